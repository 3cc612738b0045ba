package io.croissant.core.operation;

import io.croissant.core.error.FetchException;
import io.croissant.core.model.FileObject;
import io.croissant.core.spi.Checksum;
import io.croissant.core.spi.FileFetcher;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Makes a top-level file object available on the local disk. Outputs its {@link Path}. */
public final class Download extends Operation {

    private final FileObject fileObject;
    private final FileFetcher fetcher;

    public Download(FileObject fileObject, FileFetcher fetcher) {
        super(fileObject);
        this.fileObject = fileObject;
        this.fetcher = fetcher;
    }

    @Override
    public Path call(List<Object> inputs) {
        try {
            return fetcher.fetch(fileObject.contentUrl(), new Checksum(fileObject.md5(), fileObject.sha256()));
        } catch (IOException e) {
            throw new FetchException(
                    "Cannot fetch " + fileObject.contentUrl() + ": " + e.getMessage(), e, fileObject.uid(), name());
        }
    }
}
