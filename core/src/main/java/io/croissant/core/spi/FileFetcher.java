package io.croissant.core.spi;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Retrieves the bytes behind a file object's {@code contentUrl} onto the local disk.
 *
 * <p>
 * Implementations decide on caching and transport. They MUST be safe to call repeatedly for
 * the same location.
 */
public interface FileFetcher {

    /**
     * Makes the content available locally.
     *
     * @param contentUrl an {@code http(s)} or {@code file} URL, or a path relative to the document
     * @param checksum   declared digests the content must match
     * @return path of a readable local file
     * @throws IOException if the content cannot be retrieved or does not match {@code checksum}
     */
    Path fetch(String contentUrl, Checksum checksum) throws IOException;
}
