package io.croissant.core.operation;

import io.croissant.core.io.FormatReaderRegistry;
import io.croissant.core.spi.FileFetcher;
import java.nio.file.Path;
import java.util.Objects;

/**
 * What operations need from the outside world.
 *
 * @param baseDirectory  directory relative locations in the document are resolved against
 * @param cacheDirectory directory downloads and extracted archives are written to
 * @param fetcher        retrieves the content of file objects
 * @param readers        parses files by encoding format
 */
public record OperationEnvironment(
        Path baseDirectory, Path cacheDirectory, FileFetcher fetcher, FormatReaderRegistry readers) {

    public OperationEnvironment {
        Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");
        Objects.requireNonNull(cacheDirectory, "cacheDirectory must not be null");
        Objects.requireNonNull(fetcher, "fetcher must not be null");
        Objects.requireNonNull(readers, "readers must not be null");
    }
}
