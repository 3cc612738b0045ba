package io.croissant.core;

import io.croissant.core.io.FormatReaderRegistry;
import io.croissant.core.spi.FileFetcher;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Options controlling how a dataset is loaded and materialized.
 *
 * <p>
 * Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param baseDirectory  directory relative file locations are resolved against; {@code null}
 *                       means the directory of the document, or the working directory
 * @param cacheDirectory directory downloads and extracted archives are written to
 * @param httpTimeout    connect and request timeout for remote files
 * @param fetcher        custom file fetcher; {@code null} means the default caching fetcher
 * @param readers        format readers by encoding format
 * @param debug          log the compiled operation graph
 */
public record DatasetOptions(
        Path baseDirectory,
        Path cacheDirectory,
        Duration httpTimeout,
        FileFetcher fetcher,
        FormatReaderRegistry readers,
        boolean debug) {

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    public static DatasetOptions defaults() {
        return builder().build();
    }

    /** Copy of these options with another base directory. */
    public DatasetOptions withBaseDirectory(Path directory) {
        return new DatasetOptions(directory, cacheDirectory, httpTimeout, fetcher, readers, debug);
    }

    /** Builder for {@link DatasetOptions}. */
    public static final class Builder {
        private Path baseDirectory;
        private Path cacheDirectory = Path.of(System.getProperty("java.io.tmpdir"), "croissant");
        private Duration httpTimeout = Duration.ofSeconds(60);
        private FileFetcher fetcher;
        private FormatReaderRegistry readers = FormatReaderRegistry.defaults();
        private boolean debug;

        Builder() {}

        public Builder baseDirectory(Path baseDirectory) {
            this.baseDirectory = baseDirectory;
            return this;
        }

        public Builder cacheDirectory(Path cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder fetcher(FileFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder readers(FormatReaderRegistry readers) {
            this.readers = readers;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public DatasetOptions build() {
            return new DatasetOptions(baseDirectory, cacheDirectory, httpTimeout, fetcher, readers, debug);
        }
    }
}
