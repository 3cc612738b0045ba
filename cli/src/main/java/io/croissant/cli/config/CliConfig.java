package io.croissant.cli.config;

import java.nio.file.Path;

/**
 * Configuration of the command-line tool. Use {@link #builder()}; every field has a default.
 *
 * @param cacheDirectory directory downloads and extracted archives are written to
 * @param httpTimeoutMs  connect and request timeout for remote files, in ms
 * @param loggingFormat  json or text
 * @param loggingLevel   root log level
 */
public record CliConfig(Path cacheDirectory, int httpTimeoutMs, String loggingFormat, String loggingLevel) {

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {
        private Path cacheDirectory = Path.of(System.getProperty("user.home"), ".cache", "croissant");
        private int httpTimeoutMs = 60_000;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder cacheDirectory(Path cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
            return this;
        }

        public Builder httpTimeoutMs(int httpTimeoutMs) {
            this.httpTimeoutMs = httpTimeoutMs;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            if (httpTimeoutMs <= 0) {
                throw new ConfigLoadException("http.timeout-ms must be positive, got " + httpTimeoutMs);
            }
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException("logging.format must be json or text, got " + loggingFormat);
            }
            return new CliConfig(cacheDirectory, httpTimeoutMs, loggingFormat, loggingLevel);
        }
    }
}
