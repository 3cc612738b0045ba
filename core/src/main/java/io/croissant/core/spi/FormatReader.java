package io.croissant.core.spi;

import io.croissant.core.table.Table;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Parses the content of a file declared with a given encoding format into a table. Column names
 * are the raw names found in the file; cells are left untyped.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
public interface FormatReader {

    /** Encoding formats (MIME types) this reader handles, e.g. {@code text/csv}. */
    Set<String> encodingFormats();

    /**
     * @param file           the local file to parse
     * @param encodingFormat the declared format, one of {@link #encodingFormats()}
     * @return the parsed content
     * @throws IOException if the file cannot be read or is not valid for the format
     */
    Table read(Path file, String encodingFormat) throws IOException;
}
