package io.croissant.core.operation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.croissant.core.error.FileReadException;
import io.croissant.core.io.FormatReaderRegistry;
import io.croissant.core.model.Distribution;
import io.croissant.core.model.FileProperty;
import io.croissant.core.spi.FormatReader;
import io.croissant.core.table.FilePath;
import io.croissant.core.table.Table;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the files of a distribution with the reader registered for its encoding format and
 * stacks their rows. Every column is qualified by the distribution uid, and each row also carries
 * the {@code filepath}, {@code filename} and {@code fullpath} of the file it came from.
 */
public final class ReadFile extends Operation {

    private static final Logger LOG = LoggerFactory.getLogger(ReadFile.class);

    private final Distribution distribution;
    private final FormatReaderRegistry readers;

    public ReadFile(Distribution distribution, FormatReaderRegistry readers) {
        super(distribution);
        this.distribution = distribution;
        this.readers = readers;
    }

    @Override
    public Table call(List<Object> inputs) {
        List<FilePath> files = new ArrayList<>();
        for (Object input : inputs) {
            if (input instanceof Table table) {
                files.addAll(Concatenate.files(table));
            } else {
                files.addAll(filePaths(List.of(input), Path.of("")));
            }
        }
        FormatReader reader = readers.reader(distribution.encodingFormat());
        List<Table> parts = new ArrayList<>(files.size());
        for (FilePath file : files) {
            Table content;
            try {
                content = reader.read(file.filepath(), distribution.encodingFormat());
            } catch (IOException | RuntimeException e) {
                throw new FileReadException(
                        "Cannot read " + file.filepath() + " as " + distribution.encodingFormat() + ": "
                                + e.getMessage(),
                        e,
                        distribution.uid(),
                        name());
            }
            parts.add(withFileColumns(content, file).qualified(distribution.uid()));
        }
        Table table = parts.isEmpty() ? Table.empty(List.of()) : Table.concat(parts);
        LOG.debug("Read: node={}, files={}, rows={}", distribution.uid(), files.size(), table.size());
        return table;
    }

    private static Table withFileColumns(Table content, FilePath file) {
        Map<FileProperty, String> values = Map.of(
                FileProperty.FILEPATH, file.filepath().toString(),
                FileProperty.FILENAME, file.filename(),
                FileProperty.FULLPATH, file.fullpath().toString());
        Table result = content;
        for (FileProperty property : List.of(FileProperty.FILEPATH, FileProperty.FILENAME, FileProperty.FULLPATH)) {
            JsonNode cell = JsonNodeFactory.instance.textNode(values.get(property));
            result = result.withColumn(property.column(), Collections.nCopies(result.size(), cell));
        }
        return result;
    }
}
