package io.croissant.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.croissant.core.model.FileProperty;
import io.croissant.core.spi.FormatReader;
import io.croissant.core.table.Table;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Reads any file as a single row holding its bytes in the {@code content} column. */
public final class BinaryFormatReader implements FormatReader {

    @Override
    public Set<String> encodingFormats() {
        return Set.of("application/octet-stream");
    }

    @Override
    public Table read(Path file, String encodingFormat) throws IOException {
        String column = FileProperty.CONTENT.column();
        JsonNode content = JsonNodeFactory.instance.binaryNode(Files.readAllBytes(file));
        return new Table(List.of(column), List.of(Map.of(column, content)));
    }
}
