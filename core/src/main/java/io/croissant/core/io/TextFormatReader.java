package io.croissant.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.croissant.core.model.FileProperty;
import io.croissant.core.spi.FormatReader;
import io.croissant.core.table.Table;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Reads plain text, one row per line in the {@code lines} column. */
public final class TextFormatReader implements FormatReader {

    @Override
    public Set<String> encodingFormats() {
        return Set.of("text/plain");
    }

    @Override
    public Table read(Path file, String encodingFormat) throws IOException {
        String column = FileProperty.LINES.column();
        List<Map<String, JsonNode>> rows = Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                .map(line -> Map.<String, JsonNode>of(column, JsonNodeFactory.instance.textNode(line)))
                .toList();
        return new Table(List.of(column), rows);
    }
}
