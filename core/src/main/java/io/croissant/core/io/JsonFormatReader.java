package io.croissant.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.croissant.core.spi.FormatReader;
import io.croissant.core.table.Table;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Reads a JSON document: an array of objects gives one row each, a single object one row. */
public final class JsonFormatReader implements FormatReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public Set<String> encodingFormats() {
        return Set.of("application/json");
    }

    @Override
    public Table read(Path file, String encodingFormat) throws IOException {
        JsonNode root = MAPPER.readTree(file.toFile());
        List<JsonNode> records = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(records::add);
        } else {
            records.add(root);
        }
        return JsonRecords.toTable(records, file);
    }
}
