package io.croissant.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import io.croissant.core.table.Table;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Turns JSON objects into table rows; the columns are the union of their keys. */
final class JsonRecords {

    private JsonRecords() {}

    static Table toTable(List<JsonNode> records, Path file) throws IOException {
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, JsonNode>> rows = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            if (!record.isObject()) {
                throw new IOException("Expected JSON objects in " + file + " but found " + record.getNodeType());
            }
            Map<String, JsonNode> row = new LinkedHashMap<>();
            record.fields().forEachRemaining(entry -> {
                columns.add(entry.getKey());
                row.put(entry.getKey(), entry.getValue());
            });
            rows.add(row);
        }
        return new Table(new ArrayList<>(columns), rows);
    }
}
