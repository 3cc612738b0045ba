package io.croissant.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.croissant.core.spi.FormatReader;
import io.croissant.core.table.Table;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Reads one JSON object per line. */
public final class JsonLinesFormatReader implements FormatReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public Set<String> encodingFormats() {
        return Set.of("application/jsonlines", "application/x-ndjson", "application/jsonl");
    }

    @Override
    public Table read(Path file, String encodingFormat) throws IOException {
        List<JsonNode> records = new ArrayList<>();
        try (MappingIterator<JsonNode> lines = MAPPER.readerFor(JsonNode.class).readValues(file.toFile())) {
            while (lines.hasNextValue()) {
                records.add(lines.nextValue());
            }
        }
        return JsonRecords.toTable(records, file);
    }
}
