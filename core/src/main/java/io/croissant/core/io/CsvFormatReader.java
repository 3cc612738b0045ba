package io.croissant.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.croissant.core.spi.FormatReader;
import io.croissant.core.table.Table;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Reads CSV files with a header row. Every cell is kept as text. */
public final class CsvFormatReader implements FormatReader {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    @Override
    public Set<String> encodingFormats() {
        return Set.of("text/csv");
    }

    @Override
    public Table read(Path file, String encodingFormat) throws IOException {
        List<String> header = null;
        List<Map<String, JsonNode>> rows = new ArrayList<>();
        try (MappingIterator<List<String>> lines = CSV_MAPPER
                .readerForListOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(file.toFile())) {
            while (lines.hasNextValue()) {
                List<String> cells = lines.nextValue();
                if (header == null) {
                    header = cells;
                    continue;
                }
                Map<String, JsonNode> row = new LinkedHashMap<>();
                for (int i = 0; i < header.size() && i < cells.size(); i++) {
                    row.put(header.get(i), JsonNodeFactory.instance.textNode(cells.get(i)));
                }
                rows.add(row);
            }
        }
        return new Table(header == null ? List.of() : header, rows);
    }
}
