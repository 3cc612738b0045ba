package io.croissant.core.operation;

import com.fasterxml.jackson.databind.JsonNode;
import io.croissant.core.graph.ColumnRef;
import io.croissant.core.model.RecordSet;
import io.croissant.core.table.Table;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the inline records of a record set into a table with one column per record key,
 * qualified by the record set uid. Values are kept as written; fields type them when read.
 */
public final class Data extends Operation {

    private final RecordSet recordSet;

    public Data(RecordSet recordSet) {
        super(recordSet);
        this.recordSet = recordSet;
    }

    @Override
    public Table call(List<Object> inputs) {
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, JsonNode>> rows = new ArrayList<>();
        for (JsonNode record : recordSet.data()) {
            Map<String, JsonNode> row = new LinkedHashMap<>();
            record.fields().forEachRemaining(entry -> {
                String column = qualify(entry.getKey());
                columns.add(column);
                row.put(column, entry.getValue());
            });
            rows.add(row);
        }
        return new Table(new ArrayList<>(columns), rows);
    }

    // Keys may be written either as field names or as field uids.
    private String qualify(String key) {
        String prefix = recordSet.uid() + "/";
        return key.startsWith(prefix) ? key : ColumnRef.qualify(recordSet.uid(), key);
    }
}
