package io.croissant.core.operation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.croissant.core.error.OperationGraphException;
import io.croissant.core.graph.StructureGraph;
import io.croissant.core.model.Field;
import io.croissant.core.model.RecordSet;
import io.croissant.core.table.Table;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the records of a record set from the columns read by its leaf fields. The output has
 * one column per top-level field, named by the field uid; a field with sub-fields holds an object
 * keyed by sub-field name.
 */
public final class GroupRecordSet extends Operation {

    private final RecordSet recordSet;
    private final StructureGraph graph;

    public GroupRecordSet(RecordSet recordSet, StructureGraph graph) {
        super(recordSet);
        this.recordSet = recordSet;
        this.graph = graph;
    }

    @Override
    public Table call(List<Object> inputs) {
        Map<String, List<JsonNode>> columns = new HashMap<>();
        int rows = -1;
        for (Object input : inputs) {
            if (!(input instanceof Table table)) {
                throw new OperationGraphException(
                        "Record set \"" + recordSet.uid() + "\" expects field columns as inputs.",
                        recordSet.uid(),
                        name());
            }
            if (rows >= 0 && table.size() != rows) {
                throw new OperationGraphException(
                        "Fields of record set \"" + recordSet.uid() + "\" yield different numbers of rows: " + rows
                                + " and " + table.size() + ".",
                        recordSet.uid(),
                        name());
            }
            rows = table.size();
            for (String column : table.columns()) {
                columns.put(column, table.column(column));
            }
        }
        List<Field> fields = graph.fields(recordSet);
        List<String> names = fields.stream().map(Field::uid).toList();
        List<Map<String, JsonNode>> records = new ArrayList<>(Math.max(rows, 0));
        for (int i = 0; i < rows; i++) {
            Map<String, JsonNode> record = new LinkedHashMap<>();
            for (Field field : fields) {
                record.put(field.uid(), value(field, columns, i));
            }
            records.add(record);
        }
        return new Table(names, records);
    }

    private JsonNode value(Field field, Map<String, List<JsonNode>> columns, int row) {
        if (!field.hasSubFields()) {
            List<JsonNode> values = columns.get(field.uid());
            if (values == null) {
                throw new OperationGraphException(
                        "No values were read for field \"" + field.uid() + "\".", field.uid(), name());
            }
            return values.get(row);
        }
        ObjectNode nested = JsonNodeFactory.instance.objectNode();
        for (Field subField : graph.subFields(field)) {
            nested.set(subField.name(), value(subField, columns, row));
        }
        return nested;
    }
}
