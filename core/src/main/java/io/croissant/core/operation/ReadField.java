package io.croissant.core.operation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.croissant.core.error.MissingColumnException;
import io.croissant.core.error.OperationGraphException;
import io.croissant.core.error.TypeConversionException;
import io.croissant.core.graph.ColumnRef;
import io.croissant.core.model.DataType;
import io.croissant.core.model.Field;
import io.croissant.core.table.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the values of one leaf field out of the table assembled for its record set: projects the
 * column, descends into nested records when the source is a sub-field, applies the source's
 * transforms to text values and converts the result to the field's data type.
 *
 * <p>
 * Outputs a single-column table named by the field uid.
 */
public final class ReadField extends Operation {

    private final Field field;
    private final ColumnRef column;
    private final DataType dataType;

    public ReadField(Field field, ColumnRef column, DataType dataType) {
        super(field);
        this.field = field;
        this.column = column;
        this.dataType = dataType;
    }

    public ColumnRef column() {
        return column;
    }

    public DataType dataType() {
        return dataType;
    }

    @Override
    public Table call(List<Object> inputs) {
        if (inputs.size() != 1 || !(inputs.get(0) instanceof Table table)) {
            throw new OperationGraphException(
                    "Field \"" + field.uid() + "\" expects one table as input, got " + inputs.size() + " input(s).",
                    field.uid(),
                    name());
        }
        if (!table.hasColumn(column.column())) {
            throw new MissingColumnException(
                    "Column \"" + column.column() + "\" does not exist in node \"" + column.providerUid()
                            + "\". Existing columns: " + table.columns(),
                    field.uid(),
                    name());
        }
        List<JsonNode> values = new ArrayList<>(table.size());
        for (JsonNode cell : table.column(column.column())) {
            values.add(convert(transform(descend(cell))));
        }
        return new Table(
                List.of(field.uid()),
                values.stream().map(value -> Map.of(field.uid(), value)).toList());
    }

    private JsonNode descend(JsonNode cell) {
        JsonNode current = cell;
        for (String name : column.nestedPath()) {
            current = current.path(name);
        }
        return current.isMissingNode() ? NullNode.getInstance() : current;
    }

    private JsonNode transform(JsonNode value) {
        if (field.source().transforms().isEmpty() || !value.isValueNode() || value.isNull() || value.isBinary()) {
            return value;
        }
        return JsonNodeFactory.instance.textNode(field.source().applyTransforms(value.asText()));
    }

    private JsonNode convert(JsonNode value) {
        try {
            return dataType.coerce(value == null ? MissingNode.getInstance() : value);
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage(), e, field.uid(), name());
        }
    }
}
