package io.croissant.core.operation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.croissant.core.error.JoinException;
import io.croissant.core.model.Field;
import io.croissant.core.model.Source;
import io.croissant.core.table.Table;
import java.util.List;

/**
 * Left-merges two tables on the columns named by a field's {@code source} (left) and
 * {@code references} (right).
 *
 * <p>
 * The inputs may arrive in either order: when the first table lacks the left key, the operands
 * are swapped. The source's transforms are applied to the left key values before matching, and
 * the transformed values replace the originals in the result.
 */
public final class Join extends Operation {

    private final String leftKey;
    private final String rightKey;
    private final Source leftSource;

    /**
     * @param field    the field declaring the link
     * @param leftKey  qualified column read by the field's source
     * @param rightKey qualified column read by the field's references
     */
    public Join(Field field, String leftKey, String rightKey) {
        super(field);
        this.leftKey = leftKey;
        this.rightKey = rightKey;
        this.leftSource = field.source();
    }

    public String leftKey() {
        return leftKey;
    }

    public String rightKey() {
        return rightKey;
    }

    @Override
    public Table call(List<Object> inputs) {
        if (inputs.size() != 2) {
            throw new JoinException(
                    "Join expects exactly 2 inputs, got " + inputs.size() + ".", node().uid(), name());
        }
        Table left = table(inputs.get(0));
        Table right = table(inputs.get(1));
        if (!left.hasColumn(leftKey)) {
            Table swapped = left;
            left = right;
            right = swapped;
        }
        requireColumn(left, leftKey);
        requireColumn(right, rightKey);
        if (leftSource.transforms().isEmpty()) {
            return left.leftJoin(leftKey, right, rightKey);
        }
        List<JsonNode> keys = left.column(leftKey).stream()
                .map(value -> value.isValueNode() && !value.isNull()
                        ? JsonNodeFactory.instance.textNode(leftSource.applyTransforms(value.asText()))
                        : value)
                .toList();
        return left.withColumn(leftKey, keys).leftJoin(leftKey, right, rightKey);
    }

    private Table table(Object input) {
        if (input instanceof Table table) {
            return table;
        }
        throw new JoinException(
                "Join expects tables as inputs, got " + (input == null ? "null" : input.getClass().getSimpleName())
                        + ".",
                node().uid(),
                name());
    }

    private void requireColumn(Table table, String column) {
        if (!table.hasColumn(column)) {
            throw new JoinException(
                    "Column \"" + column + "\" does not exist in node \"" + node().uid() + "\". Existing columns: "
                            + table.columns(),
                    node().uid(),
                    name());
        }
    }
}
