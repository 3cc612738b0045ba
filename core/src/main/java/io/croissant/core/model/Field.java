package io.croissant.core.model;

import io.croissant.core.issues.Context;
import io.croissant.core.issues.Issues;
import java.util.List;

/**
 * A column of a record set, possibly made of sub-fields.
 *
 * @param dataType     the declared type tag, {@code null} when inherited from an ancestor field
 * @param source       where the values are read from
 * @param references   the column this field joins against, {@link Source#NONE} when absent
 * @param subFieldUids uids of the nested fields, in document order
 * @param recordSetUid uid of the record set this field belongs to
 */
public record Field(
        String uid,
        String name,
        String description,
        String dataType,
        Source source,
        Source references,
        List<String> subFieldUids,
        String recordSetUid,
        String parentUid,
        Context context)
        implements Node {

    public Field {
        subFieldUids = List.copyOf(subFieldUids);
    }

    public boolean hasSubFields() {
        return !subFieldUids.isEmpty();
    }

    @Override
    public NodeType type() {
        return NodeType.FIELD;
    }

    @Override
    public void check(Issues issues) {
        Checks.mandatory(issues, context, Terms.NAME, name);
        Checks.recommended(issues, context, Terms.DESCRIPTION, description);
        if (dataType != null && DataType.fromTag(dataType).isEmpty()) {
            issues.error(context, "Unknown data type \"" + dataType + "\" for property \"" + Terms.iri(Terms.DATA_TYPE)
                    + "\".");
        }
    }
}
