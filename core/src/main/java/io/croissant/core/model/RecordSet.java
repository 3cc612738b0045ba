package io.croissant.core.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import io.croissant.core.issues.Context;
import io.croissant.core.issues.Issues;
import java.util.List;

/**
 * A logical table. Either carries its records inline ({@link #data()}) or assembles them from
 * the sources of its fields.
 *
 * @param data inline records, {@code null} when the record set reads from distributions
 */
public record RecordSet(
        String uid,
        String name,
        String description,
        List<String> key,
        ArrayNode data,
        List<String> fieldUids,
        String parentUid,
        Context context)
        implements Node {

    public RecordSet {
        key = List.copyOf(key);
        fieldUids = List.copyOf(fieldUids);
    }

    public boolean hasData() {
        return data != null;
    }

    @Override
    public NodeType type() {
        return NodeType.RECORD_SET;
    }

    @Override
    public void check(Issues issues) {
        Checks.mandatory(issues, context, Terms.NAME, name);
        Checks.recommended(issues, context, Terms.DESCRIPTION, description);
    }
}
