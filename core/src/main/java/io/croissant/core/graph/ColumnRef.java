package io.croissant.core.graph;

import java.util.List;

/**
 * Location of a value in the tables produced at execution time.
 *
 * @param providerUid uid of the distribution or record set whose table holds the column
 * @param column      qualified column name inside that table
 * @param nestedPath  sub-field names to descend into when the column holds nested records
 */
public record ColumnRef(String providerUid, String column, List<String> nestedPath) {

    public ColumnRef {
        nestedPath = List.copyOf(nestedPath);
    }

    /** Qualified name of a column produced by reading {@code nodeUid}. */
    public static String qualify(String nodeUid, String column) {
        return nodeUid + "/" + column;
    }
}
