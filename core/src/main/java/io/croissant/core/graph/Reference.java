package io.croissant.core.graph;

import io.croissant.core.model.Node;

/**
 * A source resolved against the structure graph.
 *
 * @param target the node the longest resolvable prefix of the source path designates
 * @param column the rest of the path, {@code null} when the path is exactly the target uid
 */
public record Reference(Node target, String column) {

    public boolean hasColumn() {
        return column != null;
    }
}
