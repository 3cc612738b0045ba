package io.croissant.core.model;

import io.croissant.core.issues.Context;
import io.croissant.core.issues.Issues;

/**
 * A typed node of the structure graph. The {@code @type} tag of the document selects exactly
 * one variant; nodes are immutable once built and reference each other only through uids.
 */
public sealed interface Node permits Metadata, Distribution, RecordSet, Field {

    NodeType type();

    /** Identifier, unique across the whole document. */
    String uid();

    /** The declared name, {@code null} when the document omits it. */
    String name();

    /** Uid of the containing node, {@code null} for the dataset root. */
    String parentUid();

    /** Breadcrumb of this node for issue reporting. */
    Context context();

    /**
     * Validates the node's own properties, appending problems to {@code issues}. Never throws for
     * an invalid document.
     */
    void check(Issues issues);
}
