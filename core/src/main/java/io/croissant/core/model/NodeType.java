package io.croissant.core.model;

import java.util.Arrays;
import java.util.Optional;

/** The closed set of node variants a document may declare through its {@code @type} tag. */
public enum NodeType {
    DATASET("sc:Dataset"),
    FILE_OBJECT("sc:FileObject"),
    FILE_SET("sc:FileSet"),
    RECORD_SET("ml:RecordSet"),
    FIELD("ml:Field");

    private final String compact;

    NodeType(String compact) {
        this.compact = compact;
    }

    /** The compact tag, e.g. {@code sc:FileObject}. */
    public String compact() {
        return compact;
    }

    /** The expanded tag, e.g. {@code https://schema.org/FileObject}. */
    public String iri() {
        return Terms.expand(compact);
    }

    /** Resolves a compact or expanded tag. */
    public static Optional<NodeType> fromTag(String tag) {
        String expanded = Terms.expand(tag);
        return Arrays.stream(values()).filter(type -> type.iri().equals(expanded)).findFirst();
    }
}
