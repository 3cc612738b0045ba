package io.croissant.core.model;

import java.util.Arrays;
import java.util.Optional;

/** Implicit columns every distribution table carries besides its parsed content. */
public enum FileProperty {
    FILEPATH("filepath"),
    FILENAME("filename"),
    FULLPATH("fullpath"),
    CONTENT("content"),
    LINES("lines");

    private final String column;

    FileProperty(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public static Optional<FileProperty> fromColumn(String column) {
        return Arrays.stream(values()).filter(p -> p.column.equals(column)).findFirst();
    }
}
