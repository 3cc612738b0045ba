package io.croissant.core.operation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.croissant.core.error.ConcatenateException;
import io.croissant.core.model.FileProperty;
import io.croissant.core.model.FileSet;
import io.croissant.core.table.FilePath;
import io.croissant.core.table.Table;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gathers the files selected for a file set into one table with a row per file and the columns
 * {@code filepath}, {@code filename} and {@code fullpath}, in input order.
 */
public final class Concatenate extends Operation {

    public static final List<String> COLUMNS = List.of(
            FileProperty.FILEPATH.column(), FileProperty.FILENAME.column(), FileProperty.FULLPATH.column());

    public Concatenate(FileSet fileSet) {
        super(fileSet);
    }

    @Override
    public Table call(List<Object> inputs) {
        List<FilePath> paths = filePaths(inputs, Path.of(""));
        if (paths.isEmpty()) {
            throw new ConcatenateException("No path to concatenate.", node().uid(), name());
        }
        List<Map<String, JsonNode>> rows = new ArrayList<>(paths.size());
        for (FilePath path : paths) {
            Map<String, JsonNode> row = new LinkedHashMap<>();
            row.put(FileProperty.FILEPATH.column(), text(path.filepath().toString()));
            row.put(FileProperty.FILENAME.column(), text(path.filename()));
            row.put(FileProperty.FULLPATH.column(), text(path.fullpath().toString()));
            rows.add(row);
        }
        return new Table(COLUMNS, rows);
    }

    /** Reverses {@link #call}: the files listed by a concatenated table. */
    static List<FilePath> files(Table table) {
        return table.rows().stream()
                .map(row -> new FilePath(
                        Path.of(row.get(FileProperty.FILEPATH.column()).asText()),
                        row.get(FileProperty.FILENAME.column()).asText(),
                        Path.of(row.get(FileProperty.FULLPATH.column()).asText())))
                .toList();
    }

    private static JsonNode text(String value) {
        return JsonNodeFactory.instance.textNode(value);
    }
}
