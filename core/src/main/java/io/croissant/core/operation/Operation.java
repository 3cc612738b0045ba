package io.croissant.core.operation;

import io.croissant.core.model.Node;
import io.croissant.core.table.FilePath;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One step of the operation graph, bound to the structure node it materializes.
 *
 * <p>
 * An operation receives the outputs of its predecessors, in the order they were connected, and
 * returns its own output. Operations are compared by identity; {@link #name()} is unique within a
 * graph.
 */
public abstract class Operation {

    private final Node node;
    private final String label;

    protected Operation(Node node) {
        this(node, node.uid());
    }

    protected Operation(Node node, String label) {
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.label = Objects.requireNonNull(label, "label must not be null");
    }

    public Node node() {
        return node;
    }

    /** {@code Kind(label)}, e.g. {@code ReadFile(passengers.csv)}. */
    public String name() {
        return getClass().getSimpleName() + "(" + label + ")";
    }

    /**
     * Runs the operation.
     *
     * @param inputs outputs of the predecessors, in connection order
     * @return this operation's output
     */
    public abstract Object call(List<Object> inputs);

    /** Flattens path-like inputs (single paths, lists of {@link FilePath}) into file paths. */
    static List<FilePath> filePaths(List<Object> inputs, Path root) {
        List<FilePath> paths = new ArrayList<>();
        for (Object input : inputs) {
            if (input instanceof FilePath filePath) {
                paths.add(filePath);
            } else if (input instanceof Path path) {
                paths.add(FilePath.of(root, path));
            } else if (input instanceof Collection<?> collection) {
                paths.addAll(filePaths(new ArrayList<>(collection), root));
            }
        }
        return paths;
    }

    @Override
    public String toString() {
        return name();
    }
}
