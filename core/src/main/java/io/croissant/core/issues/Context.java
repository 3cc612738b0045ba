package io.croissant.core.issues;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ancestor chain of a node, rendered as the breadcrumb that prefixes every issue, e.g.
 * {@code [dataset(mnist) > record_set(images) > field(label)]}.
 *
 * <p>
 * Immutable. A missing name renders as {@code kind()} so the breadcrumb stays well-formed while
 * the document is still incomplete.
 *
 * @param crumbs the chain from the dataset down to the node, outermost first
 */
public record Context(List<Crumb> crumbs) {

    /** One level of the chain: the node kind and its (possibly absent) name. */
    public record Crumb(String kind, String name) {

        @Override
        public String toString() {
            return kind + "(" + (name == null ? "" : name) + ")";
        }
    }

    public static final String DATASET = "dataset";
    public static final String DISTRIBUTION = "distribution";
    public static final String RECORD_SET = "record_set";
    public static final String FIELD = "field";

    public Context {
        crumbs = List.copyOf(crumbs);
    }

    /** The context of a dataset root. */
    public static Context dataset(String name) {
        return new Context(List.of(new Crumb(DATASET, name)));
    }

    /** Returns a new context one level below this one. */
    public Context child(String kind, String name) {
        List<Crumb> chain = new ArrayList<>(crumbs);
        chain.add(new Crumb(kind, name));
        return new Context(chain);
    }

    @Override
    public String toString() {
        return crumbs.stream().map(Crumb::toString).collect(Collectors.joining(" > ", "[", "]"));
    }
}
