package io.croissant.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Unresolved pointer from a field to the column it reads, as written in the document
 * ({@code #{distribution/column}} or {@code #{record_set/field}}), plus the transforms applied
 * to every value read through it.
 *
 * <p>
 * Which prefix of {@link #path()} designates a node is only known once every node exists, so
 * resolution is left to the structure graph.
 *
 * @param raw        the reference exactly as written, or {@code null} when absent
 * @param path       the {@code /}-separated segments inside {@code #{...}}
 * @param transforms value transforms, applied in order
 */
public record Source(String raw, List<String> path, List<Transform> transforms) {

    /** The absent source. */
    public static final Source NONE = new Source(null, List.of(), List.of());

    public Source {
        path = List.copyOf(path);
        transforms = List.copyOf(transforms);
    }

    /** A source that was declared but could not be parsed; it resolves to nothing. */
    public static Source malformed(String raw) {
        return new Source(raw, List.of(), List.of());
    }

    /** Whether the document declares this source at all, even malformed. */
    public boolean isDeclared() {
        return raw != null;
    }

    /** Whether the source is declared and well-formed. */
    public boolean isPresent() {
        return raw != null && !path.isEmpty();
    }

    /** Candidate node uids for this path, longest first. */
    public List<String> uidCandidates() {
        List<String> candidates = new ArrayList<>();
        for (int end = path.size(); end >= 1; end--) {
            candidates.add(String.join("/", path.subList(0, end)));
        }
        return candidates;
    }

    /** Applies every transform, in declaration order. */
    public String applyTransforms(String value) {
        String current = value;
        for (Transform transform : transforms) {
            current = transform.apply(current);
        }
        return current;
    }

    @Override
    public String toString() {
        return raw == null ? "<none>" : raw;
    }
}
