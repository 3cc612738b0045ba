package io.croissant.core.graph;

import io.croissant.core.model.DataType;
import io.croissant.core.model.Distribution;
import io.croissant.core.model.Field;
import io.croissant.core.model.Metadata;
import io.croissant.core.model.Node;
import io.croissant.core.model.RecordSet;
import io.croissant.core.model.Source;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, typed view of a metadata document: an arena of nodes indexed by uid plus the
 * edges that resolved references induce, from the referenced node to the referencing one.
 *
 * <p>
 * Immutable once built by {@link StructureGraphBuilder}. Containment is not an edge; it is held
 * by the uid lists of the nodes themselves.
 */
public final class StructureGraph {

    private final Metadata metadata;
    private final Map<String, Node> nodes;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;

    StructureGraph(Metadata metadata, Map<String, Node> nodes, Map<String, Set<String>> successors) {
        this.metadata = metadata;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        Map<String, Set<String>> out = new LinkedHashMap<>();
        Map<String, Set<String>> in = new LinkedHashMap<>();
        successors.forEach((from, targets) -> {
            out.put(from, Collections.unmodifiableSet(new LinkedHashSet<>(targets)));
            for (String to : targets) {
                in.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
            }
        });
        in.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.successors = Collections.unmodifiableMap(out);
        this.predecessors = Collections.unmodifiableMap(in);
    }

    public Metadata metadata() {
        return metadata;
    }

    /**
     * Distributions, record sets and fields in document order. The dataset itself is not part of
     * the arena, so a record set may share its name; use {@link #metadata()}.
     */
    public Map<String, Node> nodes() {
        return nodes;
    }

    public Optional<Node> node(String uid) {
        return Optional.ofNullable(nodes.get(uid));
    }

    public int size() {
        return nodes.size();
    }

    public List<Distribution> distributions() {
        return metadata.distributionUids().stream()
                .map(nodes::get)
                .filter(Distribution.class::isInstance)
                .map(Distribution.class::cast)
                .toList();
    }

    public List<RecordSet> recordSets() {
        return metadata.recordSetUids().stream()
                .map(nodes::get)
                .filter(RecordSet.class::isInstance)
                .map(RecordSet.class::cast)
                .toList();
    }

    public Optional<RecordSet> recordSet(String name) {
        return recordSets().stream().filter(rs -> name.equals(rs.name())).findFirst();
    }

    /** Top-level fields of a record set, in document order. */
    public List<Field> fields(RecordSet recordSet) {
        return fieldsOf(recordSet.fieldUids());
    }

    public List<Field> subFields(Field field) {
        return fieldsOf(field.subFieldUids());
    }

    /** Fields of a record set that carry values themselves, i.e. have no sub-fields. */
    public List<Field> leafFields(RecordSet recordSet) {
        return leafFields(recordSet, nodes);
    }

    static List<Field> leafFields(RecordSet recordSet, Map<String, Node> nodes) {
        List<Field> leaves = new ArrayList<>();
        Deque<String> pending = new ArrayDeque<>(recordSet.fieldUids());
        while (!pending.isEmpty()) {
            if (!(nodes.get(pending.removeFirst()) instanceof Field field)) {
                continue;
            }
            if (field.hasSubFields()) {
                List<String> children = field.subFieldUids();
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.addFirst(children.get(i));
                }
            } else {
                leaves.add(field);
            }
        }
        return leaves;
    }

    private List<Field> fieldsOf(List<String> uids) {
        return uids.stream()
                .map(nodes::get)
                .filter(Field.class::isInstance)
                .map(Field.class::cast)
                .toList();
    }

    public Set<String> successors(String uid) {
        return successors.getOrDefault(uid, Set.of());
    }

    public Set<String> predecessors(String uid) {
        return predecessors.getOrDefault(uid, Set.of());
    }

    /**
     * Resolves a source: the longest {@code /}-prefix of its path naming a node is the target,
     * the remainder is the column.
     */
    public Optional<Reference> resolve(Source source) {
        return resolve(source, nodes);
    }

    static Optional<Reference> resolve(Source source, Map<String, Node> nodes) {
        if (!source.isPresent()) {
            return Optional.empty();
        }
        List<String> path = source.path();
        for (int end = path.size(); end >= 1; end--) {
            Node target = nodes.get(String.join("/", path.subList(0, end)));
            if (target != null) {
                String column = end == path.size() ? null : String.join("/", path.subList(end, path.size()));
                return Optional.of(new Reference(target, column));
            }
        }
        return Optional.empty();
    }

    /**
     * Locates the column a reference reads at execution time.
     *
     * @throws IllegalArgumentException if the reference does not designate a column
     */
    public ColumnRef columnOf(Reference reference) {
        return columnOf(reference, nodes);
    }

    /** Whether a reference points at a column: a distribution plus a column, or a field. */
    static boolean designatesColumn(Reference reference) {
        return reference.target() instanceof Distribution
                ? reference.hasColumn()
                : reference.target() instanceof Field && !reference.hasColumn();
    }

    static ColumnRef columnOf(Reference reference, Map<String, Node> nodes) {
        Node target = reference.target();
        if (target instanceof Distribution distribution && reference.hasColumn()) {
            return new ColumnRef(
                    distribution.uid(), ColumnRef.qualify(distribution.uid(), reference.column()), List.of());
        }
        if (target instanceof Field field && !reference.hasColumn()) {
            Deque<String> nested = new ArrayDeque<>();
            Field top = field;
            while (top.parentUid() != null && nodes.get(top.parentUid()) instanceof Field parent) {
                nested.addFirst(top.name());
                top = parent;
            }
            return new ColumnRef(field.recordSetUid(), top.uid(), List.copyOf(nested));
        }
        throw new IllegalArgumentException("Reference to \"" + target.uid() + "\" does not designate a column");
    }

    /**
     * The data type of a field: its own declaration, else the nearest ancestor field's.
     *
     * @return the resolved type, empty when neither the field nor any ancestor declares a known one
     */
    public Optional<DataType> dataType(Field field) {
        return dataType(field, nodes);
    }

    static Optional<DataType> dataType(Field field, Map<String, Node> nodes) {
        Field current = field;
        while (current != null) {
            if (current.dataType() != null) {
                return DataType.fromTag(current.dataType());
            }
            current = current.parentUid() != null && nodes.get(current.parentUid()) instanceof Field parent
                    ? parent
                    : null;
        }
        return Optional.empty();
    }
}
