package io.croissant.core.operation;

import io.croissant.core.error.OperationGraphException;
import io.croissant.core.graph.ColumnRef;
import io.croissant.core.graph.Reference;
import io.croissant.core.graph.StructureGraph;
import io.croissant.core.model.DataType;
import io.croissant.core.model.Distribution;
import io.croissant.core.model.Field;
import io.croissant.core.model.FileObject;
import io.croissant.core.model.FileSet;
import io.croissant.core.model.Node;
import io.croissant.core.model.RecordSet;
import io.croissant.core.model.Source;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the operations that materialize record sets from a validated structure graph.
 *
 * <p>
 * Compilation is incremental: each call to {@link #compile(RecordSet)} adds only the operations
 * the record set needs that are not in the graph yet, so shared distributions are read once.
 * Not thread-safe.
 */
public final class OperationGraphCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(OperationGraphCompiler.class);

    private final StructureGraph structure;
    private final OperationEnvironment environment;
    private final OperationGraph graph = new OperationGraph();
    private final Map<String, Operation> operations = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();

    public OperationGraphCompiler(StructureGraph structure, OperationEnvironment environment) {
        this.structure = structure;
        this.environment = environment;
    }

    public OperationGraph graph() {
        return graph;
    }

    /** Compiles every record set of the document. */
    public OperationGraph compileAll() {
        structure.recordSets().forEach(this::compile);
        return graph;
    }

    /**
     * Compiles a record set and everything it reads from.
     *
     * @return the operation whose output holds the record set's records
     * @throws OperationGraphException if the record set cannot be assembled from its sources
     */
    public Operation compile(RecordSet recordSet) {
        Optional<Operation> compiled = graph.output(recordSet.uid());
        if (compiled.isPresent()) {
            return compiled.get();
        }
        if (!inProgress.add(recordSet.uid())) {
            throw new OperationGraphException(
                    "Record set \"" + recordSet.uid() + "\" depends on itself.", recordSet.uid(), null);
        }
        int before = graph.size();
        Operation group = operation(new GroupRecordSet(recordSet, structure));
        Operation table = recordSet.hasData() ? operation(new Data(recordSet)) : joinedTable(recordSet);
        for (Field leaf : structure.leafFields(recordSet)) {
            ColumnRef column = recordSet.hasData()
                    ? structure.columnOf(new Reference(leaf, null))
                    : columnOf(leaf, leaf.source());
            DataType dataType = structure.dataType(leaf).orElse(DataType.TEXT);
            Operation readField = operation(new ReadField(leaf, column, dataType));
            graph.connect(table, readField);
            graph.connect(readField, group);
        }
        graph.setOutput(recordSet.uid(), group);
        inProgress.remove(recordSet.uid());
        LOG.info(
                "Compiled record set: uid={}, operations_added={}, operations_total={}",
                recordSet.uid(),
                graph.size() - before,
                graph.size());
        return group;
    }

    private record Link(Field field, ColumnRef left, ColumnRef right) {}

    /** Chains one join per additional provider, starting from the first provider read. */
    private Operation joinedTable(RecordSet recordSet) {
        Set<String> providers = new LinkedHashSet<>();
        List<Link> links = new ArrayList<>();
        for (Field leaf : structure.leafFields(recordSet)) {
            ColumnRef left = columnOf(leaf, leaf.source());
            providers.add(left.providerUid());
            if (leaf.references().isPresent()) {
                ColumnRef right = columnOf(leaf, leaf.references());
                providers.add(right.providerUid());
                links.add(new Link(leaf, left, right));
            }
        }
        if (providers.isEmpty()) {
            throw new OperationGraphException(
                    "Record set \"" + recordSet.uid() + "\" has no field to read.", recordSet.uid(), null);
        }
        List<String> remaining = new ArrayList<>(providers);
        Set<String> merged = new HashSet<>();
        merged.add(remaining.remove(0));
        Operation current = table(merged.iterator().next());
        while (!remaining.isEmpty()) {
            Link link = links.stream()
                    .filter(l -> merged.contains(l.left().providerUid()) && remaining.contains(l.right().providerUid())
                            || merged.contains(l.right().providerUid()) && remaining.contains(l.left().providerUid()))
                    .findFirst()
                    .orElseThrow(() -> new OperationGraphException(
                            "Record set \"" + recordSet.uid() + "\" cannot join " + merged + " with " + remaining
                                    + ".",
                            recordSet.uid(),
                            null));
            String next = merged.contains(link.left().providerUid())
                    ? link.right().providerUid()
                    : link.left().providerUid();
            Operation join = operation(new Join(link.field(), link.left().column(), link.right().column()));
            graph.connect(current, join);
            graph.connect(table(next), join);
            current = join;
            merged.add(next);
            remaining.remove(next);
        }
        return current;
    }

    private ColumnRef columnOf(Field field, Source source) {
        return structure.resolve(source)
                .map(structure::columnOf)
                .orElseThrow(() -> new OperationGraphException(
                        "Source \"" + source + "\" of field \"" + field.uid() + "\" does not resolve.",
                        field.uid(),
                        null));
    }

    /** The operation producing the table a provider's columns live in. */
    private Operation table(String providerUid) {
        Node provider = structure.node(providerUid)
                .orElseThrow(() -> new OperationGraphException(
                        "Unknown node \"" + providerUid + "\".", providerUid, null));
        if (provider instanceof RecordSet recordSet) {
            return compile(recordSet);
        }
        if (provider instanceof Distribution distribution) {
            return read(distribution);
        }
        throw new OperationGraphException(
                "Node \"" + providerUid + "\" cannot provide columns.", providerUid, null);
    }

    private Operation read(Distribution distribution) {
        Operation readFile = operation(new ReadFile(distribution, environment.readers()));
        if (!graph.predecessors(readFile).isEmpty()) {
            return readFile;
        }
        if (distribution instanceof FileSet fileSet) {
            Operation concatenate = operation(new Concatenate(fileSet));
            graph.connect(filter(fileSet, fileSet.includes()), concatenate);
            graph.connect(concatenate, readFile);
        } else if (distribution instanceof FileObject fileObject) {
            graph.connect(files(fileObject), readFile);
        }
        return readFile;
    }

    /** The operation making a file object's content available: a download or an archive lookup. */
    private Operation files(FileObject fileObject) {
        return fileObject.containedIn().isEmpty()
                ? operation(new Download(fileObject, environment.fetcher()))
                : filter(fileObject, List.of(fileObject.contentUrl()));
    }

    private Operation filter(Distribution distribution, List<String> patterns) {
        boolean topLevel = distribution.containedIn().isEmpty();
        Operation filter =
                operation(new FilterFiles(distribution, patterns, topLevel ? environment.baseDirectory() : null));
        if (topLevel || !graph.predecessors(filter).isEmpty()) {
            return filter;
        }
        for (String archiveUid : distribution.containedIn()) {
            if (!(structure.node(archiveUid).orElse(null) instanceof FileObject archive)) {
                throw new OperationGraphException(
                        "Node \"" + archiveUid + "\" containing \"" + distribution.uid() + "\" is not a file object.",
                        distribution.uid(),
                        null);
            }
            graph.connect(extract(archive), filter);
        }
        return filter;
    }

    private Operation extract(FileObject archive) {
        Operation extract = operation(new Extract(archive, environment.cacheDirectory()));
        if (!graph.predecessors(extract).isEmpty()) {
            return extract;
        }
        if (!inProgress.add(archive.uid())) {
            throw new OperationGraphException(
                    "Archive \"" + archive.uid() + "\" is contained in itself.", archive.uid(), null);
        }
        graph.connect(files(archive), extract);
        inProgress.remove(archive.uid());
        return extract;
    }

    // One operation per name: a distribution read by several record sets is read once.
    private Operation operation(Operation candidate) {
        return operations.computeIfAbsent(candidate.name(), name -> graph.add(candidate));
    }
}
