package io.croissant.core.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.croissant.core.error.DocumentParseException;
import io.croissant.core.error.ValidationException;
import io.croissant.core.issues.Context;
import io.croissant.core.issues.Issues;
import io.croissant.core.model.Distribution;
import io.croissant.core.model.Field;
import io.croissant.core.model.FileObject;
import io.croissant.core.model.FileSet;
import io.croissant.core.model.Metadata;
import io.croissant.core.model.Node;
import io.croissant.core.model.NodeType;
import io.croissant.core.model.RecordSet;
import io.croissant.core.model.Source;
import io.croissant.core.model.Terms;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link StructureGraph} from a raw metadata document.
 *
 * <p>
 * The pass runs in four steps: the dataset root is read, every distribution, record set and
 * field is instantiated, string references are resolved into edges, and each node checks its
 * own properties. Problems are appended to the caller's {@link Issues} and never interrupt the
 * pass, so a single run reports everything wrong with a document. The only exceptions are a
 * root that is not a dataset or has no name, since no meaningful context exists without them.
 *
 * <p>
 * Stateless and thread-safe; each call runs its own pass.
 */
public final class StructureGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(StructureGraphBuilder.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String DATA_TYPE_MISSING = "The field does not specify any "
            + Terms.iri(Terms.DATA_TYPE) + ", neither does any of its predecessor.";

    /**
     * Runs a validation pass over {@code document}.
     *
     * @param document the parsed metadata document
     * @param source   location of the document, used in error reports (may be null)
     * @param issues   collector receiving every problem found
     * @return the graph; only meaningful when {@code issues} holds no error afterwards
     * @throws DocumentParseException if the document is not a JSON object
     * @throws ValidationException    if the root is not a dataset or has no name
     */
    public StructureGraph build(JsonNode document, String source, Issues issues) {
        if (document == null || !document.isObject()) {
            throw new DocumentParseException("Metadata document must be a JSON object", source);
        }
        Pass pass = new Pass(issues);
        StructureGraph graph = pass.run(document, source);
        LOG.debug(
                "Structure graph built: dataset={}, nodes={}, issues={}",
                graph.metadata().name(),
                graph.size(),
                issues.size());
        return graph;
    }

    /** State of one validation pass. */
    private static final class Pass {

        private final Issues issues;
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final Map<String, Set<String>> edges = new LinkedHashMap<>();

        Pass(Issues issues) {
            this.issues = issues;
        }

        StructureGraph run(JsonNode document, String source) {
            String name = text(document, Terms.NAME);
            Context context = Context.dataset(name);
            if (NodeType.fromTag(text(document, Terms.TYPE)).orElse(null) != NodeType.DATASET) {
                issues.error(context, "No metadata is defined in the dataset.");
                throw new ValidationException(issues.report(), issues.all(), source);
            }
            if (name == null || name.isBlank()) {
                issues.error(context, "Property \"" + Terms.iri(Terms.NAME) + "\" is mandatory, but does not exist.");
                throw new ValidationException(issues.report(), issues.all(), source);
            }
            DocumentSchema.validate(document, issues, context);

            List<String> distributionUids = parseDistributions(document, name, context);
            List<String> recordSetUids = parseRecordSets(document, name, context);
            Metadata metadata = new Metadata(
                    name,
                    name,
                    text(document, Terms.DESCRIPTION),
                    text(document, Terms.LICENSE),
                    text(document, Terms.URL),
                    text(document, Terms.CITATION),
                    text(document, Terms.VERSION),
                    people(document.get(Terms.CREATOR)),
                    people(document.get(Terms.CONTRIBUTOR)),
                    distributionUids,
                    recordSetUids,
                    context);
            // The dataset stays out of the arena: a record set may share its name.
            resolveReferences();
            metadata.check(issues);
            nodes.values().forEach(node -> node.check(issues));
            checkDataTypes();
            checkRecordSets(metadata);
            return new StructureGraph(metadata, nodes, edges);
        }

        // --- Step 2: node instantiation ---

        private List<String> parseDistributions(JsonNode document, String datasetUid, Context parent) {
            List<String> uids = new ArrayList<>();
            int index = 0;
            for (JsonNode item : items(document.get(Terms.DISTRIBUTION))) {
                index++;
                if (!item.isObject()) {
                    continue;
                }
                String name = text(item, Terms.NAME);
                Context context = parent.child(Context.DISTRIBUTION, name);
                Optional<NodeType> type = NodeType.fromTag(text(item, Terms.TYPE))
                        .filter(t -> t == NodeType.FILE_OBJECT || t == NodeType.FILE_SET);
                if (type.isEmpty()) {
                    issues.error(context, badType(NodeType.FILE_OBJECT, NodeType.FILE_SET));
                    continue;
                }
                String uid = name != null ? name : Context.DISTRIBUTION + "#" + index;
                Distribution distribution = type.get() == NodeType.FILE_OBJECT
                        ? new FileObject(
                                uid,
                                name,
                                text(item, Terms.DESCRIPTION),
                                text(item, Terms.CONTENT_URL),
                                text(item, Terms.CONTENT_SIZE),
                                text(item, Terms.ENCODING_FORMAT),
                                text(item, Terms.MD5),
                                text(item, Terms.SHA256),
                                strings(item.get(Terms.CONTAINED_IN)),
                                datasetUid,
                                context)
                        : new FileSet(
                                uid,
                                name,
                                text(item, Terms.DESCRIPTION),
                                strings(item.get(Terms.INCLUDES)),
                                text(item, Terms.ENCODING_FORMAT),
                                strings(item.get(Terms.CONTAINED_IN)),
                                datasetUid,
                                context);
                if (register(distribution)) {
                    uids.add(uid);
                }
            }
            return uids;
        }

        private List<String> parseRecordSets(JsonNode document, String datasetUid, Context parent) {
            List<String> uids = new ArrayList<>();
            int index = 0;
            for (JsonNode item : items(document.get(Terms.RECORD_SET))) {
                index++;
                if (!item.isObject()) {
                    continue;
                }
                String name = text(item, Terms.NAME);
                Context context = parent.child(Context.RECORD_SET, name);
                if (NodeType.fromTag(text(item, Terms.TYPE)).orElse(null) != NodeType.RECORD_SET) {
                    issues.error(context, badType(NodeType.RECORD_SET));
                    continue;
                }
                String uid = name != null ? name : Context.RECORD_SET + "#" + index;
                ArrayNode data = parseData(item.get(Terms.DATA), context);
                List<Field> fields = new ArrayList<>();
                List<String> fieldUids = parseFields(item.get(Terms.FIELD), uid, uid, context, fields);
                RecordSet recordSet = new RecordSet(
                        uid,
                        name,
                        text(item, Terms.DESCRIPTION),
                        strings(item.get(Terms.KEY)),
                        data,
                        fieldUids,
                        datasetUid,
                        context);
                if (register(recordSet)) {
                    uids.add(uid);
                    fields.forEach(this::register);
                }
            }
            return uids;
        }

        /** Parses a field array, appending the fields in pre-order; returns the direct children's uids. */
        private List<String> parseFields(
                JsonNode array, String recordSetUid, String parentUid, Context parent, List<Field> out) {
            List<String> uids = new ArrayList<>();
            int index = 0;
            for (JsonNode item : items(array)) {
                index++;
                if (!item.isObject()) {
                    continue;
                }
                String name = text(item, Terms.NAME);
                Context context = parent.child(Context.FIELD, name);
                if (NodeType.fromTag(text(item, Terms.TYPE)).orElse(null) != NodeType.FIELD) {
                    issues.error(context, badType(NodeType.FIELD));
                    continue;
                }
                String uid = parentUid + "/" + (name != null ? name : Context.FIELD + "#" + index);
                Source source = SourceParser.parse(item.get(Terms.SOURCE), issues, context);
                Source references = SourceParser.parse(item.get(Terms.REFERENCES), issues, context);
                List<Field> children = new ArrayList<>();
                List<String> subFieldUids =
                        parseFields(item.get(Terms.SUB_FIELD), recordSetUid, uid, context, children);
                out.add(new Field(
                        uid,
                        name,
                        text(item, Terms.DESCRIPTION),
                        text(item, Terms.DATA_TYPE),
                        source,
                        references,
                        subFieldUids,
                        recordSetUid,
                        parentUid,
                        context));
                out.addAll(children);
                uids.add(uid);
            }
            return uids;
        }

        private ArrayNode parseData(JsonNode data, Context context) {
            if (data == null || data.isNull()) {
                return null;
            }
            JsonNode records = data;
            if (data.isTextual()) {
                try {
                    records = MAPPER.readTree(data.asText());
                } catch (JsonProcessingException e) {
                    records = null;
                }
            }
            if (records == null || !records.isArray()) {
                issues.error(context, invalidData());
                return MAPPER.createArrayNode();
            }
            for (JsonNode record : records) {
                if (!record.isObject()) {
                    issues.error(context, invalidData());
                    return MAPPER.createArrayNode();
                }
            }
            return (ArrayNode) records;
        }

        private boolean register(Node node) {
            if (nodes.containsKey(node.uid())) {
                issues.error(node.context(), "Duplicate node uid \"" + node.uid() + "\".");
                return false;
            }
            nodes.put(node.uid(), node);
            return true;
        }

        // --- Step 3: reference resolution ---

        private void resolveReferences() {
            for (Node node : nodes.values()) {
                if (node instanceof Distribution distribution) {
                    resolveContainedIn(distribution);
                } else if (node instanceof Field field) {
                    resolveSource(field, field.source());
                    resolveSource(field, field.references());
                    if (!field.source().isDeclared() && !field.hasSubFields() && !backedByData(field)) {
                        issues.error(field.context(), "Node \"" + field.uid() + "\" is a field and has no source.");
                    }
                }
            }
        }

        private void resolveContainedIn(Distribution distribution) {
            for (String uid : distribution.containedIn()) {
                Node target = nodes.get(uid);
                if (target == null) {
                    issues.error(distribution.context(), missingNode(uid, distribution.uid()));
                } else if (!(target instanceof FileObject)) {
                    issues.error(
                            distribution.context(),
                            "Node \"" + uid + "\" referenced by " + Terms.CONTAINED_IN + " of \"" + distribution.uid()
                                    + "\" is not a FileObject.");
                } else {
                    addEdge(uid, distribution.uid());
                }
            }
        }

        private void resolveSource(Field field, Source source) {
            if (!source.isPresent()) {
                return;
            }
            Optional<Reference> reference = StructureGraph.resolve(source, nodes);
            if (reference.isEmpty()) {
                issues.error(field.context(), missingNode(source.path().get(0), field.uid()));
                return;
            }
            if (!StructureGraph.designatesColumn(reference.get())) {
                issues.error(
                        field.context(),
                        "Source \"" + source.raw() + "\" of node \"" + field.uid() + "\" must reference a column.");
                return;
            }
            addEdge(reference.get().target().uid(), field.uid());
        }

        private boolean backedByData(Field field) {
            return nodes.get(field.recordSetUid()) instanceof RecordSet recordSet && recordSet.hasData();
        }

        private void addEdge(String from, String to) {
            edges.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        }

        // --- Step 4: checks needing the whole graph ---

        private void checkDataTypes() {
            for (Node node : nodes.values()) {
                if (node instanceof Field field
                        && !field.hasSubFields()
                        && field.dataType() == null
                        && StructureGraph.dataType(field, nodes).isEmpty()) {
                    issues.error(field.context(), DATA_TYPE_MISSING);
                }
            }
        }

        private void checkRecordSets(Metadata metadata) {
            Map<String, Set<String>> dependencies = new LinkedHashMap<>();
            for (String uid : metadata.recordSetUids()) {
                if (!(nodes.get(uid) instanceof RecordSet recordSet) || recordSet.hasData()) {
                    continue;
                }
                Set<String> providers = new LinkedHashSet<>();
                Map<String, String> links = new HashMap<>();
                for (Field field : StructureGraph.leafFields(recordSet, nodes)) {
                    Optional<String> from = provider(field.source());
                    Optional<String> to = provider(field.references());
                    from.ifPresent(providers::add);
                    to.ifPresent(providers::add);
                    if (from.isPresent() && to.isPresent()) {
                        union(links, from.get(), to.get());
                    }
                }
                checkJoinable(recordSet, providers, links);
                providers.stream()
                        .filter(p -> nodes.get(p) instanceof RecordSet)
                        .forEach(p -> dependencies.computeIfAbsent(uid, k -> new LinkedHashSet<>()).add(p));
            }
            checkCycles(dependencies);
        }

        private Optional<String> provider(Source source) {
            return StructureGraph.resolve(source, nodes)
                    .filter(StructureGraph::designatesColumn)
                    .map(reference -> StructureGraph.columnOf(reference, nodes).providerUid());
        }

        private void checkJoinable(RecordSet recordSet, Set<String> providers, Map<String, String> links) {
            if (providers.size() < 2) {
                return;
            }
            String first = providers.iterator().next();
            for (String provider : providers) {
                if (!find(links, provider).equals(find(links, first))) {
                    issues.error(
                            recordSet.context(),
                            "Record set \"" + recordSet.uid() + "\" reads from \"" + first + "\" and \"" + provider
                                    + "\" but no field declares references joining them.");
                }
            }
        }

        private static void union(Map<String, String> links, String a, String b) {
            links.put(find(links, a), find(links, b));
        }

        private static String find(Map<String, String> links, String uid) {
            String root = uid;
            while (links.containsKey(root) && !links.get(root).equals(root)) {
                root = links.get(root);
            }
            return root;
        }

        private void checkCycles(Map<String, Set<String>> dependencies) {
            Set<String> done = new LinkedHashSet<>();
            for (String start : dependencies.keySet()) {
                findCycle(start, dependencies, new ArrayList<>(), done);
            }
        }

        private void findCycle(String uid, Map<String, Set<String>> dependencies, List<String> path, Set<String> done) {
            if (done.contains(uid)) {
                return;
            }
            int position = path.indexOf(uid);
            if (position >= 0) {
                List<String> cycle = new ArrayList<>(path.subList(position, path.size()));
                cycle.add(uid);
                issues.error(
                        nodes.get(uid).context(),
                        "Reference cycle between record sets: " + String.join(" -> ", cycle) + ".");
                return;
            }
            path.add(uid);
            for (String next : dependencies.getOrDefault(uid, Set.of())) {
                findCycle(next, dependencies, path, done);
            }
            path.remove(path.size() - 1);
            done.add(uid);
        }

        // --- Messages ---

        private static String badType(NodeType... allowed) {
            String types = Arrays.stream(allowed).map(NodeType::compact).collect(Collectors.joining(", "));
            return "Node should have an attribute `\"" + Terms.TYPE + "\" in [" + types + "]`.";
        }

        private static String missingNode(String uid, String referencingUid) {
            return "There is a reference to node named \"" + uid + "\" in node \"" + referencingUid
                    + "\", but this node doesn't exist.";
        }

        private static String invalidData() {
            return "Property \"" + Terms.iri(Terms.DATA) + "\" must be a JSON array of objects.";
        }
    }

    // --- JSON helpers ---

    private static Iterable<JsonNode> items(JsonNode node) {
        return node != null && node.isArray() ? node : List.of();
    }

    private static String text(JsonNode node, String property) {
        JsonNode value = node.get(property);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static List<String> strings(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : items(node)) {
            if (item.isTextual()) {
                values.add(item.asText());
            }
        }
        return values;
    }

    /** Creator/contributor entries are either plain names or objects with a {@code name}. */
    private static List<String> people(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<JsonNode> entries = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(entries::add);
        } else {
            entries.add(node);
        }
        List<String> names = new ArrayList<>();
        for (JsonNode entry : entries) {
            if (entry.isTextual()) {
                names.add(entry.asText());
            } else if (entry.isObject() && text(entry, Terms.NAME) != null) {
                names.add(text(entry, Terms.NAME));
            }
        }
        return names;
    }
}
