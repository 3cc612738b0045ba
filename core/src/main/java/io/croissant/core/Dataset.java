package io.croissant.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.croissant.core.error.DocumentParseException;
import io.croissant.core.error.OperationGraphException;
import io.croissant.core.error.ValidationException;
import io.croissant.core.graph.StructureGraph;
import io.croissant.core.graph.StructureGraphBuilder;
import io.croissant.core.io.CachingFileFetcher;
import io.croissant.core.issues.Issue;
import io.croissant.core.issues.Issues;
import io.croissant.core.model.Field;
import io.croissant.core.model.Metadata;
import io.croissant.core.model.RecordSet;
import io.croissant.core.operation.Operation;
import io.croissant.core.operation.OperationEnvironment;
import io.croissant.core.operation.OperationExecutor;
import io.croissant.core.operation.OperationGraph;
import io.croissant.core.operation.OperationGraphCompiler;
import io.croissant.core.table.Table;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A validated metadata document and the entry point for reading its records.
 *
 * <p>
 * Construction validates the whole document and fails with a {@link ValidationException}
 * listing every error found. Records are materialized on demand, per record set.
 *
 * <pre>{@code
 * Dataset dataset = Dataset.load(Path.of("titanic/metadata.json"));
 * try (Stream<ObjectNode> passengers = dataset.records("passengers")) {
 *     passengers.limit(10).forEach(System.out::println);
 * }
 * }</pre>
 */
public final class Dataset {

    private static final Logger LOG = LoggerFactory.getLogger(Dataset.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String source;
    private final StructureGraph graph;
    private final Issues issues;
    private final DatasetOptions options;
    private final OperationGraphCompiler compiler;
    private final OperationExecutor executor = new OperationExecutor();

    private Dataset(String source, StructureGraph graph, Issues issues, DatasetOptions options) {
        this.source = source;
        this.graph = graph;
        this.issues = issues;
        this.options = options;
        this.compiler = new OperationGraphCompiler(graph, environment(options));
    }

    /** Loads a document from disk with default options. */
    public static Dataset load(Path file) {
        return load(file, DatasetOptions.defaults());
    }

    /**
     * Loads a document from disk. Relative file locations are resolved against the document's
     * directory unless the options name a base directory.
     *
     * @throws DocumentParseException if the file cannot be read or is not JSON
     * @throws ValidationException    if the document has errors
     */
    public static Dataset load(Path file, DatasetOptions options) {
        JsonNode document;
        try {
            document = MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new DocumentParseException("Cannot read " + file + ": " + e.getMessage(), e, file.toString());
        }
        Path parent = file.toAbsolutePath().getParent();
        DatasetOptions effective =
                options.baseDirectory() == null && parent != null ? options.withBaseDirectory(parent) : options;
        return from(document, file.toString(), effective);
    }

    /**
     * Validates an already parsed document.
     *
     * @param source location of the document for error reports, may be {@code null}
     * @throws ValidationException if the document has errors
     */
    public static Dataset from(JsonNode document, String source, DatasetOptions options) {
        long start = System.nanoTime();
        Issues issues = new Issues();
        StructureGraph graph = new StructureGraphBuilder().build(document, source, issues);
        if (issues.hasErrors()) {
            throw new ValidationException(issues.report(), issues.all(), source);
        }
        for (Issue warning : issues.warnings()) {
            LOG.warn("Validation warning: {}", warning);
        }
        LOG.info(
                "Validated dataset: name={}, nodes={}, warnings={}, duration_ms={}",
                graph.metadata().name(),
                graph.size(),
                issues.warnings().size(),
                (System.nanoTime() - start) / 1_000_000);
        return new Dataset(source, graph, issues, options);
    }

    public Metadata metadata() {
        return graph.metadata();
    }

    /** Names of the record sets, in document order. */
    public List<String> recordSetNames() {
        return graph.recordSets().stream().map(RecordSet::name).toList();
    }

    /** Warnings found while validating; errors would have failed construction. */
    public Issues issues() {
        return issues;
    }

    public StructureGraph graph() {
        return graph;
    }

    public String source() {
        return source;
    }

    /**
     * The records of a record set, each an object keyed by field name.
     *
     * <p>
     * Nothing is read until the stream's terminal operation starts; the stream can be consumed
     * once.
     *
     * @throws IllegalArgumentException if no record set has this name
     * @throws io.croissant.core.error.CroissantExecutionException from the terminal operation, if
     *         materializing the records fails
     */
    public Stream<ObjectNode> records(String recordSetName) {
        RecordSet recordSet = graph.recordSet(recordSetName)
                .orElseThrow(() -> new IllegalArgumentException("No record set named \"" + recordSetName
                        + "\". Existing record sets: " + recordSetNames()));
        return StreamSupport.stream(() -> materialize(recordSet).spliterator(), Spliterator.ORDERED, false);
    }

    private synchronized List<ObjectNode> materialize(RecordSet recordSet) {
        Operation output = compiler.compile(recordSet);
        OperationGraph operations = compiler.graph();
        if (options.debug()) {
            LOG.debug("Operation graph for {}:\n{}", recordSet.uid(), operations.describe());
        }
        Object result = executor.execute(operations, output);
        if (!(result instanceof Table table)) {
            throw new OperationGraphException(
                    "Record set \"" + recordSet.uid() + "\" did not produce a table.", recordSet.uid(), output.name());
        }
        List<Field> fields = graph.fields(recordSet);
        return table.rows().stream().map(row -> toRecord(row, fields)).toList();
    }

    private static ObjectNode toRecord(Map<String, JsonNode> row, List<Field> fields) {
        ObjectNode record = JsonNodeFactory.instance.objectNode();
        for (Field field : fields) {
            record.set(field.name(), row.get(field.uid()));
        }
        return record;
    }

    private static OperationEnvironment environment(DatasetOptions options) {
        Path base = options.baseDirectory() != null ? options.baseDirectory() : Path.of("").toAbsolutePath();
        return new OperationEnvironment(
                base,
                options.cacheDirectory(),
                options.fetcher() != null
                        ? options.fetcher()
                        : new CachingFileFetcher(base, options.cacheDirectory(), options.httpTimeout()),
                options.readers());
    }
}
