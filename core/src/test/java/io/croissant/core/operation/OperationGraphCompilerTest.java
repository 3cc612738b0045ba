package io.croissant.core.operation;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.croissant.core.graph.StructureGraph;
import io.croissant.core.graph.StructureGraphBuilder;
import io.croissant.core.io.FormatReaderRegistry;
import io.croissant.core.issues.Issues;
import io.croissant.core.model.RecordSet;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OperationGraphCompilerTest {

    private static final Path DATASET = Path.of("src/test/resources/datasets/passengers");

    @TempDir
    Path cacheDir;

    private StructureGraph structure;
    private OperationGraphCompiler compiler;

    @BeforeEach
    void setUp() throws IOException {
        Issues issues = new Issues();
        structure = new StructureGraphBuilder()
                .build(new ObjectMapper().readTree(DATASET.resolve("metadata.json").toFile()), "metadata.json", issues);
        assertThat(issues.errors()).isEmpty();
        OperationEnvironment environment = new OperationEnvironment(
                DATASET,
                cacheDir,
                (url, checksum) -> DATASET.resolve(url),
                FormatReaderRegistry.defaults());
        compiler = new OperationGraphCompiler(structure, environment);
    }

    private List<String> names(List<Operation> operations) {
        return operations.stream().map(Operation::name).toList();
    }

    @Test
    void inlineRecordSetReadsItsDataOnly() {
        RecordSet genders = structure.recordSet("genders").orElseThrow();

        Operation output = compiler.compile(genders);

        assertThat(output.name()).isEqualTo("GroupRecordSet(genders)");
        assertThat(names(compiler.graph().topologicalOrder()))
                .containsExactly(
                        "Data(genders)",
                        "ReadField(genders/label)",
                        "ReadField(genders/description)",
                        "GroupRecordSet(genders)");
    }

    @Test
    void joinedRecordSetChainsOneJoinPerAdditionalProvider() {
        RecordSet passengers = structure.recordSet("passengers").orElseThrow();

        Operation output = compiler.compile(passengers);
        OperationGraph graph = compiler.graph();

        assertThat(graph.output("passengers")).contains(output);
        Operation firstJoin = operation(graph, "Join(passengers/gender)");
        Operation secondJoin = operation(graph, "Join(passengers/cabin)");
        assertThat(names(graph.predecessors(firstJoin)))
                .containsExactly("ReadFile(passengers.csv)", "GroupRecordSet(genders)");
        assertThat(names(graph.predecessors(secondJoin)))
                .containsExactly("Join(passengers/gender)", "ReadFile(cabins)");
        assertThat(names(graph.predecessors(operation(graph, "ReadFile(cabins)"))))
                .containsExactly("Concatenate(cabins)");
        assertThat(names(graph.predecessors(operation(graph, "Concatenate(cabins)"))))
                .containsExactly("FilterFiles(cabins)");
        assertThat(names(graph.predecessors(operation(graph, "ReadFile(passengers.csv)"))))
                .containsExactly("Download(passengers.csv)");
        assertThat(names(graph.predecessors(output)))
                .containsExactly(
                        "ReadField(passengers/name)",
                        "ReadField(passengers/age)",
                        "ReadField(passengers/gender)",
                        "ReadField(passengers/gender_description)",
                        "ReadField(passengers/cabin)",
                        "ReadField(passengers/cabin_number)",
                        "ReadField(passengers/deck)");
    }

    @Test
    void sharedProvidersAreCompiledOnce() {
        compiler.compileAll();
        int size = compiler.graph().size();

        compiler.compile(structure.recordSet("passengers").orElseThrow());

        assertThat(compiler.graph().size()).isEqualTo(size);
        assertThat(compiler.graph().operations())
                .extracting(Operation::name)
                .filteredOn(name -> name.equals("GroupRecordSet(genders)"))
                .hasSize(1);
    }

    private static Operation operation(OperationGraph graph, String name) {
        return graph.operations().stream()
                .filter(operation -> operation.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No operation " + name + " in\n" + graph.describe()));
    }
}
