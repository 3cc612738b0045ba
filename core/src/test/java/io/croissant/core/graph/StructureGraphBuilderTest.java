package io.croissant.core.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.croissant.core.error.DocumentParseException;
import io.croissant.core.error.ValidationException;
import io.croissant.core.issues.Issue;
import io.croissant.core.issues.Issues;
import io.croissant.core.model.DataType;
import io.croissant.core.model.Field;
import io.croissant.core.model.FileObject;
import io.croissant.core.model.RecordSet;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StructureGraphBuilderTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Path GRAPHS = Path.of("src/test/resources/graphs");

    private final StructureGraphBuilder builder = new StructureGraphBuilder();
    private final Issues issues = new Issues();

    private StructureGraph build(String fixture) throws IOException {
        JsonNode document = JSON.readTree(GRAPHS.resolve(fixture).toFile());
        return builder.build(document, fixture, issues);
    }

    private List<String> errors() {
        return issues.errors().stream().map(Issue::toString).toList();
    }

    @Nested
    @DisplayName("root")
    class Root {

        @Test
        void nonObjectDocumentIsAParseError() {
            assertThatThrownBy(() -> builder.build(TextNode.valueOf("x"), "doc.json", issues))
                    .isInstanceOf(DocumentParseException.class)
                    .satisfies(e -> assertThat(((DocumentParseException) e).source()).isEqualTo("doc.json"));
        }

        @Test
        void rootThatIsNotADatasetFailsImmediately() {
            assertThatThrownBy(() -> build("not-a-dataset.json"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("[dataset(thing)] No metadata is defined in the dataset.");
        }

        @Test
        void datasetWithoutNameFailsImmediately() {
            assertThatThrownBy(() -> build("missing-name.json"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Property \"https://schema.org/name\" is mandatory, but does not exist.");
        }
    }

    @Nested
    @DisplayName("valid document")
    class Valid {

        @Test
        void buildsTypedNodesIndexedByUid() throws IOException {
            StructureGraph graph = build("minimal.json");

            assertThat(issues.hasErrors()).isFalse();
            assertThat(graph.nodes().keySet()).containsExactly("a.csv", "rs", "rs/x");
            assertThat(graph.distributions()).singleElement().isInstanceOf(FileObject.class);
            RecordSet recordSet = graph.recordSet("rs").orElseThrow();
            assertThat(graph.fields(recordSet)).extracting(Field::uid).containsExactly("rs/x");
        }

        @Test
        void recordSetMayShareTheDatasetName() throws IOException {
            JsonNode document = JSON.readTree("""
                    {
                      "@type": "sc:Dataset",
                      "name": "cities",
                      "recordSet": [{
                        "@type": "ml:RecordSet",
                        "name": "cities",
                        "field": [{"@type": "ml:Field", "name": "city", "dataType": "sc:Text"}],
                        "data": [{"city": "Paris"}]
                      }]
                    }
                    """);

            StructureGraph graph = builder.build(document, "cities.json", issues);

            assertThat(errors()).isEmpty();
            assertThat(graph.metadata().name()).isEqualTo("cities");
            assertThat(graph.recordSet("cities")).get().extracting(RecordSet::hasData).isEqualTo(true);
            assertThat(graph.nodes().keySet()).containsExactly("cities", "cities/city");
        }

        @Test
        void resolvedReferencesBecomeEdges() throws IOException {
            StructureGraph graph = build("minimal.json");

            assertThat(graph.successors("a.csv")).containsExactly("rs/x");
            assertThat(graph.predecessors("rs/x")).containsExactly("a.csv");
        }

        @Test
        void fieldReadsAQualifiedDistributionColumn() throws IOException {
            StructureGraph graph = build("minimal.json");
            Field x = (Field) graph.node("rs/x").orElseThrow();

            ColumnRef column = graph.columnOf(graph.resolve(x.source()).orElseThrow());

            assertThat(column).isEqualTo(new ColumnRef("a.csv", "a.csv/x", List.of()));
            assertThat(graph.dataType(x)).contains(DataType.INTEGER);
        }

        @Test
        void missingRecommendedPropertiesAreWarnings() throws IOException {
            build("minimal.json");

            assertThat(issues.warnings())
                    .extracting(Issue::toString)
                    .contains(
                            "[dataset(minimal)] Property \"https://schema.org/license\" is recommended, but does not"
                                    + " exist.",
                            "[dataset(minimal) > distribution(a.csv)] Property \"https://schema.org/description\" is"
                                    + " recommended, but does not exist.");
        }
    }

    @Nested
    @DisplayName("invalid document")
    class Invalid {

        @Test
        void reportsEveryDistributionProblemInOnePass() throws IOException {
            build("bad-distributions.json");

            assertThat(errors())
                    .contains(
                            "[dataset(d) > distribution(thing)] Node should have an attribute"
                                    + " `\"@type\" in [sc:FileObject, sc:FileSet]`.",
                            "[dataset(d) > distribution(no-url)] Property \"https://schema.org/contentUrl\" is"
                                    + " mandatory, but does not exist.",
                            "[dataset(d) > distribution(no-url)] Property \"https://schema.org/encodingFormat\" is"
                                    + " mandatory, but does not exist.",
                            "[dataset(d) > distribution(no-url)] The node doesn't define any integrity property"
                                    + " (like md5 or sha256).",
                            "[dataset(d) > distribution(files)] There is a reference to node named \"missing.zip\""
                                    + " in node \"files\", but this node doesn't exist.",
                            "[dataset(d) > distribution(dup)] Duplicate node uid \"dup\".");
        }

        @Test
        void reportsEveryFieldProblemInOnePass() throws IOException {
            build("bad-fields.json");

            assertThat(errors())
                    .containsExactlyInAnyOrder(
                            "[dataset(d) > record_set(rs) > field(malformed)] Malformed source data: a.csv/m.",
                            "[dataset(d) > record_set(rs) > field(dangling)] There is a reference to node named"
                                    + " \"missing\" in node \"rs/dangling\", but this node doesn't exist.",
                            "[dataset(d) > record_set(rs) > field(sourceless)] Node \"rs/sourceless\" is a field and"
                                    + " has no source.",
                            "[dataset(d) > record_set(rs) > field(whole)] Source \"#{other}\" of node \"rs/whole\""
                                    + " must reference a column.",
                            "[dataset(d) > record_set(rs) > field(wrongtype)] Unknown data type \"sc:Imaginary\" for"
                                    + " property \"http://mlcommons.org/schema/dataType\".",
                            "[dataset(d) > record_set(rs) > field(untyped)] The field does not specify any"
                                    + " http://mlcommons.org/schema/dataType, neither does any of its predecessor.");
        }

        @Test
        void recordSetReadingUnrelatedDistributionsIsRejected() throws IOException {
            build("unjoined.json");

            assertThat(errors())
                    .containsExactly("[dataset(d) > record_set(rs)] Record set \"rs\" reads from \"a.csv\" and"
                            + " \"b.csv\" but no field declares references joining them.");
        }

        @Test
        void referenceCycleBetweenRecordSetsIsRejected() throws IOException {
            build("cycle.json");

            assertThat(errors())
                    .containsExactly(
                            "[dataset(d) > record_set(rs1)] Reference cycle between record sets: rs1 -> rs2 -> rs1.");
        }

        @Test
        void envelopeViolationsAreCollected() throws IOException {
            build("bad-envelope.json");

            assertThat(errors()).anySatisfy(error -> assertThat(error)
                    .startsWith("[dataset(d)] Invalid document structure: "));
            assertThat(errors())
                    .contains("[dataset(d) > record_set(rs)] Property \"http://mlcommons.org/schema/data\" must be a"
                            + " JSON array of objects.");
        }
    }
}
