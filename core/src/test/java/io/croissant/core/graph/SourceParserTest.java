package io.croissant.core.graph;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.croissant.core.issues.Context;
import io.croissant.core.issues.Issue;
import io.croissant.core.issues.Issues;
import io.croissant.core.model.Source;
import org.junit.jupiter.api.Test;

class SourceParserTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Issues issues = new Issues();
    private final Context context = Context.dataset("d").child(Context.FIELD, "f");

    @Test
    void absentSourceIsNone() {
        assertThat(SourceParser.parse(null, issues, context)).isSameAs(Source.NONE);
        assertThat(issues.all()).isEmpty();
    }

    @Test
    void splitsTheReferencePath() {
        Source source = SourceParser.parse(TextNode.valueOf("#{passengers.csv/age}"), issues, context);

        assertThat(source.isPresent()).isTrue();
        assertThat(source.path()).containsExactly("passengers.csv", "age");
        assertThat(source.uidCandidates()).containsExactly("passengers.csv/age", "passengers.csv");
        assertThat(issues.all()).isEmpty();
    }

    @Test
    void readsObjectFormWithTransforms() throws Exception {
        JsonNode node = JSON.readTree("""
                {"data": "#{files/filename}", "applyTransform": [{"regex": "^(.*)\\\\.csv$"}]}
                """);

        Source source = SourceParser.parse(node, issues, context);

        assertThat(source.path()).containsExactly("files", "filename");
        assertThat(source.transforms()).hasSize(1);
        assertThat(source.applyTransforms("train.csv")).isEqualTo("train");
    }

    @Test
    void malformedReferenceIsReportedAndStillDeclared() {
        Source source = SourceParser.parse(TextNode.valueOf("passengers.csv/age"), issues, context);

        assertThat(source.isDeclared()).isTrue();
        assertThat(source.isPresent()).isFalse();
        assertThat(issues.errors())
                .extracting(Issue::message)
                .containsExactly("Malformed source data: passengers.csv/age.");
    }

    @Test
    void emptySegmentIsMalformed() {
        SourceParser.parse(TextNode.valueOf("#{a//b}"), issues, context);

        assertThat(issues.errors()).extracting(Issue::message).containsExactly("Malformed source data: #{a//b}.");
    }

    @Test
    void unsupportedTransformIsReported() throws Exception {
        JsonNode node = JSON.readTree("""
                {"data": "#{a/b}", "applyTransform": {"format": "%Y"}}
                """);

        SourceParser.parse(node, issues, context);

        assertThat(issues.errors()).singleElement().satisfies(issue -> assertThat(issue.message())
                .startsWith("Unsupported transform"));
    }

    @Test
    void invalidRegexIsReported() throws Exception {
        JsonNode node = JSON.readTree("""
                {"data": "#{a/b}", "applyTransform": {"regex": "(unclosed"}}
                """);

        SourceParser.parse(node, issues, context);

        assertThat(issues.errors()).singleElement().satisfies(issue -> assertThat(issue.message())
                .startsWith("Invalid regex \"(unclosed\""));
    }
}
