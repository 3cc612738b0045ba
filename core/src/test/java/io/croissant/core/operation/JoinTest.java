package io.croissant.core.operation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.croissant.core.error.JoinException;
import io.croissant.core.model.Field;
import io.croissant.core.model.Transform;
import io.croissant.core.table.Table;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JoinTest {

    private final Table passengers = new Table(
            List.of("passengers.csv/name", "passengers.csv/gender"),
            List.of(
                    Map.of("passengers.csv/name", text("Alice"), "passengers.csv/gender", text("F")),
                    Map.of("passengers.csv/name", text("Bob"), "passengers.csv/gender", text("M")),
                    Map.of("passengers.csv/name", text("Sam"), "passengers.csv/gender", text("X"))));
    private final Table genders = new Table(
            List.of("genders/label", "genders/description"),
            List.of(
                    Map.of("genders/label", text("F"), "genders/description", text("female")),
                    Map.of("genders/label", text("M"), "genders/description", text("male"))));

    private final Field gender =
            Nodes.field("passengers", "gender", Nodes.source("passengers.csv/gender"), Nodes.source("genders/label"));
    private final Join join = new Join(gender, "passengers.csv/gender", "genders/label");

    private static JsonNode text(String value) {
        return TextNode.valueOf(value);
    }

    @Test
    void leftMergesOnTheDeclaredKeys() {
        Table joined = join.call(List.of(passengers, genders));

        assertThat(joined.size()).isEqualTo(3);
        assertThat(joined.column("genders/description"))
                .extracting(node -> node.isNull() ? null : node.asText())
                .containsExactly("female", "male", null);
    }

    @Test
    void inputOrderDoesNotMatter() {
        assertThat(join.call(List.of(genders, passengers))).isEqualTo(join.call(List.of(passengers, genders)));
    }

    @Test
    void leftKeyTransformsReplaceTheKeyValues() {
        Field coded = Nodes.field(
                "passengers",
                "gender",
                Nodes.source("passengers.csv/gender", Transform.regex("^gender-(.*)$")),
                Nodes.source("genders/label"));
        Table codedPassengers = new Table(
                List.of("passengers.csv/gender"),
                List.of(Map.of("passengers.csv/gender", text("gender-F"))));

        Table joined = new Join(coded, "passengers.csv/gender", "genders/label")
                .call(List.of(codedPassengers, genders));

        assertThat(joined.column("passengers.csv/gender")).extracting(JsonNode::asText).containsExactly("F");
        assertThat(joined.column("genders/description")).extracting(JsonNode::asText).containsExactly("female");
    }

    @Test
    void requiresExactlyTwoInputs() {
        assertThatThrownBy(() -> join.call(List.of(passengers)))
                .isInstanceOf(JoinException.class)
                .hasMessage("Join expects exactly 2 inputs, got 1.")
                .satisfies(e -> assertThat(((JoinException) e).operation()).isEqualTo("Join(passengers/gender)"));
    }

    @Test
    void missingKeyColumnListsTheExistingOnes() {
        Table unrelated = new Table(List.of("other/id"), List.of());

        assertThatThrownBy(() -> join.call(List.of(passengers, unrelated)))
                .isInstanceOf(JoinException.class)
                .hasMessage("Column \"genders/label\" does not exist in node \"passengers/gender\". Existing columns:"
                        + " [other/id]");
    }

    @Test
    void nonTableInputIsRejected() {
        assertThatThrownBy(() -> join.call(List.of(passengers, "genders")))
                .isInstanceOf(JoinException.class)
                .hasMessage("Join expects tables as inputs, got String.");
    }
}
