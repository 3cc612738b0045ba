package io.croissant.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DataTypeTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Test
    void resolvesCompactAndExpandedTags() {
        assertThat(DataType.fromTag("sc:Integer")).contains(DataType.INTEGER);
        assertThat(DataType.fromTag("https://schema.org/Integer")).contains(DataType.INTEGER);
        assertThat(DataType.fromTag("sc:Number")).contains(DataType.FLOAT);
        assertThat(DataType.fromTag("sc:Unknown")).isEmpty();
    }

    @Nested
    @DisplayName("coerce")
    class Coerce {

        @Test
        void parsesTextIntoNumbers() {
            assertThat(DataType.INTEGER.coerce(NODES.textNode(" 42 ")).longValue()).isEqualTo(42L);
            assertThat(DataType.FLOAT.coerce(NODES.textNode("2.5")).doubleValue()).isEqualTo(2.5);
            assertThat(DataType.INTEGER.coerce(NODES.numberNode(3.0)).longValue()).isEqualTo(3L);
        }

        @Test
        void blankCellsAreNullExceptForText() {
            assertThat(DataType.INTEGER.coerce(NODES.textNode(""))).isEqualTo(NullNode.getInstance());
            assertThat(DataType.TEXT.coerce(NODES.textNode("")).asText()).isEmpty();
            assertThat(DataType.TEXT.coerce(null)).isEqualTo(NullNode.getInstance());
        }

        @Test
        void textKeepsLiteralsAsText() {
            assertThat(DataType.TEXT.coerce(NODES.numberNode(7)).asText()).isEqualTo("7");
        }

        @Test
        void booleansAcceptCommonSpellings() {
            assertThat(DataType.BOOLEAN.coerce(NODES.textNode("Yes")).booleanValue()).isTrue();
            assertThat(DataType.BOOLEAN.coerce(NODES.numberNode(0)).booleanValue()).isFalse();
        }

        @Test
        void datesDropTheTimePart() {
            assertThat(DataType.DATE.coerce(NODES.textNode("2023-04-01T10:00:00Z")).asText())
                    .isEqualTo("2023-04-01");
        }

        @Test
        void unconvertibleValueNamesTheTargetType() {
            assertThatThrownBy(() -> DataType.INTEGER.coerce(NODES.textNode("abc")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Cannot convert \"abc\" to sc:Integer");
        }
    }
}
