package io.pipevar.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pipevar.core.model.SchemaNode;
import io.pipevar.core.model.ValidationReport;
import io.pipevar.core.model.Violation;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link SchemaValidator} over scalar, array and object schemas. */
@DisplayName("SchemaValidator")
class SchemaValidatorTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final SchemaValidator validator = new SchemaValidator();

    private static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static SchemaNode deploySchema() {
        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        properties.put("branch", SchemaNode.string());
        properties.put("timeout", SchemaNode.integer());
        return SchemaNode.object(properties);
    }

    @Nested
    @DisplayName("objects")
    class ObjectSchemas {

        @Test
        @DisplayName("a wrong property type is reported at its path")
        void wrongPropertyType() {
            ValidationReport report =
                    validator.validate(deploySchema(), json("{\"branch\":\"main\",\"timeout\":\"30\"}"));

            assertThat(report.isValid()).isFalse();
            assertThat(report.violations()).hasSize(1);
            Violation violation = report.violations().get(0);
            assertThat(violation.path()).containsExactly("timeout");
            assertThat(violation.pointer()).isEqualTo("$.timeout");
            assertThat(violation.expected()).isEqualTo("int");
            assertThat(violation.actual()).isEqualTo("string");
            assertThat(violation.message()).isEqualTo("Expected int at $.timeout but found string");
        }

        @Test
        @DisplayName("conforming values produce no violations")
        void conforming() {
            assertThat(validator.validate(deploySchema(), json("{\"branch\":\"main\",\"timeout\":30}")).isValid())
                    .isTrue();
        }

        @Test
        @DisplayName("absent, null and undeclared properties are accepted")
        void openObjects() {
            assertThat(validator.validate(deploySchema(), json("{\"branch\":\"main\"}")).isValid()).isTrue();
            assertThat(validator.validate(deploySchema(), json("{\"timeout\":null,\"extra\":[1]}")).isValid())
                    .isTrue();
        }

        @Test
        @DisplayName("an object schema without properties accepts any object")
        void emptyProperties() {
            assertThat(validator.validate(SchemaNode.anyObject(), json("{\"anything\":{\"goes\":[1,\"x\"]}}"))
                            .isValid())
                    .isTrue();
            assertThat(validator.validate(SchemaNode.anyObject(), json("[]")).violations())
                    .extracting(Violation::actual)
                    .containsExactly("array");
        }

        @Test
        @DisplayName("sibling violations are all reported")
        void siblings() {
            ValidationReport report = validator.validate(deploySchema(), json("{\"branch\":1,\"timeout\":true}"));

            assertThat(report.violations()).extracting(Violation::pointer).containsExactly("$.branch", "$.timeout");
        }

        @Test
        @DisplayName("property names containing path syntax are quoted in the path")
        void quotedPropertySegments() {
            SchemaNode schema = SchemaNode.object(Map.of("a.b", SchemaNode.integer(), "[0]", SchemaNode.bool()));

            ValidationReport report = validator.validate(schema, json("{\"a.b\":\"x\",\"[0]\":1}"));

            assertThat(report.violations())
                    .extracting(Violation::pointer)
                    .containsExactlyInAnyOrder("$['a.b']", "$['[0]']");
        }
    }

    @Nested
    @DisplayName("arrays")
    class ArraySchemas {

        @Test
        @DisplayName("element violations carry the index")
        void elementIndex() {
            SchemaNode schema = SchemaNode.arrayOf(SchemaNode.object(Map.of("name", SchemaNode.string())));

            ValidationReport report = validator.validate(schema, json("[{\"name\":\"a\"},{\"name\":2}]"));

            assertThat(report.violations()).hasSize(1);
            assertThat(report.violations().get(0).path()).containsExactly("[1]", "name");
            assertThat(report.violations().get(0).pointer()).isEqualTo("$[1].name");
        }

        @Test
        @DisplayName("arrays without an item schema accept any elements")
        void untypedItems() {
            assertThat(validator.validate(SchemaNode.arrayOf(null), json("[1,\"a\",null]")).isValid()).isTrue();
        }
    }

    @Nested
    @DisplayName("scalars")
    class ScalarSchemas {

        @Test
        @DisplayName("float accepts integers, int rejects fractions")
        void numbers() {
            assertThat(validator.validate(SchemaNode.floating(), IntNode.valueOf(3)).isValid()).isTrue();
            assertThat(validator.validate(SchemaNode.integer(), json("3.5")).violations())
                    .extracting(Violation::actual)
                    .containsExactly("float");
        }

        @Test
        @DisplayName("enum membership compares numbers by value")
        void enumMembership() {
            SchemaNode level = SchemaNode.floating().withEnum(List.of(json("1.0"), json("2.5")));

            assertThat(validator.validate(level, IntNode.valueOf(1)).isValid()).isTrue();
            assertThat(validator.validate(level, json("3")).violations().get(0).message()).contains("is not one of");
        }

        @Test
        @DisplayName("string enums")
        void stringEnum() {
            SchemaNode status =
                    SchemaNode.string().withEnum(List.of(TextNode.valueOf("ok"), TextNode.valueOf("failed")));

            assertThat(validator.validate(status, TextNode.valueOf("ok")).isValid()).isTrue();
            assertThat(validator.validate(status, TextNode.valueOf("OK")).isValid()).isFalse();
        }

        @Test
        @DisplayName("null is not a scalar")
        void nullValue() {
            assertThat(validator.validate(SchemaNode.bool(), null).violations())
                    .extracting(Violation::pointer, Violation::actual)
                    .containsExactly(tuple("$", "null"));
        }
    }

    @Test
    @DisplayName("validation does not mutate the value")
    void noMutation() {
        JsonNode value = json("{\"branch\":1}");
        JsonNode copy = value.deepCopy();

        validator.validate(deploySchema(), value);

        assertThat(value).isEqualTo(copy);
    }
}
