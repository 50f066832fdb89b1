package io.pipevar.core.engine.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pipevar.core.error.TemplateEvalException;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link RestrictedExpressionEngine}: grammar, operator semantics and error reporting. */
@DisplayName("RestrictedExpressionEngine")
class RestrictedExpressionEngineTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final RestrictedExpressionEngine engine = new RestrictedExpressionEngine();

    private final Map<String, JsonNode> bindings = Map.of(
            "n", JSON.getNodeFactory().numberNode(4),
            "name", JSON.getNodeFactory().textNode("ada"),
            "empty", JSON.getNodeFactory().textNode(""),
            "items", json("[10, 20, 30]"),
            "repo", json("{\"owner\": {\"name\": \"octo\"}, \"default_branch\": \"main\"}"),
            "flag", JSON.getNodeFactory().booleanNode(true));

    private static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    private JsonNode eval(String expression) {
        return engine.compile(expression).evaluate(bindings);
    }

    @Nested
    @DisplayName("arithmetic")
    class Arithmetic {

        @Test
        void precedence() {
            assertThat(eval("1 + 2 * 3").asLong()).isEqualTo(7);
            assertThat(eval("(1 + 2) * 3").asLong()).isEqualTo(9);
            assertThat(eval("n - -1").asLong()).isEqualTo(5);
            assertThat(eval("n % 3").asLong()).isEqualTo(1);
        }

        @Test
        @DisplayName("division always yields a float")
        void division() {
            assertThat(eval("7 / 2").doubleValue()).isEqualTo(3.5);
            JsonNode exact = eval("n / 2");
            assertThat(exact.isFloatingPointNumber()).isTrue();
            assertThat(exact.doubleValue()).isEqualTo(2.0);
        }

        @Test
        void zeroDivisor() {
            assertThatThrownBy(() -> eval("n / 0"))
                    .isInstanceOf(TemplateEvalException.class)
                    .hasMessageContaining("Division by zero");
            assertThatThrownBy(() -> eval("n % 0"))
                    .isInstanceOf(TemplateEvalException.class)
                    .hasMessageContaining("Modulo by zero");
        }

        @Test
        void overflow() {
            assertThatThrownBy(() -> eval("9223372036854775807 + 1"))
                    .isInstanceOf(TemplateEvalException.class)
                    .hasMessageContaining("overflow");
        }

        @Test
        @DisplayName("plus concatenates when either side is a string")
        void concatenation() {
            assertThat(eval("name + '-' + n").asText()).isEqualTo("ada-4");
            assertThat(eval("n + \"x\"").asText()).isEqualTo("4x");
        }

        @Test
        void typeErrors() {
            assertThatThrownBy(() -> eval("n * name"))
                    .isInstanceOf(TemplateEvalException.class)
                    .hasMessageContaining("needs numbers");
            assertThatThrownBy(() -> eval("-name")).isInstanceOf(TemplateEvalException.class);
        }
    }

    @Nested
    @DisplayName("comparison and logic")
    class Logic {

        @Test
        void comparisons() {
            assertThat(eval("n > 3").asBoolean()).isTrue();
            assertThat(eval("n <= 3").asBoolean()).isFalse();
            assertThat(eval("'abc' < 'abd'").asBoolean()).isTrue();
            assertThat(eval("1 == 1.0").asBoolean()).isTrue();
            assertThat(eval("null == null").asBoolean()).isTrue();
            assertThat(eval("name != 'ada'").asBoolean()).isFalse();
        }

        @Test
        void incomparableTypes() {
            assertThatThrownBy(() -> eval("n < name"))
                    .isInstanceOf(TemplateEvalException.class)
                    .hasMessageContaining("cannot compare");
        }

        @Test
        @DisplayName("logical operators short-circuit and yield booleans")
        void shortCircuit() {
            assertThat(eval("flag || ghost").asBoolean()).isTrue();
            assertThat(eval("!flag && ghost").asBoolean()).isFalse();
            assertThat(eval("!empty").asBoolean()).isTrue();
            assertThat(eval("name && n").isBoolean()).isTrue();
        }

        @Test
        @DisplayName("ternary evaluates only the selected branch")
        void ternary() {
            assertThat(eval("flag ? 'yes' : ghost").asText()).isEqualTo("yes");
            assertThat(eval("empty ? 1 : n > 2 ? 'big' : 'small'").asText()).isEqualTo("big");
        }
    }

    @Nested
    @DisplayName("access")
    class Access {

        @Test
        void properties() {
            assertThat(eval("repo.owner.name").asText()).isEqualTo("octo");
            assertThat(eval("repo['default_branch']").asText()).isEqualTo("main");
            assertThat(eval("(repo).owner.name").asText()).isEqualTo("octo");
        }

        @Test
        void indexing() {
            assertThat(eval("items[0]").asInt()).isEqualTo(10);
            assertThat(eval("items[-1]").asInt()).isEqualTo(30);
            assertThat(eval("items[n - 3]").asInt()).isEqualTo(20);
        }

        @Test
        void accessErrors() {
            assertThatThrownBy(() -> eval("items[3]"))
                    .isInstanceOf(TemplateEvalException.class)
                    .hasMessageContaining("out of range");
            assertThatThrownBy(() -> eval("repo.missing"))
                    .isInstanceOf(TemplateEvalException.class)
                    .hasMessageContaining("No property 'missing'");
            assertThatThrownBy(() -> eval("name.length"))
                    .isInstanceOf(TemplateEvalException.class)
                    .hasMessageContaining("of string");
            assertThatThrownBy(() -> eval("items['a']")).isInstanceOf(TemplateEvalException.class);
        }
    }

    @Nested
    @DisplayName("syntax")
    class Syntax {

        @Test
        @DisplayName("malformed expressions fail to compile")
        void malformed() {
            for (String source : new String[] {"a +", "(a", "a b", "a @ b", "'open", "a = b", "items[0"}) {
                assertThatThrownBy(() -> engine.compile(source))
                        .as(source)
                        .isInstanceOf(TemplateEvalException.class);
            }
        }

        @Test
        @DisplayName("errors name the expression")
        void errorNamesExpression() {
            assertThatThrownBy(() -> engine.compile("a +"))
                    .isInstanceOfSatisfying(TemplateEvalException.class, e -> assertThat(e.expression())
                            .isEqualTo("a +"));
        }

        @Test
        void stringEscapes() {
            assertThat(eval("'it\\'s'").asText()).isEqualTo("it's");
            assertThat(eval("\"a\\nb\"").asText()).isEqualTo("a\nb");
        }

        @Test
        void literals() {
            assertThat(eval("true").asBoolean()).isTrue();
            assertThat(eval("null").isNull()).isTrue();
            assertThat(eval("1.5e2").doubleValue()).isEqualTo(150.0);
        }
    }
}
