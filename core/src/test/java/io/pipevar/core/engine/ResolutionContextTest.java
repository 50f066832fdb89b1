package io.pipevar.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pipevar.core.model.EntryState;
import io.pipevar.core.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link ResolutionContext} building and entry state transitions. */
@DisplayName("ResolutionContext")
class ResolutionContextTest {

    @Test
    @DisplayName("supplied values start resolved, declared variables unresolved")
    void initialStates() {
        ResolutionContext context = ResolutionContext.builder()
                .value("parent", TextNode.valueOf("p"))
                .variable("child", Variable.template("${parent}"))
                .build();

        assertThat(context.keys()).containsExactly("parent", "child");
        assertThat(context.state("parent")).isEqualTo(EntryState.RESOLVED);
        assertThat(context.state("child")).isEqualTo(EntryState.UNRESOLVED);
        assertThat(context.state("other")).isNull();
        assertThat(context.variable("parent")).isEmpty();
        assertThat(context.variable("child")).isPresent();
    }

    @Test
    @DisplayName("keys are unique across all sources")
    void duplicateKeys() {
        ResolutionContext.Builder builder = ResolutionContext.builder().value("x", TextNode.valueOf("1"));

        assertThatThrownBy(() -> builder.variable("x", Variable.literal("2")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'x'");
        assertThatThrownBy(() -> builder.value("", TextNode.valueOf("1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("state transitions are checked")
    void transitions() {
        ResolutionContext context = ResolutionContext.builder()
                .variable("v", Variable.literal("x"))
                .build();

        assertThatThrownBy(() -> context.markResolved("v", TextNode.valueOf("x")))
                .isInstanceOf(IllegalStateException.class);
        context.markResolving("v");
        assertThat(context.state("v")).isEqualTo(EntryState.RESOLVING);
        context.markResolved("v", TextNode.valueOf("x"));
        assertThat(context.state("v")).isEqualTo(EntryState.RESOLVED);
        assertThatThrownBy(() -> context.markResolving("v")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("supplied values are copied")
    void valuesCopied() {
        ObjectNode output = JsonNodeFactory.instance.objectNode().put("sha", "abc");
        ResolutionContext context = ResolutionContext.builder().nodeOutput("fetch", output).build();

        output.put("sha", "changed");

        assertThat(context.value("fetch").get("sha").asText()).isEqualTo("abc");
    }
}
