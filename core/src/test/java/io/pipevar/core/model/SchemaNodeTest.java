package io.pipevar.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link SchemaNode} construction rules and summaries. */
class SchemaNodeTest {

    @Test
    void enumIsRejectedOnContainerTypes() {
        assertThatThrownBy(() -> new SchemaNode(SchemaType.ARRAY, null, List.of(IntNode.valueOf(1)), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void itemsAndPropertiesRejectedOnOtherTypes() {
        assertThatThrownBy(() -> new SchemaNode(SchemaType.STRING, null, null, SchemaNode.string(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SchemaNode(SchemaType.ARRAY, null, null, null, Map.of("a", SchemaNode.string())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullFieldsNormaliseToEmpty() {
        SchemaNode node = SchemaNode.string();

        assertThat(node.description()).isEmpty();
        assertThat(node.enumValues()).isEmpty();
        assertThat(node.propertySchemas()).isEmpty();
        assertThat(node.itemSchema()).isNull();
        assertThat(node).isEqualTo(new SchemaNode(SchemaType.STRING, "", List.of(), null, Map.of()));
    }

    @Test
    void propertyOrderIsPreserved() {
        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        properties.put("timeout", SchemaNode.integer());
        properties.put("branch", SchemaNode.string());

        assertThat(SchemaNode.object(properties).propertySchemas().keySet()).containsExactly("timeout", "branch");
    }

    @Test
    void summaryDescribesTypeShape() {
        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        properties.put("branch", SchemaNode.string());
        properties.put("timeout", SchemaNode.integer());

        assertThat(SchemaNode.arrayOf(SchemaNode.floating()).summary()).isEqualTo("array<float>");
        assertThat(SchemaNode.arrayOf(null).summary()).isEqualTo("array");
        assertThat(SchemaNode.object(properties).summary()).isEqualTo("object{branch, timeout}");
        assertThat(SchemaNode.anyObject().summary()).isEqualTo("object");
        assertThat(SchemaNode.string().withEnum(List.of(TextNode.valueOf("a"), TextNode.valueOf("b"))).summary())
                .isEqualTo("string enum[\"a\", \"b\"]");
    }
}
