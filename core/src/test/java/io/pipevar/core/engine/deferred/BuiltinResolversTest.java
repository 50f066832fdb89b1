package io.pipevar.core.engine.deferred;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pipevar.core.spi.DeferredResolver;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the {@code timestamp}, {@code env} and {@code json} resolvers. */
@DisplayName("BuiltinResolvers")
class BuiltinResolversTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Nested
    @DisplayName("timestamp")
    class Timestamp {

        private final DeferredResolver resolver = BuiltinResolvers.timestamp(
                Clock.fixed(Instant.parse("2026-01-01T09:30:00Z"), ZoneOffset.UTC));

        @Test
        @DisplayName("appends a UTC stamp to the seed")
        void appendsStamp() {
            assertThat(resolver.resolve(TextNode.valueOf("release")).asText()).isEqualTo("release_20260101093000");
        }

        @Test
        @DisplayName("empty or null seed yields the stamp alone")
        void emptySeed() {
            assertThat(resolver.resolve(TextNode.valueOf("")).asText()).isEqualTo("20260101093000");
            assertThat(resolver.resolve(NullNode.getInstance()).asText()).isEqualTo("20260101093000");
        }

        @Test
        void rejectsNonStringSeed() {
            assertThatThrownBy(() -> resolver.resolve(IntNode.valueOf(1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("env")
    class Env {

        private final DeferredResolver resolver = BuiltinResolvers.env(Map.of("HOME", "/home/ada")::get);

        @Test
        void readsVariable() {
            assertThat(resolver.resolve(TextNode.valueOf("HOME")).asText()).isEqualTo("/home/ada");
        }

        @Test
        @DisplayName("falls back to the declared default")
        void fallback() throws Exception {
            JsonNode seed = JSON.readTree("{\"name\":\"PORT\",\"default\":8080}");

            assertThat(resolver.resolve(seed)).isEqualTo(IntNode.valueOf(8080));
        }

        @Test
        @DisplayName("a missing variable without default fails")
        void missing() {
            assertThatThrownBy(() -> resolver.resolve(TextNode.valueOf("PORT")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'PORT'");
        }
    }

    @Nested
    @DisplayName("json")
    class Json {

        @Test
        void parsesText() throws Exception {
            assertThat(BuiltinResolvers.json().resolve(TextNode.valueOf("{\"a\":[1,2]}")))
                    .isEqualTo(JSON.readTree("{\"a\":[1,2]}"));
        }

        @Test
        void rejectsInvalidText() {
            assertThatThrownBy(() -> BuiltinResolvers.json().resolve(TextNode.valueOf("{broken")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("not valid JSON");
        }
    }
}
