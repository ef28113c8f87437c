package io.lambdabridge.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lambdabridge.core.config.BridgeConfig;
import io.lambdabridge.core.event.EventKind;
import io.lambdabridge.core.event.InvocationEvent;
import io.lambdabridge.core.model.CanonicalResponse;
import io.lambdabridge.core.testkit.EventFixtures;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link ResponseEncoder}. */
class ResponseEncoderTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 13};

    private final ResponseEncoder encoder = new ResponseEncoder(BridgeConfig.DEFAULTS);

    private static CanonicalResponse withRepeatedHeader() {
        return CanonicalResponse.builder(200)
                .contentType("text/plain")
                .header("Set-Cookie", "a=1")
                .header("Set-Cookie", "b=2")
                .header("X-Trace", "t")
                .body("ok")
                .build();
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(node -> values.add(node.asText()));
        return values;
    }

    @Nested
    @DisplayName("Body")
    class Body {

        @Test
        @DisplayName("image/png bytes → base64 with flag set")
        void pngExample() {
            CanonicalResponse response = CanonicalResponse.builder(200)
                    .contentType("image/png")
                    .body(PNG)
                    .build();

            ObjectNode out = encoder.encode(response, EventKind.REST_PROXY);

            assertThat(out.get("isBase64Encoded").booleanValue()).isTrue();
            assertThat(out.get("body").asText()).isEqualTo(Base64.getEncoder().encodeToString(PNG));
            assertThat(Base64.getDecoder().decode(out.get("body").asText())).isEqualTo(PNG);
        }

        @Test
        void textIsLiteral() {
            CanonicalResponse response = CanonicalResponse.builder(200)
                    .contentType("application/json; charset=utf-8")
                    .body("{\"greeting\":\"Grüße\"}")
                    .build();

            ObjectNode out = encoder.encode(response, EventKind.HTTP_API);

            assertThat(out.get("body").asText()).isEqualTo("{\"greeting\":\"Grüße\"}");
            assertThat(out.get("isBase64Encoded").booleanValue()).isFalse();
        }

        @Test
        void emptyBodyIsEmptyStringWithoutFlag() {
            ObjectNode out = encoder.encode(CanonicalResponse.of(204), EventKind.LOAD_BALANCER_TARGET);

            assertThat(out.get("body").asText()).isEmpty();
            assertThat(out.get("isBase64Encoded").booleanValue()).isFalse();
        }
    }

    @Nested
    @DisplayName("REST proxy")
    class RestProxy {

        @Test
        void distinctHeadersUseSingleValueMap() {
            CanonicalResponse response = CanonicalResponse.builder(201)
                    .contentType("text/plain")
                    .header("Location", "/items/1")
                    .body("created")
                    .build();

            ObjectNode out = encoder.encode(response, EventKind.REST_PROXY);

            assertThat(out.get("statusCode").intValue()).isEqualTo(201);
            assertThat(out.get("headers").get("Location").asText()).isEqualTo("/items/1");
            assertThat(out.has("multiValueHeaders")).isFalse();
        }

        @Test
        void repeatedHeadersUseMultiValueMap() {
            ObjectNode out = encoder.encode(withRepeatedHeader(), EventKind.REST_PROXY);

            assertThat(out.has("headers")).isFalse();
            assertThat(texts(out.get("multiValueHeaders").get("Set-Cookie"))).containsExactly("a=1", "b=2");
            assertThat(texts(out.get("multiValueHeaders").get("X-Trace"))).containsExactly("t");
        }
    }

    @Nested
    @DisplayName("HTTP API")
    class HttpApi {

        @Test
        void setCookieGoesToCookiesArray() {
            ObjectNode out = encoder.encode(withRepeatedHeader(), EventKind.HTTP_API);

            assertThat(texts(out.get("cookies"))).containsExactly("a=1", "b=2");
            assertThat(out.get("headers").has("Set-Cookie")).isFalse();
            assertThat(out.get("headers").get("X-Trace").asText()).isEqualTo("t");
        }

        @Test
        void repeatedHeaderIsLastWriteWins() {
            CanonicalResponse response = CanonicalResponse.builder(200)
                    .header("Vary", "Accept")
                    .header("vary", "Origin")
                    .build();

            ObjectNode out = encoder.encode(response, EventKind.HTTP_API);

            assertThat(out.get("headers").get("Vary").asText()).isEqualTo("Origin");
            assertThat(out.has("cookies")).isFalse();
        }
    }

    @Nested
    @DisplayName("Load balancer")
    class LoadBalancer {

        @Test
        void singleValueShapeHasStatusDescription() {
            InvocationEvent event = EventFixtures.event("alb.json");

            ObjectNode out = encoder.encode(withRepeatedHeader(), ResponseShape.of(event));

            assertThat(out.get("statusDescription").asText()).isEqualTo("200 OK");
            assertThat(out.get("headers").get("Set-Cookie").asText()).isEqualTo("b=2");
            assertThat(out.has("multiValueHeaders")).isFalse();
        }

        @Test
        void multiValueShapeKeepsEveryValue() {
            InvocationEvent event = EventFixtures.event("alb-multi-value.json");

            ObjectNode out = encoder.encode(withRepeatedHeader(), ResponseShape.of(event));

            assertThat(texts(out.get("multiValueHeaders").get("Set-Cookie"))).containsExactly("a=1", "b=2");
            assertThat(out.has("headers")).isFalse();
        }

        @ParameterizedTest
        @CsvSource({"200, 200 OK", "404, 404 Not Found", "502, 502 Bad Gateway", "299, 299"})
        void statusDescription(int status, String expected) {
            assertThat(ResponseEncoder.statusDescription(status)).isEqualTo(expected);
        }
    }
}
