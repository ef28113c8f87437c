package io.lambdabridge.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import io.lambdabridge.core.config.BridgeConfig;
import io.lambdabridge.core.error.BridgeConfigException;
import io.lambdabridge.core.error.MalformedEventException;
import io.lambdabridge.core.error.UnsupportedMethodException;
import io.lambdabridge.core.model.CanonicalRequest;
import io.lambdabridge.core.model.CanonicalResponse;
import io.lambdabridge.core.model.HttpMethod;
import io.lambdabridge.core.spi.HttpApplication;
import io.lambdabridge.core.testkit.EventFixtures;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** End-to-end tests for {@link InvocationOrchestrator}: event in, encoded response out. */
class InvocationOrchestratorTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger orchestratorLogger;

    /** Records each request and echoes the path. */
    private final List<CanonicalRequest> seen = new ArrayList<>();

    private final HttpApplication echo = request -> {
        seen.add(request);
        return CanonicalResponse.builder(200)
                .contentType("text/plain")
                .body(request.method() + " " + request.path())
                .build();
    };

    @BeforeEach
    void setUp() {
        orchestratorLogger = (Logger) LoggerFactory.getLogger(InvocationOrchestrator.class);
        // Snapshot the MDC at log time; it is cleared before the assertions run.
        logAppender = new ListAppender<>() {
            @Override
            protected void append(ILoggingEvent event) {
                event.prepareForDeferredProcessing();
                super.append(event);
            }
        };
        logAppender.start();
        orchestratorLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        orchestratorLogger.detachAppender(logAppender);
        MDC.clear();
    }

    @Nested
    @DisplayName("Happy path")
    class HappyPath {

        @Test
        @DisplayName("/stage/hello reaches the application as /hello")
        void stageHello() throws Exception {
            InvocationOrchestrator orchestrator = new InvocationOrchestrator(echo);

            JsonNode out = orchestrator.invoke(EventFixtures.tree("rest-proxy-stage-hello.json"));

            assertThat(seen).singleElement().satisfies(request -> {
                assertThat(request.method()).isEqualTo(HttpMethod.GET);
                assertThat(request.path()).isEqualTo("/hello");
                assertThat(request.headers().entries()).containsExactly(Map.entry("Accept", "text/plain"));
            });
            assertThat(out.get("statusCode").intValue()).isEqualTo(200);
            assertThat(out.get("body").asText()).isEqualTo("GET /hello");
            assertThat(out.get("isBase64Encoded").booleanValue()).isFalse();
        }

        @Test
        @DisplayName("Base path detection off → full path reaches the application")
        void basePathDisabled() throws Exception {
            BridgeConfig config = BridgeConfig.builder().includeBasePath(false).build();
            InvocationOrchestrator orchestrator = new InvocationOrchestrator(echo, config);

            JsonNode out = orchestrator.invoke(EventFixtures.tree("rest-proxy-stage-hello.json"));

            assertThat(out.get("body").asText()).isEqualTo("GET /stage/hello");
        }

        @Test
        @DisplayName("PNG response → base64 body with flag")
        void pngResponse() throws Exception {
            byte[] png = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};
            HttpApplication app = request -> CanonicalResponse.builder(200)
                    .contentType("image/png")
                    .body(png)
                    .build();

            JsonNode out = new InvocationOrchestrator(app).invoke(EventFixtures.tree("http-api-v2.json"));

            assertThat(out.get("isBase64Encoded").booleanValue()).isTrue();
            assertThat(Base64.getDecoder().decode(out.get("body").asText())).isEqualTo(png);
        }

        @Test
        @DisplayName("Stream variant writes the encoded JSON")
        void streams() throws Exception {
            InvocationOrchestrator orchestrator = new InvocationOrchestrator(echo);
            ByteArrayOutputStream output = new ByteArrayOutputStream();

            orchestrator.invoke(new ByteArrayInputStream(EventFixtures.bytes("alb.json")), output);

            JsonNode out = EventFixtures.JSON.readTree(output.toByteArray());
            assertThat(out.get("statusDescription").asText()).isEqualTo("200 OK");
            assertThat(out.get("body").asText()).isEqualTo("GET /path/");
        }

        @Test
        @DisplayName("Load balancer multi-value event → multi-value response")
        void loadBalancerMultiValue() throws Exception {
            byte[] out = new InvocationOrchestrator(echo).invoke(EventFixtures.bytes("alb-multi-value.json"));

            JsonNode json = EventFixtures.JSON.readTree(out);
            assertThat(json.has("multiValueHeaders")).isTrue();
            assertThat(json.has("headers")).isFalse();
            assertThat(new String(out, StandardCharsets.UTF_8)).contains("\"DELETE /things\"");
        }

        @Test
        @DisplayName("Query multiplicity survives the round trip into the application")
        void queryMultiplicity() throws Exception {
            new InvocationOrchestrator(echo).invoke(EventFixtures.tree("http-api-v2.json"));

            assertThat(seen).singleElement().satisfies(request -> assertThat(request.pathAndQuery())
                    .isEqualTo("/orders/7?tag=a&tag=b&q=hello%20world"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Malformed event never reaches the application")
        void malformedNeverCallsApplication() throws Exception {
            HttpApplication app = mock(HttpApplication.class);
            InvocationOrchestrator orchestrator = new InvocationOrchestrator(app);

            assertThatThrownBy(() -> orchestrator.invoke("{\"foo\":1}".getBytes(StandardCharsets.UTF_8)))
                    .isInstanceOf(MalformedEventException.class);
            verify(app, never()).handle(any());
        }

        @Test
        @DisplayName("Unsupported method never reaches the application")
        void unsupportedMethodNeverCallsApplication() throws Exception {
            HttpApplication app = mock(HttpApplication.class);
            var tree = EventFixtures.tree("alb.json");
            tree.put("httpMethod", "BREW");

            assertThatThrownBy(() -> new InvocationOrchestrator(app).invoke(tree))
                    .isInstanceOf(UnsupportedMethodException.class);
            verify(app, never()).handle(any());
        }

        @Test
        @DisplayName("Application exception propagates as the same instance")
        void applicationExceptionPropagates() throws Exception {
            IOException failure = new IOException("database down");
            HttpApplication app = mock(HttpApplication.class);
            when(app.handle(any())).thenThrow(failure);

            assertThatThrownBy(() -> new InvocationOrchestrator(app).invoke(EventFixtures.tree("alb.json")))
                    .isSameAs(failure);
        }

        @Test
        void nullResponseIsRejected() {
            HttpApplication app = request -> null;

            assertThatThrownBy(() -> new InvocationOrchestrator(app).invoke(EventFixtures.tree("alb.json")))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void missingApplicationIsSetupError() {
            assertThatThrownBy(() -> new InvocationOrchestrator(null)).isInstanceOf(BridgeConfigException.class);
        }

        @Test
        void missingConfigIsSetupError() {
            assertThatThrownBy(() -> new InvocationOrchestrator(echo, null))
                    .isInstanceOf(BridgeConfigException.class);
        }
    }

    @Nested
    @DisplayName("Logging and trace context")
    class Logging {

        @Test
        @DisplayName("One INFO line per completed invocation with request id and trace id in MDC")
        void completedLine() throws Exception {
            new InvocationOrchestrator(echo).invoke(EventFixtures.tree("rest-proxy-default-host.json"));

            List<ILoggingEvent> completed = logAppender.list.stream()
                    .filter(e -> e.getFormattedMessage().startsWith("invocation.completed"))
                    .toList();
            assertThat(completed).singleElement().satisfies(event -> {
                assertThat(event.getLevel()).isEqualTo(Level.INFO);
                assertThat(event.getFormattedMessage())
                        .contains("event_kind=REST_PROXY")
                        .contains("method=GET")
                        .contains("path=/path/")
                        .contains("status=200")
                        .contains("base64=false")
                        .contains("duration_ms=");
                assertThat(event.getMDCPropertyMap())
                        .containsEntry("requestId", "c6af9ac6-7b61-11e6-9a41-93e8deadbeef")
                        .containsEntry("traceId", "Root=1-5e1b4151-5ac6c58f5b5daa6532e4f2e8");
            });
        }

        @Test
        @DisplayName("MDC is cleared after the invocation, also on failure")
        void mdcCleared() throws Exception {
            new InvocationOrchestrator(echo).invoke(EventFixtures.tree("http-api-v2.json"));
            assertThat(MDC.get("requestId")).isNull();
            assertThat(MDC.get("traceId")).isNull();

            HttpApplication failing = request -> {
                throw new IllegalStateException("boom");
            };
            assertThatThrownBy(() -> new InvocationOrchestrator(failing).invoke(EventFixtures.tree("http-api-v2.json")))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(MDC.get("requestId")).isNull();
            assertThat(MDC.get("traceId")).isNull();
        }

        @Test
        @DisplayName("Events without ids leave the MDC keys absent")
        void noIds() throws Exception {
            new InvocationOrchestrator(echo).invoke(EventFixtures.tree("alb-multi-value.json"));

            assertThat(logAppender.list)
                    .filteredOn(e -> e.getFormattedMessage().startsWith("invocation.completed"))
                    .singleElement()
                    .satisfies(event -> assertThat(event.getMDCPropertyMap())
                            .doesNotContainKey("requestId")
                            .doesNotContainKey("traceId"));
        }
    }
}
