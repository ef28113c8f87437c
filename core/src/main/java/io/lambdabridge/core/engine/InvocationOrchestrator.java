package io.lambdabridge.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lambdabridge.core.config.BridgeConfig;
import io.lambdabridge.core.error.BridgeConfigException;
import io.lambdabridge.core.error.InvalidEventException;
import io.lambdabridge.core.event.EventParser;
import io.lambdabridge.core.event.HttpApiEvent;
import io.lambdabridge.core.event.InvocationEvent;
import io.lambdabridge.core.event.LoadBalancerEvent;
import io.lambdabridge.core.event.RestProxyEvent;
import io.lambdabridge.core.model.BasePath;
import io.lambdabridge.core.model.CanonicalRequest;
import io.lambdabridge.core.model.CanonicalResponse;
import io.lambdabridge.core.spi.HttpApplication;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one invocation end to end: parse the event, resolve the base path, build the canonical
 * request, call the application and encode its response in the shape of the originating event.
 *
 * <p>
 * Event problems ({@link InvalidEventException}) surface before the application is called and
 * are never retried. Whatever the application throws propagates unchanged, the same instance.
 * No HTTP error response is ever substituted.
 *
 * <p>
 * For the duration of an invocation the MDC carries {@code requestId} (the gateway request id)
 * and {@code traceId} (the {@code X-Amzn-Trace-Id} header) when the event has them.
 *
 * <p>
 * Immutable after construction and safe to call concurrently.
 */
public final class InvocationOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(InvocationOrchestrator.class);

    /** MDC key for the gateway request id. */
    static final String MDC_REQUEST_ID = "requestId";
    /** MDC key for the tracing header. */
    static final String MDC_TRACE_ID = "traceId";

    private static final String TRACE_HEADER = "X-Amzn-Trace-Id";

    private final HttpApplication application;
    private final BridgeConfig config;
    private final ObjectMapper mapper;
    private final EventParser parser;
    private final ResponseEncoder encoder;

    public InvocationOrchestrator(HttpApplication application) {
        this(application, BridgeConfig.DEFAULTS);
    }

    public InvocationOrchestrator(HttpApplication application, BridgeConfig config) {
        this(application, config, new ObjectMapper());
    }

    /**
     * @throws BridgeConfigException if the application or the configuration is missing
     */
    public InvocationOrchestrator(HttpApplication application, BridgeConfig config, ObjectMapper mapper) {
        if (application == null) {
            throw new BridgeConfigException("No HTTP application configured");
        }
        if (config == null) {
            throw new BridgeConfigException("No bridge configuration supplied");
        }
        this.application = application;
        this.config = config;
        this.mapper = mapper != null ? mapper : new ObjectMapper();
        this.parser = new EventParser(this.mapper);
        this.encoder = new ResponseEncoder(config);
    }

    public BridgeConfig config() {
        return config;
    }

    /**
     * Handles a raw event stream and writes the encoded response to {@code output}.
     *
     * @throws IOException if reading the event or writing the response fails
     * @throws Exception   whatever the application throws, unchanged
     */
    public void invoke(InputStream input, OutputStream output) throws Exception {
        byte[] response = invoke(input.readAllBytes());
        output.write(response);
        output.flush();
    }

    /**
     * Handles raw event bytes.
     *
     * @return the encoded response as UTF-8 JSON bytes
     * @throws InvalidEventException if the bytes are not a known event
     * @throws Exception             whatever the application throws, unchanged
     */
    public byte[] invoke(byte[] rawEvent) throws Exception {
        InvocationEvent event = parser.parse(rawEvent);
        return mapper.writeValueAsBytes(invoke(event));
    }

    /**
     * Handles an event that is already a JSON tree.
     *
     * @return the encoded response
     * @throws InvalidEventException if the tree is not a known event
     * @throws Exception             whatever the application throws, unchanged
     */
    public JsonNode invoke(JsonNode rawEvent) throws Exception {
        return invoke(parser.parse(rawEvent));
    }

    private JsonNode invoke(InvocationEvent event) throws Exception {
        setTraceContext(event);
        try {
            return invokeInternal(event);
        } finally {
            clearTraceContext();
        }
    }

    private JsonNode invokeInternal(InvocationEvent event) throws Exception {
        long startNanos = System.nanoTime();
        BasePath basePath = BasePathResolver.resolve(event, config);
        CanonicalRequest request = CanonicalRequestBuilder.build(event, basePath);
        LOG.debug(
                "invocation.request event_kind={} method={} path={} base_path={} query_count={} header_count={} body_bytes={}",
                event.kind(),
                request.method(),
                request.path(),
                basePath.value(),
                request.queryParameters().size(),
                request.headers().size(),
                request.body().size());

        CanonicalResponse response = application.handle(request);
        if (response == null) {
            throw new IllegalStateException("HTTP application returned no response for "
                    + request.method() + " " + request.path());
        }

        JsonNode encoded = encoder.encode(response, ResponseShape.of(event));
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        LOG.info(
                "invocation.completed event_kind={} method={} path={} status={} base64={} duration_ms={}",
                event.kind(),
                request.method(),
                request.path(),
                response.statusCode(),
                encoded.path("isBase64Encoded").asBoolean(),
                durationMs);
        return encoded;
    }

    // --- Trace context ---

    private void setTraceContext(InvocationEvent event) {
        String requestId = event.requestId();
        if (requestId != null && !requestId.isBlank()) {
            MDC.put(MDC_REQUEST_ID, requestId);
        }
        String traceId = traceHeader(event);
        if (traceId != null && !traceId.isBlank()) {
            MDC.put(MDC_TRACE_ID, traceId);
        }
    }

    private void clearTraceContext() {
        MDC.remove(MDC_REQUEST_ID);
        MDC.remove(MDC_TRACE_ID);
    }

    private static String traceHeader(InvocationEvent event) {
        return switch (event.kind()) {
            case REST_PROXY -> {
                RestProxyEvent rest = (RestProxyEvent) event;
                String multi = firstMulti(rest.multiValueHeaders());
                yield multi != null ? multi : single(rest.headers());
            }
            case HTTP_API -> single(((HttpApiEvent) event).headers());
            case LOAD_BALANCER_TARGET -> {
                LoadBalancerEvent lb = (LoadBalancerEvent) event;
                String multi = firstMulti(lb.multiValueHeaders());
                yield multi != null ? multi : single(lb.headers());
            }
        };
    }

    private static String single(Map<String, String> headers) {
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (TRACE_HEADER.equalsIgnoreCase(header.getKey())) {
                return header.getValue();
            }
        }
        return null;
    }

    private static String firstMulti(Map<String, List<String>> headers) {
        for (Map.Entry<String, List<String>> header : headers.entrySet()) {
            if (TRACE_HEADER.equalsIgnoreCase(header.getKey()) && !header.getValue().isEmpty()) {
                return header.getValue().get(0);
            }
        }
        return null;
    }
}
