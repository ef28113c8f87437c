package io.lambdabridge.core.engine;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lambdabridge.core.config.BridgeConfig;
import io.lambdabridge.core.event.EventKind;
import io.lambdabridge.core.model.CanonicalResponse;
import io.lambdabridge.core.model.HttpHeaders;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes a {@link CanonicalResponse} into the JSON shape the invocation source expects.
 *
 * <table>
 * <caption>Output fields per kind</caption>
 * <tr><th>Kind</th><th>Fields</th></tr>
 * <tr><td>REST proxy</td><td>{@code statusCode}, {@code headers} or, when a header name
 * repeats, {@code multiValueHeaders}, {@code body}, {@code isBase64Encoded}</td></tr>
 * <tr><td>HTTP API</td><td>{@code statusCode}, {@code headers}, {@code cookies} (every
 * {@code Set-Cookie} value), {@code body}, {@code isBase64Encoded}</td></tr>
 * <tr><td>Load balancer</td><td>{@code statusCode}, {@code statusDescription},
 * {@code multiValueHeaders} or {@code headers} depending on the target group setting,
 * {@code body}, {@code isBase64Encoded}</td></tr>
 * </table>
 *
 * <p>
 * Where only a single-value {@code headers} map is available the last value of a repeated name
 * wins; the dropped values are logged at DEBUG. Thread-safe.
 */
public final class ResponseEncoder {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseEncoder.class);

    private static final String SET_COOKIE = "Set-Cookie";

    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(100, "Continue"),
            Map.entry(101, "Switching Protocols"),
            Map.entry(200, "OK"),
            Map.entry(201, "Created"),
            Map.entry(202, "Accepted"),
            Map.entry(203, "Non-Authoritative Information"),
            Map.entry(204, "No Content"),
            Map.entry(205, "Reset Content"),
            Map.entry(206, "Partial Content"),
            Map.entry(300, "Multiple Choices"),
            Map.entry(301, "Moved Permanently"),
            Map.entry(302, "Found"),
            Map.entry(303, "See Other"),
            Map.entry(304, "Not Modified"),
            Map.entry(307, "Temporary Redirect"),
            Map.entry(308, "Permanent Redirect"),
            Map.entry(400, "Bad Request"),
            Map.entry(401, "Unauthorized"),
            Map.entry(402, "Payment Required"),
            Map.entry(403, "Forbidden"),
            Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"),
            Map.entry(406, "Not Acceptable"),
            Map.entry(407, "Proxy Authentication Required"),
            Map.entry(408, "Request Timeout"),
            Map.entry(409, "Conflict"),
            Map.entry(410, "Gone"),
            Map.entry(411, "Length Required"),
            Map.entry(412, "Precondition Failed"),
            Map.entry(413, "Payload Too Large"),
            Map.entry(414, "URI Too Long"),
            Map.entry(415, "Unsupported Media Type"),
            Map.entry(416, "Range Not Satisfiable"),
            Map.entry(417, "Expectation Failed"),
            Map.entry(418, "I'm a teapot"),
            Map.entry(422, "Unprocessable Entity"),
            Map.entry(425, "Too Early"),
            Map.entry(426, "Upgrade Required"),
            Map.entry(428, "Precondition Required"),
            Map.entry(429, "Too Many Requests"),
            Map.entry(431, "Request Header Fields Too Large"),
            Map.entry(451, "Unavailable For Legal Reasons"),
            Map.entry(500, "Internal Server Error"),
            Map.entry(501, "Not Implemented"),
            Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"),
            Map.entry(504, "Gateway Timeout"),
            Map.entry(505, "HTTP Version Not Supported"),
            Map.entry(511, "Network Authentication Required"));

    private final BinaryBodyPolicy binaryPolicy;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ResponseEncoder(BridgeConfig config) {
        this(new BinaryBodyPolicy(config));
    }

    public ResponseEncoder(BinaryBodyPolicy binaryPolicy) {
        this.binaryPolicy = Objects.requireNonNull(binaryPolicy, "binaryPolicy must not be null");
    }

    /** Encodes for a kind using its default shape (single-value headers for load balancers). */
    public ObjectNode encode(CanonicalResponse response, EventKind kind) {
        return encode(response, ResponseShape.defaultFor(kind));
    }

    /**
     * Encodes a response.
     *
     * @param response the application's response
     * @param shape    the shape derived from the originating event
     * @return the response object to hand back to the runtime
     */
    public ObjectNode encode(CanonicalResponse response, ResponseShape shape) {
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        ObjectNode out = nodes.objectNode();
        out.put("statusCode", response.statusCode());
        HttpHeaders headers = response.headers();
        EventKind kind = shape.kind();
        switch (kind) {
            case REST_PROXY -> {
                if (headers.hasDuplicateNames()) {
                    out.set("multiValueHeaders", multiValueHeaders(headers));
                } else {
                    out.set("headers", singleValueHeaders(headers, kind));
                }
            }
            case HTTP_API -> {
                HttpHeaders withoutCookies = headers.toBuilder().remove(SET_COOKIE).build();
                out.set("headers", singleValueHeaders(withoutCookies, kind));
                List<String> cookies = headers.all(SET_COOKIE);
                if (!cookies.isEmpty()) {
                    ArrayNode array = out.putArray("cookies");
                    cookies.forEach(array::add);
                }
            }
            case LOAD_BALANCER_TARGET -> {
                out.put("statusDescription", statusDescription(response.statusCode()));
                if (shape.multiValueHeaders()) {
                    out.set("multiValueHeaders", multiValueHeaders(headers));
                } else {
                    out.set("headers", singleValueHeaders(headers, kind));
                }
            }
            default -> throw new IllegalStateException("Unhandled event kind: " + kind);
        }
        boolean base64 = binaryPolicy.shouldEncode(response.contentType(), response.body());
        if (response.body().isEmpty()) {
            out.put("body", "");
        } else if (base64) {
            out.put("body", Base64.getEncoder().encodeToString(response.body().content()));
        } else {
            out.put("body", response.body().asString());
        }
        out.put("isBase64Encoded", base64);
        return out;
    }

    /** Load balancer status line text, e.g. {@code "404 Not Found"}. Unknown codes get the bare number. */
    static String statusDescription(int statusCode) {
        String reason = REASON_PHRASES.get(statusCode);
        return reason != null ? statusCode + " " + reason : String.valueOf(statusCode);
    }

    private ObjectNode singleValueHeaders(HttpHeaders headers, EventKind kind) {
        if (LOG.isDebugEnabled() && headers.hasDuplicateNames()) {
            headers.toMultiValueMap().forEach((name, values) -> {
                if (values.size() > 1) {
                    LOG.debug(
                            "response.header_dropped event_kind={} name={} kept_last=true dropped_count={}",
                            kind,
                            name,
                            values.size() - 1);
                }
            });
        }
        ObjectNode node = nodes.objectNode();
        headers.toSingleValueMap().forEach(node::put);
        return node;
    }

    private ObjectNode multiValueHeaders(HttpHeaders headers) {
        ObjectNode node = nodes.objectNode();
        headers.toMultiValueMap().forEach((name, values) -> {
            ArrayNode array = node.putArray(name);
            values.forEach(array::add);
        });
        return node;
    }
}
