package io.lambdabridge.core.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.lambdabridge.core.error.MalformedEventException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a raw invocation payload into one {@link InvocationEvent} variant.
 *
 * <p>
 * Detection order:
 * <ol>
 * <li>{@code requestContext.elb} present → {@link LoadBalancerEvent}</li>
 * <li>{@code version} is {@code "2.0"} → {@link HttpApiEvent}</li>
 * <li>top-level {@code httpMethod} present → {@link RestProxyEvent} (also covers HTTP API
 * payload format 1.0, which shares the REST proxy shape)</li>
 * </ol>
 * Anything else, and any required field that is missing or has the wrong JSON type, raises
 * {@link MalformedEventException}. JSON {@code null} for an optional field counts as absent.
 *
 * <p>
 * Field names are matched case-sensitively. Thread-safe and side-effect free.
 */
public final class EventParser {

    private static final Logger LOG = LoggerFactory.getLogger(EventParser.class);

    /** Payload version that identifies an HTTP API 2.0 event. */
    static final String HTTP_API_VERSION = "2.0";

    private final ObjectMapper mapper;

    public EventParser() {
        this(new ObjectMapper());
    }

    public EventParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parses raw JSON bytes.
     *
     * @throws MalformedEventException if the bytes are not JSON or match no known event shape
     */
    public InvocationEvent parse(byte[] rawJson) {
        if (rawJson == null || rawJson.length == 0) {
            throw new MalformedEventException("Invocation payload is empty", null, null);
        }
        try {
            return parse(mapper.readTree(rawJson));
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Invocation payload is not valid JSON: " + e.getOriginalMessage(), e, null, null);
        } catch (IOException e) {
            throw new MalformedEventException("Invocation payload could not be read", e, null, null);
        }
    }

    /**
     * Parses raw JSON text.
     *
     * @throws MalformedEventException if the text is not JSON or matches no known event shape
     */
    public InvocationEvent parse(String rawJson) {
        if (rawJson == null || rawJson.isBlank()) {
            throw new MalformedEventException("Invocation payload is empty", null, null);
        }
        try {
            return parse(mapper.readTree(rawJson));
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Invocation payload is not valid JSON: " + e.getOriginalMessage(), e, null, null);
        }
    }

    /**
     * Detects the event shape and maps it to its variant.
     *
     * @param root the parsed payload
     * @return the typed event
     * @throws MalformedEventException if no known shape matches or a field is ill-typed
     */
    public InvocationEvent parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedEventException("Invocation payload must be a JSON object", null, null);
        }
        JsonNode requestContext = root.path("requestContext");
        InvocationEvent event;
        if (requestContext.isObject() && requestContext.has("elb")) {
            event = parseLoadBalancer(root);
        } else if (HTTP_API_VERSION.equals(root.path("version").asText(null))) {
            event = parseHttpApi(root);
        } else if (root.has("httpMethod")) {
            event = parseRestProxy(root);
        } else {
            throw new MalformedEventException(
                    "Unrecognized event: expected 'httpMethod', 'version: 2.0' or 'requestContext.elb'",
                    null,
                    null);
        }
        LOG.debug("Parsed {} event: {} {}", event.kind(), event.httpMethod(), event.rawPath());
        return event;
    }

    private RestProxyEvent parseRestProxy(JsonNode root) {
        EventKind kind = EventKind.REST_PROXY;
        JsonNode ctx = object(root, "requestContext", "requestContext", kind);
        JsonNode identity = object(ctx, "identity", "requestContext.identity", kind);
        return new RestProxyEvent(
                requiredText(root, "httpMethod", "httpMethod", kind),
                requiredText(root, "path", "path", kind),
                optionalText(root, "resource", "resource", kind),
                optionalText(ctx, "stage", "requestContext.stage", kind),
                stringMap(root, "pathParameters", kind),
                stringMap(root, "headers", kind),
                multiMap(root, "multiValueHeaders", kind),
                stringMap(root, "queryStringParameters", kind),
                multiMap(root, "multiValueQueryStringParameters", kind),
                optionalText(root, "body", "body", kind),
                optionalBoolean(root, "isBase64Encoded", kind),
                optionalText(identity, "sourceIp", "requestContext.identity.sourceIp", kind),
                optionalText(ctx, "requestId", "requestContext.requestId", kind),
                optionalText(ctx, "domainName", "requestContext.domainName", kind));
    }

    private HttpApiEvent parseHttpApi(JsonNode root) {
        EventKind kind = EventKind.HTTP_API;
        JsonNode ctx = object(root, "requestContext", "requestContext", kind);
        if (ctx.isMissingNode()) {
            throw new MalformedEventException("HTTP API event has no requestContext", "requestContext", kind);
        }
        JsonNode http = object(ctx, "http", "requestContext.http", kind);
        return new HttpApiEvent(
                requiredText(root, "version", "version", kind),
                optionalText(root, "routeKey", "routeKey", kind),
                requiredText(http, "method", "requestContext.http.method", kind),
                requiredText(root, "rawPath", "rawPath", kind),
                optionalText(root, "rawQueryString", "rawQueryString", kind),
                optionalText(ctx, "stage", "requestContext.stage", kind),
                stringMap(root, "pathParameters", kind),
                stringList(root, "cookies", kind),
                stringMap(root, "headers", kind),
                stringMap(root, "queryStringParameters", kind),
                optionalText(root, "body", "body", kind),
                optionalBoolean(root, "isBase64Encoded", kind),
                optionalText(http, "sourceIp", "requestContext.http.sourceIp", kind),
                optionalText(ctx, "requestId", "requestContext.requestId", kind),
                optionalText(ctx, "domainName", "requestContext.domainName", kind));
    }

    private LoadBalancerEvent parseLoadBalancer(JsonNode root) {
        EventKind kind = EventKind.LOAD_BALANCER_TARGET;
        JsonNode elb = object(root.path("requestContext"), "elb", "requestContext.elb", kind);
        boolean multiValue = isPresent(root.get("multiValueHeaders"))
                || isPresent(root.get("multiValueQueryStringParameters"));
        return new LoadBalancerEvent(
                requiredText(root, "httpMethod", "httpMethod", kind),
                requiredText(root, "path", "path", kind),
                optionalText(elb, "targetGroupArn", "requestContext.elb.targetGroupArn", kind),
                stringMap(root, "headers", kind),
                multiMap(root, "multiValueHeaders", kind),
                stringMap(root, "queryStringParameters", kind),
                multiMap(root, "multiValueQueryStringParameters", kind),
                optionalText(root, "body", "body", kind),
                optionalBoolean(root, "isBase64Encoded", kind),
                multiValue);
    }

    // --- Field helpers ---

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    /** Returns the child object, or a missing node when absent or {@code null}. */
    private static JsonNode object(JsonNode parent, String field, String path, EventKind kind) {
        JsonNode node = parent.get(field);
        if (!isPresent(node)) {
            return MissingNode.getInstance();
        }
        if (!node.isObject()) {
            throw new MalformedEventException("'" + path + "' must be an object", path, kind);
        }
        return node;
    }

    private static String requiredText(JsonNode parent, String field, String path, EventKind kind) {
        String value = optionalText(parent, field, path, kind);
        if (value == null) {
            throw new MalformedEventException("Required field '" + path + "' is missing", path, kind);
        }
        return value;
    }

    private static String optionalText(JsonNode parent, String field, String path, EventKind kind) {
        JsonNode node = parent.get(field);
        if (!isPresent(node)) {
            return null;
        }
        if (!node.isTextual()) {
            throw new MalformedEventException(
                    "'" + path + "' must be a string, got " + node.getNodeType(), path, kind);
        }
        return node.textValue();
    }

    private static boolean optionalBoolean(JsonNode parent, String field, EventKind kind) {
        JsonNode node = parent.get(field);
        if (!isPresent(node)) {
            return false;
        }
        if (!node.isBoolean()) {
            throw new MalformedEventException(
                    "'" + field + "' must be a boolean, got " + node.getNodeType(), field, kind);
        }
        return node.booleanValue();
    }

    /** Reads a {@code {name: string}} object, keeping order and skipping {@code null} values. */
    private static Map<String, String> stringMap(JsonNode parent, String field, EventKind kind) {
        JsonNode node = parent.get(field);
        if (!isPresent(node)) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new MalformedEventException(
                    "'" + field + "' must be an object, got " + node.getNodeType(), field, kind);
        }
        Map<String, String> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (value.isNull()) {
                continue;
            }
            if (!value.isTextual()) {
                String path = field + "." + entry.getKey();
                throw new MalformedEventException("'" + path + "' must be a string", path, kind);
            }
            result.put(entry.getKey(), value.textValue());
        }
        return Collections.unmodifiableMap(result);
    }

    /** Reads a {@code {name: [string]}} object, keeping order and skipping {@code null}s. */
    private static Map<String, List<String>> multiMap(JsonNode parent, String field, EventKind kind) {
        JsonNode node = parent.get(field);
        if (!isPresent(node)) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new MalformedEventException(
                    "'" + field + "' must be an object, got " + node.getNodeType(), field, kind);
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String path = field + "." + entry.getKey();
            JsonNode values = entry.getValue();
            if (values.isNull()) {
                continue;
            }
            if (!values.isArray()) {
                throw new MalformedEventException("'" + path + "' must be an array of strings", path, kind);
            }
            result.put(entry.getKey(), textElements(values, path, kind));
        }
        return Collections.unmodifiableMap(result);
    }

    private static List<String> stringList(JsonNode parent, String field, EventKind kind) {
        JsonNode node = parent.get(field);
        if (!isPresent(node)) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new MalformedEventException("'" + field + "' must be an array of strings", field, kind);
        }
        return textElements(node, field, kind);
    }

    private static List<String> textElements(JsonNode array, String path, EventKind kind) {
        List<String> values = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (element.isNull()) {
                continue;
            }
            if (!element.isTextual()) {
                throw new MalformedEventException("'" + path + "' must contain only strings", path, kind);
            }
            values.add(element.textValue());
        }
        return Collections.unmodifiableList(values);
    }
}
