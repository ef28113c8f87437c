package io.lambdabridge.core.engine;

import io.lambdabridge.core.error.MalformedEventException;
import io.lambdabridge.core.event.EventKind;
import io.lambdabridge.core.event.HttpApiEvent;
import io.lambdabridge.core.event.InvocationEvent;
import io.lambdabridge.core.event.LoadBalancerEvent;
import io.lambdabridge.core.event.RestProxyEvent;
import io.lambdabridge.core.model.BasePath;
import io.lambdabridge.core.model.CanonicalRequest;
import io.lambdabridge.core.model.HttpHeaders;
import io.lambdabridge.core.model.HttpMethod;
import io.lambdabridge.core.model.MediaType;
import io.lambdabridge.core.model.MessageBody;
import io.lambdabridge.core.model.QueryParameters;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.function.UnaryOperator;

/**
 * Converts a parsed event plus its resolved base path into the {@link CanonicalRequest} the
 * application sees.
 *
 * <p>
 * The base path is stripped as a segment-aligned literal prefix: {@code /prod/hello} with base
 * {@code /prod} becomes {@code /hello}, {@code /prod} alone becomes {@code /}, and a path that
 * does not start with the prefix passes through unchanged. The body is base64-decoded when the
 * event flags it and otherwise taken as the UTF-8 bytes of the string.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class CanonicalRequestBuilder {

    private static final String COOKIE = "cookie";
    private static final String COOKIE_SEPARATOR = "; ";
    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private CanonicalRequestBuilder() {}

    /**
     * Builds the canonical request.
     *
     * @param event    the parsed event
     * @param basePath the resolved base path, {@link BasePath#NONE} for none
     * @return the request, never {@code null}
     * @throws io.lambdabridge.core.error.UnsupportedMethodException if the method is not a known
     *                                                                HTTP verb
     * @throws MalformedEventException                               if the body or query cannot
     *                                                                be decoded
     */
    public static CanonicalRequest build(InvocationEvent event, BasePath basePath) {
        BasePath base = basePath != null ? basePath : BasePath.NONE;
        EventKind kind = event.kind();
        HttpMethod method = HttpMethod.parse(event.httpMethod(), kind);
        String path = stripBasePath(event.rawPath(), base);

        HttpHeaders headers;
        QueryParameters query;
        String remoteAddress;
        switch (kind) {
            case REST_PROXY -> {
                RestProxyEvent rest = (RestProxyEvent) event;
                headers = MultiValueMerger.mergeHeaders(rest.headers(), rest.multiValueHeaders(), kind);
                query = MultiValueMerger.mergeQuery(
                        rest.queryStringParameters(),
                        rest.multiValueQueryStringParameters(),
                        UnaryOperator.identity(),
                        kind);
                remoteAddress = rest.sourceIp();
            }
            case HTTP_API -> {
                HttpApiEvent http = (HttpApiEvent) event;
                headers = httpApiHeaders(http);
                query = httpApiQuery(http);
                remoteAddress = http.sourceIp();
            }
            case LOAD_BALANCER_TARGET -> {
                LoadBalancerEvent lb = (LoadBalancerEvent) event;
                headers = MultiValueMerger.mergeHeaders(lb.headers(), lb.multiValueHeaders(), kind);
                query = MultiValueMerger.mergeQuery(
                        lb.queryStringParameters(),
                        lb.multiValueQueryStringParameters(),
                        component -> decodeComponent(component, kind),
                        kind);
                remoteAddress = firstForwardedFor(headers);
            }
            default -> throw new IllegalStateException("Unhandled event kind: " + kind);
        }

        MediaType mediaType = MediaType.fromContentType(headers.first("Content-Type"));
        MessageBody body = MessageBody.of(decodeBody(event), mediaType);
        return new CanonicalRequest(method, path, query, headers, body, remoteAddress, base, kind);
    }

    /**
     * Strips {@code basePath} from {@code rawPath} on a segment boundary.
     *
     * @return a path that starts with {@code /}
     */
    static String stripBasePath(String rawPath, BasePath basePath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "/";
        }
        String path = rawPath.startsWith("/") ? rawPath : "/" + rawPath;
        if (basePath.isEmpty()) {
            return path;
        }
        String prefix = basePath.value();
        if (path.equals(prefix)) {
            return "/";
        }
        if (path.startsWith(prefix + "/")) {
            return path.substring(prefix.length());
        }
        return path;
    }

    static byte[] decodeBody(InvocationEvent event) {
        String body = event.body();
        if (body == null || body.isEmpty()) {
            return new byte[0];
        }
        if (!event.base64Encoded()) {
            return body.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException(
                    "Body is flagged as base64 but is not valid base64: " + e.getMessage(), e, "body", event.kind());
        }
    }

    // --- HTTP API ---

    private static HttpHeaders httpApiHeaders(HttpApiEvent event) {
        HttpHeaders.Builder headers = HttpHeaders.of(event.headers()).toBuilder();
        if (!event.cookies().isEmpty() && !headers.contains(COOKIE)) {
            headers.add(COOKIE, String.join(COOKIE_SEPARATOR, event.cookies()));
        }
        return headers.build();
    }

    private static QueryParameters httpApiQuery(HttpApiEvent event) {
        String raw = event.rawQueryString();
        if (raw == null || raw.isEmpty()) {
            return QueryParameters.of(event.queryStringParameters());
        }
        try {
            return QueryParameters.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException(
                    "rawQueryString holds an invalid percent escape: " + e.getMessage(),
                    e,
                    "rawQueryString",
                    EventKind.HTTP_API);
        }
    }

    // --- Load balancer ---

    private static String decodeComponent(String component, EventKind kind) {
        try {
            return QueryParameters.decode(component);
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException(
                    "Query parameter '" + component + "' holds an invalid percent escape",
                    e,
                    "queryStringParameters",
                    kind);
        }
    }

    private static String firstForwardedFor(HttpHeaders headers) {
        String forwarded = headers.first(FORWARDED_FOR);
        if (forwarded == null) {
            return null;
        }
        int comma = forwarded.indexOf(',');
        String first = (comma >= 0 ? forwarded.substring(0, comma) : forwarded).strip();
        return first.isEmpty() ? null : first;
    }
}
