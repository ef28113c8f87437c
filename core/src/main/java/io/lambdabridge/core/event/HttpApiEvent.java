package io.lambdabridge.core.event;

import java.util.List;
import java.util.Map;

/**
 * HTTP API event, payload format 2.0. Headers and query parameters come single-valued, with
 * repeated values comma-joined by the source; {@code rawQueryString} keeps the original order
 * and multiplicity. Cookies arrive separately.
 *
 * @param version               payload version, always {@code "2.0"}
 * @param routeKey              matched route, e.g. {@code "GET /items/{id}"}
 * @param httpMethod            request method from {@code requestContext.http.method}
 * @param rawPath               request path as sent by the client
 * @param rawQueryString        percent-encoded query string without {@code ?}, nullable
 * @param stage                 stage name, {@code "$default"} for the default stage
 * @param pathParameters        values for the route's parameters
 * @param cookies               request cookies, one {@code name=value} per entry
 * @param headers               request headers (lowercase names, duplicates comma-joined)
 * @param queryStringParameters decoded query parameters (duplicates comma-joined)
 * @param body                  raw body, nullable
 * @param base64Encoded         whether {@code body} is base64
 * @param sourceIp              client address, nullable
 * @param requestId             gateway request id, nullable
 * @param domainName            host the client addressed, nullable
 */
public record HttpApiEvent(
        String version,
        String routeKey,
        String httpMethod,
        String rawPath,
        String rawQueryString,
        String stage,
        Map<String, String> pathParameters,
        List<String> cookies,
        Map<String, String> headers,
        Map<String, String> queryStringParameters,
        String body,
        boolean base64Encoded,
        String sourceIp,
        String requestId,
        String domainName)
        implements InvocationEvent {

    /** Stage name HTTP APIs use when no explicit stage is in the URL. */
    public static final String DEFAULT_STAGE = "$default";

    public HttpApiEvent {
        pathParameters = pathParameters != null ? Map.copyOf(pathParameters) : Map.of();
        cookies = cookies != null ? List.copyOf(cookies) : List.of();
        headers = EventMaps.copy(headers);
        queryStringParameters = EventMaps.copy(queryStringParameters);
    }

    @Override
    public EventKind kind() {
        return EventKind.HTTP_API;
    }
}
