package io.lambdabridge.core.event;

import java.util.List;
import java.util.Map;

/**
 * Application load balancer target event. Depending on the target group's multi-value header
 * setting, headers and query parameters arrive either single-valued or multi-valued, never
 * both. Query keys and values are passed through still percent-encoded.
 *
 * @param httpMethod                      request method
 * @param path                            request path
 * @param targetGroupArn                  target group that routed the request, nullable
 * @param headers                         single-value headers
 * @param multiValueHeaders               multi-value headers
 * @param queryStringParameters           single-value query parameters (encoded)
 * @param multiValueQueryStringParameters multi-value query parameters (encoded)
 * @param body                            raw body, nullable
 * @param base64Encoded                   whether {@code body} is base64
 * @param multiValueEnabled               whether the event used the multi-value fields; the
 *                                        response must then use them too
 */
public record LoadBalancerEvent(
        String httpMethod,
        String path,
        String targetGroupArn,
        Map<String, String> headers,
        Map<String, List<String>> multiValueHeaders,
        Map<String, String> queryStringParameters,
        Map<String, List<String>> multiValueQueryStringParameters,
        String body,
        boolean base64Encoded,
        boolean multiValueEnabled)
        implements InvocationEvent {

    public LoadBalancerEvent {
        headers = EventMaps.copy(headers);
        multiValueHeaders = EventMaps.copyMulti(multiValueHeaders);
        queryStringParameters = EventMaps.copy(queryStringParameters);
        multiValueQueryStringParameters = EventMaps.copyMulti(multiValueQueryStringParameters);
    }

    @Override
    public EventKind kind() {
        return EventKind.LOAD_BALANCER_TARGET;
    }

    @Override
    public String rawPath() {
        return path;
    }

    /** Load balancers do not assign request ids in the event payload. */
    @Override
    public String requestId() {
        return null;
    }
}
