package io.lambdabridge.core.event;

import java.util.List;
import java.util.Map;

/**
 * REST API proxy integration event (payload format 1.0). Carries headers and query parameters
 * in both single-value and multi-value form.
 *
 * @param httpMethod                      request method
 * @param path                            request path; includes a custom domain's base path
 *                                        mapping but not the stage on the default host
 * @param resource                        resource template, e.g. {@code /items/{id}}
 * @param stage                           deployment stage name
 * @param pathParameters                  values for the template's parameters
 * @param headers                         single-value headers
 * @param multiValueHeaders               multi-value headers
 * @param queryStringParameters           single-value query parameters (decoded)
 * @param multiValueQueryStringParameters multi-value query parameters (decoded)
 * @param body                            raw body, nullable
 * @param base64Encoded                   whether {@code body} is base64
 * @param sourceIp                        client address from the request identity, nullable
 * @param requestId                       gateway request id, nullable
 * @param domainName                      host the client addressed, nullable
 */
public record RestProxyEvent(
        String httpMethod,
        String path,
        String resource,
        String stage,
        Map<String, String> pathParameters,
        Map<String, String> headers,
        Map<String, List<String>> multiValueHeaders,
        Map<String, String> queryStringParameters,
        Map<String, List<String>> multiValueQueryStringParameters,
        String body,
        boolean base64Encoded,
        String sourceIp,
        String requestId,
        String domainName)
        implements InvocationEvent {

    public RestProxyEvent {
        pathParameters = pathParameters != null ? Map.copyOf(pathParameters) : Map.of();
        headers = EventMaps.copy(headers);
        multiValueHeaders = EventMaps.copyMulti(multiValueHeaders);
        queryStringParameters = EventMaps.copy(queryStringParameters);
        multiValueQueryStringParameters = EventMaps.copyMulti(multiValueQueryStringParameters);
    }

    @Override
    public EventKind kind() {
        return EventKind.REST_PROXY;
    }

    @Override
    public String rawPath() {
        return path;
    }
}
