package io.lambdabridge.core.model;

import io.lambdabridge.core.event.EventKind;
import java.util.Objects;

/**
 * Schema-agnostic HTTP request handed to the embedded application. Built fresh
 * for every invocation and never shared.
 *
 * <p>
 * {@code path} always starts with {@code /} and never contains the stripped
 * {@code basePath}; the application can use {@link #fullPath()} when it needs
 * the externally visible path (e.g. for a {@code Location} header).
 *
 * @param method          the HTTP verb
 * @param path            request path relative to the base path
 * @param queryParameters decoded query parameters, duplicates in order
 * @param headers         request headers, duplicates in order
 * @param body            request body bytes (never {@code null})
 * @param remoteAddress   client address reported by the source, nullable
 * @param basePath        the stripped gateway prefix, {@link BasePath#NONE} if
 *                        none
 * @param source          the kind of event the request came from
 */
public record CanonicalRequest(
        HttpMethod method,
        String path,
        QueryParameters queryParameters,
        HttpHeaders headers,
        MessageBody body,
        String remoteAddress,
        BasePath basePath,
        EventKind source) {

    public CanonicalRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("Request path must start with '/', got: '" + path + "'");
        }
        queryParameters = queryParameters != null ? queryParameters : QueryParameters.empty();
        headers = headers != null ? headers : HttpHeaders.empty();
        body = body != null ? body : MessageBody.empty();
        basePath = basePath != null ? basePath : BasePath.NONE;
    }

    /** Path plus encoded query string, e.g. {@code /hello?a=1&a=2}. */
    public String pathAndQuery() {
        return queryParameters.isEmpty() ? path : path + "?" + queryParameters.toQueryString();
    }

    /** The externally visible path: base path followed by {@link #path()}. */
    public String fullPath() {
        return basePath.prefix(path);
    }

    /**
     * Convenience accessor for the first {@code Content-Type} header, or
     * {@code null}.
     */
    public String contentType() {
        return headers.first("Content-Type");
    }

    /**
     * Returns a new builder, mostly useful in tests and applications that
     * forward requests.
     */
    public static Builder builder(HttpMethod method, String path) {
        return new Builder(method, path);
    }

    /** Builder for {@link CanonicalRequest}. */
    public static final class Builder {
        private final HttpMethod method;
        private final String path;
        private final QueryParameters.Builder query = QueryParameters.builder();
        private final HttpHeaders.Builder headers = HttpHeaders.builder();
        private byte[] body;
        private String remoteAddress;
        private BasePath basePath = BasePath.NONE;
        private EventKind source;

        Builder(HttpMethod method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder query(String key, String value) {
            query.add(key, value);
            return this;
        }

        public Builder header(String name, String value) {
            headers.add(name, value);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder remoteAddress(String remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public Builder basePath(BasePath basePath) {
            this.basePath = basePath;
            return this;
        }

        public Builder source(EventKind source) {
            this.source = source;
            return this;
        }

        public CanonicalRequest build() {
            HttpHeaders built = headers.build();
            MediaType mediaType = MediaType.fromContentType(built.first("Content-Type"));
            return new CanonicalRequest(
                    method, path, query.build(), built, MessageBody.of(body, mediaType), remoteAddress, basePath, source);
        }
    }
}
