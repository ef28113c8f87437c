package io.lambdabridge.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Schema-agnostic HTTP response produced by the embedded application.
 *
 * @param statusCode HTTP status, 100 to 599 inclusive
 * @param headers    response headers, duplicates allowed and kept in order
 * @param body       response body bytes (never {@code null})
 */
public record CanonicalResponse(int statusCode, HttpHeaders headers, MessageBody body) {

    public CanonicalResponse {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("Status code must be between 100 and 599, got: " + statusCode);
        }
        headers = headers != null ? headers : HttpHeaders.empty();
        body = body != null ? body : MessageBody.empty();
    }

    /**
     * Convenience accessor for the last {@code Content-Type} header, or
     * {@code null}.
     */
    public String contentType() {
        return headers.last("Content-Type");
    }

    /** Returns a builder for a response with the given status. */
    public static Builder builder(int statusCode) {
        return new Builder(statusCode);
    }

    /** Shorthand for a bodiless response. */
    public static CanonicalResponse of(int statusCode) {
        return new CanonicalResponse(statusCode, HttpHeaders.empty(), MessageBody.empty());
    }

    /**
     * Builder for {@link CanonicalResponse}. The body's media type follows the
     * Content-Type header.
     */
    public static final class Builder {
        private final int statusCode;
        private final HttpHeaders.Builder headers = HttpHeaders.builder();
        private byte[] body;

        Builder(int statusCode) {
            this.statusCode = statusCode;
        }

        public Builder header(String name, String value) {
            headers.add(name, value);
            return this;
        }

        public Builder headers(HttpHeaders source) {
            Objects.requireNonNull(source, "headers must not be null");
            source.entries().forEach(entry -> headers.add(entry.getKey(), entry.getValue()));
            return this;
        }

        public Builder contentType(String contentType) {
            headers.set("Content-Type", contentType);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        /** Sets a UTF-8 text body. */
        public Builder body(String body) {
            this.body = body != null ? body.getBytes(StandardCharsets.UTF_8) : null;
            return this;
        }

        public CanonicalResponse build() {
            HttpHeaders built = headers.build();
            MediaType mediaType = MediaType.fromContentType(built.last("Content-Type"));
            return new CanonicalResponse(statusCode, built, MessageBody.of(body, mediaType));
        }
    }
}
