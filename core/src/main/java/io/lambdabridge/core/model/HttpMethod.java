package io.lambdabridge.core.model;

import io.lambdabridge.core.error.UnsupportedMethodException;
import io.lambdabridge.core.event.EventKind;
import java.util.Locale;

/**
 * HTTP verbs accepted by the bridge. Anything outside this set is rejected
 * before the application is called.
 */
public enum HttpMethod {
    GET,
    PUT,
    POST,
    DELETE,
    OPTIONS,
    HEAD,
    TRACE,
    CONNECT,
    PATCH;

    /**
     * Resolves a method string case-insensitively.
     *
     * @param method the method as it appears in the event (e.g. {@code "get"})
     * @return the matching verb
     * @throws UnsupportedMethodException if {@code method} is blank or not a
     *                                    supported verb
     */
    public static HttpMethod parse(String method) {
        return parse(method, null);
    }

    /**
     * Resolves a method string case-insensitively, tagging any failure with the
     * event kind it came from.
     */
    public static HttpMethod parse(String method, EventKind source) {
        if (method == null || method.isBlank()) {
            throw new UnsupportedMethodException("HTTP method is missing", method, source);
        }
        String normalized = method.strip().toUpperCase(Locale.ROOT);
        for (HttpMethod candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new UnsupportedMethodException("Unsupported HTTP method '" + method + "'", method, source);
    }
}
