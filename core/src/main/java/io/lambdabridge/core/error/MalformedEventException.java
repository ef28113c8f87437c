package io.lambdabridge.core.error;

import io.lambdabridge.core.event.EventKind;

/**
 * Thrown when the raw input matches no known event shape, or a required field is absent or has
 * the wrong JSON type.
 */
public final class MalformedEventException extends InvalidEventException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public MalformedEventException(String message, String field, EventKind eventKind) {
        super(message, eventKind);
        this.field = field;
    }

    public MalformedEventException(String message, Throwable cause, String field, EventKind eventKind) {
        super(message, cause, eventKind);
        this.field = field;
    }

    /** Dotted path of the offending field (e.g. {@code requestContext.http.method}), or {@code null}. */
    public String field() {
        return field;
    }
}
