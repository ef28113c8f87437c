package io.lambdabridge.core.error;

import io.lambdabridge.core.event.EventKind;

/** Thrown when the event's HTTP method is not one of {@link io.lambdabridge.core.model.HttpMethod}. */
public final class UnsupportedMethodException extends InvalidEventException {

    private static final long serialVersionUID = 1L;

    private final String method;

    public UnsupportedMethodException(String message, String method, EventKind eventKind) {
        super(message, eventKind);
        this.method = method;
    }

    /** The method string exactly as received, possibly {@code null}. */
    public String method() {
        return method;
    }
}
