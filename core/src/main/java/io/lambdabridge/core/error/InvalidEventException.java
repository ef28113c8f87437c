package io.lambdabridge.core.error;

import io.lambdabridge.core.event.EventKind;

/**
 * Abstract parent for per-invocation failures that happen before the application is called.
 * The invocation fails as a whole; no HTTP response is substituted because no canonical request
 * exists yet.
 */
public abstract class InvalidEventException extends BridgeException {

    private static final long serialVersionUID = 1L;

    private final EventKind eventKind;

    protected InvalidEventException(String message, EventKind eventKind) {
        super(message, Phase.INVOCATION);
        this.eventKind = eventKind;
    }

    protected InvalidEventException(String message, Throwable cause, EventKind eventKind) {
        super(message, cause, Phase.INVOCATION);
        this.eventKind = eventKind;
    }

    /** The detected event kind, or {@code null} if detection itself failed. */
    public EventKind eventKind() {
        return eventKind;
    }
}
