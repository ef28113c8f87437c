package io.lambdabridge.core.error;

/**
 * Abstract base for all lambda-bridge exceptions. Never thrown directly; use the concrete
 * subclasses under {@link InvalidEventException} or {@link BridgeConfigException}.
 */
public abstract class BridgeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        /** Wiring the bridge, before any invocation is processed. */
        SETUP,
        /** Translating a single invocation. */
        INVOCATION
    }

    private final Phase phase;

    protected BridgeException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected BridgeException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
