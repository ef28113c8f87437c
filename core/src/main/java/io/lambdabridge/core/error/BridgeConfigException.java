package io.lambdabridge.core.error;

/**
 * Thrown while wiring the bridge: missing application, invalid configuration values. Always
 * raised before the first invocation is processed.
 */
public final class BridgeConfigException extends BridgeException {

    private static final long serialVersionUID = 1L;

    public BridgeConfigException(String message) {
        super(message, Phase.SETUP);
    }

    public BridgeConfigException(String message, Throwable cause) {
        super(message, cause, Phase.SETUP);
    }
}
