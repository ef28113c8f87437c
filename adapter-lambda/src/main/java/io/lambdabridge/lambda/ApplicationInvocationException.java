package io.lambdabridge.lambda;

/**
 * Carries a checked exception thrown by the HTTP application out of
 * {@link LambdaBridgeHandler#handleRequest}, whose signature only admits {@link java.io.IOException}.
 * The original exception is always the cause; unchecked exceptions and I/O failures are never
 * wrapped.
 */
public class ApplicationInvocationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ApplicationInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
