package io.lambdabridge.core.event;

/**
 * A parsed upstream event. Closed hierarchy: exactly one variant per {@link EventKind}, so
 * consumers switch on {@link #kind()} and the compiler flags any kind left unhandled.
 *
 * <p>
 * Each variant keeps the fields of its own source schema as they arrived, including both
 * single-value and multi-value forms where the source sends both. Merging those forms is the
 * request builder's job.
 */
public sealed interface InvocationEvent permits RestProxyEvent, HttpApiEvent, LoadBalancerEvent {

    /** Variant tag. */
    EventKind kind();

    /** HTTP method as received, not yet validated. */
    String httpMethod();

    /** Request path as received, including any gateway base path. */
    String rawPath();

    /** Body as received, {@code null} when absent. */
    String body();

    /** True if {@link #body()} is base64 text. */
    boolean base64Encoded();

    /** Gateway request id, {@code null} if the source has none. */
    String requestId();
}
