package io.lambdabridge.core.event;

/** The invocation sources the bridge understands. */
public enum EventKind {
    /** REST API proxy integration (payload format 1.0). */
    REST_PROXY,
    /** HTTP API, payload format 2.0. */
    HTTP_API,
    /** Application load balancer target. */
    LOAD_BALANCER_TARGET
}
