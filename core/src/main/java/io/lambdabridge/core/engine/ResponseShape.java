package io.lambdabridge.core.engine;

import io.lambdabridge.core.event.EventKind;
import io.lambdabridge.core.event.InvocationEvent;
import io.lambdabridge.core.event.LoadBalancerEvent;
import java.util.Objects;

/**
 * The response format an invocation source expects back.
 *
 * @param kind              the originating event kind
 * @param multiValueHeaders for load balancer targets, whether the target group runs with
 *                          multi-value headers enabled; ignored for the other kinds
 */
public record ResponseShape(EventKind kind, boolean multiValueHeaders) {

    public ResponseShape {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /** Derives the shape from the event that started the invocation. */
    public static ResponseShape of(InvocationEvent event) {
        boolean multiValue = event instanceof LoadBalancerEvent lb && lb.multiValueEnabled();
        return new ResponseShape(event.kind(), multiValue);
    }

    /** Shape for a kind with no event at hand; load balancer targets default to single-value headers. */
    public static ResponseShape defaultFor(EventKind kind) {
        return new ResponseShape(kind, false);
    }
}
