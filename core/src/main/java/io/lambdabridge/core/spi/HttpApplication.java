package io.lambdabridge.core.spi;

import io.lambdabridge.core.model.CanonicalRequest;
import io.lambdabridge.core.model.CanonicalResponse;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * The embedded HTTP application (router, framework, plain function) that serves canonical
 * requests. The bridge does not interpret what happens inside.
 *
 * <p>
 * Whatever {@link #handle} throws reaches the function runtime unchanged; the bridge neither
 * retries nor maps it to an HTTP status.
 *
 * <p>
 * Implementations SHOULD be thread-safe if the hosting runtime dispatches invocations
 * concurrently. A single instance serves every invocation of a warm function.
 */
@FunctionalInterface
public interface HttpApplication {

    /**
     * Serves one request.
     *
     * @param request the canonical request, never {@code null}
     * @return the response, must not be {@code null}
     * @throws Exception any application failure, propagated as-is
     */
    CanonicalResponse handle(CanonicalRequest request) throws Exception;

    /**
     * Adapts an asynchronous application. The returned stage is awaited to completion before the
     * response is encoded; a failed stage rethrows its original cause.
     *
     * @param application function returning a stage per request
     * @return a blocking {@code HttpApplication}
     */
    static HttpApplication async(Function<CanonicalRequest, ? extends CompletionStage<CanonicalResponse>> application) {
        Objects.requireNonNull(application, "application must not be null");
        return request -> {
            CompletionStage<CanonicalResponse> stage = application.apply(request);
            if (stage == null) {
                throw new IllegalStateException("Asynchronous application returned no CompletionStage");
            }
            try {
                return stage.toCompletableFuture().get();
            } catch (ExecutionException e) {
                throw unwrap(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            }
        };
    }

    private static Exception unwrap(Throwable cause) {
        if (cause instanceof Exception exception) {
            return exception;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Asynchronous application failed", cause);
    }
}
