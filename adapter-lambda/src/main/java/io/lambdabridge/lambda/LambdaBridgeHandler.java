package io.lambdabridge.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import io.lambdabridge.core.engine.InvocationOrchestrator;
import io.lambdabridge.core.error.InvalidEventException;
import io.lambdabridge.core.spi.HttpApplication;
import io.lambdabridge.lambda.config.ConfigLoader;
import io.lambdabridge.lambda.config.LambdaBridgeConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Base class for function handlers that serve an embedded HTTP application.
 *
 * <pre>{@code
 * public class Handler extends LambdaBridgeHandler {
 *     @Override
 *     protected HttpApplication application() {
 *         return request -> CanonicalResponse.builder(200).body("hello").build();
 *     }
 * }
 * }</pre>
 *
 * <p>
 * The first invocation loads the configuration ({@link #config()}), configures logging and
 * builds the orchestrator; warm invocations reuse it. Setup failures surface from that first
 * invocation and are retried on the next one.
 *
 * <p>
 * Failures are logged at WARN and rethrown so the runtime reports a function error. Unchecked
 * exceptions and {@link IOException}s propagate unchanged; other checked exceptions from the
 * application are wrapped in {@link ApplicationInvocationException}.
 */
public abstract class LambdaBridgeHandler implements RequestStreamHandler {

    private static final Logger LOG = LoggerFactory.getLogger(LambdaBridgeHandler.class);

    /** MDC key for the runtime's request id. */
    static final String MDC_AWS_REQUEST_ID = "awsRequestId";

    private volatile InvocationOrchestrator orchestrator;

    /**
     * The application to serve. Called once, at cold start.
     *
     * @return the application, must not be {@code null}
     */
    protected abstract HttpApplication application();

    /** Configuration for this handler. Defaults to {@link ConfigLoader#load()}. */
    protected LambdaBridgeConfig config() {
        return ConfigLoader.load();
    }

    /** Whether setup reconfigures Logback from the loaded configuration. Defaults to {@code true}. */
    protected boolean configureLogging() {
        return true;
    }

    @Override
    public final void handleRequest(InputStream input, OutputStream output, Context context) throws IOException {
        String awsRequestId = context != null ? context.getAwsRequestId() : null;
        if (awsRequestId != null) {
            MDC.put(MDC_AWS_REQUEST_ID, awsRequestId);
        }
        try {
            orchestrator().invoke(input, output);
        } catch (InvalidEventException e) {
            LOG.warn("invocation.rejected event_kind={} error={}", e.eventKind(), e.getMessage());
            throw e;
        } catch (RuntimeException | IOException e) {
            LOG.warn("invocation.failed error={}", e.toString(), e);
            throw e;
        } catch (Exception e) {
            LOG.warn("invocation.failed error={}", e.toString(), e);
            throw new ApplicationInvocationException("HTTP application failed: " + e.getMessage(), e);
        } finally {
            MDC.remove(MDC_AWS_REQUEST_ID);
        }
    }

    /** Returns the orchestrator, building it on first use. */
    InvocationOrchestrator orchestrator() {
        InvocationOrchestrator current = orchestrator;
        if (current == null) {
            synchronized (this) {
                current = orchestrator;
                if (current == null) {
                    current = setup();
                    orchestrator = current;
                }
            }
        }
        return current;
    }

    private InvocationOrchestrator setup() {
        long startNanos = System.nanoTime();
        LambdaBridgeConfig config = config();
        if (configureLogging()) {
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        }
        InvocationOrchestrator built = new InvocationOrchestrator(application(), config.bridge());
        LOG.info(
                "bridge.initialized handler={} include_base_path={} response_types={} log_format={} log_level={} setup_ms={}",
                getClass().getName(),
                config.bridge().includeBasePath(),
                config.bridge().responseTypes(),
                config.loggingFormat(),
                config.loggingLevel(),
                (System.nanoTime() - startNanos) / 1_000_000);
        return built;
    }
}
