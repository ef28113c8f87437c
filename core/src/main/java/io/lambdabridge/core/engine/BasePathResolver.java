package io.lambdabridge.core.engine;

import io.lambdabridge.core.config.BridgeConfig;
import io.lambdabridge.core.event.HttpApiEvent;
import io.lambdabridge.core.event.InvocationEvent;
import io.lambdabridge.core.event.RestProxyEvent;
import io.lambdabridge.core.model.BasePath;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Works out which leading part of an event's raw path belongs to the gateway rather than to the
 * application.
 *
 * <ul>
 * <li>REST proxy on the default execute-api host: {@code /<stage>}. The URL the client used
 * carries the stage, the event's {@code path} does not.</li>
 * <li>REST proxy behind a custom domain: whatever precedes the populated resource template in
 * the raw path (the base path mapping).</li>
 * <li>HTTP API: {@code /<stage>} for a named stage that the raw path starts with.</li>
 * <li>Load balancer: never a base path.</li>
 * </ul>
 *
 * <p>
 * Never fails. When the prefix cannot be determined the result is {@link BasePath#NONE} and the
 * reason is logged at DEBUG. Pure function of its input, thread-safe.
 */
public final class BasePathResolver {

    private static final Logger LOG = LoggerFactory.getLogger(BasePathResolver.class);

    /** Host suffix of the gateway's generated default endpoint. */
    static final String DEFAULT_HOST_SUFFIX = ".amazonaws.com";

    private BasePathResolver() {}

    /** Resolves using the configuration's {@code includeBasePath} switch. */
    public static BasePath resolve(InvocationEvent event, BridgeConfig config) {
        return resolve(event, config.includeBasePath());
    }

    /**
     * Resolves the base path of an event.
     *
     * @param event           the parsed event
     * @param includeBasePath when {@code false} the result is always {@link BasePath#NONE}
     * @return the base path, never {@code null}
     */
    public static BasePath resolve(InvocationEvent event, boolean includeBasePath) {
        if (!includeBasePath) {
            return BasePath.NONE;
        }
        return switch (event.kind()) {
            case REST_PROXY -> resolveRestProxy((RestProxyEvent) event);
            case HTTP_API -> resolveHttpApi((HttpApiEvent) event);
            case LOAD_BALANCER_TARGET -> BasePath.NONE;
        };
    }

    private static BasePath resolveRestProxy(RestProxyEvent event) {
        if (isDefaultHost(event)) {
            return stagePath(event.stage());
        }
        String rawPath = event.path() != null ? event.path() : "";
        String resource = event.resource();
        if (resource == null || resource.isEmpty()) {
            LOG.debug("base_path.unresolved event_kind=REST_PROXY reason=no_resource path={}", rawPath);
            return BasePath.NONE;
        }
        if ("/".equals(resource)) {
            return BasePath.of(rawPath);
        }
        String populated = populate(resource, event.pathParameters());
        if (populated == null) {
            LOG.debug(
                    "base_path.unresolved event_kind=REST_PROXY reason=missing_path_parameter resource={}",
                    resource);
            return BasePath.NONE;
        }
        String matched = rawPath.endsWith(populated) ? populated : populated + "/";
        if (!rawPath.endsWith(matched)) {
            LOG.debug(
                    "base_path.unresolved event_kind=REST_PROXY reason=template_not_found resource={} populated={} path={}",
                    resource,
                    populated,
                    rawPath);
            return BasePath.NONE;
        }
        return BasePath.of(rawPath.substring(0, rawPath.length() - matched.length()));
    }

    private static BasePath resolveHttpApi(HttpApiEvent event) {
        String stage = event.stage();
        if (stage == null || stage.isEmpty() || HttpApiEvent.DEFAULT_STAGE.equals(stage)) {
            return BasePath.NONE;
        }
        String prefix = "/" + stage;
        String rawPath = event.rawPath();
        if (rawPath.equals(prefix) || rawPath.startsWith(prefix + "/")) {
            return new BasePath(prefix);
        }
        LOG.debug("base_path.unresolved event_kind=HTTP_API reason=stage_not_in_path stage={} path={}", stage, rawPath);
        return BasePath.NONE;
    }

    // --- Helpers ---

    private static boolean isDefaultHost(RestProxyEvent event) {
        String host = null;
        for (Map.Entry<String, String> header : event.headers().entrySet()) {
            if ("host".equalsIgnoreCase(header.getKey())) {
                host = header.getValue();
            }
        }
        if (host == null) {
            host = event.domainName();
        }
        if (host == null) {
            return false;
        }
        String hostname = host.strip().toLowerCase(Locale.ROOT);
        int colon = hostname.indexOf(':');
        if (colon >= 0) {
            hostname = hostname.substring(0, colon);
        }
        return hostname.endsWith(DEFAULT_HOST_SUFFIX);
    }

    private static BasePath stagePath(String stage) {
        if (stage == null || stage.isEmpty()) {
            LOG.debug("base_path.unresolved event_kind=REST_PROXY reason=no_stage");
            return BasePath.NONE;
        }
        return BasePath.of(stage);
    }

    /**
     * Substitutes {@code {name}} and greedy {@code {name+}} segments with their path parameter
     * values.
     *
     * @return the populated template, or {@code null} when a parameter has no value
     */
    static String populate(String resource, Map<String, String> pathParameters) {
        String[] segments = resource.split("/", -1);
        StringBuilder populated = new StringBuilder(resource.length());
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                populated.append('/');
            }
            String segment = segments[i];
            if (segment.length() >= 2 && segment.startsWith("{") && segment.endsWith("}")) {
                String name = segment.endsWith("+}")
                        ? segment.substring(1, segment.length() - 2)
                        : segment.substring(1, segment.length() - 1);
                String value = pathParameters.get(name);
                if (value == null) {
                    return null;
                }
                populated.append(value);
            } else {
                populated.append(segment);
            }
        }
        return populated.toString();
    }
}
