package io.lambdabridge.core.config;

import io.lambdabridge.core.error.BridgeConfigException;
import io.lambdabridge.core.model.MediaType;
import io.lambdabridge.core.model.ResponseType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translation settings, fixed at setup time and passed explicitly to the pipeline.
 *
 * <p>
 * Use {@link #builder()} to construct instances; {@link #DEFAULTS} matches the documented
 * defaults.
 *
 * @param includeBasePath detect the gateway base path, strip it from request paths and expose
 *                        it on the canonical request (default {@code true})
 * @param responseTypes   forced body encoding per MIME type, keys lowercase without parameters
 *                        (default empty)
 */
public record BridgeConfig(boolean includeBasePath, Map<String, ResponseType> responseTypes) {

    /** Default configuration. */
    public static final BridgeConfig DEFAULTS = builder().build();

    /**
     * @throws BridgeConfigException if an override has a blank content type or a {@code null}
     *                               type
     */
    public BridgeConfig {
        Map<String, ResponseType> normalized = new LinkedHashMap<>();
        if (responseTypes != null) {
            responseTypes.forEach((contentType, type) -> normalized.put(mimeKey(contentType, type), type));
        }
        responseTypes = Collections.unmodifiableMap(normalized);
    }

    /**
     * Looks up a forced response type for a Content-Type header value.
     *
     * @return the configured type, or {@code null} when the content type has no override
     */
    public ResponseType responseTypeFor(String contentType) {
        String mime = MediaType.mimeType(contentType);
        return mime != null ? responseTypes.get(mime) : null;
    }

    private static String mimeKey(String contentType, ResponseType type) {
        String mime = MediaType.mimeType(contentType);
        if (mime == null) {
            throw new BridgeConfigException("Response type override needs a content type");
        }
        if (type == null) {
            throw new BridgeConfigException("Response type override for '" + mime + "' is null");
        }
        return mime;
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link BridgeConfig}. */
    public static final class Builder {
        private boolean includeBasePath = true;
        private final Map<String, ResponseType> responseTypes = new LinkedHashMap<>();

        Builder() {}

        public Builder includeBasePath(boolean includeBasePath) {
            this.includeBasePath = includeBasePath;
            return this;
        }

        /**
         * Forces the encoding for a content type. Matching ignores case and parameters.
         *
         * @throws BridgeConfigException if the content type is blank or the type is {@code null}
         */
        public Builder responseType(String contentType, ResponseType type) {
            responseTypes.put(mimeKey(contentType, type), type);
            return this;
        }

        public BridgeConfig build() {
            return new BridgeConfig(includeBasePath, responseTypes);
        }
    }
}
