package io.lambdabridge.core.engine;

import io.lambdabridge.core.config.BridgeConfig;
import io.lambdabridge.core.model.MediaType;
import io.lambdabridge.core.model.MessageBody;
import io.lambdabridge.core.model.ResponseType;
import java.util.Objects;

/**
 * Decides whether a response body must travel base64-encoded.
 *
 * <p>
 * Order of evaluation:
 * <ol>
 * <li>An empty body is never encoded.</li>
 * <li>A configured {@link ResponseType#BINARY} override always encodes.</li>
 * <li>A configured {@link ResponseType#TEXT} override emits literal text, unless the bytes are
 * not valid UTF-8.</li>
 * <li>Otherwise the body is encoded when its content type is not a recognized text type (see
 * {@link MediaType#fromContentType}) or its bytes are not valid UTF-8. A missing content type
 * counts as not text.</li>
 * </ol>
 *
 * <p>
 * Pure function of content type, bytes and configuration. Thread-safe.
 */
public final class BinaryBodyPolicy {

    private final BridgeConfig config;

    public BinaryBodyPolicy(BridgeConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * @param contentType the response's Content-Type header, may be {@code null}
     * @param body        the response body
     * @return {@code true} if the body must be base64-encoded
     */
    public boolean shouldEncode(String contentType, MessageBody body) {
        if (body == null || body.isEmpty()) {
            return false;
        }
        ResponseType forced = config.responseTypeFor(contentType);
        if (forced == ResponseType.BINARY) {
            return true;
        }
        if (forced == ResponseType.TEXT) {
            return !body.isValidUtf8();
        }
        return !MediaType.fromContentType(contentType).isText() || !body.isValidUtf8();
    }
}
