package io.lambdabridge.core.model;

/** Forced encoding for response bodies of a configured content type. */
public enum ResponseType {
    /**
     * Emit as a literal UTF-8 string (unless the bytes are not valid UTF-8).
     */
    TEXT,
    /** Always emit base64-encoded. */
    BINARY
}
