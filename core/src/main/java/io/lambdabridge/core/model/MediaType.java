package io.lambdabridge.core.model;

import java.util.Locale;

/**
 * Coarse media type classification for message bodies.
 *
 * <p>
 * The bridge only needs to know whether a body is textual (safe to emit as a
 * literal UTF-8 string) or opaque (must be base64-encoded). This enum replaces
 * raw {@code String contentType} comparisons throughout the pipeline.
 */
public enum MediaType {
    /** {@code application/json} and structured suffixes ({@code +json}). */
    JSON("application/json", true),

    /**
     * {@code application/xml}, {@code text/xml} and structured suffixes
     * ({@code +xml}).
     */
    XML("application/xml", true),

    /** {@code application/x-www-form-urlencoded}. */
    FORM("application/x-www-form-urlencoded", true),

    /** {@code text/*} and {@code application/javascript}. */
    TEXT("text/plain", true),

    /**
     * {@code application/octet-stream}, also used as fallback for unrecognized
     * types ({@code image/png}, {@code application/pdf}, ...).
     */
    BINARY("application/octet-stream", false),

    /** No content type (body absent or not specified). */
    NONE(null, false);

    private final String value;
    private final boolean text;

    MediaType(String value, boolean text) {
        this.value = value;
        this.text = text;
    }

    /**
     * Returns the canonical MIME type string, or {@code null} for
     * {@link #NONE}.
     */
    public String value() {
        return value;
    }

    /** True when bodies of this type are recognized as text. */
    public boolean isText() {
        return text;
    }

    /**
     * Resolves a Content-Type header value to a {@link MediaType}.
     *
     * <ul>
     * <li>Ignores parameters (charset, boundary, etc.); only the MIME type is
     * considered.
     * <li>Recognizes structured suffixes (RFC 6838): {@code +json} →
     * {@link #JSON}, {@code +xml} → {@link #XML}.
     * <li>Any {@code text/*} type → {@link #TEXT} ({@code text/xml} →
     * {@link #XML}).
     * <li>Returns {@link #NONE} for {@code null} or blank input.
     * <li>Returns {@link #BINARY} for unrecognized types.
     * </ul>
     *
     * @param contentType the Content-Type header value (e.g.,
     *                    {@code "application/json; charset=utf-8"})
     * @return the resolved {@code MediaType}
     */
    public static MediaType fromContentType(String contentType) {
        String mime = mimeType(contentType);
        if (mime == null) {
            return NONE;
        }

        // Exact match
        for (MediaType type : values()) {
            if (type.value != null && type.value.equals(mime)) {
                return type;
            }
        }

        if (mime.endsWith("+json")) {
            return JSON;
        }
        if (mime.endsWith("+xml") || mime.equals("text/xml")) {
            return XML;
        }
        if (mime.startsWith("text/")
                || mime.equals("application/javascript")
                || mime.equals("application/ecmascript")) {
            return TEXT;
        }

        return BINARY;
    }

    /**
     * Strips parameters from a Content-Type value and lowercases it.
     *
     * @return the bare MIME type, or {@code null} for {@code null} or blank
     *         input
     */
    public static String mimeType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return null;
        }
        String mime = contentType;
        int semicolon = mime.indexOf(';');
        if (semicolon >= 0) {
            mime = mime.substring(0, semicolon);
        }
        mime = mime.strip().toLowerCase(Locale.ROOT);
        return mime.isEmpty() ? null : mime;
    }
}
