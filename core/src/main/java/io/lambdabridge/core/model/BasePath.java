package io.lambdabridge.core.model;

/**
 * URL path prefix imposed by the gateway's deployment stage or base path
 * mapping (e.g. {@code /prod}). Not part of the application's own route
 * namespace.
 *
 * <p>
 * Either empty ({@link #NONE}) or a string starting with {@code /} and not
 * ending with {@code /}. Derived once per invocation, never cached.
 *
 * @param value the prefix, {@code ""} for none
 */
public record BasePath(String value) {

    /** No base path. */
    public static final BasePath NONE = new BasePath("");

    public BasePath {
        if (value == null) {
            value = "";
        }
        if (!value.isEmpty() && (!value.startsWith("/") || value.endsWith("/"))) {
            throw new IllegalArgumentException(
                    "Base path must start with '/' and must not end with '/', got: '" + value + "'");
        }
    }

    /**
     * Creates a base path from a possibly sloppy prefix: adds the leading
     * slash, strips trailing slashes, and maps {@code ""} or {@code "/"} to
     * {@link #NONE}.
     */
    public static BasePath of(String prefix) {
        if (prefix == null) {
            return NONE;
        }
        String normalized = prefix.strip();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.isEmpty()) {
            return NONE;
        }
        return new BasePath(normalized.startsWith("/") ? normalized : "/" + normalized);
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    /**
     * Prepends this prefix to an application path that starts with {@code /}.
     */
    public String prefix(String path) {
        if (isEmpty()) {
            return path;
        }
        return "/".equals(path) ? value + "/" : value + path;
    }

    @Override
    public String toString() {
        return isEmpty() ? "BasePath[none]" : "BasePath[" + value + "]";
    }
}
