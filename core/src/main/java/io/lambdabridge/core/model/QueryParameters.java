package io.lambdabridge.core.model;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered query parameter collection. Keys are case-sensitive, duplicate keys
 * are kept in arrival order, and values are stored decoded.
 *
 * <p>
 * Immutable.
 */
public final class QueryParameters {

    private static final QueryParameters EMPTY = new QueryParameters(List.of());

    private final List<Map.Entry<String, String>> entries;

    private QueryParameters(List<Map.Entry<String, String>> entries) {
        this.entries = List.copyOf(entries);
    }

    /** First value for {@code key}, or {@code null}. */
    public String first(String key) {
        for (Map.Entry<String, String> entry : entries) {
            if (entry.getKey().equals(key)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /** All values for {@code key} in arrival order; empty if absent. */
    public List<String> all(String key) {
        List<String> values = new ArrayList<>();
        for (Map.Entry<String, String> entry : entries) {
            if (entry.getKey().equals(key)) {
                values.add(entry.getValue());
            }
        }
        return Collections.unmodifiableList(values);
    }

    public boolean contains(String key) {
        return first(key) != null;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Number of pairs, duplicates counted. */
    public int size() {
        return entries.size();
    }

    /** Every pair in arrival order. */
    public List<Map.Entry<String, String>> entries() {
        return entries;
    }

    /** Single-value view, last write wins, keys in first-seen order. */
    public Map<String, String> toSingleValueMap() {
        Map<String, String> result = new LinkedHashMap<>();
        entries.forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return Collections.unmodifiableMap(result);
    }

    /** Multi-value view, keys in first-seen order. */
    public Map<String, List<String>> toMultiValueMap() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        entries.forEach(entry -> result.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                .add(entry.getValue()));
        result.replaceAll((key, values) -> Collections.unmodifiableList(values));
        return Collections.unmodifiableMap(result);
    }

    /**
     * Formats the pairs as a percent-encoded query string without the leading
     * {@code ?}. Spaces become {@code %20}.
     *
     * @return the encoded query string, empty when there are no pairs
     */
    public String toQueryString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : entries) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
        }
        return sb.toString();
    }

    // ── Factory methods ──

    /**
     * Parses a raw, percent-encoded query string (with or without a leading
     * {@code ?}). A pair without {@code =} gets an empty value; empty segments
     * are skipped.
     *
     * @param rawQuery the query string, may be {@code null}
     * @return the decoded parameters
     * @throws IllegalArgumentException if a segment holds an invalid percent
     *                                  escape
     */
    public static QueryParameters parse(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return EMPTY;
        }
        String query = rawQuery.startsWith("?") ? rawQuery.substring(1) : rawQuery;
        Builder builder = builder();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            builder.add(decode(key), decode(value));
        }
        return builder.build();
    }

    /** Creates parameters from a single-value map, keeping iteration order. */
    public static QueryParameters of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        singleValue.forEach(builder::add);
        return builder.build();
    }

    /** Creates parameters from a multi-value map, keeping iteration order. */
    public static QueryParameters ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        multiValue.forEach((key, values) -> values.forEach(value -> builder.add(key, value)));
        return builder.build();
    }

    public static QueryParameters empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Percent-decodes one query component ({@code +} means space). */
    public static String decode(String component) {
        return URLDecoder.decode(component, StandardCharsets.UTF_8);
    }

    /** Percent-encodes one query component, spaces as {@code %20}. */
    public static String encode(String component) {
        return URLEncoder.encode(component, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /** Accumulates pairs in order. Not thread-safe. */
    public static final class Builder {
        private final List<Map.Entry<String, String>> entries = new ArrayList<>();

        Builder() {}

        public Builder add(String key, String value) {
            Objects.requireNonNull(key, "query key must not be null");
            Objects.requireNonNull(value, "query value must not be null for '" + key + "'");
            entries.add(Map.entry(key, value));
            return this;
        }

        public boolean contains(String key) {
            return entries.stream().anyMatch(entry -> entry.getKey().equals(key));
        }

        public QueryParameters build() {
            return entries.isEmpty() ? EMPTY : new QueryParameters(entries);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryParameters that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "QueryParameters" + entries;
    }
}
