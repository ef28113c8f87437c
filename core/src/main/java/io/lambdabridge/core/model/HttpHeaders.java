package io.lambdabridge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Ordered, case-insensitive HTTP header collection.
 *
 * <p>
 * Keeps every {@code (name, value)} pair in arrival order, duplicates included,
 * so repeated headers such as {@code Set-Cookie} survive translation. Lookups
 * ignore name case (RFC 9110 §5.1) but the first-seen spelling of each name is
 * preserved for output.
 *
 * <p>
 * Immutable. Use {@link #builder()} to assemble one incrementally.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(List.of());

    /** Every pair, in arrival order. */
    private final List<Map.Entry<String, String>> entries;

    /** Case-insensitive index: name to values in arrival order. */
    private final TreeMap<String, List<String>> index;

    private HttpHeaders(List<Map.Entry<String, String>> entries) {
        this.entries = List.copyOf(entries);
        this.index = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, String> entry : this.entries) {
            index.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).add(entry.getValue());
        }
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        List<String> values = index.get(name);
        return values != null ? values.get(0) : null;
    }

    /**
     * Last value for a header name (case-insensitive). This is the value a
     * single-value view keeps.
     *
     * @return the last value, or {@code null} if the header is absent
     */
    public String last(String name) {
        List<String> values = index.get(name);
        return values != null ? values.get(values.size() - 1) : null;
    }

    /**
     * All values for a header name (case-insensitive), in arrival order.
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String name) {
        List<String> values = index.get(name);
        return values != null ? Collections.unmodifiableList(values) : List.of();
    }

    /** True if the header exists (case-insensitive). */
    public boolean contains(String name) {
        return index.containsKey(name);
    }

    /** Returns {@code true} if no headers are present. */
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Number of pairs, duplicates counted. */
    public int size() {
        return entries.size();
    }

    /** True if at least one name (case-insensitive) occurs more than once. */
    public boolean hasDuplicateNames() {
        return index.size() < entries.size();
    }

    /** Every pair in arrival order. */
    public List<Map.Entry<String, String>> entries() {
        return entries;
    }

    /**
     * Single-value view with last-write-wins semantics. Keys use the first-seen
     * spelling of each name and follow first-seen order.
     *
     * @return an unmodifiable map
     */
    public Map<String, String> toSingleValueMap() {
        Map<String, String> result = new LinkedHashMap<>();
        Map<String, String> spelling = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, String> entry : entries) {
            String key = spelling.computeIfAbsent(entry.getKey(), k -> k);
            result.put(key, entry.getValue());
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Multi-value view. Keys use the first-seen spelling of each name, values
     * keep arrival order.
     *
     * @return an unmodifiable map
     */
    public Map<String, List<String>> toMultiValueMap() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        Map<String, String> spelling = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, String> entry : entries) {
            String key = spelling.computeIfAbsent(entry.getKey(), k -> k);
            result.computeIfAbsent(key, k -> new ArrayList<>()).add(entry.getValue());
        }
        result.replaceAll((key, values) -> Collections.unmodifiableList(values));
        return Collections.unmodifiableMap(result);
    }

    /** Returns a builder pre-populated with this collection's pairs. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        entries.forEach(entry -> builder.add(entry.getKey(), entry.getValue()));
        return builder;
    }

    // ── Factory methods ──

    /**
     * Creates headers from a single-value map, keeping the map's iteration
     * order.
     *
     * @param singleValue header name → single value
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        singleValue.forEach(builder::add);
        return builder.build();
    }

    /**
     * Creates headers from a multi-value map, keeping the map's iteration
     * order.
     *
     * @param multiValue header name → list of values
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        multiValue.forEach((name, values) -> values.forEach(value -> builder.add(name, value)));
        return builder.build();
    }

    /** Returns an empty headers instance. */
    public static HttpHeaders empty() {
        return EMPTY;
    }

    /** Returns a new, empty builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** Accumulates header pairs in order. Not thread-safe. */
    public static final class Builder {
        private final List<Map.Entry<String, String>> entries = new ArrayList<>();

        Builder() {}

        /** Appends one pair. Null names or values are rejected. */
        public Builder add(String name, String value) {
            Objects.requireNonNull(name, "header name must not be null");
            Objects.requireNonNull(value, "header value must not be null for '" + name + "'");
            entries.add(Map.entry(name, value));
            return this;
        }

        /**
         * Removes every pair with the given name (case-insensitive), then
         * appends one pair.
         */
        public Builder set(String name, String value) {
            remove(name);
            return add(name, value);
        }

        /** Removes every pair with the given name (case-insensitive). */
        public Builder remove(String name) {
            entries.removeIf(entry -> entry.getKey().equalsIgnoreCase(name));
            return this;
        }

        /**
         * True if a pair with the given name has been added (case-insensitive).
         */
        public boolean contains(String name) {
            return entries.stream().anyMatch(entry -> entry.getKey().equalsIgnoreCase(name));
        }

        public HttpHeaders build() {
            return entries.isEmpty() ? EMPTY : new HttpHeaders(entries);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + index.keySet();
    }
}
