package io.lambdabridge.core.engine;

import io.lambdabridge.core.event.EventKind;
import io.lambdabridge.core.model.HttpHeaders;
import io.lambdabridge.core.model.QueryParameters;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the single-value and multi-value forms that proxy schemas send side by side.
 *
 * <p>
 * The multi-value form is authoritative. A single-value entry is appended only when its name is
 * absent from the multi-value form, so nothing the source sent is silently dropped. When the
 * name is present but the single value is not among the multi values, the discrepancy is logged
 * at DEBUG and the single value ignored.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
final class MultiValueMerger {

    private static final Logger LOG = LoggerFactory.getLogger(MultiValueMerger.class);

    private MultiValueMerger() {}

    /** Merges headers; names compare case-insensitively. */
    static HttpHeaders mergeHeaders(
            Map<String, String> singleValue, Map<String, List<String>> multiValue, EventKind kind) {
        HttpHeaders authoritative = HttpHeaders.ofMulti(multiValue);
        HttpHeaders.Builder merged = authoritative.toBuilder();
        singleValue.forEach((name, value) -> {
            if (!authoritative.contains(name)) {
                merged.add(name, value);
            } else if (!authoritative.all(name).contains(value)) {
                LOG.debug(
                        "header.discrepancy event_kind={} name={} single_value_ignored=true multi_value_count={}",
                        kind,
                        name,
                        authoritative.all(name).size());
            }
        });
        return merged.build();
    }

    /** Merges query parameters; keys compare case-sensitively. Keys and values pass through {@code decoder}. */
    static QueryParameters mergeQuery(
            Map<String, String> singleValue,
            Map<String, List<String>> multiValue,
            UnaryOperator<String> decoder,
            EventKind kind) {
        QueryParameters.Builder merged = QueryParameters.builder();
        multiValue.forEach((key, values) -> values.forEach(value -> merged.add(decoder.apply(key), decoder.apply(value))));
        QueryParameters authoritative = merged.build();
        QueryParameters.Builder result = QueryParameters.builder();
        authoritative.entries().forEach(entry -> result.add(entry.getKey(), entry.getValue()));
        singleValue.forEach((rawKey, rawValue) -> {
            String key = decoder.apply(rawKey);
            String value = decoder.apply(rawValue);
            if (!authoritative.contains(key)) {
                result.add(key, value);
            } else if (!authoritative.all(key).contains(value)) {
                LOG.debug(
                        "query.discrepancy event_kind={} key={} single_value_ignored=true multi_value_count={}",
                        kind,
                        key,
                        authoritative.all(key).size());
            }
        });
        return result.build();
    }
}
