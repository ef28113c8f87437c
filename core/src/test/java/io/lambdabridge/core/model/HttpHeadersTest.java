package io.lambdabridge.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link HttpHeaders}. */
class HttpHeadersTest {

    // ── Case-insensitive lookup ──

    @Test
    void firstIsCaseInsensitive() {
        HttpHeaders headers = HttpHeaders.of(Map.of("Content-Type", "application/json"));
        assertThat(headers.first("content-type")).isEqualTo("application/json");
        assertThat(headers.first("CONTENT-TYPE")).isEqualTo("application/json");
    }

    @Test
    void firstAndLastReturnNullForMissingHeader() {
        HttpHeaders headers = HttpHeaders.of(Map.of("Accept", "text/html"));
        assertThat(headers.first("X-Missing")).isNull();
        assertThat(headers.last("X-Missing")).isNull();
    }

    // ── Duplicates ──

    @Test
    void duplicatesAreKeptInArrivalOrder() {
        HttpHeaders headers = HttpHeaders.builder()
                .add("Set-Cookie", "a=1")
                .add("X-Other", "x")
                .add("set-cookie", "b=2")
                .build();

        assertThat(headers.size()).isEqualTo(3);
        assertThat(headers.all("SET-COOKIE")).containsExactly("a=1", "b=2");
        assertThat(headers.first("Set-Cookie")).isEqualTo("a=1");
        assertThat(headers.last("Set-Cookie")).isEqualTo("b=2");
        assertThat(headers.hasDuplicateNames()).isTrue();
    }

    @Test
    void distinctNamesHaveNoDuplicates() {
        HttpHeaders headers = HttpHeaders.builder().add("A", "1").add("B", "2").build();
        assertThat(headers.hasDuplicateNames()).isFalse();
    }

    // ── Views ──

    @Test
    void singleValueMapIsLastWriteWinsWithFirstSpelling() {
        HttpHeaders headers = HttpHeaders.builder()
                .add("X-Trace", "one")
                .add("Accept", "text/plain")
                .add("x-trace", "two")
                .build();

        assertThat(headers.toSingleValueMap())
                .containsExactly(Map.entry("X-Trace", "two"), Map.entry("Accept", "text/plain"));
    }

    @Test
    void multiValueMapGroupsByNameIgnoringCase() {
        HttpHeaders headers = HttpHeaders.builder()
                .add("Vary", "Accept")
                .add("VARY", "Origin")
                .build();

        assertThat(headers.toMultiValueMap()).containsExactly(Map.entry("Vary", List.of("Accept", "Origin")));
    }

    @Test
    void ofMultiKeepsMapOrder() {
        Map<String, List<String>> multi = new LinkedHashMap<>();
        multi.put("B", List.of("1", "2"));
        multi.put("A", List.of("3"));

        HttpHeaders headers = HttpHeaders.ofMulti(multi);

        assertThat(headers.entries())
                .extracting(Map.Entry::getKey)
                .containsExactly("B", "B", "A");
    }

    // ── Builder ──

    @Test
    void setReplacesEveryValueOfTheName() {
        HttpHeaders headers = HttpHeaders.builder()
                .add("Content-Type", "text/plain")
                .add("content-type", "text/html")
                .set("Content-Type", "application/json")
                .build();

        assertThat(headers.all("content-type")).containsExactly("application/json");
    }

    @Test
    void toBuilderCopiesAndLeavesOriginalUntouched() {
        HttpHeaders original = HttpHeaders.of(Map.of("A", "1"));
        HttpHeaders extended = original.toBuilder().add("B", "2").build();

        assertThat(original.size()).isEqualTo(1);
        assertThat(extended.size()).isEqualTo(2);
    }

    @Test
    void nullValueIsRejected() {
        assertThatThrownBy(() -> HttpHeaders.builder().add("X", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void emptyHeaders() {
        assertThat(HttpHeaders.empty().isEmpty()).isTrue();
        assertThat(HttpHeaders.of(null)).isEqualTo(HttpHeaders.empty());
    }

    @Test
    void equalityFollowsEntries() {
        HttpHeaders a = HttpHeaders.builder().add("A", "1").build();
        HttpHeaders b = HttpHeaders.builder().add("A", "1").build();
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }
}
