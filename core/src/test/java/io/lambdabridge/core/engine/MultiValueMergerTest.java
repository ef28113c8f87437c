package io.lambdabridge.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.lambdabridge.core.event.EventKind;
import io.lambdabridge.core.model.HttpHeaders;
import io.lambdabridge.core.model.QueryParameters;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Tests for {@link MultiValueMerger}. */
class MultiValueMergerTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger mergerLogger;
    private Level previousLevel;

    @BeforeEach
    void setUp() {
        mergerLogger = (Logger) LoggerFactory.getLogger(MultiValueMerger.class);
        previousLevel = mergerLogger.getLevel();
        mergerLogger.setLevel(Level.DEBUG);
        logAppender = new ListAppender<>();
        logAppender.start();
        mergerLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        mergerLogger.detachAppender(logAppender);
        mergerLogger.setLevel(previousLevel);
    }

    @Test
    void multiValueIsAuthoritative() {
        HttpHeaders headers = MultiValueMerger.mergeHeaders(
                Map.of("Accept", "text/plain"),
                Map.of("Accept", List.of("text/html", "text/plain")),
                EventKind.REST_PROXY);

        assertThat(headers.all("accept")).containsExactly("text/html", "text/plain");
        assertThat(logAppender.list).isEmpty();
    }

    @Test
    void singleOnlyNamesAreAppended() {
        Map<String, String> single = new LinkedHashMap<>();
        single.put("X-Only-Single", "1");
        single.put("accept", "text/html");

        HttpHeaders headers = MultiValueMerger.mergeHeaders(
                single, Map.of("Accept", List.of("text/html")), EventKind.REST_PROXY);

        assertThat(headers.entries())
                .containsExactly(Map.entry("Accept", "text/html"), Map.entry("X-Only-Single", "1"));
    }

    @Test
    void disagreementIsLoggedAndIgnored() {
        HttpHeaders headers = MultiValueMerger.mergeHeaders(
                Map.of("Accept", "application/xml"),
                Map.of("Accept", List.of("text/html")),
                EventKind.REST_PROXY);

        assertThat(headers.all("Accept")).containsExactly("text/html");
        assertThat(logAppender.list)
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
                    assertThat(event.getFormattedMessage()).startsWith("header.discrepancy");
                });
    }

    @Test
    void onlySingleValueFormPresent() {
        QueryParameters query = MultiValueMerger.mergeQuery(
                Map.of("a", "1"), Map.of(), UnaryOperator.identity(), EventKind.LOAD_BALANCER_TARGET);

        assertThat(query.entries()).containsExactly(Map.entry("a", "1"));
    }

    @Test
    void queryKeysAreCaseSensitive() {
        QueryParameters query = MultiValueMerger.mergeQuery(
                Map.of("Key", "x"), Map.of("key", List.of("y")), UnaryOperator.identity(), EventKind.REST_PROXY);

        assertThat(query.entries()).containsExactly(Map.entry("key", "y"), Map.entry("Key", "x"));
    }

    @Test
    void decoderAppliesToBothForms() {
        QueryParameters query = MultiValueMerger.mergeQuery(
                Map.of("b%20c", "d%26e"),
                Map.of("a", List.of("%C3%A9")),
                QueryParameters::decode,
                EventKind.LOAD_BALANCER_TARGET);

        assertThat(query.entries()).containsExactly(Map.entry("a", "é"), Map.entry("b c", "d&e"));
    }
}
