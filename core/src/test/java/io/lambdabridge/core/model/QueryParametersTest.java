package io.lambdabridge.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link QueryParameters}. */
class QueryParametersTest {

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        void keepsOrderAndDuplicates() {
            QueryParameters query = QueryParameters.parse("a=1&b=2&a=3");

            assertThat(query.entries())
                    .containsExactly(Map.entry("a", "1"), Map.entry("b", "2"), Map.entry("a", "3"));
            assertThat(query.all("a")).containsExactly("1", "3");
        }

        @Test
        void percentDecodesKeysAndValues() {
            QueryParameters query = QueryParameters.parse("q=hello%20world&na%3Dme=caf%C3%A9&plus=a+b");

            assertThat(query.first("q")).isEqualTo("hello world");
            assertThat(query.first("na=me")).isEqualTo("café");
            assertThat(query.first("plus")).isEqualTo("a b");
        }

        @Test
        void leadingQuestionMarkAndEmptySegmentsAreIgnored() {
            QueryParameters query = QueryParameters.parse("?&a=1&&flag");

            assertThat(query.entries()).containsExactly(Map.entry("a", "1"), Map.entry("flag", ""));
        }

        @Test
        void nullOrEmptyGivesEmpty() {
            assertThat(QueryParameters.parse(null).isEmpty()).isTrue();
            assertThat(QueryParameters.parse("").isEmpty()).isTrue();
        }

        @Test
        void invalidEscapeIsRejected() {
            assertThatThrownBy(() -> QueryParameters.parse("a=%zz")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("views and formatting")
    class Views {

        @Test
        void keysAreCaseSensitive() {
            QueryParameters query = QueryParameters.builder().add("Key", "1").add("key", "2").build();

            assertThat(query.all("Key")).containsExactly("1");
            assertThat(query.all("key")).containsExactly("2");
        }

        @Test
        void singleValueViewIsLastWriteWins() {
            QueryParameters query = QueryParameters.parse("a=1&b=2&a=3");

            assertThat(query.toSingleValueMap()).containsExactly(Map.entry("a", "3"), Map.entry("b", "2"));
        }

        @Test
        void multiValueViewGroupsInFirstSeenOrder() {
            QueryParameters query = QueryParameters.parse("b=1&a=2&b=3");

            assertThat(query.toMultiValueMap())
                    .containsExactly(Map.entry("b", List.of("1", "3")), Map.entry("a", List.of("2")));
        }

        @Test
        void queryStringEncodesSpacesAsPercent20() {
            QueryParameters query = QueryParameters.builder()
                    .add("q", "hello world")
                    .add("tag", "a&b")
                    .build();

            assertThat(query.toQueryString()).isEqualTo("q=hello%20world&tag=a%26b");
        }

        @Test
        void formatThenParseKeepsEveryPair() {
            QueryParameters original = QueryParameters.builder()
                    .add("a", "1")
                    .add("a", "2")
                    .add("ü", "x y")
                    .build();

            assertThat(QueryParameters.parse(original.toQueryString())).isEqualTo(original);
        }
    }
}
