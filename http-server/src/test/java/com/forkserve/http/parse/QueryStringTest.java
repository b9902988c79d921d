package com.forkserve.http.parse;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryStringTest {

    @Test
    void parsesPairs() {
        assertThat(QueryString.parse("a=1&b=2")).isEqualTo(Map.of("a", "1", "b", "2"));
    }

    @Test
    void lastOccurrenceWins() {
        assertThat(QueryString.parse("a=1&a=2")).isEqualTo(Map.of("a", "2"));
    }

    @Test
    void keysWithoutValueAreEmpty() {
        assertThat(QueryString.parse("a&b=")).isEqualTo(Map.of("a", "", "b", ""));
    }

    @Test
    void emptyKeysAreSkipped() {
        assertThat(QueryString.parse("=x&&b=1&")).isEqualTo(Map.of("x", "", "b", "1"));
        assertThat(QueryString.parse("")).isEmpty();
    }

    @Test
    void valuesMayContainEquals() {
        assertThat(QueryString.parse("expr=a=b")).containsEntry("expr", "a=b");
    }

    @Test
    void decodesKeysAndValues() {
        assertThat(QueryString.parse("na%6De=J%C3%BCrgen&plus=a+b"))
                .containsEntry("name", "Jürgen")
                .containsEntry("plus", "a+b");
    }

    @Test
    void malformedEscapeDropsOnlyThatPair() {
        assertThat(QueryString.parse("bad=%zz&good=1&worse=%E2%82")).isEqualTo(Map.of("good", "1"));
    }
}
