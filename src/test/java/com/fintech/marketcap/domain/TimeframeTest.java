package com.fintech.marketcap.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Timeframe Tests")
class TimeframeTest {

    @ParameterizedTest(name = "{0} -> {1}ms")
    @CsvSource({
        "1s, 1000",
        "1m, 60000",
        "5m, 300000",
        "15m, 900000",
        "1h, 3600000",
        "4h, 14400000",
        "1d, 86400000",
        "1w, 604800000"
    })
    @DisplayName("Should parse supported labels")
    void testParse(String label, long expectedMillis) {
        assertThat(Timeframe.parse(label).millis()).isEqualTo(expectedMillis);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "m", "1x", "abc", "-1m", "0m", "1.5h"})
    @DisplayName("Should reject unknown labels")
    void testParseInvalid(String label) {
        assertThatThrownBy(() -> Timeframe.parse(label))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject null label")
    void testParseNull() {
        assertThatThrownBy(() -> Timeframe.parse(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should align timestamps to bucket start")
    void testAlignTimestamp() {
        Timeframe oneMinute = Timeframe.M1;

        assertThat(oneMinute.alignTimestamp(0L)).isEqualTo(0L);
        assertThat(oneMinute.alignTimestamp(59_999L)).isEqualTo(0L);
        assertThat(oneMinute.alignTimestamp(60_000L)).isEqualTo(60_000L);
        assertThat(oneMinute.alignTimestamp(185_000L)).isEqualTo(180_000L);
        assertThat(oneMinute.alignTimestamp(-1L)).isEqualTo(-60_000L);
    }

    @Test
    @DisplayName("Labels use the largest whole unit")
    void testLabel() {
        assertThat(Timeframe.M1.label()).isEqualTo("1m");
        assertThat(Timeframe.M15.toString()).isEqualTo("15m");
        assertThat(Timeframe.H1.label()).isEqualTo("1h");
        assertThat(Timeframe.ofMillis(1_500L).label()).isEqualTo("1500ms");
        assertThat(Timeframe.parse("60m")).isEqualTo(Timeframe.H1);
    }

    @Test
    @DisplayName("Should order by width")
    void testOrdering() {
        assertThat(Timeframe.M1).isLessThan(Timeframe.M5);
        assertThat(Timeframe.H1).isGreaterThan(Timeframe.M15);
    }
}
