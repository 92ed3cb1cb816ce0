package com.astradesk.worklog.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.TimeZone;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("DateUtils")
class DateUtilsTest {

    @Nested
    @DisplayName("Day arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("crosses month, year and leap-day boundaries")
        void shouldCrossBoundaries() {
            assertThat(DateUtils.addDays("2024-01-31", 1)).isEqualTo("2024-02-01");
            assertThat(DateUtils.addDays("2024-02-28", 1)).isEqualTo("2024-02-29");
            assertThat(DateUtils.subtractDays("2024-01-05", 30)).isEqualTo("2023-12-06");
            assertThat(DateUtils.nextDay("2023-12-31")).isEqualTo("2024-01-01");
        }

        @Test
        @DisplayName("is not shifted by a DST transition in the default zone")
        void shouldIgnoreDefaultZone() {
            TimeZone original = TimeZone.getDefault();
            try {
                TimeZone.setDefault(TimeZone.getTimeZone("America/Santiago"));
                assertThat(DateUtils.nextDay("2024-09-07")).isEqualTo("2024-09-08");
                assertThat(DateUtils.addDays("2024-04-06", 1)).isEqualTo("2024-04-07");
            } finally {
                TimeZone.setDefault(original);
            }
        }

        @Test
        @DisplayName("rejects input that is not an ISO date")
        void shouldRejectGarbage() {
            assertThatThrownBy(() -> DateUtils.addDays("yesterday", 1))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("iterates days inclusively and yields nothing for an inverted range")
        void shouldIterateDays() {
            assertThat(DateUtils.daysBetweenInclusive("2024-02-27", "2024-03-01"))
                .containsExactly("2024-02-27", "2024-02-28", "2024-02-29", "2024-03-01");
            assertThat(DateUtils.daysBetweenInclusive("2024-03-02", "2024-03-01")).isEmpty();
        }
    }

    @Nested
    @DisplayName("normalizeToIsoDate")
    class Normalize {

        @ParameterizedTest(name = "''{0}'' -> ''{1}''")
        @CsvSource({
            "2024-01-05, 2024-01-05",
            "05-01-2024, 2024-01-05",
            "05/01/2024, 2024-01-05",
            "5/1/2024, 2024-01-05",
            "' 2024-03-09 ', 2024-03-09",
            "January 5th, January 5th",
            "2024/01/05, 2024/01/05"
        })
        void shouldNormalize(String input, String expected) {
            assertThat(DateUtils.normalizeToIsoDate(input)).isEqualTo(expected);
        }

        @Test
        @DisplayName("keeps null as null")
        void shouldKeepNull() {
            assertThat(DateUtils.normalizeToIsoDate(null)).isNull();
        }
    }

    @Test
    @DisplayName("isIsoDate accepts only real calendar days")
    void shouldValidateIsoDates() {
        assertThat(DateUtils.isIsoDate("2024-02-29")).isTrue();
        assertThat(DateUtils.isIsoDate("2023-02-29")).isFalse();
        assertThat(DateUtils.isIsoDate("2024/02/01")).isFalse();
        assertThat(DateUtils.isIsoDate(null)).isFalse();
    }

    @Test
    @DisplayName("datePart keeps the date as written in the timestamp")
    void shouldTakeDatePart() {
        assertThat(DateUtils.datePart("2024-01-05T23:30:00.000-0500")).isEqualTo("2024-01-05");
        assertThat(DateUtils.datePart("2024-01-05")).isEqualTo("2024-01-05");
    }
}
