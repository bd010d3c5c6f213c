package com.evoila.rosetta.common.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("DurationUtils Tests")
class DurationUtilsTest {

  @Nested
  @DisplayName("Compact literals")
  class Compact {

    @ParameterizedTest
    @CsvSource({
      "5m, 300000",
      "1h30m, 5400000",
      "250ms, 250",
      "1.5h, 5400000",
      "2d, 172800000",
      "1w, 604800000",
      "10s, 10000"
    })
    void parse(String literal, long expected) {
      assertThat(DurationUtils.parse(literal)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "5", "5x", "m5", "5m foo"})
    void parse_rejectsInvalid(String literal) {
      assertThatThrownBy(() -> DurationUtils.parse(literal))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(
        strings = {"99999999999999999999h", "99999999999999999.5d", "9223372036854775807ms1ms"})
    void parse_rejectsOutOfRange(String literal) {
      assertThatThrownBy(() -> DurationUtils.parse(literal))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("out of range");
    }

    @Test
    void parseSqlInterval_rejectsOutOfRange() {
      assertThatThrownBy(() -> DurationUtils.parseSqlInterval("99999999999999999999 hours"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("out of range");
    }

    @Test
    @DisplayName("Should honour dialect unit tables")
    void parse_customUnits() {
      Map<String, Long> units = new HashMap<>(DurationUtils.COMPACT_UNITS);
      units.put("a", 1L);

      assertThat(DurationUtils.parse("500a", units)).isEqualTo(500);
      assertThat(DurationUtils.isDuration("500a", DurationUtils.COMPACT_UNITS)).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
      "300000, 5m",
      "90000, 90s",
      "1500, 1500ms",
      "0, 0s",
      "172800000, 2d",
      "3600000, 1h"
    })
    void format(long millis, String expected) {
      assertThat(DurationUtils.format(millis)).isEqualTo(expected);
    }

    @Test
    void format_customMillisSuffix() {
      assertThat(DurationUtils.format(1500, "a")).isEqualTo("1500a");
    }
  }

  @Nested
  @DisplayName("SQL intervals")
  class SqlIntervals {

    @ParameterizedTest
    @CsvSource({
      "5 minutes, 300000",
      "1 HOUR, 3600000",
      "10 seconds, 10000",
      "5m, 300000",
      "1 day, 86400000",
      "2 weeks, 1209600000"
    })
    void parseSqlInterval(String phrase, long expected) {
      assertThat(DurationUtils.parseSqlInterval(phrase)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should accept quoted interval amounts")
    void parseSqlInterval_quotedAmount() {
      assertThat(DurationUtils.parseSqlInterval("'1' HOUR")).isEqualTo(DurationUtils.HOUR);
    }

    @Test
    void parseSqlInterval_unknownUnit() {
      assertThatThrownBy(() -> DurationUtils.parseSqlInterval("5 fortnights"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("fortnight");
    }

    @ParameterizedTest
    @CsvSource({
      "300000, 5 minutes",
      "3600000, 1 hour",
      "1000, 1 second",
      "1500, 1500 milliseconds"
    })
    void formatSqlInterval(long millis, String expected) {
      assertThat(DurationUtils.formatSqlInterval(millis)).isEqualTo(expected);
    }
  }

  @Nested
  @DisplayName("ISO-8601 periods")
  class IsoPeriods {

    @ParameterizedTest
    @CsvSource({"PT1H, 3600000", "PT5M, 300000", "P1D, 86400000", "P1W, 604800000"})
    void parseIsoPeriod(String text, long expected) {
      assertThat(DurationUtils.parseIsoPeriod(text)).isEqualTo(expected);
    }

    @Test
    void parseIsoPeriod_month() {
      assertThat(DurationUtils.parseIsoPeriod("P1M")).isEqualTo(DurationUtils.MONTH);
    }

    @Test
    void parseIsoPeriod_invalid() {
      assertThatThrownBy(() -> DurationUtils.parseIsoPeriod("hourly"))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatIsoPeriod() {
      assertThat(DurationUtils.formatIsoPeriod(DurationUtils.DAY)).isEqualTo("P1D");
      assertThat(DurationUtils.formatIsoPeriod(DurationUtils.HOUR)).isEqualTo("PT1H");
      assertThat(DurationUtils.formatIsoPeriod(90_000)).isEqualTo("PT1M30S");
    }
  }
}
