package com.evoila.rosetta.druid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("DruidSqlParser Tests")
class DruidSqlParserTest {

  private final DruidSqlParser parser = new DruidSqlParser();

  @Test
  void shouldParseTimeFloorBucket() {
    QueryPlan plan =
        parser.parse(
            "SELECT TIME_FLOOR(__time, 'PT1H') AS t, COUNT(*) FROM wikipedia GROUP BY 1");

    assertThat(plan.getSourceDialect()).isEqualTo(Dialect.DRUID_SQL);
    assertThat(plan.getWindows()).containsExactly(Window.of(WindowKind.Interval.of(3600000)));
    assertThat(plan.getGroupBy()).containsExactly(GroupBy.timeBucket(3600000, "__time"));
    assertThat(plan.getAggregations()).containsExactly(Aggregation.of(AggFunction.Basic.COUNT));
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      quoteCharacter = '"',
      value = {
        "FLOOR(__time TO HOUR)          | 3600000",
        "DATE_TRUNC('day', __time)      | 86400000",
        "TIME_FLOOR(__time, 'PT5M')     | 300000"
      })
  void shouldRecognizeBucketFunctions(String bucket, long widthMs) {
    QueryPlan plan = parser.parse("SELECT " + bucket + " AS b, SUM(added) FROM wiki GROUP BY b");

    assertThat(plan.getWindows()).containsExactly(Window.of(WindowKind.Interval.of(widthMs)));
  }

  @Test
  void shouldMapApproximateAggregates() {
    QueryPlan plan =
        parser.parse(
            "SELECT APPROX_COUNT_DISTINCT(user), APPROX_QUANTILE(latency, 0.99) FROM requests");

    assertThat(plan.getAggregations())
        .containsExactly(
            Aggregation.of(AggFunction.Basic.HYPER_LOG_LOG, "user"),
            Aggregation.of(new AggFunction.Apercentile(0.99), "latency"));
  }

  @Test
  void shouldReadTimeInIntervalAsAbsoluteRange() {
    QueryPlan plan =
        parser.parse(
            "SELECT COUNT(*) FROM wiki WHERE TIME_IN_INTERVAL(__time, '2024-01-01/2024-01-02')");

    assertThat(plan.getTimeRange())
        .isEqualTo(new TimeRange.Absolute(1704067200000L, 1704153600000L));
  }

  @Test
  void shouldReadCurrentTimestampLookBack() {
    QueryPlan plan =
        parser.parse(
            "SELECT COUNT(*) FROM wiki WHERE __time >= CURRENT_TIMESTAMP - INTERVAL '1' DAY");

    assertThat(plan.getTimeRange()).isEqualTo(TimeRange.Relative.of(86400000));
  }

  @Test
  void shouldParseIsoIntervalsWithOffsets() {
    assertThat(DruidSqlParser.isoInterval("2024-01-01T01:00:00+01:00/2024-01-01T02:00:00Z"))
        .contains(new TimeRange.Absolute(1704067200000L, 1704074400000L));
    assertThat(DruidSqlParser.isoInterval("2024-01-01")).isEmpty();
    assertThat(DruidSqlParser.isoInterval("yesterday/today")).isEmpty();
  }

  @Test
  void shouldRequireQuantileLevel() {
    assertThatThrownBy(() -> parser.parse("SELECT APPROX_QUANTILE(latency) FROM requests"))
        .isInstanceOf(QueryParseException.class)
        .hasMessageContaining("requires a quantile");
  }
}
