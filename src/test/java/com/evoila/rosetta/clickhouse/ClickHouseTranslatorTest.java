package com.evoila.rosetta.clickhouse;

import static org.assertj.core.api.Assertions.assertThat;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ClickHouseTranslator Tests")
class ClickHouseTranslatorTest {

  private final ClickHouseTranslator translator = new ClickHouseTranslator();

  @Test
  void shouldRenderWindowAsStartOfInterval() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("cpu"))
            .timeRange(TimeRange.Relative.of(3600000))
            .aggregation(Aggregation.of(AggFunction.Basic.AVG, "usage"))
            .window(Window.of(WindowKind.Interval.of(300000)))
            .group(GroupBy.tag("host"))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo(
            "SELECT toStartOfInterval(timestamp, toIntervalMinute(5)) AS bucket, host,"
                + " avg(usage) FROM cpu WHERE timestamp >= now() - toIntervalHour(1)"
                + " GROUP BY bucket, host");
  }

  @Test
  void shouldUseParametricQuantileAndMatch() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("requests"))
            .aggregation(Aggregation.of(new AggFunction.Percentile(0.95), "latency"))
            .filter(Filter.of(new FilterCondition.Regex("host", "web.*", false)))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo("SELECT quantile(0.95)(latency) FROM requests WHERE match(host, 'web.*')");
  }

  @Test
  void shouldRenderAbsoluteRangeAsDateTimeLiterals() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("cpu"))
            .timeRange(new TimeRange.Absolute(1704067200000L, 1704070800500L))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo(
            "SELECT * FROM cpu WHERE timestamp >= '2024-01-01 00:00:00'"
                + " AND timestamp < '2024-01-01 01:00:00.500'");
  }

  @Test
  void shouldCountDistinctExactly() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("visits"))
            .aggregation(Aggregation.of(AggFunction.Basic.COUNT_DISTINCT, "user_id"))
            .build();

    assertThat(translator.translate(plan)).isEqualTo("SELECT uniqExact(user_id) FROM visits");
  }

  @Test
  void shouldApproximateTopKWithOrderAndLimit() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("cpu"))
            .aggregation(Aggregation.of(new AggFunction.TopK(3)))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo("SELECT value FROM cpu ORDER BY value DESC LIMIT 3");
  }

  @Test
  void shouldRenderSampleAsGroupArraySample() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("m"))
            .aggregation(Aggregation.of(new AggFunction.Sample(4), "x"))
            .build();

    String query = translator.translate(plan);

    assertThat(query).isEqualTo("SELECT groupArraySample(4)(x) FROM m");
    assertThat(new ClickHouseParser().parse(query).getAggregations())
        .containsExactly(Aggregation.of(new AggFunction.Sample(4), "x"));
  }

  @Test
  void shouldReparseQuotedTableNameWithWhitespace() {
    QueryPlan plan = QueryPlan.builder().source(DataSource.table("weird name-with.dots")).build();

    assertThat(new ClickHouseParser().parse(translator.translate(plan)).getSources())
        .extracting(DataSource::name)
        .containsExactly("weird name-with.dots");
  }

  @Test
  void shouldQuoteIdentifiersWithBackticks() {
    QueryPlan plan = QueryPlan.builder().source(DataSource.table("my-table")).build();

    assertThat(translator.translate(plan)).isEqualTo("SELECT * FROM `my-table`");
  }
}
