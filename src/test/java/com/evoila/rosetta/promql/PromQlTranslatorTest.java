package com.evoila.rosetta.promql;

import static org.assertj.core.api.Assertions.assertThat;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.ComparisonOp;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.OrderBy;
import com.evoila.rosetta.common.plan.QueryHints;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PromQlTranslator Tests")
class PromQlTranslatorTest {

  private final PromQlTranslator translator = new PromQlTranslator();
  private final PromQlParser parser = new PromQlParser();

  @Nested
  @DisplayName("Aggregations")
  class Aggregations {

    @Test
    void shouldRoundTripCounterRate() {
      String query = "rate(http_requests_total{job=\"api\"}[5m])";

      assertThat(translator.translate(parser.parse(query))).isEqualTo(query);
    }

    @Test
    void shouldPutGroupingOnOutermostOperator() {
      QueryPlan plan =
          QueryPlan.builder()
              .source(DataSource.metric("http_requests_total"))
              .aggregation(Aggregation.of(AggFunction.Basic.RATE))
              .aggregation(Aggregation.of(AggFunction.Basic.SUM))
              .window(Window.of(new WindowKind.Range(300000)))
              .group(GroupBy.tag("job"))
              .build();

      assertThat(translator.translate(plan))
          .isEqualTo("sum by (job) (rate(http_requests_total[5m]))");
    }

    @Test
    void shouldRollUpWindowedAggregationOverTime() {
      QueryPlan plan =
          QueryPlan.builder()
              .source(DataSource.measurement("cpu"))
              .timeRange(TimeRange.Relative.of(3600000))
              .aggregation(Aggregation.of(AggFunction.Basic.AVG, "value"))
              .window(Window.of(WindowKind.Interval.of(300000)))
              .build();

      assertThat(translator.translate(plan)).isEqualTo("avg_over_time(cpu[5m])");
    }

    @Test
    void shouldRollUpPercentileAsQuantileOverTime() {
      QueryPlan plan =
          QueryPlan.builder()
              .source(DataSource.metric("latency"))
              .aggregation(Aggregation.of(new AggFunction.Percentile(0.9)))
              .window(Window.of(new WindowKind.Range(300000)))
              .build();

      assertThat(translator.translate(plan)).isEqualTo("quantile_over_time(0.9, latency[5m])");
    }

    @Test
    void shouldSumGroupedPlanWithoutAggregation() {
      QueryPlan plan =
          QueryPlan.builder()
              .source(DataSource.metric("up"))
              .group(GroupBy.tag("host"))
              .build();

      assertThat(translator.translate(plan)).isEqualTo("sum by (host) (up)");
    }

    @Test
    void shouldKeepWithoutClauseOfPrometheusSource() {
      QueryPlan plan =
          QueryPlan.builder()
              .source(DataSource.metric("up"))
              .aggregation(Aggregation.of(AggFunction.Basic.SUM))
              .sourceDialect(Dialect.PROMQL)
              .hints(QueryHints.builder().customHint("without", "instance").build())
              .build();

      assertThat(translator.translate(plan)).isEqualTo("sum without (instance) (up)");
    }

    @Test
    void shouldSortRankedSeries() {
      QueryPlan plan =
          QueryPlan.builder()
              .source(DataSource.metric("up"))
              .aggregation(Aggregation.of(new AggFunction.TopK(5)))
              .order(OrderBy.desc("value"))
              .build();

      assertThat(translator.translate(plan)).isEqualTo("sort_desc(topk (5, up))");
    }
  }

  @Nested
  @DisplayName("Selectors")
  class Selectors {

    @Test
    void shouldTurnInListIntoRegexMatcherAndKeepValueThreshold() {
      QueryPlan plan =
          QueryPlan.builder()
              .source(DataSource.metric("cpu"))
              .filter(
                  Filter.of(
                      new FilterCondition.In(
                          "host", List.of(Value.of("a"), Value.of("b")), false)))
              .filter(
                  Filter.of(
                      new FilterCondition.Comparison("value", ComparisonOp.GT, Value.of(90L))))
              .build();

      assertThat(translator.translate(plan)).isEqualTo("cpu{host=~\"a|b\"} > 90");
    }

    @Test
    void shouldMoveInvalidMetricNameIntoMatcher() {
      QueryPlan plan = QueryPlan.builder().source(DataSource.metric("servers.cpu")).build();

      assertThat(translator.translate(plan)).isEqualTo("{__name__=\"servers.cpu\"}");
    }

    @Test
    void shouldRenderAbsoluteEndAsEvaluationTime() {
      QueryPlan plan =
          QueryPlan.builder()
              .source(DataSource.metric("cpu"))
              .timeRange(new TimeRange.Absolute(1704067200000L, 1704070800000L))
              .build();

      assertThat(translator.translate(plan)).isEqualTo("cpu @ 1704070800");
    }

    @Test
    void shouldFallBackToDefaultMetric() {
      assertThat(translator.translate(QueryPlan.builder().build())).isEqualTo("metric");
    }

    @Test
    void shouldDropRowBounds() {
      QueryPlan plan =
          QueryPlan.builder().source(DataSource.metric("up")).limit(10L).offset(5L).build();

      assertThat(translator.translate(plan)).isEqualTo("up");
    }
  }
}
