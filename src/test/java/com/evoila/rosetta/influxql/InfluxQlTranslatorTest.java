package com.evoila.rosetta.influxql;

import static org.assertj.core.api.Assertions.assertThat;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.OrderBy;
import com.evoila.rosetta.common.plan.QueryHints;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Transformation;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.promql.PromQlParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InfluxQlTranslator Tests")
class InfluxQlTranslatorTest {

  private final InfluxQlTranslator translator = new InfluxQlTranslator();

  @Test
  void shouldRenderCounterRateAsDerivative() {
    QueryPlan plan = new PromQlParser().parse("rate(http_requests_total{job=\"api\"}[5m])");

    String query = translator.translate(plan);

    assertThat(query)
        .isEqualTo(
            "SELECT non_negative_derivative(\"value\", 1s) FROM \"http_requests_total\""
                + " WHERE time >= now() - 5m AND \"job\" = 'api'");
    assertThat(query).contains("derivative(").contains("FROM \"http_requests_total\"");
  }

  @Test
  void shouldRenderWindowGroupingAndFill() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.measurement("cpu"))
            .timeRange(TimeRange.Relative.of(3600000))
            .aggregation(Aggregation.of(AggFunction.Basic.AVG, "usage"))
            .window(new Window(WindowKind.Interval.of(60000), FillStrategy.Basic.PREVIOUS))
            .group(GroupBy.tag("host"))
            .filter(Filter.of(new FilterCondition.Regex("host", "web.*", false)))
            .limit(10L)
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo(
            "SELECT mean(\"usage\") FROM \"cpu\" WHERE time >= now() - 1h"
                + " AND \"host\" =~ /web.*/ GROUP BY time(1m), \"host\" fill(previous) LIMIT 10");
  }

  @Test
  void shouldRenderWindowOffset() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.measurement("cpu"))
            .aggregation(Aggregation.of(AggFunction.Basic.MAX, "usage"))
            .window(Window.of(new WindowKind.Interval(60000, 15000L, null)))
            .build();

    assertThat(translator.translate(plan)).endsWith("GROUP BY time(1m, 15s)");
  }

  @Test
  void shouldExpressPercentilesInPercent() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.measurement("requests"))
            .aggregation(Aggregation.of(new AggFunction.Percentile(0.95), "latency"))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo("SELECT percentile(\"latency\", 95) FROM \"requests\"");
  }

  @Test
  void shouldUseNativeTopSelector() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.measurement("cpu"))
            .aggregation(Aggregation.of(new AggFunction.TopK(5)))
            .build();

    assertThat(translator.translate(plan)).isEqualTo("SELECT top(\"value\", 5) FROM \"cpu\"");
  }

  @Test
  void shouldWrapAggregateInDerivativeTransformation() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.measurement("net"))
            .aggregation(Aggregation.of(AggFunction.Basic.AVG))
            .transformation(Transformation.of(new TransformType.Derivative(1000L, false)))
            .window(Window.of(WindowKind.Interval.of(60000)))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo("SELECT derivative(mean(\"value\"), 1s) FROM \"net\" GROUP BY time(1m)");
  }

  @Test
  void shouldRenderAbsoluteBoundsAsTimestamps() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.measurement("cpu"))
            .timeRange(new TimeRange.Absolute(1704067200000L, 1704070800000L))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo(
            "SELECT * FROM \"cpu\" WHERE time >= '2024-01-01T00:00:00Z'"
                + " AND time < '2024-01-01T01:00:00Z'");
  }

  @Test
  void shouldOnlyKeepOrderingOnTime() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.measurement("cpu"))
            .order(OrderBy.desc("value"))
            .order(OrderBy.desc("time"))
            .build();

    assertThat(translator.translate(plan)).isEqualTo("SELECT * FROM \"cpu\" ORDER BY time DESC");
  }

  @Test
  void shouldOmitNextValueFill() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.measurement("cpu"))
            .aggregation(Aggregation.of(AggFunction.Basic.SUM, "v"))
            .window(new Window(WindowKind.Interval.of(10000), FillStrategy.Basic.NEXT))
            .build();

    assertThat(translator.translate(plan)).doesNotContain("fill(").endsWith("GROUP BY time(10s)");
  }

  @Test
  void shouldKeepSeriesLimitOfInfluxQlSource() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.measurement("cpu"))
            .sourceDialect(Dialect.INFLUXQL)
            .hints(QueryHints.builder().customHint("slimit", "3").build())
            .build();

    assertThat(translator.translate(plan)).isEqualTo("SELECT * FROM \"cpu\" SLIMIT 3");
  }
}
