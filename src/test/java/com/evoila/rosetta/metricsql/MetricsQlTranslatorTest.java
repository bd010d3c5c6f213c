package com.evoila.rosetta.metricsql;

import static org.assertj.core.api.Assertions.assertThat;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricsQlTranslator Tests")
class MetricsQlTranslatorTest {

  private final MetricsQlTranslator translator = new MetricsQlTranslator();

  @Test
  void shouldTargetMetricsQl() {
    assertThat(translator.targetDialect()).isEqualTo(Dialect.METRICSQL);
  }

  @Test
  void shouldRenderRowBoundsAsLimitOffset() {
    QueryPlan plan =
        QueryPlan.builder().source(DataSource.metric("up")).limit(10L).offset(5L).build();

    assertThat(translator.translate(plan)).isEqualTo("limit_offset(10, 5, up)");
  }

  @Test
  void shouldDropOffsetWithoutLimit() {
    QueryPlan plan = QueryPlan.builder().source(DataSource.metric("up")).offset(5L).build();

    assertThat(translator.translate(plan)).isEqualTo("up");
  }

  @Test
  void shouldUseMetricsQlRollups() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.metric("latency"))
            .aggregation(Aggregation.of(AggFunction.Basic.MEDIAN))
            .window(Window.of(new WindowKind.Range(300000)))
            .build();

    assertThat(translator.translate(plan)).isEqualTo("median_over_time(latency[5m])");
  }

  @Test
  void shouldUseMedianOperatorAcrossSeries() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.metric("latency"))
            .aggregation(Aggregation.of(AggFunction.Basic.MEDIAN))
            .build();

    assertThat(translator.translate(plan)).isEqualTo("median (latency)");
  }

  @Test
  void shouldKeepPromQlRendering() {
    String query = "sum by (job) (rate(http_requests_total[5m]))";

    assertThat(translator.translate(new MetricsQlParser().parse(query))).isEqualTo(query);
  }
}
