package com.evoila.rosetta.metricsql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Transformation;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.promql.PromQlParser;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricsQlParser Tests")
class MetricsQlParserTest {

  private final MetricsQlParser parser = new MetricsQlParser();

  @Test
  void shouldParsePromQlCompatibleQueries() {
    QueryPlan plan = parser.parse("sum by (job) (rate(http_requests_total[5m]))");

    assertThat(plan.getSourceDialect()).isEqualTo(Dialect.METRICSQL);
    assertThat(plan.getAggregations())
        .extracting(Aggregation::function)
        .containsExactly(AggFunction.Basic.RATE, AggFunction.Basic.SUM);
  }

  @Test
  void shouldMapMetricsQlOperators() {
    assertThat(parser.parse("median(cpu)").getAggregations())
        .containsExactly(Aggregation.of(AggFunction.Basic.MEDIAN));
    assertThat(parser.parse("distinct(cpu)").getAggregations())
        .containsExactly(Aggregation.of(AggFunction.Basic.COUNT_DISTINCT));
    assertThat(parser.parse("median_over_time(cpu[5m])").getAggregations())
        .containsExactly(Aggregation.of(AggFunction.Basic.MEDIAN));
  }

  @Test
  void shouldKeepTopkVariantsAsCustomAggregations() {
    QueryPlan plan = parser.parse("topk_avg(3, range_avg(cpu_usage))");

    assertThat(plan.getSources()).containsExactly(DataSource.metric("cpu_usage"));
    assertThat(plan.getTransformations())
        .containsExactly(Transformation.of(new TransformType.Custom("range_avg", List.of())));
    assertThat(plan.getAggregations())
        .containsExactly(
            new Aggregation(
                new AggFunction.Custom("topk_avg"), null, List.of(Value.of(3.0)), null, false));
  }

  @Test
  void shouldKeepRollupsAsCustomAggregations() {
    QueryPlan plan = parser.parse("rollup_rate(requests[5m])");

    assertThat(plan.getAggregations())
        .extracting(Aggregation::function)
        .containsExactly(new AggFunction.Custom("rollup_rate"));
  }

  @Test
  void shouldRewriteLabelCopyAsLabelReplace() {
    QueryPlan plan = parser.parse("label_copy(up, \"instance\", \"host\")");

    assertThat(plan.getTransformations())
        .containsExactly(
            Transformation.of(new TransformType.LabelReplace("host", "$1", "instance", "(.*)")));
  }

  @Test
  void shouldDeleteSourceLabelsOnLabelMove() {
    QueryPlan plan = parser.parse("label_move(up, \"instance\", \"host\")");

    assertThat(plan.getTransformations())
        .containsExactly(
            Transformation.of(new TransformType.LabelReplace("host", "$1", "instance", "(.*)")),
            Transformation.of(
                new TransformType.Custom("label_del", List.of(Value.of("instance")))));
  }

  @Test
  void shouldRecordTemplatesAndModifiers() {
    QueryPlan plan = parser.parse("WITH (q = up{job=\"api\"}) rate(q[5m]) keep_metric_names");

    assertThat(plan.getHints().getCustom())
        .containsEntry("with", "q = up{job=\"api\"}")
        .containsEntry("keep_metric_names", "true");
    assertThat(plan.getSources()).containsExactly(DataSource.metric("q"));
  }

  @Test
  void shouldRejectIncompleteLabelPairs() {
    assertThatThrownBy(() -> parser.parse("label_copy(up, \"instance\")"))
        .isInstanceOf(QueryParseException.class)
        .hasMessageContaining("pairs of label names");
  }

  @Test
  void shouldRejectTemplatesInPromQl() {
    assertThatThrownBy(() -> new PromQlParser().parse("WITH (q = up) q"))
        .isInstanceOf(QueryParseException.class);
  }
}
