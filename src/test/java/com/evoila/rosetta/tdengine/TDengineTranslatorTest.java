package com.evoila.rosetta.tdengine;

import static org.assertj.core.api.Assertions.assertThat;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TDengineTranslator Tests")
class TDengineTranslatorTest {

  private final TDengineTranslator translator = new TDengineTranslator();

  private static QueryPlan.QueryPlanBuilder meters() {
    return QueryPlan.builder()
        .source(DataSource.table("meters"))
        .aggregation(Aggregation.of(AggFunction.Basic.AVG, "current"));
  }

  @Test
  void shouldPartitionByTagsAndFillInterval() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("cpu"))
            .timeRange(TimeRange.Relative.of(3600000))
            .aggregation(Aggregation.of(AggFunction.Basic.AVG, "usage"))
            .window(new Window(WindowKind.Interval.of(300000), FillStrategy.Basic.PREVIOUS))
            .group(GroupBy.tag("host"))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo(
            "SELECT _wstart, host, avg(usage) FROM cpu WHERE ts >= NOW() - 1h"
                + " PARTITION BY host INTERVAL(5m) FILL(PREV)");
  }

  @Test
  void shouldRenderSlidingIntervalWithConstantFill() {
    QueryPlan plan =
        meters()
            .window(
                new Window(
                    new WindowKind.Interval(60000, null, 30000L),
                    new FillStrategy.Constant(Value.of(0L))))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo(
            "SELECT _wstart, avg(current) FROM meters INTERVAL(1m) SLIDING(30s) FILL(VALUE, 0)");
  }

  @Test
  void shouldRenderSessionWindowOnTimeColumn() {
    QueryPlan plan = meters().window(Window.of(new WindowKind.Session(60000, null))).build();

    assertThat(translator.translate(plan)).endsWith(" SESSION(ts, 1m)");
  }

  @Test
  void shouldRenderCountWindow() {
    QueryPlan plan = meters().window(Window.of(new WindowKind.Count(100, 10L))).build();

    assertThat(translator.translate(plan)).endsWith(" COUNT_WINDOW(100, 10)");
  }

  @Test
  void shouldRenderStateWindow() {
    QueryPlan plan = meters().window(Window.of(new WindowKind.State("status"))).build();

    assertThat(translator.translate(plan)).endsWith(" STATE_WINDOW(status)");
  }

  @Test
  void shouldUseMillisecondUnitBelowOneSecond() {
    QueryPlan plan = meters().window(Window.of(WindowKind.Interval.of(500))).build();

    assertThat(translator.translate(plan)).endsWith(" INTERVAL(500a)");
  }

  @Test
  void shouldRenderMedianAsFiftiethPercentile() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("meters"))
            .aggregation(Aggregation.of(AggFunction.Basic.MEDIAN, "voltage"))
            .build();

    assertThat(translator.translate(plan)).isEqualTo("SELECT percentile(voltage, 50) FROM meters");
  }

  @Test
  void shouldUseNativeTopFunction() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("meters"))
            .aggregation(Aggregation.of(new AggFunction.TopK(3), "current"))
            .build();

    assertThat(translator.translate(plan)).isEqualTo("SELECT top(current, 3) FROM meters");
  }
}
