package com.evoila.rosetta.questdb;

import static org.assertj.core.api.Assertions.assertThat;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QuestDbTranslator Tests")
class QuestDbTranslatorTest {

  private final QuestDbTranslator translator = new QuestDbTranslator();

  @Test
  void shouldRenderWindowAsSampleBy() {
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
            "SELECT host, avg(usage) FROM cpu WHERE timestamp >= dateadd('h', -1, now())"
                + " SAMPLE BY 5m");
  }

  @Test
  void shouldRenderFillAndAlignment() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("trades"))
            .aggregation(Aggregation.of(AggFunction.Basic.SUM, "amount"))
            .window(
                new Window(
                    new WindowKind.SampleBy(3600000, "CALENDAR"), FillStrategy.Basic.PREVIOUS))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo("SELECT sum(amount) FROM trades SAMPLE BY 1h FILL(PREV) ALIGN TO CALENDAR");
  }

  @Test
  void shouldRenderOffsetAsRowRange() {
    QueryPlan plan =
        QueryPlan.builder().source(DataSource.table("trades")).limit(20L).offset(10L).build();

    assertThat(translator.translate(plan)).isEqualTo("SELECT * FROM trades LIMIT 10, 30");
  }

  @Test
  void shouldDropOffsetWithoutLimit() {
    QueryPlan plan = QueryPlan.builder().source(DataSource.table("trades")).offset(10L).build();

    assertThat(translator.translate(plan)).isEqualTo("SELECT * FROM trades");
  }

  @Test
  void shouldRenderPercentilesApproximately() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("requests"))
            .aggregation(Aggregation.of(new AggFunction.Percentile(0.95), "latency"))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo("SELECT approx_percentile(latency, 0.95) FROM requests");
  }

  @Test
  void shouldKeepGroupByWithoutWindow() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("trades"))
            .aggregation(Aggregation.of(AggFunction.Basic.COUNT_DISTINCT, "symbol"))
            .group(GroupBy.column("side"))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo("SELECT side, count_distinct(symbol) FROM trades GROUP BY side");
  }
}
