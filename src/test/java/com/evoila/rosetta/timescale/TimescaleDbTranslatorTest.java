package com.evoila.rosetta.timescale;

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

@DisplayName("TimescaleDbTranslator Tests")
class TimescaleDbTranslatorTest {

  private final TimescaleDbTranslator translator = new TimescaleDbTranslator();

  private static QueryPlan windowed(FillStrategy fill) {
    return QueryPlan.builder()
        .source(DataSource.table("cpu"))
        .timeRange(TimeRange.Relative.of(3600000))
        .aggregation(Aggregation.of(AggFunction.Basic.AVG, "usage"))
        .window(new Window(WindowKind.Interval.of(300000), fill))
        .group(GroupBy.tag("host"))
        .build();
  }

  @Test
  void shouldRenderWindowAsTimeBucket() {
    assertThat(translator.translate(windowed(null)))
        .isEqualTo(
            "SELECT time_bucket('5 minutes', time) AS bucket, host, avg(usage) FROM cpu"
                + " WHERE time >= NOW() - INTERVAL '1 hour' GROUP BY bucket, host");
  }

  @Test
  void shouldGapFillWithLastObservation() {
    assertThat(translator.translate(windowed(FillStrategy.Basic.PREVIOUS)))
        .isEqualTo(
            "SELECT time_bucket_gapfill('5 minutes', time) AS bucket, host, locf(avg(usage))"
                + " FROM cpu WHERE time >= NOW() - INTERVAL '1 hour' GROUP BY bucket, host");
  }

  @Test
  void shouldInterpolateLinearFill() {
    assertThat(translator.translate(windowed(FillStrategy.Basic.LINEAR)))
        .contains("time_bucket_gapfill(")
        .contains("interpolate(avg(usage))");
  }

  @Test
  void shouldKeepPlainBucketWithoutFill() {
    assertThat(translator.translate(windowed(FillStrategy.Basic.NONE)))
        .contains("time_bucket('5 minutes', time)")
        .doesNotContain("gapfill");
  }

  @Test
  void shouldOrderFirstAndLastByTime() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("trades"))
            .aggregation(Aggregation.of(AggFunction.Basic.FIRST, "price"))
            .aggregation(Aggregation.of(AggFunction.Basic.LAST, "price"))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo("SELECT first(price, time), last(price, time) FROM trades");
  }

  @Test
  void shouldRenderApproximatePercentileExactly() {
    QueryPlan plan =
        QueryPlan.builder()
            .source(DataSource.table("requests"))
            .aggregation(Aggregation.of(new AggFunction.Apercentile(0.99), "latency"))
            .build();

    assertThat(translator.translate(plan))
        .isEqualTo(
            "SELECT percentile_cont(0.99) WITHIN GROUP (ORDER BY latency) FROM requests");
  }
}
