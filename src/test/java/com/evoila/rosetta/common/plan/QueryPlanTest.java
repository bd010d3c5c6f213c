package com.evoila.rosetta.common.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("QueryPlan Tests")
class QueryPlanTest {

  private static QueryPlan samplePlan() {
    return QueryPlan.builder()
        .source(DataSource.measurement("cpu"))
        .timeRange(TimeRange.Relative.of(3_600_000))
        .filter(Filter.eq("host", "server01"))
        .aggregation(Aggregation.of(AggFunction.Basic.AVG, "usage"))
        .group(GroupBy.tag("host"))
        .build();
  }

  @Test
  @DisplayName("Empty plan has empty collections and default hints")
  void emptyPlan() {
    QueryPlan plan = QueryPlan.empty();

    assertThat(plan.getSources()).isEmpty();
    assertThat(plan.getAggregations()).isEmpty();
    assertThat(plan.primarySource()).isEmpty();
    assertThat(plan.primaryWindow()).isEmpty();
    assertThat(plan.getHints()).isEqualTo(QueryHints.empty());
    assertThat(plan.getOutputFormat().timestampFormat()).isEqualTo(TimestampFormat.UNIX_MS);
  }

  @Test
  @DisplayName("Collections are unmodifiable")
  void collectionsAreImmutable() {
    QueryPlan plan = samplePlan();

    assertThatThrownBy(() -> plan.getFilters().add(Filter.eq("a", "b")))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("Plans with the same content are equal")
  void structuralEquality() {
    assertThat(samplePlan()).isEqualTo(samplePlan());
    assertThat(samplePlan().hashCode()).isEqualTo(samplePlan().hashCode());
  }

  @Nested
  @DisplayName("Copy helpers")
  class CopyHelpers {

    @Test
    void withEvaluationTimeAnchorsRelativeRange() {
      QueryPlan anchored = samplePlan().withEvaluationTime(1_700_000_000_000L);

      assertThat(anchored.getTimeRange())
          .isEqualTo(new TimeRange.Relative(3_600_000, 1_700_000_000_000L));
    }

    @Test
    void withEvaluationTimeBoundsOpenPlan() {
      QueryPlan anchored = QueryPlan.empty().withEvaluationTime(1_000L);

      assertThat(anchored.getTimeRange()).isEqualTo(new TimeRange.Until(1_000L));
    }

    @Test
    void withEvaluationTimeKeepsAbsoluteRange() {
      QueryPlan plan = samplePlan().withTimeRange(10L, 20L);

      assertThat(plan.withEvaluationTime(99L).getTimeRange())
          .isEqualTo(new TimeRange.Absolute(10L, 20L));
    }

    @Test
    void hintsAndLimitsDoNotTouchOriginal() {
      QueryPlan original = samplePlan();

      QueryPlan modified = original.withResolution(15_000).withTimeout(30_000).withLimit(10);

      assertThat(modified.getHints().getStepMs()).isEqualTo(15_000L);
      assertThat(modified.getHints().getTimeoutMs()).isEqualTo(30_000L);
      assertThat(modified.getLimit()).isEqualTo(10L);
      assertThat(original.getLimit()).isNull();
      assertThat(original.getHints().getStepMs()).isNull();
    }
  }

  @Test
  @DisplayName("Custom hints are looked up by key")
  void customHints() {
    QueryHints hints = QueryHints.builder().customHint("fill", "previous").build();

    assertThat(hints.custom("fill")).contains("previous");
    assertThat(hints.custom("missing")).isEmpty();
    assertThat(hints.hasCustom("fill")).isTrue();
  }

  @Test
  @DisplayName("Range functions are flagged")
  void rangeFunctions() {
    assertThat(AggFunction.Basic.RATE.isRangeFunction()).isTrue();
    assertThat(AggFunction.Basic.PREDICT_LINEAR.isRangeFunction()).isTrue();
    assertThat(AggFunction.Basic.SUM.isRangeFunction()).isFalse();
  }

  @Test
  @DisplayName("Whole floats render without a fraction")
  void floatText() {
    assertThat(Value.of(2.0).text()).isEqualTo("2");
    assertThat(Value.of(0.95).text()).isEqualTo("0.95");
    assertThat(Value.parse("42")).isEqualTo(Value.of(42L));
    assertThat(Value.parse("abc")).isEqualTo(Value.of("abc"));
  }
}
