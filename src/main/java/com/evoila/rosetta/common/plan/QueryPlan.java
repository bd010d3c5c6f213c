package com.evoila.rosetta.common.plan;

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Canonical, dialect-agnostic representation of a time-series query.
 *
 * <p>Every parser produces exactly one plan per invocation and every translator consumes one.
 * Instances are immutable: collections are unmodifiable copies and the {@code with*} helpers
 * return modified copies. All durations are milliseconds; dialect syntax only survives in
 * {@link #getSourceDialect()} and the custom hints.
 *
 * <p>{@code aggregations} and {@code transformations} are kept in composition order, innermost
 * first, so {@code sum(rate(x[5m]))} yields {@code [RATE, SUM]}.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
public class QueryPlan {

  @Singular private final List<DataSource> sources;

  private final TimeRange timeRange;

  @Singular private final List<Filter> filters;

  @Singular private final List<Aggregation> aggregations;

  @Singular private final List<Window> windows;

  @Singular("group")
  private final List<GroupBy> groupBy;

  @Singular private final List<Transformation> transformations;

  @Singular("order")
  private final List<OrderBy> orderBy;

  private final Long limit;

  private final Long offset;

  @Builder.Default private final OutputFormat outputFormat = OutputFormat.defaults();

  @Builder.Default private final QueryHints hints = QueryHints.empty();

  private final String database;

  private final String originalQuery;

  private final Dialect sourceDialect;

  public static QueryPlan empty() {
    return QueryPlan.builder().build();
  }

  /** First source, which every translator treats as the primary one. */
  public Optional<DataSource> primarySource() {
    return sources.isEmpty() ? Optional.empty() : Optional.of(sources.get(0));
  }

  /** First window, if any. */
  public Optional<Window> primaryWindow() {
    return windows.isEmpty() ? Optional.empty() : Optional.of(windows.get(0));
  }

  /**
   * Pins the plan to an evaluation instant: a relative range gets the instant as its anchor, a
   * plan without a range becomes bounded above by it.
   */
  public QueryPlan withEvaluationTime(long evaluationMs) {
    TimeRange anchored;
    if (timeRange instanceof TimeRange.Relative relative) {
      anchored = new TimeRange.Relative(relative.durationMs(), evaluationMs);
    } else if (timeRange == null) {
      anchored = new TimeRange.Until(evaluationMs);
    } else {
      anchored = timeRange;
    }
    return toBuilder().timeRange(anchored).build();
  }

  public QueryPlan withResolution(long stepMs) {
    return toBuilder().hints(hints.toBuilder().stepMs(stepMs).build()).build();
  }

  public QueryPlan withTimeout(long timeoutMs) {
    return toBuilder().hints(hints.toBuilder().timeoutMs(timeoutMs).build()).build();
  }

  public QueryPlan withLimit(long newLimit) {
    return toBuilder().limit(newLimit).build();
  }

  public QueryPlan withTimeRange(long startMs, long endMs) {
    return toBuilder().timeRange(new TimeRange.Absolute(startMs, endMs)).build();
  }
}
