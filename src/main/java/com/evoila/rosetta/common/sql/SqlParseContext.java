package com.evoila.rosetta.common.sql;

import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.OrderBy;
import com.evoila.rosetta.common.plan.QueryHints;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Transformation;
import com.evoila.rosetta.common.plan.Window;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;

/**
 * Mutable state of one SQL parse. Lives only for the duration of a single {@code parse} call and
 * is turned into an immutable {@link QueryPlan} by {@link #build()}.
 */
public class SqlParseContext {

  private final QueryPlan.QueryPlanBuilder plan = QueryPlan.builder();
  private final QueryHints.QueryHintsBuilder hints = QueryHints.builder();
  private final Map<String, String> customHints = new LinkedHashMap<>();
  private final List<Window> windows = new ArrayList<>();
  private final List<String> projections = new ArrayList<>();
  private final Set<String> bucketAliases = new HashSet<>();
  private final Set<Integer> bucketOrdinals = new HashSet<>();
  private final List<String> columns = new ArrayList<>();

  @Getter private final SqlStatement statement;
  @Getter private final int depth;

  @Getter @Setter private FillStrategy fill;
  @Getter @Setter private String lastColumn;

  private TimeRange timeRange;
  private Long relativeMs;
  private Long lowerBoundMs;
  private Long upperBoundMs;
  private boolean hasSource;

  public SqlParseContext(SqlStatement statement, int depth) {
    this.statement = statement;
    this.depth = depth;
  }

  public QueryHints.QueryHintsBuilder hints() {
    return hints;
  }

  public QueryPlan.QueryPlanBuilder plan() {
    return plan;
  }

  public void source(DataSource source) {
    plan.source(source);
    if (!hasSource && source.database() != null) {
      plan.database(source.database());
    }
    hasSource = true;
  }

  public void aggregation(Aggregation aggregation) {
    plan.aggregation(aggregation);
  }

  public void transformation(Transformation transformation) {
    plan.transformation(transformation);
  }

  public void filter(Filter filter) {
    plan.filter(filter);
  }

  public void window(Window window) {
    windows.add(window);
  }

  public boolean hasWindow() {
    return !windows.isEmpty();
  }

  public void group(GroupBy groupBy) {
    plan.group(groupBy);
  }

  public void order(OrderBy orderBy) {
    plan.order(orderBy);
  }

  public void limit(long limit) {
    plan.limit(limit);
  }

  public void offset(long offset) {
    plan.offset(offset);
  }

  public void timeRange(TimeRange range) {
    this.timeRange = range;
  }

  public void relative(long durationMs) {
    this.relativeMs = durationMs;
  }

  public void lowerBound(long epochMs) {
    this.lowerBoundMs = epochMs;
  }

  public void upperBound(long epochMs) {
    this.upperBoundMs = epochMs;
  }

  /** Records a custom hint; repeated keys accumulate, separated by {@code "; "}. */
  public void hint(String key, String value) {
    customHints.merge(key, value, (a, b) -> a + "; " + b);
  }

  /** Projection expression at the given zero-based position of the select list. */
  public void projection(String expression) {
    projections.add(expression);
  }

  public List<String> projections() {
    return projections;
  }

  public void column(String column) {
    columns.add(column);
  }

  /** Marks a select-list entry as the time bucket so GROUP BY references to it are skipped. */
  public void bucketProjection(String alias, int ordinal) {
    if (alias != null) {
      bucketAliases.add(alias.toLowerCase(Locale.ROOT));
    }
    bucketOrdinals.add(ordinal);
  }

  public boolean isBucketReference(String expression) {
    String normalized = expression.trim().toLowerCase(Locale.ROOT);
    if (bucketAliases.contains(normalized)) {
      return true;
    }
    if (normalized.matches("\\d+")) {
      return bucketOrdinals.contains(Integer.parseInt(normalized));
    }
    return false;
  }

  public QueryPlan build() {
    if (!columns.isEmpty()) {
      customHints.putIfAbsent("columns", String.join(",", columns));
    }
    for (int i = 0; i < windows.size(); i++) {
      Window window = windows.get(i);
      boolean last = i == windows.size() - 1;
      plan.window(last && fill != null && window.fill() == null ? window.withFill(fill) : window);
    }
    if (windows.isEmpty() && fill != null) {
      plan.transformation(Transformation.of(new TransformType.Fill(fill)));
    }
    plan.timeRange(resolveTimeRange());
    plan.hints(hints.custom(customHints).build());
    return plan.build();
  }

  private TimeRange resolveTimeRange() {
    if (timeRange != null) {
      return timeRange;
    }
    if (relativeMs != null) {
      return TimeRange.Relative.of(relativeMs);
    }
    if (lowerBoundMs != null && upperBoundMs != null) {
      return new TimeRange.Absolute(lowerBoundMs, upperBoundMs);
    }
    if (lowerBoundMs != null) {
      return new TimeRange.Since(lowerBoundMs);
    }
    if (upperBoundMs != null) {
      return new TimeRange.Until(upperBoundMs);
    }
    return null;
  }
}
