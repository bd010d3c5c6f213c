package com.evoila.rosetta.promql;

import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.OrderBy;
import com.evoila.rosetta.common.plan.QueryHints;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.Transformation;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.Setter;

/**
 * Plan fragment produced for one PromQL sub-expression. Function and aggregation calls absorb the
 * fragment of their vector argument and append their own operation, which keeps aggregations in
 * composition order.
 */
public class PromQlExpression {

  private final List<DataSource> sources = new ArrayList<>();
  private final List<Filter> filters = new ArrayList<>();
  private final List<Aggregation> aggregations = new ArrayList<>();
  private final List<Window> windows = new ArrayList<>();
  private final List<GroupBy> groups = new ArrayList<>();
  private final List<Transformation> transformations = new ArrayList<>();
  private final List<OrderBy> orders = new ArrayList<>();
  private final Map<String, String> hints = new LinkedHashMap<>();

  @Getter @Setter private TimeRange timeRange;
  @Getter @Setter private Long stepMs;

  /** Value of a number literal expression, null for anything else. */
  @Getter @Setter private Double number;

  /** Value of a string literal expression, null for anything else. */
  @Getter @Setter private String string;

  /** Source text of the expression. */
  @Getter @Setter private String text;

  public static PromQlExpression ofNumber(double value, String text) {
    PromQlExpression expression = new PromQlExpression();
    expression.setNumber(value);
    expression.setText(text);
    return expression;
  }

  public static PromQlExpression ofString(String value, String text) {
    PromQlExpression expression = new PromQlExpression();
    expression.setString(value);
    expression.setText(text);
    return expression;
  }

  public boolean isNumber() {
    return number != null;
  }

  public boolean isString() {
    return string != null;
  }

  /** True if the expression yields series, i.e. it contains a selector or series operation. */
  public boolean isVector() {
    return !sources.isEmpty() || !aggregations.isEmpty() || !transformations.isEmpty();
  }

  public void source(DataSource source) {
    sources.add(source);
  }

  public void filter(Filter filter) {
    filters.add(filter);
  }

  public void aggregation(Aggregation aggregation) {
    aggregations.add(aggregation);
  }

  public void window(Window window) {
    windows.add(window);
  }

  public boolean hasWindow() {
    return !windows.isEmpty();
  }

  /** Duration of the first range window, e.g. the {@code 5m} of {@code x[5m]}. */
  public Optional<Long> rangeMs() {
    return windows.stream()
        .map(Window::kind)
        .filter(WindowKind.Range.class::isInstance)
        .map(kind -> ((WindowKind.Range) kind).durationMs())
        .findFirst();
  }

  public void group(GroupBy groupBy) {
    groups.add(groupBy);
  }

  public void transformation(Transformation transformation) {
    transformations.add(transformation);
  }

  public void order(OrderBy orderBy) {
    orders.add(orderBy);
  }

  /** Records a custom hint; repeated keys accumulate, separated by {@code "; "}. */
  public void hint(String key, String value) {
    hints.merge(key, value, (a, b) -> a + "; " + b);
  }

  /** Takes over everything the argument expression collected. */
  public void absorb(PromQlExpression inner) {
    sources.addAll(inner.sources);
    filters.addAll(inner.filters);
    aggregations.addAll(inner.aggregations);
    windows.addAll(inner.windows);
    groups.addAll(inner.groups);
    transformations.addAll(inner.transformations);
    orders.addAll(inner.orders);
    inner.hints.forEach(this::hint);
    if (inner.timeRange != null) {
      timeRange = inner.timeRange;
    }
    if (inner.stepMs != null) {
      stepMs = inner.stepMs;
    }
  }

  public QueryPlan toPlan() {
    QueryPlan.QueryPlanBuilder plan =
        QueryPlan.builder()
            .sources(sources)
            .filters(filters)
            .aggregations(aggregations)
            .windows(windows)
            .groupBy(groups)
            .transformations(transformations)
            .orderBy(orders)
            .timeRange(timeRange);
    Map<String, String> custom = new LinkedHashMap<>(hints);
    if (number != null) {
      custom.put("scalar", text);
    } else if (string != null) {
      custom.put("string", string);
    }
    return plan.hints(QueryHints.builder().stepMs(stepMs).custom(custom).build()).build();
  }
}
