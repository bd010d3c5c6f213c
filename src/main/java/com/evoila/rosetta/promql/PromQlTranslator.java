package com.evoila.rosetta.promql;

import com.evoila.rosetta.common.dialect.DialectTranslator;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.ComparisonOp;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.GroupByExpr;
import com.evoila.rosetta.common.plan.OrderBy;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.SourceKind;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Transformation;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Renders plans as PromQL.
 *
 * <p>The primary source is the metric name ({@value #DEFAULT_METRIC} when the plan has none) and
 * label filters become matchers; {@code IN} lists and {@code LIKE} patterns turn into regular
 * expression matchers and {@code IS NULL} into an empty-value matcher. Aggregations compose
 * innermost first: range functions wrap the selector with its {@code [range]}, the first
 * aggregation of a windowed plan becomes {@code <agg>_over_time}, and later aggregations render as
 * operators. Tag groupings become the {@code by} clause of the outermost operator. An anchored or
 * absolute time range renders as an {@code @} modifier; PromQL offsets are kept for PromQL
 * sources.
 *
 * <p>Numeric comparisons on the value column become a trailing comparison and ordering on it
 * becomes {@code sort}/{@code sort_desc}. Limits, other orderings, non-label predicates, fills,
 * casts, cumulative sums, moving averages and elapsed times are omitted, as are aggregations
 * without a PromQL counterpart (first, spread, mode, integral). Distinct counts are approximated
 * by {@code count}.
 */
@Slf4j
@Component
public class PromQlTranslator implements DialectTranslator {

  protected static final String DEFAULT_METRIC = "metric";

  private static final long DEFAULT_RANGE_MS = 5 * DurationUtils.MINUTE;
  private static final Pattern METRIC_NAME = Pattern.compile("^[a-zA-Z_:][a-zA-Z0-9_:]*$");
  private static final Pattern LABEL_NAME = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
  private static final Set<String> VALUE_COLUMNS = Set.of("value", "_value");
  private static final Set<Dialect> PROMETHEUS_FAMILY =
      EnumSet.of(Dialect.PROMQL, Dialect.METRICSQL);

  @Override
  public Dialect targetDialect() {
    return Dialect.PROMQL;
  }

  @Override
  public String translate(QueryPlan plan) {
    Selector selector = selector(plan);
    Optional<Long> windowMs = windowMs(plan);
    List<String> labels = groupLabels(plan);
    List<Aggregation> aggregations = plan.getAggregations();

    String expression = null;
    int lastOperator = lastOperatorIndex(plan, windowMs.isPresent());
    for (int i = 0; i < aggregations.size(); i++) {
      String inner = expression;
      String grouping = i == lastOperator ? grouping(plan, labels) : "";
      Optional<String> rendered =
          aggregation(aggregations.get(i), inner, selector, windowMs, grouping);
      if (rendered.isPresent()) {
        expression = rendered.get();
      } else {
        log.debug("Omitting {} in PromQL rendering", aggregations.get(i).function());
      }
    }
    if (expression == null) {
      expression =
          aggregations.isEmpty() && hasRangeWindow(plan)
              ? selector.withRange(windowMs.orElse(DEFAULT_RANGE_MS))
              : selector.bare();
    }
    if (lastOperator < 0 && !labels.isEmpty()) {
      expression = "sum" + grouping(plan, labels) + " (" + expression + ")";
    }

    for (Transformation transformation : plan.getTransformations()) {
      expression = transform(transformation.type(), expression, selector).orElse(expression);
    }
    expression = bounds(sorted(expression, plan), plan);
    for (String comparison : valueComparisons(plan)) {
      expression = expression + " " + comparison;
    }

    log.debug("Built {} query: '{}'", targetDialect().getDisplayName(), expression);
    return expression;
  }

  // ============================================================================
  // Dialect hooks
  // ============================================================================

  /** {@code <agg>_over_time} rollup of a windowed aggregation. */
  protected Optional<String> overTimeFunction(AggFunction.Basic function) {
    return Optional.ofNullable(
        switch (function) {
          case AVG -> "avg_over_time";
          case SUM -> "sum_over_time";
          case MIN -> "min_over_time";
          case MAX -> "max_over_time";
          case COUNT -> "count_over_time";
          case STDDEV, STDDEV_POP, STDDEV_SAMP -> "stddev_over_time";
          case VARIANCE, VAR_POP, VAR_SAMP -> "stdvar_over_time";
          case LAST, LAST_ROW -> "last_over_time";
          default -> null;
        });
  }

  /** Aggregation operator across series. */
  protected Optional<String> operatorName(AggFunction.Basic function) {
    return Optional.ofNullable(
        switch (function) {
          case SUM -> "sum";
          case AVG -> "avg";
          case MIN -> "min";
          case MAX -> "max";
          case COUNT, COUNT_DISTINCT, HYPER_LOG_LOG -> "count";
          case STDDEV, STDDEV_POP, STDDEV_SAMP -> "stddev";
          case VARIANCE, VAR_POP, VAR_SAMP -> "stdvar";
          default -> null;
        });
  }

  /** Applies limit and offset; PromQL has no row bounds. */
  protected String bounds(String expression, QueryPlan plan) {
    if (plan.getLimit() != null || plan.getOffset() != null) {
      log.debug("Omitting limit {} and offset {} for PromQL", plan.getLimit(), plan.getOffset());
    }
    return expression;
  }

  // ============================================================================
  // Aggregations
  // ============================================================================

  /**
   * Index of the aggregation that renders as the outermost operator and carries the grouping, or
   * -1 when no aggregation renders as an operator.
   */
  private int lastOperatorIndex(QueryPlan plan, boolean windowed) {
    List<Aggregation> aggregations = plan.getAggregations();
    for (int i = aggregations.size() - 1; i >= 0; i--) {
      if (isOperator(aggregations.get(i).function(), i == 0 && windowed)) {
        return i;
      }
    }
    return -1;
  }

  private boolean isOperator(AggFunction function, boolean rollup) {
    if (function instanceof AggFunction.Basic basic) {
      if (basic.isRangeFunction() || basic == AggFunction.Basic.PREDICT_LINEAR) {
        return false;
      }
      if (rollup && overTimeFunction(basic).isPresent()) {
        return false;
      }
      return operatorName(basic).isPresent() || basic == AggFunction.Basic.MEDIAN;
    }
    if (function instanceof AggFunction.Percentile
        || function instanceof AggFunction.Apercentile) {
      return !rollup;
    }
    return function instanceof AggFunction.TopK
        || function instanceof AggFunction.BottomK
        || function instanceof AggFunction.Sample
        || (function instanceof AggFunction.Custom custom
            && PromQlParser.AGGREGATION_OPERATORS.contains(custom.name()));
  }

  /**
   * Renders one aggregation around {@code inner}, or around the selector when {@code inner} is
   * null.
   */
  private Optional<String> aggregation(
      Aggregation aggregation,
      String inner,
      Selector selector,
      Optional<Long> windowMs,
      String grouping) {
    AggFunction function = aggregation.function();
    String argument = inner != null ? inner : selector.bare();
    boolean rollup = inner == null && windowMs.isPresent();

    if (function instanceof AggFunction.Basic basic) {
      if (basic.isRangeFunction()) {
        String name = basic.name().toLowerCase();
        return Optional.of(name + "(" + rangeVector(inner, selector, windowMs) + ")");
      }
      if (basic == AggFunction.Basic.PREDICT_LINEAR) {
        String seconds =
            aggregation.args().isEmpty() ? "3600" : aggregation.args().get(0).text();
        return Optional.of(
            "predict_linear(" + rangeVector(inner, selector, windowMs) + ", " + seconds + ")");
      }
      if (rollup) {
        Optional<String> overTime = overTimeFunction(basic);
        if (overTime.isPresent()) {
          return Optional.of(overTime.get() + "(" + rangeVector(null, selector, windowMs) + ")");
        }
      }
      if (basic == AggFunction.Basic.MEDIAN && operatorName(basic).isEmpty()) {
        return Optional.of(quantile(0.5, argument, selector, windowMs, rollup, grouping));
      }
      return operatorName(basic).map(name -> name + grouping + " (" + argument + ")");
    } else if (function instanceof AggFunction.Percentile percentile) {
      return Optional.of(
          quantile(percentile.quantile(), argument, selector, windowMs, rollup, grouping));
    } else if (function instanceof AggFunction.Apercentile apercentile) {
      return Optional.of(
          quantile(apercentile.quantile(), argument, selector, windowMs, rollup, grouping));
    } else if (function instanceof AggFunction.HistogramQuantile histogram) {
      return Optional.of(
          "histogram_quantile(" + number(histogram.quantile()) + ", " + argument + ")");
    } else if (function instanceof AggFunction.TopK top) {
      return Optional.of("topk" + grouping + " (" + top.k() + ", " + argument + ")");
    } else if (function instanceof AggFunction.BottomK bottom) {
      return Optional.of("bottomk" + grouping + " (" + bottom.k() + ", " + argument + ")");
    } else if (function instanceof AggFunction.Sample sample) {
      return Optional.of("limitk" + grouping + " (" + sample.n() + ", " + argument + ")");
    } else if (function instanceof AggFunction.Custom custom) {
      return Optional.of(
          custom(custom.name(), aggregation.args(), inner, selector, windowMs, grouping));
    }
    throw new IllegalStateException("Unknown aggregate function: " + function);
  }

  private String quantile(
      double quantile,
      String argument,
      Selector selector,
      Optional<Long> windowMs,
      boolean rollup,
      String grouping) {
    if (rollup) {
      return "quantile_over_time("
          + number(quantile)
          + ", "
          + rangeVector(null, selector, windowMs)
          + ")";
    }
    return "quantile" + grouping + " (" + number(quantile) + ", " + argument + ")";
  }

  private String custom(
      String name,
      List<Value> args,
      String inner,
      Selector selector,
      Optional<Long> windowMs,
      String grouping) {
    String literals = args.stream().map(this::literal).collect(Collectors.joining(", "));
    if (PromQlParser.AGGREGATION_OPERATORS.contains(name)) {
      String parameter = literals.isEmpty() ? "" : literals + ", ";
      return name + grouping + " (" + parameter + (inner != null ? inner : selector.bare()) + ")";
    }
    String argument =
        name.endsWith("_over_time")
            ? rangeVector(inner, selector, windowMs)
            : inner != null ? inner : selector.bare();
    return name + "(" + argument + (literals.isEmpty() ? "" : ", " + literals) + ")";
  }

  /** Range vector over the selector, or a subquery over an already wrapped expression. */
  private String rangeVector(String inner, Selector selector, Optional<Long> windowMs) {
    long rangeMs = windowMs.orElse(DEFAULT_RANGE_MS);
    if (inner == null) {
      return selector.withRange(rangeMs);
    }
    return "(" + inner + ")[" + DurationUtils.format(rangeMs) + ":]";
  }

  private String grouping(QueryPlan plan, List<String> labels) {
    if (PROMETHEUS_FAMILY.contains(plan.getSourceDialect())) {
      Optional<String> without = plan.getHints().custom("without");
      if (without.isPresent() && labels.isEmpty()) {
        return " without (" + String.join(", ", without.get().split(",")) + ")";
      }
    }
    return labels.isEmpty() ? "" : " by (" + String.join(", ", labels) + ")";
  }

  private static List<String> groupLabels(QueryPlan plan) {
    List<String> labels = new ArrayList<>();
    for (GroupBy group : plan.getGroupBy()) {
      String name = null;
      if (group.expr() instanceof GroupByExpr.Tag tag) {
        name = tag.name();
      } else if (group.expr() instanceof GroupByExpr.Column column) {
        name = column.name();
      }
      if (name != null && LABEL_NAME.matcher(name).matches() && !labels.contains(name)) {
        labels.add(name);
      }
    }
    return labels;
  }

  // ============================================================================
  // Transformations
  // ============================================================================

  private Optional<String> transform(TransformType type, String expression, Selector selector) {
    if (type instanceof TransformType.Basic basic) {
      return switch (basic) {
        case ABS, CEIL, FLOOR, SQRT, EXP ->
            Optional.of(basic.name().toLowerCase() + "(" + expression + ")");
        default -> Optional.empty();
      };
    } else if (type instanceof TransformType.Round round) {
      if (round.digits() == null || round.digits() == 0) {
        return Optional.of("round(" + expression + ")");
      }
      return Optional.of(
          "round(" + expression + ", " + number(Math.pow(10, -round.digits())) + ")");
    } else if (type instanceof TransformType.Log log) {
      if (log.base() == null) {
        return Optional.of("ln(" + expression + ")");
      } else if (log.base() == 2.0) {
        return Optional.of("log2(" + expression + ")");
      } else if (log.base() == 10.0) {
        return Optional.of("log10(" + expression + ")");
      }
      return Optional.of("ln(" + expression + ") / " + number(Math.log(log.base())));
    } else if (type instanceof TransformType.Pow pow) {
      return Optional.of("(" + expression + ") ^ " + number(pow.exponent()));
    } else if (type instanceof TransformType.Derivative derivative) {
      String name = derivative.nonNegative() ? "rate" : "deriv";
      return Optional.of(name + "(" + rangeVector(expression, selector) + ")");
    } else if (type instanceof TransformType.Difference difference) {
      String name = difference.nonNegative() ? "increase" : "delta";
      return Optional.of(name + "(" + rangeVector(expression, selector) + ")");
    } else if (type instanceof TransformType.LabelReplace replace) {
      return Optional.of(
          "label_replace("
              + expression
              + ", "
              + string(replace.destination())
              + ", "
              + string(replace.replacement())
              + ", "
              + string(replace.source())
              + ", "
              + string(replace.regex())
              + ")");
    } else if (type instanceof TransformType.LabelJoin join) {
      StringBuilder call =
          new StringBuilder("label_join(")
              .append(expression)
              .append(", ")
              .append(string(join.destination()))
              .append(", ")
              .append(string(join.separator()));
      join.sources().forEach(source -> call.append(", ").append(string(source)));
      return Optional.of(call.append(')').toString());
    } else if (type instanceof TransformType.Custom custom) {
      String extra =
          custom.args().stream().map(value -> ", " + literal(value)).collect(Collectors.joining());
      return Optional.of(custom.name() + "(" + expression + extra + ")");
    }
    return Optional.empty();
  }

  /** Range vector for a transformation; anything but the bare selector becomes a subquery. */
  private String rangeVector(String expression, Selector selector) {
    if (expression.equals(selector.bare())) {
      return selector.withRange(DEFAULT_RANGE_MS);
    }
    return "(" + expression + ")[" + DurationUtils.format(DEFAULT_RANGE_MS) + ":]";
  }

  // ============================================================================
  // Selector
  // ============================================================================

  private Selector selector(QueryPlan plan) {
    String metric =
        plan.primarySource()
            .filter(source -> !(source.kind() instanceof SourceKind.Subquery))
            .map(DataSource::name)
            .orElse(null);
    List<String> matchers = new ArrayList<>();
    for (Filter filter : plan.getFilters()) {
      matchers(filter.condition(), false, matchers);
    }
    if (metric == null && matchers.isEmpty()) {
      metric = DEFAULT_METRIC;
    }
    if (metric != null && !METRIC_NAME.matcher(metric).matches()) {
      matchers.add(0, "__name__=" + string(metric));
      metric = null;
    }
    String text =
        (metric != null ? metric : "")
            + (matchers.isEmpty() ? "" : "{" + String.join(", ", matchers) + "}");
    return new Selector(text, modifiers(plan));
  }

  /** Adds the label matchers expressing {@code condition}; anything else is omitted. */
  private void matchers(FilterCondition condition, boolean negated, List<String> matchers) {
    if (condition instanceof FilterCondition.And and && !negated) {
      and.conditions().forEach(child -> matchers(child, false, matchers));
    } else if (condition instanceof FilterCondition.Not not) {
      matchers(not.condition(), !negated, matchers);
    } else if (condition instanceof FilterCondition.Comparison comparison) {
      comparisonMatcher(comparison, negated).ifPresent(matchers::add);
    } else if (condition instanceof FilterCondition.Regex regex) {
      label(regex.column())
          .ifPresent(
              label ->
                  matchers.add(
                      label
                          + (regex.negated() != negated ? "!~" : "=~")
                          + string(regex.pattern())));
    } else if (condition instanceof FilterCondition.In in) {
      label(in.column())
          .ifPresent(
              label ->
                  matchers.add(
                      label
                          + (in.negated() != negated ? "!~" : "=~")
                          + string(alternation(in.values()))));
    } else if (condition instanceof FilterCondition.IsNull isNull) {
      String operator = isNull.negated() != negated ? "!=" : "=";
      label(isNull.column()).ifPresent(label -> matchers.add(label + operator + "\"\""));
    } else if (condition instanceof FilterCondition.Or or) {
      orMatcher(or, negated).ifPresent(matchers::add);
    } else {
      log.debug("Omitting predicate {} in PromQL rendering", condition);
    }
  }

  private Optional<String> comparisonMatcher(
      FilterCondition.Comparison comparison, boolean negated) {
    if (VALUE_COLUMNS.contains(comparison.column())) {
      return Optional.empty();
    }
    Optional<String> label = label(comparison.column());
    if (label.isEmpty()) {
      return Optional.empty();
    }
    ComparisonOp op = negated ? comparison.op().negate() : comparison.op();
    String value = comparison.value().text();
    return switch (op) {
      case EQ -> Optional.of(label.get() + "=" + string(value));
      case NOT_EQ -> Optional.of(label.get() + "!=" + string(value));
      case LIKE -> Optional.of(label.get() + "=~" + string(likePattern(value)));
      case NOT_LIKE -> Optional.of(label.get() + "!~" + string(likePattern(value)));
      default -> Optional.empty();
    };
  }

  /** An OR of equalities on one label becomes a single alternation matcher. */
  private Optional<String> orMatcher(FilterCondition.Or or, boolean negated) {
    String column = null;
    List<Value> values = new ArrayList<>();
    for (FilterCondition child : or.conditions()) {
      if (!(child instanceof FilterCondition.Comparison comparison)
          || comparison.op() != ComparisonOp.EQ
          || (column != null && !column.equals(comparison.column()))) {
        log.debug("Omitting disjunction {} in PromQL rendering", or);
        return Optional.empty();
      }
      column = comparison.column();
      values.add(comparison.value());
    }
    String alternation = alternation(values);
    return label(column).map(label -> label + (negated ? "!~" : "=~") + string(alternation));
  }

  private static Optional<String> label(String column) {
    return column != null && LABEL_NAME.matcher(column).matches()
        ? Optional.of(column)
        : Optional.empty();
  }

  private static String alternation(List<Value> values) {
    return values.stream().map(value -> escapeRegex(value.text())).collect(Collectors.joining("|"));
  }

  private static String escapeRegex(String text) {
    StringBuilder escaped = new StringBuilder();
    for (char c : text.toCharArray()) {
      if ("\\^$.|?*+()[]{}".indexOf(c) >= 0) {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  /** Regular expression equivalent to an SQL LIKE pattern; PromQL matchers are fully anchored. */
  private static String likePattern(String like) {
    StringBuilder pattern = new StringBuilder();
    for (char c : like.toCharArray()) {
      if (c == '%') {
        pattern.append(".*");
      } else if (c == '_') {
        pattern.append('.');
      } else {
        pattern.append(escapeRegex(String.valueOf(c)));
      }
    }
    return pattern.toString();
  }

  /** {@code offset} and {@code @} modifiers attached to every selector. */
  private String modifiers(QueryPlan plan) {
    StringBuilder modifiers = new StringBuilder();
    if (PROMETHEUS_FAMILY.contains(plan.getSourceDialect())) {
      plan.getHints()
          .custom("offset_ms")
          .map(Long::parseLong)
          .ifPresent(
              offsetMs ->
                  modifiers
                      .append(" offset ")
                      .append(offsetMs < 0 ? "-" : "")
                      .append(DurationUtils.format(Math.abs(offsetMs))));
    }
    evaluationEnd(plan.getTimeRange())
        .ifPresent(endMs -> modifiers.append(" @ ").append(seconds(endMs)));
    return modifiers.toString();
  }

  private static Optional<Long> evaluationEnd(TimeRange range) {
    if (range instanceof TimeRange.Absolute absolute) {
      return Optional.of(absolute.endMs());
    } else if (range instanceof TimeRange.Relative relative) {
      return Optional.ofNullable(relative.anchorMs());
    } else if (range instanceof TimeRange.Until until) {
      return Optional.of(until.endMs());
    }
    return Optional.empty();
  }

  // ============================================================================
  // Plan inspection
  // ============================================================================

  /** Range of the plan's rollups: a look-back window, else an interval or time-bucket width. */
  private static Optional<Long> windowMs(QueryPlan plan) {
    Optional<Long> range =
        plan.getWindows().stream()
            .map(Window::kind)
            .filter(WindowKind.Range.class::isInstance)
            .map(kind -> ((WindowKind.Range) kind).durationMs())
            .findFirst();
    if (range.isPresent()) {
      return range;
    }
    Optional<Long> interval =
        plan.getWindows().stream()
            .map(Window::kind)
            .map(PromQlTranslator::intervalMs)
            .flatMap(Optional::stream)
            .findFirst();
    if (interval.isPresent()) {
      return interval;
    }
    return plan.getGroupBy().stream()
        .map(GroupBy::expr)
        .filter(GroupByExpr.TimeBucket.class::isInstance)
        .map(expr -> ((GroupByExpr.TimeBucket) expr).intervalMs())
        .findFirst();
  }

  private static Optional<Long> intervalMs(WindowKind kind) {
    if (kind instanceof WindowKind.Interval interval) {
      return Optional.of(interval.durationMs());
    }
    if (kind instanceof WindowKind.SampleBy sample) {
      return Optional.of(sample.intervalMs());
    }
    return Optional.empty();
  }

  private static boolean hasRangeWindow(QueryPlan plan) {
    return plan.getWindows().stream()
        .anyMatch(window -> window.kind() instanceof WindowKind.Range);
  }

  /** Value thresholds and value ordering; orderings on other columns have no PromQL form. */
  private List<String> valueComparisons(QueryPlan plan) {
    List<String> comparisons = new ArrayList<>();
    for (Filter filter : plan.getFilters()) {
      if (filter.condition() instanceof FilterCondition.Comparison comparison
          && VALUE_COLUMNS.contains(comparison.column())
          && isNumeric(comparison.value())) {
        String symbol = comparison.op() == ComparisonOp.EQ ? "==" : comparison.op().getSymbol();
        if (comparison.op() != ComparisonOp.LIKE && comparison.op() != ComparisonOp.NOT_LIKE) {
          comparisons.add(symbol + " " + comparison.value().text());
        }
      }
    }
    return comparisons;
  }

  private String sorted(String expression, QueryPlan plan) {
    for (OrderBy order : plan.getOrderBy()) {
      if (VALUE_COLUMNS.contains(order.column())) {
        return (order.ascending() ? "sort(" : "sort_desc(") + expression + ")";
      }
    }
    return expression;
  }

  private static boolean isNumeric(Value value) {
    return value instanceof Value.IntValue || value instanceof Value.FloatValue;
  }

  // ============================================================================
  // Literals
  // ============================================================================

  private String literal(Value value) {
    if (value instanceof Value.StringValue string) {
      return string(string.value());
    } else if (value instanceof Value.DurationValue duration) {
      return DurationUtils.format(duration.durationMs());
    }
    return value.text();
  }

  protected static String string(String text) {
    return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  protected static String number(double value) {
    return Value.of(value).text();
  }

  private static String seconds(long epochMs) {
    return BigDecimal.valueOf(epochMs).movePointLeft(3).stripTrailingZeros().toPlainString();
  }

  /** Vector selector text plus the modifiers that follow it. */
  private record Selector(String text, String modifiers) {

    String bare() {
      return text + modifiers;
    }

    String withRange(long rangeMs) {
      return text + "[" + DurationUtils.format(rangeMs) + "]" + modifiers;
    }
  }
}
