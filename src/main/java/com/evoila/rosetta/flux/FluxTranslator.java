package com.evoila.rosetta.flux;

import com.evoila.rosetta.common.dialect.DialectTranslator;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.ComparisonOp;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Renders plans as Flux pipelines.
 *
 * <p>The plan database (or {@code db/rp}) becomes the bucket, {@value #DEFAULT_BUCKET} when the
 * plan has none, and the primary source a {@code _measurement} filter. Aggregated columns become
 * {@code _field} filters. Pipeline order is range, filters, group, windowed aggregation, further
 * aggregations, transformations, sort and limit.
 *
 * <p>Interval windows render through {@code aggregateWindow} with the first aggregation as its
 * {@code fn}, or as {@code window()} when that aggregation has no Flux function. Counter rates map
 * to {@code derivative(nonNegative: true)}, percentiles to {@code quantile()}. Linear and
 * next-value fills, math transformations (they need imports), label rewrites, expression
 * groupings, subquery sources and non-interval windows are omitted. Mixed sort directions use the
 * direction of the first column. An offset without a limit is dropped.
 */
@Slf4j
@Component
public class FluxTranslator implements DialectTranslator {

  private static final String DEFAULT_BUCKET = "default";
  private static final String TIME = "_time";

  private static final Set<String> TIME_COLUMNS = Set.of("time", "timestamp", "ts", "_wstart");
  private static final Pattern PLAIN_COLUMN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  @Override
  public Dialect targetDialect() {
    return Dialect.FLUX;
  }

  @Override
  public String translate(QueryPlan plan) {
    List<String> stages = new ArrayList<>();
    stages.add("from(bucket: " + string(bucket(plan)) + ")");
    range(plan).ifPresent(stages::add);

    measurement(plan)
        .ifPresent(name -> stages.add(filter(field("_measurement") + " == " + string(name))));
    List<String> fields = fields(plan);
    if (!fields.isEmpty()) {
      stages.add(
          filter(
              fields.stream()
                  .map(name -> field("_field") + " == " + string(name))
                  .collect(Collectors.joining(" or "))));
    }
    for (Filter filter : plan.getFilters()) {
      if (!FilterCondition.matchesAll(filter.condition())) {
        stages.add(filter(condition(filter.condition())));
      }
    }

    List<String> groupColumns = groupColumns(plan);
    if (!groupColumns.isEmpty()) {
      stages.add("group(columns: " + stringArray(groupColumns) + ")");
    }

    aggregations(plan, stages);
    for (Transformation transformation : plan.getTransformations()) {
      transform(transformation.type()).ifPresent(stages::addAll);
    }

    sort(plan).ifPresent(stages::add);
    limit(plan).ifPresent(stages::add);
    if (plan.getSourceDialect() == Dialect.FLUX) {
      plan.getHints()
          .custom("yield")
          .ifPresent(name -> stages.add("yield(name: " + string(name) + ")"));
    }

    String query = String.join("\n  |> ", stages);
    log.debug("Built Flux query: '{}'", query);
    return query;
  }

  // ============================================================================
  // Source and range
  // ============================================================================

  private static String bucket(QueryPlan plan) {
    Optional<DataSource> source = plan.primarySource();
    String database =
        plan.getDatabase() != null
            ? plan.getDatabase()
            : source.map(DataSource::database).orElse(null);
    if (database == null) {
      return DEFAULT_BUCKET;
    }
    String retentionPolicy = source.map(DataSource::retentionPolicy).orElse(null);
    return retentionPolicy != null ? database + "/" + retentionPolicy : database;
  }

  /** Measurement filter value; absent for bucket-only plans and subqueries. */
  private static Optional<String> measurement(QueryPlan plan) {
    return plan.primarySource()
        .filter(source -> source.name() != null)
        .filter(source -> !(source.kind() instanceof SourceKind.Subquery))
        .filter(
            source ->
                source.kind() != SourceKind.Basic.TABLE
                    || !source.name().equals(plan.getDatabase()))
        .map(DataSource::name);
  }

  private Optional<String> range(QueryPlan plan) {
    TimeRange range = plan.getTimeRange();
    if (range == null) {
      return plan.getWindows().stream()
          .map(Window::kind)
          .filter(WindowKind.Range.class::isInstance)
          .map(kind -> "range(start: -" + duration(((WindowKind.Range) kind).durationMs()) + ")")
          .findFirst();
    }
    if (range instanceof TimeRange.Relative relative) {
      if (relative.anchorMs() == null) {
        return Optional.of("range(start: -" + duration(relative.durationMs()) + ")");
      }
      return Optional.of(
          range(relative.anchorMs() - relative.durationMs(), relative.anchorMs()));
    } else if (range instanceof TimeRange.Absolute absolute) {
      return Optional.of(range(absolute.startMs(), absolute.endMs()));
    } else if (range instanceof TimeRange.Since since) {
      return Optional.of("range(start: " + timestamp(since.startMs()) + ")");
    } else if (range instanceof TimeRange.Until until) {
      return Optional.of(range(0, until.endMs()));
    }
    throw new IllegalStateException("Unknown time range: " + range);
  }

  private static String range(long startMs, long endMs) {
    return "range(start: " + timestamp(startMs) + ", stop: " + timestamp(endMs) + ")";
  }

  /**
   * Fields selected by the plan: aggregated columns plus, for Flux sources, the recorded
   * {@code _field} selections. Columns starting with an underscore are record columns, not fields.
   */
  private static List<String> fields(QueryPlan plan) {
    Set<String> fields = new LinkedHashSet<>();
    if (plan.getSourceDialect() == Dialect.FLUX) {
      plan.getHints()
          .custom("columns")
          .ifPresent(columns -> fields.addAll(List.of(columns.split(","))));
    }
    plan.getAggregations().stream()
        .map(Aggregation::column)
        .filter(column -> column != null && !column.startsWith("_") && !column.equals("*"))
        .forEach(fields::add);
    return fields.stream().map(String::trim).filter(name -> !name.isEmpty()).toList();
  }

  // ============================================================================
  // Predicates
  // ============================================================================

  private static String filter(String predicate) {
    return "filter(fn: (r) => " + predicate + ")";
  }

  private String condition(FilterCondition condition) {
    if (condition instanceof FilterCondition.Comparison comparison) {
      return comparison(comparison);
    } else if (condition instanceof FilterCondition.Regex regex) {
      return field(regex.column()) + (regex.negated() ? " !~ " : " =~ ") + regex(regex.pattern());
    } else if (condition instanceof FilterCondition.In in) {
      if (in.values().isEmpty()) {
        return in.negated() ? "true" : "false";
      }
      String joined =
          in.values().stream()
              .map(value -> field(in.column()) + (in.negated() ? " != " : " == ") + literal(value))
              .collect(Collectors.joining(in.negated() ? " and " : " or "));
      return "(" + joined + ")";
    } else if (condition instanceof FilterCondition.Between between) {
      String column = field(between.column());
      if (between.negated()) {
        return "("
            + column
            + " < "
            + literal(between.low())
            + " or "
            + column
            + " > "
            + literal(between.high())
            + ")";
      }
      return column + " >= " + literal(between.low()) + " and " + column + " <= "
          + literal(between.high());
    } else if (condition instanceof FilterCondition.IsNull isNull) {
      return (isNull.negated() ? "exists " : "not exists ") + field(isNull.column());
    } else if (condition instanceof FilterCondition.And and) {
      if (and.conditions().isEmpty()) {
        return "true";
      }
      return and.conditions().stream().map(this::condition).collect(Collectors.joining(" and "));
    } else if (condition instanceof FilterCondition.Or or) {
      if (or.conditions().isEmpty()) {
        return "false";
      }
      return or.conditions().stream()
          .map(child -> "(" + condition(child) + ")")
          .collect(Collectors.joining(" or ", "(", ")"));
    } else if (condition instanceof FilterCondition.Not not) {
      return "not (" + condition(not.condition()) + ")";
    }
    throw new IllegalStateException("Unknown filter condition: " + condition);
  }

  private String comparison(FilterCondition.Comparison comparison) {
    String column = field(comparison.column());
    Value value = comparison.value();
    if (value instanceof Value.NullValue) {
      return (comparison.op() == ComparisonOp.NOT_EQ ? "exists " : "not exists ") + column;
    }
    return switch (comparison.op()) {
      case EQ -> column + " == " + literal(value);
      case NOT_EQ -> column + " != " + literal(value);
      case LT, LT_EQ, GT, GT_EQ ->
          column + " " + comparison.op().getSymbol() + " " + literal(value);
      case LIKE -> column + " =~ " + regex(likePattern(value.text()));
      case NOT_LIKE -> column + " !~ " + regex(likePattern(value.text()));
    };
  }

  /** Anchored regular expression equivalent to an SQL LIKE pattern. */
  static String likePattern(String like) {
    StringBuilder pattern = new StringBuilder("^");
    for (char c : like.toCharArray()) {
      if (c == '%') {
        pattern.append(".*");
      } else if (c == '_') {
        pattern.append('.');
      } else if ("\\^$.|?*+()[]{}".indexOf(c) >= 0) {
        pattern.append('\\').append(c);
      } else {
        pattern.append(c);
      }
    }
    return pattern.append('$').toString();
  }

  private static String field(String column) {
    String name = TIME_COLUMNS.contains(column.toLowerCase(Locale.ROOT)) ? TIME : column;
    return PLAIN_COLUMN.matcher(name).matches() ? "r." + name : "r[" + string(name) + "]";
  }

  private String literal(Value value) {
    if (value instanceof Value.StringValue string) {
      return string(string.value());
    } else if (value instanceof Value.BoolValue
        || value instanceof Value.IntValue
        || value instanceof Value.FloatValue) {
      return value.text();
    } else if (value instanceof Value.TimestampValue timestamp) {
      return timestamp(timestamp.epochMs());
    } else if (value instanceof Value.DurationValue duration) {
      return duration(duration.durationMs());
    } else if (value instanceof Value.ArrayValue array) {
      return array.values().stream()
          .map(this::literal)
          .collect(Collectors.joining(", ", "[", "]"));
    } else if (value instanceof Value.NullValue) {
      return "\"\"";
    }
    throw new IllegalStateException("Unknown value: " + value);
  }

  // ============================================================================
  // Grouping and aggregation
  // ============================================================================

  private static List<String> groupColumns(QueryPlan plan) {
    List<String> columns = new ArrayList<>();
    for (GroupBy group : plan.getGroupBy()) {
      GroupByExpr expr = group.expr();
      String name = null;
      if (expr instanceof GroupByExpr.Tag tag) {
        name = tag.name();
      } else if (expr instanceof GroupByExpr.Column column) {
        name = column.name();
      }
      if (name != null && !columns.contains(name)) {
        columns.add(name);
      }
    }
    return columns;
  }

  /**
   * Appends the windowed aggregation and the remaining aggregation stages. The first aggregation
   * is folded into {@code aggregateWindow} when the plan is windowed.
   */
  private void aggregations(QueryPlan plan, List<String> stages) {
    List<Aggregation> remaining = new ArrayList<>(plan.getAggregations());
    Optional<Interval> interval = interval(plan);
    if (interval.isPresent()) {
      Interval window = interval.get();
      Optional<String> fn =
          remaining.isEmpty() ? Optional.empty() : windowFunction(remaining.get(0));
      FillStrategy fill = window.fill();
      if (fn.isPresent()) {
        remaining.remove(0);
        StringBuilder stage =
            new StringBuilder("aggregateWindow(every: ").append(duration(window.everyMs()));
        if (window.offsetMs() != null) {
          stage.append(", offset: ").append(duration(window.offsetMs()));
        }
        stage.append(", fn: ").append(fn.get());
        if (fill != null && fill != FillStrategy.Basic.NONE) {
          stage.append(", createEmpty: true");
        }
        stages.add(stage.append(')').toString());
      } else {
        stages.add("window(every: " + duration(window.everyMs()) + ")");
      }
      fillStage(fill).ifPresent(stages::add);
    }
    for (Aggregation aggregation : remaining) {
      stages.addAll(aggregationStages(aggregation));
    }
  }

  /** Flux function usable as {@code aggregateWindow(fn:)}. */
  private static Optional<String> windowFunction(Aggregation aggregation) {
    if (aggregation.column() != null && aggregation.column().startsWith("_")) {
      return Optional.empty();
    }
    if (aggregation.function() instanceof AggFunction.Basic basic) {
      return simpleFunction(basic);
    }
    return Optional.empty();
  }

  private static Optional<String> simpleFunction(AggFunction.Basic function) {
    return Optional.ofNullable(
        switch (function) {
          case AVG -> "mean";
          case SUM -> "sum";
          case COUNT -> "count";
          case MIN -> "min";
          case MAX -> "max";
          case MEDIAN -> "median";
          case MODE -> "mode";
          case STDDEV, STDDEV_SAMP -> "stddev";
          case SPREAD -> "spread";
          case FIRST, FIRST_ROW -> "first";
          case LAST, LAST_ROW -> "last";
          case INTEGRAL -> "integral";
          case INCREASE -> "increase";
          case TWA -> "timeWeightedAvg";
          default -> null;
        });
  }

  private List<String> aggregationStages(Aggregation aggregation) {
    AggFunction function = aggregation.function();
    String column =
        aggregation.column() != null && aggregation.column().startsWith("_")
            ? "column: " + string(aggregation.column())
            : null;
    if (function instanceof AggFunction.Basic basic) {
      Optional<String> simple = simpleFunction(basic);
      if (simple.isPresent()) {
        return List.of(call(simple.get(), column));
      }
      return switch (basic) {
        case STDDEV_POP -> List.of(call("stddev", column, "mode: \"population\""));
        case RATE, IRATE -> List.of("derivative(unit: 1s, nonNegative: true)");
        case DERIV -> List.of("derivative(unit: 1s)");
        case DELTA, IDELTA -> List.of("difference()");
        case COUNT_DISTINCT, HYPER_LOG_LOG -> List.of(call("unique", column), "count()");
        default -> List.of(call(basic.name().toLowerCase(Locale.ROOT), column));
      };
    } else if (function instanceof AggFunction.Percentile percentile) {
      return List.of(call("quantile", column, "q: " + number(percentile.quantile())));
    } else if (function instanceof AggFunction.Apercentile apercentile) {
      return List.of(
          call(
              "quantile",
              column,
              "q: " + number(apercentile.quantile()),
              "method: \"estimate_tdigest\""));
    } else if (function instanceof AggFunction.HistogramQuantile histogram) {
      return List.of("histogramQuantile(quantile: " + number(histogram.quantile()) + ")");
    } else if (function instanceof AggFunction.TopK top) {
      return List.of(call("top", column, "n: " + top.k()));
    } else if (function instanceof AggFunction.BottomK bottom) {
      return List.of(call("bottom", column, "n: " + bottom.k()));
    } else if (function instanceof AggFunction.Sample sample) {
      return List.of(call("sample", column, "n: " + sample.n()));
    } else if (function instanceof AggFunction.Custom custom) {
      return List.of(call(custom.name(), column));
    }
    throw new IllegalStateException("Unknown aggregate function: " + function);
  }

  private static String call(String name, String... arguments) {
    String joined =
        Arrays.stream(arguments).filter(Objects::nonNull).collect(Collectors.joining(", "));
    return name + "(" + joined + ")";
  }

  private Optional<String> fillStage(FillStrategy fill) {
    if (fill == FillStrategy.Basic.PREVIOUS) {
      return Optional.of("fill(usePrevious: true)");
    }
    if (fill instanceof FillStrategy.Constant constant) {
      return Optional.of("fill(value: " + literal(constant.value()) + ")");
    }
    return Optional.empty();
  }

  /** Interval window of the plan, or the interval implied by a time-bucket grouping. */
  private static Optional<Interval> interval(QueryPlan plan) {
    for (Window window : plan.getWindows()) {
      if (window.kind() instanceof WindowKind.Interval interval) {
        return Optional.of(
            new Interval(interval.durationMs(), interval.offsetMs(), window.fill()));
      }
      if (window.kind() instanceof WindowKind.SampleBy sample) {
        return Optional.of(new Interval(sample.intervalMs(), null, window.fill()));
      }
    }
    return plan.getGroupBy().stream()
        .map(GroupBy::expr)
        .filter(GroupByExpr.TimeBucket.class::isInstance)
        .map(expr -> new Interval(((GroupByExpr.TimeBucket) expr).intervalMs(), null, null))
        .findFirst();
  }

  // ============================================================================
  // Transformations, ordering, bounds
  // ============================================================================

  private Optional<List<String>> transform(TransformType type) {
    if (type == TransformType.Basic.CUMULATIVE_SUM) {
      return Optional.of(List.of("cumulativeSum()"));
    } else if (type instanceof TransformType.Derivative derivative) {
      long unitMs = derivative.unitMs() != null ? derivative.unitMs() : DurationUtils.SECOND;
      String nonNegative = derivative.nonNegative() ? ", nonNegative: true" : "";
      return Optional.of(List.of("derivative(unit: " + duration(unitMs) + nonNegative + ")"));
    } else if (type instanceof TransformType.Difference difference) {
      return Optional.of(
          List.of(difference.nonNegative() ? "difference(nonNegative: true)" : "difference()"));
    } else if (type instanceof TransformType.MovingAverage average) {
      return Optional.of(List.of("movingAverage(n: " + average.points() + ")"));
    } else if (type instanceof TransformType.Elapsed elapsed) {
      return Optional.of(
          List.of(
              elapsed.unitMs() != null
                  ? "elapsed(unit: " + duration(elapsed.unitMs()) + ")"
                  : "elapsed()"));
    } else if (type instanceof TransformType.Fill fill) {
      return fillStage(fill.strategy()).map(List::of);
    } else if (type instanceof TransformType.Cast cast) {
      return castFunction(cast).map(name -> List.of(name + "()"));
    } else if (type instanceof TransformType.Custom custom) {
      return Optional.of(List.of(custom.name() + "()"));
    }
    return Optional.empty();
  }

  private static Optional<String> castFunction(TransformType.Cast cast) {
    return Optional.ofNullable(
        switch (cast.type()) {
          case BOOL -> "toBool";
          case INT8, INT16, INT32, INT64 -> "toInt";
          case UINT8, UINT16, UINT32, UINT64 -> "toUInt";
          case FLOAT32, FLOAT64 -> "toFloat";
          case STRING -> "toString";
          case TIMESTAMP -> "toTime";
          case DURATION -> "toDuration";
          default -> null;
        });
  }

  private static Optional<String> sort(QueryPlan plan) {
    List<OrderBy> orders = plan.getOrderBy();
    if (orders.isEmpty()) {
      return Optional.empty();
    }
    List<String> columns = new ArrayList<>();
    for (OrderBy order : orders) {
      String column =
          TIME_COLUMNS.contains(order.column().toLowerCase(Locale.ROOT)) ? TIME : order.column();
      if (!columns.contains(column)) {
        columns.add(column);
      }
    }
    String descending = orders.get(0).ascending() ? "" : ", desc: true";
    return Optional.of("sort(columns: " + stringArray(columns) + descending + ")");
  }

  private static Optional<String> limit(QueryPlan plan) {
    if (plan.getLimit() == null) {
      if (plan.getOffset() != null) {
        log.debug("Dropping offset {} without limit for Flux", plan.getOffset());
      }
      return Optional.empty();
    }
    StringBuilder stage = new StringBuilder("limit(n: ").append(plan.getLimit());
    if (plan.getOffset() != null && plan.getOffset() > 0) {
      stage.append(", offset: ").append(plan.getOffset());
    }
    return Optional.of(stage.append(')').toString());
  }

  // ============================================================================
  // Literals
  // ============================================================================

  private static String duration(long millis) {
    return DurationUtils.format(millis);
  }

  private static String timestamp(long epochMs) {
    return Instant.ofEpochMilli(epochMs).toString();
  }

  private static String string(String text) {
    return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  private static String stringArray(List<String> values) {
    return values.stream().map(FluxTranslator::string).collect(Collectors.joining(", ", "[", "]"));
  }

  private static String regex(String pattern) {
    return "/" + pattern.replace("/", "\\/") + "/";
  }

  private static String number(double value) {
    return Value.of(value).text();
  }

  private record Interval(long everyMs, Long offsetMs, FillStrategy fill) {}
}
