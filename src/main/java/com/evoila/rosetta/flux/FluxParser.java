package com.evoila.rosetta.flux;

import com.evoila.rosetta.common.dialect.AbstractDialectParser;
import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.ComparisonOp;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.OrderBy;
import com.evoila.rosetta.common.plan.QueryHints;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.SourceKind;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Transformation;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.sql.SqlExpressionParser;
import com.evoila.rosetta.common.utils.DurationUtils;
import com.evoila.rosetta.common.utils.FunctionCall;
import com.evoila.rosetta.common.utils.StringParser;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Flux (InfluxDB 2.x) parser.
 *
 * <p>A query is a {@code |>} pipeline that must start with {@code from(bucket: "...")}. The bucket
 * becomes the plan database and a {@code r._measurement == "..."} filter the source; {@code
 * r._field} predicates select value columns. Stages are mapped in pipeline order, so aggregations
 * and transformations keep their composition order. Stages without an IR counterpart (map, pivot,
 * keep, drop, ...) are recorded under the {@code stage} hint.
 */
@Slf4j
@Component
public class FluxParser extends AbstractDialectParser {

  private static final String MEASUREMENT = "_measurement";
  private static final String FIELD = "_field";

  static final Map<String, AggFunction> AGGREGATES =
      Map.ofEntries(
          Map.entry("mean", AggFunction.Basic.AVG),
          Map.entry("sum", AggFunction.Basic.SUM),
          Map.entry("count", AggFunction.Basic.COUNT),
          Map.entry("min", AggFunction.Basic.MIN),
          Map.entry("max", AggFunction.Basic.MAX),
          Map.entry("median", AggFunction.Basic.MEDIAN),
          Map.entry("mode", AggFunction.Basic.MODE),
          Map.entry("stddev", AggFunction.Basic.STDDEV),
          Map.entry("spread", AggFunction.Basic.SPREAD),
          Map.entry("first", AggFunction.Basic.FIRST),
          Map.entry("last", AggFunction.Basic.LAST),
          Map.entry("integral", AggFunction.Basic.INTEGRAL),
          Map.entry("increase", AggFunction.Basic.INCREASE),
          Map.entry("timeWeightedAvg", AggFunction.Basic.TWA),
          Map.entry("distinct", new AggFunction.Custom("distinct")),
          Map.entry("unique", new AggFunction.Custom("unique")));

  private static final Pattern BRACKET_ACCESS = Pattern.compile("\\b(\\w+)\\[\"([^\"]+)\"\\]");
  private static final Pattern LAMBDA =
      Pattern.compile("^\\(\\s*(\\w+)\\s*\\)\\s*=>\\s*(.+)$", Pattern.DOTALL);

  public FluxParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public FluxParser(ParserLimits limits) {
    super(limits);
  }

  @Override
  public Dialect dialect() {
    return Dialect.FLUX;
  }

  @Override
  protected QueryPlan doParse(String query) {
    List<String> stages = StringParser.splitPipeline(query);
    if (stages.isEmpty()) {
      throw new QueryParseException("Empty Flux pipeline");
    }
    FunctionCall from =
        FunctionCall.parse(stages.get(0))
            .filter(call -> call.name().equals("from"))
            .orElseThrow(
                () -> new QueryParseException("Flux query must start with from(bucket: ...)"));
    String bucket =
        Optional.ofNullable(namedArguments(from).get("bucket"))
            .map(StringParser::unquote)
            .orElseThrow(() -> new QueryParseException("from() requires a bucket argument"));

    FluxPipeline pipeline = new FluxPipeline(bucket);
    for (int i = 1; i < stages.size(); i++) {
      String stage = stages.get(i);
      FunctionCall call =
          FunctionCall.parse(stage)
              .orElseThrow(() -> new QueryParseException("Invalid Flux stage: " + stage));
      applyStage(call, pipeline);
    }
    return pipeline.build();
  }

  private void applyStage(FunctionCall call, FluxPipeline pipeline) {
    Map<String, String> args = namedArguments(call);
    String name = call.name();
    switch (name) {
      case "range" -> pipeline.timeRange = range(args);
      case "filter" -> filter(args.get("fn"), pipeline);
      case "aggregateWindow" -> aggregateWindow(args, pipeline);
      case "window" ->
          pipeline.windows.add(Window.of(WindowKind.Interval.of(duration(args, "every"))));
      case "group" -> {
        if (args.containsKey("columns")) {
          stringList(args.get("columns")).forEach(tag -> pipeline.plan.group(GroupBy.tag(tag)));
        }
      }
      case "limit" -> {
        pipeline.plan.limit(longArgument(args, "n"));
        if (args.containsKey("offset")) {
          pipeline.plan.offset(longArgument(args, "offset"));
        }
      }
      case "sort" -> {
        boolean descending = "true".equals(args.get("desc"));
        List<String> columns =
            args.containsKey("columns") ? stringList(args.get("columns")) : List.of("_value");
        columns.forEach(column -> pipeline.plan.order(new OrderBy(column, !descending, null)));
      }
      case "quantile" ->
          pipeline.aggregation(
              new AggFunction.Percentile(doubleArgument(args, "q")), args.get("column"));
      case "top" -> pipeline.aggregation(new AggFunction.TopK((int) longArgument(args, "n")), null);
      case "bottom" ->
          pipeline.aggregation(new AggFunction.BottomK((int) longArgument(args, "n")), null);
      case "sample" ->
          pipeline.aggregation(new AggFunction.Sample((int) longArgument(args, "n")), null);
      case "derivative" ->
          pipeline.transformation(
              new TransformType.Derivative(
                  args.containsKey("unit") ? duration(args, "unit") : null,
                  "true".equals(args.get("nonNegative"))));
      case "difference" ->
          pipeline.transformation(
              new TransformType.Difference("true".equals(args.get("nonNegative"))));
      case "cumulativeSum" -> pipeline.transformation(TransformType.Basic.CUMULATIVE_SUM);
      case "movingAverage" ->
          pipeline.transformation(new TransformType.MovingAverage((int) longArgument(args, "n")));
      case "elapsed" ->
          pipeline.transformation(
              new TransformType.Elapsed(args.containsKey("unit") ? duration(args, "unit") : null));
      case "fill" -> pipeline.fill = fill(args);
      case "yield" ->
          pipeline.hints.customHint(
              "yield", StringParser.unquote(args.getOrDefault("name", "_results")));
      default -> {
        AggFunction aggregate = AGGREGATES.get(name);
        if (aggregate != null) {
          pipeline.aggregation(aggregate, args.get("column"));
        } else {
          log.debug("Keeping Flux stage '{}' as hint", name);
          pipeline.stage(name + "(" + call.argumentText() + ")");
        }
      }
    }
  }

  // ============================================================================
  // Stage helpers
  // ============================================================================

  private TimeRange range(Map<String, String> args) {
    String start = args.get("start");
    if (start == null) {
      throw new QueryParseException("range() requires a start argument");
    }
    String stop = args.get("stop");
    Optional<Long> startInstant = instant(start);
    if (startInstant.isPresent()) {
      Optional<Long> stopInstant = stop == null ? Optional.empty() : instant(stop);
      return stopInstant
          .<TimeRange>map(end -> new TimeRange.Absolute(startInstant.get(), end))
          .orElseGet(() -> new TimeRange.Since(startInstant.get()));
    }
    return TimeRange.Relative.of(relative(start));
  }

  private static long relative(String literal) {
    String text = literal.trim();
    if (!text.startsWith("-")) {
      throw new QueryParseException("Relative range start must be negative: " + literal);
    }
    return DurationUtils.parse(text.substring(1));
  }

  private static Optional<Long> instant(String literal) {
    String text = StringParser.unquote(literal.trim());
    if (text.startsWith("time(")) {
      text = StringParser.unquote(text.substring(text.indexOf(':') + 1, text.length() - 1));
    }
    if (text.isEmpty() || !Character.isDigit(text.charAt(0))) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.parse(text).toEpochMilli());
    } catch (DateTimeParseException e) {
      throw new QueryParseException("Invalid RFC3339 timestamp: " + text, e);
    }
  }

  private void filter(String function, FluxPipeline pipeline) {
    if (function == null) {
      throw new QueryParseException("filter() requires an fn argument");
    }
    Matcher lambda = LAMBDA.matcher(function.trim());
    if (!lambda.matches()) {
      throw new QueryParseException("filter fn must be a lambda: " + function);
    }
    String prefix = lambda.group(1) + ".";
    String body = BRACKET_ACCESS.matcher(lambda.group(2).trim()).replaceAll("$1.$2");
    FilterCondition condition;
    try {
      condition = SqlExpressionParser.parse(body, true);
    } catch (IllegalArgumentException e) {
      log.debug("Keeping Flux predicate '{}' as hint: {}", body, e.getMessage());
      pipeline.hints.customHint("filter", body);
      return;
    }
    List<FilterCondition> conjuncts =
        condition instanceof FilterCondition.And and ? and.conditions() : List.of(condition);
    List<FilterCondition> remaining = new ArrayList<>();
    for (FilterCondition conjunct : conjuncts) {
      FilterCondition stripped = stripRecord(conjunct, prefix);
      if (!pipeline.absorb(stripped)) {
        remaining.add(stripped);
      }
    }
    if (!remaining.isEmpty()) {
      pipeline.plan.filter(Filter.of(FilterCondition.and(remaining)));
    }
  }

  /** Removes the lambda parameter prefix ({@code r.}) from every column of the condition. */
  private static FilterCondition stripRecord(FilterCondition condition, String prefix) {
    if (condition instanceof FilterCondition.Comparison comparison) {
      return new FilterCondition.Comparison(
          strip(comparison.column(), prefix), comparison.op(), comparison.value());
    } else if (condition instanceof FilterCondition.Regex regex) {
      return new FilterCondition.Regex(
          strip(regex.column(), prefix), regex.pattern(), regex.negated());
    } else if (condition instanceof FilterCondition.In in) {
      return new FilterCondition.In(strip(in.column(), prefix), in.values(), in.negated());
    } else if (condition instanceof FilterCondition.Between between) {
      return new FilterCondition.Between(
          strip(between.column(), prefix), between.low(), between.high(), between.negated());
    } else if (condition instanceof FilterCondition.IsNull isNull) {
      return new FilterCondition.IsNull(strip(isNull.column(), prefix), isNull.negated());
    } else if (condition instanceof FilterCondition.And and) {
      return new FilterCondition.And(
          and.conditions().stream().map(inner -> stripRecord(inner, prefix)).toList());
    } else if (condition instanceof FilterCondition.Or or) {
      return new FilterCondition.Or(
          or.conditions().stream().map(inner -> stripRecord(inner, prefix)).toList());
    } else if (condition instanceof FilterCondition.Not not) {
      return new FilterCondition.Not(stripRecord(not.condition(), prefix));
    } else {
      throw new IllegalStateException("Unknown filter condition: " + condition);
    }
  }

  private static String strip(String column, String prefix) {
    return column.startsWith(prefix) ? column.substring(prefix.length()) : column;
  }

  private void aggregateWindow(Map<String, String> args, FluxPipeline pipeline) {
    Window window = Window.of(WindowKind.Interval.of(duration(args, "every")));
    if ("true".equals(args.get("createEmpty"))) {
      window = window.withFill(FillStrategy.Basic.NULL);
    }
    pipeline.windows.add(window);
    String fn = args.get("fn");
    if (fn == null) {
      throw new QueryParseException("aggregateWindow() requires an fn argument");
    }
    AggFunction aggregate = AGGREGATES.get(fn.trim());
    pipeline.aggregation(
        aggregate != null ? aggregate : new AggFunction.Custom(fn.trim()), args.get("column"));
  }

  private static FillStrategy fill(Map<String, String> args) {
    if ("true".equals(args.get("usePrevious"))) {
      return FillStrategy.Basic.PREVIOUS;
    }
    String value = args.get("value");
    if (value == null) {
      throw new QueryParseException("fill() requires value or usePrevious");
    }
    return new FillStrategy.Constant(
        StringParser.isQuoted(value) ? Value.of(StringParser.unquote(value)) : Value.parse(value));
  }

  /**
   * Splits {@code key: value, ...} arguments. Values keep their source text; the key ends at the
   * first colon so timestamps and lambdas survive intact.
   */
  static Map<String, String> namedArguments(FunctionCall call) {
    Map<String, String> args = new LinkedHashMap<>();
    for (String argument : call.arguments()) {
      int colon = argument.indexOf(':');
      if (colon <= 0) {
        throw new QueryParseException(
            "Flux arguments must be named, found '" + argument + "' in " + call.name() + "()");
      }
      args.put(argument.substring(0, colon).trim(), argument.substring(colon + 1).trim());
    }
    return args;
  }

  private static long duration(Map<String, String> args, String key) {
    String value = args.get(key);
    if (value == null) {
      throw new QueryParseException("Missing duration argument '" + key + "'");
    }
    return DurationUtils.parse(value);
  }

  private static long longArgument(Map<String, String> args, String key) {
    String value = args.get(key);
    if (value == null || !value.matches("\\d{1,18}")) {
      throw new QueryParseException("Argument '" + key + "' must be a non-negative integer");
    }
    return Long.parseLong(value);
  }

  private static double doubleArgument(Map<String, String> args, String key) {
    String value = args.get(key);
    if (value == null || !value.matches("\\d*\\.?\\d+")) {
      throw new QueryParseException("Argument '" + key + "' must be a number");
    }
    return Double.parseDouble(value);
  }

  /** Elements of a Flux string array such as {@code ["host", "region"]}. */
  private static List<String> stringList(String array) {
    String text = array.trim();
    if (!text.startsWith("[") || !text.endsWith("]")) {
      throw new QueryParseException("Expected an array but found " + array);
    }
    return StringParser.splitTopLevel(text.substring(1, text.length() - 1), ',').stream()
        .map(StringParser::unquote)
        .toList();
  }

  /** Accumulates one pipeline into a plan. */
  private static final class FluxPipeline {
    private final QueryPlan.QueryPlanBuilder plan = QueryPlan.builder();
    private final QueryHints.QueryHintsBuilder hints = QueryHints.builder();
    private final List<Window> windows = new ArrayList<>();
    private final List<String> fields = new ArrayList<>();
    private final List<String> unmappedStages = new ArrayList<>();
    private final String bucket;
    private TimeRange timeRange;
    private FillStrategy fill;
    private String measurement;

    FluxPipeline(String bucket) {
      this.bucket = bucket;
    }

    void aggregation(AggFunction function, String column) {
      plan.aggregation(
          Aggregation.of(function, column == null ? null : StringParser.unquote(column)));
    }

    void transformation(TransformType type) {
      plan.transformation(Transformation.of(type));
    }

    void stage(String text) {
      unmappedStages.add(text);
    }

    /** Takes over measurement and field selections; returns false for ordinary predicates. */
    boolean absorb(FilterCondition condition) {
      if (condition instanceof FilterCondition.Comparison comparison
          && comparison.op() == ComparisonOp.EQ) {
        if (comparison.column().equals(MEASUREMENT) && measurement == null) {
          measurement = comparison.value().text();
          return true;
        }
        if (comparison.column().equals(FIELD)) {
          fields.add(comparison.value().text());
          return true;
        }
      }
      if (condition instanceof FilterCondition.Or or
          && or.conditions().stream().allMatch(FluxPipeline::isFieldEquality)) {
        or.conditions()
            .forEach(field -> fields.add(((FilterCondition.Comparison) field).value().text()));
        return true;
      }
      return false;
    }

    private static boolean isFieldEquality(FilterCondition condition) {
      return condition instanceof FilterCondition.Comparison comparison
          && comparison.column().equals(FIELD)
          && comparison.op() == ComparisonOp.EQ;
    }

    QueryPlan build() {
      plan.database(bucket);
      plan.source(
          new DataSource(
              measurement != null ? measurement : bucket,
              bucket,
              null,
              null,
              measurement != null ? SourceKind.Basic.MEASUREMENT : SourceKind.Basic.TABLE));
      for (int i = 0; i < windows.size(); i++) {
        Window window = windows.get(i);
        boolean last = i == windows.size() - 1;
        plan.window(last && fill != null ? window.withFill(fill) : window);
      }
      if (windows.isEmpty() && fill != null) {
        plan.transformation(Transformation.of(new TransformType.Fill(fill)));
      }
      if (!fields.isEmpty()) {
        hints.customHint("columns", String.join(",", fields));
      }
      if (!unmappedStages.isEmpty()) {
        hints.customHint("stage", String.join("; ", unmappedStages));
      }
      return plan.timeRange(timeRange).hints(hints.build()).build();
    }
  }
}
