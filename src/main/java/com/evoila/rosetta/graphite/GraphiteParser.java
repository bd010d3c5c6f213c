package com.evoila.rosetta.graphite;

import com.evoila.rosetta.common.dialect.AbstractDialectParser;
import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.OrderBy;
import com.evoila.rosetta.common.plan.OutputFormat;
import com.evoila.rosetta.common.plan.QueryHints;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Transformation;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Graphite render target parser.
 *
 * <p>A recursive descent over nested function calls with a bounded depth. The innermost metric path
 * becomes the source; every enclosing function contributes an aggregation, transformation, window
 * or hint, innermost first. Unknown functions are kept as custom transformations.
 */
@Slf4j
@Component
public class GraphiteParser extends AbstractDialectParser {

  /** Graphite interval units; {@code min} is minutes, {@code mon} months. */
  public static final Map<String, Long> UNITS =
      Map.ofEntries(
          Map.entry("ms", 1L),
          Map.entry("s", DurationUtils.SECOND),
          Map.entry("sec", DurationUtils.SECOND),
          Map.entry("seconds", DurationUtils.SECOND),
          Map.entry("m", DurationUtils.MINUTE),
          Map.entry("min", DurationUtils.MINUTE),
          Map.entry("minutes", DurationUtils.MINUTE),
          Map.entry("h", DurationUtils.HOUR),
          Map.entry("hours", DurationUtils.HOUR),
          Map.entry("d", DurationUtils.DAY),
          Map.entry("days", DurationUtils.DAY),
          Map.entry("w", DurationUtils.WEEK),
          Map.entry("weeks", DurationUtils.WEEK),
          Map.entry("mon", DurationUtils.MONTH),
          Map.entry("y", DurationUtils.YEAR));

  private static final Map<String, AggFunction> SERIES_AGGREGATES =
      Map.of(
          "sumseries", AggFunction.Basic.SUM,
          "sum", AggFunction.Basic.SUM,
          "averageseries", AggFunction.Basic.AVG,
          "avg", AggFunction.Basic.AVG,
          "minseries", AggFunction.Basic.MIN,
          "maxseries", AggFunction.Basic.MAX,
          "countseries", AggFunction.Basic.COUNT,
          "stddevseries", AggFunction.Basic.STDDEV,
          "multiplyseries", new AggFunction.Custom("multiplySeries"),
          "diffseries", new AggFunction.Custom("diffSeries"));

  public GraphiteParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public GraphiteParser(ParserLimits limits) {
    super(limits);
  }

  @Override
  public Dialect dialect() {
    return Dialect.GRAPHITE;
  }

  @Override
  protected QueryPlan doParse(String query) {
    Reader reader = new Reader(query);
    Node root = reader.expression(0);
    reader.skipWhitespace();
    if (!reader.atEnd()) {
      throw reader.error("Unexpected trailing characters");
    }
    log.debug("Graphite target tree: {}", root);
    Builder builder = new Builder();
    builder.apply(root);
    return builder.build();
  }

  // ============================================================================
  // Syntax tree
  // ============================================================================

  /** A parsed target expression. */
  private sealed interface Node permits Path, Call, Literal {}

  private record Path(String path) implements Node {}

  private record Call(String name, List<Node> args) implements Node {}

  /** Number, string or boolean argument. */
  private record Literal(Value value) implements Node {
    String text() {
      return value.text();
    }
  }

  private final class Reader {
    private final String query;
    private int pos;

    Reader(String query) {
      this.query = query;
    }

    Node expression(int depth) {
      checkDepth(depth, query, pos);
      skipWhitespace();
      if (atEnd()) {
        throw error("Expected expression");
      }
      char c = query.charAt(pos);
      if (c == '"' || c == '\'') {
        return new Literal(Value.of(string(c)));
      }
      if (Character.isDigit(c) || ((c == '-' || c == '.') && nextIsDigit())) {
        String number = number();
        if (isPathContinuation()) {
          return new Path(number + path());
        }
        return new Literal(Value.parse(number));
      }
      String token = path();
      if (token.isEmpty()) {
        throw error("Unexpected character '" + c + "'");
      }
      skipWhitespace();
      if (!atEnd() && query.charAt(pos) == '(' && isFunctionName(token)) {
        pos++;
        return new Call(token, arguments(depth));
      }
      if (token.equals("true") || token.equals("false")) {
        return new Literal(Value.of(Boolean.parseBoolean(token)));
      }
      return new Path(token);
    }

    private List<Node> arguments(int depth) {
      List<Node> args = new ArrayList<>();
      skipWhitespace();
      if (!atEnd() && query.charAt(pos) == ')') {
        pos++;
        return args;
      }
      while (true) {
        args.add(expression(depth + 1));
        skipWhitespace();
        if (atEnd()) {
          throw error("Unbalanced parentheses");
        }
        char c = query.charAt(pos++);
        if (c == ')') {
          return args;
        }
        if (c == '=') {
          // keyword argument: keep its value only
          args.remove(args.size() - 1);
          continue;
        }
        if (c != ',') {
          throw error("Expected ',' or ')' but found '" + c + "'");
        }
      }
    }

    /** A metric path including globs, brace alternatives and character classes. */
    private String path() {
      int start = pos;
      int braces = 0;
      while (!atEnd()) {
        char c = query.charAt(pos);
        if (c == '{') {
          braces++;
        } else if (c == '}') {
          if (braces == 0) {
            break;
          }
          braces--;
        } else if (braces == 0 && !isPathChar(c)) {
          break;
        }
        pos++;
      }
      if (braces != 0) {
        throw error("Unbalanced braces in metric path");
      }
      return query.substring(start, pos);
    }

    private String number() {
      int start = pos;
      if (query.charAt(pos) == '-') {
        pos++;
      }
      while (!atEnd() && (Character.isDigit(query.charAt(pos)) || query.charAt(pos) == '.')) {
        pos++;
      }
      if (!atEnd() && (query.charAt(pos) == 'e' || query.charAt(pos) == 'E')) {
        int mark = pos++;
        if (!atEnd() && (query.charAt(pos) == '-' || query.charAt(pos) == '+')) {
          pos++;
        }
        if (atEnd() || !Character.isDigit(query.charAt(pos))) {
          pos = mark;
        }
        while (!atEnd() && Character.isDigit(query.charAt(pos))) {
          pos++;
        }
      }
      return query.substring(start, pos);
    }

    private String string(char quote) {
      int start = ++pos;
      while (!atEnd() && query.charAt(pos) != quote) {
        if (query.charAt(pos) == '\\') {
          pos++;
        }
        pos++;
      }
      if (atEnd()) {
        throw QueryParseException.at("Unterminated string", query, start - 1);
      }
      return query.substring(start, pos++).replace("\\" + quote, String.valueOf(quote));
    }

    private boolean isPathContinuation() {
      return !atEnd() && isPathChar(query.charAt(pos));
    }

    private boolean nextIsDigit() {
      return pos + 1 < query.length() && Character.isDigit(query.charAt(pos + 1));
    }

    private boolean isFunctionName(String token) {
      return token.chars().allMatch(ch -> Character.isLetterOrDigit(ch) || ch == '_');
    }

    private boolean isPathChar(char c) {
      return Character.isLetterOrDigit(c) || "._-*?[]:#@$%^~<>!|".indexOf(c) >= 0;
    }

    void skipWhitespace() {
      while (!atEnd() && Character.isWhitespace(query.charAt(pos))) {
        pos++;
      }
    }

    boolean atEnd() {
      return pos >= query.length();
    }

    QueryParseException error(String message) {
      return QueryParseException.at(message, query, pos);
    }
  }

  // ============================================================================
  // Plan construction
  // ============================================================================

  private static final class Builder {
    private final QueryPlan.QueryPlanBuilder plan = QueryPlan.builder();
    private final Map<String, String> hints = new LinkedHashMap<>();
    private OutputFormat outputFormat = OutputFormat.defaults();
    private boolean hasSource;

    /** Applies a node after its series arguments, so operations end innermost first. */
    void apply(Node node) {
      if (node instanceof Path path) {
        plan.source(DataSource.metric(path.path()));
        hasSource = true;
      } else if (node instanceof Call call) {
        call.args().stream().filter(arg -> !(arg instanceof Literal)).forEach(this::apply);
        function(call.name(), literals(call));
      } else if (node instanceof Literal literal) {
        hint("literal", literal.text());
      } else {
        throw new IllegalStateException("Unknown Graphite node: " + node);
      }
    }

    private void function(String name, List<Literal> args) {
      String lower = name.toLowerCase();
      if (SERIES_AGGREGATES.containsKey(lower)) {
        aggregation(SERIES_AGGREGATES.get(lower));
        return;
      }
      switch (lower) {
        case "summarize", "smartsummarize" -> summarize(args);
        case "hitcount" -> {
          window(durationArg(name, args, 0));
          aggregation(AggFunction.Basic.SUM);
        }
        case "alias" -> outputFormat = outputFormat.withOption("alias", stringArg(name, args, 0));
        case "aliasbynode", "aliasbytags" ->
            outputFormat =
                outputFormat.withOption(
                    "alias",
                    lower
                        + "("
                        + String.join(",", args.stream().map(Literal::text).toList())
                        + ")");
        case "aliassub" -> hint("alias_sub", joined(args));
        case "scale" -> transform(new TransformType.Custom("scale", values(args)));
        case "offset" -> transform(new TransformType.Custom("offset", values(args)));
        case "derivative" -> transform(new TransformType.Derivative(null, false));
        case "nonnegativederivative" -> transform(new TransformType.Derivative(null, true));
        case "perseconds", "persecond" -> aggregation(AggFunction.Basic.RATE);
        case "integral" -> aggregation(AggFunction.Basic.INTEGRAL);
        case "movingaverage" -> movingAverage(args);
        case "movingmedian", "movingsum", "movingmin", "movingmax" ->
            transform(new TransformType.Custom(lower, values(args)));
        case "highestcurrent", "highestaverage", "highestmax" ->
            aggregation(new AggFunction.TopK(countArg(name, args)));
        case "lowestcurrent", "lowestaverage", "lowestmin" ->
            aggregation(new AggFunction.BottomK(countArg(name, args)));
        case "absolute" -> transform(TransformType.Basic.ABS);
        case "pow" -> transform(new TransformType.Pow(numberArg(name, args, 0)));
        case "squareroot" -> transform(TransformType.Basic.SQRT);
        case "log" ->
            transform(new TransformType.Log(args.isEmpty() ? 10.0 : numberArg(name, args, 0)));
        case "integralbyinterval" -> aggregation(AggFunction.Basic.INTEGRAL);
        case "keeplastvalue" -> fill(FillStrategy.Basic.PREVIOUS);
        case "transformnull" ->
            fill(new FillStrategy.Constant(args.isEmpty() ? Value.of(0L) : args.get(0).value()));
        case "timeshift" -> hint("time_shift", stringArg(name, args, 0));
        case "timestack" -> hint("time_stack", joined(args));
        case "limit" -> plan.limit((long) countArg(name, args));
        case "sortbyname" -> plan.order(OrderBy.asc("name"));
        default -> transform(new TransformType.Custom(name, values(args)));
      }
    }

    private void summarize(List<Literal> args) {
      window(durationArg("summarize", args, 0));
      String function = args.size() > 1 ? args.get(1).text().toLowerCase() : "sum";
      aggregation(
          switch (function) {
            case "sum", "total" -> AggFunction.Basic.SUM;
            case "avg", "average" -> AggFunction.Basic.AVG;
            case "min" -> AggFunction.Basic.MIN;
            case "max" -> AggFunction.Basic.MAX;
            case "count" -> AggFunction.Basic.COUNT;
            case "last", "current" -> AggFunction.Basic.LAST;
            case "first" -> AggFunction.Basic.FIRST;
            case "median" -> AggFunction.Basic.MEDIAN;
            default -> new AggFunction.Custom(function);
          });
      if (args.size() > 2) {
        hint("align_to_from", args.get(2).text());
      }
    }

    /** A point count maps to a moving average; a time window such as "5min" stays custom. */
    private void movingAverage(List<Literal> args) {
      if (!args.isEmpty() && args.get(0).value() instanceof Value.IntValue points) {
        transform(new TransformType.MovingAverage((int) points.value()));
      } else {
        transform(new TransformType.Custom("movingAverage", values(args)));
      }
    }

    private void window(long intervalMs) {
      plan.window(Window.of(WindowKind.Interval.of(intervalMs)));
    }

    private void aggregation(AggFunction function) {
      plan.aggregation(Aggregation.of(function));
    }

    private void transform(TransformType type) {
      plan.transformation(Transformation.of(type));
    }

    private void fill(FillStrategy strategy) {
      transform(new TransformType.Fill(strategy));
    }

    private void hint(String key, String value) {
      hints.merge(key, value, (a, b) -> a + "; " + b);
    }

    QueryPlan build() {
      if (!hasSource) {
        throw new QueryParseException("Graphite target contains no metric path");
      }
      return plan.outputFormat(outputFormat)
          .hints(QueryHints.builder().custom(hints).build())
          .build();
    }

    private static List<Literal> literals(Call call) {
      List<Literal> literals = new ArrayList<>();
      for (Node arg : call.args()) {
        if (arg instanceof Literal literal) {
          literals.add(literal);
        }
      }
      return literals;
    }

    private static List<Value> values(List<Literal> args) {
      return args.stream().map(Literal::value).toList();
    }

    private static String joined(List<Literal> args) {
      return String.join(",", args.stream().map(Literal::text).toList());
    }

    private static String stringArg(String function, List<Literal> args, int index) {
      if (args.size() <= index) {
        throw new QueryParseException(function + " requires argument " + (index + 1));
      }
      return args.get(index).text();
    }

    private static double numberArg(String function, List<Literal> args, int index) {
      Value value = index < args.size() ? args.get(index).value() : null;
      if (value instanceof Value.IntValue intValue) {
        return intValue.value();
      }
      if (value instanceof Value.FloatValue floatValue) {
        return floatValue.value();
      }
      throw new QueryParseException(function + " requires a numeric argument");
    }

    private static int countArg(String function, List<Literal> args) {
      return args.isEmpty() ? 1 : (int) numberArg(function, args, 0);
    }

    static long durationArg(String function, List<Literal> args, int index) {
      String text = stringArg(function, args, index).replace("-", "").trim();
      try {
        return DurationUtils.parse(text, UNITS);
      } catch (IllegalArgumentException e) {
        throw new QueryParseException(
            "Invalid " + function + " interval '" + args.get(index).text() + "'", e);
      }
    }
  }
}
