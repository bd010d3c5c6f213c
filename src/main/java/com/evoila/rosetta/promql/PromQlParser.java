package com.evoila.rosetta.promql;

import com.evoila.rosetta.common.dialect.AbstractDialectParser;
import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.ComparisonOp;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.OrderBy;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Transformation;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.utils.DurationUtils;
import com.evoila.rosetta.promql.PromQlToken.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * PromQL parser: a tokenizer plus a precedence-climbing recursive descent with a bounded nesting
 * depth.
 *
 * <p>Selectors become metric sources with label matchers as filters; {@code [range]} becomes a
 * range window and {@code [range:step]} additionally sets the step hint. Aggregation operators and
 * functions absorb the plan fragment of their vector argument and append their own operation, so
 * {@code sum(rate(x[5m]))} yields {@code [RATE, SUM]}. For binary expressions the vector operand
 * forms the plan and the other operand is recorded in the {@code binary_op} hint.
 *
 * <p>Subclasses extend the grammar through {@link #aggregationOperators()}, {@link
 * #aggregationFunction(String, PromQlExpression)}, {@link #applyFunction(String, List,
 * PromQlExpression)} and {@link #postfixModifier(String, PromQlExpression)}.
 */
@Slf4j
@Component
public class PromQlParser extends AbstractDialectParser {

  protected static final Set<String> AGGREGATION_OPERATORS =
      Set.of(
          "sum", "avg", "min", "max", "count", "stddev", "stdvar", "group", "topk", "bottomk",
          "quantile", "count_values", "limitk", "limit_ratio");

  protected static final Map<String, AggFunction> RANGE_FUNCTIONS =
      Map.of(
          "rate", AggFunction.Basic.RATE,
          "irate", AggFunction.Basic.IRATE,
          "increase", AggFunction.Basic.INCREASE,
          "delta", AggFunction.Basic.DELTA,
          "idelta", AggFunction.Basic.IDELTA,
          "deriv", AggFunction.Basic.DERIV,
          "resets", AggFunction.Basic.RESETS,
          "changes", AggFunction.Basic.CHANGES);

  protected static final Map<String, AggFunction> OVER_TIME_FUNCTIONS =
      Map.of(
          "avg_over_time", AggFunction.Basic.AVG,
          "sum_over_time", AggFunction.Basic.SUM,
          "min_over_time", AggFunction.Basic.MIN,
          "max_over_time", AggFunction.Basic.MAX,
          "count_over_time", AggFunction.Basic.COUNT,
          "stddev_over_time", AggFunction.Basic.STDDEV,
          "stdvar_over_time", AggFunction.Basic.VARIANCE,
          "last_over_time", AggFunction.Basic.LAST,
          "present_over_time", new AggFunction.Custom("present_over_time"),
          "mad_over_time", new AggFunction.Custom("mad_over_time"));

  protected static final Map<String, TransformType> MATH_FUNCTIONS =
      Map.of(
          "abs", TransformType.Basic.ABS,
          "ceil", TransformType.Basic.CEIL,
          "floor", TransformType.Basic.FLOOR,
          "sqrt", TransformType.Basic.SQRT,
          "exp", TransformType.Basic.EXP,
          "ln", new TransformType.Log(null),
          "log2", new TransformType.Log(2.0),
          "log10", new TransformType.Log(10.0));

  /** Element-wise functions without a structural counterpart, kept as custom transformations. */
  protected static final Set<String> CUSTOM_TRANSFORMS =
      Set.of(
          "clamp", "clamp_min", "clamp_max", "sgn", "time", "timestamp", "day_of_month",
          "day_of_week", "day_of_year", "days_in_month", "hour", "minute", "month", "year",
          "absent", "absent_over_time", "scalar", "vector", "sort_by_label",
          "sort_by_label_desc", "histogram_count", "histogram_sum", "histogram_avg",
          "histogram_fraction", "histogram_stddev", "histogram_stdvar", "deg", "rad", "pi",
          "sin", "cos", "tan", "asin", "acos", "atan", "sinh", "cosh", "tanh", "asinh", "acosh",
          "atanh", "holt_winters", "double_exponential_smoothing");

  private static final Set<String> MATCH_OPERATORS = Set.of("=", "!=", "=~", "!~");

  public PromQlParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public PromQlParser(ParserLimits limits) {
    super(limits);
  }

  @Override
  public Dialect dialect() {
    return Dialect.PROMQL;
  }

  @Override
  protected QueryPlan doParse(String query) {
    Cursor cursor = new Cursor(query, PromQlLexer.tokenize(query));
    PromQlExpression expression = cursor.parseRoot();
    return expression.toPlan();
  }

  // ============================================================================
  // Extension points
  // ============================================================================

  /** Names parsed with aggregation operator syntax ({@code by}/{@code without} modifiers). */
  protected Set<String> aggregationOperators() {
    return AGGREGATION_OPERATORS;
  }

  /** Whether a leading {@code WITH (...)} template block is accepted. */
  protected boolean withTemplates() {
    return false;
  }

  /**
   * Maps an aggregation operator to its function.
   *
   * @param parameter the parameter argument of {@code topk}, {@code quantile} and friends, or null
   */
  protected AggFunction aggregationFunction(String name, PromQlExpression parameter) {
    return switch (name) {
      case "sum" -> AggFunction.Basic.SUM;
      case "avg" -> AggFunction.Basic.AVG;
      case "min" -> AggFunction.Basic.MIN;
      case "max" -> AggFunction.Basic.MAX;
      case "count" -> AggFunction.Basic.COUNT;
      case "stddev" -> AggFunction.Basic.STDDEV;
      case "stdvar" -> AggFunction.Basic.VARIANCE;
      case "topk" -> new AggFunction.TopK(intParameter(name, parameter));
      case "bottomk" -> new AggFunction.BottomK(intParameter(name, parameter));
      case "quantile" -> new AggFunction.Percentile(numberParameter(name, parameter));
      default -> new AggFunction.Custom(name);
    };
  }

  /**
   * Applies a function call to {@code target}, which first takes over the vector argument. Unknown
   * functions are recorded as custom aggregations carrying their literal arguments.
   */
  protected void applyFunction(
      String name, List<PromQlExpression> args, PromQlExpression target) {
    absorbVector(args, target);
    List<Value> literals = literalArguments(args);
    if (RANGE_FUNCTIONS.containsKey(name)) {
      target.aggregation(Aggregation.of(RANGE_FUNCTIONS.get(name)));
    } else if (OVER_TIME_FUNCTIONS.containsKey(name)) {
      target.aggregation(Aggregation.of(OVER_TIME_FUNCTIONS.get(name)));
    } else if (name.equals("quantile_over_time")) {
      target.aggregation(
          Aggregation.of(new AggFunction.Percentile(numberParameter(name, first(args)))));
    } else if (name.equals("predict_linear")) {
      target.aggregation(
          new Aggregation(AggFunction.Basic.PREDICT_LINEAR, null, literals, null, false));
    } else if (name.equals("histogram_quantile")) {
      target.aggregation(
          Aggregation.of(new AggFunction.HistogramQuantile(numberParameter(name, first(args)))));
    } else if (name.equals("label_replace")) {
      requireStrings(name, args, 4);
      target.transformation(
          Transformation.of(
              new TransformType.LabelReplace(
                  args.get(1).getString(),
                  args.get(2).getString(),
                  args.get(3).getString(),
                  args.get(4).getString())));
    } else if (name.equals("label_join")) {
      requireStrings(name, args, 2);
      List<String> sources = new ArrayList<>();
      for (int i = 3; i < args.size(); i++) {
        sources.add(args.get(i).getString());
      }
      target.transformation(
          Transformation.of(
              new TransformType.LabelJoin(
                  args.get(1).getString(), args.get(2).getString(), sources)));
    } else if (MATH_FUNCTIONS.containsKey(name)) {
      target.transformation(Transformation.of(MATH_FUNCTIONS.get(name)));
    } else if (name.equals("round")) {
      target.transformation(
          Transformation.of(
              literals.isEmpty()
                  ? new TransformType.Round(null)
                  : new TransformType.Custom("round", literals)));
    } else if (name.equals("sort")) {
      target.order(OrderBy.asc("value"));
    } else if (name.equals("sort_desc")) {
      target.order(OrderBy.desc("value"));
    } else if (CUSTOM_TRANSFORMS.contains(name)) {
      target.transformation(Transformation.of(new TransformType.Custom(name, literals)));
    } else {
      target.aggregation(
          new Aggregation(new AggFunction.Custom(name), null, literals, null, false));
    }
  }

  /**
   * Handles an identifier following a complete primary expression, such as MetricsQL's {@code
   * keep_metric_names}.
   *
   * @return true if the identifier was consumed
   */
  protected boolean postfixModifier(String identifier, PromQlExpression expression) {
    return false;
  }

  // ============================================================================
  // Argument helpers
  // ============================================================================

  /** Absorbs the first vector argument, if any, into {@code target}. */
  protected static void absorbVector(List<PromQlExpression> args, PromQlExpression target) {
    args.stream().filter(PromQlExpression::isVector).findFirst().ifPresent(target::absorb);
  }

  /** Number and string arguments as values, in order. */
  protected static List<Value> literalArguments(List<PromQlExpression> args) {
    List<Value> values = new ArrayList<>();
    for (PromQlExpression arg : args) {
      if (arg.isNumber()) {
        values.add(Value.of(arg.getNumber()));
      } else if (arg.isString()) {
        values.add(Value.of(arg.getString()));
      }
    }
    return values;
  }

  protected static PromQlExpression first(List<PromQlExpression> args) {
    return args.isEmpty() ? null : args.get(0);
  }

  protected static double numberParameter(String function, PromQlExpression parameter) {
    if (parameter == null || !parameter.isNumber()) {
      throw new QueryParseException(function + " requires a numeric parameter");
    }
    return parameter.getNumber();
  }

  protected static int intParameter(String function, PromQlExpression parameter) {
    return (int) numberParameter(function, parameter);
  }

  private static void requireStrings(String function, List<PromQlExpression> args, int count) {
    if (args.size() < count + 1) {
      throw new QueryParseException(function + " expects a vector and " + count + " strings");
    }
    for (int i = 1; i < args.size(); i++) {
      if (!args.get(i).isString()) {
        throw new QueryParseException(function + " argument " + (i + 1) + " must be a string");
      }
    }
  }

  private static int precedence(PromQlToken token) {
    if (token.is(Type.IDENTIFIER)) {
      return switch (token.text().toLowerCase()) {
        case "or" -> 1;
        case "and", "unless" -> 2;
        case "atan2" -> 5;
        default -> 0;
      };
    }
    if (!token.is(Type.OPERATOR)) {
      return 0;
    }
    return switch (token.text()) {
      case "==", "!=", "<=", "<", ">=", ">" -> 3;
      case "+", "-" -> 4;
      case "*", "/", "%" -> 5;
      case "^" -> 6;
      default -> 0;
    };
  }

  // ============================================================================
  // Recursive descent
  // ============================================================================

  /** Position in the token stream of one parse. */
  private final class Cursor {
    private final String query;
    private final List<PromQlToken> tokens;
    private int index;

    Cursor(String query, List<PromQlToken> tokens) {
      this.query = query;
      this.tokens = tokens;
    }

    PromQlExpression parseRoot() {
      String templates = null;
      if (withTemplates() && peek().isIdentifier("WITH") && peekAhead(1).is(Type.LPAREN)) {
        templates = skipTemplates();
      }
      PromQlExpression expression = parseExpression(0, 1);
      if (!peek().is(Type.EOF)) {
        throw error("Unexpected '" + peek().text() + "'", peek());
      }
      if (templates != null) {
        expression.hint("with", templates);
      }
      return expression;
    }

    private String skipTemplates() {
      next();
      PromQlToken open = next();
      int depth = 1;
      while (depth > 0) {
        PromQlToken token = next();
        if (token.is(Type.EOF)) {
          throw error("Unclosed WITH template block", open);
        }
        if (token.is(Type.LPAREN)) {
          depth++;
        } else if (token.is(Type.RPAREN)) {
          depth--;
        }
      }
      return query.substring(open.end(), tokens.get(index - 1).position()).trim();
    }

    private PromQlExpression parseExpression(int depth, int minPrecedence) {
      checkDepth(depth, query, peek().position());
      int start = peek().position();
      PromQlExpression left = parseUnary(depth);
      left.setText(textFrom(start));
      while (true) {
        PromQlToken operator = peek();
        int precedence = precedence(operator);
        if (precedence == 0 || precedence < minPrecedence) {
          return left;
        }
        next();
        String modifiers = parseBinaryModifiers();
        int nextMinimum = operator.isOperator("^") ? precedence : precedence + 1;
        PromQlExpression right = parseExpression(depth + 1, nextMinimum);
        left = combine(left, operator.text() + modifiers, right);
        left.setText(textFrom(start));
      }
    }

    private String parseBinaryModifiers() {
      StringBuilder modifiers = new StringBuilder();
      if (peek().isIdentifier("bool")) {
        next();
        modifiers.append(" bool");
      }
      if (peek().isIdentifier("on") || peek().isIdentifier("ignoring")) {
        modifiers.append(' ').append(next().text()).append(labelList());
        if (peek().isIdentifier("group_left") || peek().isIdentifier("group_right")) {
          modifiers.append(' ').append(next().text());
          if (peek().is(Type.LPAREN)) {
            modifiers.append(labelList());
          }
        }
      }
      return modifiers.toString();
    }

    private PromQlExpression combine(
        PromQlExpression left, String operator, PromQlExpression right) {
      boolean rightCarries = !left.isVector() && right.isVector();
      PromQlExpression main = rightCarries ? right : left;
      String description =
          rightCarries ? left.getText() + " " + operator : operator + " " + right.getText();
      main.hint("binary_op", description);
      return main;
    }

    private PromQlExpression parseUnary(int depth) {
      PromQlToken token = peek();
      if (token.isOperator("-") || token.isOperator("+")) {
        next();
        checkDepth(depth + 1, query, token.position());
        PromQlExpression operand = parseUnary(depth + 1);
        if (token.isOperator("-")) {
          if (operand.isNumber()) {
            operand.setNumber(-operand.getNumber());
          } else {
            operand.hint("unary", "-");
          }
        }
        return operand;
      }
      return parsePostfix(parsePrimary(depth));
    }

    private PromQlExpression parsePrimary(int depth) {
      PromQlToken token = peek();
      switch (token.type()) {
        case NUMBER -> {
          next();
          return PromQlExpression.ofNumber(parseNumber(token.text()), token.text());
        }
        case DURATION -> {
          next();
          return PromQlExpression.ofNumber(
              DurationUtils.parse(token.text()) / 1000.0, token.text());
        }
        case STRING -> {
          next();
          return PromQlExpression.ofString(
              token.text(), query.substring(token.position(), token.end()));
        }
        case LPAREN -> {
          next();
          PromQlExpression inner = parseExpression(depth + 1, 1);
          expect(Type.RPAREN, "')'");
          return inner;
        }
        case LBRACE -> {
          return parseSelector(null);
        }
        case IDENTIFIER -> {
          return parseIdentifier(token, depth);
        }
        default -> throw error("Unexpected '" + token.text() + "'", token);
      }
    }

    private PromQlExpression parseIdentifier(PromQlToken token, int depth) {
      String name = token.text();
      PromQlToken following = peekAhead(1);
      if ((name.equalsIgnoreCase("inf") || name.equalsIgnoreCase("nan"))
          && !following.is(Type.LPAREN)
          && !following.is(Type.LBRACE)) {
        next();
        return PromQlExpression.ofNumber(
            name.equalsIgnoreCase("nan") ? Double.NaN : Double.POSITIVE_INFINITY, name);
      }
      if (aggregationOperators().contains(name.toLowerCase())
          && (following.is(Type.LPAREN)
              || following.isIdentifier("by")
              || following.isIdentifier("without"))) {
        return parseAggregation(depth);
      }
      if (following.is(Type.LPAREN)) {
        return parseFunctionCall(depth);
      }
      return parseSelector(name);
    }

    private PromQlExpression parseSelector(String name) {
      PromQlToken start = peek();
      if (name != null) {
        next();
      }
      String metric = name;
      List<FilterCondition> matchers = new ArrayList<>();
      if (peek().is(Type.LBRACE)) {
        next();
        while (!peek().is(Type.RBRACE)) {
          PromQlToken label = next();
          if (!label.is(Type.IDENTIFIER) && !label.is(Type.STRING)) {
            throw error("Expected label name but found '" + label.text() + "'", label);
          }
          PromQlToken operator = next();
          if (!operator.is(Type.OPERATOR) || !MATCH_OPERATORS.contains(operator.text())) {
            throw error("Expected label matcher operator after " + label.text(), operator);
          }
          PromQlToken value = next();
          if (!value.is(Type.STRING)) {
            throw error("Expected string value for label " + label.text(), value);
          }
          if (label.text().equals("__name__") && operator.text().equals("=")) {
            metric = value.text();
          } else {
            matchers.add(matcher(label.text(), operator.text(), value.text()));
          }
          if (peek().is(Type.COMMA)) {
            next();
          } else if (!peek().is(Type.RBRACE)) {
            throw error("Expected ',' or '}' in label matchers", peek());
          }
        }
        next();
      }
      if (metric == null && matchers.isEmpty()) {
        throw error("Vector selector must contain a metric name or a label matcher", start);
      }
      PromQlExpression expression = new PromQlExpression();
      expression.source(DataSource.metric(metric));
      matchers.forEach(matcher -> expression.filter(Filter.of(matcher)));
      return expression;
    }

    private FilterCondition matcher(String label, String operator, String value) {
      return switch (operator) {
        case "=" -> new FilterCondition.Comparison(label, ComparisonOp.EQ, Value.of(value));
        case "!=" -> new FilterCondition.Comparison(label, ComparisonOp.NOT_EQ, Value.of(value));
        case "=~" -> new FilterCondition.Regex(label, value, false);
        default -> new FilterCondition.Regex(label, value, true);
      };
    }

    private PromQlExpression parsePostfix(PromQlExpression expression) {
      while (true) {
        PromQlToken token = peek();
        if (token.is(Type.LBRACKET)) {
          parseRange(expression);
        } else if (token.isIdentifier("offset")) {
          next();
          boolean negative = false;
          if (peek().isOperator("-")) {
            next();
            negative = true;
          }
          long offsetMs = duration();
          expression.hint("offset_ms", Long.toString(negative ? -offsetMs : offsetMs));
        } else if (token.is(Type.AT)) {
          parseAt(expression);
        } else if (token.is(Type.IDENTIFIER) && postfixModifier(token.text(), expression)) {
          next();
        } else {
          return expression;
        }
      }
    }

    private void parseRange(PromQlExpression expression) {
      next();
      long rangeMs = duration();
      if (peek().is(Type.COLON)) {
        next();
        expression.hint("subquery", "true");
        if (peek().is(Type.DURATION)) {
          expression.setStepMs(duration());
        }
      }
      expect(Type.RBRACKET, "']'");
      expression.window(Window.of(new WindowKind.Range(rangeMs)));
    }

    private void parseAt(PromQlExpression expression) {
      PromQlToken at = next();
      PromQlToken token = next();
      if (token.is(Type.NUMBER)) {
        long endMs = Math.round(parseNumber(token.text()) * 1000);
        long lengthMs = expression.rangeMs().orElse(0L);
        expression.setTimeRange(new TimeRange.Absolute(endMs - lengthMs, endMs));
      } else if ((token.isIdentifier("start") || token.isIdentifier("end"))
          && peek().is(Type.LPAREN)) {
        next();
        expect(Type.RPAREN, "')'");
        expression.hint("at", token.text() + "()");
      } else {
        throw error("Expected timestamp after '@'", at);
      }
    }

    private PromQlExpression parseAggregation(int depth) {
      PromQlToken nameToken = next();
      String name = nameToken.text().toLowerCase();
      Grouping grouping = parseGrouping();
      expect(Type.LPAREN, "'(' after " + name);
      List<PromQlExpression> args = parseArguments(depth);
      if (grouping == null) {
        grouping = parseGrouping();
      }
      if (args.isEmpty()) {
        throw error(name + " requires an argument", nameToken);
      }
      PromQlExpression parameter = args.size() > 1 ? args.get(0) : null;
      PromQlExpression vector = args.get(args.size() - 1);

      PromQlExpression expression = new PromQlExpression();
      expression.absorb(vector);
      AggFunction function = aggregationFunction(name, parameter);
      List<Value> values =
          function instanceof AggFunction.Custom && parameter != null
              ? literalArguments(List.of(parameter))
              : List.of();
      expression.aggregation(new Aggregation(function, null, values, null, false));
      if (grouping != null) {
        if (grouping.without()) {
          expression.hint("without", String.join(",", grouping.labels()));
        } else {
          grouping.labels().forEach(label -> expression.group(GroupBy.tag(label)));
        }
      }
      log.debug("PromQL aggregation {} with grouping {}", name, grouping);
      return expression;
    }

    private Grouping parseGrouping() {
      if (peek().isIdentifier("by") || peek().isIdentifier("without")) {
        boolean without = next().isIdentifier("without");
        return new Grouping(without, labels());
      }
      return null;
    }

    private PromQlExpression parseFunctionCall(int depth) {
      PromQlToken nameToken = next();
      String name = nameToken.text();
      next();
      List<PromQlExpression> args = parseArguments(depth);
      PromQlExpression expression = new PromQlExpression();
      applyFunction(name, args, expression);
      return expression;
    }

    /** Arguments after the opening parenthesis, consuming the closing one. */
    private List<PromQlExpression> parseArguments(int depth) {
      List<PromQlExpression> args = new ArrayList<>();
      if (peek().is(Type.RPAREN)) {
        next();
        return args;
      }
      while (true) {
        args.add(parseExpression(depth + 1, 1));
        PromQlToken token = next();
        if (token.is(Type.RPAREN)) {
          return args;
        }
        if (!token.is(Type.COMMA)) {
          throw error("Expected ',' or ')' but found '" + token.text() + "'", token);
        }
      }
    }

    private List<String> labels() {
      expect(Type.LPAREN, "'(' before label list");
      List<String> labels = new ArrayList<>();
      while (!peek().is(Type.RPAREN)) {
        PromQlToken label = next();
        if (!label.is(Type.IDENTIFIER) && !label.is(Type.STRING)) {
          throw error("Expected label name but found '" + label.text() + "'", label);
        }
        labels.add(label.text());
        if (peek().is(Type.COMMA)) {
          next();
        } else if (!peek().is(Type.RPAREN)) {
          throw error("Expected ',' or ')' in label list", peek());
        }
      }
      next();
      return labels;
    }

    private String labelList() {
      return "(" + String.join(", ", labels()) + ")";
    }

    private long duration() {
      PromQlToken token = next();
      if (!token.is(Type.DURATION)) {
        throw error("Expected duration but found '" + token.text() + "'", token);
      }
      return DurationUtils.parse(token.text());
    }

    private double parseNumber(String text) {
      if (text.startsWith("0x") || text.startsWith("0X")) {
        return Long.parseLong(text.substring(2), 16);
      }
      return Double.parseDouble(text);
    }

    private String textFrom(int start) {
      int end = index > 0 ? tokens.get(index - 1).end() : start;
      return end > start ? query.substring(start, end) : "";
    }

    private PromQlToken peek() {
      return tokens.get(index);
    }

    private PromQlToken peekAhead(int offset) {
      return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private PromQlToken next() {
      PromQlToken token = tokens.get(index);
      if (!token.is(Type.EOF)) {
        index++;
      }
      return token;
    }

    private void expect(Type type, String description) {
      PromQlToken token = next();
      if (!token.is(type)) {
        throw error("Expected " + description + " but found '" + token.text() + "'", token);
      }
    }

    private QueryParseException error(String message, PromQlToken token) {
      return QueryParseException.at(message, query, token.position());
    }
  }

  private record Grouping(boolean without, List<String> labels) {}
}
