package com.evoila.rosetta.common.sql;

import com.evoila.rosetta.common.dialect.AbstractDialectParser;
import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.DataType;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.Filter;
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
import com.evoila.rosetta.common.utils.DurationUtils;
import com.evoila.rosetta.common.utils.FunctionCall;
import com.evoila.rosetta.common.utils.StringParser;
import com.evoila.rosetta.common.utils.StringParser.KeywordMatch;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Template for the SQL-family dialects.
 *
 * <p>A SELECT statement is split into its top-level clauses, then each clause is handled by an
 * overridable step: sources from FROM (tables, sub-queries and joins), aggregations and
 * transformations from the select list, time range and filters from WHERE, grouping, ordering and
 * bounds. Dialect subclasses add their own clause keywords and function tables and override the
 * hooks for their time bucketing and windowing syntax.
 *
 * <p>A statement that does not start with SELECT is accepted only if its leading keyword is a known
 * statement keyword of the dialect, in which case the plan records the statement kind in the hints.
 */
@Slf4j
public abstract class AbstractSqlParser extends AbstractDialectParser {

  protected static final List<String> STANDARD_CLAUSES =
      List.of("SELECT", "FROM", "WHERE", "GROUP BY", "HAVING", "ORDER BY", "LIMIT", "OFFSET");

  protected static final Set<String> STANDARD_STATEMENTS =
      Set.of(
          "CREATE", "DROP", "ALTER", "INSERT", "DELETE", "UPDATE", "SHOW", "DESCRIBE", "DESC",
          "EXPLAIN", "USE");

  protected static final Map<String, AggFunction> STANDARD_AGGREGATES =
      Map.ofEntries(
          Map.entry("count", AggFunction.Basic.COUNT),
          Map.entry("sum", AggFunction.Basic.SUM),
          Map.entry("avg", AggFunction.Basic.AVG),
          Map.entry("min", AggFunction.Basic.MIN),
          Map.entry("max", AggFunction.Basic.MAX),
          Map.entry("stddev", AggFunction.Basic.STDDEV),
          Map.entry("stddev_pop", AggFunction.Basic.STDDEV_POP),
          Map.entry("stddev_samp", AggFunction.Basic.STDDEV_SAMP),
          Map.entry("variance", AggFunction.Basic.VARIANCE),
          Map.entry("var_pop", AggFunction.Basic.VAR_POP),
          Map.entry("var_samp", AggFunction.Basic.VAR_SAMP),
          Map.entry("first", AggFunction.Basic.FIRST),
          Map.entry("last", AggFunction.Basic.LAST),
          Map.entry("median", AggFunction.Basic.MEDIAN),
          Map.entry("mode", AggFunction.Basic.MODE),
          Map.entry("spread", AggFunction.Basic.SPREAD),
          Map.entry("twa", AggFunction.Basic.TWA),
          Map.entry("irate", AggFunction.Basic.IRATE),
          Map.entry("count_distinct", AggFunction.Basic.COUNT_DISTINCT));

  protected static final Map<String, TransformType> STANDARD_TRANSFORMS =
      Map.ofEntries(
          Map.entry("abs", TransformType.Basic.ABS),
          Map.entry("ceil", TransformType.Basic.CEIL),
          Map.entry("ceiling", TransformType.Basic.CEIL),
          Map.entry("floor", TransformType.Basic.FLOOR),
          Map.entry("sqrt", TransformType.Basic.SQRT),
          Map.entry("exp", TransformType.Basic.EXP),
          Map.entry("lower", TransformType.Basic.LOWER),
          Map.entry("upper", TransformType.Basic.UPPER),
          Map.entry("trim", TransformType.Basic.TRIM),
          Map.entry("cumulative_sum", TransformType.Basic.CUMULATIVE_SUM),
          Map.entry("csum", TransformType.Basic.CUMULATIVE_SUM),
          Map.entry("ln", new TransformType.Log(null)),
          Map.entry("log10", new TransformType.Log(10.0)),
          Map.entry("log2", new TransformType.Log(2.0)));

  private static final Set<String> STANDARD_TIME_COLUMNS =
      Set.of("time", "ts", "timestamp", "_time", "__time", "event_time", "_ts");

  private static final List<String> JOIN_KEYWORDS =
      List.of(
          "LEFT OUTER JOIN",
          "RIGHT OUTER JOIN",
          "FULL OUTER JOIN",
          "INNER JOIN",
          "LEFT JOIN",
          "RIGHT JOIN",
          "FULL JOIN",
          "CROSS JOIN",
          "ASOF JOIN",
          "LT JOIN",
          "SPLICE JOIN",
          "GLOBAL JOIN",
          "JOIN",
          "ON",
          "USING");

  private static final Pattern NOW_MINUS =
      Pattern.compile(
          "^(?:now(?:\\s*\\(\\s*\\))?|current_timestamp(?:\\s*\\(\\s*\\))?)\\s*-\\s*(.+)$",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern INTERVAL_PREFIX =
      Pattern.compile("^interval\\s+(.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern BOUND =
      Pattern.compile("^([\"`]?[\\w.]+[\"`]?)\\s*(>=|>|<=|<)\\s*(.+)$", Pattern.DOTALL);
  private static final Pattern BETWEEN =
      Pattern.compile(
          "^([\"`]?[\\w.]+[\"`]?)\\s+BETWEEN\\s+(.+?)\\s+AND\\s+(.+)$",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern EPOCH = Pattern.compile("^(\\d+)(ns|u|µ|us|ms|s)?$");
  private static final Pattern PLAIN_COLUMN =
      Pattern.compile("^(?:\"[^\"]+\"|`[^`]+`|[A-Za-z_@$][\\w.@$]*)$");
  private static final Pattern ORDER_ITEM =
      Pattern.compile(
          "^(.+?)(?:\\s+(ASC|DESC))?(?:\\s+NULLS\\s+(FIRST|LAST))?$",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern STATEMENT_TARGET =
      Pattern.compile(
          "\\b(?:TABLE|STABLE|DATABASE|MEASUREMENT|VIEW|HYPERTABLE|INTO|FROM)\\s+"
              + "(?:IF\\s+(?:NOT\\s+)?EXISTS\\s+)?([\\w.\"`]+)",
          Pattern.CASE_INSENSITIVE);

  protected AbstractSqlParser(ParserLimits limits) {
    super(limits);
  }

  // ============================================================================
  // Dialect hooks
  // ============================================================================

  /** Clause keywords splitting a SELECT statement, longest alternatives are preferred. */
  protected List<String> clauseKeywords() {
    return STANDARD_CLAUSES;
  }

  /** Clause keywords that double as function names, such as ClickHouse's {@code SAMPLE}. */
  protected Set<String> functionNamedClauses() {
    return Set.of();
  }

  /** Leading keywords accepted for statements other than SELECT. */
  protected Set<String> statementKeywords() {
    return STANDARD_STATEMENTS;
  }

  /** Lower-case aggregate function names mapped to their canonical function. */
  protected Map<String, AggFunction> aggregateFunctions() {
    return STANDARD_AGGREGATES;
  }

  protected SourceKind defaultSourceKind() {
    return SourceKind.Basic.TABLE;
  }

  /** Whether {@code /regex/} literals appear in predicates. */
  protected boolean regexLiterals() {
    return false;
  }

  /** Unit table for compact duration literals such as {@code 1h}. */
  protected Map<String, Long> durationUnits() {
    return DurationUtils.COMPACT_UNITS;
  }

  protected boolean isTimeColumn(String column) {
    return STANDARD_TIME_COLUMNS.contains(column.toLowerCase(Locale.ROOT));
  }

  /** Rewrites the FROM clause before table references are extracted, e.g. to strip modifiers. */
  protected String prepareFrom(String from, SqlParseContext context) {
    return from;
  }

  /**
   * Handles a select-list function call with dialect meaning (time buckets, gap filling).
   *
   * @return true if the call was consumed
   */
  protected boolean handleFunction(
      FunctionCall call, String alias, int ordinal, SqlParseContext context) {
    return false;
  }

  /**
   * Handles a select-list expression that is not a plain function call.
   *
   * @return true if the expression was consumed
   */
  protected boolean handleExpression(
      String expression, String alias, int ordinal, SqlParseContext context) {
    return false;
  }

  /**
   * Handles a GROUP BY item with dialect meaning.
   *
   * @return true if the item was consumed
   */
  protected boolean handleGroupBy(String item, SqlParseContext context) {
    return false;
  }

  /**
   * Resolves the offset in {@code now() - <offset>} to milliseconds. Understands SQL interval
   * literals and compact durations.
   */
  protected Optional<Long> parseOffset(String offset) {
    String text = offset.trim();
    try {
      Matcher interval = INTERVAL_PREFIX.matcher(text);
      if (interval.matches()) {
        return Optional.of(DurationUtils.parseSqlInterval(interval.group(1)));
      }
      return Optional.of(DurationUtils.parse(text, durationUnits()));
    } catch (IllegalArgumentException e) {
      log.debug("Not a relative offset: '{}'", text);
      return Optional.empty();
    }
  }

  /**
   * Resolves the right-hand side of a lower time bound to a look-back duration, for forms such as
   * {@code NOW() - INTERVAL '1 hour'}.
   */
  protected Optional<Long> parseRelativeStart(String expression) {
    Matcher matcher = NOW_MINUS.matcher(expression.trim());
    if (matcher.matches()) {
      return parseOffset(matcher.group(1));
    }
    return Optional.empty();
  }

  /** Clauses only the dialect knows about, such as SAMPLE BY or INTERVAL. */
  protected void parseDialectClauses(SqlStatement statement, SqlParseContext context) {
    // no dialect clauses by default
  }

  // ============================================================================
  // Statement level
  // ============================================================================

  @Override
  protected QueryPlan doParse(String query) {
    String text = query.endsWith(";") ? query.substring(0, query.length() - 1).trim() : query;
    return parseStatement(text, 0);
  }

  protected QueryPlan parseStatement(String text, int depth) {
    checkDepth(depth, text, 0);
    String leading = StringParser.leadingKeyword(text);
    if (leading.equals("SELECT")) {
      return parseSelect(text, depth);
    }
    if (leading.equals("WITH")) {
      return parseWith(text, depth);
    }
    return parseNonSelect(text, leading);
  }

  private QueryPlan parseWith(String text, int depth) {
    int select = StringParser.indexOfTopLevelKeyword(text, "SELECT", 4);
    if (select < 0) {
      throw new QueryParseException("WITH clause is not followed by a SELECT statement");
    }
    QueryPlan plan = parseSelect(text.substring(select), depth);
    return plan.toBuilder()
        .hints(
            plan.getHints().toBuilder()
                .customHint("with", text.substring(4, select).trim())
                .build())
        .build();
  }

  /** Accepts known non-SELECT statements, recording their kind and target object. */
  protected QueryPlan parseNonSelect(String text, String leading) {
    if (leading.isEmpty() || !statementKeywords().contains(leading)) {
      throw new QueryParseException(
          "Expected a SELECT statement but found '"
              + (leading.isEmpty() ? text.substring(0, Math.min(text.length(), 20)) : leading)
              + "'");
    }
    QueryPlan.QueryPlanBuilder plan = QueryPlan.builder();
    Matcher target = STATEMENT_TARGET.matcher(text);
    if (target.find()) {
      plan.source(tableReference(target.group(1)));
    }
    return plan.hints(QueryHints.builder().customHint("statement", leading).build()).build();
  }

  protected QueryPlan parseSelect(String text, int depth) {
    SqlStatement statement =
        SqlStatement.split(text, clauseKeywords(), functionNamedClauses());
    String from =
        statement
            .clause("FROM")
            .filter(clause -> !clause.isBlank())
            .orElseThrow(() -> new QueryParseException("SELECT statement requires a FROM clause"));
    String select = statement.clause("SELECT").orElse("");
    if (select.isBlank()) {
      throw new QueryParseException("SELECT statement has an empty select list");
    }

    SqlParseContext context = new SqlParseContext(statement, depth);
    parseFrom(from, context);
    parseProjection(select, context);
    statement.clause("WHERE").ifPresent(where -> parseWhere(where, context));
    statement.clause("GROUP BY").ifPresent(groupBy -> parseGroupBy(groupBy, context));
    statement.clause("HAVING").ifPresent(having -> context.hint("having", having));
    statement.clause("ORDER BY").ifPresent(orderBy -> parseOrderBy(orderBy, context));
    statement.clause("LIMIT").ifPresent(limit -> parseLimit(limit, context));
    statement.clause("OFFSET").ifPresent(offset -> context.offset(parseCount(offset, "OFFSET")));
    parseDialectClauses(statement, context);
    statement.repeated().forEach(clause -> context.hint("unparsed", clause));
    return context.build();
  }

  // ============================================================================
  // FROM
  // ============================================================================

  protected void parseFrom(String from, SqlParseContext context) {
    String text = prepareFrom(from, context);
    List<KeywordMatch> joins = StringParser.findTopLevelKeywords(text, JOIN_KEYWORDS);
    int primaryEnd = joins.isEmpty() ? text.length() : joins.get(0).start();
    for (String reference : StringParser.splitTopLevel(text.substring(0, primaryEnd), ',')) {
      context.source(sourceReference(reference, context));
    }
    for (int i = 0; i < joins.size(); i++) {
      KeywordMatch match = joins.get(i);
      int end = i + 1 < joins.size() ? joins.get(i + 1).start() : text.length();
      String content = text.substring(match.end(), end).trim();
      if (match.keyword().equals("ON") || match.keyword().equals("USING")) {
        context.hint("join_condition", content);
      } else {
        String joinType =
            match.keyword().equals("JOIN") ? "INNER" : match.keyword().replace(" JOIN", "");
        context.hint("join_type", joinType);
        context.source(sourceReference(content, context));
      }
    }
  }

  private DataSource sourceReference(String reference, SqlParseContext context) {
    String text = reference.trim();
    if (text.isEmpty()) {
      throw new QueryParseException("Empty table reference");
    }
    if (text.startsWith("(")) {
      int close = StringParser.findClosing(text, 0);
      if (close < 0) {
        throw new QueryParseException("Unclosed sub-query in FROM clause");
      }
      QueryPlan subquery =
          parseStatement(text.substring(1, close).trim(), context.getDepth() + 1);
      String alias = stripAs(text.substring(close + 1));
      return new DataSource(
          alias != null ? alias : "subquery", null, null, alias, new SourceKind.Subquery(subquery));
    }
    List<String> words = StringParser.splitWords(text);
    DataSource table = tableReference(words.get(0));
    String alias =
        words.size() > 1 ? stripAs(String.join(" ", words.subList(1, words.size()))) : null;
    return new DataSource(
        table.name(), table.database(), table.retentionPolicy(), alias, defaultSourceKind());
  }

  private static String stripAs(String text) {
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    if (trimmed.toUpperCase(Locale.ROOT).startsWith("AS ")) {
      trimmed = trimmed.substring(3).trim();
    }
    List<String> words = StringParser.splitWords(trimmed);
    return words.isEmpty() ? null : StringParser.unquote(words.get(0));
  }

  /** Parses {@code table}, {@code db.table} or {@code db.rp.table}, each part optionally quoted. */
  protected DataSource tableReference(String path) {
    List<String> parts = StringParser.splitTopLevel(path, '.');
    if (parts.isEmpty() || parts.size() > 3) {
      throw new QueryParseException("Invalid table reference: " + path);
    }
    String name = StringParser.unquote(parts.get(parts.size() - 1));
    if (name.isEmpty()) {
      throw new QueryParseException("Invalid table reference: " + path);
    }
    String database = parts.size() > 1 ? StringParser.unquote(parts.get(0)) : null;
    String retentionPolicy = parts.size() == 3 ? StringParser.unquote(parts.get(1)) : null;
    return new DataSource(name, database, retentionPolicy, null, defaultSourceKind());
  }

  // ============================================================================
  // Select list
  // ============================================================================

  protected void parseProjection(String select, SqlParseContext context) {
    String list = select.trim();
    if (StringParser.matchWords(list, 0, new String[] {"DISTINCT"}) > 0) {
      context.hint("distinct", "true");
      list = list.substring("DISTINCT".length()).trim();
    }
    List<String> items = StringParser.splitTopLevel(list, ',');
    for (int i = 0; i < items.size(); i++) {
      String item = items.get(i);
      String expression = item;
      String alias = null;
      List<KeywordMatch> as = StringParser.findTopLevelKeywords(item, List.of("AS"));
      if (!as.isEmpty()) {
        KeywordMatch last = as.get(as.size() - 1);
        expression = item.substring(0, last.start()).trim();
        alias = StringParser.unquote(item.substring(last.end()).trim());
      }
      context.projection(expression);
      projectExpression(expression, alias, i + 1, context);
    }
  }

  protected void projectExpression(
      String expression, String alias, int ordinal, SqlParseContext context) {
    if (expression.equals("*")) {
      return;
    }
    if (handleExpression(expression, alias, ordinal, context)) {
      return;
    }
    Optional<FunctionCall> call = FunctionCall.parse(expression);
    if (call.isPresent()) {
      projectCall(call.get(), alias, ordinal, context);
    } else if (isPlainColumn(expression)) {
      String column = StringParser.unquote(expression);
      context.column(column);
      context.setLastColumn(column);
    } else {
      context.hint("projection", expression);
    }
  }

  private void projectCall(FunctionCall call, String alias, int ordinal, SqlParseContext context) {
    if (handleFunction(call, alias, ordinal, context)) {
      return;
    }
    String name = call.lowerName();
    if (name.equals("cast")) {
      projectCast(call, alias, context);
      return;
    }

    String first = call.argument(0).orElse("").trim();
    boolean distinct = false;
    if (StringParser.matchWords(first, 0, new String[] {"DISTINCT"}) > 0) {
      distinct = true;
      first = first.substring("DISTINCT".length()).trim();
    }
    String column = argumentColumn(first, ordinal, context);
    List<Value> args = literalArguments(call, 1);

    AggFunction function = aggregateFunctions().get(name);
    if (function != null) {
      if (function == AggFunction.Basic.COUNT && distinct) {
        function = AggFunction.Basic.COUNT_DISTINCT;
      }
      context.aggregation(new Aggregation(function, column, args, alias, distinct));
    } else {
      Optional<AggFunction> parametric = parametricAggregate(name, call);
      Optional<TransformType> transform = transformFor(name, call);
      if (parametric.isPresent()) {
        context.aggregation(new Aggregation(parametric.get(), column, args, alias, distinct));
      } else if (transform.isPresent()) {
        context.transformation(new Transformation(transform.get(), column, alias));
      } else {
        context.aggregation(
            new Aggregation(new AggFunction.Custom(call.name()), column, args, alias, distinct));
      }
    }
    context.setLastColumn(column);
  }

  private String argumentColumn(String argument, int ordinal, SqlParseContext context) {
    if (argument.isEmpty() || argument.equals("*")) {
      return null;
    }
    if (FunctionCall.parse(argument).isPresent()) {
      context.setLastColumn(null);
      projectExpression(argument, null, ordinal, context);
      return context.getLastColumn();
    }
    if (isPlainColumn(argument)) {
      return StringParser.unquote(argument);
    }
    return null;
  }

  private void projectCast(FunctionCall call, String alias, SqlParseContext context) {
    String argument = call.argumentText();
    List<KeywordMatch> as = StringParser.findTopLevelKeywords(argument, List.of("AS"));
    if (as.isEmpty()) {
      context.hint("projection", "CAST(" + argument + ")");
      return;
    }
    String column = StringParser.unquote(argument.substring(0, as.get(0).start()).trim());
    String typeName = argument.substring(as.get(0).end()).trim().replaceAll("\\(.*\\)$", "");
    Optional<DataType> type = DataType.fromSqlName(typeName);
    if (type.isPresent()) {
      context.transformation(new Transformation(new TransformType.Cast(type.get()), column, alias));
    } else {
      context.hint("cast", column + " AS " + typeName);
    }
  }

  /** Literal arguments from position {@code from} on; quoted ones become strings. */
  protected static List<Value> literalArguments(FunctionCall call, int from) {
    List<Value> values = new ArrayList<>();
    for (int i = from; i < call.arguments().size(); i++) {
      String argument = call.arguments().get(i);
      values.add(
          StringParser.isQuoted(argument)
              ? Value.of(StringParser.unquote(argument))
              : Value.parse(argument));
    }
    return values;
  }

  /** Aggregates with a numeric parameter, such as {@code percentile(x, 95)}. */
  protected Optional<AggFunction> parametricAggregate(String name, FunctionCall call) {
    Optional<Double> parameter = numericArgument(call, 1);
    if (parameter.isEmpty()) {
      return Optional.empty();
    }
    double value = parameter.get();
    return switch (name) {
      case "percentile", "percentile_cont", "percentile_disc" ->
          Optional.of(new AggFunction.Percentile(normalizeQuantile(value)));
      case "apercentile", "approx_percentile", "percentile_approx" ->
          Optional.of(new AggFunction.Apercentile(normalizeQuantile(value)));
      case "top" -> Optional.of(new AggFunction.TopK((int) value));
      case "bottom" -> Optional.of(new AggFunction.BottomK((int) value));
      case "sample" -> Optional.of(new AggFunction.Sample((int) value));
      default -> Optional.empty();
    };
  }

  /** Scalar and series transformations such as {@code abs(x)} or {@code derivative(x, 1s)}. */
  protected Optional<TransformType> transformFor(String name, FunctionCall call) {
    TransformType basic = STANDARD_TRANSFORMS.get(name);
    if (basic != null) {
      return Optional.of(basic);
    }
    return switch (name) {
      case "round" ->
          Optional.of(
              new TransformType.Round(
                  numericArgument(call, 1).map(Double::intValue).orElse(null)));
      case "pow", "power" -> numericArgument(call, 1).map(TransformType.Pow::new);
      case "log" -> Optional.of(new TransformType.Log(numericArgument(call, 1).orElse(10.0)));
      case "derivative" ->
          Optional.of(new TransformType.Derivative(durationArgument(call, 1), false));
      case "non_negative_derivative" ->
          Optional.of(new TransformType.Derivative(durationArgument(call, 1), true));
      case "difference", "diff" -> Optional.of(new TransformType.Difference(false));
      case "non_negative_difference" -> Optional.of(new TransformType.Difference(true));
      case "moving_average", "mavg" ->
          numericArgument(call, 1)
              .map(points -> new TransformType.MovingAverage(points.intValue()));
      case "elapsed" -> Optional.of(new TransformType.Elapsed(durationArgument(call, 1)));
      default -> Optional.empty();
    };
  }

  protected static Optional<Double> numericArgument(FunctionCall call, int index) {
    return call.argument(index)
        .map(StringParser::unquote)
        .filter(text -> text.matches("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?"))
        .map(Double::parseDouble);
  }

  protected Long durationArgument(FunctionCall call, int index) {
    return call.argument(index)
        .map(StringParser::unquote)
        .filter(text -> DurationUtils.isDuration(text, durationUnits()))
        .map(text -> DurationUtils.parse(text, durationUnits()))
        .orElse(null);
  }

  protected static double normalizeQuantile(double value) {
    return value > 1 ? value / 100.0 : value;
  }

  protected static boolean isPlainColumn(String expression) {
    return PLAIN_COLUMN.matcher(expression.trim()).matches();
  }

  // ============================================================================
  // WHERE
  // ============================================================================

  protected void parseWhere(String where, SqlParseContext context) {
    for (String conjunct : SqlStatement.splitConjuncts(where)) {
      if (parseTimeCondition(conjunct, context)) {
        continue;
      }
      try {
        context.filter(Filter.of(SqlExpressionParser.parse(conjunct, regexLiterals())));
      } catch (IllegalArgumentException e) {
        log.debug("Keeping unparsed filter '{}' as hint: {}", conjunct, e.getMessage());
        context.hint("filter", conjunct);
      }
    }
  }

  /**
   * Recognizes bounds on the time column: relative look-backs, epoch or timestamp bounds and
   * BETWEEN ranges.
   *
   * @return true if the condition was turned into (part of) the time range
   */
  protected boolean parseTimeCondition(String condition, SqlParseContext context) {
    Matcher between = BETWEEN.matcher(condition);
    if (between.matches() && isTimeColumn(StringParser.unquote(between.group(1)))) {
      Optional<Long> start = parseTimestamp(between.group(2));
      Optional<Long> end = parseTimestamp(between.group(3));
      if (start.isPresent() && end.isPresent()) {
        context.timeRange(new TimeRange.Absolute(start.get(), end.get()));
        return true;
      }
      return false;
    }
    Matcher bound = BOUND.matcher(condition);
    if (!bound.matches() || !isTimeColumn(StringParser.unquote(bound.group(1)))) {
      return false;
    }
    String operator = bound.group(2);
    String value = bound.group(3).trim();
    boolean lower = operator.startsWith(">");
    if (lower) {
      Optional<Long> lookBack = parseRelativeStart(value);
      if (lookBack.isPresent()) {
        context.relative(lookBack.get());
        return true;
      }
    }
    Optional<Long> timestamp = parseTimestamp(value);
    if (timestamp.isPresent()) {
      if (lower) {
        context.lowerBound(timestamp.get());
      } else {
        context.upperBound(timestamp.get());
      }
      return true;
    }
    return false;
  }

  private static String epochUnit(int digits) {
    if (digits <= 10) {
      return "s";
    }
    if (digits <= 13) {
      return "ms";
    }
    return digits <= 16 ? "us" : "ns";
  }

  /**
   * Parses an epoch literal (optionally with a unit suffix) or a quoted ISO-8601 timestamp to epoch
   * milliseconds. Bare epochs are interpreted by magnitude: up to 10 digits seconds, up to 13
   * milliseconds, up to 16 microseconds, otherwise nanoseconds.
   */
  protected static Optional<Long> parseTimestamp(String literal) {
    String text = literal.trim();
    Matcher epoch = EPOCH.matcher(text);
    if (epoch.matches()) {
      String digits = epoch.group(1);
      if (digits.length() > 19) {
        return Optional.empty();
      }
      long value = Long.parseLong(digits);
      String unit = epoch.group(2);
      if (unit == null) {
        unit = epochUnit(digits.length());
      }
      return Optional.of(
          switch (unit) {
            case "s" -> value * 1000;
            case "ms" -> value;
            case "u", "µ", "us" -> value / 1000;
            default -> value / 1_000_000;
          });
    }
    if (!StringParser.isQuoted(text)) {
      return Optional.empty();
    }
    String timestamp = StringParser.unquote(text).trim();
    try {
      if (timestamp.length() == 10) {
        return Optional.of(
            LocalDate.parse(timestamp).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli());
      }
      if (timestamp.endsWith("Z") || timestamp.matches(".*[+-]\\d{2}:\\d{2}$")) {
        return Optional.of(Instant.parse(timestamp.replace(' ', 'T')).toEpochMilli());
      }
      return Optional.of(
          LocalDateTime.parse(timestamp.replace(' ', 'T'))
              .toInstant(ZoneOffset.UTC)
              .toEpochMilli());
    } catch (DateTimeParseException e) {
      log.debug("Not a timestamp literal: '{}'", timestamp);
      return Optional.empty();
    }
  }

  // ============================================================================
  // Shared dialect helpers
  // ============================================================================

  /**
   * Registers a time bucket of {@code intervalMs} over {@code column}: an interval window plus the
   * matching grouping. Only the first bucket of a statement counts; the select-list entry is
   * remembered so GROUP BY references to it are skipped.
   */
  protected void timeBucket(
      long intervalMs, String column, String alias, int ordinal, SqlParseContext context) {
    if (!context.hasWindow()) {
      context.window(Window.of(WindowKind.Interval.of(intervalMs)));
      context.group(GroupBy.timeBucket(intervalMs, column));
    }
    context.bucketProjection(alias, ordinal);
  }

  /** Content of a clause written as {@code (a, b)}, split at top-level commas; never empty. */
  protected static List<String> parenthesizedArguments(String clause, String keyword) {
    String text = clause.trim();
    if (!text.startsWith("(") || StringParser.findClosing(text, 0) != text.length() - 1) {
      throw new QueryParseException(keyword + " expects a parenthesized argument list");
    }
    List<String> arguments = StringParser.splitTopLevel(text.substring(1, text.length() - 1), ',');
    if (arguments.isEmpty()) {
      throw new QueryParseException(keyword + " requires an argument");
    }
    return arguments;
  }

  /**
   * Parses a FILL argument list: {@code none}, {@code null}, {@code prev[ious]}, {@code next},
   * {@code linear}, {@code value, <v>} or a bare constant.
   */
  protected static FillStrategy fillStrategy(List<String> arguments) {
    if (arguments.isEmpty()) {
      throw new QueryParseException("FILL requires an argument");
    }
    String mode = arguments.get(0).trim().toLowerCase(Locale.ROOT);
    return switch (mode) {
      case "none" -> FillStrategy.Basic.NONE;
      case "null", "null_f" -> FillStrategy.Basic.NULL;
      case "prev", "previous" -> FillStrategy.Basic.PREVIOUS;
      case "next" -> FillStrategy.Basic.NEXT;
      case "linear" -> FillStrategy.Basic.LINEAR;
      case "value", "value_f" -> {
        if (arguments.size() < 2) {
          throw new QueryParseException("FILL(VALUE) requires a constant");
        }
        yield new FillStrategy.Constant(Value.parse(arguments.get(1)));
      }
      default -> {
        Value constant = Value.parse(arguments.get(0));
        if (constant instanceof Value.StringValue) {
          throw new QueryParseException("Unknown FILL mode: " + arguments.get(0));
        }
        yield new FillStrategy.Constant(constant);
      }
    };
  }

  // ============================================================================
  // GROUP BY, ORDER BY, LIMIT
  // ============================================================================

  protected void parseGroupBy(String groupBy, SqlParseContext context) {
    for (String item : StringParser.splitTopLevel(groupBy, ',')) {
      if (context.isBucketReference(item) || handleGroupBy(item, context)) {
        continue;
      }
      if (item.equals("*")) {
        context.group(GroupBy.allTags());
      } else if (item.matches("\\d+")) {
        int ordinal = Integer.parseInt(item);
        List<String> projections = context.projections();
        if (ordinal < 1 || ordinal > projections.size()) {
          throw new QueryParseException("GROUP BY position " + ordinal + " is not in select list");
        }
        String projection = projections.get(ordinal - 1);
        context.group(
            isPlainColumn(projection)
                ? GroupBy.column(StringParser.unquote(projection))
                : GroupBy.expression(projection));
      } else if (isPlainColumn(item)) {
        context.group(GroupBy.column(StringParser.unquote(item)));
      } else {
        context.group(GroupBy.expression(item));
      }
    }
  }

  protected void parseOrderBy(String orderBy, SqlParseContext context) {
    for (String item : StringParser.splitTopLevel(orderBy, ',')) {
      Matcher matcher = ORDER_ITEM.matcher(item.trim());
      if (!matcher.matches()) {
        context.hint("order_by", item);
        continue;
      }
      boolean ascending = !"DESC".equalsIgnoreCase(matcher.group(2));
      Boolean nullsFirst =
          matcher.group(3) == null ? null : "FIRST".equalsIgnoreCase(matcher.group(3));
      String column = StringParser.unquote(matcher.group(1).trim());
      context.order(new OrderBy(column, ascending, nullsFirst));
    }
  }

  protected void parseLimit(String limit, SqlParseContext context) {
    String text = limit.trim();
    List<KeywordMatch> offset = StringParser.findTopLevelKeywords(text, List.of("OFFSET", "BY"));
    if (!offset.isEmpty()) {
      KeywordMatch match = offset.get(0);
      String rest = text.substring(match.end()).trim();
      text = text.substring(0, match.start()).trim();
      if (match.keyword().equals("OFFSET")) {
        context.offset(parseCount(rest, "OFFSET"));
      } else {
        context.hint("limit_by", rest);
      }
    }
    List<String> parts = StringParser.splitTopLevel(text, ',');
    if (parts.size() == 2) {
      context.offset(parseCount(parts.get(0), "OFFSET"));
      context.limit(parseCount(parts.get(1), "LIMIT"));
    } else {
      context.limit(parseCount(text, "LIMIT"));
    }
  }

  protected static long parseCount(String text, String clause) {
    String trimmed = text.trim();
    if (!trimmed.matches("\\d{1,18}")) {
      throw new QueryParseException("Invalid " + clause + " value: '" + trimmed + "'");
    }
    return Long.parseLong(trimmed);
  }
}
