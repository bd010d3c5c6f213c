package com.evoila.rosetta.tdengine;

import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.sql.AbstractSqlParser;
import com.evoila.rosetta.common.sql.SqlExpressionParser;
import com.evoila.rosetta.common.sql.SqlParseContext;
import com.evoila.rosetta.common.sql.SqlStatement;
import com.evoila.rosetta.common.utils.DurationUtils;
import com.evoila.rosetta.common.utils.StringParser;
import com.evoila.rosetta.common.utils.StringParser.KeywordMatch;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * TDengine parser.
 *
 * <p>Window clauses follow FROM/WHERE/PARTITION BY: {@code INTERVAL(d[, offset]) [SLIDING(d)]},
 * {@code SESSION(col, gap)}, {@code STATE_WINDOW(col)}, {@code EVENT_WINDOW START WITH ... END
 * WITH ...} and {@code COUNT_WINDOW(n[, sliding])}, each optionally followed by {@code FILL(...)}.
 * Durations use TDengine units where {@code a} is milliseconds. Window pseudo columns such as
 * {@code _wstart} are treated as bucket references.
 */
@Component
public class TDengineParser extends AbstractSqlParser {

  /** TDengine duration units: a = ms, n = month. */
  public static final Map<String, Long> UNITS =
      Map.of(
          "a", 1L,
          "u", 0L,
          "s", DurationUtils.SECOND,
          "m", DurationUtils.MINUTE,
          "h", DurationUtils.HOUR,
          "d", DurationUtils.DAY,
          "w", DurationUtils.WEEK,
          "n", DurationUtils.MONTH,
          "y", DurationUtils.YEAR);

  private static final List<String> CLAUSES =
      List.of(
          "SELECT",
          "FROM",
          "WHERE",
          "PARTITION BY",
          "INTERVAL",
          "SLIDING",
          "SESSION",
          "STATE_WINDOW",
          "EVENT_WINDOW",
          "COUNT_WINDOW",
          "FILL",
          "GROUP BY",
          "HAVING",
          "ORDER BY",
          "SLIMIT",
          "SOFFSET",
          "LIMIT",
          "OFFSET");

  private static final Set<String> WINDOW_PSEUDO_COLUMNS =
      Set.of("_wstart", "_wend", "_wduration", "_qstart", "_qend", "_qduration", "_irowts");

  private static final Map<String, AggFunction> AGGREGATES = buildAggregates();

  public TDengineParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public TDengineParser(ParserLimits limits) {
    super(limits);
  }

  private static Map<String, AggFunction> buildAggregates() {
    Map<String, AggFunction> aggregates = new HashMap<>(STANDARD_AGGREGATES);
    aggregates.put("last_row", AggFunction.Basic.LAST_ROW);
    aggregates.put("hyperloglog", AggFunction.Basic.HYPER_LOG_LOG);
    aggregates.put("histogram", AggFunction.Basic.HISTOGRAM);
    aggregates.put("leastsquares", new AggFunction.Custom("LEASTSQUARES"));
    return Map.copyOf(aggregates);
  }

  @Override
  public Dialect dialect() {
    return Dialect.TDENGINE;
  }

  @Override
  protected List<String> clauseKeywords() {
    return CLAUSES;
  }

  @Override
  protected Map<String, AggFunction> aggregateFunctions() {
    return AGGREGATES;
  }

  @Override
  protected Map<String, Long> durationUnits() {
    return UNITS;
  }

  @Override
  protected boolean handleExpression(
      String expression, String alias, int ordinal, SqlParseContext context) {
    if (WINDOW_PSEUDO_COLUMNS.contains(expression.trim().toLowerCase(Locale.ROOT))) {
      context.bucketProjection(alias, ordinal);
      return true;
    }
    return false;
  }

  @Override
  protected void parseDialectClauses(SqlStatement statement, SqlParseContext context) {
    statement.clause("PARTITION BY").ifPresent(partition -> parsePartition(partition, context));
    statement.clause("INTERVAL").ifPresent(interval -> parseInterval(interval, statement, context));
    statement.clause("SESSION").ifPresent(session -> parseSession(session, context));
    statement
        .clause("STATE_WINDOW")
        .ifPresent(
            state ->
                context.window(
                    Window.of(
                        new WindowKind.State(
                            StringParser.unquote(
                                parenthesizedArguments(state, "STATE_WINDOW").get(0))))));
    statement.clause("EVENT_WINDOW").ifPresent(event -> parseEventWindow(event, context));
    statement.clause("COUNT_WINDOW").ifPresent(count -> parseCountWindow(count, context));
    statement
        .clause("FILL")
        .ifPresent(fill -> context.setFill(fillStrategy(parenthesizedArguments(fill, "FILL"))));
    statement.clause("SLIMIT").ifPresent(slimit -> context.hint("slimit", slimit));
    statement.clause("SOFFSET").ifPresent(soffset -> context.hint("soffset", soffset));
  }

  private void parsePartition(String partition, SqlParseContext context) {
    for (String item : StringParser.splitTopLevel(partition, ',')) {
      String name = StringParser.unquote(item);
      context.group(GroupBy.tag(name.equalsIgnoreCase("tbname") ? "tbname" : name));
    }
  }

  private void parseInterval(String interval, SqlStatement statement, SqlParseContext context) {
    List<String> arguments = parenthesizedArguments(interval, "INTERVAL");
    long durationMs = duration(arguments.get(0));
    Long offsetMs = arguments.size() > 1 ? duration(arguments.get(1)) : null;
    Long slidingMs =
        statement
            .clause("SLIDING")
            .map(sliding -> duration(parenthesizedArguments(sliding, "SLIDING").get(0)))
            .orElse(null);
    context.window(Window.of(new WindowKind.Interval(durationMs, offsetMs, slidingMs)));
  }

  private void parseSession(String session, SqlParseContext context) {
    List<String> arguments = parenthesizedArguments(session, "SESSION");
    if (arguments.size() != 2) {
      throw new QueryParseException("SESSION expects a column and a gap");
    }
    context.window(
        Window.of(
            new WindowKind.Session(
                duration(arguments.get(1)), StringParser.unquote(arguments.get(0)))));
  }

  private void parseEventWindow(String event, SqlParseContext context) {
    List<KeywordMatch> parts =
        StringParser.findTopLevelKeywords(event, List.of("START WITH", "END WITH"));
    if (parts.size() != 2
        || !parts.get(0).keyword().equals("START WITH")
        || !parts.get(1).keyword().equals("END WITH")) {
      throw new QueryParseException("EVENT_WINDOW requires START WITH and END WITH conditions");
    }
    String start = event.substring(parts.get(0).end(), parts.get(1).start()).trim();
    String end = event.substring(parts.get(1).end()).trim();
    FilterCondition startCondition = SqlExpressionParser.parse(start, false);
    FilterCondition endCondition = SqlExpressionParser.parse(end, false);
    context.window(Window.of(new WindowKind.Event(startCondition, endCondition)));
  }

  private void parseCountWindow(String count, SqlParseContext context) {
    List<String> arguments = parenthesizedArguments(count, "COUNT_WINDOW");
    long rows = parseCount(arguments.get(0), "COUNT_WINDOW");
    Long sliding = arguments.size() > 1 ? parseCount(arguments.get(1), "COUNT_WINDOW") : null;
    context.window(Window.of(new WindowKind.Count(rows, sliding)));
  }

  private static long duration(String literal) {
    return DurationUtils.parse(StringParser.unquote(literal), UNITS);
  }
}
