package com.evoila.rosetta.clickhouse;

import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.sql.AbstractSqlParser;
import com.evoila.rosetta.common.sql.SqlParseContext;
import com.evoila.rosetta.common.sql.SqlStatement;
import com.evoila.rosetta.common.utils.DurationUtils;
import com.evoila.rosetta.common.utils.FunctionCall;
import com.evoila.rosetta.common.utils.StringParser;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * ClickHouse parser.
 *
 * <p>{@code toStartOf*} functions and {@code toStartOfInterval(col, INTERVAL n unit)} become time
 * buckets; parametric aggregates such as {@code quantile(0.95)(x)} map to percentiles. Modifiers
 * without an IR counterpart ({@code PREWHERE}, {@code FINAL}, {@code SAMPLE}, {@code WITH
 * TOTALS}, {@code SETTINGS}, {@code FORMAT}, {@code arrayJoin}) are kept as hints.
 */
@Slf4j
@Component
public class ClickHouseParser extends AbstractSqlParser {

  private static final List<String> CLAUSES =
      List.of(
          "SELECT",
          "FROM",
          "SAMPLE",
          "PREWHERE",
          "WHERE",
          "GROUP BY",
          "WITH TOTALS",
          "HAVING",
          "ORDER BY",
          "LIMIT",
          "OFFSET",
          "SETTINGS",
          "FORMAT");

  /** Fixed-width {@code toStartOf*} functions, keyed by lower-case name. */
  static final Map<String, Long> START_OF_FUNCTIONS =
      Map.of(
          "tostartofsecond", DurationUtils.SECOND,
          "tostartofminute", DurationUtils.MINUTE,
          "tostartoffiveminutes", 5 * DurationUtils.MINUTE,
          "tostartoffiveminute", 5 * DurationUtils.MINUTE,
          "tostartoftenminutes", 10 * DurationUtils.MINUTE,
          "tostartoffifteenminutes", 15 * DurationUtils.MINUTE,
          "tostartofhour", DurationUtils.HOUR,
          "tostartofday", DurationUtils.DAY,
          "tostartofweek", DurationUtils.WEEK,
          "tostartofmonth", DurationUtils.MONTH);

  private static final Map<String, AggFunction> AGGREGATES = buildAggregates();

  private static final Pattern PARAMETRIC_QUANTILE =
      Pattern.compile(
          "^(quantile\\w*)\\s*\\(\\s*([0-9.]+)\\s*\\)\\s*\\((.+)\\)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern GROUP_ARRAY_SAMPLE =
      Pattern.compile(
          "^groupArraySample\\s*\\(\\s*(\\d+)\\s*\\)\\s*\\((.+)\\)$",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern TO_INTERVAL =
      Pattern.compile("^toInterval(\\w+)\\s*\\(\\s*(\\d+)\\s*\\)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern FINAL_MODIFIER =
      Pattern.compile("\\s+FINAL\\b", Pattern.CASE_INSENSITIVE);

  public ClickHouseParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public ClickHouseParser(ParserLimits limits) {
    super(limits);
  }

  private static Map<String, AggFunction> buildAggregates() {
    Map<String, AggFunction> aggregates = new HashMap<>(STANDARD_AGGREGATES);
    aggregates.put("any", AggFunction.Basic.FIRST);
    aggregates.put("anylast", AggFunction.Basic.LAST);
    aggregates.put("uniq", AggFunction.Basic.COUNT_DISTINCT);
    aggregates.put("uniqexact", AggFunction.Basic.COUNT_DISTINCT);
    aggregates.put("uniqcombined", AggFunction.Basic.COUNT_DISTINCT);
    aggregates.put("uniqhll12", AggFunction.Basic.HYPER_LOG_LOG);
    aggregates.put("stddevpop", AggFunction.Basic.STDDEV_POP);
    aggregates.put("stddevsamp", AggFunction.Basic.STDDEV_SAMP);
    aggregates.put("varpop", AggFunction.Basic.VAR_POP);
    aggregates.put("varsamp", AggFunction.Basic.VAR_SAMP);
    return Map.copyOf(aggregates);
  }

  @Override
  public Dialect dialect() {
    return Dialect.CLICKHOUSE;
  }

  @Override
  protected List<String> clauseKeywords() {
    return CLAUSES;
  }

  @Override
  protected Set<String> functionNamedClauses() {
    return Set.of("SAMPLE");
  }

  @Override
  protected Map<String, AggFunction> aggregateFunctions() {
    return AGGREGATES;
  }

  @Override
  protected boolean isTimeColumn(String column) {
    return super.isTimeColumn(column)
        || Set.of("event_date", "datetime", "date").contains(column.toLowerCase(Locale.ROOT));
  }

  @Override
  protected String prepareFrom(String from, SqlParseContext context) {
    Matcher matcher = FINAL_MODIFIER.matcher(from);
    if (matcher.find()) {
      context.hint("final", "true");
      return matcher.replaceAll("");
    }
    return from;
  }

  @Override
  protected boolean handleExpression(
      String expression, String alias, int ordinal, SqlParseContext context) {
    Matcher sample = GROUP_ARRAY_SAMPLE.matcher(expression.trim());
    if (sample.matches()) {
      String column = StringParser.unquote(sample.group(2));
      context.aggregation(
          new Aggregation(
              new AggFunction.Sample(Integer.parseInt(sample.group(1))),
              column,
              List.of(),
              alias,
              false));
      context.setLastColumn(column);
      return true;
    }
    Matcher quantile = PARAMETRIC_QUANTILE.matcher(expression.trim());
    if (!quantile.matches()) {
      return false;
    }
    double level = normalizeQuantile(Double.parseDouble(quantile.group(2)));
    String column = StringParser.unquote(quantile.group(3));
    context.aggregation(
        new Aggregation(new AggFunction.Percentile(level), column, List.of(), alias, false));
    context.setLastColumn(column);
    return true;
  }

  @Override
  protected boolean handleFunction(
      FunctionCall call, String alias, int ordinal, SqlParseContext context) {
    String name = call.lowerName();
    if (name.equals("arrayjoin")) {
      context.hint("array_join", call.argumentText());
      return true;
    }
    Optional<Long> width = bucketWidth(call);
    if (width.isEmpty()) {
      return false;
    }
    String column = StringParser.unquote(call.argument(0).orElse(""));
    timeBucket(width.get(), column, alias, ordinal, context);
    return true;
  }

  @Override
  protected boolean handleGroupBy(String item, SqlParseContext context) {
    Optional<FunctionCall> call = FunctionCall.parse(item);
    if (call.isEmpty()) {
      return false;
    }
    Optional<Long> width = bucketWidth(call.get());
    if (width.isEmpty()) {
      return false;
    }
    timeBucket(
        width.get(), StringParser.unquote(call.get().argument(0).orElse("")), null, -1, context);
    return true;
  }

  private Optional<Long> bucketWidth(FunctionCall call) {
    String name = call.lowerName();
    Long fixed = START_OF_FUNCTIONS.get(name);
    if (fixed != null) {
      return Optional.of(fixed);
    }
    if (!name.equals("tostartofinterval")) {
      return Optional.empty();
    }
    String interval =
        call.argument(1)
            .orElseThrow(() -> new QueryParseException("toStartOfInterval requires an interval"));
    return Optional.of(
        parseOffset(interval)
            .orElseThrow(
                () ->
                    new QueryParseException(
                        "Unsupported interval in toStartOfInterval: " + interval)));
  }

  /** Also resolves {@code toIntervalMinute(5)}. */
  @Override
  protected Optional<Long> parseOffset(String offset) {
    Matcher function = TO_INTERVAL.matcher(offset.trim());
    if (function.matches()) {
      return Optional.of(
          Long.parseLong(function.group(2)) * DurationUtils.sqlUnitMillis(function.group(1)));
    }
    return super.parseOffset(offset);
  }

  @Override
  protected void parseDialectClauses(SqlStatement statement, SqlParseContext context) {
    statement.clause("PREWHERE").ifPresent(prewhere -> context.hint("prewhere", prewhere));
    statement.clause("SAMPLE").ifPresent(sample -> context.hint("sample", sample));
    if (statement.has("WITH TOTALS")) {
      context.hint("with_totals", "true");
    }
    statement.clause("SETTINGS").ifPresent(settings -> context.hint("settings", settings));
    statement.clause("FORMAT").ifPresent(format -> context.hint("format", format));
    log.debug("ClickHouse dialect clauses: {}", statement.clauses().keySet());
  }
}
