package com.evoila.rosetta.influxql;

import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.QueryHints;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.SourceKind;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.sql.AbstractSqlParser;
import com.evoila.rosetta.common.sql.SqlParseContext;
import com.evoila.rosetta.common.sql.SqlStatement;
import com.evoila.rosetta.common.utils.DurationUtils;
import com.evoila.rosetta.common.utils.FunctionCall;
import com.evoila.rosetta.common.utils.StringParser;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * InfluxQL (InfluxDB 1.x) parser.
 *
 * <p>Sources are measurements, optionally qualified as {@code "db"."rp"."measurement"}. {@code
 * GROUP BY time(d[, offset])} becomes an interval window; the remaining GROUP BY items are tags.
 * {@code FILL}, {@code SLIMIT}, {@code SOFFSET}, {@code TZ} and {@code INTO} are supported, the
 * last three as hints. Besides SELECT, the SHOW, CREATE, DROP, DELETE and ALTER statements are
 * accepted; SHOW statements read from a system source such as {@code _measurements}.
 */
@Slf4j
@Component
public class InfluxQlParser extends AbstractSqlParser {

  private static final List<String> CLAUSES =
      List.of(
          "SELECT",
          "INTO",
          "FROM",
          "WHERE",
          "GROUP BY",
          "FILL",
          "ORDER BY",
          "LIMIT",
          "OFFSET",
          "SLIMIT",
          "SOFFSET",
          "TZ");

  private static final Set<String> STATEMENTS = Set.of("SHOW", "CREATE", "DROP", "DELETE", "ALTER");

  /** SHOW targets and the system source each one reads from; longest first. */
  private static final Map<String, String> SHOW_SOURCES = buildShowSources();

  private static final Map<String, AggFunction> AGGREGATES = buildAggregates();

  private static final Pattern ON_DATABASE =
      Pattern.compile("\\bON\\s+(\"[^\"]+\"|\\w+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern SHOW_FROM =
      Pattern.compile("\\bFROM\\s+(\\S+)", Pattern.CASE_INSENSITIVE);

  public InfluxQlParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public InfluxQlParser(ParserLimits limits) {
    super(limits);
  }

  private static Map<String, String> buildShowSources() {
    Map<String, String> sources = new LinkedHashMap<>();
    sources.put("RETENTION POLICIES", "_retention_policies");
    sources.put("MEASUREMENTS", "_measurements");
    sources.put("TAG KEYS", "_tag_keys");
    sources.put("TAG VALUES", "_tag_values");
    sources.put("FIELD KEYS", "_field_keys");
    sources.put("DATABASES", "_databases");
    sources.put("SERIES", "_series");
    return sources;
  }

  private static Map<String, AggFunction> buildAggregates() {
    Map<String, AggFunction> aggregates = new HashMap<>(STANDARD_AGGREGATES);
    aggregates.put("mean", AggFunction.Basic.AVG);
    aggregates.put("integral", AggFunction.Basic.INTEGRAL);
    aggregates.put("derivative", AggFunction.Basic.DERIV);
    aggregates.put("non_negative_derivative", AggFunction.Basic.RATE);
    aggregates.put("distinct", new AggFunction.Custom("distinct"));
    return Map.copyOf(aggregates);
  }

  @Override
  public Dialect dialect() {
    return Dialect.INFLUXQL;
  }

  @Override
  protected List<String> clauseKeywords() {
    return CLAUSES;
  }

  @Override
  protected Set<String> statementKeywords() {
    return STATEMENTS;
  }

  @Override
  protected Map<String, AggFunction> aggregateFunctions() {
    return AGGREGATES;
  }

  @Override
  protected SourceKind defaultSourceKind() {
    return SourceKind.Basic.MEASUREMENT;
  }

  @Override
  protected boolean regexLiterals() {
    return true;
  }

  @Override
  protected boolean isTimeColumn(String column) {
    return column.equalsIgnoreCase("time");
  }

  @Override
  protected QueryPlan parseNonSelect(String text, String leading) {
    if (!leading.equals("SHOW")) {
      return super.parseNonSelect(text, leading);
    }
    String target = text.substring("SHOW".length()).trim();
    log.debug("InfluxQL SHOW statement: '{}'", target);
    QueryPlan.QueryPlanBuilder plan = QueryPlan.builder();
    QueryHints.QueryHintsBuilder hints = QueryHints.builder().customHint("statement", "SHOW");
    SHOW_SOURCES.entrySet().stream()
        .filter(entry -> StringParser.matchWords(target, 0, entry.getKey().split(" ")) > 0)
        .findFirst()
        .ifPresentOrElse(
            entry -> plan.source(DataSource.of(entry.getValue(), SourceKind.Basic.MEASUREMENT)),
            () -> hints.customHint("show", target));
    Matcher database = ON_DATABASE.matcher(target);
    if (database.find()) {
      plan.database(StringParser.unquote(database.group(1)));
    }
    Matcher from = SHOW_FROM.matcher(target);
    if (from.find()) {
      hints.customHint("measurement", StringParser.unquote(from.group(1)));
    }
    return plan.hints(hints.build()).build();
  }

  /** Regex sources ({@code FROM /cpu.*\/}) keep the pattern as measurement name. */
  @Override
  protected DataSource tableReference(String path) {
    String text = path.trim();
    if (text.startsWith("/") && text.endsWith("/") && text.length() > 1) {
      return DataSource.measurement(text);
    }
    return super.tableReference(text);
  }

  @Override
  protected boolean handleFunction(
      FunctionCall call, String alias, int ordinal, SqlParseContext context) {
    if (!call.lowerName().equals("count")) {
      return false;
    }
    Optional<FunctionCall> inner = call.argument(0).flatMap(FunctionCall::parse);
    if (inner.isEmpty() || !inner.get().lowerName().equals("distinct")) {
      return false;
    }
    String column = StringParser.unquote(inner.get().argument(0).orElse(""));
    context.aggregation(
        new Aggregation(AggFunction.Basic.COUNT_DISTINCT, column, List.of(), alias, true));
    context.setLastColumn(column);
    return true;
  }

  @Override
  protected boolean handleGroupBy(String item, SqlParseContext context) {
    Optional<FunctionCall> call = FunctionCall.parse(item);
    if (call.isPresent() && call.get().lowerName().equals("time")) {
      List<String> arguments = call.get().arguments();
      if (arguments.isEmpty()) {
        throw new QueryParseException("GROUP BY time() requires an interval");
      }
      long intervalMs = DurationUtils.parse(arguments.get(0));
      Long offsetMs = arguments.size() > 1 ? DurationUtils.parse(arguments.get(1)) : null;
      context.window(Window.of(new WindowKind.Interval(intervalMs, offsetMs, null)));
      return true;
    }
    if (item.equals("*")) {
      context.group(GroupBy.allTags());
      return true;
    }
    if (isPlainColumn(item)) {
      context.group(GroupBy.tag(StringParser.unquote(item)));
      return true;
    }
    return false;
  }

  @Override
  protected void parseDialectClauses(SqlStatement statement, SqlParseContext context) {
    statement
        .clause("FILL")
        .ifPresent(fill -> context.setFill(fillStrategy(parenthesizedArguments(fill, "FILL"))));
    statement.clause("INTO").ifPresent(into -> context.hint("into", into));
    statement.clause("SLIMIT").ifPresent(slimit -> context.hint("slimit", slimit));
    statement.clause("SOFFSET").ifPresent(soffset -> context.hint("soffset", soffset));
    statement
        .clause("TZ")
        .ifPresent(
            tz ->
                context.hint(
                    "tz", StringParser.unquote(parenthesizedArguments(tz, "TZ").get(0))));
  }
}
