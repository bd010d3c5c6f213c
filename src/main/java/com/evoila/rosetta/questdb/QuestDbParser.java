package com.evoila.rosetta.questdb;

import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.sql.AbstractSqlParser;
import com.evoila.rosetta.common.sql.SqlParseContext;
import com.evoila.rosetta.common.sql.SqlStatement;
import com.evoila.rosetta.common.utils.DurationUtils;
import com.evoila.rosetta.common.utils.StringParser;
import com.evoila.rosetta.common.utils.StringParser.KeywordMatch;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * QuestDB parser.
 *
 * <p>Handles {@code SAMPLE BY} with {@code FILL} and {@code ALIGN TO}, {@code LATEST ON ts
 * PARTITION BY col} (last row per partition), ASOF/LT/SPLICE joins and {@code dateadd} relative
 * time bounds. QuestDB durations use {@code T} for milliseconds and {@code M} for months.
 */
@Component
public class QuestDbParser extends AbstractSqlParser {

  public static final Map<String, Long> UNITS =
      Map.of(
          "T", 1L,
          "s", DurationUtils.SECOND,
          "m", DurationUtils.MINUTE,
          "h", DurationUtils.HOUR,
          "d", DurationUtils.DAY,
          "w", DurationUtils.WEEK,
          "M", DurationUtils.MONTH,
          "y", DurationUtils.YEAR);

  private static final List<String> CLAUSES =
      List.of(
          "SELECT",
          "FROM",
          "WHERE",
          "LATEST ON",
          "LATEST BY",
          "SAMPLE BY",
          "FILL",
          "ALIGN TO",
          "GROUP BY",
          "ORDER BY",
          "LIMIT");

  private static final Pattern DATEADD_NOW =
      Pattern.compile(
          "^dateadd\\s*\\(\\s*'(\\w)'\\s*,\\s*-(\\d+)\\s*,\\s*now\\s*\\(\\s*\\)\\s*\\)$",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern IN_INTERVAL =
      Pattern.compile("^([\"`]?[\\w.]+[\"`]?)\\s+IN\\s+('.*')$", Pattern.CASE_INSENSITIVE);

  public QuestDbParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public QuestDbParser(ParserLimits limits) {
    super(limits);
  }

  @Override
  public Dialect dialect() {
    return Dialect.QUESTDB;
  }

  @Override
  protected List<String> clauseKeywords() {
    return CLAUSES;
  }

  @Override
  protected Map<String, Long> durationUnits() {
    return UNITS;
  }

  @Override
  protected Optional<Long> parseRelativeStart(String expression) {
    Matcher matcher = DATEADD_NOW.matcher(expression.trim());
    if (matcher.matches()) {
      Long unit = UNITS.get(matcher.group(1));
      if (unit != null && unit > 0) {
        return Optional.of(Long.parseLong(matcher.group(2)) * unit);
      }
    }
    return super.parseRelativeStart(expression);
  }

  @Override
  protected boolean parseTimeCondition(String condition, SqlParseContext context) {
    Matcher interval = IN_INTERVAL.matcher(condition.trim());
    if (interval.matches() && isTimeColumn(StringParser.unquote(interval.group(1)))) {
      context.hint("time_interval", StringParser.unquote(interval.group(2)));
      return true;
    }
    return super.parseTimeCondition(condition, context);
  }

  /** QuestDB LIMIT accepts negative counts (rows from the end) and {@code lo, hi} ranges. */
  @Override
  protected void parseLimit(String limit, SqlParseContext context) {
    String text = limit.trim();
    if (text.startsWith("-")) {
      context.hint("limit", text);
      return;
    }
    List<String> range = StringParser.splitTopLevel(text, ',');
    if (range.size() == 2) {
      long low = parseCount(range.get(0), "LIMIT");
      long high = parseCount(range.get(1), "LIMIT");
      context.offset(low);
      context.limit(Math.max(0, high - low));
      return;
    }
    context.limit(parseCount(text, "LIMIT"));
  }

  @Override
  protected void parseDialectClauses(SqlStatement statement, SqlParseContext context) {
    statement.clause("SAMPLE BY").ifPresent(sample -> parseSampleBy(sample, statement, context));
    statement
        .clause("FILL")
        .ifPresent(fill -> context.setFill(fillStrategy(parenthesizedArguments(fill, "FILL"))));
    statement.clause("LATEST ON").ifPresent(latest -> parseLatestOn(latest, context));
    statement
        .clause("LATEST BY")
        .ifPresent(
            latest -> {
              context.aggregation(Aggregation.of(AggFunction.Basic.LAST_ROW));
              StringParser.splitTopLevel(latest, ',')
                  .forEach(column -> context.group(GroupBy.column(StringParser.unquote(column))));
            });
  }

  private void parseSampleBy(String sample, SqlStatement statement, SqlParseContext context) {
    long intervalMs = DurationUtils.parse(sample.trim(), UNITS);
    String align = statement.clause("ALIGN TO").orElse(null);
    context.window(Window.of(new WindowKind.SampleBy(intervalMs, align)));
  }

  private void parseLatestOn(String latest, SqlParseContext context) {
    List<KeywordMatch> partition =
        StringParser.findTopLevelKeywords(latest, List.of("PARTITION BY"));
    if (partition.isEmpty()) {
      throw new QueryParseException("LATEST ON requires PARTITION BY");
    }
    String timestamp = StringParser.unquote(latest.substring(0, partition.get(0).start()).trim());
    context.aggregation(Aggregation.of(AggFunction.Basic.LAST_ROW, timestamp));
    String partitionColumns = latest.substring(partition.get(0).end());
    for (String column : StringParser.splitTopLevel(partitionColumns, ',')) {
      context.group(GroupBy.column(StringParser.unquote(column)));
    }
  }
}
