package com.evoila.rosetta.druid;

import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.sql.AbstractSqlParser;
import com.evoila.rosetta.common.sql.SqlParseContext;
import com.evoila.rosetta.common.utils.DurationUtils;
import com.evoila.rosetta.common.utils.FunctionCall;
import com.evoila.rosetta.common.utils.StringParser;
import com.evoila.rosetta.common.utils.StringParser.KeywordMatch;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Druid SQL parser.
 *
 * <p>Time buckets come from {@code TIME_FLOOR(__time, 'PT1H')}, {@code FLOOR(__time TO HOUR)} or
 * {@code DATE_TRUNC('hour', __time)}. Approximate aggregates map to HyperLogLog and approximate
 * percentiles; {@code TIME_IN_INTERVAL(__time, 'start/end')} becomes an absolute time range.
 */
@Slf4j
@Component
public class DruidSqlParser extends AbstractSqlParser {

  private static final Map<String, AggFunction> AGGREGATES = buildAggregates();

  public DruidSqlParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public DruidSqlParser(ParserLimits limits) {
    super(limits);
  }

  private static Map<String, AggFunction> buildAggregates() {
    Map<String, AggFunction> aggregates = new HashMap<>(STANDARD_AGGREGATES);
    aggregates.put("approx_count_distinct", AggFunction.Basic.HYPER_LOG_LOG);
    aggregates.put("approx_count_distinct_ds_hll", AggFunction.Basic.HYPER_LOG_LOG);
    aggregates.put("approx_count_distinct_ds_theta", AggFunction.Basic.HYPER_LOG_LOG);
    aggregates.put("earliest", AggFunction.Basic.FIRST);
    aggregates.put("latest", AggFunction.Basic.LAST);
    return Map.copyOf(aggregates);
  }

  @Override
  public Dialect dialect() {
    return Dialect.DRUID_SQL;
  }

  @Override
  protected Map<String, AggFunction> aggregateFunctions() {
    return AGGREGATES;
  }

  @Override
  protected boolean handleFunction(
      FunctionCall call, String alias, int ordinal, SqlParseContext context) {
    String name = call.lowerName();
    if (name.equals("approx_quantile") || name.equals("approx_quantile_ds")) {
      double level =
          numericArgument(call, 1)
              .map(AbstractSqlParser::normalizeQuantile)
              .orElseThrow(() -> new QueryParseException(call.name() + " requires a quantile"));
      String column = StringParser.unquote(call.argument(0).orElse(""));
      context.aggregation(
          new Aggregation(new AggFunction.Apercentile(level), column, List.of(), alias, false));
      context.setLastColumn(column);
      return true;
    }
    Optional<Bucket> bucket = bucket(call);
    if (bucket.isEmpty()) {
      return false;
    }
    timeBucket(bucket.get().widthMs(), bucket.get().column(), alias, ordinal, context);
    return true;
  }

  @Override
  protected boolean handleGroupBy(String item, SqlParseContext context) {
    Optional<Bucket> bucket = FunctionCall.parse(item).flatMap(DruidSqlParser::bucket);
    if (bucket.isEmpty()) {
      return false;
    }
    timeBucket(bucket.get().widthMs(), bucket.get().column(), null, -1, context);
    return true;
  }

  private record Bucket(long widthMs, String column) {}

  private static Optional<Bucket> bucket(FunctionCall call) {
    switch (call.lowerName()) {
      case "time_floor" -> {
        String period =
            call.argument(1)
                .orElseThrow(() -> new QueryParseException("TIME_FLOOR requires a period"));
        return Optional.of(
            new Bucket(
                DurationUtils.parseIsoPeriod(StringParser.unquote(period)),
                StringParser.unquote(call.argument(0).orElse(""))));
      }
      case "floor" -> {
        List<KeywordMatch> to =
            StringParser.findTopLevelKeywords(call.argumentText(), List.of("TO"));
        if (to.isEmpty()) {
          return Optional.empty();
        }
        String column = call.argumentText().substring(0, to.get(0).start()).trim();
        String unit = call.argumentText().substring(to.get(0).end()).trim();
        return Optional.of(
            new Bucket(DurationUtils.sqlUnitMillis(unit), StringParser.unquote(column)));
      }
      case "date_trunc" -> {
        String unit = StringParser.unquote(call.argument(0).orElse(""));
        String column = StringParser.unquote(call.argument(1).orElse("__time"));
        return Optional.of(new Bucket(DurationUtils.sqlUnitMillis(unit), column));
      }
      default -> {
        return Optional.empty();
      }
    }
  }

  @Override
  protected boolean parseTimeCondition(String condition, SqlParseContext context) {
    Optional<FunctionCall> call = FunctionCall.parse(condition);
    if (call.isPresent() && call.get().lowerName().equals("time_in_interval")) {
      String interval = StringParser.unquote(call.get().argument(1).orElse(""));
      Optional<TimeRange> range = isoInterval(interval);
      if (range.isPresent()) {
        context.timeRange(range.get());
      } else {
        context.hint("time_in_interval", interval);
      }
      return true;
    }
    return super.parseTimeCondition(condition, context);
  }

  /**
   * Parses {@code 2024-01-01T00:00:00Z/2024-01-02T00:00:00Z}. Bounds without a zone are UTC and a
   * bare date means its start of day.
   */
  static Optional<TimeRange> isoInterval(String interval) {
    String[] bounds = interval.split("/");
    if (bounds.length != 2) {
      return Optional.empty();
    }
    try {
      return Optional.of(new TimeRange.Absolute(instant(bounds[0]), instant(bounds[1])));
    } catch (DateTimeParseException e) {
      log.debug("Not an ISO-8601 interval: '{}'", interval);
      return Optional.empty();
    }
  }

  private static long instant(String bound) {
    String text = bound.trim();
    if (text.length() == 10) {
      return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
    if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
      return OffsetDateTime.parse(text).toInstant().toEpochMilli();
    }
    return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC).toEpochMilli();
  }
}
