package com.evoila.rosetta.timescale;

import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.sql.AbstractSqlParser;
import com.evoila.rosetta.common.sql.SqlParseContext;
import com.evoila.rosetta.common.utils.DurationUtils;
import com.evoila.rosetta.common.utils.FunctionCall;
import com.evoila.rosetta.common.utils.StringParser;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * TimescaleDB parser: PostgreSQL SELECT plus the time bucketing functions.
 *
 * <p>{@code time_bucket('5 minutes', time)} and {@code time_bucket_gapfill(...)} become an interval
 * window grouped by the bucket. Gap filling defaults to null-filled buckets; wrapping a column in
 * {@code locf()} or {@code interpolate()} selects previous-value or linear filling.
 */
@Slf4j
@Component
public class TimescaleDbParser extends AbstractSqlParser {

  private static final String TIME_BUCKET = "time_bucket";
  private static final String TIME_BUCKET_GAPFILL = "time_bucket_gapfill";

  public TimescaleDbParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public TimescaleDbParser(ParserLimits limits) {
    super(limits);
  }

  @Override
  public Dialect dialect() {
    return Dialect.TIMESCALEDB;
  }

  @Override
  protected boolean handleFunction(
      FunctionCall call, String alias, int ordinal, SqlParseContext context) {
    switch (call.lowerName()) {
      case TIME_BUCKET, TIME_BUCKET_GAPFILL -> {
        bucket(call, alias, ordinal, context);
        return true;
      }
      case "locf" -> {
        context.setFill(FillStrategy.Basic.PREVIOUS);
        projectExpression(call.argument(0).orElse(""), alias, ordinal, context);
        return true;
      }
      case "interpolate" -> {
        context.setFill(FillStrategy.Basic.LINEAR);
        projectExpression(call.argument(0).orElse(""), alias, ordinal, context);
        return true;
      }
      case "first", "last" -> {
        // first(value, time) orders by its second argument
        if (call.arguments().size() != 2) {
          return false;
        }
        String column = StringParser.unquote(call.argument(0).orElse(""));
        AggFunction function =
            call.lowerName().equals("first") ? AggFunction.Basic.FIRST : AggFunction.Basic.LAST;
        context.aggregation(new Aggregation(function, column, List.of(), alias, false));
        context.setLastColumn(column);
        return true;
      }
      default -> {
        return false;
      }
    }
  }

  @Override
  protected boolean handleGroupBy(String item, SqlParseContext context) {
    Optional<FunctionCall> call = FunctionCall.parse(item);
    if (call.isEmpty() || !call.get().lowerName().startsWith(TIME_BUCKET)) {
      return false;
    }
    bucket(call.get(), null, -1, context);
    return true;
  }

  private void bucket(FunctionCall call, String alias, int ordinal, SqlParseContext context) {
    if (call.arguments().size() < 2) {
      throw new QueryParseException(call.name() + " requires an interval and a time column");
    }
    long intervalMs = bucketWidth(call.arguments().get(0));
    String column = StringParser.unquote(call.arguments().get(1));
    timeBucket(intervalMs, column, alias, ordinal, context);
    if (call.lowerName().equals(TIME_BUCKET_GAPFILL)) {
      context.hint("gapfill", "true");
      if (context.getFill() == null) {
        context.setFill(FillStrategy.Basic.NULL);
      }
    }
    log.debug("TimescaleDB bucket of {}ms over '{}'", intervalMs, column);
  }

  /** Accepts {@code '5 minutes'}, {@code INTERVAL '5 minutes'} or {@code '5 minutes'::interval}. */
  private static long bucketWidth(String argument) {
    String text = argument.trim();
    if (text.toLowerCase(Locale.ROOT).startsWith("interval")) {
      text = text.substring("interval".length()).trim();
    }
    int cast = text.indexOf("::");
    if (cast > 0) {
      text = text.substring(0, cast);
    }
    return DurationUtils.parseSqlInterval(StringParser.unquote(text));
  }
}
