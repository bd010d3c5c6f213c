package com.evoila.rosetta.clickhouse;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataType;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.sql.AbstractSqlTranslator;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Renders plans as ClickHouse SQL over a {@code timestamp} column.
 *
 * <p>Interval windows become {@code toStartOfInterval} buckets and durations render as {@code
 * toIntervalX(n)}. Percentiles use the parametric {@code quantile(q)(x)} form, samples use {@code
 * groupArraySample(n)(x)} and regular expressions use {@code match}. Fill strategies, session,
 * state, event and count windows are omitted, and top-k and bottom-k are approximated by ordering
 * and limiting.
 */
@Component
public class ClickHouseTranslator extends AbstractSqlTranslator {

  private static final long[] INTERVAL_STEPS = {
    DurationUtils.DAY, DurationUtils.HOUR, DurationUtils.MINUTE, DurationUtils.SECOND
  };
  private static final String[] INTERVAL_UNITS = {"Day", "Hour", "Minute", "Second"};

  private static final DateTimeFormatter SECONDS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter MILLISECONDS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

  @Override
  public Dialect targetDialect() {
    return Dialect.CLICKHOUSE;
  }

  @Override
  protected String timeColumn() {
    return "timestamp";
  }

  @Override
  protected char identifierQuote() {
    return '`';
  }

  @Override
  protected String formatDuration(long millis) {
    if (millis != 0) {
      for (int i = 0; i < INTERVAL_STEPS.length; i++) {
        if (millis % INTERVAL_STEPS[i] == 0) {
          return "toInterval" + INTERVAL_UNITS[i] + "(" + millis / INTERVAL_STEPS[i] + ")";
        }
      }
    }
    return "toIntervalMillisecond(" + millis + ")";
  }

  @Override
  protected String relativeStart(long durationMs) {
    return "now() - " + formatDuration(durationMs);
  }

  @Override
  protected String timestampLiteral(long epochMs) {
    Instant instant = Instant.ofEpochMilli(epochMs);
    return quote(epochMs % 1000 == 0 ? SECONDS.format(instant) : MILLISECONDS.format(instant));
  }

  @Override
  protected String functionName(AggFunction.Basic function) {
    return switch (function) {
      case STDDEV, STDDEV_SAMP -> "stddevSamp";
      case STDDEV_POP -> "stddevPop";
      case VARIANCE, VAR_SAMP -> "varSamp";
      case VAR_POP -> "varPop";
      case FIRST, FIRST_ROW -> "any";
      case LAST, LAST_ROW -> "anyLast";
      case HYPER_LOG_LOG -> "uniqHLL12";
      default -> super.functionName(function);
    };
  }

  @Override
  protected String aggregationCall(Aggregation aggregation, String argument) {
    if (aggregation.function() == AggFunction.Basic.COUNT_DISTINCT) {
      return "uniqExact(" + argument + ")";
    }
    if (aggregation.function() instanceof AggFunction.Sample sample) {
      return "groupArraySample(" + sample.n() + ")(" + argument + ")";
    }
    return super.aggregationCall(aggregation, argument);
  }

  @Override
  protected String percentile(double quantile, String argument) {
    return "quantile(" + number(quantile) + ")(" + argument + ")";
  }

  @Override
  protected String approximatePercentile(double quantile, String argument) {
    return "quantileTDigest(" + number(quantile) + ")(" + argument + ")";
  }

  @Override
  protected String regexCondition(String column, String pattern, boolean negated) {
    return (negated ? "NOT match(" : "match(") + column + ", " + quote(pattern) + ")";
  }

  @Override
  protected String sqlType(DataType type) {
    return switch (type) {
      case BOOL -> "Bool";
      case INT8 -> "Int8";
      case INT16 -> "Int16";
      case INT32 -> "Int32";
      case INT64 -> "Int64";
      case UINT8 -> "UInt8";
      case UINT16 -> "UInt16";
      case UINT32 -> "UInt32";
      case UINT64 -> "UInt64";
      case FLOAT32 -> "Float32";
      case FLOAT64 -> "Float64";
      case STRING, BINARY -> "String";
      case TIMESTAMP -> "DateTime64(3)";
      case DURATION -> "Int64";
      case JSON -> "JSON";
    };
  }

  @Override
  protected Optional<String> bucketExpression(Window window, long intervalMs, String column) {
    return Optional.of(
        "toStartOfInterval(" + identifier(column) + ", " + formatDuration(intervalMs) + ")");
  }
}
