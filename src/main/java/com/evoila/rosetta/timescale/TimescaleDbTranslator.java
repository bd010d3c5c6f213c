package com.evoila.rosetta.timescale;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.sql.AbstractSqlTranslator;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Renders plans as TimescaleDB SQL.
 *
 * <p>Interval windows become {@code time_bucket} groups; a window with a fill strategy switches to
 * {@code time_bucket_gapfill} and wraps aggregates in {@code locf()} for previous-value filling or
 * {@code interpolate()} for linear filling. Constant and next-value fills are rendered as plain
 * gap filling. {@code first} and {@code last} take the time column as ordering argument.
 * Approximate percentiles render as exact ones.
 */
@Component
public class TimescaleDbTranslator extends AbstractSqlTranslator {

  @Override
  public Dialect targetDialect() {
    return Dialect.TIMESCALEDB;
  }

  @Override
  protected String timeColumn() {
    return "time";
  }

  @Override
  protected String formatDuration(long millis) {
    return "INTERVAL '" + DurationUtils.formatSqlInterval(millis) + "'";
  }

  @Override
  protected Optional<String> bucketExpression(Window window, long intervalMs, String column) {
    String function = gapFilled(window) ? "time_bucket_gapfill" : "time_bucket";
    return Optional.of(
        function
            + "('"
            + DurationUtils.formatSqlInterval(intervalMs)
            + "', "
            + identifier(column)
            + ")");
  }

  @Override
  protected String fillValue(String expression, QueryPlan plan) {
    FillStrategy fill = bucket(plan).map(bucket -> bucket.window().fill()).orElse(null);
    if (fill == FillStrategy.Basic.PREVIOUS) {
      return "locf(" + expression + ")";
    }
    if (fill == FillStrategy.Basic.LINEAR) {
      return "interpolate(" + expression + ")";
    }
    return expression;
  }

  @Override
  protected String approximatePercentile(double quantile, String argument) {
    return percentile(quantile, argument);
  }

  @Override
  protected String aggregationCall(Aggregation aggregation, String argument) {
    AggFunction function = aggregation.function();
    if (function == AggFunction.Basic.FIRST || function == AggFunction.Basic.FIRST_ROW) {
      return "first(" + argument + ", " + identifier(timeColumn()) + ")";
    }
    if (function == AggFunction.Basic.LAST || function == AggFunction.Basic.LAST_ROW) {
      return "last(" + argument + ", " + identifier(timeColumn()) + ")";
    }
    return super.aggregationCall(aggregation, argument);
  }

  private static boolean gapFilled(Window window) {
    return window.fill() != null && window.fill() != FillStrategy.Basic.NONE;
  }
}
