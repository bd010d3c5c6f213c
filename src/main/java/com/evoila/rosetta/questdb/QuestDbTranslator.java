package com.evoila.rosetta.questdb;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataType;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.GroupByExpr;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.sql.AbstractSqlTranslator;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Renders plans as QuestDB SQL over the designated {@code timestamp} column.
 *
 * <p>Interval windows become {@code SAMPLE BY} with {@code FILL} and {@code ALIGN TO}; sampled
 * queries key on their non-aggregated columns, so grouping columns are not repeated in GROUP BY.
 * Relative ranges use {@code dateadd}. Offsets render as {@code LIMIT lo, hi} and are dropped
 * without a limit. HAVING and next-value fills are omitted, as are all window kinds other than
 * intervals. Exact percentiles render approximate.
 */
@Slf4j
@Component
public class QuestDbTranslator extends AbstractSqlTranslator {

  private static final Pattern COMPACT = Pattern.compile("^(\\d+)([a-zA-Z])$");

  @Override
  public Dialect targetDialect() {
    return Dialect.QUESTDB;
  }

  @Override
  protected String timeColumn() {
    return "timestamp";
  }

  @Override
  protected String formatDuration(long millis) {
    return DurationUtils.format(millis, "T");
  }

  @Override
  protected String relativeStart(long durationMs) {
    Matcher compact = COMPACT.matcher(formatDuration(durationMs));
    if (!compact.matches()) {
      throw new IllegalStateException("Unexpected duration literal for " + durationMs + "ms");
    }
    return "dateadd('" + compact.group(2) + "', -" + compact.group(1) + ", now())";
  }

  @Override
  protected String functionName(AggFunction.Basic function) {
    return function == AggFunction.Basic.STDDEV ? "stddev_samp" : super.functionName(function);
  }

  @Override
  protected String aggregationCall(Aggregation aggregation, String argument) {
    AggFunction function = aggregation.function();
    if (function == AggFunction.Basic.COUNT_DISTINCT
        || function == AggFunction.Basic.HYPER_LOG_LOG) {
      return "count_distinct(" + argument + ")";
    }
    return super.aggregationCall(aggregation, argument);
  }

  @Override
  protected String percentile(double quantile, String argument) {
    return approximatePercentile(quantile, argument);
  }

  @Override
  protected String sqlType(DataType type) {
    return switch (type) {
      case INT8 -> "BYTE";
      case INT16 -> "SHORT";
      case INT32 -> "INT";
      case INT64, UINT8, UINT16, UINT32, UINT64 -> "LONG";
      case FLOAT32 -> "FLOAT";
      case FLOAT64 -> "DOUBLE";
      case STRING -> "STRING";
      case BINARY -> "BINARY";
      default -> super.sqlType(type);
    };
  }

  @Override
  protected boolean supportsHaving() {
    return false;
  }

  @Override
  protected Optional<String> groupItem(GroupByExpr expr, QueryPlan plan) {
    return bucket(plan).isEmpty() ? super.groupItem(expr, plan) : Optional.empty();
  }

  @Override
  protected void appendWindowClauses(StringBuilder sql, QueryPlan plan) {
    Optional<Bucket> bucket = bucket(plan);
    if (bucket.isEmpty()) {
      return;
    }
    Window window = bucket.get().window();
    sql.append(" SAMPLE BY ").append(formatDuration(bucket.get().intervalMs()));
    fill(window.fill()).ifPresent(fill -> sql.append(" FILL(").append(fill).append(')'));
    if (window.kind() instanceof WindowKind.SampleBy sample && sample.align() != null) {
      sql.append(" ALIGN TO ").append(sample.align());
    }
  }

  @Override
  protected void appendBounds(StringBuilder sql, Long limit, Long offset) {
    if (limit == null) {
      if (offset != null) {
        log.debug("Dropping OFFSET {} without LIMIT for QuestDB", offset);
      }
      return;
    }
    if (offset == null || offset == 0) {
      sql.append(" LIMIT ").append(limit);
    } else {
      sql.append(" LIMIT ").append(offset).append(", ").append(offset + limit);
    }
  }

  private Optional<String> fill(FillStrategy fill) {
    if (fill == null || fill == FillStrategy.Basic.NEXT) {
      return Optional.empty();
    }
    if (fill instanceof FillStrategy.Constant constant) {
      return Optional.of(literal(constant.value()));
    }
    return Optional.of(
        switch ((FillStrategy.Basic) fill) {
          case NONE -> "NONE";
          case NULL -> "NULL";
          case PREVIOUS -> "PREV";
          case LINEAR -> "LINEAR";
          case NEXT -> throw new IllegalStateException("Next-value fill has no QuestDB form");
        });
  }
}
