package com.evoila.rosetta.tdengine;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataType;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.GroupByExpr;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.sql.AbstractSqlTranslator;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Renders plans as TDengine SQL over the {@code ts} column.
 *
 * <p>Tag groupings become {@code PARTITION BY}; windows render as {@code INTERVAL ... SLIDING},
 * {@code SESSION}, {@code STATE_WINDOW}, {@code EVENT_WINDOW} or {@code COUNT_WINDOW} with an
 * optional {@code FILL}, and the select list starts with {@code _wstart}. Durations use the
 * {@code a} unit below one second. Top-k and bottom-k map to {@code top} and {@code bottom};
 * medians render as the 50th percentile. Row windows are omitted.
 */
@Component
public class TDengineTranslator extends AbstractSqlTranslator {

  @Override
  public Dialect targetDialect() {
    return Dialect.TDENGINE;
  }

  @Override
  protected String timeColumn() {
    return "ts";
  }

  @Override
  protected char identifierQuote() {
    return '`';
  }

  @Override
  protected String formatDuration(long millis) {
    return DurationUtils.format(millis, "a");
  }

  @Override
  protected String relativeStart(long durationMs) {
    return "NOW() - " + formatDuration(durationMs);
  }

  @Override
  protected String functionName(AggFunction.Basic function) {
    return switch (function) {
      case FIRST_ROW -> "first";
      case LAST_ROW -> "last_row";
      case HYPER_LOG_LOG -> "hyperloglog";
      default -> super.functionName(function);
    };
  }

  @Override
  protected String aggregationCall(Aggregation aggregation, String argument) {
    if (aggregation.function() == AggFunction.Basic.MEDIAN) {
      return percentile(0.5, argument);
    }
    return super.aggregationCall(aggregation, argument);
  }

  @Override
  protected String percentile(double quantile, String argument) {
    return "percentile(" + argument + ", " + percent(quantile) + ")";
  }

  @Override
  protected String approximatePercentile(double quantile, String argument) {
    return "apercentile(" + argument + ", " + percent(quantile) + ")";
  }

  @Override
  protected Optional<String> ranking(AggFunction function, String argument) {
    if (function instanceof AggFunction.TopK top) {
      return Optional.of("top(" + argument + ", " + top.k() + ")");
    }
    if (function instanceof AggFunction.BottomK bottom) {
      return Optional.of("bottom(" + argument + ", " + bottom.k() + ")");
    }
    return Optional.empty();
  }

  @Override
  protected String regexCondition(String column, String pattern, boolean negated) {
    return column + (negated ? " NMATCH " : " MATCH ") + quote(pattern);
  }

  @Override
  protected Optional<String> transform(TransformType type, String argument) {
    if (type == TransformType.Basic.CUMULATIVE_SUM) {
      return Optional.of("csum(" + argument + ")");
    } else if (type instanceof TransformType.Difference difference) {
      return Optional.of("diff(" + argument + (difference.nonNegative() ? ", 1" : "") + ")");
    } else if (type instanceof TransformType.MovingAverage average) {
      return Optional.of("mavg(" + argument + ", " + average.points() + ")");
    } else if (type instanceof TransformType.Derivative derivative) {
      long unitMs = derivative.unitMs() != null ? derivative.unitMs() : DurationUtils.SECOND;
      return Optional.of(
          "derivative("
              + argument
              + ", "
              + formatDuration(unitMs)
              + ", "
              + (derivative.nonNegative() ? 1 : 0)
              + ")");
    } else if (type instanceof TransformType.Elapsed elapsed && elapsed.unitMs() != null) {
      return Optional.of("elapsed(" + argument + ", " + formatDuration(elapsed.unitMs()) + ")");
    }
    return super.transform(type, argument);
  }

  @Override
  protected String sqlType(DataType type) {
    return switch (type) {
      case INT32 -> "INT";
      case UINT8 -> "TINYINT UNSIGNED";
      case UINT16 -> "SMALLINT UNSIGNED";
      case UINT32 -> "INT UNSIGNED";
      case UINT64 -> "BIGINT UNSIGNED";
      case FLOAT32 -> "FLOAT";
      case FLOAT64 -> "DOUBLE";
      case STRING -> "VARCHAR(256)";
      case BINARY -> "VARBINARY(256)";
      default -> super.sqlType(type);
    };
  }

  @Override
  protected List<String> leadingProjection(QueryPlan plan) {
    return windowed(plan) ? List.of("_wstart") : List.of();
  }

  @Override
  protected Optional<String> groupItem(GroupByExpr expr, QueryPlan plan) {
    return expr instanceof GroupByExpr.Tag ? Optional.empty() : super.groupItem(expr, plan);
  }

  @Override
  protected void appendWindowClauses(StringBuilder sql, QueryPlan plan) {
    List<String> partitions =
        plan.getGroupBy().stream()
            .map(GroupBy::expr)
            .filter(GroupByExpr.Tag.class::isInstance)
            .map(expr -> identifier(((GroupByExpr.Tag) expr).name()))
            .collect(Collectors.toList());
    if (!partitions.isEmpty()) {
      sql.append(" PARTITION BY ").append(String.join(", ", partitions));
    }

    Optional<Window> window = windowClause(plan);
    if (window.isEmpty()) {
      return;
    }
    WindowKind kind = window.get().kind();
    if (kind instanceof WindowKind.Interval interval) {
      sql.append(" INTERVAL(").append(formatDuration(interval.durationMs()));
      if (interval.offsetMs() != null) {
        sql.append(", ").append(formatDuration(interval.offsetMs()));
      }
      sql.append(')');
      if (interval.slidingMs() != null) {
        sql.append(" SLIDING(").append(formatDuration(interval.slidingMs())).append(')');
      }
    } else if (kind instanceof WindowKind.SampleBy sample) {
      sql.append(" INTERVAL(").append(formatDuration(sample.intervalMs())).append(')');
    } else if (kind instanceof WindowKind.Session session) {
      String column = session.column() != null ? session.column() : timeColumn();
      sql.append(" SESSION(")
          .append(identifier(column))
          .append(", ")
          .append(formatDuration(session.gapMs()))
          .append(')');
    } else if (kind instanceof WindowKind.State state) {
      sql.append(" STATE_WINDOW(").append(identifier(state.column())).append(')');
    } else if (kind instanceof WindowKind.Event event) {
      sql.append(" EVENT_WINDOW START WITH ")
          .append(condition(event.start()))
          .append(" END WITH ")
          .append(condition(event.end()));
    } else if (kind instanceof WindowKind.Count count) {
      sql.append(" COUNT_WINDOW(").append(count.count());
      if (count.sliding() != null) {
        sql.append(", ").append(count.sliding());
      }
      sql.append(')');
    }
    if (window.get().fill() != null) {
      sql.append(" FILL(").append(fill(window.get().fill())).append(')');
    }
  }

  /** First window with a TDengine clause, or the interval implied by a time-bucket grouping. */
  private Optional<Window> windowClause(QueryPlan plan) {
    Optional<Window> clause =
        plan.getWindows().stream()
            .filter(
                window ->
                    !(window.kind() instanceof WindowKind.Range)
                        && !(window.kind() instanceof WindowKind.Rows))
            .findFirst();
    if (clause.isPresent()) {
      return clause;
    }
    return bucket(plan).map(Bucket::window);
  }

  private boolean windowed(QueryPlan plan) {
    return windowClause(plan).isPresent();
  }

  private static String percent(double quantile) {
    return number(Math.round(quantile * 1_000_000) / 10_000.0);
  }

  private String fill(FillStrategy fill) {
    if (fill instanceof FillStrategy.Constant constant) {
      return "VALUE, " + literal(constant.value());
    }
    return switch ((FillStrategy.Basic) fill) {
      case NONE -> "NONE";
      case NULL -> "NULL";
      case PREVIOUS -> "PREV";
      case NEXT -> "NEXT";
      case LINEAR -> "LINEAR";
    };
  }
}
