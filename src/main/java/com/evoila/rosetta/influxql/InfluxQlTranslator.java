package com.evoila.rosetta.influxql;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.GroupByExpr;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.sql.AbstractSqlTranslator;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Renders plans as InfluxQL.
 *
 * <p>Measurements and fields are always double-quoted, windows become {@code GROUP BY time(d)}
 * followed by {@code fill()}, and regular expressions use {@code /.../} literals. {@code Avg} maps
 * to {@code mean}, rates to {@code non_negative_derivative(x, 1s)} and {@code Deriv} to {@code
 * derivative(x, 1s)}; percentiles are expressed in percent. Grouped tags are not selected and
 * ordering is only kept on {@code time}. HAVING, casts, next-value fills and window kinds other
 * than intervals are omitted.
 */
@Component
public class InfluxQlTranslator extends AbstractSqlTranslator {

  private static final String TIME = "time";

  @Override
  public Dialect targetDialect() {
    return Dialect.INFLUXQL;
  }

  @Override
  protected String timeColumn() {
    return TIME;
  }

  @Override
  protected String formatDuration(long millis) {
    return DurationUtils.format(millis);
  }

  @Override
  protected String relativeStart(long durationMs) {
    return "now() - " + formatDuration(durationMs);
  }

  @Override
  protected String identifier(String name) {
    if (name.equals("*") || name.equals(TIME)) {
      return name;
    }
    return "\"" + name.replace("\"", "\\\"") + "\"";
  }

  @Override
  protected String functionName(AggFunction.Basic function) {
    return switch (function) {
      case AVG -> "mean";
      case FIRST_ROW -> "first";
      case LAST_ROW -> "last";
      default -> super.functionName(function);
    };
  }

  @Override
  protected String aggregationCall(Aggregation aggregation, String argument) {
    AggFunction function = aggregation.function();
    if (function == AggFunction.Basic.COUNT_DISTINCT
        || function == AggFunction.Basic.HYPER_LOG_LOG) {
      return "count(distinct(" + argument + "))";
    }
    if (function == AggFunction.Basic.RATE || function == AggFunction.Basic.IRATE) {
      return "non_negative_derivative(" + argument + ", 1s)";
    }
    if (function == AggFunction.Basic.DERIV) {
      return "derivative(" + argument + ", 1s)";
    }
    if (function instanceof AggFunction.HistogramQuantile histogram) {
      return percentile(histogram.quantile(), argument);
    }
    return super.aggregationCall(aggregation, argument);
  }

  @Override
  protected String percentile(double quantile, String argument) {
    double percent = Math.round(quantile * 1_000_000) / 10_000.0;
    return "percentile(" + argument + ", " + number(percent) + ")";
  }

  @Override
  protected String approximatePercentile(double quantile, String argument) {
    return percentile(quantile, argument);
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
    return column + (negated ? " !~ /" : " =~ /") + pattern.replace("/", "\\/") + "/";
  }

  @Override
  protected Optional<String> transform(TransformType type, String argument) {
    if (type instanceof TransformType.Round) {
      return Optional.of("round(" + argument + ")");
    } else if (type instanceof TransformType.Log log && log.base() != null && log.base() == 2.0) {
      return Optional.of("log2(" + argument + ")");
    } else if (type instanceof TransformType.Derivative derivative) {
      String name = derivative.nonNegative() ? "non_negative_derivative" : "derivative";
      return Optional.of(name + "(" + argument + unit(derivative.unitMs()) + ")");
    } else if (type instanceof TransformType.Elapsed elapsed) {
      return Optional.of("elapsed(" + argument + unit(elapsed.unitMs()) + ")");
    } else if (type instanceof TransformType.Cast) {
      return Optional.empty();
    }
    return super.transform(type, argument);
  }

  @Override
  protected Optional<String> groupItem(GroupByExpr expr, QueryPlan plan) {
    if (expr instanceof GroupByExpr.AllTags) {
      return Optional.of("*");
    }
    return super.groupItem(expr, plan);
  }

  @Override
  protected Optional<String> windowGrouping(QueryPlan plan) {
    return bucket(plan)
        .map(
            bucket -> {
              Long offsetMs =
                  bucket.window().kind() instanceof WindowKind.Interval interval
                      ? interval.offsetMs()
                      : null;
              return "time("
                  + formatDuration(bucket.intervalMs())
                  + (offsetMs != null ? ", " + formatDuration(offsetMs) : "")
                  + ")";
            });
  }

  @Override
  protected void appendGroupByModifiers(StringBuilder sql, QueryPlan plan) {
    bucket(plan)
        .map(Bucket::window)
        .map(Window::fill)
        .flatMap(InfluxQlTranslator::fill)
        .ifPresent(fill -> sql.append(" fill(").append(fill).append(')'));
  }

  @Override
  protected String render(QueryPlan plan) {
    QueryPlan timeOrdered =
        plan.toBuilder()
            .clearOrderBy()
            .orderBy(
                plan.getOrderBy().stream()
                    .filter(order -> order.column().equalsIgnoreCase(TIME))
                    .toList())
            .build();
    StringBuilder sql = new StringBuilder(super.render(timeOrdered));
    if (plan.getSourceDialect() == Dialect.INFLUXQL) {
      plan.getHints().custom("slimit").ifPresent(value -> sql.append(" SLIMIT ").append(value));
      plan.getHints().custom("soffset").ifPresent(value -> sql.append(" SOFFSET ").append(value));
    }
    return sql.toString();
  }

  @Override
  protected boolean supportsHaving() {
    return false;
  }

  /** Grouped tags come back with every series and cannot be selected next to aggregates. */
  @Override
  protected boolean projectsGroupColumns() {
    return false;
  }

  private String unit(Long unitMs) {
    return unitMs != null ? ", " + formatDuration(unitMs) : "";
  }

  private static Optional<String> fill(FillStrategy fill) {
    if (fill == null || fill == FillStrategy.Basic.NEXT) {
      return Optional.empty();
    }
    if (fill instanceof FillStrategy.Constant constant) {
      return Optional.of(constant.value().text());
    }
    return Optional.of(
        switch ((FillStrategy.Basic) fill) {
          case NONE -> "none";
          case NULL -> "null";
          case PREVIOUS -> "previous";
          case LINEAR -> "linear";
          case NEXT -> throw new IllegalStateException("Next-value fill has no InfluxQL form");
        });
  }
}
