package com.evoila.rosetta.metricsql;

import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.promql.PromQlTranslator;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Renders plans as MetricsQL, which accepts every PromQL rendering.
 *
 * <p>On top of the PromQL output, first, median, mode, spread and distinct-count rollups use the
 * MetricsQL {@code *_over_time} functions, medians and modes across series use the {@code median}
 * and {@code mode} operators, and limits render as {@code limit_offset}. An offset without a limit
 * is dropped.
 */
@Component
public class MetricsQlTranslator extends PromQlTranslator {

  @Override
  public Dialect targetDialect() {
    return Dialect.METRICSQL;
  }

  @Override
  protected Optional<String> overTimeFunction(AggFunction.Basic function) {
    return switch (function) {
      case FIRST, FIRST_ROW -> Optional.of("first_over_time");
      case MEDIAN -> Optional.of("median_over_time");
      case MODE -> Optional.of("mode_over_time");
      case SPREAD -> Optional.of("range_over_time");
      case COUNT_DISTINCT, HYPER_LOG_LOG -> Optional.of("distinct_over_time");
      default -> super.overTimeFunction(function);
    };
  }

  @Override
  protected Optional<String> operatorName(AggFunction.Basic function) {
    return switch (function) {
      case MEDIAN -> Optional.of("median");
      case MODE -> Optional.of("mode");
      default -> super.operatorName(function);
    };
  }

  @Override
  protected String bounds(String expression, QueryPlan plan) {
    if (plan.getLimit() == null) {
      return expression;
    }
    long offset = plan.getOffset() != null ? plan.getOffset() : 0;
    return "limit_offset(" + plan.getLimit() + ", " + offset + ", " + expression + ")";
  }
}
