package com.evoila.rosetta.metricsql;

import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Transformation;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.promql.PromQlExpression;
import com.evoila.rosetta.promql.PromQlParser;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * MetricsQL (VictoriaMetrics) parser. Accepts the PromQL grammar plus the MetricsQL extensions:
 * {@code WITH} templates, {@code keep_metric_names}, the extra aggregation operators, {@code
 * range_*} and {@code rollup*} functions and the label manipulation functions.
 */
@Slf4j
@Component
public class MetricsQlParser extends PromQlParser {

  private static final Set<String> AGGREGATION_OPERATORS = metricsQlOperators();

  private static final Map<String, AggFunction> EXTRA_OVER_TIME =
      Map.of(
          "median_over_time", AggFunction.Basic.MEDIAN,
          "mode_over_time", AggFunction.Basic.MODE,
          "first_over_time", AggFunction.Basic.FIRST,
          "increase_pure", AggFunction.Basic.INCREASE,
          "integrate", AggFunction.Basic.INTEGRAL);

  private static final Set<String> ROLLUP_FUNCTIONS =
      Set.of(
          "rollup", "rollup_rate", "rollup_deriv", "rollup_delta", "rollup_increase",
          "rollup_candlestick", "rollup_scrape_interval");

  private static final Set<String> RANGE_TRANSFORMS =
      Set.of(
          "range_avg", "range_median", "range_quantile", "range_first", "range_last",
          "range_min", "range_max", "range_sum", "range_stddev", "range_stdvar",
          "range_normalize", "running_avg", "running_sum", "running_min", "running_max");

  private static final Set<String> LABEL_TRANSFORMS =
      Set.of(
          "label_set", "label_del", "label_keep", "label_uppercase", "label_lowercase",
          "label_map", "label_value", "labels_equal", "drop_common_labels");

  public MetricsQlParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public MetricsQlParser(ParserLimits limits) {
    super(limits);
  }

  @Override
  public Dialect dialect() {
    return Dialect.METRICSQL;
  }

  @Override
  protected Set<String> aggregationOperators() {
    return AGGREGATION_OPERATORS;
  }

  @Override
  protected boolean withTemplates() {
    return true;
  }

  @Override
  protected AggFunction aggregationFunction(String name, PromQlExpression parameter) {
    return switch (name) {
      case "median" -> AggFunction.Basic.MEDIAN;
      case "mode" -> AggFunction.Basic.MODE;
      case "any" -> AggFunction.Basic.FIRST;
      case "distinct" -> AggFunction.Basic.COUNT_DISTINCT;
      case "histogram" -> AggFunction.Basic.HISTOGRAM;
      default -> super.aggregationFunction(name, parameter);
    };
  }

  @Override
  protected void applyFunction(
      String name, List<PromQlExpression> args, PromQlExpression target) {
    String lower = name.toLowerCase();
    if (EXTRA_OVER_TIME.containsKey(lower)) {
      absorbVector(args, target);
      target.aggregation(Aggregation.of(EXTRA_OVER_TIME.get(lower)));
    } else if (ROLLUP_FUNCTIONS.contains(lower)) {
      // rollup results have no canonical form
      absorbVector(args, target);
      target.aggregation(
          new Aggregation(
              new AggFunction.Custom(lower), null, literalArguments(args), null, false));
    } else if (RANGE_TRANSFORMS.contains(lower) || LABEL_TRANSFORMS.contains(lower)) {
      absorbVector(args, target);
      target.transformation(
          Transformation.of(new TransformType.Custom(lower, literalArguments(args))));
    } else if (lower.equals("label_copy") || lower.equals("label_move")) {
      labelCopy(lower, args, target);
    } else {
      super.applyFunction(lower, args, target);
    }
  }

  @Override
  protected boolean postfixModifier(String identifier, PromQlExpression expression) {
    if (identifier.equalsIgnoreCase("keep_metric_names")) {
      expression.hint("keep_metric_names", "true");
      return true;
    }
    return false;
  }

  /**
   * {@code label_copy(q, "src1", "dst1", ...)} becomes one full-match label replacement per pair;
   * {@code label_move} additionally deletes the source labels.
   */
  private void labelCopy(String name, List<PromQlExpression> args, PromQlExpression target) {
    if (args.size() < 3 || (args.size() - 1) % 2 != 0) {
      throw new QueryParseException(name + " expects a vector and pairs of label names");
    }
    absorbVector(args, target);
    List<Value> moved = new ArrayList<>();
    for (int i = 1; i < args.size(); i += 2) {
      PromQlExpression source = args.get(i);
      PromQlExpression destination = args.get(i + 1);
      if (!source.isString() || !destination.isString()) {
        throw new QueryParseException(name + " label names must be strings");
      }
      target.transformation(
          Transformation.of(
              new TransformType.LabelReplace(
                  destination.getString(), "$1", source.getString(), "(.*)")));
      moved.add(Value.of(source.getString()));
    }
    if (name.equals("label_move")) {
      target.transformation(Transformation.of(new TransformType.Custom("label_del", moved)));
    }
    log.debug("MetricsQL {} rewritten into {} label replacements", name, moved.size());
  }

  private static Set<String> metricsQlOperators() {
    Set<String> operators = new HashSet<>(PromQlParser.AGGREGATION_OPERATORS);
    operators.addAll(
        Set.of(
            "median", "mode", "any", "distinct", "geomean", "histogram", "mad", "outliersk",
            "outliers_mad", "share", "zscore", "sum2", "quantiles", "stdvar", "topk_avg",
            "topk_max", "topk_min", "topk_last", "topk_median", "bottomk_avg", "bottomk_max",
            "bottomk_min", "bottomk_last", "bottomk_median"));
    return Set.copyOf(operators);
  }
}
