package com.evoila.rosetta.druid;

import com.evoila.rosetta.common.dialect.AbstractDialectParser;
import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.ComparisonOp;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.OrderBy;
import com.evoila.rosetta.common.plan.QueryHints;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.SourceKind;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

/**
 * Parser for Druid native JSON queries ({@code timeseries}, {@code topN}, {@code groupBy}, {@code
 * scan} and friends).
 *
 * <p>The query must be a JSON object with {@code queryType} and {@code dataSource}. Granularity
 * becomes an interval window, {@code intervals} an absolute time range, aggregators and filters map
 * to their plan counterparts and {@code dimensions} to tag groups. Post-aggregations and virtual
 * columns are kept as raw JSON hints.
 */
@Slf4j
@Component
public class DruidNativeParser extends AbstractDialectParser {

  private static final JsonMapper JSON_MAPPER = JsonMapper.builder().build();

  private static final Map<String, Long> GRANULARITIES = buildGranularities();

  private static final Map<String, AggFunction> AGGREGATORS = buildAggregators();

  public DruidNativeParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public DruidNativeParser(ParserLimits limits) {
    super(limits);
  }

  @Override
  public Dialect dialect() {
    return Dialect.DRUID_NATIVE;
  }

  @Override
  protected QueryPlan doParse(String query) {
    JsonNode root;
    try {
      root = JSON_MAPPER.readTree(query);
    } catch (JacksonException e) {
      throw new QueryParseException("Invalid Druid native query JSON: " + e.getMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new QueryParseException("Druid native query must be a JSON object");
    }
    String queryType = text(root.get("queryType"))
        .orElseThrow(() -> new QueryParseException("Druid native query requires 'queryType'"));
    JsonNode dataSource = root.get("dataSource");
    if (dataSource == null || dataSource.isNull()) {
      throw new QueryParseException("Druid native query requires 'dataSource'");
    }

    QueryPlan.QueryPlanBuilder plan = QueryPlan.builder();
    QueryHints.QueryHintsBuilder hints = QueryHints.builder().customHint("query_type", queryType);
    plan.source(dataSource(dataSource, 0));
    parseGranularity(root.get("granularity"), plan, hints);
    parseIntervals(root.get("intervals"), plan);
    parseAggregations(root.get("aggregations"), plan);
    if (root.hasNonNull("filter")) {
      plan.filter(Filter.of(condition(root.get("filter"), 0)));
    }
    parseDimensions(root, plan);
    parseLimits(root, plan);
    parseContext(root.get("context"), hints);
    for (String raw : List.of("postAggregations", "virtualColumns", "having", "columns")) {
      if (root.hasNonNull(raw)) {
        hints.customHint(raw, root.get(raw).toString());
      }
    }
    log.debug("Druid native {} query on {}", queryType, dataSource);
    return plan.hints(hints.build()).build();
  }

  private DataSource dataSource(JsonNode node, int depth) {
    if (node.isString()) {
      return DataSource.table(node.stringValue());
    }
    if (!node.isObject()) {
      throw new QueryParseException("'dataSource' must be a string or an object");
    }
    String type = text(node.get("type")).orElse("table");
    if (type.equals("query") && node.hasNonNull("query")) {
      checkDepth(depth + 1, node.toString(), 0);
      QueryPlan inner = doParse(node.get("query").toString());
      return new DataSource(
          inner.primarySource().map(DataSource::name).orElse("subquery"),
          null,
          null,
          null,
          new SourceKind.Subquery(inner));
    }
    return text(node.get("name"))
        .map(DataSource::table)
        .orElseThrow(() -> new QueryParseException("'dataSource' object requires 'name'"));
  }

  private void parseGranularity(
      JsonNode node, QueryPlan.QueryPlanBuilder plan, QueryHints.QueryHintsBuilder hints) {
    if (node == null || node.isNull()) {
      return;
    }
    long intervalMs;
    if (node.isString()) {
      String name = node.stringValue().toLowerCase(Locale.ROOT);
      if (name.equals("all") || name.equals("none")) {
        hints.customHint("granularity", name);
        return;
      }
      Long known = GRANULARITIES.get(name);
      if (known == null) {
        throw new QueryParseException("Unknown Druid granularity: " + node.stringValue());
      }
      intervalMs = known;
    } else if (node.isObject()) {
      String type = text(node.get("type")).orElse("period");
      if (type.equals("duration") && node.path("duration").isNumber()) {
        intervalMs = wholeNumber(node, "duration");
      } else if (type.equals("period")) {
        String period =
            text(node.get("period"))
                .orElseThrow(() -> new QueryParseException("Period granularity requires 'period'"));
        intervalMs = DurationUtils.parseIsoPeriod(period);
        text(node.get("timeZone")).ifPresent(zone -> hints.customHint("time_zone", zone));
        text(node.get("origin")).ifPresent(origin -> hints.customHint("origin", origin));
      } else {
        throw new QueryParseException("Unsupported granularity type: " + type);
      }
    } else {
      throw new QueryParseException("'granularity' must be a string or an object");
    }
    plan.window(Window.of(WindowKind.Interval.of(intervalMs)));
  }

  private void parseIntervals(JsonNode node, QueryPlan.QueryPlanBuilder plan) {
    if (node == null || node.isNull()) {
      return;
    }
    JsonNode first = node.isArray() ? (node.size() > 0 ? node.get(0) : null) : node;
    if (first == null) {
      return;
    }
    String interval =
        text(first).orElseThrow(() -> new QueryParseException("'intervals' must hold strings"));
    TimeRange range =
        DruidSqlParser.isoInterval(interval)
            .orElseThrow(() -> new QueryParseException("Invalid Druid interval: " + interval));
    plan.timeRange(range);
  }

  private void parseAggregations(JsonNode node, QueryPlan.QueryPlanBuilder plan) {
    if (node == null || !node.isArray()) {
      return;
    }
    for (JsonNode aggregator : node) {
      String type =
          text(aggregator.get("type"))
              .orElseThrow(() -> new QueryParseException("Aggregator requires 'type'"));
      AggFunction function = AGGREGATORS.getOrDefault(type, new AggFunction.Custom(type));
      String column =
          text(aggregator.get("fieldName"))
              .or(() -> text(aggregator.get("field")))
              .orElse(null);
      String alias = text(aggregator.get("name")).orElse(null);
      plan.aggregation(new Aggregation(function, column, List.of(), alias, false));
    }
  }

  private FilterCondition condition(JsonNode node, int depth) {
    checkDepth(depth, node.toString(), 0);
    String type =
        text(node.get("type")).orElseThrow(() -> new QueryParseException("Filter requires 'type'"));
    String dimension = text(node.get("dimension")).or(() -> text(node.get("column"))).orElse(null);
    return switch (type) {
      case "selector" -> selector(dimension, node.get("value"));
      case "equality" -> selector(dimension, node.get("matchValue"));
      case "null" -> new FilterCondition.IsNull(dimension, false);
      case "in" -> new FilterCondition.In(dimension, values(node.get("values")), false);
      case "regex" ->
          new FilterCondition.Regex(dimension, text(node.get("pattern")).orElse(""), false);
      case "like" ->
          new FilterCondition.Comparison(
              dimension, ComparisonOp.LIKE, Value.of(text(node.get("pattern")).orElse("")));
      case "bound", "range" -> bound(dimension, node);
      case "and" -> new FilterCondition.And(children(node, depth));
      case "or" -> new FilterCondition.Or(children(node, depth));
      case "not" -> {
        JsonNode field = node.get("field");
        if (field == null || !field.isObject()) {
          throw new QueryParseException("'not' filter requires 'field'");
        }
        yield new FilterCondition.Not(condition(field, depth + 1));
      }
      default -> throw new QueryParseException("Unsupported Druid filter type: " + type);
    };
  }

  private FilterCondition selector(String dimension, JsonNode value) {
    if (value == null || value.isNull()) {
      return new FilterCondition.IsNull(dimension, false);
    }
    return new FilterCondition.Comparison(dimension, ComparisonOp.EQ, value(value));
  }

  private FilterCondition bound(String dimension, JsonNode node) {
    List<FilterCondition> parts = new ArrayList<>();
    JsonNode lower = node.has("lower") ? node.get("lower") : node.get("lowerValue");
    JsonNode upper = node.has("upper") ? node.get("upper") : node.get("upperValue");
    if (lower != null && !lower.isNull()) {
      boolean strict =
          node.path("lowerStrict").isBoolean() && node.get("lowerStrict").booleanValue();
      parts.add(
          new FilterCondition.Comparison(
              dimension, strict ? ComparisonOp.GT : ComparisonOp.GT_EQ, value(lower)));
    }
    if (upper != null && !upper.isNull()) {
      boolean strict =
          node.path("upperStrict").isBoolean() && node.get("upperStrict").booleanValue();
      parts.add(
          new FilterCondition.Comparison(
              dimension, strict ? ComparisonOp.LT : ComparisonOp.LT_EQ, value(upper)));
    }
    if (parts.isEmpty()) {
      throw new QueryParseException("Bound filter on " + dimension + " has no bounds");
    }
    return FilterCondition.and(parts);
  }

  private List<FilterCondition> children(JsonNode node, int depth) {
    JsonNode fields = node.get("fields");
    if (fields == null || !fields.isArray() || fields.size() == 0) {
      throw new QueryParseException("Logical filter requires a non-empty 'fields' array");
    }
    List<FilterCondition> conditions = new ArrayList<>();
    for (JsonNode field : fields) {
      conditions.add(condition(field, depth + 1));
    }
    return conditions;
  }

  private void parseDimensions(JsonNode root, QueryPlan.QueryPlanBuilder plan) {
    List<JsonNode> dimensions = new ArrayList<>();
    if (root.path("dimensions").isArray()) {
      root.get("dimensions").forEach(dimensions::add);
    }
    if (root.hasNonNull("dimension")) {
      dimensions.add(root.get("dimension"));
    }
    for (JsonNode dimension : dimensions) {
      Optional<String> name =
          dimension.isObject() ? text(dimension.get("dimension")) : text(dimension);
      name.ifPresent(tag -> plan.group(GroupBy.tag(tag)));
    }
  }

  private void parseLimits(JsonNode root, QueryPlan.QueryPlanBuilder plan) {
    if (root.path("threshold").isNumber()) {
      plan.limit(wholeNumber(root, "threshold"));
    }
    if (root.path("limit").isNumber()) {
      plan.limit(wholeNumber(root, "limit"));
    }
    if (root.path("offset").isNumber()) {
      plan.offset(wholeNumber(root, "offset"));
    }
    JsonNode limitSpec = root.get("limitSpec");
    if (limitSpec != null && limitSpec.isObject()) {
      if (limitSpec.path("limit").isNumber()) {
        plan.limit(wholeNumber(limitSpec, "limit"));
      }
      if (limitSpec.path("columns").isArray()) {
        for (JsonNode column : limitSpec.get("columns")) {
          Optional<String> name =
              column.isObject() ? text(column.get("dimension")) : text(column);
          boolean descending =
              column.isObject()
                  && text(column.get("direction")).orElse("ascending").startsWith("desc");
          name.ifPresent(n -> plan.order(descending ? OrderBy.desc(n) : OrderBy.asc(n)));
        }
      }
    }
    // topN orders by its metric
    JsonNode metric = root.get("metric");
    if (metric != null) {
      Optional<String> name = metric.isObject() ? text(metric.get("metric")) : text(metric);
      name.ifPresent(n -> plan.order(OrderBy.desc(n)));
    }
    if (root.path("descending").isBoolean() && root.get("descending").booleanValue()) {
      plan.order(OrderBy.desc("__time"));
    }
  }

  private void parseContext(JsonNode context, QueryHints.QueryHintsBuilder hints) {
    if (context == null || !context.isObject()) {
      return;
    }
    if (context.path("timeout").isNumber()) {
      hints.timeoutMs(wholeNumber(context, "timeout"));
    }
    if (context.path("useCache").isBoolean()) {
      hints.useCache(context.get("useCache").booleanValue());
    }
  }

  private static long wholeNumber(JsonNode parent, String field) {
    JsonNode node = parent.get(field);
    if (!node.canConvertToExactIntegral() || !node.canConvertToLong()) {
      throw new QueryParseException("'" + field + "' must be a whole number, got: " + node);
    }
    return node.longValue();
  }

  private static List<Value> values(JsonNode node) {
    if (node == null || !node.isArray()) {
      throw new QueryParseException("'in' filter requires a 'values' array");
    }
    List<Value> values = new ArrayList<>();
    node.forEach(value -> values.add(value(value)));
    return values;
  }

  private static Value value(JsonNode node) {
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return Value.of(node.longValue());
    }
    if (node.isNumber()) {
      return Value.of(node.doubleValue());
    }
    if (node.isBoolean()) {
      return Value.of(node.booleanValue());
    }
    if (node.isNull()) {
      return Value.nullValue();
    }
    return Value.of(node.isString() ? node.stringValue() : node.toString());
  }

  private static Optional<String> text(JsonNode node) {
    return node != null && node.isString() ? Optional.of(node.stringValue()) : Optional.empty();
  }

  private static Map<String, Long> buildGranularities() {
    Map<String, Long> map = new HashMap<>();
    map.put("second", DurationUtils.SECOND);
    map.put("minute", DurationUtils.MINUTE);
    map.put("five_minute", 5 * DurationUtils.MINUTE);
    map.put("ten_minute", 10 * DurationUtils.MINUTE);
    map.put("fifteen_minute", 15 * DurationUtils.MINUTE);
    map.put("thirty_minute", 30 * DurationUtils.MINUTE);
    map.put("hour", DurationUtils.HOUR);
    map.put("six_hour", 6 * DurationUtils.HOUR);
    map.put("eight_hour", 8 * DurationUtils.HOUR);
    map.put("day", DurationUtils.DAY);
    map.put("week", DurationUtils.WEEK);
    map.put("month", DurationUtils.MONTH);
    map.put("quarter", 3 * DurationUtils.MONTH);
    map.put("year", DurationUtils.YEAR);
    return Map.copyOf(map);
  }

  private static Map<String, AggFunction> buildAggregators() {
    Map<String, AggFunction> map = new HashMap<>();
    map.put("count", AggFunction.Basic.COUNT);
    for (String prefix : List.of("long", "double", "float")) {
      map.put(prefix + "Sum", AggFunction.Basic.SUM);
      map.put(prefix + "Min", AggFunction.Basic.MIN);
      map.put(prefix + "Max", AggFunction.Basic.MAX);
      map.put(prefix + "First", AggFunction.Basic.FIRST);
      map.put(prefix + "Last", AggFunction.Basic.LAST);
      map.put(prefix + "Mean", AggFunction.Basic.AVG);
    }
    map.put("hyperUnique", AggFunction.Basic.HYPER_LOG_LOG);
    map.put("cardinality", AggFunction.Basic.HYPER_LOG_LOG);
    map.put("HLLSketchBuild", AggFunction.Basic.HYPER_LOG_LOG);
    map.put("HLLSketchMerge", AggFunction.Basic.HYPER_LOG_LOG);
    map.put("thetaSketch", AggFunction.Basic.HYPER_LOG_LOG);
    return Map.copyOf(map);
  }
}
