package com.evoila.rosetta.opentsdb;

import com.evoila.rosetta.common.dialect.AbstractDialectParser;
import com.evoila.rosetta.common.dialect.ParserLimits;
import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.ComparisonOp;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.QueryHints;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

/**
 * Parser for OpenTSDB {@code /api/query} JSON bodies.
 *
 * <p>Each sub-query contributes its metric as a source, its tags and filters as predicates and its
 * aggregator as an aggregation; a {@code rate} flag adds a rate ahead of the aggregator, matching
 * the order in which OpenTSDB evaluates them. {@code downsample} becomes an interval window with
 * the downsample function kept as a hint. Times are epoch seconds, epoch milliseconds (13 digits),
 * {@code yyyy/MM/dd[-HH:mm[:ss]]} dates in UTC or relative values such as {@code 1h-ago}.
 */
@Slf4j
@Component
public class OpenTsdbParser extends AbstractDialectParser {

  /** Relative time and downsample units. */
  public static final Map<String, Long> UNITS =
      Map.of(
          "ms", 1L,
          "s", DurationUtils.SECOND,
          "m", DurationUtils.MINUTE,
          "h", DurationUtils.HOUR,
          "d", DurationUtils.DAY,
          "w", DurationUtils.WEEK,
          "n", DurationUtils.MONTH,
          "y", DurationUtils.YEAR);

  private static final JsonMapper JSON_MAPPER = JsonMapper.builder().build();

  private static final Pattern DOWNSAMPLE =
      Pattern.compile("^(\\d+[a-z]+|0all)-(\\w+)(?:-(\\w+))?$");
  private static final Pattern PERCENTILE = Pattern.compile("^(e?)p(\\d{2,3})$");
  private static final Pattern EPOCH = Pattern.compile("^\\d+(\\.\\d+)?$");

  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy/MM/dd-HH:mm[:ss]");
  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

  public OpenTsdbParser() {
    this(ParserLimits.DEFAULTS);
  }

  @Autowired
  public OpenTsdbParser(ParserLimits limits) {
    super(limits);
  }

  @Override
  public Dialect dialect() {
    return Dialect.OPENTSDB;
  }

  @Override
  protected QueryPlan doParse(String query) {
    JsonNode root;
    try {
      root = JSON_MAPPER.readTree(query);
    } catch (JacksonException e) {
      throw new QueryParseException("Invalid OpenTSDB query JSON: " + e.getMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new QueryParseException("OpenTSDB query must be a JSON object");
    }
    JsonNode queries = root.get("queries");
    if (queries == null || !queries.isArray() || queries.size() == 0) {
      throw new QueryParseException("OpenTSDB query requires a non-empty 'queries' array");
    }
    JsonNode start = root.get("start");
    if (start == null || start.isNull()) {
      throw new QueryParseException("OpenTSDB query requires 'start'");
    }

    QueryPlan.QueryPlanBuilder plan = QueryPlan.builder();
    QueryHints.QueryHintsBuilder hints = QueryHints.builder();
    plan.timeRange(timeRange(start, root.get("end"), hints));
    Set<String> groupedTags = new HashSet<>();
    for (JsonNode subQuery : queries) {
      parseSubQuery(subQuery, plan, hints, groupedTags);
    }
    log.debug("OpenTSDB query with {} sub-queries", queries.size());
    if (queries.size() > 1) {
      hints.customHint("queries", Integer.toString(queries.size()));
    }
    if (root.path("msResolution").isBoolean() && root.get("msResolution").booleanValue()) {
      hints.customHint("ms_resolution", "true");
    }
    text(root.get("timezone")).ifPresent(zone -> hints.customHint("time_zone", zone));
    return plan.hints(hints.build()).build();
  }

  private void parseSubQuery(
      JsonNode subQuery,
      QueryPlan.QueryPlanBuilder plan,
      QueryHints.QueryHintsBuilder hints,
      Set<String> groupedTags) {
    if (!subQuery.isObject()) {
      throw new QueryParseException("Each OpenTSDB sub-query must be an object");
    }
    String metric =
        text(subQuery.get("metric"))
            .orElseThrow(() -> new QueryParseException("OpenTSDB sub-query requires 'metric'"));
    plan.source(DataSource.metric(metric));

    text(subQuery.get("downsample")).ifPresent(spec -> downsample(spec, plan, hints));

    if (subQuery.path("rate").isBoolean() && subQuery.get("rate").booleanValue()) {
      plan.aggregation(Aggregation.of(AggFunction.Basic.RATE));
      JsonNode rateOptions = subQuery.get("rateOptions");
      if (rateOptions != null && rateOptions.isObject()) {
        hints.customHint("rate_options", rateOptions.toString());
      }
    }

    text(subQuery.get("aggregator"))
        .flatMap(OpenTsdbParser::aggregatorFunction)
        .ifPresent(function -> plan.aggregation(Aggregation.of(function)));

    JsonNode tags = subQuery.get("tags");
    if (tags != null && tags.isObject()) {
      for (Map.Entry<String, JsonNode> tag : tags.properties()) {
        String value = text(tag.getValue()).orElse("");
        tagFilter(tag.getKey(), value, plan);
        group(tag.getKey(), plan, groupedTags);
      }
    }
    JsonNode filters = subQuery.get("filters");
    if (filters != null && filters.isArray()) {
      for (JsonNode filter : filters) {
        String tagKey =
            text(filter.get("tagk"))
                .orElseThrow(() -> new QueryParseException("OpenTSDB filter requires 'tagk'"));
        String type = text(filter.get("type")).orElse("literal_or");
        String expression = text(filter.get("filter")).orElse("");
        plan.filter(Filter.of(filterCondition(type, tagKey, expression)));
        if (filter.path("groupBy").isBoolean() && filter.get("groupBy").booleanValue()) {
          group(tagKey, plan, groupedTags);
        }
      }
    }
  }

  private void downsample(
      String spec, QueryPlan.QueryPlanBuilder plan, QueryHints.QueryHintsBuilder hints) {
    Matcher matcher = DOWNSAMPLE.matcher(spec.trim());
    if (!matcher.matches()) {
      throw new QueryParseException("Invalid OpenTSDB downsample: " + spec);
    }
    hints.customHint("downsample", spec);
    if (matcher.group(1).equals("0all")) {
      return;
    }
    long intervalMs = DurationUtils.parse(matcher.group(1), UNITS);
    Window window = Window.of(WindowKind.Interval.of(intervalMs));
    if (matcher.group(3) != null) {
      window = window.withFill(fillPolicy(matcher.group(3)));
    }
    plan.window(window);
  }

  private static FillStrategy fillPolicy(String policy) {
    return switch (policy.toLowerCase()) {
      case "none" -> FillStrategy.Basic.NONE;
      case "nan", "null" -> FillStrategy.Basic.NULL;
      case "zero" -> new FillStrategy.Constant(Value.of(0L));
      default -> throw new QueryParseException("Unknown OpenTSDB fill policy: " + policy);
    };
  }

  /** Maps an aggregator name; {@code none} disables aggregation across series. */
  static Optional<AggFunction> aggregatorFunction(String name) {
    String lower = name.toLowerCase();
    Matcher percentile = PERCENTILE.matcher(lower);
    if (percentile.matches()) {
      String digits = percentile.group(2);
      double quantile = Double.parseDouble(digits) / (digits.length() == 3 ? 1000 : 100);
      return Optional.of(
          percentile.group(1).isEmpty()
              ? new AggFunction.Percentile(quantile)
              : new AggFunction.Apercentile(quantile));
    }
    AggFunction function =
        switch (lower) {
          case "none" -> null;
          case "sum", "zimsum" -> AggFunction.Basic.SUM;
          case "avg" -> AggFunction.Basic.AVG;
          case "min", "mimmin" -> AggFunction.Basic.MIN;
          case "max", "mimmax" -> AggFunction.Basic.MAX;
          case "count" -> AggFunction.Basic.COUNT;
          case "first" -> AggFunction.Basic.FIRST;
          case "last" -> AggFunction.Basic.LAST;
          case "dev" -> AggFunction.Basic.STDDEV;
          case "median" -> AggFunction.Basic.MEDIAN;
          default -> new AggFunction.Custom(lower);
        };
    return Optional.ofNullable(function);
  }

  private static void tagFilter(String key, String value, QueryPlan.QueryPlanBuilder plan) {
    if (value.equals("*") || value.isEmpty()) {
      return;
    }
    if (value.contains("|")) {
      plan.filter(Filter.of(new FilterCondition.In(key, literals(value), false)));
    } else {
      plan.filter(Filter.eq(key, value));
    }
  }

  private static FilterCondition filterCondition(String type, String key, String expression) {
    return switch (type.toLowerCase()) {
      case "literal_or", "iliteral_or" ->
          expression.contains("|")
              ? new FilterCondition.In(key, literals(expression), false)
              : new FilterCondition.Comparison(key, ComparisonOp.EQ, Value.of(expression));
      case "not_literal_or", "not_iliteral_or" ->
          expression.contains("|")
              ? new FilterCondition.In(key, literals(expression), true)
              : new FilterCondition.Comparison(key, ComparisonOp.NOT_EQ, Value.of(expression));
      case "wildcard" -> new FilterCondition.Regex(key, globToRegex(expression), false);
      case "iwildcard" -> new FilterCondition.Regex(key, "(?i)" + globToRegex(expression), false);
      case "regexp" -> new FilterCondition.Regex(key, expression, false);
      default -> throw new QueryParseException("Unsupported OpenTSDB filter type: " + type);
    };
  }

  private static List<Value> literals(String expression) {
    List<Value> values = new ArrayList<>();
    for (String literal : expression.split("\\|")) {
      if (!literal.isBlank()) {
        values.add(Value.of(literal.trim()));
      }
    }
    return values;
  }

  private static String globToRegex(String glob) {
    StringBuilder regex = new StringBuilder("^");
    for (char c : glob.toCharArray()) {
      if (c == '*') {
        regex.append(".*");
      } else if ("\\.[]{}()+-?^$|".indexOf(c) >= 0) {
        regex.append('\\').append(c);
      } else {
        regex.append(c);
      }
    }
    return regex.append('$').toString();
  }

  private static void group(String tag, QueryPlan.QueryPlanBuilder plan, Set<String> grouped) {
    if (grouped.add(tag)) {
      plan.group(GroupBy.tag(tag));
    }
  }

  private TimeRange timeRange(JsonNode start, JsonNode end, QueryHints.QueryHintsBuilder hints) {
    Optional<Long> relativeStart = relative(start);
    if (relativeStart.isPresent()) {
      if (end != null && !end.isNull()) {
        hints.customHint("end", end.isString() ? end.stringValue() : end.toString());
      }
      return TimeRange.Relative.of(relativeStart.get());
    }
    long startMs = timestamp(start);
    if (end == null || end.isNull()) {
      return new TimeRange.Since(startMs);
    }
    if (relative(end).isPresent()) {
      hints.customHint("end", end.stringValue());
      return new TimeRange.Since(startMs);
    }
    return new TimeRange.Absolute(startMs, timestamp(end));
  }

  private static Optional<Long> relative(JsonNode node) {
    if (node.isString() && node.stringValue().endsWith("-ago")) {
      String amount = node.stringValue().substring(0, node.stringValue().length() - 4);
      return Optional.of(DurationUtils.parse(amount, UNITS));
    }
    return Optional.empty();
  }

  /** Epoch seconds or 13-digit epoch milliseconds, as number or string, or an OpenTSDB date. */
  static long timestamp(JsonNode node) {
    String text;
    if (node.isNumber()) {
      text =
          node.isIntegralNumber()
              ? node.bigIntegerValue().toString()
              : Double.toString(node.doubleValue());
    } else if (node.isString()) {
      text = node.stringValue().trim();
    } else {
      throw new QueryParseException("Invalid OpenTSDB time: " + node);
    }
    if (EPOCH.matcher(text).matches()) {
      if (text.contains(".")) {
        return Math.round(Double.parseDouble(text) * 1000);
      }
      long value = Long.parseLong(text);
      return text.length() >= 13 ? value : value * 1000;
    }
    try {
      if (text.length() == 10) {
        return LocalDate.parse(text, DATE).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
      }
      return LocalDateTime.parse(text, DATE_TIME).toInstant(ZoneOffset.UTC).toEpochMilli();
    } catch (DateTimeParseException e) {
      throw new QueryParseException("Invalid OpenTSDB time: " + text, e);
    }
  }

  private static Optional<String> text(JsonNode node) {
    return node != null && node.isString() ? Optional.of(node.stringValue()) : Optional.empty();
  }
}
