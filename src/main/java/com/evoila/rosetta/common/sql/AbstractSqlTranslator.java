package com.evoila.rosetta.common.sql;

import com.evoila.rosetta.common.dialect.DialectTranslator;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.DataType;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.GroupByExpr;
import com.evoila.rosetta.common.plan.OrderBy;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.SourceKind;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Transformation;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.common.utils.DurationUtils;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Template for the SQL-family translators.
 *
 * <p>Plan fields are rendered in a fixed order: the select list from aggregations, transformations
 * and grouping, the primary source, WHERE from the time range and filters, dialect window clauses,
 * GROUP BY, HAVING, ORDER BY and the bounds. Subclasses supply the time column, the duration and
 * interval literals, their function names and their windowing syntax.
 *
 * <p>When no aggregation names a column the aggregations are read as a composition over the value
 * column, innermost first, so {@code [RATE, SUM]} renders {@code sum(rate(value))}. Otherwise each
 * aggregation is an independent select-list entry. Top-k and bottom-k selections are approximated
 * by ordering on the value and limiting the row count unless the dialect has a native function.
 * Label rewrites have no SQL form and are omitted. A look-back range without a time range becomes
 * a relative lower bound on the time column.
 */
@Slf4j
public abstract class AbstractSqlTranslator implements DialectTranslator {

  protected static final String DEFAULT_SOURCE = "default";
  protected static final String DEFAULT_COLUMN = "value";
  protected static final String BUCKET_ALIAS = "bucket";

  private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  private static final Set<String> RESERVED_WORDS =
      Set.of(
          "align", "all", "and", "as", "asc", "between", "by", "case", "count_window",
          "default", "desc", "distinct", "event_window", "fill", "final", "format", "from",
          "group", "having", "in", "interval", "into", "is", "join", "latest", "like", "limit",
          "not", "null", "offset", "on", "or", "order", "partition", "prewhere", "sample",
          "select", "session", "settings", "sliding", "slimit", "soffset", "state_window",
          "table", "to", "tz", "user", "where", "with");

  private static final Set<Dialect> SQL_FAMILY =
      EnumSet.of(
          Dialect.SQL,
          Dialect.TIMESCALEDB,
          Dialect.TDENGINE,
          Dialect.QUESTDB,
          Dialect.CLICKHOUSE,
          Dialect.DRUID_SQL);

  // ============================================================================
  // Dialect hooks
  // ============================================================================

  /** Name of the time column used for time bounds and buckets. */
  protected abstract String timeColumn();

  /** Native duration literal, e.g. {@code 5m} or {@code '5 minutes'}. */
  protected abstract String formatDuration(long millis);

  /** Right-hand side of {@code time >= ...} for a look-back of {@code durationMs}. */
  protected String relativeStart(long durationMs) {
    return "NOW() - INTERVAL '" + DurationUtils.formatSqlInterval(durationMs) + "'";
  }

  protected String timestampLiteral(long epochMs) {
    return quote(Instant.ofEpochMilli(epochMs).toString());
  }

  protected char identifierQuote() {
    return '"';
  }

  /** Function name of a parameterless aggregate. */
  protected String functionName(AggFunction.Basic function) {
    return switch (function) {
      case FIRST_ROW -> "first";
      case LAST_ROW -> "last";
      case HYPER_LOG_LOG -> "approx_count_distinct";
      default -> function.name().toLowerCase(Locale.ROOT);
    };
  }

  protected String percentile(double quantile, String argument) {
    return "percentile_cont(" + number(quantile) + ") WITHIN GROUP (ORDER BY " + argument + ")";
  }

  protected String approximatePercentile(double quantile, String argument) {
    return "approx_percentile(" + argument + ", " + number(quantile) + ")";
  }

  /** Native rendering of top-k and bottom-k, or empty to approximate with ORDER BY and LIMIT. */
  protected Optional<String> ranking(AggFunction function, String argument) {
    return Optional.empty();
  }

  protected String regexCondition(String column, String pattern, boolean negated) {
    return column + (negated ? " !~ " : " ~ ") + quote(pattern);
  }

  protected String sqlType(DataType type) {
    return switch (type) {
      case BOOL -> "BOOLEAN";
      case INT8 -> "TINYINT";
      case INT16 -> "SMALLINT";
      case INT32 -> "INTEGER";
      case INT64, UINT8, UINT16, UINT32, UINT64 -> "BIGINT";
      case FLOAT32 -> "REAL";
      case FLOAT64 -> "DOUBLE PRECISION";
      case STRING -> "VARCHAR";
      case BINARY -> "VARBINARY";
      case TIMESTAMP -> "TIMESTAMP";
      case DURATION -> "INTERVAL";
      case JSON -> "JSON";
    };
  }

  /**
   * Select-list expression bucketing the time column, aliased {@value #BUCKET_ALIAS} and grouped by
   * that alias. Empty when the dialect expresses windows as a separate clause.
   */
  protected Optional<String> bucketExpression(Window window, long intervalMs, String column) {
    return Optional.empty();
  }

  /** Leading select-list entries such as window pseudo columns. */
  protected List<String> leadingProjection(QueryPlan plan) {
    return List.of();
  }

  /** Clauses between WHERE and GROUP BY, such as INTERVAL or SAMPLE BY. */
  protected void appendWindowClauses(StringBuilder sql, QueryPlan plan) {
    // no window clauses by default
  }

  /**
   * GROUP BY entry for a grouping of the plan, or empty when the dialect expresses it elsewhere.
   * Time buckets are rendered by {@link #windowGrouping(QueryPlan)}.
   */
  protected Optional<String> groupItem(GroupByExpr expr, QueryPlan plan) {
    if (expr instanceof GroupByExpr.Column || expr instanceof GroupByExpr.Tag) {
      return columnName(expr).map(this::identifier);
    } else if (expr instanceof GroupByExpr.Expression expression) {
      return SQL_FAMILY.contains(plan.getSourceDialect())
          ? Optional.of(expression.text())
          : Optional.empty();
    } else if (expr instanceof GroupByExpr.TimeBucket || expr instanceof GroupByExpr.AllTags) {
      return Optional.empty();
    }
    throw new IllegalStateException("Unknown grouping: " + expr);
  }

  /** Leading GROUP BY entry for the time bucket, by default the bucket alias. */
  protected Optional<String> windowGrouping(QueryPlan plan) {
    return bucket(plan)
        .flatMap(bucket -> bucketExpression(bucket.window(), bucket.intervalMs(), bucket.column()))
        .map(expression -> BUCKET_ALIAS);
  }

  /** Clauses directly after GROUP BY, such as a trailing FILL. */
  protected void appendGroupByModifiers(StringBuilder sql, QueryPlan plan) {
    // none by default
  }

  /** Applies the window fill to an aggregated select-list expression. */
  protected String fillValue(String expression, QueryPlan plan) {
    return expression;
  }

  protected boolean supportsHaving() {
    return true;
  }

  /** Whether grouping columns are repeated in the select list. */
  protected boolean projectsGroupColumns() {
    return true;
  }

  protected void appendBounds(StringBuilder sql, Long limit, Long offset) {
    if (limit != null) {
      sql.append(" LIMIT ").append(limit);
    }
    if (offset != null) {
      sql.append(" OFFSET ").append(offset);
    }
  }

  // ============================================================================
  // Statement
  // ============================================================================

  @Override
  public String translate(QueryPlan plan) {
    String query = render(plan);
    log.debug("Built {} query: '{}'", targetDialect().getDisplayName(), query);
    return query;
  }

  protected String render(QueryPlan plan) {
    Ranking ranking = Ranking.of(plan, this);
    StringBuilder sql = new StringBuilder("SELECT ");
    if (plan.getHints().custom("distinct").filter("true"::equals).isPresent()) {
      sql.append("DISTINCT ");
    }
    sql.append(String.join(", ", projection(plan, ranking)));
    sql.append(" FROM ").append(source(plan));

    List<String> conditions = new ArrayList<>(timeConditions(plan));
    for (Filter filter : plan.getFilters()) {
      if (!FilterCondition.matchesAll(filter.condition())) {
        conditions.add(condition(filter.condition()));
      }
    }
    if (!conditions.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", conditions));
    }
    appendWindowClauses(sql, plan);

    List<String> groups = groupBy(plan);
    if (!groups.isEmpty()) {
      sql.append(" GROUP BY ").append(String.join(", ", groups));
    }
    appendGroupByModifiers(sql, plan);
    Optional<String> having = plan.getHints().custom("having");
    if (having.isPresent() && supportsHaving() && SQL_FAMILY.contains(plan.getSourceDialect())) {
      sql.append(" HAVING ").append(having.get());
    }

    List<String> order = orderBy(plan, ranking);
    if (!order.isEmpty()) {
      sql.append(" ORDER BY ").append(String.join(", ", order));
    }
    Long limit = plan.getLimit() != null ? plan.getLimit() : ranking.limit();
    appendBounds(sql, limit, plan.getOffset());
    return sql.toString();
  }

  // ============================================================================
  // Select list
  // ============================================================================

  private List<String> projection(QueryPlan plan, Ranking ranking) {
    List<String> items = new ArrayList<>(leadingProjection(plan));
    bucket(plan)
        .flatMap(bucket -> bucketExpression(bucket.window(), bucket.intervalMs(), bucket.column()))
        .ifPresent(expression -> items.add(expression + " AS " + BUCKET_ALIAS));
    if (projectsGroupColumns()) {
      for (GroupBy group : plan.getGroupBy()) {
        columnName(group.expr())
            .map(this::identifier)
            .filter(item -> !items.contains(item))
            .ifPresent(items::add);
      }
    }
    items.addAll(valueExpressions(plan, ranking));
    if (items.isEmpty()) {
      items.addAll(plainColumns(plan));
    }
    if (items.isEmpty()) {
      items.add("*");
    }
    return items;
  }

  private List<String> valueExpressions(QueryPlan plan, Ranking ranking) {
    List<String> items = new ArrayList<>();
    boolean composed = plan.getAggregations().stream().allMatch(a -> a.column() == null);
    String current = null;
    String currentAlias = null;

    for (Aggregation aggregation : plan.getAggregations()) {
      if (composed) {
        String argument = current != null ? current : defaultArgument(aggregation, plan);
        current = aggregationCall(aggregation, argument);
        currentAlias = aggregation.alias() != null ? aggregation.alias() : currentAlias;
      } else {
        String argument =
            aggregation.column() != null
                ? identifier(aggregation.column())
                : defaultArgument(aggregation, plan);
        items.add(
            aliased(fillValue(aggregationCall(aggregation, argument), plan), aggregation.alias()));
      }
    }
    if (current != null) {
      current = fillValue(current, plan);
    }

    for (Transformation transformation : plan.getTransformations()) {
      if (transformation.column() != null) {
        transform(transformation.type(), identifier(transformation.column()))
            .ifPresent(expression -> items.add(aliased(expression, transformation.alias())));
      } else {
        String argument = current != null ? current : identifier(valueColumn(plan));
        Optional<String> wrapped = transform(transformation.type(), argument);
        if (wrapped.isPresent()) {
          current = wrapped.get();
          currentAlias = transformation.alias() != null ? transformation.alias() : currentAlias;
        }
      }
    }

    if (current == null && ranking.approximated()) {
      current = identifier(valueColumn(plan));
    }
    if (current != null) {
      if (currentAlias == null && ranking.approximated() && !current.equals(DEFAULT_COLUMN)) {
        currentAlias = DEFAULT_COLUMN;
      }
      items.add(0, aliased(current, currentAlias));
    }
    return items;
  }

  private List<String> plainColumns(QueryPlan plan) {
    return plan.getHints()
        .custom("columns")
        .map(columns -> List.of(columns.split(",")))
        .orElse(List.of())
        .stream()
        .map(String::trim)
        .filter(column -> !column.isEmpty())
        .map(this::identifier)
        .collect(Collectors.toList());
  }

  private String defaultArgument(Aggregation aggregation, QueryPlan plan) {
    if (aggregation.function() == AggFunction.Basic.COUNT) {
      return "*";
    }
    return identifier(valueColumn(plan));
  }

  /** First plain column that is not a grouping column, or {@value #DEFAULT_COLUMN}. */
  protected String valueColumn(QueryPlan plan) {
    Set<String> grouped =
        plan.getGroupBy().stream()
            .map(group -> columnName(group.expr()))
            .flatMap(Optional::stream)
            .collect(Collectors.toSet());
    return plan.getHints()
        .custom("columns")
        .stream()
        .flatMap(columns -> List.of(columns.split(",")).stream())
        .map(String::trim)
        .filter(column -> !column.isEmpty() && !grouped.contains(column))
        .findFirst()
        .orElse(DEFAULT_COLUMN);
  }

  protected String aggregationCall(Aggregation aggregation, String argument) {
    AggFunction function = aggregation.function();
    if (function == AggFunction.Basic.COUNT_DISTINCT) {
      return "count(DISTINCT " + argument + ")";
    }
    if (function instanceof AggFunction.Basic basic) {
      String distinct = aggregation.distinct() ? "DISTINCT " : "";
      return functionName(basic) + "(" + distinct + argument + extraArguments(aggregation) + ")";
    } else if (function instanceof AggFunction.Percentile percentile) {
      return percentile(percentile.quantile(), argument);
    } else if (function instanceof AggFunction.Apercentile apercentile) {
      return approximatePercentile(apercentile.quantile(), argument);
    } else if (function instanceof AggFunction.HistogramQuantile histogram) {
      return "histogram_quantile(" + number(histogram.quantile()) + ", " + argument + ")";
    } else if (function instanceof AggFunction.TopK || function instanceof AggFunction.BottomK) {
      return ranking(function, argument).orElse(argument);
    } else if (function instanceof AggFunction.Sample sample) {
      return "sample(" + argument + ", " + sample.n() + ")";
    } else if (function instanceof AggFunction.Custom custom) {
      return custom.name() + "(" + argument + extraArguments(aggregation) + ")";
    }
    throw new IllegalStateException("Unknown aggregate function: " + function);
  }

  private String extraArguments(Aggregation aggregation) {
    if (aggregation.args().isEmpty()) {
      return "";
    }
    return ", " + aggregation.args().stream().map(this::literal).collect(Collectors.joining(", "));
  }

  /** Wraps {@code argument} in the transformation, or empty when it has no SQL form. */
  protected Optional<String> transform(TransformType type, String argument) {
    if (type instanceof TransformType.Basic basic) {
      return Optional.of(basic.name().toLowerCase(Locale.ROOT) + "(" + argument + ")");
    } else if (type instanceof TransformType.Round round) {
      return Optional.of(
          "round(" + argument + (round.digits() != null ? ", " + round.digits() : "") + ")");
    } else if (type instanceof TransformType.Log log) {
      if (log.base() == null) {
        return Optional.of("ln(" + argument + ")");
      }
      if (log.base() == 10.0) {
        return Optional.of("log10(" + argument + ")");
      }
      return Optional.of("log(" + argument + ", " + number(log.base()) + ")");
    } else if (type instanceof TransformType.Pow pow) {
      return Optional.of("power(" + argument + ", " + number(pow.exponent()) + ")");
    } else if (type instanceof TransformType.Derivative derivative) {
      String name = derivative.nonNegative() ? "non_negative_derivative" : "derivative";
      return Optional.of(name + "(" + argument + ")");
    } else if (type instanceof TransformType.Difference difference) {
      String name = difference.nonNegative() ? "non_negative_difference" : "difference";
      return Optional.of(name + "(" + argument + ")");
    } else if (type instanceof TransformType.MovingAverage average) {
      return Optional.of("moving_average(" + argument + ", " + average.points() + ")");
    } else if (type instanceof TransformType.Elapsed) {
      return Optional.of("elapsed(" + argument + ")");
    } else if (type instanceof TransformType.Cast cast) {
      return Optional.of("CAST(" + argument + " AS " + sqlType(cast.type()) + ")");
    } else if (type instanceof TransformType.Custom custom) {
      String extra =
          custom.args().stream().map(value -> ", " + literal(value)).collect(Collectors.joining());
      return Optional.of(custom.name() + "(" + argument + extra + ")");
    } else if (type instanceof TransformType.Fill
        || type instanceof TransformType.LabelReplace
        || type instanceof TransformType.LabelJoin) {
      return Optional.empty();
    }
    throw new IllegalStateException("Unknown transformation: " + type);
  }

  // ============================================================================
  // FROM
  // ============================================================================

  private String source(QueryPlan plan) {
    Optional<DataSource> primary = plan.primarySource();
    if (primary.isEmpty() || primary.get().name() == null) {
      return identifier(DEFAULT_SOURCE);
    }
    DataSource source = primary.get();
    if (source.kind() instanceof SourceKind.Subquery subquery) {
      String alias = source.alias() != null ? source.alias() : source.name();
      return "(" + render(subquery.plan()) + ") AS " + identifier(alias);
    }
    StringBuilder reference = new StringBuilder();
    if (source.database() != null) {
      reference.append(identifier(source.database())).append('.');
      if (source.retentionPolicy() != null) {
        reference.append(identifier(source.retentionPolicy())).append('.');
      }
    }
    reference.append(identifier(source.name()));
    if (source.alias() != null && !source.alias().equals(source.name())) {
      reference.append(" AS ").append(identifier(source.alias()));
    }
    return reference.toString();
  }

  // ============================================================================
  // WHERE
  // ============================================================================

  private List<String> timeConditions(QueryPlan plan) {
    String column = identifier(timeColumn());
    TimeRange range = plan.getTimeRange();
    if (range == null) {
      return lookBack(plan)
          .map(durationMs -> List.of(column + " >= " + relativeStart(durationMs)))
          .orElse(List.of());
    }
    if (range instanceof TimeRange.Relative relative) {
      if (relative.anchorMs() == null) {
        return List.of(column + " >= " + relativeStart(relative.durationMs()));
      }
      return List.of(
          column + " >= " + timestampLiteral(relative.anchorMs() - relative.durationMs()),
          column + " < " + timestampLiteral(relative.anchorMs()));
    } else if (range instanceof TimeRange.Absolute absolute) {
      return List.of(
          column + " >= " + timestampLiteral(absolute.startMs()),
          column + " < " + timestampLiteral(absolute.endMs()));
    } else if (range instanceof TimeRange.Since since) {
      return List.of(column + " >= " + timestampLiteral(since.startMs()));
    } else if (range instanceof TimeRange.Until until) {
      return List.of(column + " < " + timestampLiteral(until.endMs()));
    }
    throw new IllegalStateException("Unknown time range: " + range);
  }

  private static Optional<Long> lookBack(QueryPlan plan) {
    return plan.getWindows().stream()
        .map(Window::kind)
        .filter(WindowKind.Range.class::isInstance)
        .map(kind -> ((WindowKind.Range) kind).durationMs())
        .findFirst();
  }

  protected String condition(FilterCondition condition) {
    if (condition instanceof FilterCondition.Comparison comparison) {
      return identifier(comparison.column())
          + " "
          + comparison.op().getSymbol()
          + " "
          + literal(comparison.value());
    } else if (condition instanceof FilterCondition.Regex regex) {
      return regexCondition(identifier(regex.column()), regex.pattern(), regex.negated());
    } else if (condition instanceof FilterCondition.In in) {
      String values =
          in.values().isEmpty()
              ? "NULL"
              : in.values().stream().map(this::literal).collect(Collectors.joining(", "));
      return identifier(in.column()) + (in.negated() ? " NOT IN (" : " IN (") + values + ")";
    } else if (condition instanceof FilterCondition.Between between) {
      return identifier(between.column())
          + (between.negated() ? " NOT BETWEEN " : " BETWEEN ")
          + literal(between.low())
          + " AND "
          + literal(between.high());
    } else if (condition instanceof FilterCondition.IsNull isNull) {
      return identifier(isNull.column()) + (isNull.negated() ? " IS NOT NULL" : " IS NULL");
    } else if (condition instanceof FilterCondition.And and) {
      if (and.conditions().isEmpty()) {
        return "TRUE";
      }
      return and.conditions().stream().map(this::condition).collect(Collectors.joining(" AND "));
    } else if (condition instanceof FilterCondition.Or or) {
      if (or.conditions().isEmpty()) {
        return "FALSE";
      }
      return "("
          + or.conditions().stream()
              .map(
                  child ->
                      child instanceof FilterCondition.And
                          ? "(" + condition(child) + ")"
                          : condition(child))
              .collect(Collectors.joining(" OR "))
          + ")";
    } else if (condition instanceof FilterCondition.Not not) {
      return "NOT (" + condition(not.condition()) + ")";
    }
    throw new IllegalStateException("Unknown filter condition: " + condition);
  }

  // ============================================================================
  // GROUP BY, ORDER BY
  // ============================================================================

  private List<String> groupBy(QueryPlan plan) {
    List<String> items = new ArrayList<>();
    windowGrouping(plan).ifPresent(items::add);
    for (GroupBy group : plan.getGroupBy()) {
      groupItem(group.expr(), plan).filter(item -> !items.contains(item)).ifPresent(items::add);
    }
    return items;
  }

  private List<String> orderBy(QueryPlan plan, Ranking ranking) {
    List<String> items = new ArrayList<>();
    for (OrderBy order : plan.getOrderBy()) {
      StringBuilder item = new StringBuilder(identifier(order.column()));
      item.append(order.ascending() ? " ASC" : " DESC");
      if (order.nullsFirst() != null) {
        item.append(order.nullsFirst() ? " NULLS FIRST" : " NULLS LAST");
      }
      items.add(item.toString());
    }
    if (items.isEmpty() && ranking.approximated()) {
      items.add(DEFAULT_COLUMN + (ranking.descending() ? " DESC" : " ASC"));
    }
    return items;
  }

  // ============================================================================
  // Shared helpers
  // ============================================================================

  /** Time bucket implied by an interval window, or by a time-bucket grouping without one. */
  protected Optional<Bucket> bucket(QueryPlan plan) {
    String column =
        plan.getGroupBy().stream()
            .map(GroupBy::expr)
            .filter(GroupByExpr.TimeBucket.class::isInstance)
            .map(expr -> ((GroupByExpr.TimeBucket) expr).column())
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(timeColumn());
    for (Window window : plan.getWindows()) {
      if (window.kind() instanceof WindowKind.Interval interval) {
        return Optional.of(new Bucket(window, interval.durationMs(), column));
      }
      if (window.kind() instanceof WindowKind.SampleBy sample) {
        return Optional.of(new Bucket(window, sample.intervalMs(), column));
      }
    }
    return plan.getGroupBy().stream()
        .map(GroupBy::expr)
        .filter(GroupByExpr.TimeBucket.class::isInstance)
        .map(expr -> (GroupByExpr.TimeBucket) expr)
        .findFirst()
        .map(
            timeBucket ->
                new Bucket(
                    Window.of(WindowKind.Interval.of(timeBucket.intervalMs())),
                    timeBucket.intervalMs(),
                    column));
  }

  protected static Optional<String> columnName(GroupByExpr expr) {
    if (expr instanceof GroupByExpr.Column column) {
      return Optional.of(column.name());
    }
    if (expr instanceof GroupByExpr.Tag tag) {
      return Optional.of(tag.name());
    }
    return Optional.empty();
  }

  /** Quotes an identifier unless it is a plain, non-reserved name. */
  protected String identifier(String name) {
    if (name.equals("*")
        || (PLAIN_IDENTIFIER.matcher(name).matches()
            && !RESERVED_WORDS.contains(name.toLowerCase(Locale.ROOT)))) {
      return name;
    }
    char quote = identifierQuote();
    return quote + name.replace(String.valueOf(quote), "\\" + quote) + quote;
  }

  protected String literal(Value value) {
    if (value instanceof Value.StringValue string) {
      return quote(string.value());
    } else if (value instanceof Value.NullValue) {
      return "NULL";
    } else if (value instanceof Value.BoolValue bool) {
      return bool.value() ? "TRUE" : "FALSE";
    } else if (value instanceof Value.IntValue integer) {
      return integer.text();
    } else if (value instanceof Value.FloatValue floating) {
      return Double.isFinite(floating.value()) ? floating.text() : quote(floating.text());
    } else if (value instanceof Value.TimestampValue timestamp) {
      return timestampLiteral(timestamp.epochMs());
    } else if (value instanceof Value.DurationValue duration) {
      return formatDuration(duration.durationMs());
    } else if (value instanceof Value.ArrayValue array) {
      return array.values().stream()
          .map(this::literal)
          .collect(Collectors.joining(", ", "(", ")"));
    }
    throw new IllegalStateException("Unknown value: " + value);
  }

  protected static String quote(String text) {
    return "'" + text.replace("'", "''") + "'";
  }

  protected static String number(double value) {
    return Value.of(value).text();
  }

  private String aliased(String expression, String alias) {
    return alias == null ? expression : expression + " AS " + identifier(alias);
  }

  /** Window rendered as a time bucket of {@code intervalMs} over {@code column}. */
  protected record Bucket(Window window, long intervalMs, String column) {}

  /** Top-k or bottom-k selection approximated by ORDER BY and LIMIT. */
  private record Ranking(boolean approximated, boolean descending, Long limit) {

    static Ranking of(QueryPlan plan, AbstractSqlTranslator translator) {
      for (Aggregation aggregation : plan.getAggregations()) {
        AggFunction function = aggregation.function();
        if (translator.ranking(function, DEFAULT_COLUMN).isPresent()) {
          continue;
        }
        if (function instanceof AggFunction.TopK top) {
          return new Ranking(true, true, (long) top.k());
        }
        if (function instanceof AggFunction.BottomK bottom) {
          return new Ranking(true, false, (long) bottom.k());
        }
      }
      return new Ranking(false, false, null);
    }
  }
}
