package com.evoila.rosetta.common.dialect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.exception.QueryTranslationException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import com.evoila.rosetta.graphite.GraphiteParser;
import com.evoila.rosetta.influxql.InfluxQlTranslator;
import com.evoila.rosetta.promql.PromQlParser;
import com.evoila.rosetta.sql.SqlParser;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("DialectRegistry Tests")
class DialectRegistryTest {

  private final DialectRegistry registry = DialectRegistry.shared();

  @Nested
  @DisplayName("Registration")
  class Registration {

    @Test
    void shouldLoadEveryDialectFromServiceRegistrations() {
      assertThat(registry.supportedDialects()).containsExactlyInAnyOrder(Dialect.values());
      assertThat(registry.translationTargets())
          .containsExactlyInAnyOrder(
              Dialect.INFLUXQL,
              Dialect.FLUX,
              Dialect.PROMQL,
              Dialect.METRICSQL,
              Dialect.TDENGINE,
              Dialect.TIMESCALEDB,
              Dialect.QUESTDB,
              Dialect.CLICKHOUSE,
              Dialect.SQL);
    }

    @Test
    void shouldReturnSameSharedInstance() {
      assertThat(DialectRegistry.shared()).isSameAs(registry);
    }

    @Test
    void shouldLookUpParsersAndTranslatorsByDialect() {
      assertThat(registry.findParser(Dialect.GRAPHITE))
          .get()
          .isInstanceOf(GraphiteParser.class);
      assertThat(registry.findTranslator(Dialect.INFLUXQL))
          .get()
          .isInstanceOf(InfluxQlTranslator.class);
      assertThat(registry.findTranslator(Dialect.OPENTSDB)).isEmpty();
    }

    @Test
    void shouldRejectDuplicateParsers() {
      List<DialectParser> parsers = List.of(new PromQlParser(), new PromQlParser());

      assertThatThrownBy(() -> new DialectRegistry(parsers, List.of(), null))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("Duplicate parser for dialect promql");
    }

    @Test
    void shouldRejectDuplicateTranslators() {
      List<DialectTranslator> translators =
          List.of(new InfluxQlTranslator(), new InfluxQlTranslator());

      assertThatThrownBy(() -> new DialectRegistry(List.of(), translators, null))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("Duplicate translator for dialect influxql");
    }

    @Test
    void shouldApplyParserLimitsOfRegisteredParsers() {
      DialectRegistry limited =
          new DialectRegistry(
              List.of(new GraphiteParser(new ParserLimits(3, 60))), List.of(), null);

      assertThat(limited.parse(Dialect.GRAPHITE, "sumSeries(scale(a.b, 2))").getAggregations())
          .containsExactly(Aggregation.of(AggFunction.Basic.SUM));
      String nested = "sumSeries(scale(absolute(offset(a.b, 1)), 2))";
      assertThatThrownBy(() -> limited.parse(Dialect.GRAPHITE, nested))
          .isInstanceOf(QueryParseException.class)
          .hasMessageContaining("maximum depth of 3");
      assertThatThrownBy(() -> limited.parse(Dialect.GRAPHITE, "a.b." + "c".repeat(60)))
          .isInstanceOf(QueryParseException.class)
          .hasMessageContaining("Query too long");
    }
  }

  @Nested
  @DisplayName("Parsing")
  class Parsing {

    @Test
    void shouldParseInfluxQlWindowedMean() {
      ParsedQuery parsed =
          registry.parseAutoWithConfidence(
              "SELECT mean(\"value\") FROM \"cpu\" WHERE time > now() - 1h GROUP BY time(5m)"
                  + " FILL(null)");

      assertThat(parsed.dialect()).isEqualTo(Dialect.INFLUXQL);
      assertThat(parsed.confidence()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
      QueryPlan plan = parsed.plan();
      assertThat(plan.getSources()).extracting(DataSource::name).containsExactly("cpu");
      assertThat(plan.getAggregations())
          .extracting(Aggregation::function)
          .containsExactly(AggFunction.Basic.AVG);
      assertThat(plan.getTimeRange()).isEqualTo(TimeRange.Relative.of(3600000));
      assertThat(plan.getWindows())
          .containsExactly(new Window(WindowKind.Interval.of(300000), FillStrategy.Basic.NULL));
    }

    @Test
    void shouldParsePrometheusSelector() {
      QueryPlan plan = registry.parseAuto("rate(http_requests_total{job=\"api\"}[5m])");

      assertThat(plan.getSourceDialect()).isEqualTo(Dialect.PROMQL);
      assertThat(plan.getSources())
          .extracting(DataSource::name)
          .containsExactly("http_requests_total");
      assertThat(plan.getFilters()).containsExactly(Filter.eq("job", "api"));
      assertThat(plan.getAggregations())
          .extracting(Aggregation::function)
          .containsExactly(AggFunction.Basic.RATE);
      assertThat(plan.getWindows()).containsExactly(Window.of(new WindowKind.Range(300000)));
    }

    @Test
    void shouldDetectClickHouseExtension() {
      ParsedQuery parsed =
          registry.parseAutoWithConfidence(
              "SELECT toStartOfHour(timestamp) AS hour, count() FROM events GROUP BY hour"
                  + " WITH TOTALS");

      assertThat(parsed.dialect()).isEqualTo(Dialect.CLICKHOUSE);
      assertThat(parsed.plan().getSources()).extracting(DataSource::name).containsExactly("events");
    }

    @Test
    void shouldParseFluxPipeline() {
      QueryPlan plan =
          registry.parseAuto(
              "from(bucket: \"b\") |> range(start: -1h)"
                  + " |> filter(fn: (r) => r._measurement == \"cpu\")"
                  + " |> aggregateWindow(every: 5m, fn: mean)");

      assertThat(plan.getTimeRange()).isEqualTo(TimeRange.Relative.of(3600000));
      assertThat(plan.getSources()).extracting(DataSource::name).containsExactly("cpu");
      assertThat(plan.getWindows()).containsExactly(Window.of(WindowKind.Interval.of(300000)));
      assertThat(plan.getAggregations())
          .extracting(Aggregation::function)
          .containsExactly(AggFunction.Basic.AVG);
    }

    @Test
    void shouldRejectDialectWithoutParser() {
      DialectRegistry sqlOnly = new DialectRegistry(List.of(new SqlParser()), List.of(), null);

      assertThatThrownBy(() -> sqlOnly.parse(Dialect.GRAPHITE, "a.b"))
          .isInstanceOf(QueryParseException.class)
          .hasMessage("Unsupported dialect: graphite");
    }
  }

  @Nested
  @DisplayName("Translation")
  class Translation {

    @Test
    void shouldTranslateCounterRateToInfluxQl() {
      String query =
          registry.translateQuery(
              "rate(http_requests_total{job=\"api\"}[5m])", Dialect.PROMQL, Dialect.INFLUXQL);

      assertThat(query).contains("derivative(").contains("FROM \"http_requests_total\"");
    }

    @Test
    void shouldAutoDetectSourceDialect() {
      String query =
          registry.translateQuery(
              "SELECT mean(\"value\") FROM \"cpu\" WHERE time > now() - 1h GROUP BY time(5m)",
              Dialect.PROMQL);

      assertThat(query).isEqualTo("avg_over_time(cpu[5m])");
    }

    @Test
    void shouldReportMissingTranslator() {
      QueryPlan plan = QueryPlan.builder().source(DataSource.metric("up")).build();

      assertThatThrownBy(() -> registry.translate(plan, Dialect.GRAPHITE))
          .isInstanceOf(QueryTranslationException.class)
          .hasMessage("No translator for dialect: graphite")
          .satisfies(
              e ->
                  assertThat(((QueryTranslationException) e).getUnsupportedFeature())
                      .contains("graphite"));
    }

    @Test
    void shouldWrapParseFailures() {
      assertThatThrownBy(
              () -> registry.translateQuery("sum(rate(x[5m]", Dialect.PROMQL, Dialect.SQL))
          .isInstanceOf(QueryTranslationException.class)
          .hasMessageStartingWith("Parse error: ")
          .hasCauseInstanceOf(QueryParseException.class);
    }

    @ParameterizedTest
    @EnumSource(
        value = Dialect.class,
        names = {"INFLUXQL", "TDENGINE", "TIMESCALEDB", "QUESTDB", "CLICKHOUSE", "SQL"})
    void shouldReparseQuotedSourceName(Dialect dialect) {
      QueryPlan plan =
          QueryPlan.builder().source(DataSource.table("weird name-with.dots")).build();

      QueryPlan reparsed = registry.parse(dialect, registry.translate(plan, dialect));

      assertThat(reparsed.getSources())
          .extracting(DataSource::name)
          .containsExactly("weird name-with.dots");
    }

    @ParameterizedTest
    @EnumSource(
        value = Dialect.class,
        names = {
          "INFLUXQL", "FLUX", "PROMQL", "METRICSQL", "TDENGINE", "TIMESCALEDB", "QUESTDB",
          "CLICKHOUSE", "SQL"
        })
    void shouldReparseOwnRendering(Dialect dialect) {
      QueryPlan plan =
          QueryPlan.builder()
              .source(DataSource.measurement("cpu"))
              .timeRange(TimeRange.Relative.of(3600000))
              .aggregation(Aggregation.of(AggFunction.Basic.AVG, "usage"))
              .window(Window.of(WindowKind.Interval.of(300000)))
              .build();

      String rendered = registry.translate(plan, dialect);
      QueryPlan reparsed = registry.parse(dialect, rendered);

      assertThat(reparsed.getSources()).extracting(DataSource::name).containsExactly("cpu");
      assertThat(reparsed.getAggregations()).isNotEmpty();
      assertThat(reparsed.getSourceDialect()).isEqualTo(dialect);
    }
  }
}
