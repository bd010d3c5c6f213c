package com.evoila.rosetta.flux;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

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
import com.evoila.rosetta.common.plan.OrderBy;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.SourceKind;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.TransformType;
import com.evoila.rosetta.common.plan.Transformation;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("FluxParser Tests")
class FluxParserTest {

  private final FluxParser parser = new FluxParser();

  @Nested
  @DisplayName("Pipelines")
  class Pipelines {

    @Test
    void shouldParseWindowedMean() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\") |> range(start: -1h)"
                  + " |> filter(fn: (r) => r._measurement == \"cpu\")"
                  + " |> aggregateWindow(every: 5m, fn: mean)");

      assertThat(plan.getTimeRange()).isEqualTo(TimeRange.Relative.of(3600000));
      assertThat(plan.getSources())
          .containsExactly(new DataSource("cpu", "b", null, null, SourceKind.Basic.MEASUREMENT));
      assertThat(plan.getDatabase()).isEqualTo("b");
      assertThat(plan.getWindows()).containsExactly(Window.of(WindowKind.Interval.of(300000)));
      assertThat(plan.getAggregations())
          .extracting(Aggregation::function)
          .containsExactly(AggFunction.Basic.AVG);
      assertThat(plan.getFilters()).isEmpty();
      assertThat(plan.getSourceDialect()).isEqualTo(Dialect.FLUX);
    }

    @Test
    void shouldUseBucketAsSourceWithoutMeasurement() {
      QueryPlan plan = parser.parse("from(bucket: \"metrics\") |> range(start: -15m)");

      assertThat(plan.getSources())
          .containsExactly(
              new DataSource("metrics", "metrics", null, null, SourceKind.Basic.TABLE));
      assertThat(plan.getTimeRange()).isEqualTo(TimeRange.Relative.of(900000));
    }

    @Test
    void shouldParseAbsoluteRange() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\")"
                  + " |> range(start: 2024-01-01T00:00:00Z, stop: 2024-01-01T01:00:00Z)");

      assertThat(plan.getTimeRange())
          .isEqualTo(new TimeRange.Absolute(1704067200000L, 1704070800000L));
    }

    @Test
    void shouldParseOpenEndedAbsoluteRange() {
      QueryPlan plan = parser.parse("from(bucket: \"b\") |> range(start: 2024-01-01T00:00:00Z)");

      assertThat(plan.getTimeRange()).isEqualTo(new TimeRange.Since(1704067200000L));
    }

    @Test
    void shouldMapGroupSortAndLimit() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\") |> range(start: -1h)"
                  + " |> group(columns: [\"host\", \"region\"])"
                  + " |> sort(columns: [\"_value\"], desc: true)"
                  + " |> limit(n: 10, offset: 5)");

      assertThat(plan.getGroupBy()).containsExactly(GroupBy.tag("host"), GroupBy.tag("region"));
      assertThat(plan.getOrderBy()).containsExactly(new OrderBy("_value", false, null));
      assertThat(plan.getLimit()).isEqualTo(10L);
      assertThat(plan.getOffset()).isEqualTo(5L);
    }

    @Test
    void shouldKeepUnmappedStagesAsHints() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\") |> range(start: -1h)"
                  + " |> map(fn: (r) => ({r with v: r._value * 2}))"
                  + " |> yield(name: \"doubled\")");

      assertThat(plan.getHints().getCustom())
          .containsEntry("yield", "doubled")
          .hasEntrySatisfying("stage", stage -> assertThat(stage).startsWith("map("));
    }
  }

  @Nested
  @DisplayName("Filters")
  class Filters {

    @Test
    void shouldAbsorbMeasurementAndFieldPredicates() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\") |> range(start: -1h)"
                  + " |> filter(fn: (r) => r._measurement == \"cpu\" and r._field == \"usage\""
                  + " and r.host == \"web01\")");

      assertThat(plan.primarySource()).map(DataSource::name).contains("cpu");
      assertThat(plan.getHints().getCustom()).containsEntry("columns", "usage");
      assertThat(plan.getFilters())
          .containsExactly(
              Filter.of(
                  new FilterCondition.Comparison("host", ComparisonOp.EQ, Value.of("web01"))));
    }

    @Test
    void shouldCollectAlternativeFields() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\") |> range(start: -1h)"
                  + " |> filter(fn: (r) => r._field == \"rx\" or r._field == \"tx\")");

      assertThat(plan.getHints().getCustom()).containsEntry("columns", "rx,tx");
      assertThat(plan.getFilters()).isEmpty();
    }

    @Test
    void shouldNormalizeBracketAccessAndRegex() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\") |> range(start: -1h)"
                  + " |> filter(fn: (r) => r[\"host\"] =~ /web.*/)");

      assertThat(plan.getFilters())
          .containsExactly(Filter.of(new FilterCondition.Regex("host", "web.*", false)));
    }

    @Test
    void shouldReadRegexLiteralContainingQuotesAndBrackets() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\") |> range(start: -1h)"
                  + " |> filter(fn: (r) => r.host =~ /a\"b(|>/ and r.dc !~ /x'y,z)/)");

      assertThat(plan.getFilters())
          .containsExactly(
              Filter.of(
                  new FilterCondition.And(
                      List.of(
                          new FilterCondition.Regex("host", "a\"b(|>", false),
                          new FilterCondition.Regex("dc", "x'y,z)", true)))));
    }

    @Test
    void shouldRoundTripRegexContainingQuote() {
      String query =
          "from(bucket: \"b\") |> range(start: -1h) |> filter(fn: (r) => r.host =~ /a\"b/)";

      QueryPlan plan = parser.parse(new FluxTranslator().translate(parser.parse(query)));

      assertThat(plan.getFilters())
          .containsExactly(Filter.of(new FilterCondition.Regex("host", "a\"b", false)));
    }

    @Test
    void shouldKeepUnsupportedPredicateAsHint() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\") |> range(start: -1h)"
                  + " |> filter(fn: (r) => r._value > r.threshold)");

      assertThat(plan.getFilters()).isEmpty();
      assertThat(plan.getHints().getCustom()).containsEntry("filter", "r._value > r.threshold");
    }
  }

  @Nested
  @DisplayName("Functions")
  class Functions {

    @Test
    void shouldFillWindowWithPreviousValue() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\") |> range(start: -1h)"
                  + " |> aggregateWindow(every: 1m, fn: max, createEmpty: true)"
                  + " |> fill(usePrevious: true)");

      assertThat(plan.getWindows())
          .containsExactly(new Window(WindowKind.Interval.of(60000), FillStrategy.Basic.PREVIOUS));
    }

    @Test
    void shouldTurnFillWithoutWindowIntoTransformation() {
      QueryPlan plan = parser.parse("from(bucket: \"b\") |> range(start: -1h) |> fill(value: 0)");

      assertThat(plan.getTransformations())
          .containsExactly(
              Transformation.of(
                  new TransformType.Fill(new FillStrategy.Constant(Value.of(0L)))));
    }

    @Test
    void shouldMapSelectorsAndTransformations() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\") |> range(start: -1h)"
                  + " |> derivative(unit: 1s, nonNegative: true)"
                  + " |> quantile(q: 0.99, column: \"_value\")"
                  + " |> top(n: 5)");

      assertThat(plan.getTransformations())
          .containsExactly(Transformation.of(new TransformType.Derivative(1000L, true)));
      assertThat(plan.getAggregations())
          .containsExactly(
              Aggregation.of(new AggFunction.Percentile(0.99), "_value"),
              Aggregation.of(new AggFunction.TopK(5)));
    }

    @Test
    void shouldMapUnknownAggregateWindowFunctionToCustom() {
      QueryPlan plan =
          parser.parse(
              "from(bucket: \"b\") |> range(start: -1h) |> aggregateWindow(every: 1h, fn: skew)");

      assertThat(plan.getAggregations())
          .extracting(Aggregation::function)
          .containsExactly(new AggFunction.Custom("skew"));
    }
  }

  @Nested
  @DisplayName("Errors")
  class Errors {

    @ParameterizedTest
    @ValueSource(
        strings = {
          "range(start: -1h)",
          "from(host: \"x\")",
          "from(bucket: \"b\") |> range(stop: now())",
          "from(bucket: \"b\") |> range(start: 1h)",
          "from(bucket: \"b\") |> filter(fn: r._value > 1)",
          "from(bucket: \"b\") |> limit(10)",
          "from(bucket: \"b\") |> limit(n: -1)",
          "from(bucket: \"b\") |> aggregateWindow(fn: mean)",
          "from(bucket: \"b\") |> 42",
          "from(bucket: \"b\") |> range(start: -1h"
        })
    void shouldRejectInvalidPipelines(String query) {
      assertThatThrownBy(() -> parser.parse(query)).isInstanceOf(QueryParseException.class);
    }
  }
}
