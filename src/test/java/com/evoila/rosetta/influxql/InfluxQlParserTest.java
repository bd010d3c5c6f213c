package com.evoila.rosetta.influxql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.AggFunction;
import com.evoila.rosetta.common.plan.Aggregation;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.FillStrategy;
import com.evoila.rosetta.common.plan.Filter;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.GroupBy;
import com.evoila.rosetta.common.plan.QueryPlan;
import com.evoila.rosetta.common.plan.SourceKind;
import com.evoila.rosetta.common.plan.TimeRange;
import com.evoila.rosetta.common.plan.Value;
import com.evoila.rosetta.common.plan.Window;
import com.evoila.rosetta.common.plan.WindowKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InfluxQlParser Tests")
class InfluxQlParserTest {

  private final InfluxQlParser parser = new InfluxQlParser();

  @Nested
  @DisplayName("SELECT statements")
  class Select {

    @Test
    void shouldParseQuotedNamesWithWhitespace() {
      QueryPlan plan =
          parser.parse("SELECT mean(\"usage idle\") FROM \"cpu load\" WHERE time > now() - 1h");

      assertThat(plan.getSources()).containsExactly(DataSource.measurement("cpu load"));
      assertThat(plan.getAggregations())
          .containsExactly(Aggregation.of(AggFunction.Basic.AVG, "usage idle"));
    }

    @Test
    void shouldParseWindowedMean() {
      QueryPlan plan =
          parser.parse(
              "SELECT mean(\"value\") FROM \"cpu\" WHERE time > now() - 1h"
                  + " GROUP BY time(5m) FILL(null)");

      assertThat(plan.getSources()).containsExactly(DataSource.measurement("cpu"));
      assertThat(plan.getAggregations())
          .containsExactly(Aggregation.of(AggFunction.Basic.AVG, "value"));
      assertThat(plan.getTimeRange()).isEqualTo(new TimeRange.Relative(3600000, null));
      assertThat(plan.getWindows())
          .containsExactly(new Window(WindowKind.Interval.of(300000), FillStrategy.Basic.NULL));
      assertThat(plan.getSourceDialect()).isEqualTo(Dialect.INFLUXQL);
    }

    @Test
    void shouldSplitTimeBucketFromTagGroups() {
      QueryPlan plan =
          parser.parse(
              "SELECT max(usage) FROM cpu WHERE host =~ /web.*/ GROUP BY time(1m, 15s), host");

      assertThat(plan.getWindows())
          .containsExactly(Window.of(new WindowKind.Interval(60000, 15000L, null)));
      assertThat(plan.getGroupBy()).containsExactly(GroupBy.tag("host"));
      assertThat(plan.getFilters())
          .containsExactly(Filter.of(new FilterCondition.Regex("host", "web.*", false)));
    }

    @Test
    void shouldGroupByAllTags() {
      QueryPlan plan = parser.parse("SELECT last(value) FROM mem GROUP BY *");

      assertThat(plan.getGroupBy()).containsExactly(GroupBy.allTags());
    }

    @Test
    void shouldParseQualifiedMeasurement() {
      QueryPlan plan = parser.parse("SELECT value FROM \"telegraf\".\"autogen\".\"cpu\"");

      assertThat(plan.getSources())
          .containsExactly(
              new DataSource("cpu", "telegraf", "autogen", null, SourceKind.Basic.MEASUREMENT));
      assertThat(plan.getDatabase()).isEqualTo("telegraf");
      assertThat(plan.getHints().getCustom()).containsEntry("columns", "value");
    }

    @Test
    void shouldKeepRegexMeasurement() {
      QueryPlan plan = parser.parse("SELECT * FROM /cpu.*/");

      assertThat(plan.getSources()).containsExactly(DataSource.measurement("/cpu.*/"));
    }

    @Test
    void shouldMapNestedDerivative() {
      QueryPlan plan =
          parser.parse(
              "SELECT non_negative_derivative(mean(bytes), 1s) FROM net GROUP BY time(1m)");

      assertThat(plan.getAggregations())
          .extracting(Aggregation::function)
          .containsExactly(AggFunction.Basic.AVG, AggFunction.Basic.RATE);
      assertThat(plan.getAggregations()).extracting(Aggregation::column).containsOnly("bytes");
    }

    @Test
    void shouldParseCountDistinct() {
      QueryPlan plan = parser.parse("SELECT count(distinct(host)) FROM cpu");

      assertThat(plan.getAggregations())
          .containsExactly(
              new Aggregation(AggFunction.Basic.COUNT_DISTINCT, "host", List.of(), null, true));
    }

    @Test
    void shouldApplyConstantFill() {
      QueryPlan plan = parser.parse("SELECT sum(v) FROM m GROUP BY time(10s) fill(0)");

      assertThat(plan.primaryWindow())
          .map(Window::fill)
          .contains(new FillStrategy.Constant(Value.of(0L)));
    }

    @Test
    void shouldParseAbsoluteTimeBounds() {
      QueryPlan plan =
          parser.parse(
              "SELECT v FROM m WHERE time >= '2024-01-01T00:00:00Z' AND time < 1704070800s");

      assertThat(plan.getTimeRange())
          .isEqualTo(new TimeRange.Absolute(1704067200000L, 1704070800000L));
    }

    @Test
    void shouldRecordSeriesLimitsAndTimezone() {
      QueryPlan plan =
          parser.parse("SELECT mean(v) FROM m GROUP BY host LIMIT 10 SLIMIT 3 TZ('Europe/Berlin')");

      assertThat(plan.getLimit()).isEqualTo(10L);
      assertThat(plan.getHints().getCustom())
          .containsEntry("slimit", "3")
          .containsEntry("tz", "Europe/Berlin");
    }
  }

  @Nested
  @DisplayName("Other statements")
  class OtherStatements {

    @Test
    void shouldReadShowMeasurementsFromSystemSource() {
      QueryPlan plan = parser.parse("SHOW MEASUREMENTS ON telegraf");

      assertThat(plan.getSources()).containsExactly(DataSource.measurement("_measurements"));
      assertThat(plan.getDatabase()).isEqualTo("telegraf");
      assertThat(plan.getHints().getCustom()).containsEntry("statement", "SHOW");
    }

    @Test
    void shouldRecordMeasurementOfShowTagKeys() {
      QueryPlan plan = parser.parse("SHOW TAG KEYS FROM \"cpu\"");

      assertThat(plan.getSources()).containsExactly(DataSource.measurement("_tag_keys"));
      assertThat(plan.getHints().getCustom()).containsEntry("measurement", "cpu");
    }

    @Test
    void shouldAcceptDeleteStatement() {
      QueryPlan plan = parser.parse("DELETE FROM cpu WHERE time < '2020-01-01'");

      assertThat(plan.getHints().getCustom()).containsEntry("statement", "DELETE");
      assertThat(plan.primarySource()).map(DataSource::name).contains("cpu");
    }

    @Test
    void shouldRejectUnsupportedStatement() {
      assertThatThrownBy(() -> parser.parse("INSERT cpu value=1"))
          .isInstanceOf(QueryParseException.class)
          .hasMessageContaining("Expected a SELECT statement");
    }

    @Test
    void shouldRequireFromClause() {
      assertThatThrownBy(() -> parser.parse("SELECT mean(value)"))
          .isInstanceOf(QueryParseException.class)
          .hasMessageContaining("FROM");
    }

    @Test
    void shouldRejectUnknownFillMode() {
      assertThatThrownBy(() -> parser.parse("SELECT mean(v) FROM m GROUP BY time(1m) FILL(bogus)"))
          .isInstanceOf(QueryParseException.class);
    }
  }
}
