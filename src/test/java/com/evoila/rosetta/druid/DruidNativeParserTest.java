package com.evoila.rosetta.druid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("DruidNativeParser Tests")
class DruidNativeParserTest {

  private final DruidNativeParser parser = new DruidNativeParser();

  @Nested
  @DisplayName("Query types")
  class QueryTypes {

    @Test
    void shouldParseTimeseriesQuery() {
      QueryPlan plan =
          parser.parse(
              """
              {
                "queryType": "timeseries",
                "dataSource": "wikipedia",
                "granularity": "hour",
                "intervals": ["2024-01-01/2024-01-02"],
                "aggregations": [{"type": "longSum", "name": "edits", "fieldName": "count"}],
                "filter": {"type": "selector", "dimension": "page", "value": "Main"},
                "context": {"timeout": 5000, "useCache": false}
              }
              """);

      assertThat(plan.getSourceDialect()).isEqualTo(Dialect.DRUID_NATIVE);
      assertThat(plan.getSources()).containsExactly(DataSource.table("wikipedia"));
      assertThat(plan.getWindows()).containsExactly(Window.of(WindowKind.Interval.of(3600000)));
      assertThat(plan.getTimeRange())
          .isEqualTo(new TimeRange.Absolute(1704067200000L, 1704153600000L));
      assertThat(plan.getAggregations())
          .containsExactly(
              new Aggregation(AggFunction.Basic.SUM, "count", List.of(), "edits", false));
      assertThat(plan.getFilters()).containsExactly(Filter.eq("page", "Main"));
      assertThat(plan.getHints().getTimeoutMs()).isEqualTo(5000L);
      assertThat(plan.getHints().getUseCache()).isFalse();
      assertThat(plan.getHints().getCustom()).containsEntry("query_type", "timeseries");
    }

    @Test
    void shouldParseTopNQuery() {
      QueryPlan plan =
          parser.parse(
              """
              {"queryType": "topN", "dataSource": "wiki", "dimension": "page",
               "threshold": 10, "metric": "edits", "granularity": "all",
               "aggregations": [{"type": "count", "name": "edits"}]}
              """);

      assertThat(plan.getGroupBy()).containsExactly(GroupBy.tag("page"));
      assertThat(plan.getLimit()).isEqualTo(10L);
      assertThat(plan.getOrderBy()).containsExactly(OrderBy.desc("edits"));
      assertThat(plan.getWindows()).isEmpty();
      assertThat(plan.getHints().getCustom()).containsEntry("granularity", "all");
    }

    @Test
    void shouldParseGroupByQuery() {
      QueryPlan plan =
          parser.parse(
              """
              {"queryType": "groupBy", "dataSource": {"type": "table", "name": "wiki"},
               "dimensions": ["country", {"type": "default", "dimension": "city"}],
               "granularity": {"type": "period", "period": "PT5M", "timeZone": "UTC"},
               "limitSpec": {"type": "default", "limit": 5,
                             "columns": [{"dimension": "edits", "direction": "descending"}]},
               "postAggregations": [{"type": "arithmetic", "name": "ratio"}]}
              """);

      assertThat(plan.getSources()).containsExactly(DataSource.table("wiki"));
      assertThat(plan.getGroupBy()).containsExactly(GroupBy.tag("country"), GroupBy.tag("city"));
      assertThat(plan.getWindows()).containsExactly(Window.of(WindowKind.Interval.of(300000)));
      assertThat(plan.getLimit()).isEqualTo(5L);
      assertThat(plan.getOrderBy()).containsExactly(OrderBy.desc("edits"));
      assertThat(plan.getHints().getCustom())
          .containsEntry("time_zone", "UTC")
          .containsKey("postAggregations");
    }

    @Test
    void shouldParseQueryDataSource() {
      QueryPlan plan =
          parser.parse(
              """
              {"queryType": "timeseries",
               "dataSource": {"type": "query",
                              "query": {"queryType": "scan", "dataSource": "raw"}}}
              """);

      DataSource source = plan.getSources().get(0);
      assertThat(source.name()).isEqualTo("raw");
      assertThat(source.kind()).isInstanceOf(SourceKind.Subquery.class);
    }
  }

  @Nested
  @DisplayName("Filters")
  class Filters {

    @Test
    void shouldParseLogicalFilters() {
      QueryPlan plan =
          parser.parse(
              """
              {"queryType": "scan", "dataSource": "wiki", "filter": {
                "type": "and", "fields": [
                  {"type": "in", "dimension": "country", "values": ["DE", "FR"]},
                  {"type": "not",
                   "field": {"type": "regex", "dimension": "page", "pattern": "^Talk"}},
                  {"type": "bound", "dimension": "added", "lower": "10", "lowerStrict": true,
                   "upper": 20}
                ]}}
              """);

      assertThat(plan.getFilters())
          .containsExactly(
              Filter.of(
                  new FilterCondition.And(
                      List.of(
                          new FilterCondition.In(
                              "country", List.of(Value.of("DE"), Value.of("FR")), false),
                          new FilterCondition.Not(
                              new FilterCondition.Regex("page", "^Talk", false)),
                          new FilterCondition.And(
                              List.of(
                                  new FilterCondition.Comparison(
                                      "added", ComparisonOp.GT, Value.of("10")),
                                  new FilterCondition.Comparison(
                                      "added", ComparisonOp.LT_EQ, Value.of(20L))))))));
    }

    @Test
    void shouldTreatNullSelectorAsIsNull() {
      QueryPlan plan =
          parser.parse(
              """
              {"queryType": "scan", "dataSource": "wiki",
               "filter": {"type": "selector", "dimension": "user", "value": null}}
              """);

      assertThat(plan.getFilters())
          .containsExactly(Filter.of(new FilterCondition.IsNull("user", false)));
    }

    @Test
    void shouldBoundFilterNesting() {
      String filter = "{\"type\": \"not\", \"field\": ".repeat(70)
          + "{\"type\": \"null\", \"dimension\": \"x\"}"
          + "}".repeat(70);
      String query = "{\"queryType\": \"scan\", \"dataSource\": \"t\", \"filter\": " + filter + "}";

      assertThatThrownBy(() -> parser.parse(query))
          .isInstanceOf(QueryParseException.class)
          .hasMessageContaining("maximum depth");
    }
  }

  @Nested
  @DisplayName("Errors")
  class Errors {

    @ParameterizedTest
    @ValueSource(
        strings = {
          "not json",
          "[1, 2]",
          "{\"dataSource\": \"wiki\"}",
          "{\"queryType\": \"scan\"}",
          "{\"queryType\": \"scan\", \"dataSource\": 42}",
          "{\"queryType\": \"scan\", \"dataSource\": \"t\", \"granularity\": \"fortnight\"}",
          "{\"queryType\": \"scan\", \"dataSource\": \"t\", \"intervals\": [\"yesterday\"]}",
          "{\"queryType\": \"scan\", \"dataSource\": \"t\", \"filter\": {\"type\": \"spatial\"}}",
          "{\"queryType\": \"scan\", \"dataSource\": \"t\", \"filter\": {\"type\": \"and\"}}"
        })
    void shouldRejectInvalidQueries(String query) {
      assertThatThrownBy(() -> parser.parse(query)).isInstanceOf(QueryParseException.class);
    }

    @ParameterizedTest
    @ValueSource(
        strings = {
          "{\"queryType\": \"topN\", \"dataSource\": \"d\", \"threshold\": 1e30}",
          "{\"queryType\": \"scan\", \"dataSource\": \"d\", \"limit\": 2.5}",
          "{\"queryType\": \"scan\", \"dataSource\": \"d\","
              + " \"offset\": 123456789012345678901234567890}",
          "{\"queryType\": \"scan\", \"dataSource\": \"d\","
              + " \"context\": {\"timeout\": 1e300}}"
        })
    void shouldRejectNumbersOutsideLongRange(String query) {
      assertThatThrownBy(() -> parser.parse(query))
          .isInstanceOf(QueryParseException.class)
          .hasMessageContaining("must be a whole number");
    }

    @Test
    void shouldKeepOversizedFilterValueAsDouble() {
      String query =
          "{\"queryType\": \"scan\", \"dataSource\": \"d\", \"filter\":"
              + " {\"type\": \"selector\", \"dimension\": \"n\","
              + " \"value\": 123456789012345678901234567890}}";

      assertThat(parser.parse(query).getFilters()).hasSize(1);
    }
  }
}
