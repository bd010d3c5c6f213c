package com.evoila.rosetta.common.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.evoila.rosetta.common.plan.ComparisonOp;
import com.evoila.rosetta.common.plan.FilterCondition;
import com.evoila.rosetta.common.plan.Value;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("SqlExpressionParser Tests")
class SqlExpressionParserTest {

  @Nested
  @DisplayName("Predicates")
  class Predicates {

    @Test
    void comparisonWithString() {
      assertThat(SqlExpressionParser.parse("host = 'server01'", false))
          .isEqualTo(
              new FilterCondition.Comparison("host", ComparisonOp.EQ, Value.of("server01")));
    }

    @Test
    void comparisonWithNegativeNumber() {
      assertThat(SqlExpressionParser.parse("temp >= -5", false))
          .isEqualTo(new FilterCondition.Comparison("temp", ComparisonOp.GT_EQ, Value.of(-5L)));
    }

    @Test
    void notEqualSpellings() {
      FilterCondition expected =
          new FilterCondition.Comparison("region", ComparisonOp.NOT_EQ, Value.of("eu"));

      assertThat(SqlExpressionParser.parse("region <> 'eu'", false)).isEqualTo(expected);
      assertThat(SqlExpressionParser.parse("region != 'eu'", false)).isEqualTo(expected);
    }

    @Test
    void quotedIdentifierColumn() {
      assertThat(SqlExpressionParser.parse("\"cpu-total\" < 1.5", false))
          .isEqualTo(
              new FilterCondition.Comparison("cpu-total", ComparisonOp.LT, Value.of(1.5)));
    }

    @Test
    void inList() {
      assertThat(SqlExpressionParser.parse("dc NOT IN ('a', 'b')", false))
          .isEqualTo(new FilterCondition.In("dc", List.of(Value.of("a"), Value.of("b")), true));
    }

    @Test
    void between() {
      assertThat(SqlExpressionParser.parse("v BETWEEN 1 AND 10", false))
          .isEqualTo(new FilterCondition.Between("v", Value.of(1L), Value.of(10L), false));
    }

    @Test
    void isNotNull() {
      assertThat(SqlExpressionParser.parse("host IS NOT NULL", false))
          .isEqualTo(new FilterCondition.IsNull("host", true));
    }

    @Test
    void like() {
      assertThat(SqlExpressionParser.parse("host not like 'web%'", false))
          .isEqualTo(
              new FilterCondition.Comparison("host", ComparisonOp.NOT_LIKE, Value.of("web%")));
    }

    @Test
    void regexLiteral() {
      assertThat(SqlExpressionParser.parse("host =~ /^web-\\d+$/", true))
          .isEqualTo(new FilterCondition.Regex("host", "^web-\\d+$", false));
      assertThat(SqlExpressionParser.parse("host !~ /a\\/b/", true))
          .isEqualTo(new FilterCondition.Regex("host", "a/b", true));
    }

    @Test
    void postgresRegexOperator() {
      assertThat(SqlExpressionParser.parse("host ~ '^web'", false))
          .isEqualTo(new FilterCondition.Regex("host", "^web", false));
    }

    @Test
    void durationLiteral() {
      assertThat(SqlExpressionParser.parse("uptime > 5m", false))
          .isEqualTo(
              new FilterCondition.Comparison(
                  "uptime", ComparisonOp.GT, new Value.DurationValue(300_000)));
    }

    @Test
    void booleanAndNull() {
      assertThat(SqlExpressionParser.parse("up = TRUE", false))
          .isEqualTo(new FilterCondition.Comparison("up", ComparisonOp.EQ, Value.of(true)));
      assertThat(SqlExpressionParser.parse("up = null", false))
          .isEqualTo(new FilterCondition.Comparison("up", ComparisonOp.EQ, Value.nullValue()));
    }
  }

  @Nested
  @DisplayName("Boolean structure")
  class BooleanStructure {

    @Test
    @DisplayName("AND binds tighter than OR")
    void precedence() {
      FilterCondition condition = SqlExpressionParser.parse("a = 1 OR b = 2 AND c = 3", false);

      assertThat(condition).isInstanceOf(FilterCondition.Or.class);
      FilterCondition.Or or = (FilterCondition.Or) condition;
      assertThat(or.conditions()).hasSize(2);
      assertThat(or.conditions().get(1)).isInstanceOf(FilterCondition.And.class);
    }

    @Test
    void parenthesesAndNot() {
      FilterCondition condition =
          SqlExpressionParser.parse("NOT (a = 1 or b = 2) and c = 3", false);

      FilterCondition.And and = (FilterCondition.And) condition;
      assertThat(and.conditions().get(0)).isInstanceOf(FilterCondition.Not.class);
      FilterCondition.Not not = (FilterCondition.Not) and.conditions().get(0);
      assertThat(not.condition()).isInstanceOf(FilterCondition.Or.class);
    }
  }

  @Nested
  @DisplayName("Rejected input")
  class Rejected {

    @ParameterizedTest
    @ValueSource(
        strings = {
          "abs(v) > 1",
          "a = b",
          "a =",
          "a = 1 b",
          "(a = 1",
          "a IS 1",
          "a = 'unterminated"
        })
    void unsupportedPredicates(String predicate) {
      assertThatThrownBy(() -> SqlExpressionParser.parse(predicate, false))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void excessiveNesting() {
      String predicate = "(".repeat(100) + "a = 1" + ")".repeat(100);

      assertThatThrownBy(() -> SqlExpressionParser.parse(predicate, false))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("too deep");
    }
  }
}
