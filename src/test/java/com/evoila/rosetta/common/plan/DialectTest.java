package com.evoila.rosetta.common.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("Dialect Tests")
class DialectTest {

  @ParameterizedTest
  @CsvSource({
    "influxql, INFLUXQL",
    "PromQL, PROMQL",
    "' timescale ', TIMESCALEDB",
    "timescaledb, TIMESCALEDB",
    "druid, DRUID_SQL",
    "druidnative, DRUID_NATIVE",
    "SQL, SQL"
  })
  void fromStringAcceptsIdsAndAliases(String name, Dialect expected) {
    assertThat(Dialect.fromString(name)).isEqualTo(expected);
  }

  @Test
  void fromStringRejectsUnknownNames() {
    assertThatThrownBy(() -> Dialect.fromString("cypher"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("cypher");
    assertThatThrownBy(() -> Dialect.fromString(null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void findIsOptional() {
    assertThat(Dialect.find("nope")).isEmpty();
    assertThat(Dialect.find("flux")).contains(Dialect.FLUX);
  }

  @Test
  void toStringIsTheId() {
    assertThat(Dialect.TIMESCALEDB).hasToString("timescaledb");
    assertThat(Dialect.DRUID_NATIVE.getDisplayName()).isEqualTo("Druid native");
  }

  @Test
  void comparisonOperators() {
    assertThat(ComparisonOp.fromSymbol("==")).isEqualTo(ComparisonOp.EQ);
    assertThat(ComparisonOp.fromSymbol("<>")).isEqualTo(ComparisonOp.NOT_EQ);
    assertThat(ComparisonOp.GT.negate()).isEqualTo(ComparisonOp.LT_EQ);
    assertThat(ComparisonOp.LIKE.negate()).isEqualTo(ComparisonOp.NOT_LIKE);
    assertThatThrownBy(() -> ComparisonOp.fromSymbol("<=>"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
