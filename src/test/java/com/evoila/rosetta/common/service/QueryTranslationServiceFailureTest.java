package com.evoila.rosetta.common.service;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.evoila.rosetta.common.dialect.DialectRegistry;
import com.evoila.rosetta.common.exception.QueryTranslationException;
import com.evoila.rosetta.common.plan.DataSource;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.QueryPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryTranslationServiceFailureTest {

  @Mock private DialectRegistry registry;

  private QueryTranslationService service;

  @BeforeEach
  void setUp() {
    service = new QueryTranslationService(registry);
  }

  @Test
  void translate_TranslatorFailure_ShouldRethrowUnchanged() {
    // Given
    QueryPlan plan = QueryPlan.builder().source(DataSource.metric("up")).build();
    QueryTranslationException failure =
        new QueryTranslationException("No translator for dialect: sql", "sql");
    when(registry.parse(Dialect.PROMQL, "up")).thenReturn(plan);
    when(registry.translate(plan, Dialect.SQL)).thenThrow(failure);

    // When / Then
    assertThatThrownBy(() -> service.translate("up", "promql", "sql")).isSameAs(failure);
  }

  @Test
  void translate_UnknownTarget_ShouldFailBeforeParsing() {
    // When / Then
    assertThatThrownBy(() -> service.translate("up", "promql", "cobol"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown dialect: cobol");
    verify(registry, never()).parse(any(), any());
  }
}
