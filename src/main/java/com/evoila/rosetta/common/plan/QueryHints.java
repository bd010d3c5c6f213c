package com.evoila.rosetta.common.plan;

import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Execution hints plus the escape hatch for dialect features without a structural IR form.
 * Parsers record anything they cannot map under {@link #getCustom()} so translators and
 * diagnostics can still see it.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
public class QueryHints {
  private final String forceIndex;
  private final Integer parallel;
  private final Long memoryLimit;
  private final Long timeoutMs;
  private final Long stepMs;
  private final Long lookbackDeltaMs;
  private final Boolean useCache;

  @Singular("customHint")
  private final Map<String, String> custom;

  public static QueryHints empty() {
    return QueryHints.builder().build();
  }

  public Optional<String> custom(String key) {
    return Optional.ofNullable(custom.get(key));
  }

  public boolean hasCustom(String key) {
    return custom.containsKey(key);
  }
}
