package com.evoila.rosetta.common.config;

import com.evoila.rosetta.common.dialect.DialectDetector;
import com.evoila.rosetta.common.dialect.ParserLimits;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Compiler settings bound from the {@code rosetta} prefix. */
@Data
@Component
@ConfigurationProperties(prefix = "rosetta")
public class RosettaProperties {

  private Parser parser = new Parser();
  private Detection detection = new Detection();

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Parser {
    @Builder.Default private int maxDepth = ParserLimits.DEFAULTS.maxDepth();
    @Builder.Default private int maxQueryLength = ParserLimits.DEFAULTS.maxQueryLength();
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Detection {
    // scores below this fall back to generic SQL
    @Builder.Default private int minimumScore = DialectDetector.DEFAULT_MINIMUM_SCORE;
  }
}
