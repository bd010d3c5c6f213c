package com.evoila.rosetta.common.config;

import com.evoila.rosetta.common.dialect.DialectDetector;
import com.evoila.rosetta.common.dialect.DialectParser;
import com.evoila.rosetta.common.dialect.DialectRegistry;
import com.evoila.rosetta.common.dialect.DialectTranslator;
import com.evoila.rosetta.common.dialect.ParserLimits;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the registry from every parser and translator bean. Parsers pick up the configured {@link
 * ParserLimits} through their limits constructor.
 */
@Slf4j
@Configuration
public class DialectRegistryConfig {

  @Bean
  public ParserLimits parserLimits(RosettaProperties properties) {
    RosettaProperties.Parser parser = properties.getParser();
    log.debug(
        "Parser limits: max depth {}, max query length {}",
        parser.getMaxDepth(),
        parser.getMaxQueryLength());
    return new ParserLimits(parser.getMaxDepth(), parser.getMaxQueryLength());
  }

  @Bean
  public DialectDetector dialectDetector(RosettaProperties properties) {
    return new DialectDetector(properties.getDetection().getMinimumScore());
  }

  @Bean
  public DialectRegistry dialectRegistry(
      List<DialectParser> parsers, List<DialectTranslator> translators, DialectDetector detector) {
    return new DialectRegistry(parsers, translators, detector);
  }
}
