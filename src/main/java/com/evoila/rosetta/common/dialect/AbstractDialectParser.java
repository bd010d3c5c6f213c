package com.evoila.rosetta.common.dialect;

import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.QueryPlan;
import lombok.extern.slf4j.Slf4j;

/**
 * Common input validation and error normalisation for dialect parsers. Subclasses implement
 * {@link #doParse(String)} on trimmed, length-checked text; low-level parsing failures such as
 * malformed numbers or unbalanced brackets surface as {@link QueryParseException}.
 */
@Slf4j
public abstract class AbstractDialectParser implements DialectParser {

  protected final ParserLimits limits;

  protected AbstractDialectParser(ParserLimits limits) {
    this.limits = limits != null ? limits : ParserLimits.DEFAULTS;
  }

  @Override
  public final QueryPlan parse(String query) {
    String text = validate(query);
    log.debug("Parsing {} query: '{}'", dialect(), text);
    QueryPlan plan;
    try {
      plan = doParse(text);
    } catch (QueryParseException e) {
      log.debug("{} parse failed: {}", dialect(), e.getMessage());
      throw e;
    } catch (IllegalArgumentException | IllegalStateException e) {
      log.debug("{} parse failed: {}", dialect(), e.getMessage());
      throw new QueryParseException(
          "Invalid " + dialect().getDisplayName() + " query: " + e.getMessage(), e);
    }
    return plan.toBuilder().sourceDialect(dialect()).originalQuery(query).build();
  }

  protected abstract QueryPlan doParse(String query);

  private String validate(String query) {
    if (query == null || query.isBlank()) {
      throw new QueryParseException("Empty " + dialect().getDisplayName() + " query");
    }
    if (query.length() > limits.maxQueryLength()) {
      throw new QueryParseException(
          "Query too long ("
              + query.length()
              + " chars), max allowed: "
              + limits.maxQueryLength());
    }
    return query.trim();
  }

  /** Fails when a recursive descent exceeds the configured nesting bound. */
  protected void checkDepth(int depth, String query, int position) {
    if (depth > limits.maxDepth()) {
      throw QueryParseException.at(
          "Expression nesting exceeds maximum depth of " + limits.maxDepth(), query, position);
    }
  }
}
