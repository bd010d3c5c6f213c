package com.evoila.rosetta.common.dialect;

import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.QueryPlan;

/**
 * Front end turning query text of one dialect into a {@link QueryPlan}.
 *
 * <p>Implementations are stateless and safe for concurrent use. They extract what they understand
 * and record the rest in the plan's custom hints; they only fail when the text lacks the minimal
 * structure of the dialect.
 */
public interface DialectParser {

  Dialect dialect();

  /**
   * Parses query text.
   *
   * @param query raw query text
   * @return a freshly built plan tagged with {@link #dialect()}
   * @throws QueryParseException if the text is not a statement of this dialect
   */
  QueryPlan parse(String query);
}
