package com.evoila.rosetta.common.dialect;

import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.QueryPlan;

/**
 * Back end rendering a {@link QueryPlan} as query text of one target dialect.
 *
 * <p>Rendering is best effort: plan features without a native construct are approximated or
 * omitted, as documented by each implementation. The output is always accepted by the parser of
 * the same dialect.
 */
public interface DialectTranslator {

  Dialect targetDialect();

  String translate(QueryPlan plan);
}
