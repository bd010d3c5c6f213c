package com.evoila.rosetta.common.dialect;

import com.evoila.rosetta.common.plan.Dialect;
import com.evoila.rosetta.common.plan.QueryPlan;

/** Plan produced by auto-detected parsing, with the detected dialect and detection confidence. */
public record ParsedQuery(QueryPlan plan, Dialect dialect, double confidence) {}
