package com.evoila.rosetta.common.model;

/**
 * Outcome of a parse request.
 *
 * @param dialect dialect the query was parsed as
 * @param confidence detection confidence, 1.0 when the dialect was given
 * @param plan textual rendering of the query plan
 */
public record ParseResponse(String dialect, double confidence, String plan) {}
