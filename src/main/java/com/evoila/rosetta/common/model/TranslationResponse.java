package com.evoila.rosetta.common.model;

/**
 * Outcome of a translation request.
 *
 * @param source dialect the query was parsed as
 * @param target dialect it was rendered in
 * @param confidence detection confidence, 1.0 when the source was given
 * @param query translated query text
 */
public record TranslationResponse(String source, String target, double confidence, String query) {}
