package com.evoila.rosetta.common.model;

/**
 * @param query raw query text
 * @param source dialect of {@code query}, auto-detected when absent
 * @param target dialect to render
 */
public record TranslateRequest(String query, String source, String target) {}
