package com.evoila.rosetta.common.model;

/**
 * @param query raw query text
 * @param dialect dialect id or alias, auto-detected when absent
 */
public record ParseRequest(String query, String dialect) {}
