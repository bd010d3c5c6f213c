package com.evoila.rosetta.common.model;

import java.util.List;

/** One entry of the dialect listing. */
public record DialectInfo(
    String id, String name, List<String> aliases, boolean parsable, boolean translatable) {}
