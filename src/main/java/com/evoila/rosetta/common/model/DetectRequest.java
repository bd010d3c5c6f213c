package com.evoila.rosetta.common.model;

public record DetectRequest(String query) {}
