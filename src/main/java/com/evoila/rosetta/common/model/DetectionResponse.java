package com.evoila.rosetta.common.model;

import java.util.Map;

public record DetectionResponse(String dialect, double confidence, Map<String, Integer> scores) {}
