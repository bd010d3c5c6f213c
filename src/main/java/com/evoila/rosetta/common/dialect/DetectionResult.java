package com.evoila.rosetta.common.dialect;

import com.evoila.rosetta.common.plan.Dialect;
import java.util.Map;

/**
 * Outcome of dialect detection.
 *
 * @param dialect the best guess
 * @param confidence winning score divided by the sum of all scores, 0 when nothing scored
 * @param scores per-dialect score for diagnostics, dialects without a match are absent
 */
public record DetectionResult(Dialect dialect, double confidence, Map<Dialect, Integer> scores) {

  public DetectionResult {
    scores = scores == null ? Map.of() : Map.copyOf(scores);
  }
}
