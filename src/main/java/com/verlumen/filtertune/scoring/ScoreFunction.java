package com.verlumen.filtertune.scoring;

import java.io.Serializable;
import java.util.Map;

/**
 * Scores a processed image against its original by comparing their metrics.
 *
 * <p>Each weighted metric contributes its direction-adjusted percent improvement times its weight.
 * Regressions are penalized heavily, more so for critical metrics, and every regressed metric adds
 * a flat deduction on top. Metrics missing from either snapshot, and metrics whose original value
 * is effectively zero, are skipped.
 */
public interface ScoreFunction extends Serializable {
  /** Computes the score together with its per-metric breakdown. */
  ScoreResult calculateScore(Map<String, Double> original, Map<String, Double> processed);

  /**
   * Computes only the total score. Always equal to {@code calculateScore(...).totalScore()}; used
   * in search loops.
   */
  double quickScore(Map<String, Double> original, Map<String, Double> processed);

  /** Creates a score function outside of dependency injection. */
  static ScoreFunction create(ScoreConfig config) {
    return new ScoreFunctionImpl(config);
  }
}
