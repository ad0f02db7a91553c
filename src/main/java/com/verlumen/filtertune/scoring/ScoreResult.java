package com.verlumen.filtertune.scoring;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** Detailed breakdown of one score calculation. */
@AutoValue
public abstract class ScoreResult {
  /** Total score, higher is better. */
  public abstract double totalScore();

  /** Weighted, penalty-adjusted contribution of each scored metric. */
  public abstract ImmutableMap<String, Double> metricScores();

  /** Direction-adjusted percent improvement of each scored metric. */
  public abstract ImmutableMap<String, Double> improvements();

  /** Sum of all regression penalties, including the per-regression flat penalty. */
  public abstract double penalty();

  public abstract int negativeCount();

  static ScoreResult create(
      double totalScore,
      ImmutableMap<String, Double> metricScores,
      ImmutableMap<String, Double> improvements,
      double penalty,
      int negativeCount) {
    return new AutoValue_ScoreResult(
        totalScore, metricScores, improvements, penalty, negativeCount);
  }
}
