package com.verlumen.filtertune.scoring;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import java.util.Map;

/** Weighted, penalty-aware implementation of {@link ScoreFunction}. */
final class ScoreFunctionImpl implements ScoreFunction {
  private static final long serialVersionUID = 1L;

  static final double EPSILON = 1e-10;

  private final ScoreConfig config;

  @Inject
  ScoreFunctionImpl(ScoreConfig config) {
    this.config = config;
  }

  @Override
  public ScoreResult calculateScore(Map<String, Double> original, Map<String, Double> processed) {
    double totalScore = 0.0;
    double penalty = 0.0;
    int negativeCount = 0;
    ImmutableMap.Builder<String, Double> metricScores = ImmutableMap.builder();
    ImmutableMap.Builder<String, Double> improvements = ImmutableMap.builder();

    for (Map.Entry<String, Double> entry : config.weights().entrySet()) {
      String metricName = entry.getKey();
      Double improvement = improvement(metricName, original, processed);
      if (improvement == null) {
        continue;
      }
      improvements.put(metricName, improvement);

      double score = entry.getValue() * improvement;
      if (improvement < 0) {
        negativeCount++;
        double penaltyAmount = Math.abs(score) * penaltyFactor(metricName);
        penalty += penaltyAmount;
        score = -penaltyAmount;
      }
      metricScores.put(metricName, score);
      totalScore += score;
    }

    double countPenalty = negativeCount * config.negativeCountPenalty();
    penalty += countPenalty;
    totalScore -= countPenalty;

    return ScoreResult.create(
        totalScore, metricScores.build(), improvements.build(), penalty, negativeCount);
  }

  @Override
  public double quickScore(Map<String, Double> original, Map<String, Double> processed) {
    double totalScore = 0.0;
    int negativeCount = 0;

    for (Map.Entry<String, Double> entry : config.weights().entrySet()) {
      String metricName = entry.getKey();
      Double improvement = improvement(metricName, original, processed);
      if (improvement == null) {
        continue;
      }
      double score = entry.getValue() * improvement;
      if (improvement < 0) {
        negativeCount++;
        score = -Math.abs(score) * penaltyFactor(metricName);
      }
      totalScore += score;
    }

    return totalScore - negativeCount * config.negativeCountPenalty();
  }

  /** Returns the direction-adjusted percent improvement, or null if the metric is not scored. */
  private static Double improvement(
      String metricName, Map<String, Double> original, Map<String, Double> processed) {
    Double originalValue = original.get(metricName);
    Double processedValue = processed.get(metricName);
    if (originalValue == null || processedValue == null) {
      return null;
    }
    double baseline = Math.abs(originalValue);
    if (baseline < EPSILON) {
      return null;
    }
    return NoiseMetrics.isHigherBetter(metricName)
        ? (processedValue - originalValue) / baseline * 100
        : (originalValue - processedValue) / baseline * 100;
  }

  private double penaltyFactor(String metricName) {
    return NoiseMetrics.isCritical(metricName)
        ? config.criticalPenaltyFactor()
        : config.negativePenaltyFactor();
  }
}
