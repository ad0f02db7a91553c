package com.verlumen.filtertune.optimization;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Best assignment seen during one run, with its score history. */
final class RunningBest {
  private final List<Double> history = new ArrayList<>();
  private PipelineParams params;
  private double score;
  private int iterations;

  RunningBest(PipelineParams params, double score) {
    this.params = params;
    this.score = score;
    history.add(score);
  }

  /** Replaces the best if {@code candidateScore} is strictly higher. Returns whether it did. */
  boolean offer(PipelineParams candidate, double candidateScore) {
    if (candidateScore > score) {
      params = candidate;
      score = candidateScore;
      return true;
    }
    return false;
  }

  void recordHistory() {
    history.add(score);
  }

  PipelineParams params() {
    return params;
  }

  double score() {
    return score;
  }

  int iterations() {
    return iterations;
  }

  void setIterations(int iterations) {
    this.iterations = iterations;
  }

  ImmutableList<Double> history() {
    return ImmutableList.copyOf(history);
  }
}
