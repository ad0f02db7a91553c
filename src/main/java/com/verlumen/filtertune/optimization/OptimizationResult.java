package com.verlumen.filtertune.optimization;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.time.Duration;

/** Outcome of one optimization run. */
@AutoValue
public abstract class OptimizationResult {
  /** Filters of the optimized pipeline, in application order. */
  public abstract ImmutableList<String> pipelineFilters();

  public abstract PipelineParams bestParams();

  public abstract double bestScore();

  /** Score of the parameters the run started from. */
  public abstract double initialScore();

  /**
   * Work done: sweeps for hill climbing, evaluated combinations for grid search, generations for
   * the genetic search.
   */
  public abstract int iterations();

  public abstract Duration elapsedTime();

  /** Best score seen so far, recorded at each step of the run. Never decreases. */
  public abstract ImmutableList<Double> scoreHistory();

  /** True if the best score beats the initial score. */
  public abstract boolean improved();

  static OptimizationResult create(
      ImmutableList<String> pipelineFilters,
      PipelineParams bestParams,
      double bestScore,
      double initialScore,
      int iterations,
      Duration elapsedTime,
      ImmutableList<Double> scoreHistory) {
    return new AutoValue_OptimizationResult(
        pipelineFilters,
        bestParams,
        bestScore,
        initialScore,
        iterations,
        elapsedTime,
        scoreHistory,
        bestScore > initialScore);
  }
}
