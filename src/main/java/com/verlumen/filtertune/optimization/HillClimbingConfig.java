package com.verlumen.filtertune.optimization;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Tuning of {@link HillClimbingOptimizer}. */
@AutoValue
public abstract class HillClimbingConfig {
  public static final int DEFAULT_MAX_ITERATIONS = 100;
  public static final double DEFAULT_STEP_DECAY = 0.95;
  public static final double DEFAULT_MIN_STEP_FACTOR = 0.1;
  public static final int DEFAULT_MAX_NO_IMPROVEMENT = 10;

  /** Maximum number of sweeps. */
  public abstract int maxIterations();

  /** Factor applied to every step multiplier after a sweep without improvement. */
  public abstract double stepDecay();

  /** Lower bound of the step multipliers. */
  public abstract double minStepFactor();

  /** Consecutive sweeps without improvement after which the search has converged. */
  public abstract int maxNoImprovement();

  public static HillClimbingConfig defaults() {
    return create(
        DEFAULT_MAX_ITERATIONS,
        DEFAULT_STEP_DECAY,
        DEFAULT_MIN_STEP_FACTOR,
        DEFAULT_MAX_NO_IMPROVEMENT);
  }

  public static HillClimbingConfig create(
      int maxIterations, double stepDecay, double minStepFactor, int maxNoImprovement) {
    checkArgument(maxIterations > 0, "maxIterations must be positive");
    checkArgument(stepDecay > 0 && stepDecay <= 1, "stepDecay must be in (0, 1]");
    checkArgument(minStepFactor > 0 && minStepFactor <= 1, "minStepFactor must be in (0, 1]");
    checkArgument(maxNoImprovement > 0, "maxNoImprovement must be positive");
    return new AutoValue_HillClimbingConfig(
        maxIterations, stepDecay, minStepFactor, maxNoImprovement);
  }
}
