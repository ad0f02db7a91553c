package com.verlumen.filtertune.optimization;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Tuning of {@link GridSearchOptimizer}. */
@AutoValue
public abstract class GridSearchConfig {
  public static final int DEFAULT_MAX_ITERATIONS = 500;
  public static final int DEFAULT_COARSE_DIVISIONS = 3;
  public static final int DEFAULT_FINE_DIVISIONS = 5;
  public static final double DEFAULT_FINE_RANGE_FACTOR = 0.3;

  /** Evaluation budget shared by the coarse and fine phases. */
  public abstract int maxIterations();

  /** Values sampled per parameter in the coarse phase. */
  public abstract int coarseDivisions();

  /** Values sampled per parameter in the fine phase. */
  public abstract int fineDivisions();

  /** Width of the fine window as a fraction of each parameter's full range. */
  public abstract double fineRangeFactor();

  public static GridSearchConfig defaults() {
    return create(
        DEFAULT_MAX_ITERATIONS,
        DEFAULT_COARSE_DIVISIONS,
        DEFAULT_FINE_DIVISIONS,
        DEFAULT_FINE_RANGE_FACTOR);
  }

  public static GridSearchConfig create(
      int maxIterations, int coarseDivisions, int fineDivisions, double fineRangeFactor) {
    checkArgument(maxIterations > 0, "maxIterations must be positive");
    checkArgument(coarseDivisions > 0, "coarseDivisions must be positive");
    checkArgument(fineDivisions > 0, "fineDivisions must be positive");
    checkArgument(
        fineRangeFactor > 0 && fineRangeFactor <= 1, "fineRangeFactor must be in (0, 1]");
    return new AutoValue_GridSearchConfig(
        maxIterations, coarseDivisions, fineDivisions, fineRangeFactor);
  }
}
