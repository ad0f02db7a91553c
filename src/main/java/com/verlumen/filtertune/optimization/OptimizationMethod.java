package com.verlumen.filtertune.optimization;

/** Search strategies offered by {@link OptimizerFactory}. */
public enum OptimizationMethod {
  /** Coordinate-wise local search from the current parameters. May stop at a local optimum. */
  HILL_CLIMBING,
  /** Coarse global grid followed by a fine grid around the best coarse point. */
  GRID_SEARCH,
  /** Evolutionary search seeded with the current parameters. */
  GENETIC
}
