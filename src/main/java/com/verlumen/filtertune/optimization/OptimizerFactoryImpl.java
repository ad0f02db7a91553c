package com.verlumen.filtertune.optimization;

import com.google.inject.Inject;
import com.verlumen.filtertune.params.ParamBoundsRegistry;
import com.verlumen.filtertune.scoring.ScoreFunction;

final class OptimizerFactoryImpl implements OptimizerFactory {
  private final ScoreFunction scoreFunction;
  private final ParamBoundsRegistry paramBounds;
  private final HillClimbingConfig hillClimbingConfig;
  private final GridSearchConfig gridSearchConfig;
  private final GeneticConfig geneticConfig;

  @Inject
  OptimizerFactoryImpl(
      ScoreFunction scoreFunction,
      ParamBoundsRegistry paramBounds,
      HillClimbingConfig hillClimbingConfig,
      GridSearchConfig gridSearchConfig,
      GeneticConfig geneticConfig) {
    this.scoreFunction = scoreFunction;
    this.paramBounds = paramBounds;
    this.hillClimbingConfig = hillClimbingConfig;
    this.gridSearchConfig = gridSearchConfig;
    this.geneticConfig = geneticConfig;
  }

  @Override
  public Optimizer create(OptimizationMethod method, ProgressListener progressListener) {
    switch (method) {
      case HILL_CLIMBING:
        return new HillClimbingOptimizer(
            scoreFunction, paramBounds, hillClimbingConfig, progressListener);
      case GRID_SEARCH:
        return new GridSearchOptimizer(
            scoreFunction, paramBounds, gridSearchConfig, progressListener);
      case GENETIC:
        return new GeneticOptimizer(scoreFunction, paramBounds, geneticConfig, progressListener);
    }
    throw new IllegalArgumentException("Unsupported optimization method: " + method);
  }
}
