package com.verlumen.filtertune.optimization;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;

/**
 * Binds {@link OptimizerFactory}. Requires bindings for the score function and the parameter
 * bounds, as installed by the scoring and params modules.
 */
@AutoValue
public abstract class OptimizationModule extends AbstractModule {
  public static OptimizationModule create() {
    return create(
        HillClimbingConfig.defaults(), GridSearchConfig.defaults(), GeneticConfig.defaults());
  }

  public static OptimizationModule create(
      HillClimbingConfig hillClimbingConfig,
      GridSearchConfig gridSearchConfig,
      GeneticConfig geneticConfig) {
    return new AutoValue_OptimizationModule(hillClimbingConfig, gridSearchConfig, geneticConfig);
  }

  abstract HillClimbingConfig hillClimbingConfig();

  abstract GridSearchConfig gridSearchConfig();

  abstract GeneticConfig geneticConfig();

  @Override
  protected void configure() {
    bind(OptimizerFactory.class).to(OptimizerFactoryImpl.class);
  }

  @Provides
  HillClimbingConfig provideHillClimbingConfig() {
    return hillClimbingConfig();
  }

  @Provides
  GridSearchConfig provideGridSearchConfig() {
    return gridSearchConfig();
  }

  @Provides
  GeneticConfig provideGeneticConfig() {
    return geneticConfig();
  }
}
