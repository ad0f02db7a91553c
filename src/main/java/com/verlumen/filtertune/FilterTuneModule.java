package com.verlumen.filtertune;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.verlumen.filtertune.optimization.GeneticConfig;
import com.verlumen.filtertune.optimization.GridSearchConfig;
import com.verlumen.filtertune.optimization.HillClimbingConfig;
import com.verlumen.filtertune.optimization.OptimizationModule;
import com.verlumen.filtertune.params.ParamsModule;
import com.verlumen.filtertune.scoring.ScoreConfig;
import com.verlumen.filtertune.scoring.ScoringModule;
import com.verlumen.filtertune.settings.OptimizationSettings;

/** Installs the parameter registry, the score function and the optimizer factory. */
@AutoValue
public abstract class FilterTuneModule extends AbstractModule {
  public static FilterTuneModule create() {
    return create(ScoreConfig.defaults());
  }

  public static FilterTuneModule create(ScoreConfig scoreConfig) {
    return create(
        scoreConfig,
        HillClimbingConfig.defaults(),
        GridSearchConfig.defaults(),
        GeneticConfig.defaults());
  }

  /** Scores with the weights and penalties stored in {@code settings}. */
  public static FilterTuneModule fromSettings(OptimizationSettings settings) {
    return create(settings.toScoreConfig());
  }

  public static FilterTuneModule create(
      ScoreConfig scoreConfig,
      HillClimbingConfig hillClimbingConfig,
      GridSearchConfig gridSearchConfig,
      GeneticConfig geneticConfig) {
    return new AutoValue_FilterTuneModule(
        scoreConfig, hillClimbingConfig, gridSearchConfig, geneticConfig);
  }

  abstract ScoreConfig scoreConfig();

  abstract HillClimbingConfig hillClimbingConfig();

  abstract GridSearchConfig gridSearchConfig();

  abstract GeneticConfig geneticConfig();

  @Override
  protected void configure() {
    install(new ParamsModule());
    install(ScoringModule.create(scoreConfig()));
    install(OptimizationModule.create(hillClimbingConfig(), gridSearchConfig(), geneticConfig()));
  }
}
