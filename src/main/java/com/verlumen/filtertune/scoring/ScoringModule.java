package com.verlumen.filtertune.scoring;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;

@AutoValue
public abstract class ScoringModule extends AbstractModule {
  public static ScoringModule create() {
    return create(ScoreConfig.defaults());
  }

  public static ScoringModule create(ScoreConfig scoreConfig) {
    return new AutoValue_ScoringModule(scoreConfig);
  }

  abstract ScoreConfig scoreConfig();

  @Override
  protected void configure() {
    bind(ScoreFunction.class).to(ScoreFunctionImpl.class);
  }

  @Provides
  ScoreConfig provideScoreConfig() {
    return scoreConfig();
  }
}
