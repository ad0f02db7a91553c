package com.verlumen.filtertune.optimization;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Tuning of {@link GeneticOptimizer}. */
@AutoValue
public abstract class GeneticConfig {
  public static final int DEFAULT_MAX_GENERATIONS = 30;
  public static final int DEFAULT_POPULATION_SIZE = 20;
  public static final int DEFAULT_TOURNAMENT_SIZE = 3;
  public static final double DEFAULT_MUTATION_PROBABILITY = 0.15;
  public static final double DEFAULT_CROSSOVER_PROBABILITY = 0.35;

  public abstract int maxGenerations();

  public abstract int populationSize();

  public abstract int tournamentSize();

  public abstract double mutationProbability();

  public abstract double crossoverProbability();

  public static GeneticConfig defaults() {
    return create(
        DEFAULT_MAX_GENERATIONS,
        DEFAULT_POPULATION_SIZE,
        DEFAULT_TOURNAMENT_SIZE,
        DEFAULT_MUTATION_PROBABILITY,
        DEFAULT_CROSSOVER_PROBABILITY);
  }

  public static GeneticConfig create(
      int maxGenerations,
      int populationSize,
      int tournamentSize,
      double mutationProbability,
      double crossoverProbability) {
    checkArgument(maxGenerations > 0, "maxGenerations must be positive");
    checkArgument(populationSize > 1, "populationSize must be at least 2");
    checkArgument(tournamentSize > 0, "tournamentSize must be positive");
    checkArgument(
        mutationProbability >= 0 && mutationProbability <= 1,
        "mutationProbability must be in [0, 1]");
    checkArgument(
        crossoverProbability >= 0 && crossoverProbability <= 1,
        "crossoverProbability must be in [0, 1]");
    return new AutoValue_GeneticConfig(
        maxGenerations, populationSize, tournamentSize, mutationProbability, crossoverProbability);
  }
}
