package com.verlumen.filtertune.optimization;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.filtertune.params.ParamBoundsRegistry;
import com.verlumen.filtertune.params.ParamSpec;
import com.verlumen.filtertune.scoring.ScoreFunction;
import io.jenetics.DoubleChromosome;
import io.jenetics.DoubleGene;
import io.jenetics.Genotype;
import io.jenetics.Mutator;
import io.jenetics.SinglePointCrossover;
import io.jenetics.TournamentSelector;
import io.jenetics.engine.Engine;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Evolutionary search over the tunable parameters of a pipeline.
 *
 * <p>Each parameter becomes one {@link DoubleChromosome} spanning its bounds. Genes are decoded
 * through {@link ParamSpec#normalize(double)}, so integer and odd-only constraints hold for every
 * evaluated candidate. The first population contains the starting assignment. Evaluation runs on
 * the calling thread.
 */
public final class GeneticOptimizer extends OptimizerBase {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final GeneticConfig config;

  public GeneticOptimizer(
      ScoreFunction scoreFunction,
      ParamBoundsRegistry paramBounds,
      GeneticConfig config,
      ProgressListener progressListener) {
    super(scoreFunction, paramBounds, config.maxGenerations(), progressListener);
    this.config = config;
  }

  @Override
  <I> void search(Evaluator<I> evaluator, RunningBest best) {
    ImmutableList<ActiveParam> active =
        activeParams(evaluator.pipeline(), best.params()).stream()
            .filter(param -> param.spec().min() < param.spec().max())
            .collect(ImmutableList.toImmutableList());
    if (active.isEmpty()) {
      logger.atInfo().log("No tunable parameters in pipeline %s", evaluator.pipeline());
      return;
    }

    PipelineParams base = best.params();
    Function<Genotype<DoubleGene>, Double> fitnessFunction =
        genotype -> fitness(evaluator, decode(active, base, genotype));
    Engine<DoubleGene, Double> engine =
        Engine.builder(fitnessFunction, template(active))
            .populationSize(config.populationSize())
            .selector(new TournamentSelector<>(config.tournamentSize()))
            .alterers(
                new Mutator<>(config.mutationProbability()),
                new SinglePointCrossover<>(config.crossoverProbability()))
            .executor(Runnable::run)
            .build();

    engine.stream(List.of(seed(active, base)))
        .limit(result -> !isStopRequested())
        .limit(maxIterations)
        .forEach(
            result -> {
              Genotype<DoubleGene> fittest = result.bestPhenotype().genotype();
              best.offer(decode(active, base, fittest), result.bestFitness());
              best.recordHistory();
              best.setIterations((int) result.generation());
              reportProgress(best.iterations(), maxIterations, best.score());
              logger.atFine().log(
                  "Generation %d: best fitness %.4f", result.generation(), result.bestFitness());
            });
  }

  /** Scores a candidate, or returns negative infinity once a stop has been requested. */
  private <I> double fitness(Evaluator<I> evaluator, PipelineParams candidate) {
    return isStopRequested() ? Double.NEGATIVE_INFINITY : evaluator.score(candidate);
  }

  private static Genotype<DoubleGene> template(ImmutableList<ActiveParam> active) {
    List<DoubleChromosome> chromosomes = new ArrayList<>();
    for (ActiveParam param : active) {
      ParamSpec spec = param.spec();
      chromosomes.add(DoubleChromosome.of(spec.min(), upperBound(spec)));
    }
    return Genotype.of(chromosomes);
  }

  private static Genotype<DoubleGene> seed(ImmutableList<ActiveParam> active, PipelineParams base) {
    List<DoubleChromosome> chromosomes = new ArrayList<>();
    for (ActiveParam param : active) {
      ParamSpec spec = param.spec();
      double value = spec.clip(param.currentValue(base));
      chromosomes.add(DoubleChromosome.of(DoubleGene.of(value, spec.min(), upperBound(spec))));
    }
    return Genotype.of(chromosomes);
  }

  private static PipelineParams decode(
      ImmutableList<ActiveParam> active, PipelineParams base, Genotype<DoubleGene> genotype) {
    PipelineParams.Builder candidate = base.toBuilder();
    for (int i = 0; i < active.size(); i++) {
      ActiveParam param = active.get(i);
      double allele = genotype.get(i).gene().doubleValue();
      param.set(candidate, param.spec().normalize(allele));
    }
    return candidate.build();
  }

  // Gene upper bounds are exclusive.
  private static double upperBound(ParamSpec spec) {
    return Math.nextUp(spec.max());
  }
}
