package com.verlumen.filtertune.optimization;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.filtertune.params.ParamBoundsRegistry;
import com.verlumen.filtertune.params.ParamSpec;
import com.verlumen.filtertune.scoring.ScoreFunction;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Coordinate-wise local search with adaptive step sizes.
 *
 * <p>Each sweep tries one step up and one step down for every tunable parameter and keeps the first
 * move that raises the score. A parameter whose move succeeds gets a larger step. A sweep without
 * any improvement shrinks every step, and the search ends after {@link
 * HillClimbingConfig#maxNoImprovement()} such sweeps in a row.
 */
public final class HillClimbingOptimizer extends OptimizerBase {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final double STEP_GROWTH = 1.1;
  private static final double MAX_STEP_FACTOR = 1.0;
  private static final int[] DIRECTIONS = {1, -1};

  private final HillClimbingConfig config;

  public HillClimbingOptimizer(
      ScoreFunction scoreFunction,
      ParamBoundsRegistry paramBounds,
      HillClimbingConfig config,
      ProgressListener progressListener) {
    super(scoreFunction, paramBounds, config.maxIterations(), progressListener);
    this.config = config;
  }

  @Override
  <I> void search(Evaluator<I> evaluator, RunningBest best) {
    ImmutableList<ActiveParam> active = activeParams(evaluator.pipeline(), best.params());
    if (active.isEmpty()) {
      logger.atInfo().log("No tunable parameters in pipeline %s", evaluator.pipeline());
      return;
    }

    Map<ActiveParam, Double> stepFactors = new LinkedHashMap<>();
    active.forEach(param -> stepFactors.put(param, MAX_STEP_FACTOR));

    int iteration = 0;
    int sweepsWithoutImprovement = 0;
    while (iteration < maxIterations && !isStopRequested()) {
      boolean improvedThisSweep = false;
      for (ActiveParam param : active) {
        if (isStopRequested()) {
          break;
        }
        if (tryMove(evaluator, best, param, stepFactors)) {
          improvedThisSweep = true;
        }
      }

      iteration++;
      best.setIterations(iteration);
      best.recordHistory();
      reportProgress(iteration, maxIterations, best.score());

      if (improvedThisSweep) {
        sweepsWithoutImprovement = 0;
        continue;
      }
      sweepsWithoutImprovement++;
      stepFactors.replaceAll(
          (param, factor) -> Math.max(config.minStepFactor(), factor * config.stepDecay()));
      if (sweepsWithoutImprovement >= config.maxNoImprovement()) {
        logger.atFine().log(
            "Converged after %d sweeps without improvement", sweepsWithoutImprovement);
        break;
      }
    }
  }

  /** Tries one step in each direction and keeps the first that improves the score. */
  private <I> boolean tryMove(
      Evaluator<I> evaluator,
      RunningBest best,
      ActiveParam param,
      Map<ActiveParam, Double> stepFactors) {
    ParamSpec spec = param.spec();
    double current = param.currentValue(best.params());
    double delta = stepSize(spec, stepFactors.get(param));
    for (int direction : DIRECTIONS) {
      Number candidateValue = spec.normalize(current + direction * delta);
      if (candidateValue.doubleValue() == current) {
        continue;
      }
      if (isStopRequested()) {
        return false;
      }
      PipelineParams candidate =
          best.params().withValue(param.filterName(), spec.name(), candidateValue);
      if (best.offer(candidate, evaluator.score(candidate))) {
        stepFactors.put(
            param, Math.min(MAX_STEP_FACTOR, stepFactors.get(param) * STEP_GROWTH));
        return true;
      }
    }
    return false;
  }

  /**
   * Scales the base step. Integer steps are at least one, and odd-only steps are even so that a
   * move lands on the next odd value instead of rounding back.
   */
  static double stepSize(ParamSpec spec, double factor) {
    double scaled = spec.step() * factor;
    if (!spec.isInteger()) {
      return scaled;
    }
    long rounded = Math.max(1, Math.round(scaled));
    if (spec.oddOnly() && rounded % 2 != 0) {
      rounded++;
    }
    return rounded;
  }
}
