package com.verlumen.filtertune.optimization;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.math.LongMath;
import com.verlumen.filtertune.params.ParamBoundsRegistry;
import com.verlumen.filtertune.params.ParamSpec;
import com.verlumen.filtertune.scoring.ScoreFunction;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Exhaustive two-phase grid search.
 *
 * <p>The coarse phase evaluates the cartesian product of evenly spaced values over each parameter's
 * full range. The fine phase evaluates a denser grid inside a window around the best coarse result.
 * Both phases draw from one evaluation budget of {@link GridSearchConfig#maxIterations()}.
 */
public final class GridSearchOptimizer extends OptimizerBase {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final GridSearchConfig config;

  public GridSearchOptimizer(
      ScoreFunction scoreFunction,
      ParamBoundsRegistry paramBounds,
      GridSearchConfig config,
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

    PipelineParams base = best.params();
    List<List<Number>> coarseAxes = new ArrayList<>();
    for (ActiveParam param : active) {
      coarseAxes.add(gridValues(param.spec(), config.coarseDivisions(), null, 1.0));
    }
    int evaluated = runPhase(evaluator, best, active, base, coarseAxes, maxIterations, 0);
    best.recordHistory();
    logger.atFine().log("Coarse phase: %d evaluations, best %.4f", evaluated, best.score());

    int remaining = maxIterations - evaluated;
    if (remaining > 0 && !isStopRequested()) {
      PipelineParams center = best.params();
      List<List<Number>> fineAxes = new ArrayList<>();
      for (ActiveParam param : active) {
        fineAxes.add(
            gridValues(
                param.spec(),
                config.fineDivisions(),
                param.currentValue(center),
                config.fineRangeFactor()));
      }
      evaluated += runPhase(evaluator, best, active, center, fineAxes, remaining, evaluated);
      best.recordHistory();
      logger.atFine().log("Fine phase done: %d evaluations, best %.4f", evaluated, best.score());
    }
    best.setIterations(evaluated);
  }

  /**
   * Evaluates the cartesian product of {@code axes}, stopping at {@code budget} evaluations.
   * Combinations are built one at a time by an index counter over the axes, the last axis varying
   * fastest. The full product is never materialized.
   */
  private <I> int runPhase(
      Evaluator<I> evaluator,
      RunningBest best,
      ImmutableList<ActiveParam> active,
      PipelineParams base,
      List<List<Number>> axes,
      int budget,
      int evaluatedBefore) {
    int total = evaluatedBefore + (int) Math.min(budget, combinationCount(axes));
    int[] indices = new int[axes.size()];
    int evaluated = 0;
    boolean exhausted = false;
    while (!exhausted && evaluated < budget && !isStopRequested()) {
      PipelineParams.Builder candidate = base.toBuilder();
      for (int i = 0; i < active.size(); i++) {
        active.get(i).set(candidate, axes.get(i).get(indices[i]));
      }
      PipelineParams params = candidate.build();
      best.offer(params, evaluator.score(params));
      evaluated++;
      reportProgress(evaluatedBefore + evaluated, total, best.score());
      exhausted = advance(indices, axes);
    }
    return evaluated;
  }

  /** Moves {@code indices} to the next combination. Returns true after the last one. */
  private static boolean advance(int[] indices, List<List<Number>> axes) {
    for (int i = indices.length - 1; i >= 0; i--) {
      indices[i]++;
      if (indices[i] < axes.get(i).size()) {
        return false;
      }
      indices[i] = 0;
    }
    return true;
  }

  /** Size of the product of {@code axes}, saturating at {@code Long.MAX_VALUE}. */
  static long combinationCount(List<? extends List<?>> axes) {
    long count = 1;
    for (List<?> axis : axes) {
      count = LongMath.saturatedMultiply(count, axis.size());
    }
    return count;
  }

  /**
   * Returns the grid values of one parameter.
   *
   * <p>With a null {@code center}, or with {@code rangeFactor >= 1}, the grid spans the full range.
   * Otherwise it spans a window of {@code rangeFactor} times the range width centred on {@code
   * center} and clipped to the bounds. Continuous parameters get {@code divisions} evenly spaced
   * values including both ends. Integer parameters enumerate {@code min + k * step} within the
   * window, keep odd values only when required, and subsample evenly down to {@code divisions}. An
   * integer window holding no admissible value yields the admissible value nearest the centre.
   */
  static ImmutableList<Number> gridValues(
      ParamSpec spec, int divisions, Double center, double rangeFactor) {
    double lo = spec.min();
    double hi = spec.max();
    if (center != null && rangeFactor < 1.0) {
      double halfWidth = (spec.max() - spec.min()) * rangeFactor / 2;
      lo = spec.clip(center - halfWidth);
      hi = spec.clip(center + halfWidth);
    }
    return spec.isInteger()
        ? integerValues(spec, divisions, lo, hi, center)
        : continuousValues(divisions, lo, hi);
  }

  private static ImmutableList<Number> continuousValues(int divisions, double lo, double hi) {
    if (divisions == 1 || lo == hi) {
      return ImmutableList.of(lo);
    }
    double width = (hi - lo) / (divisions - 1);
    return IntStream.range(0, divisions)
        .<Number>mapToObj(i -> i == divisions - 1 ? hi : lo + i * width)
        .distinct()
        .collect(toImmutableList());
  }

  private static ImmutableList<Number> integerValues(
      ParamSpec spec, int divisions, double lo, double hi, Double center) {
    int min = (int) Math.round(spec.min());
    int max = (int) Math.round(spec.max());
    int step = Math.max(1, (int) spec.step());
    List<Integer> admissible = new ArrayList<>();
    for (int value = min; value <= max; value += step) {
      if (!spec.oddOnly() || value % 2 != 0) {
        admissible.add(value);
      }
    }
    if (admissible.isEmpty()) {
      // A step that skips every odd value; fall back to normalized bounds.
      admissible.add(spec.normalize(spec.min()).intValue());
    }

    List<Integer> window = new ArrayList<>();
    for (int value : admissible) {
      if (value >= lo && value <= hi) {
        window.add(value);
      }
    }
    if (window.isEmpty()) {
      double target = center == null ? lo : center;
      int nearest = admissible.get(0);
      for (int value : admissible) {
        if (Math.abs(value - target) < Math.abs(nearest - target)) {
          nearest = value;
        }
      }
      return ImmutableList.of(nearest);
    }

    int n = window.size();
    if (n <= divisions) {
      return ImmutableList.copyOf(window);
    }
    if (divisions == 1) {
      return ImmutableList.of(window.get(0));
    }
    return IntStream.range(0, divisions)
        .map(i -> (int) ((long) i * (n - 1) / (divisions - 1)))
        .distinct()
        .<Number>mapToObj(window::get)
        .collect(toImmutableList());
  }
}
