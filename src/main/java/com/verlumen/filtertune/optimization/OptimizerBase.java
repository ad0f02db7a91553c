package com.verlumen.filtertune.optimization;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.verlumen.filtertune.params.ParamBoundsRegistry;
import com.verlumen.filtertune.params.ParamSpec;
import com.verlumen.filtertune.scoring.ScoreFunction;
import java.util.List;
import java.util.Map;

/**
 * Shared machinery of the search strategies: pipeline evaluation, bounds lookup, cancellation and
 * progress reporting.
 *
 * <p>{@link #optimize} measures the original image once, scores the starting assignment and hands
 * both to the strategy's {@link #search}. Every candidate is scored against that fixed baseline.
 */
public abstract class OptimizerBase implements Optimizer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  protected final ScoreFunction scoreFunction;
  protected final ParamBoundsRegistry paramBounds;
  protected final int maxIterations;
  private final ProgressListener progressListener;

  private volatile boolean stopRequested;

  protected OptimizerBase(
      ScoreFunction scoreFunction,
      ParamBoundsRegistry paramBounds,
      int maxIterations,
      ProgressListener progressListener) {
    checkArgument(maxIterations > 0, "maxIterations must be positive but was %s", maxIterations);
    this.scoreFunction = checkNotNull(scoreFunction);
    this.paramBounds = checkNotNull(paramBounds);
    this.maxIterations = maxIterations;
    this.progressListener = checkNotNull(progressListener);
  }

  @Override
  public final <I> OptimizationResult optimize(
      I image,
      List<String> pipelineFilters,
      PipelineParams currentParams,
      FilterApplier<I> applyFilter,
      ImageAnalyzer<I> analyzer) {
    checkArgument(
        pipelineFilters.size() <= MAX_PIPELINE_FILTERS,
        "A pipeline holds at most %s filters but got %s",
        MAX_PIPELINE_FILTERS,
        pipelineFilters);
    stopRequested = false;
    Stopwatch stopwatch = Stopwatch.createStarted();
    ImmutableList<String> pipeline = ImmutableList.copyOf(pipelineFilters);
    logger.atInfo().log("Starting %s over pipeline %s", getClass().getSimpleName(), pipeline);

    ImmutableMap<String, Double> originalMetrics = ImmutableMap.copyOf(analyzer.analyze(image));
    Evaluator<I> evaluator =
        new Evaluator<>(image, pipeline, originalMetrics, applyFilter, analyzer);

    PipelineParams initialParams = deepCopyParams(currentParams);
    double initialScore = evaluator.score(initialParams);
    RunningBest best = new RunningBest(initialParams, initialScore);

    search(evaluator, best);

    OptimizationResult result =
        OptimizationResult.create(
            pipeline,
            best.params(),
            best.score(),
            initialScore,
            best.iterations(),
            stopwatch.elapsed(),
            best.history());
    logger.atInfo().log(
        "%s finished%s after %d iterations in %s: score %.4f -> %.4f",
        getClass().getSimpleName(),
        stopRequested ? " (stopped)" : "",
        result.iterations(),
        result.elapsedTime(),
        initialScore,
        result.bestScore());
    return result;
  }

  /**
   * Runs the strategy. Implementations offer candidates to {@code best}, record its history, set
   * its iteration count, and return once converged, out of budget or stopped.
   */
  abstract <I> void search(Evaluator<I> evaluator, RunningBest best);

  @Override
  public void stop() {
    stopRequested = true;
  }

  protected boolean isStopRequested() {
    return stopRequested;
  }

  protected void reportProgress(int current, int total, double bestScore) {
    progressListener.onProgress(current, total, bestScore);
  }

  /**
   * Applies the pipeline's filters in order, analyzes the result and scores it against {@code
   * originalMetrics}. Filters without an entry in {@code params} are skipped. Exceptions thrown by
   * the collaborators propagate unchanged.
   */
  protected final <I> double evaluate(
      I image,
      List<String> pipelineFilters,
      PipelineParams params,
      Map<String, Double> originalMetrics,
      FilterApplier<I> applyFilter,
      ImageAnalyzer<I> analyzer) {
    I processed = image;
    for (String filterName : pipelineFilters) {
      if (params.containsFilter(filterName)) {
        processed = applyFilter.apply(processed, filterName, params.getFilterParams(filterName));
      }
    }
    return scoreFunction.quickScore(originalMetrics, analyzer.analyze(processed));
  }

  /** Returns the bounds of a parameter; undeclared parameters get the permissive default. */
  public ParamSpec getParamRange(String filterName, String paramName) {
    return paramBounds.getParamSpec(filterName, paramName);
  }

  public double clipParam(String filterName, String paramName, double value) {
    return getParamRange(filterName, paramName).clip(value);
  }

  public PipelineParams deepCopyParams(PipelineParams params) {
    return params.copy();
  }

  /**
   * Lists the tunable parameters of a pipeline: for each declared filter in pipeline order, its
   * declared parameters that hold a numeric value in {@code params}.
   */
  ImmutableList<ActiveParam> activeParams(List<String> pipelineFilters, PipelineParams params) {
    ImmutableList.Builder<ActiveParam> active = ImmutableList.builder();
    for (String filterName : ImmutableSet.copyOf(pipelineFilters)) {
      if (!paramBounds.containsFilter(filterName) || !params.containsFilter(filterName)) {
        continue;
      }
      for (ParamSpec spec : paramBounds.getParamSpecs(filterName)) {
        if (params.getNumber(filterName, spec.name()).isPresent()) {
          active.add(ActiveParam.create(filterName, spec));
        }
      }
    }
    return active.build();
  }

  /** One tunable parameter of the pipeline. */
  @AutoValue
  abstract static class ActiveParam {
    abstract String filterName();

    abstract ParamSpec spec();

    static ActiveParam create(String filterName, ParamSpec spec) {
      return new AutoValue_OptimizerBase_ActiveParam(filterName, spec);
    }

    double currentValue(PipelineParams params) {
      return params.getNumber(filterName(), spec().name()).getAsDouble();
    }

    PipelineParams.Builder set(PipelineParams.Builder builder, Number value) {
      return builder.put(filterName(), spec().name(), value);
    }
  }

  /** Scores assignments against the fixed baseline of one run. */
  final class Evaluator<I> {
    private final I image;
    private final ImmutableList<String> pipeline;
    private final ImmutableMap<String, Double> originalMetrics;
    private final FilterApplier<I> applyFilter;
    private final ImageAnalyzer<I> analyzer;

    private Evaluator(
        I image,
        ImmutableList<String> pipeline,
        ImmutableMap<String, Double> originalMetrics,
        FilterApplier<I> applyFilter,
        ImageAnalyzer<I> analyzer) {
      this.image = image;
      this.pipeline = pipeline;
      this.originalMetrics = originalMetrics;
      this.applyFilter = applyFilter;
      this.analyzer = analyzer;
    }

    ImmutableList<String> pipeline() {
      return pipeline;
    }

    double score(PipelineParams params) {
      return evaluate(image, pipeline, params, originalMetrics, applyFilter, analyzer);
    }
  }
}
