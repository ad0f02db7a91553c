package com.verlumen.filtertune.optimization;

import java.util.List;

/**
 * Searches the parameter space of a filter pipeline for the assignment that maximizes the score of
 * the processed image against the original.
 *
 * <p>{@link #optimize} blocks the calling thread until the search ends. Callers that must stay
 * responsive run it on a worker thread and call {@link #stop()} from elsewhere.
 */
public interface Optimizer {
  /** Maximum number of filters in an optimized pipeline. */
  int MAX_PIPELINE_FILTERS = 3;

  /**
   * Runs the search.
   *
   * @param image the source image, never modified
   * @param pipelineFilters filter names in application order, at most {@link
   *     #MAX_PIPELINE_FILTERS}
   * @param currentParams the starting assignment
   * @param applyFilter applies one filter to an image
   * @param analyzer measures image-quality metrics
   * @return the best assignment found; a stopped run returns its best so far
   * @throws IllegalArgumentException if the pipeline has too many filters
   */
  <I> OptimizationResult optimize(
      I image,
      List<String> pipelineFilters,
      PipelineParams currentParams,
      FilterApplier<I> applyFilter,
      ImageAnalyzer<I> analyzer);

  /**
   * Requests cooperative cancellation. The running search finishes its current evaluation and
   * returns its best result so far.
   */
  void stop();
}
