package com.verlumen.filtertune.optimization;

import java.util.Map;

/**
 * Measures named image-quality metrics. The key set must be the same for every image analyzed
 * during one optimization run.
 *
 * @param <I> the image representation, opaque to the optimizer
 */
@FunctionalInterface
public interface ImageAnalyzer<I> {
  Map<String, Double> analyze(I image);
}
