package com.verlumen.filtertune.optimization;

/** Creates optimizers sharing one score function and one set of parameter bounds. */
public interface OptimizerFactory {
  Optimizer create(OptimizationMethod method, ProgressListener progressListener);

  default Optimizer create(OptimizationMethod method) {
    return create(method, ProgressListener.none());
  }
}
