package com.verlumen.filtertune.optimization;

/**
 * Receives progress updates from a running optimizer. Called synchronously on the optimizing
 * thread, so implementations must return quickly.
 */
@FunctionalInterface
public interface ProgressListener {
  void onProgress(int current, int total, double bestScore);

  static ProgressListener none() {
    return (current, total, bestScore) -> {};
  }
}
