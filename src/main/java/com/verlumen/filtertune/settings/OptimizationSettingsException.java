package com.verlumen.filtertune.settings;

/** Thrown when a settings document cannot be read, parsed or written. */
public final class OptimizationSettingsException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public OptimizationSettingsException(String message) {
    super(message);
  }

  public OptimizationSettingsException(String message, Throwable cause) {
    super(message, cause);
  }
}
