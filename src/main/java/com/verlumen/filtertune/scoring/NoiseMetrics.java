package com.verlumen.filtertune.scoring;

import com.google.common.collect.ImmutableSet;

/**
 * Names of the image-quality metrics produced by the noise analyzer, and the fixed classification
 * of those metrics used when scoring.
 */
public final class NoiseMetrics {
  public static final String SNR = "snr";
  public static final String SNR_RMS = "snr_rms";
  public static final String NOISE_STD = "noise_std";
  public static final String NOISE_STD_MAD = "noise_std_mad";
  public static final String NOISE_STD_LAPLACIAN = "noise_std_laplacian";
  public static final String LINEWISE_H = "linewise_h";
  public static final String LINEWISE_V = "linewise_v";
  public static final String LINE_CORRELATION = "line_correlation";
  public static final String ABNORMAL_LINES_COUNT = "abnormal_lines_count";
  public static final String EDGE_NOISE = "edge_noise";
  public static final String EDGE_SHARPNESS = "edge_sharpness";
  public static final String GRADIENT_VARIANCE = "gradient_variance";
  public static final String EDGE_COHERENCE = "edge_coherence";
  public static final String TOTAL_SPECTRAL_ENERGY = "total_spectral_energy";
  public static final String PSD_PEAKS_COUNT = "psd_peaks_count";

  /** Metrics where a larger value means a better image. Every other metric is lower-is-better. */
  public static final ImmutableSet<String> HIGHER_IS_BETTER =
      ImmutableSet.of(SNR, SNR_RMS, LINE_CORRELATION, EDGE_SHARPNESS, EDGE_COHERENCE);

  /** Metrics whose regression is penalized with the critical penalty factor. */
  public static final ImmutableSet<String> CRITICAL =
      ImmutableSet.of(EDGE_SHARPNESS, NOISE_STD_MAD, ABNORMAL_LINES_COUNT);

  public static boolean isHigherBetter(String metricName) {
    return HIGHER_IS_BETTER.contains(metricName);
  }

  public static boolean isCritical(String metricName) {
    return CRITICAL.contains(metricName);
  }

  private NoiseMetrics() {}
}
