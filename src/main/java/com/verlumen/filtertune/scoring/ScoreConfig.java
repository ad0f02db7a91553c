package com.verlumen.filtertune.scoring;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/** Metric weights and regression penalties consumed by {@link ScoreFunction}. */
@AutoValue
public abstract class ScoreConfig implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final double DEFAULT_NEGATIVE_PENALTY_FACTOR = 5.0;
  public static final double DEFAULT_CRITICAL_PENALTY_FACTOR = 20.0;
  public static final double DEFAULT_NEGATIVE_COUNT_PENALTY = 50.0;

  /** Edge preservation dominates; spectral metrics only break ties. */
  public static final ImmutableMap<String, Double> DEFAULT_WEIGHTS =
      ImmutableMap.<String, Double>builder()
          .put(NoiseMetrics.SNR, 2.0)
          .put(NoiseMetrics.SNR_RMS, 1.0)
          .put(NoiseMetrics.NOISE_STD, 0.5)
          .put(NoiseMetrics.NOISE_STD_MAD, 1.0)
          .put(NoiseMetrics.NOISE_STD_LAPLACIAN, 1.5)
          .put(NoiseMetrics.LINEWISE_H, 1.0)
          .put(NoiseMetrics.LINEWISE_V, 1.0)
          .put(NoiseMetrics.LINE_CORRELATION, 0.5)
          .put(NoiseMetrics.ABNORMAL_LINES_COUNT, 1.0)
          .put(NoiseMetrics.EDGE_NOISE, 1.0)
          .put(NoiseMetrics.EDGE_SHARPNESS, 5.0)
          .put(NoiseMetrics.GRADIENT_VARIANCE, 0.5)
          .put(NoiseMetrics.EDGE_COHERENCE, 1.0)
          .put(NoiseMetrics.TOTAL_SPECTRAL_ENERGY, 0.3)
          .put(NoiseMetrics.PSD_PEAKS_COUNT, 0.3)
          .build();

  public abstract ImmutableMap<String, Double> weights();

  /** Multiplier applied to the weighted regression of an ordinary metric. */
  public abstract double negativePenaltyFactor();

  /** Multiplier applied to the weighted regression of a {@link NoiseMetrics#CRITICAL} metric. */
  public abstract double criticalPenaltyFactor();

  /** Flat deduction per regressed metric. */
  public abstract double negativeCountPenalty();

  public static ScoreConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_ScoreConfig.Builder()
        .setWeights(DEFAULT_WEIGHTS)
        .setNegativePenaltyFactor(DEFAULT_NEGATIVE_PENALTY_FACTOR)
        .setCriticalPenaltyFactor(DEFAULT_CRITICAL_PENALTY_FACTOR)
        .setNegativeCountPenalty(DEFAULT_NEGATIVE_COUNT_PENALTY);
  }

  public abstract Builder toBuilder();

  /** Returns a copy with one metric weight added or replaced. */
  public ScoreConfig withWeight(String metricName, double weight) {
    Map<String, Double> weights = new LinkedHashMap<>(weights());
    weights.put(metricName, weight);
    return toBuilder().setWeights(weights).build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setWeights(Map<String, Double> weights);

    public abstract Builder setNegativePenaltyFactor(double factor);

    public abstract Builder setCriticalPenaltyFactor(double factor);

    public abstract Builder setNegativeCountPenalty(double penalty);

    abstract ScoreConfig autoBuild();

    public ScoreConfig build() {
      ScoreConfig config = autoBuild();
      checkArgument(config.negativePenaltyFactor() >= 0, "negativePenaltyFactor must be >= 0");
      checkArgument(config.criticalPenaltyFactor() >= 0, "criticalPenaltyFactor must be >= 0");
      checkArgument(config.negativeCountPenalty() >= 0, "negativeCountPenalty must be >= 0");
      return config;
    }
  }
}
