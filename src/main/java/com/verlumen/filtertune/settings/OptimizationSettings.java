package com.verlumen.filtertune.settings;

import com.google.common.collect.ImmutableSet;
import com.google.gson.annotations.SerializedName;
import com.verlumen.filtertune.optimization.PipelineParams;
import com.verlumen.filtertune.params.ParamBoundsRegistry;
import com.verlumen.filtertune.params.ParamSpec;
import com.verlumen.filtertune.scoring.ScoreConfig;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * POJO mirroring the settings document that stores the starting filter parameters, the default
 * pipeline and the scoring weights. Loaded and saved by {@link OptimizationSettingsLoader}.
 */
public final class OptimizationSettings implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final String NEGATIVE_PENALTY_FACTOR = "negative_penalty_factor";
  public static final String CRITICAL_PENALTY_FACTOR = "critical_penalty_factor";
  public static final String NEGATIVE_COUNT_PENALTY = "negative_count_penalty";

  private static final ImmutableSet<String> PENALTY_KEYS =
      ImmutableSet.of(NEGATIVE_PENALTY_FACTOR, CRITICAL_PENALTY_FACTOR, NEGATIVE_COUNT_PENALTY);

  @SerializedName("filter_parameters")
  private Map<String, Map<String, Object>> filterParameters = new LinkedHashMap<>();

  @SerializedName("pipeline_filters")
  private List<String> pipelineFilters = new ArrayList<>();

  @SerializedName("optimization_weights")
  private Map<String, Double> optimizationWeights = new LinkedHashMap<>();

  @SerializedName("last_modified")
  private String lastModified = "";

  public OptimizationSettings() {}

  public Map<String, Map<String, Object>> getFilterParameters() {
    return filterParameters;
  }

  public void setFilterParameters(Map<String, Map<String, Object>> filterParameters) {
    this.filterParameters = filterParameters;
  }

  /** Returns the stored parameters of one filter, or an empty map. */
  public Map<String, Object> getFilterParams(String filterName) {
    Map<String, Object> params = filterParameters.get(filterName);
    return params == null ? new LinkedHashMap<>() : params;
  }

  public void setFilterParams(String filterName, Map<String, ?> params) {
    filterParameters.put(filterName, new LinkedHashMap<>(params));
  }

  public List<String> getPipelineFilters() {
    return pipelineFilters;
  }

  public void setPipelineFilters(List<String> pipelineFilters) {
    this.pipelineFilters = pipelineFilters;
  }

  public Map<String, Double> getOptimizationWeights() {
    return optimizationWeights;
  }

  public void setOptimizationWeights(Map<String, Double> optimizationWeights) {
    this.optimizationWeights = optimizationWeights;
  }

  public String getLastModified() {
    return lastModified;
  }

  public void setLastModified(String lastModified) {
    this.lastModified = lastModified;
  }

  /**
   * Builds a score configuration: stored weights replace or extend the default weight table, and
   * the penalty keys override the default penalties.
   */
  public ScoreConfig toScoreConfig() {
    Map<String, Double> weights = new LinkedHashMap<>(ScoreConfig.DEFAULT_WEIGHTS);
    optimizationWeights.forEach(
        (key, value) -> {
          if (!PENALTY_KEYS.contains(key)) {
            weights.put(key, value);
          }
        });
    return ScoreConfig.builder()
        .setWeights(weights)
        .setNegativePenaltyFactor(
            penalty(NEGATIVE_PENALTY_FACTOR, ScoreConfig.DEFAULT_NEGATIVE_PENALTY_FACTOR))
        .setCriticalPenaltyFactor(
            penalty(CRITICAL_PENALTY_FACTOR, ScoreConfig.DEFAULT_CRITICAL_PENALTY_FACTOR))
        .setNegativeCountPenalty(
            penalty(NEGATIVE_COUNT_PENALTY, ScoreConfig.DEFAULT_NEGATIVE_COUNT_PENALTY))
        .build();
  }

  private double penalty(String key, double defaultValue) {
    Double value = optimizationWeights.get(key);
    return value == null ? defaultValue : value;
  }

  /**
   * Converts the stored filter parameters into pipeline parameters. JSON numbers are read as
   * doubles, so values of integer parameters declared in {@code registry} are rounded to {@link
   * Integer}. Everything else is kept as stored.
   */
  public PipelineParams toPipelineParams(ParamBoundsRegistry registry) {
    PipelineParams.Builder builder = PipelineParams.builder();
    filterParameters.forEach(
        (filterName, params) -> {
          builder.putAll(filterName, new LinkedHashMap<>());
          params.forEach(
              (paramName, value) ->
                  builder.put(
                      filterName, paramName, convert(registry, filterName, paramName, value)));
        });
    return builder.build();
  }

  private static Object convert(
      ParamBoundsRegistry registry, String filterName, String paramName, Object value) {
    if (!(value instanceof Number)) {
      return value;
    }
    double number = ((Number) value).doubleValue();
    Optional<ParamSpec> spec =
        registry.getParamSpecs(filterName).stream()
            .filter(candidate -> candidate.name().equals(paramName))
            .findFirst();
    if (spec.isPresent() && spec.get().isInteger()) {
      return (int) Math.round(number);
    }
    return number;
  }

  /** Stores every filter of {@code params}, replacing the stored values of those filters. */
  public void applyPipelineParams(PipelineParams params) {
    params.asMap().forEach(this::setFilterParams);
  }
}
