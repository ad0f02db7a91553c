package com.verlumen.filtertune.optimization;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Parameter values for the filters of a pipeline, keyed by filter name and then parameter name.
 *
 * <p>Instances are immutable. Candidates are derived with {@link #withValue} or {@link #toBuilder},
 * which never affect the instance they start from. Values are numbers for tunable parameters and
 * may be any immutable value (usually a {@link String}) for parameters the optimizer leaves alone.
 */
@AutoValue
public abstract class PipelineParams implements Serializable {
  private static final long serialVersionUID = 1L;

  public abstract ImmutableMap<String, ImmutableMap<String, Object>> asMap();

  public static PipelineParams empty() {
    return builder().build();
  }

  public static PipelineParams of(Map<String, ? extends Map<String, ?>> params) {
    Builder builder = builder();
    params.forEach(builder::putAll);
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder builder = builder();
    asMap().forEach(builder::putAll);
    return builder;
  }

  public boolean containsFilter(String filterName) {
    return asMap().containsKey(filterName);
  }

  /** Returns the parameters of one filter, or an empty map if the filter has none. */
  public ImmutableMap<String, Object> getFilterParams(String filterName) {
    ImmutableMap<String, Object> params = asMap().get(filterName);
    return params == null ? ImmutableMap.of() : params;
  }

  /** Returns the numeric value of a parameter, or empty if it is absent or not a number. */
  public OptionalDouble getNumber(String filterName, String paramName) {
    Object value = getFilterParams(filterName).get(paramName);
    return value instanceof Number
        ? OptionalDouble.of(((Number) value).doubleValue())
        : OptionalDouble.empty();
  }

  /** Returns a copy with one parameter value replaced. */
  public PipelineParams withValue(String filterName, String paramName, Object value) {
    return toBuilder().put(filterName, paramName, value).build();
  }

  /** Returns a structurally independent copy. */
  public PipelineParams copy() {
    return toBuilder().build();
  }

  /** Mutable builder preserving filter and parameter insertion order. */
  public static final class Builder {
    private final Map<String, Map<String, Object>> params = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String filterName, String paramName, Object value) {
      checkArgument(!filterName.isEmpty(), "Filter name cannot be empty");
      checkNotNull(value, "Value of %s.%s cannot be null", filterName, paramName);
      params.computeIfAbsent(filterName, k -> new LinkedHashMap<>()).put(paramName, value);
      return this;
    }

    public Builder putAll(String filterName, Map<String, ?> filterParams) {
      params.computeIfAbsent(filterName, k -> new LinkedHashMap<>());
      filterParams.forEach((paramName, value) -> put(filterName, paramName, value));
      return this;
    }

    public PipelineParams build() {
      ImmutableMap.Builder<String, ImmutableMap<String, Object>> copy = ImmutableMap.builder();
      params.forEach((filterName, values) -> copy.put(filterName, ImmutableMap.copyOf(values)));
      return new AutoValue_PipelineParams(copy.build());
    }
  }
}
