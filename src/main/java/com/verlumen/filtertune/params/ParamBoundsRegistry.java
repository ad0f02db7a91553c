package com.verlumen.filtertune.params;

import com.google.common.collect.ImmutableList;
import java.io.Serializable;

/** Looks up parameter bounds by filter and parameter name. */
public interface ParamBoundsRegistry extends Serializable {
  /** Range used for any parameter the registry does not declare. */
  ParamSpec DEFAULT_SPEC_TEMPLATE = ParamSpec.ofDouble("default", 0.0, 1.0, 0.1);

  /** Returns true if the filter declares optimizable parameters. */
  boolean containsFilter(String filterName);

  /**
   * Returns the declared parameters of a filter in sweep order, or an empty list for an unknown
   * filter.
   */
  ImmutableList<ParamSpec> getParamSpecs(String filterName);

  /**
   * Returns the bounds of a parameter. Undeclared pairs resolve to the permissive default range
   * {@code (0.0, 1.0, 0.1)} instead of failing.
   */
  ParamSpec getParamSpec(String filterName, String paramName);

  /** Creates a registry over the given filters. Filter names must be unique. */
  static ParamBoundsRegistry of(ImmutableList<FilterSpec> filterSpecs) {
    return new ParamBoundsRegistryImpl(filterSpecs);
  }

  static ParamBoundsRegistry of(FilterSpec... filterSpecs) {
    return of(ImmutableList.copyOf(filterSpecs));
  }

  /** Creates a registry over every {@link NoiseFilter}. */
  static ParamBoundsRegistry noiseFilters() {
    return of(NoiseFilter.allSpecs());
  }
}
