package com.verlumen.filtertune.params;

import static java.util.function.Function.identity;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.mu.util.stream.BiStream;
import java.util.concurrent.TimeUnit;

/**
 * Implementation of {@link ParamBoundsRegistry} backed by an immutable map from filter name to its
 * {@link FilterSpec}.
 */
final class ParamBoundsRegistryImpl implements ParamBoundsRegistry {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final long serialVersionUID = 1L;

  private final ImmutableMap<String, FilterSpec> specsByFilter;

  @Inject
  ParamBoundsRegistryImpl(ImmutableList<FilterSpec> filterSpecs) {
    this.specsByFilter =
        BiStream.from(filterSpecs, FilterSpec::filterName, identity())
            .collect(ImmutableMap::toImmutableMap);
  }

  @Override
  public boolean containsFilter(String filterName) {
    return specsByFilter.containsKey(filterName);
  }

  @Override
  public ImmutableList<ParamSpec> getParamSpecs(String filterName) {
    FilterSpec spec = specsByFilter.get(filterName);
    return spec == null ? ImmutableList.of() : spec.paramSpecs();
  }

  @Override
  public ParamSpec getParamSpec(String filterName, String paramName) {
    FilterSpec filterSpec = specsByFilter.get(filterName);
    if (filterSpec != null) {
      ParamSpec spec = filterSpec.getParamSpec(paramName).orElse(null);
      if (spec != null) {
        return spec;
      }
    }
    logger.atWarning().atMostEvery(1, TimeUnit.MINUTES).log(
        "No bounds declared for %s.%s, using default range [%s, %s] step %s",
        filterName,
        paramName,
        DEFAULT_SPEC_TEMPLATE.min(),
        DEFAULT_SPEC_TEMPLATE.max(),
        DEFAULT_SPEC_TEMPLATE.step());
    return ParamSpec.ofDouble(
        paramName,
        DEFAULT_SPEC_TEMPLATE.min(),
        DEFAULT_SPEC_TEMPLATE.max(),
        DEFAULT_SPEC_TEMPLATE.step());
  }
}
