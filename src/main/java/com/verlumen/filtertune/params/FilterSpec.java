package com.verlumen.filtertune.params;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.Optional;

/** The optimizable parameters of one filter, in sweep order. */
@AutoValue
public abstract class FilterSpec implements Serializable {
  private static final long serialVersionUID = 1L;

  public abstract String filterName();

  public abstract ImmutableList<ParamSpec> paramSpecs();

  public static FilterSpec create(String filterName, ParamSpec... paramSpecs) {
    return create(filterName, ImmutableList.copyOf(paramSpecs));
  }

  public static FilterSpec create(String filterName, ImmutableList<ParamSpec> paramSpecs) {
    long distinctNames = paramSpecs.stream().map(ParamSpec::name).distinct().count();
    checkArgument(
        distinctNames == paramSpecs.size(), "Duplicate parameter names for filter %s", filterName);
    return new AutoValue_FilterSpec(filterName, paramSpecs);
  }

  public Optional<ParamSpec> getParamSpec(String paramName) {
    return paramSpecs().stream().filter(spec -> spec.name().equals(paramName)).findFirst();
  }
}
