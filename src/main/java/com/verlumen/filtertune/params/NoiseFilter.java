package com.verlumen.filtertune.params;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Optional;

/**
 * The noise filters whose parameters can be tuned, each declaring its parameter bounds and type
 * constraints.
 */
public enum NoiseFilter {
  LINEWISE(
      "Linewise",
      ParamSpec.ofOddInteger("window_size", 3, 31, 2),
      ParamSpec.ofDouble("strength", 0.0, 1.0, 0.05)),
  NOTCH(
      "Notch",
      ParamSpec.ofDouble("center_freq", 0.1, 0.5, 0.05),
      ParamSpec.ofDouble("bandwidth", 0.01, 0.2, 0.02),
      ParamSpec.ofInteger("num_notches", 1, 5, 1)),
  ANISOTROPIC(
      "Anisotropic",
      ParamSpec.ofInteger("iterations", 5, 30, 5),
      ParamSpec.ofDouble("kappa", 10.0, 100.0, 10.0),
      ParamSpec.ofDouble("gamma", 0.05, 0.25, 0.05)),
  BILATERAL(
      "Bilateral",
      ParamSpec.ofInteger("d", 3, 15, 2),
      ParamSpec.ofDouble("sigmaColor", 10.0, 100.0, 10.0),
      ParamSpec.ofDouble("sigmaSpace", 10.0, 100.0, 10.0)),
  NLM(
      "NLM",
      ParamSpec.ofDouble("h", 0.5, 15.0, 0.5),
      ParamSpec.ofOddInteger("templateWindowSize", 3, 11, 2),
      ParamSpec.ofOddInteger("searchWindowSize", 7, 21, 2)),
  WAVELET("Wavelet", ParamSpec.ofDouble("sigma", 0.1, 2.0, 0.1)),
  FOURIER(
      "Fourier",
      ParamSpec.ofDouble("cutoff", 0.1, 0.9, 0.1),
      ParamSpec.ofInteger("order", 1, 8, 1),
      ParamSpec.ofDouble("bandwidth", 0.05, 0.3, 0.05));

  private final FilterSpec spec;

  NoiseFilter(String filterName, ParamSpec... paramSpecs) {
    this.spec = FilterSpec.create(filterName, paramSpecs);
  }

  public String filterName() {
    return spec.filterName();
  }

  public FilterSpec spec() {
    return spec;
  }

  public static Optional<NoiseFilter> forName(String filterName) {
    return Arrays.stream(values())
        .filter(filter -> filter.filterName().equals(filterName))
        .findFirst();
  }

  public static ImmutableList<FilterSpec> allSpecs() {
    return Arrays.stream(values()).map(NoiseFilter::spec).collect(toImmutableList());
  }
}
