package com.verlumen.filtertune.params;

import static com.google.common.truth.Truth.assertThat;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class NoiseFilterTest {
  @Test
  public void forName_findsFilter(@TestParameter NoiseFilter filter) {
    assertThat(NoiseFilter.forName(filter.filterName())).hasValue(filter);
  }

  @Test
  public void spec_declaresParameters(@TestParameter NoiseFilter filter) {
    assertThat(filter.spec().paramSpecs()).isNotEmpty();
  }

  @Test
  public void spec_boundsAreAdmissible(@TestParameter NoiseFilter filter) {
    for (ParamSpec spec : filter.spec().paramSpecs()) {
      assertThat(spec.admits(spec.normalize(spec.min()))).isTrue();
      assertThat(spec.admits(spec.normalize(spec.max()))).isTrue();
    }
  }

  @Test
  public void forName_unknownFilter_isEmpty() {
    assertThat(NoiseFilter.forName("Median")).isEmpty();
  }

  @Test
  public void linewiseWindowSize_isOddOnly() {
    ParamSpec windowSize = NoiseFilter.LINEWISE.spec().getParamSpec("window_size").get();

    assertThat(windowSize.oddOnly()).isTrue();
    assertThat(windowSize.isInteger()).isTrue();
    assertThat(windowSize.getRange().lowerEndpoint()).isEqualTo(3.0);
    assertThat(windowSize.getRange().upperEndpoint()).isEqualTo(31.0);
  }

  @Test
  public void allSpecs_coversEveryFilter() {
    assertThat(NoiseFilter.allSpecs()).hasSize(NoiseFilter.values().length);
  }
}
