package com.verlumen.filtertune.optimization;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PipelineParamsTest {
  private static final PipelineParams PARAMS =
      PipelineParams.of(
          ImmutableMap.<String, ImmutableMap<String, Object>>of(
              "Linewise",
              ImmutableMap.<String, Object>of("window_size", 5, "direction", "horizontal"),
              "NLM",
              ImmutableMap.<String, Object>of("h", 10.0)));

  @Test
  public void withValue_leavesOriginalUntouched() {
    PipelineParams changed = PARAMS.withValue("Linewise", "window_size", 7);

    assertThat(changed.getFilterParams("Linewise")).containsEntry("window_size", 7);
    assertThat(PARAMS.getFilterParams("Linewise")).containsEntry("window_size", 5);
  }

  @Test
  public void getNumber_numericValue_isPresent() {
    assertThat(PARAMS.getNumber("NLM", "h").getAsDouble()).isEqualTo(10.0);
  }

  @Test
  public void getNumber_nonNumericOrMissing_isEmpty() {
    assertThat(PARAMS.getNumber("Linewise", "direction").isPresent()).isFalse();
    assertThat(PARAMS.getNumber("Linewise", "strength").isPresent()).isFalse();
    assertThat(PARAMS.getNumber("Notch", "bandwidth").isPresent()).isFalse();
  }

  @Test
  public void getFilterParams_unknownFilter_isEmpty() {
    assertThat(PARAMS.getFilterParams("Notch")).isEmpty();
  }

  @Test
  public void copy_isEqualButIndependent() {
    PipelineParams copy = PARAMS.copy();

    assertThat(copy).isEqualTo(PARAMS);
    assertThat(copy.withValue("NLM", "h", 3.0)).isNotEqualTo(PARAMS);
  }

  @Test
  public void builder_keepsInsertionOrder() {
    PipelineParams params =
        PipelineParams.builder()
            .put("Notch", "bandwidth", 0.1)
            .put("Linewise", "strength", 1.0)
            .build();

    assertThat(params.asMap().keySet()).containsExactly("Notch", "Linewise").inOrder();
  }

  @Test
  public void builder_nullValue_throws() {
    assertThrows(
        NullPointerException.class,
        () -> PipelineParams.builder().put("Notch", "bandwidth", null));
  }

  @Test
  public void builder_emptyFilterName_throws() {
    assertThrows(
        IllegalArgumentException.class, () -> PipelineParams.builder().put("", "bandwidth", 0.1));
  }
}
