package com.verlumen.filtertune.params;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.Range;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParamSpecTest {
  private static final ParamSpec STRENGTH = ParamSpec.ofDouble("strength", 0.0, 1.0, 0.05);
  private static final ParamSpec ORDER = ParamSpec.ofInteger("order", 1, 8, 1);
  private static final ParamSpec WINDOW = ParamSpec.ofOddInteger("window_size", 3, 31, 2);

  @Test
  public void getRange_isClosedOverBounds() {
    assertThat(STRENGTH.getRange()).isEqualTo(Range.closed(0.0, 1.0));
  }

  @Test
  public void clip_clampsToBounds() {
    assertThat(STRENGTH.clip(-0.5)).isEqualTo(0.0);
    assertThat(STRENGTH.clip(1.5)).isEqualTo(1.0);
    assertThat(STRENGTH.clip(0.3)).isEqualTo(0.3);
  }

  @Test
  public void clip_nanGoesToMin() {
    assertThat(STRENGTH.clip(Double.NaN)).isEqualTo(0.0);
  }

  @Test
  public void normalize_doubleParam_returnsClippedDouble() {
    assertThat(STRENGTH.normalize(0.42)).isEqualTo(0.42);
    assertThat(STRENGTH.normalize(7.0)).isEqualTo(1.0);
  }

  @Test
  public void normalize_integerParam_roundsToInteger() {
    assertThat(ORDER.normalize(3.6)).isEqualTo(4);
    assertThat(ORDER.normalize(42.0)).isEqualTo(8);
    assertThat(ORDER.normalize(-3.0)).isEqualTo(1);
  }

  @Test
  public void normalize_oddOnlyParam_movesEvenValuesUp() {
    assertThat(WINDOW.normalize(6.0)).isEqualTo(7);
    assertThat(WINDOW.normalize(5.2)).isEqualTo(5);
  }

  @Test
  public void normalize_oddOnlyParam_evenValueAtUpperBoundMovesDown() {
    ParamSpec spec = ParamSpec.ofOddInteger("k", 3, 9, 2);

    assertThat(spec.normalize(9.6)).isEqualTo(9);
    assertThat(spec.normalize(8.4)).isEqualTo(9);
  }

  @Test
  public void normalize_oddOnlyParam_alwaysAdmitted() {
    for (double value = 0.0; value <= 40.0; value += 0.25) {
      Number normalized = WINDOW.normalize(value);
      assertThat(WINDOW.admits(normalized)).isTrue();
    }
  }

  @Test
  public void admits_rejectsViolations() {
    assertThat(WINDOW.admits(4)).isFalse();
    assertThat(WINDOW.admits(5.5)).isFalse();
    assertThat(WINDOW.admits(33)).isFalse();
    assertThat(WINDOW.admits(5)).isTrue();
    assertThat(ORDER.admits(2.0)).isTrue();
  }

  @Test
  public void ofOddInteger_evenBound_throws() {
    assertThrows(IllegalArgumentException.class, () -> ParamSpec.ofOddInteger("k", 2, 9, 2));
  }

  @Test
  public void create_minAboveMax_throws() {
    assertThrows(IllegalArgumentException.class, () -> ParamSpec.ofDouble("x", 1.0, 0.0, 0.1));
  }

  @Test
  public void create_nonPositiveStep_throws() {
    assertThrows(IllegalArgumentException.class, () -> ParamSpec.ofDouble("x", 0.0, 1.0, 0.0));
  }

  @Test
  public void create_emptyName_throws() {
    assertThrows(IllegalArgumentException.class, () -> ParamSpec.ofInteger("", 0, 1, 1));
  }
}
