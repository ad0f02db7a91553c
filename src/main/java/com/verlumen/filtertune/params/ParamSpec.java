package com.verlumen.filtertune.params;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.Range;
import java.io.Serializable;

/**
 * Specifies the admissible range, step size and type constraints for one filter parameter.
 *
 * <p>Every value produced by {@link #normalize(double)} lies within {@link #getRange()}, is a whole
 * number for {@link ParamType#INTEGER} parameters and is odd when {@link #oddOnly()} is set.
 */
@AutoValue
public abstract class ParamSpec implements Serializable {
  private static final long serialVersionUID = 1L;

  public abstract String name();

  public abstract ParamType type();

  public abstract double min();

  public abstract double max();

  /** Base step used by local search and by integer grid enumeration. */
  public abstract double step();

  public abstract boolean oddOnly();

  /** Creates a continuous parameter specification. */
  public static ParamSpec ofDouble(String name, double min, double max, double step) {
    return create(name, ParamType.DOUBLE, min, max, step, false);
  }

  /** Creates an integer parameter specification. */
  public static ParamSpec ofInteger(String name, int min, int max, int step) {
    return create(name, ParamType.INTEGER, min, max, step, false);
  }

  /**
   * Creates an integer parameter specification that only admits odd values, such as a window size.
   * Both bounds must be odd.
   */
  public static ParamSpec ofOddInteger(String name, int min, int max, int step) {
    checkArgument(isOdd(min) && isOdd(max), "Odd-only bounds must be odd: [%s, %s]", min, max);
    return create(name, ParamType.INTEGER, min, max, step, true);
  }

  private static ParamSpec create(
      String name, ParamType type, double min, double max, double step, boolean oddOnly) {
    checkArgument(!name.isEmpty(), "Parameter name cannot be empty");
    checkArgument(min <= max, "min %s must not exceed max %s for %s", min, max, name);
    checkArgument(step > 0, "step must be positive for %s but was %s", name, step);
    return new AutoValue_ParamSpec(name, type, min, max, step, oddOnly);
  }

  public Range<Double> getRange() {
    return Range.closed(min(), max());
  }

  public boolean isInteger() {
    return type() == ParamType.INTEGER;
  }

  /** Clamps {@code value} into {@code [min, max]}. NaN clamps to {@code min}. */
  public double clip(double value) {
    if (Double.isNaN(value)) {
      return min();
    }
    return Math.max(min(), Math.min(max(), value));
  }

  /**
   * Clips {@code value} and applies the type constraints.
   *
   * @return an {@link Integer} for integer parameters, a {@link Double} otherwise
   */
  public Number normalize(double value) {
    double clipped = clip(value);
    if (!isInteger()) {
      return clipped;
    }
    int rounded = (int) Math.round(clipped);
    if (oddOnly() && !isOdd(rounded)) {
      // Both bounds are odd, so an even value always has an odd neighbour inside the range.
      rounded = rounded + 1 <= max() ? rounded + 1 : rounded - 1;
    }
    return rounded;
  }

  /** Returns true if {@code value} satisfies every constraint of this specification. */
  public boolean admits(Number value) {
    double v = value.doubleValue();
    if (!getRange().contains(v)) {
      return false;
    }
    if (!isInteger()) {
      return true;
    }
    return v == Math.rint(v) && (!oddOnly() || isOdd((int) v));
  }

  private static boolean isOdd(int value) {
    return value % 2 != 0;
  }
}
