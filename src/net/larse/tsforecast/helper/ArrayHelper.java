package net.larse.tsforecast.helper;

/** Static array manipulation functions. */
public class ArrayHelper {
  /**
   * Returns {@code num} evenly spaced values over [start, end], both ends included. A single value
   * is {@code start}.
   */
  public static double[] linspace(double start, double end, int num) {
    double[] result = new double[num];
    if (num == 1) {
      result[0] = start;
      return result;
    }
    double step = (end - start) / (num - 1);
    for (int i = 0; i < num; i++) {
      result[i] = start + i * step;
    }
    // pin the last value against accumulated rounding
    result[num - 1] = end;
    return result;
  }

  /** Largest absolute difference between values and reference, element by element. */
  public static double maxAbsDifference(double[] values, double[] reference) {
    double max = 0;
    for (int i = 0; i < values.length; i++) {
      max = Math.max(max, Math.abs(values[i] - reference[i]));
    }
    return max;
  }

  /** Largest absolute value, 0 for an empty array. */
  public static double maxAbs(double[] values) {
    double max = 0;
    for (double v : values) {
      max = Math.max(max, Math.abs(v));
    }
    return max;
  }

  /** Mean of the absolute values, 0 for an empty array. */
  public static double meanAbs(double[] values) {
    if (values.length == 0) {
      return 0;
    }
    double sum = 0;
    for (double v : values) {
      sum += Math.abs(v);
    }
    return sum / values.length;
  }

  /** True when every value is exactly 0 or 1. */
  public static boolean isBinary(double[] values) {
    for (double v : values) {
      if (v != 0 && v != 1) {
        return false;
      }
    }
    return true;
  }
}
