package net.larse.tsforecast.algorithms;

import java.util.Map;
import java.util.function.IntToDoubleFunction;
import net.larse.tsforecast.timeseries.CanonicalSeries;
import net.larse.tsforecast.timeseries.TimeSeriesUtils;

/** Deterministic daily series for the fitting and forecasting tests. */
final class SyntheticSeries {
  // 2020-01-01T00:00:00Z
  static final long START = 1577836800L;
  static final long DAY = TimeSeriesUtils.SECONDS_PER_DAY;

  private SyntheticSeries() {}

  /** Timestamp of day {@code t}, with day 0 at {@link #START}. */
  static long day(int t) {
    return START + t * DAY;
  }

  static long[] days(int from, int count) {
    long[] ts = new long[count];
    for (int i = 0; i < count; i++) {
      ts[i] = day(from + i);
    }
    return ts;
  }

  /** {@code count} daily values {@code f(t)} for t = from, from + 1, ... */
  static CanonicalSeries daily(int from, int count, IntToDoubleFunction f) {
    return daily(from, count, f, null, null, null);
  }

  static CanonicalSeries daily(
      int from,
      int count,
      IntToDoubleFunction f,
      double[] cap,
      double[] floor,
      Map<String, double[]> regressors) {
    double[] y = new double[count];
    for (int i = 0; i < count; i++) {
      y[i] = f.applyAsDouble(from + i);
    }
    return new CanonicalSeries(days(from, count), y, cap, floor, regressors);
  }

  /** {@code 100 + 0.5 t}. */
  static CanonicalSeries linear(int from, int count) {
    return daily(from, count, t -> 100 + 0.5 * t);
  }

  /** Phase of a timestamp within a period of {@code periodDays}, in radians. */
  static double phase(long ts, double periodDays) {
    return 2 * Math.PI * TimeSeriesUtils.epochDays(ts) / periodDays;
  }
}
