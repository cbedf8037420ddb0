/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.tsforecast.timeseries;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.Map;

/**
 * The validated historical series: strictly increasing unique timestamps, each with an observed
 * value and the covariates carried alongside it.
 */
public class CanonicalSeries extends CovariateFrame {
  private static final long serialVersionUID = 1L;

  private final double[] y;

  public CanonicalSeries(
      long[] timestamps,
      double[] y,
      double[] cap,
      double[] floor,
      Map<String, double[]> regressors) {
    super(timestamps, cap, floor, regressors);
    Preconditions.checkArgument(y.length == timestamps.length, "y has wrong length");
    for (int i = 0; i < y.length; i++) {
      Preconditions.checkArgument(Double.isFinite(y[i]), "missing value at row %s", i);
    }
    this.y = y.clone();
  }

  public static CanonicalSeries of(long[] timestamps, double[] y) {
    return new CanonicalSeries(timestamps, y, null, null, null);
  }

  public double y(int i) {
    return y[i];
  }

  public double[] values() {
    return y.clone();
  }

  /** Time covered by the series, in seconds. */
  public long span() {
    return end() - start();
  }

  /** The covariates of this series without its target. */
  public CovariateFrame covariates() {
    return new CovariateFrame(timestamps, cap, floor, regressors);
  }

  @Override
  public CanonicalSeries slice(int from, int to) {
    return new CanonicalSeries(
        Arrays.copyOfRange(timestamps, from, to),
        Arrays.copyOfRange(y, from, to),
        sliceColumn(cap, from, to),
        sliceColumn(floor, from, to),
        sliceRegressors(from, to));
  }

  /** Rows with a timestamp at or before the cutoff. */
  public CanonicalSeries truncate(long cutoff) {
    return slice(0, upperBound(cutoff));
  }

  /** Rows with a timestamp in (from, to]. */
  public CanonicalSeries between(long fromExclusive, long toInclusive) {
    return slice(upperBound(fromExclusive), upperBound(toInclusive));
  }
}
