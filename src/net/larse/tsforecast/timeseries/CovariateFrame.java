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
import com.google.common.collect.ImmutableMap;
import java.io.Serializable;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Column-oriented table of strictly increasing timestamps with optional capacity, floor and
 * regressor columns. Missing cells hold NaN.
 *
 * <p>Instances are immutable: arrays are copied on the way in and on the way out.
 */
public class CovariateFrame implements Serializable {
  private static final long serialVersionUID = 1L;

  protected final long[] timestamps;
  // null when the column is absent altogether
  protected final double[] cap;
  protected final double[] floor;
  protected final ImmutableMap<String, double[]> regressors;

  public CovariateFrame(
      long[] timestamps, double[] cap, double[] floor, Map<String, double[]> regressors) {
    Preconditions.checkNotNull(timestamps);
    for (int i = 1; i < timestamps.length; i++) {
      Preconditions.checkArgument(
          timestamps[i] > timestamps[i - 1], "timestamps must be strictly increasing at %s", i);
    }
    Preconditions.checkArgument(cap == null || cap.length == timestamps.length);
    Preconditions.checkArgument(floor == null || floor.length == timestamps.length);

    this.timestamps = timestamps.clone();
    this.cap = cap == null ? null : cap.clone();
    this.floor = floor == null ? null : floor.clone();

    ImmutableMap.Builder<String, double[]> copy = ImmutableMap.builder();
    if (regressors != null) {
      for (Map.Entry<String, double[]> e : regressors.entrySet()) {
        Preconditions.checkArgument(
            e.getValue().length == timestamps.length, "regressor %s has wrong length", e.getKey());
        copy.put(e.getKey(), e.getValue().clone());
      }
    }
    this.regressors = copy.build();
  }

  public static CovariateFrame of(long[] timestamps) {
    return new CovariateFrame(timestamps, null, null, null);
  }

  public int size() {
    return timestamps.length;
  }

  public long timestamp(int i) {
    return timestamps[i];
  }

  public long[] timestamps() {
    return timestamps.clone();
  }

  public long start() {
    return timestamps[0];
  }

  public long end() {
    return timestamps[timestamps.length - 1];
  }

  public boolean hasCap() {
    return cap != null;
  }

  public boolean hasFloor() {
    return floor != null;
  }

  /** Capacity at row i, NaN when absent. */
  public double cap(int i) {
    return cap == null ? Double.NaN : cap[i];
  }

  /** Floor at row i, NaN when absent. */
  public double floor(int i) {
    return floor == null ? Double.NaN : floor[i];
  }

  public Set<String> regressorNames() {
    return regressors.keySet();
  }

  public boolean hasRegressor(String name) {
    return regressors.containsKey(name);
  }

  /** Regressor value at row i, NaN when the column or the cell is absent. */
  public double regressor(String name, int i) {
    double[] column = regressors.get(name);
    return column == null ? Double.NaN : column[i];
  }

  /** Row of the given timestamp, or a negative value when absent. */
  public int indexOf(long epochSecond) {
    return Arrays.binarySearch(timestamps, epochSecond);
  }

  /** Rows [from, to). */
  public CovariateFrame slice(int from, int to) {
    return new CovariateFrame(
        Arrays.copyOfRange(timestamps, from, to),
        sliceColumn(cap, from, to),
        sliceColumn(floor, from, to),
        sliceRegressors(from, to));
  }

  protected static double[] sliceColumn(double[] column, int from, int to) {
    return column == null ? null : Arrays.copyOfRange(column, from, to);
  }

  protected Map<String, double[]> sliceRegressors(int from, int to) {
    ImmutableMap.Builder<String, double[]> sliced = ImmutableMap.builder();
    for (Map.Entry<String, double[]> e : regressors.entrySet()) {
      sliced.put(e.getKey(), Arrays.copyOfRange(e.getValue(), from, to));
    }
    return sliced.build();
  }

  /** First row whose timestamp is strictly greater than the given one. */
  protected int upperBound(long epochSecond) {
    int idx = Arrays.binarySearch(timestamps, epochSecond);
    return idx >= 0 ? idx + 1 : -idx - 1;
  }

  /**
   * Concatenates two frames. Every row of {@code later} must come after the last row of {@code
   * earlier}. A column present in only one frame is NaN-filled in the other.
   */
  public static CovariateFrame concat(CovariateFrame earlier, CovariateFrame later) {
    int n1 = earlier.size();
    int n2 = later.size();
    long[] ts = new long[n1 + n2];
    System.arraycopy(earlier.timestamps, 0, ts, 0, n1);
    System.arraycopy(later.timestamps, 0, ts, n1, n2);

    double[] cap = null;
    if (earlier.hasCap() || later.hasCap()) {
      cap = new double[n1 + n2];
      for (int i = 0; i < n1; i++) {
        cap[i] = earlier.cap(i);
      }
      for (int i = 0; i < n2; i++) {
        cap[n1 + i] = later.cap(i);
      }
    }
    double[] floor = null;
    if (earlier.hasFloor() || later.hasFloor()) {
      floor = new double[n1 + n2];
      for (int i = 0; i < n1; i++) {
        floor[i] = earlier.floor(i);
      }
      for (int i = 0; i < n2; i++) {
        floor[n1 + i] = later.floor(i);
      }
    }

    ImmutableMap.Builder<String, double[]> regressors = ImmutableMap.builder();
    LinkedHashSet<String> names = new LinkedHashSet<>(earlier.regressorNames());
    names.addAll(later.regressorNames());
    for (String name : names) {
      double[] column = new double[n1 + n2];
      for (int i = 0; i < n1; i++) {
        column[i] = earlier.regressor(name, i);
      }
      for (int i = 0; i < n2; i++) {
        column[n1 + i] = later.regressor(name, i);
      }
      regressors.put(name, column);
    }
    return new CovariateFrame(ts, cap, floor, regressors.build());
  }
}
