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

package net.larse.tsforecast.algorithms;

import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.List;

/**
 * Scaled time, capacity and feature columns of one frame, built by {@link DesignMatrixBuilder}.
 *
 * <p>Coefficient vectors passed in here use the fitting layout {@code [k, m, delta..., beta...]}.
 */
public final class DesignMatrix {
  /** Metadata of one feature column. */
  public static final class FeatureColumn implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final String component;
    private final boolean multiplicative;
    private final double priorScale;

    FeatureColumn(String name, String component, boolean multiplicative, double priorScale) {
      this.name = name;
      this.component = component;
      this.multiplicative = multiplicative;
      this.priorScale = priorScale;
    }

    public String getName() {
      return name;
    }

    /** The output component the column contributes to. */
    public String getComponent() {
      return component;
    }

    public boolean isMultiplicative() {
      return multiplicative;
    }

    public double getPriorScale() {
      return priorScale;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  private final long[] timestamps;
  private final double[] t;
  private final double[] cap;
  private final double[] floor;
  private final double[][] features;
  private final ImmutableList<FeatureColumn> columns;
  private final TrendModel trend;

  DesignMatrix(
      long[] timestamps,
      double[] t,
      double[] cap,
      double[] floor,
      double[][] features,
      List<FeatureColumn> columns,
      TrendModel trend) {
    this.timestamps = timestamps;
    this.t = t;
    this.cap = cap;
    this.floor = floor;
    this.features = features;
    this.columns = ImmutableList.copyOf(columns);
    this.trend = trend;
  }

  public int size() {
    return timestamps.length;
  }

  public int numFeatures() {
    return columns.size();
  }

  public int numChangepoints() {
    return trend.numChangepoints();
  }

  /** Number of fitted parameters: k, m, one per changepoint and one per feature. */
  public int numParameters() {
    return 2 + numChangepoints() + numFeatures();
  }

  public List<FeatureColumn> getColumns() {
    return columns;
  }

  public TrendModel getTrendModel() {
    return trend;
  }

  public long timestamp(int i) {
    return timestamps[i];
  }

  public long[] timestamps() {
    return timestamps.clone();
  }

  /** Scaled time of every row: 0 at the first training row, 1 at the last. */
  public double[] time() {
    return t.clone();
  }

  /** Capacity above the floor, in scaled units. NaN under linear growth. */
  public double[] scaledCap() {
    return cap.clone();
  }

  /** Floor of row i in data units, 0 when the model has none. */
  public double floor(int i) {
    return floor[i];
  }

  public double feature(int row, int column) {
    return features[row][column];
  }

  /** Scaled trend under the trend part of {@code params}. */
  public double[] trend(double[] params) {
    return trend.evaluate(params[0], params[1], delta(params), t, cap);
  }

  /** Rate changes from a parameter vector. */
  public double[] delta(double[] params) {
    double[] delta = new double[numChangepoints()];
    System.arraycopy(params, 2, delta, 0, delta.length);
    return delta;
  }

  /** Offset of the first feature coefficient in a parameter vector. */
  public int featureOffset() {
    return 2 + numChangepoints();
  }

  /** Row sums of the additive (or multiplicative) feature columns times their coefficients. */
  public double[] featureSums(double[] params, boolean multiplicative) {
    int offset = featureOffset();
    double[] out = new double[timestamps.length];
    for (int j = 0; j < columns.size(); j++) {
      if (columns.get(j).isMultiplicative() != multiplicative) {
        continue;
      }
      double beta = params[offset + j];
      for (int i = 0; i < out.length; i++) {
        out[i] += features[i][j] * beta;
      }
    }
    return out;
  }

  /** Row sums of the columns belonging to one component. */
  public double[] component(String component, double[] params) {
    int offset = featureOffset();
    double[] out = new double[timestamps.length];
    for (int j = 0; j < columns.size(); j++) {
      if (!columns.get(j).getComponent().equals(component)) {
        continue;
      }
      double beta = params[offset + j];
      for (int i = 0; i < out.length; i++) {
        out[i] += features[i][j] * beta;
      }
    }
    return out;
  }

  /** Scaled prediction {@code g (1 + X_mult beta) + X_add beta} for a given trend. */
  public double[] combine(double[] trendValues, double[] params) {
    double[] mult = featureSums(params, true);
    double[] add = featureSums(params, false);
    double[] out = new double[timestamps.length];
    for (int i = 0; i < out.length; i++) {
      out[i] = trendValues[i] * (1 + mult[i]) + add[i];
    }
    return out;
  }
}
