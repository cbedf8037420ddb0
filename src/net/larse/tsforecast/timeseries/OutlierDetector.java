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
import org.apache.commons.math.stat.descriptive.DescriptiveStatistics;

/** Flags outlying observations of a series, either by interquartile range or by z-score. */
public final class OutlierDetector {
  public enum Method {
    IQR,
    ZSCORE
  }

  public static final double DEFAULT_THRESHOLD = 1.5;

  private final Method method;
  private final double threshold;

  public OutlierDetector() {
    this(Method.IQR, DEFAULT_THRESHOLD);
  }

  public OutlierDetector(Method method, double threshold) {
    Preconditions.checkArgument(threshold > 0, "threshold must be positive");
    this.method = Preconditions.checkNotNull(method);
    this.threshold = threshold;
  }

  public boolean[] flag(CanonicalSeries series) {
    return flag(series.values());
  }

  public boolean[] flag(double[] values) {
    boolean[] outliers = new boolean[values.length];
    if (values.length == 0) {
      return outliers;
    }
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (double v : values) {
      stats.addValue(v);
    }

    if (method == Method.IQR) {
      double q1 = stats.getPercentile(25);
      double q3 = stats.getPercentile(75);
      double iqr = q3 - q1;
      double lower = q1 - threshold * iqr;
      double upper = q3 + threshold * iqr;
      for (int i = 0; i < values.length; i++) {
        outliers[i] = values[i] < lower || values[i] > upper;
      }
    } else {
      double mean = stats.getMean();
      double std = stats.getStandardDeviation();
      // a constant series has no outliers
      if (std > 0) {
        for (int i = 0; i < values.length; i++) {
          outliers[i] = Math.abs(values[i] - mean) / std > threshold;
        }
      }
    }
    return outliers;
  }
}
