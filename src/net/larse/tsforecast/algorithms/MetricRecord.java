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

import java.util.LinkedHashMap;
import java.util.Map;
import net.larse.tsforecast.timeseries.TimeSeriesUtils;

/**
 * Accuracy of a group of cross-validation folds. Percentage errors are fractions, so a MAPE of
 * 0.05 means 5%.
 */
public final class MetricRecord {
  // null for the overall record
  private final Long horizon;
  private final int count;
  private final double mse;
  private final double rmse;
  private final double mae;
  private final double mape;
  private final double mdape;
  private final double smape;
  private final double coverage;

  MetricRecord(
      Long horizon,
      int count,
      double mse,
      double mae,
      double mape,
      double mdape,
      double smape,
      double coverage) {
    this.horizon = horizon;
    this.count = count;
    this.mse = mse;
    this.rmse = Math.sqrt(mse);
    this.mae = mae;
    this.mape = mape;
    this.mdape = mdape;
    this.smape = smape;
    this.coverage = coverage;
  }

  /** Horizon in seconds, or null for a record over all horizons. */
  public Long getHorizon() {
    return horizon;
  }

  public int getCount() {
    return count;
  }

  public double getMse() {
    return mse;
  }

  public double getRmse() {
    return rmse;
  }

  public double getMae() {
    return mae;
  }

  /** Mean absolute percentage error over non-zero actuals; infinite when every actual is zero. */
  public double getMape() {
    return mape;
  }

  public double getMdape() {
    return mdape;
  }

  public double getSmape() {
    return smape;
  }

  /** Fraction of actuals inside the predicted interval. */
  public double getCoverage() {
    return coverage;
  }

  public Map<String, Object> toRecord() {
    Map<String, Object> record = new LinkedHashMap<>();
    if (horizon != null) {
      record.put("horizon_days", horizon / (double) TimeSeriesUtils.SECONDS_PER_DAY);
    }
    record.put("count", count);
    record.put("mse", mse);
    record.put("rmse", rmse);
    record.put("mae", mae);
    record.put("mape", mape);
    record.put("mdape", mdape);
    record.put("smape", smape);
    record.put("coverage", coverage);
    return record;
  }

  @Override
  public String toString() {
    return toRecord().toString();
  }
}
