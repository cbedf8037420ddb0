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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.commons.math.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math.stat.descriptive.rank.Percentile;

/** Aggregates cross-validation folds into accuracy metrics, per horizon or over all folds. */
public class MetricsCalculator {

  /** One record per distinct horizon, shortest first. */
  public List<MetricRecord> byHorizon(List<CvFold> folds) {
    Map<Long, List<CvFold>> groups = new TreeMap<>();
    for (CvFold fold : folds) {
      groups.computeIfAbsent(fold.getHorizon(), h -> new ArrayList<>()).add(fold);
    }
    List<MetricRecord> records = new ArrayList<>();
    for (Map.Entry<Long, List<CvFold>> e : groups.entrySet()) {
      records.add(compute(e.getKey(), e.getValue()));
    }
    return records;
  }

  public MetricRecord overall(List<CvFold> folds) {
    return compute(null, folds);
  }

  private static MetricRecord compute(Long horizon, List<CvFold> folds) {
    Preconditions.checkArgument(!folds.isEmpty(), "no folds to score");
    DescriptiveStatistics squared = new DescriptiveStatistics();
    DescriptiveStatistics absolute = new DescriptiveStatistics();
    DescriptiveStatistics percentage = new DescriptiveStatistics();
    DescriptiveStatistics symmetric = new DescriptiveStatistics();
    int covered = 0;

    for (CvFold fold : folds) {
      double actual = fold.getActual();
      double error = fold.getPredicted() - actual;
      squared.addValue(error * error);
      absolute.addValue(Math.abs(error));
      // zero actuals have no percentage error
      if (actual != 0) {
        percentage.addValue(Math.abs(error / actual));
      }
      double denominator = (Math.abs(actual) + Math.abs(fold.getPredicted())) / 2;
      if (denominator != 0) {
        symmetric.addValue(Math.abs(error) / denominator);
      }
      if (fold.getPredictedLower() <= actual && actual <= fold.getPredictedUpper()) {
        covered++;
      }
    }

    double mape = Double.POSITIVE_INFINITY;
    double mdape = Double.POSITIVE_INFINITY;
    if (percentage.getN() > 0) {
      mape = percentage.getMean();
      mdape = new Percentile().evaluate(percentage.getValues(), 50);
    }
    double smape = symmetric.getN() > 0 ? symmetric.getMean() : 0;
    return new MetricRecord(
        horizon,
        folds.size(),
        squared.getMean(),
        absolute.getMean(),
        mape,
        mdape,
        smape,
        covered / (double) folds.size());
  }
}
