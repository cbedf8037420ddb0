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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.larse.tsforecast.algorithms.CrossValidator.CvFailure;

/**
 * Everything a fit call reports: the model, a training summary, one record per changepoint and,
 * when cross-validation ran, its metrics, failures and a few sample folds.
 */
public final class FitReport {
  private final FittedModel model;
  private final ImmutableMap<String, Object> summary;
  private final ImmutableList<Map<String, Object>> changepoints;
  // cross-validation results, null or empty when it did not run
  private final MetricRecord overallMetrics;
  private final ImmutableList<MetricRecord> horizonMetrics;
  private final ImmutableList<CvFailure> failures;
  private final ImmutableList<CvFold> sampleFolds;

  FitReport(
      FittedModel model,
      Map<String, Object> summary,
      List<Map<String, Object>> changepoints,
      MetricRecord overallMetrics,
      List<MetricRecord> horizonMetrics,
      List<CvFailure> failures,
      List<CvFold> sampleFolds) {
    this.model = model;
    this.summary = ImmutableMap.copyOf(summary);
    this.changepoints = ImmutableList.copyOf(changepoints);
    this.overallMetrics = overallMetrics;
    this.horizonMetrics = ImmutableList.copyOf(horizonMetrics);
    this.failures = ImmutableList.copyOf(failures);
    this.sampleFolds = ImmutableList.copyOf(sampleFolds);
  }

  public FittedModel getModel() {
    return model;
  }

  public Map<String, Object> getSummary() {
    return summary;
  }

  /** Records of {@code index}, {@code ds} and {@code delta} (rate change in y units per day). */
  public List<Map<String, Object>> getChangepoints() {
    return changepoints;
  }

  public boolean hasCrossValidation() {
    return overallMetrics != null || !failures.isEmpty();
  }

  /** Metrics over all folds, or null when cross-validation did not run or produced no folds. */
  public MetricRecord getOverallMetrics() {
    return overallMetrics;
  }

  public List<MetricRecord> getHorizonMetrics() {
    return horizonMetrics;
  }

  public List<CvFailure> getFailures() {
    return failures;
  }

  public List<CvFold> getSampleFolds() {
    return sampleFolds;
  }
}
