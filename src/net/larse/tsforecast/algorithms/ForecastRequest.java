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

import net.larse.tsforecast.timeseries.CovariateFrame;

/**
 * What to forecast: {@code periods} steps of {@code frequency} past the last observation,
 * optionally preceded by the history. Future capacity, floor and regressor values are looked up by
 * timestamp in {@code futureCovariates}.
 */
public final class ForecastRequest {
  private final int periods;
  private final String frequency;
  private final boolean includeHistory;
  private final CovariateFrame futureCovariates;

  public ForecastRequest(
      int periods, String frequency, boolean includeHistory, CovariateFrame futureCovariates) {
    this.periods = periods;
    this.frequency = frequency;
    this.includeHistory = includeHistory;
    this.futureCovariates = futureCovariates;
  }

  /** A future-only request without covariates. */
  public static ForecastRequest of(int periods, String frequency) {
    return new ForecastRequest(periods, frequency, false, null);
  }

  public ForecastRequest withHistory(boolean includeHistory) {
    return new ForecastRequest(periods, frequency, includeHistory, futureCovariates);
  }

  public ForecastRequest withFutureCovariates(CovariateFrame covariates) {
    return new ForecastRequest(periods, frequency, includeHistory, covariates);
  }

  public int getPeriods() {
    return periods;
  }

  public String getFrequency() {
    return frequency;
  }

  public boolean isIncludeHistory() {
    return includeHistory;
  }

  /** Covariates of future rows, or null. */
  public CovariateFrame getFutureCovariates() {
    return futureCovariates;
  }
}
