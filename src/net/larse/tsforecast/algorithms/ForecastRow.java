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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.larse.tsforecast.timeseries.TimeSeriesUtils;

/** One row of a forecast: point prediction, interval, trend and the per-component values. */
public final class ForecastRow {
  private final long timestamp;
  private final double trend;
  private final ImmutableMap<String, Double> components;
  private final double yhat;
  private final double yhatLower;
  private final double yhatUpper;
  private final boolean historical;
  private final Double observed;

  public ForecastRow(
      long timestamp,
      double trend,
      Map<String, Double> components,
      double yhat,
      double yhatLower,
      double yhatUpper,
      boolean historical,
      Double observed) {
    this.timestamp = timestamp;
    this.trend = trend;
    this.components = ImmutableMap.copyOf(components);
    this.yhat = yhat;
    this.yhatLower = yhatLower;
    this.yhatUpper = yhatUpper;
    this.historical = historical;
    this.observed = observed;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public double getTrend() {
    return trend;
  }

  public Map<String, Double> getComponents() {
    return components;
  }

  public double getYhat() {
    return yhat;
  }

  public double getYhatLower() {
    return yhatLower;
  }

  public double getYhatUpper() {
    return yhatUpper;
  }

  public boolean isHistorical() {
    return historical;
  }

  /** The observed value of a historical row, null for future rows. */
  public Double getObserved() {
    return observed;
  }

  /** Flat output record, in column order. */
  public Map<String, Object> toRecord() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("ds", TimeSeriesUtils.format(timestamp));
    record.put("yhat", yhat);
    record.put("yhat_lower", yhatLower);
    record.put("yhat_upper", yhatUpper);
    record.put("trend", trend);
    record.putAll(components);
    record.put("forecast_type", historical ? "historical" : "forecast");
    if (observed != null) {
      record.put("y", observed);
    }
    return record;
  }

  @Override
  public String toString() {
    return toRecord().toString();
  }
}
