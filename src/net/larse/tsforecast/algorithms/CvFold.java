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

/** A held-out observation scored against the forecast made at one cutoff. */
public final class CvFold {
  private final long cutoff;
  private final long timestamp;
  private final double actual;
  private final double predicted;
  private final double predictedLower;
  private final double predictedUpper;

  public CvFold(
      long cutoff,
      long timestamp,
      double actual,
      double predicted,
      double predictedLower,
      double predictedUpper) {
    this.cutoff = cutoff;
    this.timestamp = timestamp;
    this.actual = actual;
    this.predicted = predicted;
    this.predictedLower = predictedLower;
    this.predictedUpper = predictedUpper;
  }

  public long getCutoff() {
    return cutoff;
  }

  public long getTimestamp() {
    return timestamp;
  }

  /** Seconds from the cutoff to this observation. */
  public long getHorizon() {
    return timestamp - cutoff;
  }

  public double getActual() {
    return actual;
  }

  public double getPredicted() {
    return predicted;
  }

  public double getPredictedLower() {
    return predictedLower;
  }

  public double getPredictedUpper() {
    return predictedUpper;
  }

  public Map<String, Object> toRecord() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("cutoff", TimeSeriesUtils.format(cutoff));
    record.put("ds", TimeSeriesUtils.format(timestamp));
    record.put("y", actual);
    record.put("yhat", predicted);
    record.put("yhat_lower", predictedLower);
    record.put("yhat_upper", predictedUpper);
    return record;
  }

  @Override
  public String toString() {
    return toRecord().toString();
  }
}
