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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.larse.tsforecast.errors.ConfigException;
import net.larse.tsforecast.errors.ForecastException;
import net.larse.tsforecast.helper.ArrayHelper;
import net.larse.tsforecast.timeseries.CanonicalSeries;
import net.larse.tsforecast.timeseries.CovariateFrame;
import net.larse.tsforecast.timeseries.Frequency;
import org.apache.commons.math.random.JDKRandomGenerator;
import org.apache.commons.math.random.RandomDataImpl;
import org.apache.commons.math.stat.descriptive.rank.Percentile;

/**
 * Evaluates a fitted model over history and future timestamps.
 *
 * <p>The point forecast uses the point estimate. Intervals come from the posterior samples: each
 * sample is evaluated with randomly simulated future trend changes and Gaussian observation noise,
 * and the bounds are the empirical quantiles of the simulated values. The simulation is seeded from
 * the model configuration, so repeated calls give identical results.
 */
public class Forecaster {
  // Added to the rate-change scale so it stays positive when every fitted change is zero.
  private static final double MIN_CHANGE_SCALE = 1e-8;

  /** Predictions for the rows of one frame. */
  public static final class Prediction {
    private final long[] timestamps;
    private final double[] trend;
    private final double[] yhat;
    private final double[] lower;
    private final double[] upper;
    private final ImmutableMap<String, double[]> components;

    Prediction(
        long[] timestamps,
        double[] trend,
        double[] yhat,
        double[] lower,
        double[] upper,
        Map<String, double[]> components) {
      this.timestamps = timestamps;
      this.trend = trend;
      this.yhat = yhat;
      this.lower = lower;
      this.upper = upper;
      this.components = ImmutableMap.copyOf(components);
    }

    public int size() {
      return timestamps.length;
    }

    public long timestamp(int i) {
      return timestamps[i];
    }

    public double trend(int i) {
      return trend[i];
    }

    public double yhat(int i) {
      return yhat[i];
    }

    public double lower(int i) {
      return lower[i];
    }

    public double upper(int i) {
      return upper[i];
    }

    public Map<String, double[]> getComponents() {
      return components;
    }
  }

  /**
   * Forecasts {@code request.periods} steps past the end of the history.
   *
   * @throws ConfigException on non-positive periods, an unknown frequency or missing capacity
   * @throws net.larse.tsforecast.errors.DataException on missing future regressor values
   */
  public List<ForecastRow> forecast(FittedModel model, ForecastRequest request)
      throws ForecastException {
    if (request.getPeriods() <= 0) {
      throw new ConfigException("periods must be positive", String.valueOf(request.getPeriods()));
    }
    Frequency frequency = Frequency.parse(request.getFrequency());

    CanonicalSeries history = model.getHistory();
    long[] future = frequency.sequence(history.end(), request.getPeriods());
    CovariateFrame futureFrame = futureFrame(future, request.getFutureCovariates());
    int historyRows = request.isIncludeHistory() ? history.size() : 0;
    CovariateFrame frame =
        request.isIncludeHistory()
            ? CovariateFrame.concat(history.covariates(), futureFrame)
            : futureFrame;

    Prediction prediction = predict(model, frame);
    List<ForecastRow> rows = new ArrayList<>(prediction.size());
    for (int i = 0; i < prediction.size(); i++) {
      Map<String, Double> components = new LinkedHashMap<>();
      for (Map.Entry<String, double[]> e : prediction.getComponents().entrySet()) {
        components.put(e.getKey(), e.getValue()[i]);
      }
      boolean historical = i < historyRows;
      rows.add(
          new ForecastRow(
              prediction.timestamp(i),
              prediction.trend(i),
              components,
              prediction.yhat(i),
              prediction.lower(i),
              prediction.upper(i),
              historical,
              historical ? history.y(i) : null));
    }
    return rows;
  }

  /** Evaluates the model at the rows of an arbitrary frame. */
  public Prediction predict(FittedModel model, CovariateFrame frame) throws ForecastException {
    DesignMatrixBuilder design = model.getDesign();
    DesignMatrix matrix = design.build(frame);
    double[] params = model.getParams();
    double yScale = design.getYScale();
    int n = matrix.size();

    double[] g = matrix.trend(params);
    double[] scaled = matrix.combine(g, params);
    double[] trend = new double[n];
    double[] yhat = new double[n];
    for (int i = 0; i < n; i++) {
      trend[i] = matrix.floor(i) + yScale * g[i];
      yhat[i] = matrix.floor(i) + yScale * scaled[i];
    }

    Map<String, double[]> components = new LinkedHashMap<>();
    for (String name : design.componentNames()) {
      double[] values = matrix.component(name, params);
      // multiplicative components stay relative to the trend
      if (!design.isMultiplicative()) {
        for (int i = 0; i < n; i++) {
          values[i] *= yScale;
        }
      }
      components.put(name, values);
    }

    double[] lower;
    double[] upper;
    if (model.numSamples() == 0) {
      lower = yhat.clone();
      upper = yhat.clone();
    } else {
      double[][] simulated = simulate(model, matrix);
      double width = model.getConfig().getIntervalWidth();
      Percentile percentile = new Percentile();
      lower = new double[n];
      upper = new double[n];
      for (int i = 0; i < n; i++) {
        lower[i] = percentile.evaluate(simulated[i], 100 * (1 - width) / 2);
        upper[i] = percentile.evaluate(simulated[i], 100 * (1 + width) / 2);
      }
    }
    return new Prediction(matrix.timestamps(), trend, yhat, lower, upper, components);
  }

  /** Simulated observations, one row per frame row and one column per posterior sample. */
  private static double[][] simulate(FittedModel model, DesignMatrix matrix) {
    JDKRandomGenerator generator = new JDKRandomGenerator();
    generator.setSeed(model.getConfig().getSeed());
    RandomDataImpl random = new RandomDataImpl(generator);

    TrendModel trendModel = matrix.getTrendModel();
    double[] t = matrix.time();
    double[] cap = matrix.scaledCap();
    double tMax = Double.NEGATIVE_INFINITY;
    for (double v : t) {
      tMax = Math.max(tMax, v);
    }
    double changeScale = ArrayHelper.meanAbs(model.getDelta()) + MIN_CHANGE_SCALE;
    double sigma = model.getSigma();
    double yScale = model.getDesign().getYScale();

    int n = matrix.size();
    int samples = model.numSamples();
    double[][] simulated = new double[n][samples];
    for (int s = 0; s < samples; s++) {
      double[] params = model.getSample(s);
      double[][] path =
          trendModel.simulateFutureChanges(matrix.delta(params), tMax, changeScale, random);
      double[] g =
          TrendModel.evaluate(
              trendModel.getGrowth(), params[0], params[1], path[0], path[1], t, cap);
      double[] scaled = matrix.combine(g, params);
      for (int i = 0; i < n; i++) {
        double noisy = scaled[i] + random.nextGaussian(0, sigma);
        simulated[i][s] = matrix.floor(i) + yScale * noisy;
      }
    }
    return simulated;
  }

  /** Future rows with covariates looked up by timestamp; absent cells stay NaN. */
  private static CovariateFrame futureFrame(long[] timestamps, CovariateFrame covariates) {
    if (covariates == null) {
      return CovariateFrame.of(timestamps);
    }
    int n = timestamps.length;
    double[] cap = covariates.hasCap() ? new double[n] : null;
    double[] floor = covariates.hasFloor() ? new double[n] : null;
    Map<String, double[]> regressors = new LinkedHashMap<>();
    for (String name : covariates.regressorNames()) {
      regressors.put(name, new double[n]);
    }
    for (int i = 0; i < n; i++) {
      int idx = covariates.indexOf(timestamps[i]);
      if (cap != null) {
        cap[i] = idx >= 0 ? covariates.cap(idx) : Double.NaN;
      }
      if (floor != null) {
        floor[i] = idx >= 0 ? covariates.floor(idx) : Double.NaN;
      }
      for (Map.Entry<String, double[]> e : regressors.entrySet()) {
        e.getValue()[i] = idx >= 0 ? covariates.regressor(e.getKey(), idx) : Double.NaN;
      }
    }
    return new CovariateFrame(timestamps, cap, floor, regressors);
  }
}
