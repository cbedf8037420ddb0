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
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.larse.tsforecast.algorithms.CrossValidator.CvResult;
import net.larse.tsforecast.errors.ForecastException;
import net.larse.tsforecast.timeseries.CanonicalSeries;
import net.larse.tsforecast.timeseries.DataPreparer;
import net.larse.tsforecast.timeseries.FieldMapping;
import net.larse.tsforecast.timeseries.Holiday;
import net.larse.tsforecast.timeseries.TimeSeriesUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for fitting and forecasting: prepares records, fits, optionally cross-validates,
 * and assembles the fit report.
 */
public class ForecastEngine {
  private static final Logger logger = LoggerFactory.getLogger(ForecastEngine.class);

  // Fold details carried in a fit report.
  public static final int MAX_SAMPLE_FOLDS = 10;

  /** Rolling-origin cross-validation durations. */
  public static final class CvOptions {
    private final Duration initial;
    private final Duration period;
    private final Duration horizon;

    public CvOptions(Duration initial, Duration period, Duration horizon) {
      this.initial = Preconditions.checkNotNull(initial);
      this.period = Preconditions.checkNotNull(period);
      this.horizon = Preconditions.checkNotNull(horizon);
    }

    public Duration getInitial() {
      return initial;
    }

    public Duration getPeriod() {
      return period;
    }

    public Duration getHorizon() {
      return horizon;
    }
  }

  private final DataPreparer preparer;
  private final Fitter fitter;
  private final Forecaster forecaster;
  private final CrossValidator crossValidator;
  private final MetricsCalculator metrics;

  public ForecastEngine() {
    this(new DataPreparer(), new Fitter(), new Forecaster(), new CrossValidator(),
        new MetricsCalculator());
  }

  public ForecastEngine(
      DataPreparer preparer,
      Fitter fitter,
      Forecaster forecaster,
      CrossValidator crossValidator,
      MetricsCalculator metrics) {
    this.preparer = preparer;
    this.fitter = fitter;
    this.forecaster = forecaster;
    this.crossValidator = crossValidator;
    this.metrics = metrics;
  }

  /** Prepares raw records, then fits; holidays come from the mapped holiday field. */
  public FitReport fit(
      List<? extends Map<String, ?>> records,
      FieldMapping mapping,
      ModelConfig config,
      CvOptions cv)
      throws ForecastException {
    DataPreparer.Prepared prepared = preparer.prepare(records, mapping);
    return fit(prepared.getSeries(), prepared.getHolidays(), config, cv);
  }

  /**
   * Fits {@code series} with the extra holidays added to the config and, when {@code cv} is not
   * null, cross-validates the fitted model.
   */
  public FitReport fit(
      CanonicalSeries series, List<Holiday> holidays, ModelConfig config, CvOptions cv)
      throws ForecastException {
    ModelConfig effective = config;
    if (!holidays.isEmpty()) {
      effective = config.toBuilder().addHolidays(holidays).build();
    }
    FittedModel model = fitter.fit(series, effective);

    MetricRecord overall = null;
    List<MetricRecord> byHorizon = new ArrayList<>();
    List<CrossValidator.CvFailure> failures = new ArrayList<>();
    List<CvFold> sample = new ArrayList<>();
    if (cv != null) {
      CvResult result =
          crossValidator.crossValidate(model, cv.getInitial(), cv.getPeriod(), cv.getHorizon());
      failures.addAll(result.getFailures());
      if (!result.getFolds().isEmpty()) {
        overall = metrics.overall(result.getFolds());
        byHorizon.addAll(metrics.byHorizon(result.getFolds()));
        sample.addAll(
            result.getFolds().subList(0, Math.min(MAX_SAMPLE_FOLDS, result.getFolds().size())));
      }
      logger.info(
          "Cross-validation: {} folds, {} failed cutoffs",
          result.getFolds().size(), failures.size());
    }
    return new FitReport(
        model, summary(model), changepointRecords(model), overall, byHorizon, failures, sample);
  }

  public List<ForecastRow> forecast(FittedModel model, ForecastRequest request)
      throws ForecastException {
    return forecaster.forecast(model, request);
  }

  private static Map<String, Object> summary(FittedModel model) {
    CanonicalSeries history = model.getHistory();
    DesignMatrixBuilder design = model.getDesign();
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("rows", history.size());
    summary.put("start", TimeSeriesUtils.format(history.start()));
    summary.put("end", TimeSeriesUtils.format(history.end()));
    summary.put("config", model.getConfig().describe());
    summary.put("n_changepoints", model.getChangepoints().length);
    summary.put("seasonalities", design.seasonalityNames());
    summary.put("holidays", design.holidayNames());
    summary.put("regressors", design.getRegressors());
    summary.put("iterations", model.getIterations());
    summary.put("sigma", model.getSigma() * design.getYScale());
    return summary;
  }

  private static List<Map<String, Object>> changepointRecords(FittedModel model) {
    DesignMatrixBuilder design = model.getDesign();
    // scaled rate per unit of scaled time, to y units per day
    double perDay =
        design.getYScale() / (design.getTScale() / TimeSeriesUtils.SECONDS_PER_DAY);
    long[] changepoints = model.getChangepoints();
    double[] delta = model.getDelta();
    List<Map<String, Object>> records = new ArrayList<>();
    for (int j = 0; j < changepoints.length; j++) {
      Map<String, Object> record = new LinkedHashMap<>();
      record.put("index", j);
      record.put("ds", TimeSeriesUtils.format(changepoints[j]));
      record.put("delta", delta[j] * perDay);
      records.add(record);
    }
    return records;
  }
}
