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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.larse.tsforecast.algorithms.DesignMatrix.FeatureColumn;
import net.larse.tsforecast.algorithms.ModelConfig.Growth;
import net.larse.tsforecast.algorithms.ModelConfig.Seasonality;
import net.larse.tsforecast.algorithms.ModelConfig.SeasonalityMode;
import net.larse.tsforecast.algorithms.ModelConfig.Toggle;
import net.larse.tsforecast.errors.ConfigException;
import net.larse.tsforecast.errors.DataException;
import net.larse.tsforecast.errors.ForecastException;
import net.larse.tsforecast.helper.ArrayHelper;
import net.larse.tsforecast.timeseries.CanonicalSeries;
import net.larse.tsforecast.timeseries.CovariateFrame;
import net.larse.tsforecast.timeseries.Holiday;
import net.larse.tsforecast.timeseries.TimeSeriesUtils;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds design matrices for any frame from state fixed by the training history: time and value
 * scaling, changepoints, the resolved seasonalities, holiday windows and regressor standardization.
 *
 * <p>A builder is created once per fit and kept with the fitted model, so matrices for future
 * frames are reproduced from the history alone.
 */
public final class DesignMatrixBuilder implements Serializable {
  private static final long serialVersionUID = 1L;
  private static final Logger logger = LoggerFactory.getLogger(DesignMatrixBuilder.class);

  public static final double YEARLY_PERIOD = 365.25;
  public static final double WEEKLY_PERIOD = 7;
  public static final double DAILY_PERIOD = 1;

  /** A Fourier seasonality that survived toggle resolution. */
  static final class SeasonalTerm implements Serializable {
    private static final long serialVersionUID = 1L;

    final String name;
    final double period;
    final int order;

    SeasonalTerm(String name, double period, int order) {
      this.name = name;
      this.period = period;
      this.order = order;
    }
  }

  private final Growth growth;
  private final boolean multiplicative;
  private final long start;
  private final double tScale;
  private final double yScale;
  private final boolean useFloor;
  private final long[] changepoints;
  private final TrendModel trend;
  private final ImmutableList<SeasonalTerm> seasonalTerms;
  private final ImmutableMap<String, ImmutableSet<LocalDate>> holidayDays;
  private final ImmutableList<String> regressors;
  private final double[] regressorMean;
  private final double[] regressorStd;
  private final ImmutableList<FeatureColumn> columns;

  private DesignMatrixBuilder(CanonicalSeries history, ModelConfig config)
      throws ForecastException {
    this.growth = config.getGrowth();
    this.multiplicative = config.getSeasonalityMode() == SeasonalityMode.MULTIPLICATIVE;
    this.start = history.start();
    this.tScale = history.span();

    if (growth == Growth.LOGISTIC && !history.hasCap()) {
      throw new ConfigException("Logistic growth requires a capacity column", "cap");
    }
    this.useFloor = growth == Growth.LOGISTIC && history.hasFloor();
    double[] floor = new double[history.size()];
    for (int i = 0; i < floor.length; i++) {
      floor[i] = useFloor ? history.floor(i) : 0;
    }
    double maxDeviation = ArrayHelper.maxAbsDifference(history.values(), floor);
    this.yScale = maxDeviation > 0 ? maxDeviation : 1;

    this.changepoints = TrendModel.placeChangepoints(history, config);
    double[] scaled = new double[changepoints.length];
    for (int j = 0; j < scaled.length; j++) {
      scaled[j] = (changepoints[j] - start) / tScale;
    }
    this.trend = new TrendModel(growth, scaled);

    this.seasonalTerms = resolveSeasonalities(history, config);
    this.holidayDays = expandHolidays(config.getHolidays());

    this.regressors = ImmutableList.copyOf(config.getRegressors());
    this.regressorMean = new double[regressors.size()];
    this.regressorStd = new double[regressors.size()];
    for (int r = 0; r < regressors.size(); r++) {
      standardize(history, r);
    }

    double priorScale = config.getSeasonalityPriorScale();
    ImmutableList.Builder<FeatureColumn> cols = ImmutableList.builder();
    for (SeasonalTerm term : seasonalTerms) {
      for (int n = 1; n <= term.order; n++) {
        cols.add(new FeatureColumn(term.name + "_sin" + n, term.name, multiplicative, priorScale));
        cols.add(new FeatureColumn(term.name + "_cos" + n, term.name, multiplicative, priorScale));
      }
    }
    for (String name : holidayDays.keySet()) {
      cols.add(new FeatureColumn(name, "holidays", multiplicative, priorScale));
    }
    for (String name : regressors) {
      cols.add(new FeatureColumn(name, name, multiplicative, priorScale));
    }
    this.columns = cols.build();

    logger.debug(
        "Design: {} changepoints, seasonalities {}, {} holidays, {} regressors",
        changepoints.length, seasonalityNames(), holidayDays.size(), regressors.size());
  }

  /**
   * Fixes scaling, changepoints and the feature layout against a training history.
   *
   * @throws ConfigException on logistic growth without capacity or misplaced changepoints
   * @throws DataException on a regressor that is missing from the history
   */
  public static DesignMatrixBuilder create(CanonicalSeries history, ModelConfig config)
      throws ForecastException {
    return new DesignMatrixBuilder(history, config);
  }

  /**
   * Design matrix for a frame, historical or future.
   *
   * @throws ConfigException when logistic growth meets a row without capacity or floor
   * @throws DataException on a capacity not above the floor or a missing regressor value
   */
  public DesignMatrix build(CovariateFrame frame) throws ForecastException {
    int n = frame.size();
    double[] t = new double[n];
    double[] cap = new double[n];
    double[] floor = new double[n];
    for (int i = 0; i < n; i++) {
      long ts = frame.timestamp(i);
      t[i] = (ts - start) / tScale;
      floor[i] = 0;
      if (useFloor) {
        floor[i] = frame.floor(i);
        if (Double.isNaN(floor[i])) {
          throw new ConfigException(
              "Missing floor under logistic growth", TimeSeriesUtils.format(ts));
        }
      }
      if (growth == Growth.LOGISTIC) {
        double c = frame.cap(i);
        if (Double.isNaN(c)) {
          throw new ConfigException(
              "Logistic growth requires a capacity on every row", TimeSeriesUtils.format(ts));
        }
        if (c <= floor[i]) {
          throw new DataException("Capacity must exceed the floor", TimeSeriesUtils.format(ts));
        }
        cap[i] = (c - floor[i]) / yScale;
      } else {
        cap[i] = Double.NaN;
      }
    }

    double[][] features = new double[n][columns.size()];
    for (int i = 0; i < n; i++) {
      fillRow(frame, i, features[i]);
    }
    return new DesignMatrix(frame.timestamps(), t, cap, floor, features, columns, trend);
  }

  private void fillRow(CovariateFrame frame, int i, double[] row) throws DataException {
    long ts = frame.timestamp(i);
    int col = 0;
    double days = TimeSeriesUtils.epochDays(ts);
    for (SeasonalTerm term : seasonalTerms) {
      for (int n = 1; n <= term.order; n++) {
        double x = 2 * Math.PI * n * days / term.period;
        row[col++] = Math.sin(x);
        row[col++] = Math.cos(x);
      }
    }

    LocalDate day = TimeSeriesUtils.toDate(ts);
    for (Set<LocalDate> covered : holidayDays.values()) {
      row[col++] = covered.contains(day) ? 1 : 0;
    }

    for (int r = 0; r < regressors.size(); r++) {
      String name = regressors.get(r);
      double v = frame.regressor(name, i);
      if (Double.isNaN(v)) {
        throw new DataException(
            "Missing regressor value", name + " at " + TimeSeriesUtils.format(ts));
      }
      row[col++] = (v - regressorMean[r]) / regressorStd[r];
    }
  }

  private void standardize(CanonicalSeries history, int r) throws DataException {
    String name = regressors.get(r);
    if (!history.hasRegressor(name)) {
      throw new DataException("Regressor not found in history", name);
    }
    double[] values = new double[history.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = history.regressor(name, i);
      if (Double.isNaN(values[i])) {
        throw new DataException(
            "Missing regressor value",
            name + " at " + TimeSeriesUtils.format(history.timestamp(i)));
      }
    }
    regressorMean[r] = 0;
    regressorStd[r] = 1;
    if (ArrayHelper.isBinary(values) || values.length < 2) {
      return;
    }
    double std = new StandardDeviation().evaluate(values);
    if (std > 0) {
      double sum = 0;
      for (double v : values) {
        sum += v;
      }
      regressorMean[r] = sum / values.length;
      regressorStd[r] = std;
    }
  }

  @VisibleForTesting
  static ImmutableList<SeasonalTerm> resolveSeasonalities(
      CanonicalSeries history, ModelConfig config) {
    double spanDays = history.span() / (double) TimeSeriesUtils.SECONDS_PER_DAY;
    double spacingDays =
        TimeSeriesUtils.minSpacing(history.timestamps()) / (double) TimeSeriesUtils.SECONDS_PER_DAY;

    ImmutableList.Builder<SeasonalTerm> terms = ImmutableList.builder();
    if (enabled(config.getYearly(), spanDays >= 730, "yearly")) {
      terms.add(new SeasonalTerm("yearly", YEARLY_PERIOD, config.getYearlyOrder()));
    }
    boolean weeklyResolved = spanDays >= 2 * WEEKLY_PERIOD && spacingDays < WEEKLY_PERIOD;
    if (enabled(config.getWeekly(), weeklyResolved, "weekly")) {
      terms.add(new SeasonalTerm("weekly", WEEKLY_PERIOD, config.getWeeklyOrder()));
    }
    if (enabled(
        config.getDaily(), spanDays >= 2 * DAILY_PERIOD && spacingDays < DAILY_PERIOD, "daily")) {
      terms.add(new SeasonalTerm("daily", DAILY_PERIOD, config.getDailyOrder()));
    }
    for (Seasonality s : config.getSeasonalities()) {
      terms.add(new SeasonalTerm(s.getName(), s.getPeriodDays(), s.getFourierOrder()));
    }
    return terms.build();
  }

  private static boolean enabled(Toggle toggle, boolean autoResult, String name) {
    if (toggle == Toggle.AUTO) {
      if (!autoResult) {
        logger.info("Disabling {} seasonality; the history does not resolve it", name);
      }
      return autoResult;
    }
    return toggle == Toggle.ON;
  }

  /** Days covered by each holiday name, names in order of first appearance. */
  private static ImmutableMap<String, ImmutableSet<LocalDate>> expandHolidays(
      List<Holiday> holidays) {
    Map<String, Set<LocalDate>> days = new LinkedHashMap<>();
    for (Holiday h : holidays) {
      days.computeIfAbsent(h.getName(), k -> new LinkedHashSet<>()).addAll(h.windowDays());
    }
    ImmutableMap.Builder<String, ImmutableSet<LocalDate>> out = ImmutableMap.builder();
    for (Map.Entry<String, Set<LocalDate>> e : days.entrySet()) {
      out.put(e.getKey(), ImmutableSet.copyOf(e.getValue()));
    }
    return out.build();
  }

  public Growth getGrowth() {
    return growth;
  }

  public TrendModel getTrendModel() {
    return trend;
  }

  public List<FeatureColumn> getColumns() {
    return columns;
  }

  /** Changepoints in epoch seconds. */
  public long[] getChangepoints() {
    return changepoints.clone();
  }

  public long getStart() {
    return start;
  }

  /** Seconds per unit of scaled time: the training span. */
  public double getTScale() {
    return tScale;
  }

  public double getYScale() {
    return yScale;
  }

  public List<String> seasonalityNames() {
    List<String> names = new ArrayList<>();
    for (SeasonalTerm term : seasonalTerms) {
      names.add(term.name);
    }
    return names;
  }

  public boolean hasHolidays() {
    return !holidayDays.isEmpty();
  }

  public List<String> holidayNames() {
    return holidayDays.keySet().asList();
  }

  public List<String> getRegressors() {
    return regressors;
  }

  /** Output component names: each seasonality, the holiday total, then each regressor. */
  public List<String> componentNames() {
    List<String> names = seasonalityNames();
    if (hasHolidays()) {
      names.add("holidays");
    }
    names.addAll(regressors);
    return names;
  }

  public boolean isMultiplicative() {
    return multiplicative;
  }
}
