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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import net.larse.tsforecast.errors.ConfigException;
import net.larse.tsforecast.timeseries.Holiday;
import net.larse.tsforecast.timeseries.TimeSeriesUtils;

/**
 * Immutable model configuration. Every field has a default; {@link Builder#build()} validates the
 * combination and fails with {@link ConfigException}.
 */
public final class ModelConfig implements Serializable {
  private static final long serialVersionUID = 1L;

  public enum Growth {
    LINEAR,
    LOGISTIC
  }

  public enum SeasonalityMode {
    ADDITIVE,
    MULTIPLICATIVE
  }

  /** Seasonality switch; AUTO is resolved once against the training history. */
  public enum Toggle {
    AUTO,
    ON,
    OFF
  }

  /** A named Fourier seasonality with its period in days. */
  public static final class Seasonality implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final double periodDays;
    private final int fourierOrder;

    public Seasonality(String name, double periodDays, int fourierOrder) {
      this.name = Preconditions.checkNotNull(name);
      this.periodDays = periodDays;
      this.fourierOrder = fourierOrder;
    }

    public String getName() {
      return name;
    }

    public double getPeriodDays() {
      return periodDays;
    }

    public int getFourierOrder() {
      return fourierOrder;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Seasonality)) {
        return false;
      }
      Seasonality other = (Seasonality) o;
      return name.equals(other.name)
          && periodDays == other.periodDays
          && fourierOrder == other.fourierOrder;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, periodDays, fourierOrder);
    }

    @Override
    public String toString() {
      return name + "(" + periodDays + "d, order " + fourierOrder + ")";
    }
  }

  public static final int DEFAULT_YEARLY_ORDER = 10;
  public static final int DEFAULT_WEEKLY_ORDER = 3;
  public static final int DEFAULT_DAILY_ORDER = 4;
  public static final int DEFAULT_CUSTOM_ORDER = 10;

  // Names a seasonality or regressor may not take: they are output columns or reserved components.
  static final ImmutableSet<String> RESERVED_NAMES =
      ImmutableSet.of(
          "ds", "y", "trend", "holidays", "yhat", "yhat_lower", "yhat_upper", "forecast_type");

  private final Growth growth;
  private final SeasonalityMode seasonalityMode;
  private final Toggle yearly;
  private final Toggle weekly;
  private final Toggle daily;
  private final int yearlyOrder;
  private final int weeklyOrder;
  private final int dailyOrder;
  private final ImmutableList<Seasonality> seasonalities;
  private final ImmutableList<Holiday> holidays;
  private final ImmutableList<String> regressors;
  private final double changepointPriorScale;
  private final double seasonalityPriorScale;
  private final int uncertaintySamples;
  private final double intervalWidth;
  private final int nChangepoints;
  private final double changepointRange;
  // null when changepoints are placed automatically
  private final ImmutableList<Long> changepoints;
  private final int maxIterations;
  private final double tolerance;
  private final long seed;

  private ModelConfig(Builder b) {
    this.growth = b.growth;
    this.seasonalityMode = b.seasonalityMode;
    this.yearly = b.yearly;
    this.weekly = b.weekly;
    this.daily = b.daily;
    this.yearlyOrder = b.yearlyOrder;
    this.weeklyOrder = b.weeklyOrder;
    this.dailyOrder = b.dailyOrder;
    this.seasonalities = ImmutableList.copyOf(b.seasonalities);
    this.holidays = ImmutableList.copyOf(new LinkedHashSet<>(b.holidays));
    this.regressors = ImmutableList.copyOf(b.regressors);
    this.changepointPriorScale = b.changepointPriorScale;
    this.seasonalityPriorScale = b.seasonalityPriorScale;
    this.uncertaintySamples = b.uncertaintySamples;
    this.intervalWidth = b.intervalWidth;
    this.nChangepoints = b.nChangepoints;
    this.changepointRange = b.changepointRange;
    this.changepoints = b.changepoints == null ? null : ImmutableList.copyOf(b.changepoints);
    this.maxIterations = b.maxIterations;
    this.tolerance = b.tolerance;
    this.seed = b.seed;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ModelConfig defaults() {
    try {
      return builder().build();
    } catch (ConfigException e) {
      throw new IllegalStateException("default configuration is invalid", e);
    }
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.growth = growth;
    b.seasonalityMode = seasonalityMode;
    b.yearly = yearly;
    b.weekly = weekly;
    b.daily = daily;
    b.yearlyOrder = yearlyOrder;
    b.weeklyOrder = weeklyOrder;
    b.dailyOrder = dailyOrder;
    b.seasonalities.addAll(seasonalities);
    b.holidays.addAll(holidays);
    b.regressors.addAll(regressors);
    b.changepointPriorScale = changepointPriorScale;
    b.seasonalityPriorScale = seasonalityPriorScale;
    b.uncertaintySamples = uncertaintySamples;
    b.intervalWidth = intervalWidth;
    b.nChangepoints = nChangepoints;
    b.changepointRange = changepointRange;
    b.changepoints = changepoints == null ? null : new ArrayList<>(changepoints);
    b.maxIterations = maxIterations;
    b.tolerance = tolerance;
    b.seed = seed;
    return b;
  }

  public Growth getGrowth() {
    return growth;
  }

  public SeasonalityMode getSeasonalityMode() {
    return seasonalityMode;
  }

  public Toggle getYearly() {
    return yearly;
  }

  public Toggle getWeekly() {
    return weekly;
  }

  public Toggle getDaily() {
    return daily;
  }

  public int getYearlyOrder() {
    return yearlyOrder;
  }

  public int getWeeklyOrder() {
    return weeklyOrder;
  }

  public int getDailyOrder() {
    return dailyOrder;
  }

  public List<Seasonality> getSeasonalities() {
    return seasonalities;
  }

  public List<Holiday> getHolidays() {
    return holidays;
  }

  public List<String> getRegressors() {
    return regressors;
  }

  public double getChangepointPriorScale() {
    return changepointPriorScale;
  }

  public double getSeasonalityPriorScale() {
    return seasonalityPriorScale;
  }

  public int getUncertaintySamples() {
    return uncertaintySamples;
  }

  public double getIntervalWidth() {
    return intervalWidth;
  }

  public int getNChangepoints() {
    return nChangepoints;
  }

  public double getChangepointRange() {
    return changepointRange;
  }

  public boolean hasExplicitChangepoints() {
    return changepoints != null;
  }

  /** Explicit changepoints in epoch seconds, or null when they are placed automatically. */
  public List<Long> getChangepoints() {
    return changepoints;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public double getTolerance() {
    return tolerance;
  }

  public long getSeed() {
    return seed;
  }

  /** Flat description of the configuration, for reports. */
  public Map<String, Object> describe() {
    ImmutableMap.Builder<String, Object> out = ImmutableMap.builder();
    out.put("growth", growth.name().toLowerCase(Locale.ROOT))
        .put("seasonality_mode", seasonalityMode.name().toLowerCase(Locale.ROOT))
        .put("yearly_seasonality", yearly.name().toLowerCase(Locale.ROOT))
        .put("weekly_seasonality", weekly.name().toLowerCase(Locale.ROOT))
        .put("daily_seasonality", daily.name().toLowerCase(Locale.ROOT))
        .put("changepoint_prior_scale", changepointPriorScale)
        .put("seasonality_prior_scale", seasonalityPriorScale)
        .put("uncertainty_samples", uncertaintySamples)
        .put("interval_width", intervalWidth)
        .put("n_changepoints", nChangepoints)
        .put("changepoint_range", changepointRange)
        .put("regressors", regressors)
        .put("seasonalities", seasonalities.toString());
    if (changepoints != null) {
      List<String> dates = new ArrayList<>();
      for (long cp : changepoints) {
        dates.add(TimeSeriesUtils.format(cp));
      }
      out.put("changepoints", dates);
    }
    return out.build();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ModelConfig)) {
      return false;
    }
    ModelConfig other = (ModelConfig) o;
    return growth == other.growth
        && seasonalityMode == other.seasonalityMode
        && yearly == other.yearly
        && weekly == other.weekly
        && daily == other.daily
        && yearlyOrder == other.yearlyOrder
        && weeklyOrder == other.weeklyOrder
        && dailyOrder == other.dailyOrder
        && seasonalities.equals(other.seasonalities)
        && holidays.equals(other.holidays)
        && regressors.equals(other.regressors)
        && changepointPriorScale == other.changepointPriorScale
        && seasonalityPriorScale == other.seasonalityPriorScale
        && uncertaintySamples == other.uncertaintySamples
        && intervalWidth == other.intervalWidth
        && nChangepoints == other.nChangepoints
        && changepointRange == other.changepointRange
        && Objects.equals(changepoints, other.changepoints)
        && maxIterations == other.maxIterations
        && tolerance == other.tolerance
        && seed == other.seed;
  }

  @Override
  public int hashCode() {
    return Objects.hash(growth, seasonalityMode, seasonalities, holidays, regressors, seed);
  }

  @Override
  public String toString() {
    return describe().toString();
  }

  public static final class Builder {
    private Growth growth = Growth.LINEAR;
    private SeasonalityMode seasonalityMode = SeasonalityMode.ADDITIVE;
    private Toggle yearly = Toggle.AUTO;
    private Toggle weekly = Toggle.AUTO;
    private Toggle daily = Toggle.AUTO;
    private int yearlyOrder = DEFAULT_YEARLY_ORDER;
    private int weeklyOrder = DEFAULT_WEEKLY_ORDER;
    private int dailyOrder = DEFAULT_DAILY_ORDER;
    private final List<Seasonality> seasonalities = new ArrayList<>();
    private final List<Holiday> holidays = new ArrayList<>();
    private final List<String> regressors = new ArrayList<>();
    // Trend flexibility: scale of the Laplace prior on rate changes.
    private double changepointPriorScale = 0.05;
    // Scale of the normal prior on seasonal, holiday and regressor coefficients.
    private double seasonalityPriorScale = 10.0;
    private int uncertaintySamples = 1000;
    private double intervalWidth = 0.8;
    // Upper bound on the number of automatically placed changepoints.
    private int nChangepoints = 25;
    // Fraction of the history in which changepoints may be placed.
    private double changepointRange = 0.8;
    private List<Long> changepoints = null;
    private int maxIterations = 1000;
    private double tolerance = 1e-9;
    private long seed = 0;

    private Builder() {}

    public Builder growth(Growth growth) {
      this.growth = Preconditions.checkNotNull(growth);
      return this;
    }

    public Builder seasonalityMode(SeasonalityMode mode) {
      this.seasonalityMode = Preconditions.checkNotNull(mode);
      return this;
    }

    public Builder yearly(Toggle toggle) {
      this.yearly = Preconditions.checkNotNull(toggle);
      return this;
    }

    public Builder yearly(Toggle toggle, int order) {
      this.yearlyOrder = order;
      return yearly(toggle);
    }

    public Builder weekly(Toggle toggle) {
      this.weekly = Preconditions.checkNotNull(toggle);
      return this;
    }

    public Builder weekly(Toggle toggle, int order) {
      this.weeklyOrder = order;
      return weekly(toggle);
    }

    public Builder daily(Toggle toggle) {
      this.daily = Preconditions.checkNotNull(toggle);
      return this;
    }

    public Builder daily(Toggle toggle, int order) {
      this.dailyOrder = order;
      return daily(toggle);
    }

    /** Turns all three built-in seasonalities off. */
    public Builder noSeasonality() {
      yearly = Toggle.OFF;
      weekly = Toggle.OFF;
      daily = Toggle.OFF;
      return this;
    }

    public Builder addSeasonality(String name, double periodDays, int fourierOrder) {
      seasonalities.add(new Seasonality(name, periodDays, fourierOrder));
      return this;
    }

    public Builder addHoliday(Holiday holiday) {
      holidays.add(Preconditions.checkNotNull(holiday));
      return this;
    }

    public Builder addHolidays(Collection<Holiday> holidays) {
      for (Holiday h : holidays) {
        addHoliday(h);
      }
      return this;
    }

    public Builder addRegressor(String name) {
      regressors.add(Preconditions.checkNotNull(name));
      return this;
    }

    public Builder regressors(Collection<String> names) {
      regressors.clear();
      for (String name : names) {
        addRegressor(name);
      }
      return this;
    }

    public Builder changepointPriorScale(double scale) {
      this.changepointPriorScale = scale;
      return this;
    }

    public Builder seasonalityPriorScale(double scale) {
      this.seasonalityPriorScale = scale;
      return this;
    }

    public Builder uncertaintySamples(int samples) {
      this.uncertaintySamples = samples;
      return this;
    }

    public Builder intervalWidth(double width) {
      this.intervalWidth = width;
      return this;
    }

    public Builder nChangepoints(int n) {
      this.nChangepoints = n;
      return this;
    }

    public Builder changepointRange(double range) {
      this.changepointRange = range;
      return this;
    }

    /** Explicit changepoints in epoch seconds; null restores automatic placement. */
    public Builder changepoints(Collection<Long> epochSeconds) {
      this.changepoints = epochSeconds == null ? null : new ArrayList<>(epochSeconds);
      return this;
    }

    public Builder maxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    public Builder tolerance(double tolerance) {
      this.tolerance = tolerance;
      return this;
    }

    public Builder seed(long seed) {
      this.seed = seed;
      return this;
    }

    public ModelConfig build() throws ConfigException {
      if (!(changepointPriorScale > 0)) {
        throw new ConfigException(
            "changepoint_prior_scale must be positive", String.valueOf(changepointPriorScale));
      }
      if (!(seasonalityPriorScale > 0)) {
        throw new ConfigException(
            "seasonality_prior_scale must be positive", String.valueOf(seasonalityPriorScale));
      }
      if (uncertaintySamples < 0) {
        throw new ConfigException(
            "uncertainty_samples must not be negative", String.valueOf(uncertaintySamples));
      }
      if (!(intervalWidth > 0 && intervalWidth < 1)) {
        throw new ConfigException(
            "interval_width must be in (0, 1)", String.valueOf(intervalWidth));
      }
      if (nChangepoints < 0) {
        throw new ConfigException(
            "n_changepoints must not be negative", String.valueOf(nChangepoints));
      }
      if (!(changepointRange > 0 && changepointRange <= 1)) {
        throw new ConfigException(
            "changepoint_range must be in (0, 1]", String.valueOf(changepointRange));
      }
      if (maxIterations <= 0) {
        throw new ConfigException(
            "max_iterations must be positive", String.valueOf(maxIterations));
      }
      if (!(tolerance > 0)) {
        throw new ConfigException("tolerance must be positive", String.valueOf(tolerance));
      }
      checkOrder("yearly", yearlyOrder);
      checkOrder("weekly", weeklyOrder);
      checkOrder("daily", dailyOrder);

      Set<String> names = new HashSet<>();
      names.add("yearly");
      names.add("weekly");
      names.add("daily");
      for (Seasonality s : seasonalities) {
        if (s.getName().isEmpty() || RESERVED_NAMES.contains(s.getName())) {
          throw new ConfigException("Invalid seasonality name", s.getName());
        }
        if (!names.add(s.getName())) {
          throw new ConfigException("Duplicate seasonality name", s.getName());
        }
        if (!(s.getPeriodDays() > 0) || Double.isInfinite(s.getPeriodDays())) {
          throw new ConfigException("Seasonality period must be positive", s.getName());
        }
        checkOrder(s.getName(), s.getFourierOrder());
      }
      for (String r : regressors) {
        if (r.isEmpty() || RESERVED_NAMES.contains(r)) {
          throw new ConfigException("Invalid regressor name", r);
        }
        if (!names.add(r)) {
          throw new ConfigException("Regressor name is already in use", r);
        }
      }

      if (changepoints != null) {
        // sorted, duplicates collapse
        changepoints = new ArrayList<>(new TreeSet<>(changepoints));
      }
      return new ModelConfig(this);
    }

    private static void checkOrder(String name, int order) throws ConfigException {
      if (order <= 0) {
        throw new ConfigException("Fourier order must be positive", name);
      }
    }
  }
}
