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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import net.larse.tsforecast.errors.ConfigException;
import net.larse.tsforecast.errors.FitException;
import net.larse.tsforecast.errors.ForecastException;
import net.larse.tsforecast.timeseries.CanonicalSeries;
import net.larse.tsforecast.timeseries.TimeSeriesUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rolling-origin cross-validation: refits on the history up to each cutoff and scores the
 * predictions for the following horizon against the held-out observations.
 *
 * <p>Cutoffs start at {@code min(ds) + initial} and advance by {@code period} while {@code cutoff
 * + horizon <= max(ds)}. A cutoff whose fit fails is recorded as a {@link CvFailure} and skipped;
 * any other error aborts the run.
 */
public class CrossValidator {
  private static final Logger logger = LoggerFactory.getLogger(CrossValidator.class);

  /** A cutoff whose refit failed. */
  public static final class CvFailure {
    private final long cutoff;
    private final String message;

    public CvFailure(long cutoff, String message) {
      this.cutoff = cutoff;
      this.message = message;
    }

    public long getCutoff() {
      return cutoff;
    }

    public String getMessage() {
      return message;
    }

    @Override
    public String toString() {
      return TimeSeriesUtils.format(cutoff) + ": " + message;
    }
  }

  /** Folds of every successful cutoff, in cutoff order, and the failed cutoffs. */
  public static final class CvResult {
    private final ImmutableList<Long> cutoffs;
    private final ImmutableList<CvFold> folds;
    private final ImmutableList<CvFailure> failures;

    CvResult(List<Long> cutoffs, List<CvFold> folds, List<CvFailure> failures) {
      this.cutoffs = ImmutableList.copyOf(cutoffs);
      this.folds = ImmutableList.copyOf(folds);
      this.failures = ImmutableList.copyOf(failures);
    }

    public List<Long> getCutoffs() {
      return cutoffs;
    }

    public List<CvFold> getFolds() {
      return folds;
    }

    public List<CvFailure> getFailures() {
      return failures;
    }
  }

  private final Fitter fitter;
  private final Forecaster forecaster;
  private final ExecutorService executor;

  public CrossValidator() {
    this(new Fitter(), new Forecaster(), MoreExecutors.newDirectExecutorService());
  }

  /** Runs the cutoffs on {@code executor}; the caller owns its lifecycle. */
  public CrossValidator(Fitter fitter, Forecaster forecaster, ExecutorService executor) {
    this.fitter = Preconditions.checkNotNull(fitter);
    this.forecaster = Preconditions.checkNotNull(forecaster);
    this.executor = Preconditions.checkNotNull(executor);
  }

  /** Durations given as text, such as {@code "730 days"} or {@code "12 hours"}. */
  public CvResult crossValidate(FittedModel model, String initial, String period, String horizon)
      throws ForecastException {
    return crossValidate(
        model,
        TimeSeriesUtils.parseDuration(initial),
        TimeSeriesUtils.parseDuration(period),
        TimeSeriesUtils.parseDuration(horizon));
  }

  public CvResult crossValidate(
      FittedModel model, Duration initial, Duration period, Duration horizon)
      throws ForecastException {
    CanonicalSeries history = model.getHistory();
    List<Long> cutoffs = cutoffs(history, initial, period, horizon);
    long horizonSeconds = horizon.getSeconds();
    logger.info(
        "Cross-validating over {} cutoffs from {}",
        cutoffs.size(), TimeSeriesUtils.format(cutoffs.get(0)));

    List<Future<List<CvFold>>> futures = new ArrayList<>();
    for (long cutoff : cutoffs) {
      futures.add(executor.submit(() -> evaluateCutoff(model, cutoff, horizonSeconds)));
    }

    List<CvFold> folds = new ArrayList<>();
    List<CvFailure> failures = new ArrayList<>();
    try {
      for (int c = 0; c < futures.size(); c++) {
        try {
          folds.addAll(futures.get(c).get());
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof FitException) {
            logger.warn(
                "Cutoff {} failed: {}", TimeSeriesUtils.format(cutoffs.get(c)), cause.getMessage());
            failures.add(new CvFailure(cutoffs.get(c), cause.getMessage()));
          } else if (cause instanceof ForecastException) {
            throw (ForecastException) cause;
          } else if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
          } else if (cause instanceof Error) {
            throw (Error) cause;
          } else {
            throw new IllegalStateException(cause);
          }
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FitException("Cross-validation was interrupted", null, e);
    } finally {
      for (Future<List<CvFold>> f : futures) {
        f.cancel(true);
      }
    }
    return new CvResult(cutoffs, folds, failures);
  }

  private List<CvFold> evaluateCutoff(FittedModel model, long cutoff, long horizonSeconds)
      throws ForecastException {
    CanonicalSeries history = model.getHistory();
    CanonicalSeries train = history.truncate(cutoff);
    CanonicalSeries test = history.between(cutoff, cutoff + horizonSeconds);

    if (train.size() == 0) {
      throw new FitException("No training rows before cutoff", TimeSeriesUtils.format(cutoff));
    }
    ModelConfig config = model.getConfig();
    if (config.hasExplicitChangepoints()) {
      List<Long> inside = new ArrayList<>();
      for (long cp : config.getChangepoints()) {
        if (cp > train.start() && cp < train.end()) {
          inside.add(cp);
        }
      }
      config = config.toBuilder().changepoints(inside).build();
    }

    List<CvFold> folds = new ArrayList<>();
    FittedModel fitted = fitter.fit(train, config);
    if (test.size() == 0) {
      return folds;
    }
    Forecaster.Prediction prediction = forecaster.predict(fitted, test.covariates());
    for (int i = 0; i < test.size(); i++) {
      folds.add(
          new CvFold(
              cutoff,
              test.timestamp(i),
              test.y(i),
              prediction.yhat(i),
              prediction.lower(i),
              prediction.upper(i)));
    }
    return folds;
  }

  /**
   * Cutoffs of a rolling-origin evaluation.
   *
   * @throws ConfigException on non-positive durations or when no cutoff fits in the history
   */
  @VisibleForTesting
  static List<Long> cutoffs(
      CanonicalSeries history, Duration initial, Duration period, Duration horizon)
      throws ConfigException {
    if (initial.isNegative() || initial.isZero()) {
      throw new ConfigException("initial must be positive", initial.toString());
    }
    if (period.isNegative() || period.isZero()) {
      throw new ConfigException("period must be positive", period.toString());
    }
    if (horizon.isNegative() || horizon.isZero()) {
      throw new ConfigException("horizon must be positive", horizon.toString());
    }
    List<Long> cutoffs = new ArrayList<>();
    for (long cutoff = history.start() + initial.getSeconds();
        cutoff + horizon.getSeconds() <= history.end();
        cutoff += period.getSeconds()) {
      cutoffs.add(cutoff);
    }
    if (cutoffs.isEmpty()) {
      throw new ConfigException(
          "No cutoff fits in the history",
          "initial=" + initial + ", horizon=" + horizon + ", span=" + history.span() + "s");
    }
    return cutoffs;
  }
}
