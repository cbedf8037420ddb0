package net.larse.tsforecast.algorithms;

import com.google.common.base.Preconditions;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.larse.tsforecast.algorithms.ModelConfig.Growth;
import net.larse.tsforecast.errors.ConfigException;
import net.larse.tsforecast.helper.ArrayHelper;
import net.larse.tsforecast.timeseries.CanonicalSeries;
import net.larse.tsforecast.timeseries.TimeSeriesUtils;
import org.apache.commons.math.random.RandomData;

/**
 * Piecewise linear or logistic trend in scaled time, with a base rate {@code k}, an offset {@code
 * m} and one rate change {@code delta[j]} per changepoint {@code s[j]}.
 *
 * <p>Linear: {@code g(t) = (k + a(t)·delta) t + (m + a(t)·gamma)} with {@code gamma_j = -s_j
 * delta_j}, so the trend is continuous. Logistic: {@code g(t) = C(t) / (1 + exp(-(k + a(t)·delta)
 * (t - (m + a(t)·gamma))))} with the offsets gamma chosen so the curve stays continuous at every
 * changepoint. Here {@code a_j(t) = 1} when {@code t >= s_j}.
 */
public final class TrendModel implements Serializable {
  private static final long serialVersionUID = 1L;

  // Relative step of the central differences used for logistic gradients.
  private static final double GRADIENT_STEP = 1e-6;

  private final Growth growth;
  private final double[] changepoints;

  public TrendModel(Growth growth, double[] changepoints) {
    this.growth = Preconditions.checkNotNull(growth);
    this.changepoints = changepoints.clone();
  }

  public Growth getGrowth() {
    return growth;
  }

  /** Changepoints in scaled time. */
  public double[] getChangepoints() {
    return changepoints.clone();
  }

  public int numChangepoints() {
    return changepoints.length;
  }

  /**
   * Places changepoints for a history, or validates the explicit ones of the config.
   *
   * <p>Automatic placement puts {@code min(cap, max(1, round(n/4)))} changepoints (at most
   * {@code H - 1}, with {@code H = floor(range * n)}) at evenly spaced rows of the first {@code H}
   * rows, and keeps those strictly after the first timestamp and strictly before
   * {@code start + range * span}.
   *
   * @return changepoints in epoch seconds, ascending
   */
  public static long[] placeChangepoints(CanonicalSeries history, ModelConfig config)
      throws ConfigException {
    if (config.hasExplicitChangepoints()) {
      long[] explicit = new long[config.getChangepoints().size()];
      for (int i = 0; i < explicit.length; i++) {
        long cp = config.getChangepoints().get(i);
        if (cp <= history.start() || cp >= history.end()) {
          throw new ConfigException(
              "Changepoint must lie strictly inside the history", TimeSeriesUtils.format(cp));
        }
        explicit[i] = cp;
      }
      return explicit;
    }

    int n = history.size();
    int histSize = (int) Math.floor(config.getChangepointRange() * n);
    int count = Math.min(config.getNChangepoints(), Math.max(1, (int) Math.round(0.25 * n)));
    count = Math.min(count, histSize - 1);
    if (count <= 0) {
      return new long[0];
    }

    double limit = history.start() + config.getChangepointRange() * history.span();
    double[] positions = ArrayHelper.linspace(0, histSize - 1, count + 1);
    List<Long> placed = new ArrayList<>();
    for (int i = 1; i < positions.length; i++) {
      long ts = history.timestamp((int) Math.round(positions[i]));
      if (ts > history.start() && ts < limit) {
        placed.add(ts);
      }
    }
    long[] result = new long[placed.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = placed.get(i);
    }
    return result;
  }

  /** Trend at scaled times {@code t} using this model's changepoints. */
  public double[] evaluate(double k, double m, double[] delta, double[] t, double[] cap) {
    return evaluate(growth, k, m, changepoints, delta, t, cap);
  }

  /**
   * Trend at scaled times {@code t} under arbitrary changepoints {@code s} (ascending) and rate
   * changes. {@code cap} is the scaled capacity and is ignored by linear growth.
   */
  public static double[] evaluate(
      Growth growth, double k, double m, double[] s, double[] delta, double[] t, double[] cap) {
    Preconditions.checkArgument(s.length == delta.length, "one rate change per changepoint");
    return growth == Growth.LINEAR ? linear(k, m, s, delta, t) : logistic(k, m, s, delta, t, cap);
  }

  private static double[] linear(double k, double m, double[] s, double[] delta, double[] t) {
    double[] out = new double[t.length];
    for (int i = 0; i < t.length; i++) {
      double rate = k;
      double offset = m;
      for (int j = 0; j < s.length && t[i] >= s[j]; j++) {
        rate += delta[j];
        offset -= s[j] * delta[j];
      }
      out[i] = rate * t[i] + offset;
    }
    return out;
  }

  private static double[] logistic(
      double k, double m, double[] s, double[] delta, double[] t, double[] cap) {
    double[] gamma = logisticOffsets(k, m, s, delta);
    double[] out = new double[t.length];
    for (int i = 0; i < t.length; i++) {
      double rate = k;
      double offset = m;
      for (int j = 0; j < s.length && t[i] >= s[j]; j++) {
        rate += delta[j];
        offset += gamma[j];
      }
      out[i] = cap[i] / (1 + Math.exp(-rate * (t[i] - offset)));
    }
    return out;
  }

  /** Offset adjustments that keep the logistic curve continuous at each changepoint. */
  private static double[] logisticOffsets(double k, double m, double[] s, double[] delta) {
    double[] gamma = new double[s.length];
    double rate = k;
    double offset = m;
    for (int j = 0; j < s.length; j++) {
      double next = rate + delta[j];
      if (Math.abs(next) < 1e-12) {
        next = next < 0 ? -1e-12 : 1e-12;
      }
      gamma[j] = (s[j] - offset) * (1 - rate / next);
      offset += gamma[j];
      rate = next;
    }
    return gamma;
  }

  /**
   * Gradient of the trend with respect to {@code (k, m, delta...)}, one row per time. Linear growth
   * is exact; logistic growth uses central differences.
   */
  public double[][] gradient(double k, double m, double[] delta, double[] t, double[] cap) {
    int p = 2 + changepoints.length;
    double[][] grad = new double[t.length][p];
    if (growth == Growth.LINEAR) {
      for (int i = 0; i < t.length; i++) {
        grad[i][0] = t[i];
        grad[i][1] = 1;
        for (int j = 0; j < changepoints.length && t[i] >= changepoints[j]; j++) {
          grad[i][2 + j] = t[i] - changepoints[j];
        }
      }
      return grad;
    }

    double[] params = new double[p];
    params[0] = k;
    params[1] = m;
    System.arraycopy(delta, 0, params, 2, delta.length);
    for (int c = 0; c < p; c++) {
      double h = GRADIENT_STEP * Math.max(1, Math.abs(params[c]));
      double[] up = params.clone();
      double[] down = params.clone();
      up[c] += h;
      down[c] -= h;
      double[] gUp = evaluate(up[0], up[1], Arrays.copyOfRange(up, 2, p), t, cap);
      double[] gDown = evaluate(down[0], down[1], Arrays.copyOfRange(down, 2, p), t, cap);
      for (int i = 0; i < t.length; i++) {
        grad[i][c] = (gUp[i] - gDown[i]) / (2 * h);
      }
    }
    return grad;
  }

  /**
   * Initial {@code (k, m)} from the first and last observation. Logistic growth solves the
   * logistic curve through both points, with values clamped into (1%, 99%) of capacity.
   */
  public double[] initialParams(double[] t, double[] y, double[] cap) {
    int last = t.length - 1;
    double dt = t[last] - t[0];
    if (growth == Growth.LINEAR) {
      double k = (y[last] - y[0]) / dt;
      return new double[] {k, y[0] - k * t[0]};
    }

    double c0 = cap[0];
    double c1 = cap[last];
    double y0 = Math.max(0.01 * c0, Math.min(0.99 * c0, y[0]));
    double y1 = Math.max(0.01 * c1, Math.min(0.99 * c1, y[last]));
    double r0 = c0 / y0;
    double r1 = c1 / y1;
    if (Math.abs(r0 - r1) <= 0.01) {
      r0 = 1.05 * r0;
    }
    double l0 = Math.log(r0 - 1);
    double l1 = Math.log(r1 - 1);
    double m = l0 * dt / (l0 - l1);
    double k = (l0 - l1) / dt;
    return new double[] {k, m + t[0]};
  }

  /**
   * Changepoints and rate changes of one simulated trend path: the fitted ones, followed by random
   * changes in {@code (1, tMax]}. Their count is Poisson with mean {@code S (tMax - 1)}, their
   * locations uniform and their sizes Laplace(0, scale).
   */
  public double[][] simulateFutureChanges(
      double[] delta, double tMax, double scale, RandomData random) {
    int s = changepoints.length;
    if (s == 0 || tMax <= 1) {
      return new double[][] {changepoints.clone(), delta.clone()};
    }
    int added = (int) random.nextPoisson(s * (tMax - 1));
    double[] locations = new double[added];
    for (int i = 0; i < added; i++) {
      locations[i] = random.nextUniform(1, tMax);
    }
    Arrays.sort(locations);

    double[] allChangepoints = Arrays.copyOf(changepoints, s + added);
    double[] allDelta = Arrays.copyOf(delta, s + added);
    for (int i = 0; i < added; i++) {
      allChangepoints[s + i] = locations[i];
      allDelta[s + i] = laplace(scale, random);
    }
    return new double[][] {allChangepoints, allDelta};
  }

  private static double laplace(double scale, RandomData random) {
    double u = random.nextUniform(-0.5, 0.5);
    return -scale * Math.signum(u) * Math.log(1 - 2 * Math.abs(u));
  }
}
