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

import java.util.List;
import net.larse.tsforecast.algorithms.DesignMatrix.FeatureColumn;
import net.larse.tsforecast.errors.FitException;
import net.larse.tsforecast.errors.ForecastException;
import net.larse.tsforecast.helper.GaussianSampler;
import net.larse.tsforecast.helper.PenalizedLeastSquares;
import net.larse.tsforecast.helper.PenalizedLeastSquares.Prior;
import net.larse.tsforecast.timeseries.CanonicalSeries;
import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates trend, seasonal, holiday and regressor coefficients jointly.
 *
 * <p>Targets are scaled to {@code (y - floor) / yScale} and time to [0, 1] over the history. The
 * fit maximizes the posterior of {@code y ~ N(g(t) (1 + X_mult beta) + X_add beta, sigma)} under
 * N(0, 5) priors on k and m, Laplace(0, tau) priors on the rate changes and N(0, s) priors on
 * beta. With uncertainty samples requested, coefficient vectors are drawn from the Laplace
 * approximation of the posterior around the optimum.
 */
public class Fitter {
  private static final Logger logger = LoggerFactory.getLogger(Fitter.class);

  // Scale of the normal priors on the base rate and offset.
  public static final double TREND_PRIOR_SCALE = 5;

  public FittedModel fit(CanonicalSeries series, ModelConfig config) throws ForecastException {
    int n = series.size();
    if (n < 2) {
      throw new FitException("At least 2 observations are required", "rows=" + n);
    }
    DesignMatrixBuilder design = DesignMatrixBuilder.create(series, config);
    DesignMatrix matrix = design.build(series.covariates());

    int p = matrix.numParameters();
    if (n < p) {
      throw new FitException("Fewer observations than free parameters", "n=" + n + ", p=" + p);
    }

    double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      y[i] = (series.y(i) - matrix.floor(i)) / design.getYScale();
    }

    Prior[] priors = new Prior[p];
    priors[0] = Prior.normal(TREND_PRIOR_SCALE);
    priors[1] = Prior.normal(TREND_PRIOR_SCALE);
    for (int j = 0; j < matrix.numChangepoints(); j++) {
      priors[2 + j] = Prior.laplace(config.getChangepointPriorScale());
    }
    List<FeatureColumn> columns = matrix.getColumns();
    for (int j = 0; j < columns.size(); j++) {
      priors[matrix.featureOffset() + j] = Prior.normal(columns.get(j).getPriorScale());
    }

    double[] initial = new double[p];
    double[] trendInit =
        matrix.getTrendModel().initialParams(matrix.time(), y, matrix.scaledCap());
    initial[0] = trendInit[0];
    initial[1] = trendInit[1];

    PenalizedLeastSquares solver =
        new PenalizedLeastSquares(
            new RegressionFunction(matrix), y, priors, config.getMaxIterations(),
            config.getTolerance());
    if (!solver.solve(initial)) {
      throw new FitException("Optimizer failed", solver.getFailure());
    }
    double[] params = solver.getParams();

    double[][] samples = new double[0][];
    if (config.getUncertaintySamples() > 0) {
      DenseMatrix64F covariance = solver.getCovariance();
      if (covariance == null) {
        throw new FitException("Posterior covariance is singular", "p=" + p);
      }
      samples =
          new GaussianSampler(config.getSeed())
              .sample(params, covariance, config.getUncertaintySamples());
      if (samples == null) {
        throw new FitException("Posterior covariance is not positive definite", "p=" + p);
      }
    }

    logger.info(
        "Fitted {} rows with {} parameters ({} changepoints) in {} iterations, sigma={}",
        n, p, matrix.numChangepoints(), solver.getIterations(),
        solver.getSigma() * design.getYScale());
    return new FittedModel(
        config, series, design, params, solver.getSigma(), solver.getIterations(), samples);
  }

  /** {@code g(t) (1 + X_mult beta) + X_add beta} as a function of all parameters. */
  static final class RegressionFunction implements PenalizedLeastSquares.Model {
    private final DesignMatrix matrix;
    private final double[] t;
    private final double[] cap;

    RegressionFunction(DesignMatrix matrix) {
      this.matrix = matrix;
      this.t = matrix.time();
      this.cap = matrix.scaledCap();
    }

    @Override
    public int numParameters() {
      return matrix.numParameters();
    }

    @Override
    public void predict(double[] params, double[] out) {
      double[] result = matrix.combine(matrix.trend(params), params);
      System.arraycopy(result, 0, out, 0, result.length);
    }

    @Override
    public void jacobian(double[] params, DenseMatrix64F out) {
      double[] g = matrix.trend(params);
      double[] mult = matrix.featureSums(params, true);
      double[][] trendGrad =
          matrix.getTrendModel().gradient(params[0], params[1], matrix.delta(params), t, cap);
      int trendParams = matrix.featureOffset();
      List<FeatureColumn> columns = matrix.getColumns();

      for (int i = 0; i < matrix.size(); i++) {
        for (int c = 0; c < trendParams; c++) {
          out.unsafe_set(i, c, trendGrad[i][c] * (1 + mult[i]));
        }
        for (int j = 0; j < columns.size(); j++) {
          double x = matrix.feature(i, j);
          out.unsafe_set(i, trendParams + j, columns.get(j).isMultiplicative() ? x * g[i] : x);
        }
      }
    }
  }
}
