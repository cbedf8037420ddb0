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

package net.larse.tsforecast.helper;

import com.google.common.base.Preconditions;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;

/**
 * Maximum a posteriori fit of a (possibly non-linear) regression model with Gaussian noise of
 * unknown scale and independent normal or Laplace priors on the parameters.
 *
 * <p>The negative log posterior minimized is
 *
 * <pre>
 *   sum((f(theta) - y)^2) / (2 sigma^2) + n log(sigma) + 2 sigma^2 + sum(penalty_j(theta_j))
 * </pre>
 *
 * with {@code penalty = theta^2 / (2 s^2)} for normal priors and {@code sqrt(theta^2 + eps^2) / s}
 * for Laplace priors. Each iteration majorizes the Laplace terms by quadratics (iteratively
 * reweighted least squares), linearizes the model and takes a Levenberg-Marquardt step through
 * {@link FitGenerator}. Sigma is refreshed in closed form after every accepted step.
 */
public class PenalizedLeastSquares {
  /** A regression function of the parameters, evaluated at fixed design points. */
  public interface Model {
    int numParameters();

    /** Writes the model value of every observation into {@code out}. */
    void predict(double[] params, double[] out);

    /** Writes d(prediction_i)/d(param_j) into the n-by-p matrix {@code out}. */
    void jacobian(double[] params, DenseMatrix64F out);
  }

  /** Prior on one parameter. */
  public static final class Prior {
    enum Kind {
      FLAT,
      NORMAL,
      LAPLACE
    }

    private static final Prior FLAT = new Prior(Kind.FLAT, 0);

    final Kind kind;
    final double scale;

    private Prior(Kind kind, double scale) {
      this.kind = kind;
      this.scale = scale;
    }

    public static Prior flat() {
      return FLAT;
    }

    public static Prior normal(double scale) {
      Preconditions.checkArgument(scale > 0, "prior scale must be positive");
      return new Prior(Kind.NORMAL, scale);
    }

    public static Prior laplace(double scale) {
      Preconditions.checkArgument(scale > 0, "prior scale must be positive");
      return new Prior(Kind.LAPLACE, scale);
    }
  }

  public static final double MIN_SIGMA = 1e-6;

  // Smoothing of |x| near zero.
  private static final double EPSILON = 1e-4;

  private static final double INITIAL_DAMPING = 1e-4;
  private static final double MIN_DAMPING = 1e-12;
  private static final double MAX_DAMPING = 1e12;
  private static final double DAMPING_FACTOR = 10;

  private final Model model;
  private final double[] targets;
  private final Prior[] priors;
  private final int maxIterations;
  private final double tolerance;
  private final FitGenerator fitGenerator = new FitGenerator();

  private double[] params;
  private double sigma;
  private double objective;
  private int iterations;
  private DenseMatrix64F covariance;
  private String failure;

  public PenalizedLeastSquares(
      Model model, double[] targets, Prior[] priors, int maxIterations, double tolerance) {
    Preconditions.checkArgument(priors.length == model.numParameters(), "one prior per parameter");
    Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive");
    Preconditions.checkArgument(tolerance > 0, "tolerance must be positive");
    this.model = model;
    this.targets = targets.clone();
    this.priors = priors.clone();
    this.maxIterations = maxIterations;
    this.tolerance = tolerance;
  }

  /**
   * Runs the optimizer from {@code initial}.
   *
   * @return false when the iteration budget is exhausted or a step cannot be solved; see {@link
   *     #getFailure()}
   */
  public boolean solve(double[] initial) {
    int n = targets.length;
    int p = model.numParameters();
    Preconditions.checkArgument(initial.length == p, "initial has wrong length");

    double[] theta = initial.clone();
    double[] pred = new double[n];
    double[] candidatePred = new double[n];
    DenseMatrix64F jac = new DenseMatrix64F(n, p);

    model.predict(theta, pred);
    double sig = updateSigma(residualSumOfSquares(pred));
    double f = objective(theta, pred, sig);
    if (!Double.isFinite(f)) {
      failure = "objective is not finite at the starting point";
      return false;
    }

    double damping = INITIAL_DAMPING;
    boolean refreshJacobian = true;
    boolean converged = false;
    iterations = 0;
    while (iterations < maxIterations) {
      iterations++;
      if (refreshJacobian) {
        model.jacobian(theta, jac);
      }
      double[] weights = priorWeights(theta);
      double[] step = dampedStep(theta, pred, jac, sig, weights, damping);
      if (step == null) {
        failure = "singular step at iteration " + iterations;
        return false;
      }

      double[] candidate = new double[p];
      for (int j = 0; j < p; j++) {
        candidate[j] = theta[j] + step[j];
      }
      model.predict(candidate, candidatePred);
      double fc = objective(candidate, candidatePred, sig);

      if (Double.isFinite(fc) && fc <= f) {
        theta = candidate;
        double[] swap = pred;
        pred = candidatePred;
        candidatePred = swap;

        sig = updateSigma(residualSumOfSquares(pred));
        double updated = objective(theta, pred, sig);
        double change = (f - updated) / Math.max(1.0, Math.abs(updated));
        f = updated;
        damping = Math.max(damping / DAMPING_FACTOR, MIN_DAMPING);
        refreshJacobian = true;

        if (change < tolerance
            || ArrayHelper.maxAbs(step) < tolerance * (1 + ArrayHelper.maxAbs(theta))) {
          converged = true;
          break;
        }
      } else {
        damping *= DAMPING_FACTOR;
        refreshJacobian = false;
        // No step of any length lowers the objective: a stationary point.
        if (damping > MAX_DAMPING) {
          converged = true;
          break;
        }
      }
    }

    params = theta;
    sigma = sig;
    objective = f;
    if (!converged) {
      failure = "no convergence within " + maxIterations + " iterations";
      return false;
    }

    model.jacobian(theta, jac);
    covariance = posteriorCovariance(jac, sig, priorWeights(theta));
    return true;
  }

  public double[] getParams() {
    return params.clone();
  }

  public double getSigma() {
    return sigma;
  }

  public double getObjective() {
    return objective;
  }

  public int getIterations() {
    return iterations;
  }

  /**
   * Inverse curvature of the (majorized) objective at the optimum, or null when it is singular.
   */
  public DenseMatrix64F getCovariance() {
    return covariance == null ? null : covariance.copy();
  }

  public String getFailure() {
    return failure;
  }

  private double[] dampedStep(
      double[] theta,
      double[] pred,
      DenseMatrix64F jac,
      double sig,
      double[] weights,
      double damping) {
    int n = targets.length;
    int p = theta.length;
    fitGenerator.init(p, n + 2 * p);

    double[] colScale = new double[p];
    for (int i = 0; i < n; i++) {
      fitGenerator.setTarget(i, -(pred[i] - targets[i]) / sig);
      for (int j = 0; j < p; j++) {
        double v = jac.unsafe_get(i, j) / sig;
        fitGenerator.setObservation(i, j, v);
        colScale[j] += v * v;
      }
    }
    for (int j = 0; j < p; j++) {
      double root = Math.sqrt(weights[j]);
      fitGenerator.setObservation(n + j, j, root);
      fitGenerator.setTarget(n + j, -root * theta[j]);

      double scale = colScale[j] + weights[j];
      if (scale <= 0) {
        scale = 1;
      }
      fitGenerator.setObservation(n + p + j, j, Math.sqrt(damping * scale));
    }
    return fitGenerator.linearFit();
  }

  private DenseMatrix64F posteriorCovariance(DenseMatrix64F jac, double sig, double[] weights) {
    int p = weights.length;
    DenseMatrix64F hessian = new DenseMatrix64F(p, p);
    CommonOps.multTransA(jac, jac, hessian);
    CommonOps.scale(1.0 / (sig * sig), hessian);
    for (int j = 0; j < p; j++) {
      hessian.set(j, j, hessian.get(j, j) + weights[j]);
    }
    if (!CommonOps.invert(hessian)) {
      return null;
    }
    for (double v : hessian.getData()) {
      if (!Double.isFinite(v)) {
        return null;
      }
    }
    return hessian;
  }

  /** Quadratic coefficients of the prior terms, majorized at theta. */
  private double[] priorWeights(double[] theta) {
    double[] weights = new double[theta.length];
    for (int j = 0; j < theta.length; j++) {
      Prior prior = priors[j];
      switch (prior.kind) {
        case NORMAL:
          weights[j] = 1.0 / (prior.scale * prior.scale);
          break;
        case LAPLACE:
          weights[j] = 1.0 / (prior.scale * Math.hypot(theta[j], EPSILON));
          break;
        default:
          weights[j] = 0;
      }
    }
    return weights;
  }

  private double objective(double[] theta, double[] pred, double sig) {
    double value =
        residualSumOfSquares(pred) / (2 * sig * sig)
            + targets.length * Math.log(sig)
            + 2 * sig * sig;
    for (int j = 0; j < theta.length; j++) {
      Prior prior = priors[j];
      if (prior.kind == Prior.Kind.NORMAL) {
        value += theta[j] * theta[j] / (2 * prior.scale * prior.scale);
      } else if (prior.kind == Prior.Kind.LAPLACE) {
        value += Math.hypot(theta[j], EPSILON) / prior.scale;
      }
    }
    return value;
  }

  private double residualSumOfSquares(double[] pred) {
    double rss = 0;
    for (int i = 0; i < targets.length; i++) {
      double r = pred[i] - targets[i];
      rss += r * r;
    }
    return rss;
  }

  /** Minimizer of rss/(2 s^2) + n log(s) + 2 s^2 over s, floored at {@link #MIN_SIGMA}. */
  private double updateSigma(double rss) {
    int n = targets.length;
    double variance = 2 * rss / (n + Math.sqrt((double) n * n + 16 * rss));
    return Math.max(Math.sqrt(variance), MIN_SIGMA);
  }
}
