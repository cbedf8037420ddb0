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

import org.apache.commons.math.random.GaussianRandomGenerator;
import org.apache.commons.math.random.JDKRandomGenerator;
import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.DecompositionFactory;
import org.ejml.interfaces.decomposition.CholeskyDecomposition;

/**
 * Draws from a multivariate normal distribution through the Cholesky factor of its covariance.
 *
 * <p>A covariance that is not numerically positive definite is retried with a growing diagonal
 * jitter, relative to its mean diagonal.
 */
public class GaussianSampler {
  private static final double[] JITTER = {0, 1e-12, 1e-10, 1e-8, 1e-6};

  private final GaussianRandomGenerator normal;

  public GaussianSampler(long seed) {
    JDKRandomGenerator random = new JDKRandomGenerator();
    random.setSeed(seed);
    this.normal = new GaussianRandomGenerator(random);
  }

  /**
   * Returns {@code count} draws of {@code N(mean, covariance)}, one per row.
   *
   * @return the draws, or null when the covariance cannot be factored even with jitter
   */
  public double[][] sample(double[] mean, DenseMatrix64F covariance, int count) {
    DenseMatrix64F lower = factor(covariance);
    if (lower == null) {
      return null;
    }
    int p = mean.length;
    double[][] draws = new double[count][p];
    double[] z = new double[p];
    for (int s = 0; s < count; s++) {
      for (int j = 0; j < p; j++) {
        z[j] = normal.nextNormalizedDouble();
      }
      for (int i = 0; i < p; i++) {
        double v = mean[i];
        for (int j = 0; j <= i; j++) {
          v += lower.unsafe_get(i, j) * z[j];
        }
        draws[s][i] = v;
      }
    }
    return draws;
  }

  private static DenseMatrix64F factor(DenseMatrix64F covariance) {
    int p = covariance.numRows;
    double meanDiagonal = 0;
    for (int j = 0; j < p; j++) {
      meanDiagonal += Math.abs(covariance.get(j, j));
    }
    meanDiagonal = p == 0 ? 1 : Math.max(meanDiagonal / p, Double.MIN_NORMAL);

    for (double jitter : JITTER) {
      DenseMatrix64F work = covariance.copy();
      for (int j = 0; j < p; j++) {
        work.set(j, j, work.get(j, j) + jitter * meanDiagonal);
      }
      CholeskyDecomposition<DenseMatrix64F> chol = DecompositionFactory.chol(p, true);
      if (chol.decompose(work)) {
        DenseMatrix64F lower = chol.getT(null);
        if (isFinite(lower)) {
          return lower;
        }
      }
    }
    return null;
  }

  private static boolean isFinite(DenseMatrix64F matrix) {
    for (double v : matrix.getData()) {
      if (!Double.isFinite(v)) {
        return false;
      }
    }
    return true;
  }
}
