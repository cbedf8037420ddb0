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

import java.io.Serializable;
import java.util.Arrays;
import net.larse.tsforecast.timeseries.CanonicalSeries;

/**
 * The immutable result of one fit: the configuration and history it was fitted on, the design
 * state needed to rebuild matrices, the point estimate and, when requested, posterior samples.
 *
 * <p>Parameters are in scaled units and laid out as {@code [k, m, delta..., beta...]}.
 */
public final class FittedModel implements Serializable {
  private static final long serialVersionUID = 1L;

  private final ModelConfig config;
  private final CanonicalSeries history;
  private final DesignMatrixBuilder design;
  private final double[] params;
  private final double sigma;
  private final int iterations;
  private final double[][] samples;

  FittedModel(
      ModelConfig config,
      CanonicalSeries history,
      DesignMatrixBuilder design,
      double[] params,
      double sigma,
      int iterations,
      double[][] samples) {
    this.config = config;
    this.history = history;
    this.design = design;
    this.params = params.clone();
    this.sigma = sigma;
    this.iterations = iterations;
    this.samples = new double[samples.length][];
    for (int s = 0; s < samples.length; s++) {
      this.samples[s] = samples[s].clone();
    }
  }

  public ModelConfig getConfig() {
    return config;
  }

  public CanonicalSeries getHistory() {
    return history;
  }

  public DesignMatrixBuilder getDesign() {
    return design;
  }

  /** Changepoints in epoch seconds. */
  public long[] getChangepoints() {
    return design.getChangepoints();
  }

  public double[] getParams() {
    return params.clone();
  }

  public double getK() {
    return params[0];
  }

  public double getM() {
    return params[1];
  }

  public double[] getDelta() {
    int s = design.getTrendModel().numChangepoints();
    return Arrays.copyOfRange(params, 2, 2 + s);
  }

  public double[] getBeta() {
    int s = design.getTrendModel().numChangepoints();
    return Arrays.copyOfRange(params, 2 + s, params.length);
  }

  /** Residual scale in scaled units. */
  public double getSigma() {
    return sigma;
  }

  public int getIterations() {
    return iterations;
  }

  public int numSamples() {
    return samples.length;
  }

  public double[] getSample(int s) {
    return samples[s].clone();
  }
}
