package net.larse.tsforecast.helper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.ejml.data.DenseMatrix64F;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GaussianSamplerTest {
  private static final double[] MEAN = {1, -2};

  private static DenseMatrix64F covariance() {
    return new DenseMatrix64F(2, 2, true, 4, 1.2, 1.2, 1);
  }

  @Test
  public void testMomentsOfDraws() {
    int count = 20000;
    double[][] draws = new GaussianSampler(42).sample(MEAN, covariance(), count);
    assertEquals(count, draws.length);

    double[] mean = new double[2];
    for (double[] d : draws) {
      mean[0] += d[0] / count;
      mean[1] += d[1] / count;
    }
    double v0 = 0;
    double v1 = 0;
    double c01 = 0;
    for (double[] d : draws) {
      v0 += (d[0] - mean[0]) * (d[0] - mean[0]) / count;
      v1 += (d[1] - mean[1]) * (d[1] - mean[1]) / count;
      c01 += (d[0] - mean[0]) * (d[1] - mean[1]) / count;
    }
    assertArrayEquals(MEAN, mean, 0.05);
    assertEquals(4, v0, 0.2);
    assertEquals(1, v1, 0.05);
    assertEquals(1.2, c01, 0.1);
  }

  @Test
  public void testSameSeedSameDraws() {
    double[][] a = new GaussianSampler(7).sample(MEAN, covariance(), 5);
    double[][] b = new GaussianSampler(7).sample(MEAN, covariance(), 5);
    for (int s = 0; s < a.length; s++) {
      assertArrayEquals(a[s], b[s], 0);
    }
  }

  @Test
  public void testSingularCovarianceIsJittered() {
    DenseMatrix64F singular = new DenseMatrix64F(2, 2, true, 1, 1, 1, 1);
    double[][] draws = new GaussianSampler(1).sample(MEAN, singular, 10);
    for (double[] d : draws) {
      assertEquals(d[0] - MEAN[0], d[1] - MEAN[1], 1e-4);
    }
  }

  @Test
  public void testIndefiniteCovariance() {
    DenseMatrix64F indefinite = new DenseMatrix64F(2, 2, true, 1, 0, 0, -1);
    assertNull(new GaussianSampler(1).sample(MEAN, indefinite, 3));
  }
}
