package net.larse.tsforecast.algorithms;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import net.larse.tsforecast.algorithms.ModelConfig.Growth;
import net.larse.tsforecast.errors.ConfigException;
import net.larse.tsforecast.helper.ArrayHelper;
import net.larse.tsforecast.timeseries.CanonicalSeries;
import org.apache.commons.math.random.JDKRandomGenerator;
import org.apache.commons.math.random.RandomDataImpl;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TrendModelTest {

  @Test
  public void testChangepointsStayInRange() throws Exception {
    CanonicalSeries history = SyntheticSeries.linear(0, 100);
    long[] changepoints = TrendModel.placeChangepoints(history, ModelConfig.defaults());

    assertEquals(25, changepoints.length);
    double limit = history.start() + 0.8 * history.span();
    for (int j = 0; j < changepoints.length; j++) {
      assertTrue(changepoints[j] > history.start());
      assertTrue(changepoints[j] < limit);
      if (j > 0) {
        assertTrue(changepoints[j] > changepoints[j - 1]);
      }
    }
  }

  @Test
  public void testShortHistoryGetsFewChangepoints() throws Exception {
    long[] changepoints =
        TrendModel.placeChangepoints(SyntheticSeries.linear(0, 8), ModelConfig.defaults());
    assertEquals(2, changepoints.length);

    assertEquals(
        0,
        TrendModel.placeChangepoints(
                SyntheticSeries.linear(0, 100), ModelConfig.builder().nChangepoints(0).build())
            .length);
  }

  @Test
  public void testExplicitChangepointsMustBeInside() throws Exception {
    CanonicalSeries history = SyntheticSeries.linear(0, 30);
    ModelConfig inside =
        ModelConfig.builder()
            .changepoints(ImmutableList.of(SyntheticSeries.day(10), SyntheticSeries.day(20)))
            .build();
    assertArrayEquals(
        new long[] {SyntheticSeries.day(10), SyntheticSeries.day(20)},
        TrendModel.placeChangepoints(history, inside));

    ModelConfig outside =
        ModelConfig.builder().changepoints(ImmutableList.of(SyntheticSeries.day(29))).build();
    try {
      TrendModel.placeChangepoints(history, outside);
      fail("expected a ConfigException");
    } catch (ConfigException e) {
      assertEquals("2020-01-30 00:00:00", e.getContext());
    }
  }

  @Test
  public void testLinearTrendIsContinuous() {
    TrendModel trend = new TrendModel(Growth.LINEAR, new double[] {0.5});
    double[] t = {0, 0.25, 0.5, 0.75, 1};
    double[] g = trend.evaluate(2, 1, new double[] {-4}, t, null);
    assertArrayEquals(new double[] {1, 1.5, 2, 1.5, 1}, g, 1e-12);
  }

  @Test
  public void testLogisticTrendStaysBelowCapacity() {
    TrendModel trend = new TrendModel(Growth.LOGISTIC, new double[] {0.3, 0.6});
    double[] t = ArrayHelper.linspace(0, 2, 41);
    double[] cap = new double[t.length];
    Arrays.fill(cap, 0.8);
    double[] g = trend.evaluate(8, 0.4, new double[] {4, -6}, t, cap);
    for (int i = 0; i < g.length; i++) {
      assertTrue(g[i] > 0 && g[i] < 0.8);
      if (i > 0) {
        // continuous: no jump between neighbouring grid points
        assertTrue(Math.abs(g[i] - g[i - 1]) < 0.2);
      }
    }
  }

  @Test
  public void testLinearGradientMatchesDifferences() {
    TrendModel trend = new TrendModel(Growth.LINEAR, new double[] {0.2, 0.7});
    double[] t = {0.1, 0.5, 0.9};
    double[][] grad = trend.gradient(1, 0.5, new double[] {0.3, -0.2}, t, null);
    assertArrayEquals(new double[] {0.9, 1, 0.7, 0.2}, grad[2], 1e-12);
    assertArrayEquals(new double[] {0.1, 1, 0, 0}, grad[0], 1e-12);
  }

  @Test
  public void testInitialParamsInterpolateEndpoints() {
    TrendModel trend = new TrendModel(Growth.LINEAR, new double[0]);
    double[] params = trend.initialParams(new double[] {0, 0.5, 1}, new double[] {2, 9, 4}, null);
    assertArrayEquals(new double[] {2, 2}, params, 1e-12);
  }

  @Test
  public void testSimulatedChangesFollowTheHistory() {
    TrendModel trend = new TrendModel(Growth.LINEAR, new double[] {0.25, 0.5});
    JDKRandomGenerator generator = new JDKRandomGenerator();
    generator.setSeed(3);
    double[][] path =
        trend.simulateFutureChanges(
            new double[] {0.1, -0.1}, 3, 0.1, new RandomDataImpl(generator));

    assertEquals(path[0].length, path[1].length);
    assertEquals(0.25, path[0][0], 0);
    assertEquals(0.5, path[0][1], 0);
    assertEquals(0.1, path[1][0], 0);
    for (int j = 2; j < path[0].length; j++) {
      assertTrue(path[0][j] >= 1 && path[0][j] <= 3);
      assertTrue(path[0][j] >= path[0][j - 1]);
    }

    // no extrapolation inside the history
    double[][] inside =
        trend.simulateFutureChanges(new double[] {0.1, -0.1}, 1, 0.1, new RandomDataImpl());
    assertEquals(2, inside[0].length);
  }
}
