package net.larse.tsforecast.timeseries;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OutlierDetectorTest {

  @Test
  public void testIqrFlagsSpike() {
    double[] values = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 100};
    boolean[] flags = new OutlierDetector().flag(values);
    for (int i = 0; i < 10; i++) {
      assertFalse("row " + i, flags[i]);
    }
    assertTrue(flags[10]);
  }

  @Test
  public void testZScore() {
    double[] values = {1, 1, 1, 1, 1, 1, 1, 1, 1, 10};
    boolean[] flags = new OutlierDetector(OutlierDetector.Method.ZSCORE, 2).flag(values);
    assertTrue(flags[9]);
    assertFalse(flags[0]);
  }

  @Test
  public void testConstantSeriesHasNoOutliers() {
    boolean[] flags =
        new OutlierDetector(OutlierDetector.Method.ZSCORE, 1).flag(new double[] {4, 4, 4});
    assertArrayEquals(new boolean[] {false, false, false}, flags);
  }
}
