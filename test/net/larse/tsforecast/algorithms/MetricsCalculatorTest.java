package net.larse.tsforecast.algorithms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MetricsCalculatorTest {
  private static final long DAY = SyntheticSeries.DAY;

  private MetricsCalculator calculator;
  private List<CvFold> folds;

  @Before
  public void setUp() {
    calculator = new MetricsCalculator();
    folds =
        ImmutableList.of(
            new CvFold(0, DAY, 100, 110, 90, 105),
            new CvFold(0, 2 * DAY, 0, 5, 4, 6),
            new CvFold(DAY, 2 * DAY, 50, 40, 30, 60));
  }

  @Test
  public void testOverall() {
    MetricRecord overall = calculator.overall(folds);
    assertNull(overall.getHorizon());
    assertEquals(3, overall.getCount());
    assertEquals(75, overall.getMse(), 1e-12);
    assertEquals(Math.sqrt(75), overall.getRmse(), 1e-12);
    assertEquals(25.0 / 3, overall.getMae(), 1e-12);
    // the zero actual has no percentage error
    assertEquals(0.15, overall.getMape(), 1e-12);
    assertEquals(0.15, overall.getMdape(), 1e-12);
    assertEquals((10.0 / 105 + 2 + 10.0 / 45) / 3, overall.getSmape(), 1e-12);
    assertEquals(2.0 / 3, overall.getCoverage(), 1e-12);
  }

  @Test
  public void testByHorizon() {
    List<MetricRecord> records = calculator.byHorizon(folds);
    assertEquals(2, records.size());

    MetricRecord oneDay = records.get(0);
    assertEquals(Long.valueOf(DAY), oneDay.getHorizon());
    assertEquals(2, oneDay.getCount());
    assertEquals(1.0, oneDay.getCoverage(), 0);
    assertEquals(1.0, oneDay.toRecord().get("horizon_days"));

    MetricRecord twoDays = records.get(1);
    assertEquals(Long.valueOf(2 * DAY), twoDays.getHorizon());
    assertEquals(Double.POSITIVE_INFINITY, twoDays.getMape(), 0);
    assertEquals(2, twoDays.getSmape(), 1e-12);
    assertEquals(0, twoDays.getCoverage(), 0);
  }

  @Test
  public void testPerfectZeroForecast() {
    MetricRecord record = calculator.overall(ImmutableList.of(new CvFold(0, DAY, 0, 0, 0, 0)));
    assertEquals(0, record.getSmape(), 0);
    assertEquals(0, record.getMae(), 0);
    assertEquals(1, record.getCoverage(), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoFolds() {
    calculator.overall(ImmutableList.<CvFold>of());
  }
}
