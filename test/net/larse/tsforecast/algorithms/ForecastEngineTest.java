package net.larse.tsforecast.algorithms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.larse.tsforecast.timeseries.FieldMapping;
import net.larse.tsforecast.timeseries.TimeSeriesUtils;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ForecastEngineTest {
  private static final int LAUNCH_DAY = 30;

  private ForecastEngine engine;
  private List<Map<String, Object>> records;
  private FieldMapping mapping;
  private ModelConfig config;

  @Before
  public void setUp() throws Exception {
    engine = new ForecastEngine();
    records = new ArrayList<>();
    for (int t = 0; t < 120; t++) {
      Map<String, Object> record = new HashMap<>();
      record.put("date", TimeSeriesUtils.format(SyntheticSeries.day(t)));
      record.put("sales", String.valueOf(20 + 0.5 * t + (t == LAUNCH_DAY ? 15 : 0)));
      record.put("event", t == LAUNCH_DAY ? "launch" : null);
      records.add(record);
    }
    mapping = FieldMapping.builder("date", "sales").holidays("event").build();
    config =
        ModelOptions.parse(
            ImmutableMap.of(
                "yearly_seasonality", "false",
                "weekly_seasonality", "false",
                "daily_seasonality", "false",
                "uncertainty_samples", "0"));
  }

  @Test
  public void testFitReportWithoutCrossValidation() throws Exception {
    FitReport report = engine.fit(records, mapping, config, null);

    assertFalse(report.hasCrossValidation());
    assertNull(report.getOverallMetrics());
    assertTrue(report.getSampleFolds().isEmpty());

    Map<String, Object> summary = report.getSummary();
    assertEquals(120, summary.get("rows"));
    assertEquals("2020-01-01 00:00:00", summary.get("start"));
    assertEquals(ImmutableList.of("launch"), summary.get("holidays"));
    assertEquals(report.getChangepoints().size(), summary.get("n_changepoints"));
    assertEquals("linear", ((Map<?, ?>) summary.get("config")).get("growth"));

    // no trend changes in a straight line
    for (Map<String, Object> changepoint : report.getChangepoints()) {
      assertEquals(0, (Double) changepoint.get("delta"), 1e-3);
    }

    List<ForecastRow> rows =
        engine.forecast(report.getModel(), ForecastRequest.of(3, "D").withHistory(true));
    assertEquals(123, rows.size());
    assertEquals(15, rows.get(LAUNCH_DAY).getComponents().get("holidays"), 0.05);
    assertEquals(20 + 0.5 * 121, rows.get(121).getYhat(), 0.05);
  }

  @Test
  public void testFitReportWithCrossValidation() throws Exception {
    ForecastEngine.CvOptions cv =
        new ForecastEngine.CvOptions(Duration.ofDays(40), Duration.ofDays(20), Duration.ofDays(10));
    FitReport report = engine.fit(records, mapping, config, cv);

    assertTrue(report.hasCrossValidation());
    assertTrue(report.getFailures().isEmpty());
    assertEquals(4 * 10, report.getOverallMetrics().getCount());
    assertEquals(10, report.getHorizonMetrics().size());
    assertEquals(ForecastEngine.MAX_SAMPLE_FOLDS, report.getSampleFolds().size());
    assertEquals(0, report.getOverallMetrics().getMae(), 0.05);
  }
}
