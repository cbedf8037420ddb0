package net.larse.tsforecast.algorithms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import net.larse.tsforecast.algorithms.ModelConfig.Growth;
import net.larse.tsforecast.algorithms.ModelConfig.SeasonalityMode;
import net.larse.tsforecast.algorithms.ModelConfig.Toggle;
import net.larse.tsforecast.errors.ConfigException;
import net.larse.tsforecast.errors.DataException;
import net.larse.tsforecast.errors.FitException;
import net.larse.tsforecast.timeseries.CanonicalSeries;
import net.larse.tsforecast.timeseries.CovariateFrame;
import net.larse.tsforecast.timeseries.Holiday;
import net.larse.tsforecast.timeseries.TimeSeriesUtils;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ForecasterTest {
  private Fitter fitter;
  private Forecaster forecaster;

  @Before
  public void setUp() {
    fitter = new Fitter();
    forecaster = new Forecaster();
  }

  private FittedModel fitLinear(int samples) throws Exception {
    ModelConfig config = ModelConfig.builder().noSeasonality().uncertaintySamples(samples).build();
    return fitter.fit(SyntheticSeries.linear(1, 100), config);
  }

  @Test
  public void testNoiselessLinearForecast() throws Exception {
    FittedModel model = fitLinear(200);
    List<ForecastRow> rows = forecaster.forecast(model, ForecastRequest.of(10, "D"));

    assertEquals(10, rows.size());
    for (int i = 0; i < rows.size(); i++) {
      ForecastRow row = rows.get(i);
      int t = 101 + i;
      assertEquals(SyntheticSeries.day(t), row.getTimestamp());
      assertEquals(100 + 0.5 * t, row.getYhat(), 1e-3);
      assertEquals(row.getYhat(), row.getTrend(), 1e-9);
      assertTrue(row.getYhatUpper() - row.getYhatLower() < 0.01);
      assertTrue(row.getYhatLower() <= row.getYhat() + 1e-3);
      assertTrue(row.getYhatUpper() >= row.getYhat() - 1e-3);
      assertFalse(row.isHistorical());
      assertNull(row.getObserved());
    }
  }

  @Test
  public void testHistoryIsPrepended() throws Exception {
    FittedModel model = fitLinear(0);
    List<ForecastRow> rows =
        forecaster.forecast(model, ForecastRequest.of(5, "D").withHistory(true));

    assertEquals(105, rows.size());
    ForecastRow first = rows.get(0);
    assertTrue(first.isHistorical());
    assertEquals(100.5, first.getObserved(), 0);
    assertEquals(100.5, first.getYhat(), 1e-3);
    assertEquals(first.getYhat(), first.getYhatLower(), 0);

    Map<String, Object> record = rows.get(104).toRecord();
    assertEquals("forecast", record.get("forecast_type"));
    assertEquals(TimeSeriesUtils.format(SyntheticSeries.day(105)), record.get("ds"));
    assertFalse(record.containsKey("y"));
    assertEquals("historical", first.toRecord().get("forecast_type"));
  }

  @Test
  public void testForecastIsRepeatable() throws Exception {
    FittedModel model = fitLinear(100);
    List<ForecastRow> a = forecaster.forecast(model, ForecastRequest.of(7, "D"));
    List<ForecastRow> b = forecaster.forecast(model, ForecastRequest.of(7, "D"));
    for (int i = 0; i < a.size(); i++) {
      assertEquals(a.get(i).getYhat(), b.get(i).getYhat(), 0);
      assertEquals(a.get(i).getYhatLower(), b.get(i).getYhatLower(), 0);
      assertEquals(a.get(i).getYhatUpper(), b.get(i).getYhatUpper(), 0);
    }
  }

  @Test
  public void testInvalidRequests() throws Exception {
    FittedModel model = fitLinear(0);
    try {
      forecaster.forecast(model, ForecastRequest.of(0, "D"));
      fail("expected a ConfigException");
    } catch (ConfigException e) {
      assertEquals("0", e.getContext());
    }
    try {
      forecaster.forecast(model, ForecastRequest.of(3, "fortnightly"));
      fail("expected a ConfigException");
    } catch (ConfigException e) {
      // expected
    }
  }

  @Test
  public void testWeeklySeasonalityIsRecovered() throws Exception {
    CanonicalSeries history =
        SyntheticSeries.daily(
            0,
            84,
            t -> {
              double x = SyntheticSeries.phase(SyntheticSeries.day(t), 7);
              return 50 + 0.1 * t + 5 * Math.sin(x) + 2 * Math.cos(2 * x);
            });
    ModelConfig config =
        ModelConfig.builder()
            .yearly(Toggle.OFF)
            .daily(Toggle.OFF)
            .weekly(Toggle.ON)
            .uncertaintySamples(0)
            .build();
    FittedModel model = fitter.fit(history, config);
    List<ForecastRow> rows = forecaster.forecast(model, ForecastRequest.of(14, "D"));

    for (int i = 0; i < rows.size(); i++) {
      int t = 84 + i;
      double x = SyntheticSeries.phase(SyntheticSeries.day(t), 7);
      double weekly = 5 * Math.sin(x) + 2 * Math.cos(2 * x);
      ForecastRow row = rows.get(i);
      assertEquals(50 + 0.1 * t + weekly, row.getYhat(), 0.05);
      assertEquals(weekly, row.getComponents().get("weekly"), 0.05);
    }
  }

  @Test
  public void testMultiplicativeSeasonality() throws Exception {
    CanonicalSeries history =
        SyntheticSeries.daily(
            0,
            84,
            t -> {
              double x = SyntheticSeries.phase(SyntheticSeries.day(t), 7);
              return (50 + 0.5 * t) * (1 + 0.1 * Math.sin(x));
            });
    ModelConfig config =
        ModelConfig.builder()
            .noSeasonality()
            .weekly(Toggle.ON)
            .seasonalityMode(SeasonalityMode.MULTIPLICATIVE)
            .uncertaintySamples(0)
            .build();
    FittedModel model = fitter.fit(history, config);
    List<ForecastRow> rows = forecaster.forecast(model, ForecastRequest.of(7, "D"));

    for (int i = 0; i < rows.size(); i++) {
      int t = 84 + i;
      double x = SyntheticSeries.phase(SyntheticSeries.day(t), 7);
      ForecastRow row = rows.get(i);
      assertEquals((50 + 0.5 * t) * (1 + 0.1 * Math.sin(x)), row.getYhat(), 0.1);
      // reported relative to the trend
      assertEquals(0.1 * Math.sin(x), row.getComponents().get("weekly"), 0.01);
    }
  }

  @Test
  public void testHolidayEffects() throws Exception {
    int[] holidayDays = {10, 40, 70, 100, 125};
    ModelConfig.Builder builder = ModelConfig.builder().noSeasonality().uncertaintySamples(0);
    for (int d : holidayDays) {
      builder.addHoliday(new Holiday("promo", TimeSeriesUtils.toDate(SyntheticSeries.day(d))));
    }
    CanonicalSeries history =
        SyntheticSeries.daily(
            0, 120, t -> 20 + 0.2 * t + (Arrays.binarySearch(holidayDays, t) >= 0 ? 10 : 0));
    FittedModel model = fitter.fit(history, builder.build());

    List<ForecastRow> rows =
        forecaster.forecast(model, ForecastRequest.of(10, "D").withHistory(true));
    assertEquals(10, rows.get(40).getComponents().get("holidays"), 0.05);
    assertEquals(0, rows.get(41).getComponents().get("holidays"), 0.05);
    assertEquals(20 + 0.2 * 125 + 10, rows.get(125).getYhat(), 0.05);
    assertEquals(10, rows.get(125).getComponents().get("holidays"), 0.05);
    assertEquals(0, rows.get(126).getComponents().get("holidays"), 0.05);
  }

  @Test
  public void testRegressorNeedsFutureValues() throws Exception {
    double[] promo = new double[60];
    for (int t = 0; t < promo.length; t++) {
      promo[t] = t % 4 == 0 ? 1 : 0;
    }
    CanonicalSeries history =
        SyntheticSeries.daily(
            0, 60, t -> 10 + 0.1 * t + 3 * promo[t], null, null, ImmutableMap.of("promo", promo));
    ModelConfig config =
        ModelConfig.builder().noSeasonality().addRegressor("promo").uncertaintySamples(0).build();
    FittedModel model = fitter.fit(history, config);

    try {
      forecaster.forecast(model, ForecastRequest.of(4, "D"));
      fail("expected a DataException");
    } catch (DataException e) {
      assertTrue(e.getContext().startsWith("promo at "));
    }

    double[] future = {1, 0, 0, 0};
    CovariateFrame covariates =
        new CovariateFrame(
            SyntheticSeries.days(60, 4), null, null, ImmutableMap.of("promo", future));
    List<ForecastRow> rows =
        forecaster.forecast(model, ForecastRequest.of(4, "D").withFutureCovariates(covariates));
    for (int i = 0; i < 4; i++) {
      int t = 60 + i;
      assertEquals(10 + 0.1 * t + 3 * future[i], rows.get(i).getYhat(), 0.05);
      assertEquals(3 * future[i], rows.get(i).getComponents().get("promo"), 0.05);
    }
  }

  @Test
  public void testLogisticForecastRespectsCapacity() throws Exception {
    double[] cap = new double[60];
    Arrays.fill(cap, 100);
    CanonicalSeries history =
        SyntheticSeries.daily(
            0, 60, t -> 100 / (1 + Math.exp(-0.1 * (t - 30))), cap, null, null);
    ModelConfig config =
        ModelConfig.builder()
            .growth(Growth.LOGISTIC)
            .noSeasonality()
            .uncertaintySamples(0)
            .build();
    FittedModel model = fitter.fit(history, config);

    double[] futureCap = new double[30];
    Arrays.fill(futureCap, 100);
    CovariateFrame covariates =
        new CovariateFrame(SyntheticSeries.days(60, 30), futureCap, null, null);
    List<ForecastRow> rows =
        forecaster.forecast(model, ForecastRequest.of(30, "D").withFutureCovariates(covariates));
    for (int i = 0; i < rows.size(); i++) {
      int t = 60 + i;
      double yhat = rows.get(i).getYhat();
      assertTrue(yhat <= 100);
      assertEquals(100 / (1 + Math.exp(-0.1 * (t - 30))), yhat, 0.5);
    }

    try {
      forecaster.forecast(model, ForecastRequest.of(3, "D"));
      fail("expected a ConfigException");
    } catch (ConfigException e) {
      // no capacity for the future rows
    }
  }

  @Test
  public void testTooFewObservations() throws Exception {
    ModelConfig config =
        ModelConfig.builder().noSeasonality().weekly(Toggle.ON).uncertaintySamples(0).build();
    try {
      fitter.fit(SyntheticSeries.linear(0, 5), config);
      fail("expected a FitException");
    } catch (FitException e) {
      assertTrue(e.getContext().startsWith("n=5"));
    }
  }
}
