package net.larse.tsforecast.algorithms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.Map;
import net.larse.tsforecast.algorithms.ModelConfig.Growth;
import net.larse.tsforecast.algorithms.ModelConfig.SeasonalityMode;
import net.larse.tsforecast.algorithms.ModelConfig.Toggle;
import net.larse.tsforecast.errors.ConfigException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ModelOptionsTest {

  @Test
  public void testParse() throws Exception {
    Map<String, String> options =
        ImmutableMap.<String, String>builder()
            .put("growth", "Logistic")
            .put("seasonality_mode", "multiplicative")
            .put("yearly_seasonality", "false")
            .put("weekly_seasonality", "yes")
            .put("changepoint_prior_scale", "0.5")
            .put("uncertainty_samples", "0")
            .put("confidence_interval", "0.95")
            .put("regressors", " temp, ,promo ")
            .put(
                "seasonalities",
                "[{\"name\": \"monthly\", \"period\": 30.5, \"fourier_order\": 5},"
                    + " {\"name\": \"quarterly\", \"period\": 91.25}]")
            .put("something_else", "ignored")
            .build();

    ModelConfig config = ModelOptions.parse(options);
    assertEquals(Growth.LOGISTIC, config.getGrowth());
    assertEquals(SeasonalityMode.MULTIPLICATIVE, config.getSeasonalityMode());
    assertEquals(Toggle.OFF, config.getYearly());
    assertEquals(Toggle.ON, config.getWeekly());
    assertEquals(Toggle.AUTO, config.getDaily());
    assertEquals(0.5, config.getChangepointPriorScale(), 0);
    assertEquals(0, config.getUncertaintySamples());
    assertEquals(0.95, config.getIntervalWidth(), 0);
    assertEquals(ImmutableList.of("temp", "promo"), config.getRegressors());
    assertEquals(
        ImmutableList.of(
            new ModelConfig.Seasonality("monthly", 30.5, 5),
            new ModelConfig.Seasonality("quarterly", 91.25, ModelConfig.DEFAULT_CUSTOM_ORDER)),
        config.getSeasonalities());
  }

  @Test
  public void testEmptyOptionsGiveDefaults() throws Exception {
    assertEquals(ModelConfig.defaults(), ModelOptions.parse(ImmutableMap.of()));
  }

  @Test
  public void testInvalidValuesNameTheOption() {
    String[][] cases = {
      {"growth", "exponential"},
      {"changepoint_prior_scale", "big"},
      {"uncertainty_samples", "1.5"},
      {"daily_seasonality", "maybe"},
      {"seasonalities", "{not json"},
      {"seasonalities", "{\"name\": \"monthly\"}"},
      {"seasonalities", "[{\"name\": \"monthly\", \"period\": \"long\"}]"},
      {"interval_width", "1.2"},
    };
    for (String[] c : cases) {
      try {
        ModelOptions.parse(ImmutableMap.of(c[0], c[1]));
        fail("expected a ConfigException for " + c[0] + "=" + c[1]);
      } catch (ConfigException e) {
        // expected
      }
    }
  }

  @Test
  public void testCrossValidationOptions() throws Exception {
    assertNull(ModelOptions.parseCrossValidation(ImmutableMap.of()));
    assertNull(ModelOptions.parseCrossValidation(ImmutableMap.of("cross_validate", "false")));

    ForecastEngine.CvOptions defaults =
        ModelOptions.parseCrossValidation(ImmutableMap.of("cross_validate", "true"));
    assertEquals(Duration.ofDays(730), defaults.getInitial());
    assertEquals(Duration.ofDays(180), defaults.getPeriod());
    assertEquals(Duration.ofDays(365), defaults.getHorizon());

    ForecastEngine.CvOptions custom =
        ModelOptions.parseCrossValidation(
            ImmutableMap.of("cross_validate", "1", "cv_horizon", "30 days"));
    assertEquals(Duration.ofDays(30), custom.getHorizon());
  }

  @Test
  public void testCrossValidateIsStrictlyBoolean() {
    for (String value : new String[] {"auto", "AUTO", "maybe"}) {
      try {
        ModelOptions.parseCrossValidation(ImmutableMap.of("cross_validate", value));
        fail("expected a ConfigException for '" + value + "'");
      } catch (ConfigException e) {
        assertEquals(value, e.getContext());
      }
    }
  }

  @Test(expected = ConfigException.class)
  public void testBadCrossValidationDuration() throws Exception {
    ModelOptions.parseCrossValidation(
        ImmutableMap.of("cross_validate", "on", "cv_period", "every month"));
  }
}
