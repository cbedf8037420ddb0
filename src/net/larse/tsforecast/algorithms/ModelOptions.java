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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableSet;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.larse.tsforecast.algorithms.ModelConfig.Growth;
import net.larse.tsforecast.algorithms.ModelConfig.SeasonalityMode;
import net.larse.tsforecast.algorithms.ModelConfig.Toggle;
import net.larse.tsforecast.errors.ConfigException;
import net.larse.tsforecast.timeseries.TimeSeriesUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link ModelConfig} from declarative string options such as {@code growth=logistic} or
 * {@code seasonalities=[{"name": "monthly", "period": 30.5, "fourier_order": 5}]}.
 *
 * <p>Unset options keep their defaults and unknown ones are logged and ignored. Every value that
 * cannot be parsed fails with a {@link ConfigException} naming the option.
 */
public final class ModelOptions {
  private static final Logger logger = LoggerFactory.getLogger(ModelOptions.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String DEFAULT_CV_INITIAL = "730 days";
  public static final String DEFAULT_CV_PERIOD = "180 days";
  public static final String DEFAULT_CV_HORIZON = "365 days";

  private static final ImmutableSet<String> KNOWN =
      ImmutableSet.of(
          "growth",
          "seasonality_mode",
          "yearly_seasonality",
          "weekly_seasonality",
          "daily_seasonality",
          "changepoint_prior_scale",
          "seasonality_prior_scale",
          "uncertainty_samples",
          "confidence_interval",
          "interval_width",
          "regressors",
          "seasonalities",
          "n_changepoints",
          "changepoint_range",
          "cross_validate",
          "cv_initial",
          "cv_period",
          "cv_horizon");

  private ModelOptions() {}

  public static ModelConfig parse(Map<String, String> options) throws ConfigException {
    for (String key : options.keySet()) {
      if (!KNOWN.contains(key)) {
        logger.warn("Ignoring unknown option {}", key);
      }
    }

    ModelConfig.Builder builder = ModelConfig.builder();
    String growth = value(options, "growth");
    if (growth != null) {
      builder.growth(parseEnum(Growth.class, "growth", growth));
    }
    String mode = value(options, "seasonality_mode");
    if (mode != null) {
      builder.seasonalityMode(parseEnum(SeasonalityMode.class, "seasonality_mode", mode));
    }
    String yearly = value(options, "yearly_seasonality");
    if (yearly != null) {
      builder.yearly(parseToggle("yearly_seasonality", yearly));
    }
    String weekly = value(options, "weekly_seasonality");
    if (weekly != null) {
      builder.weekly(parseToggle("weekly_seasonality", weekly));
    }
    String daily = value(options, "daily_seasonality");
    if (daily != null) {
      builder.daily(parseToggle("daily_seasonality", daily));
    }

    String cps = value(options, "changepoint_prior_scale");
    if (cps != null) {
      builder.changepointPriorScale(parseDouble("changepoint_prior_scale", cps));
    }
    String sps = value(options, "seasonality_prior_scale");
    if (sps != null) {
      builder.seasonalityPriorScale(parseDouble("seasonality_prior_scale", sps));
    }
    String samples = value(options, "uncertainty_samples");
    if (samples != null) {
      builder.uncertaintySamples(parseInt("uncertainty_samples", samples));
    }
    String width = value(options, "confidence_interval");
    if (width == null) {
      width = value(options, "interval_width");
    }
    if (width != null) {
      builder.intervalWidth(parseDouble("confidence_interval", width));
    }
    String nChangepoints = value(options, "n_changepoints");
    if (nChangepoints != null) {
      builder.nChangepoints(parseInt("n_changepoints", nChangepoints));
    }
    String range = value(options, "changepoint_range");
    if (range != null) {
      builder.changepointRange(parseDouble("changepoint_range", range));
    }

    String regressors = value(options, "regressors");
    if (regressors != null) {
      List<String> names = new ArrayList<>();
      for (String name : StringUtils.split(regressors, ',')) {
        String trimmed = StringUtils.trimToNull(name);
        if (trimmed != null) {
          names.add(trimmed);
        }
      }
      builder.regressors(names);
    }

    String seasonalities = value(options, "seasonalities");
    if (seasonalities != null) {
      addSeasonalities(builder, seasonalities);
    }
    return builder.build();
  }

  /**
   * Cross-validation settings, or null unless {@code cross_validate} is true. Durations default to
   * 730, 180 and 365 days.
   */
  public static ForecastEngine.CvOptions parseCrossValidation(Map<String, String> options)
      throws ConfigException {
    String enabled = value(options, "cross_validate");
    if (enabled == null) {
      return null;
    }
    Toggle toggle = parseToggle("cross_validate", enabled);
    if (toggle == Toggle.AUTO) {
      throw new ConfigException("cross_validate must be true or false", enabled);
    }
    if (toggle == Toggle.OFF) {
      return null;
    }
    return new ForecastEngine.CvOptions(
        duration(options, "cv_initial", DEFAULT_CV_INITIAL),
        duration(options, "cv_period", DEFAULT_CV_PERIOD),
        duration(options, "cv_horizon", DEFAULT_CV_HORIZON));
  }

  private static Duration duration(Map<String, String> options, String key, String fallback)
      throws ConfigException {
    String text = value(options, key);
    try {
      return TimeSeriesUtils.parseDuration(text == null ? fallback : text);
    } catch (ConfigException e) {
      throw new ConfigException("Invalid duration for " + key, text, e);
    }
  }

  private static void addSeasonalities(ModelConfig.Builder builder, String json)
      throws ConfigException {
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new ConfigException("seasonalities is not valid JSON", e.getOriginalMessage(), e);
    }
    if (root == null || !root.isArray()) {
      throw new ConfigException("seasonalities must be a JSON array", json);
    }
    for (JsonNode node : root) {
      JsonNode name = node.path("name");
      JsonNode period = node.path("period");
      if (!name.isTextual() || !period.isNumber()) {
        throw new ConfigException(
            "Each seasonality needs a name and a numeric period", node.toString());
      }
      JsonNode order = node.path("fourier_order");
      if (!order.isMissingNode() && !order.canConvertToInt()) {
        throw new ConfigException("fourier_order must be an integer", node.toString());
      }
      builder.addSeasonality(
          name.asText(),
          period.asDouble(),
          order.isMissingNode() ? ModelConfig.DEFAULT_CUSTOM_ORDER : order.asInt());
    }
  }

  private static String value(Map<String, String> options, String key) {
    return StringUtils.trimToNull(options.get(key));
  }

  /** Booleans accept true/1/yes/on and false/0/no/off; {@code auto} defers to the history. */
  static Toggle parseToggle(String key, String value) throws ConfigException {
    switch (value.toLowerCase(Locale.ROOT)) {
      case "auto":
        return Toggle.AUTO;
      case "true":
      case "1":
      case "yes":
      case "on":
        return Toggle.ON;
      case "false":
      case "0":
      case "no":
      case "off":
        return Toggle.OFF;
      default:
        throw new ConfigException("Invalid value for " + key, value);
    }
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value)
      throws ConfigException {
    try {
      return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid value for " + key, value, e);
    }
  }

  private static double parseDouble(String key, String value) throws ConfigException {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid number for " + key, value, e);
    }
  }

  private static int parseInt(String key, String value) throws ConfigException {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid integer for " + key, value, e);
    }
  }
}
