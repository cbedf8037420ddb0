package net.larse.tsforecast.algorithms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import net.larse.tsforecast.algorithms.DesignMatrixBuilder.SeasonalTerm;
import net.larse.tsforecast.algorithms.ModelConfig.Growth;
import net.larse.tsforecast.algorithms.ModelConfig.Toggle;
import net.larse.tsforecast.errors.ConfigException;
import net.larse.tsforecast.errors.DataException;
import net.larse.tsforecast.errors.ForecastException;
import net.larse.tsforecast.timeseries.CanonicalSeries;
import net.larse.tsforecast.timeseries.CovariateFrame;
import net.larse.tsforecast.timeseries.Holiday;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DesignMatrixBuilderTest {

  private static List<String> names(List<SeasonalTerm> terms) {
    String[] names = new String[terms.size()];
    for (int i = 0; i < names.length; i++) {
      names[i] = terms.get(i).name;
    }
    return Arrays.asList(names);
  }

  @Test
  public void testAutoSeasonalityOnDailyHistory() throws Exception {
    CanonicalSeries history = SyntheticSeries.linear(0, 100);
    assertEquals(
        ImmutableList.of("weekly"),
        names(DesignMatrixBuilder.resolveSeasonalities(history, ModelConfig.defaults())));

    // two years resolve the yearly cycle
    CanonicalSeries longHistory = SyntheticSeries.linear(0, 731);
    assertEquals(
        ImmutableList.of("yearly", "weekly"),
        names(DesignMatrixBuilder.resolveSeasonalities(longHistory, ModelConfig.defaults())));
  }

  @Test
  public void testAutoSeasonalityOnHourlyHistory() throws Exception {
    long[] ts = new long[72];
    double[] y = new double[72];
    for (int i = 0; i < ts.length; i++) {
      ts[i] = SyntheticSeries.START + i * 3600L;
      y[i] = i;
    }
    ModelConfig config =
        ModelConfig.builder().addSeasonality("hourly_cycle", 0.5, 2).build();
    List<SeasonalTerm> terms =
        DesignMatrixBuilder.resolveSeasonalities(CanonicalSeries.of(ts, y), config);
    assertEquals(ImmutableList.of("daily", "hourly_cycle"), names(terms));
    assertEquals(ModelConfig.DEFAULT_DAILY_ORDER, terms.get(0).order);
  }

  @Test
  public void testExplicitTogglesWin() throws Exception {
    ModelConfig config =
        ModelConfig.builder().yearly(Toggle.ON, 4).weekly(Toggle.OFF).build();
    assertEquals(
        ImmutableList.of("yearly"),
        names(
            DesignMatrixBuilder.resolveSeasonalities(SyntheticSeries.linear(0, 30), config)));
  }

  @Test
  public void testFeatureLayout() throws Exception {
    ModelConfig config =
        ModelConfig.builder()
            .weekly(Toggle.ON, 2)
            .addHoliday(new Holiday("sale", LocalDate.of(2020, 1, 5), -1, 1))
            .addRegressor("temp")
            .build();
    double[] temp = new double[20];
    for (int i = 0; i < temp.length; i++) {
      temp[i] = i % 3;
    }
    CanonicalSeries history =
        SyntheticSeries.daily(0, 20, t -> t, null, null, ImmutableMap.of("temp", temp));
    DesignMatrixBuilder builder = DesignMatrixBuilder.create(history, config);
    DesignMatrix matrix = builder.build(history.covariates());

    assertEquals(
        ImmutableList.of("weekly", "holidays", "temp"), builder.componentNames());
    assertEquals(6, matrix.numFeatures());
    assertEquals(2 + matrix.numChangepoints() + 6, matrix.numParameters());
    assertEquals(19, builder.getYScale(), 0);

    // the holiday window covers Jan 4 to Jan 6, rows 3 to 5
    int holiday = 4;
    for (int i = 0; i < 20; i++) {
      assertEquals("row " + i, i >= 3 && i <= 5 ? 1 : 0, matrix.feature(i, holiday), 0);
    }
    // the regressor is standardized
    double sum = 0;
    for (int i = 0; i < 20; i++) {
      sum += matrix.feature(i, 5);
    }
    assertEquals(0, sum, 1e-9);
    assertEquals(0, matrix.time()[0], 0);
    assertEquals(1, matrix.time()[19], 1e-12);
  }

  @Test
  public void testLogisticWithoutCapacity() throws Exception {
    ModelConfig config = ModelConfig.builder().growth(Growth.LOGISTIC).build();
    try {
      DesignMatrixBuilder.create(SyntheticSeries.linear(0, 30), config);
      fail("expected a ConfigException");
    } catch (ConfigException e) {
      assertEquals(ForecastException.Kind.CONFIG, e.getKind());
    }
  }

  @Test
  public void testCapacityMustExceedFloor() throws Exception {
    double[] cap = new double[10];
    double[] floor = new double[10];
    Arrays.fill(cap, 200);
    Arrays.fill(floor, 50);
    CanonicalSeries history = SyntheticSeries.daily(0, 10, t -> 100 + t, cap, floor, null);
    DesignMatrixBuilder builder =
        DesignMatrixBuilder.create(
            history, ModelConfig.builder().growth(Growth.LOGISTIC).noSeasonality().build());

    double[] lowCap = {40};
    double[] futureFloor = {50};
    CovariateFrame future =
        new CovariateFrame(new long[] {SyntheticSeries.day(10)}, lowCap, futureFloor, null);
    try {
      builder.build(future);
      fail("expected a DataException");
    } catch (DataException e) {
      assertEquals("2020-01-11 00:00:00", e.getContext());
    }

    CovariateFrame noCap = CovariateFrame.of(new long[] {SyntheticSeries.day(10)});
    try {
      builder.build(noCap);
      fail("expected a ConfigException");
    } catch (ConfigException e) {
      // expected
    }
  }

  @Test
  public void testMissingRegressor() throws Exception {
    ModelConfig config = ModelConfig.builder().addRegressor("temp").build();
    try {
      DesignMatrixBuilder.create(SyntheticSeries.linear(0, 30), config);
      fail("expected a DataException");
    } catch (DataException e) {
      assertEquals("temp", e.getContext());
    }

    double[] temp = new double[30];
    CanonicalSeries history =
        SyntheticSeries.daily(0, 30, t -> t, null, null, ImmutableMap.of("temp", temp));
    DesignMatrixBuilder builder = DesignMatrixBuilder.create(history, config);
    try {
      builder.build(CovariateFrame.of(new long[] {SyntheticSeries.day(30)}));
      fail("expected a DataException");
    } catch (DataException e) {
      assertTrue(e.getContext().startsWith("temp at "));
    }
  }
}
