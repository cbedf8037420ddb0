package net.larse.tsforecast.algorithms;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.larse.tsforecast.errors.ForecastException;
import net.larse.tsforecast.errors.ModelIOException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ModelStoreTest {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private ModelStore store;
  private FittedModel model;

  @Before
  public void setUp() throws Exception {
    store = new ModelStore();
    ModelConfig config = ModelConfig.builder().noSeasonality().uncertaintySamples(50).build();
    model = new Fitter().fit(SyntheticSeries.linear(0, 60), config);
  }

  @Test
  public void testRoundTripGivesSameForecast() throws Exception {
    Path path = folder.getRoot().toPath().resolve("models").resolve("linear.model");
    store.save(model, path);
    assertTrue(Files.exists(path));
    FittedModel loaded = store.load(path);

    assertEquals(model.getConfig(), loaded.getConfig());
    assertArrayEquals(model.getParams(), loaded.getParams(), 0);
    assertArrayEquals(model.getChangepoints(), loaded.getChangepoints());
    assertEquals(model.numSamples(), loaded.numSamples());

    Forecaster forecaster = new Forecaster();
    List<ForecastRow> before = forecaster.forecast(model, ForecastRequest.of(5, "D"));
    List<ForecastRow> after = forecaster.forecast(loaded, ForecastRequest.of(5, "D"));
    for (int i = 0; i < before.size(); i++) {
      assertEquals(before.get(i).toRecord(), after.get(i).toRecord());
    }
  }

  @Test
  public void testSaveReplacesExistingFile() throws Exception {
    File existing = folder.newFile("model.bin");
    Files.write(existing.toPath(), "old".getBytes(StandardCharsets.UTF_8));
    store.save(model, existing.toPath());
    assertArrayEquals(model.getParams(), store.load(existing.toPath()).getParams(), 0);
    // only the model is left behind
    assertEquals(1, folder.getRoot().list().length);
  }

  @Test
  public void testLoadFailures() throws Exception {
    try {
      store.load(folder.getRoot().toPath().resolve("missing.model"));
      fail("expected a ModelIOException");
    } catch (ModelIOException e) {
      assertEquals(ForecastException.Kind.IO, e.getKind());
    }

    File garbage = folder.newFile("garbage.model");
    Files.write(garbage.toPath(), "not a model".getBytes(StandardCharsets.UTF_8));
    try {
      store.load(garbage.toPath());
      fail("expected a ModelIOException");
    } catch (ModelIOException e) {
      assertEquals(garbage.toPath().toString(), e.getContext());
    }
  }
}
