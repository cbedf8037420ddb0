package net.larse.tsforecast.timeseries;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HolidayTest {

  @Test
  public void testWindowDays() {
    Holiday h = new Holiday("xmas", LocalDate.of(2020, 12, 25), -1, 2);
    assertEquals(
        ImmutableList.of(
            LocalDate.of(2020, 12, 24),
            LocalDate.of(2020, 12, 25),
            LocalDate.of(2020, 12, 26),
            LocalDate.of(2020, 12, 27)),
        h.windowDays());
    assertEquals(
        ImmutableList.of(LocalDate.of(2020, 1, 1)),
        new Holiday("day", LocalDate.of(2020, 1, 1)).windowDays());
  }

  @Test
  public void testEquality() {
    LocalDate date = LocalDate.of(2020, 7, 4);
    assertEquals(new Holiday("july4", date), new Holiday("july4", date, 0, 0));
    assertEquals(new Holiday("july4", date).hashCode(), new Holiday("july4", date).hashCode());
    assertNotEquals(new Holiday("july4", date), new Holiday("july4", date, 0, 1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsPositiveLowerWindow() {
    new Holiday("bad", LocalDate.of(2020, 1, 1), 1, 2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsNegativeUpperWindow() {
    new Holiday("bad", LocalDate.of(2020, 1, 1), 0, -1);
  }
}
