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

package net.larse.tsforecast.timeseries;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.io.Serializable;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.larse.tsforecast.errors.ConfigException;

/**
 * A forecast step such as {@code "D"}, {@code "H"}, {@code "15T"} or {@code "2W"}: an optional
 * positive multiplier followed by a unit.
 *
 * <p>Fixed units step in seconds. Months, quarters and years step on the calendar and are
 * anchored: {@code M}, {@code Q}, {@code Y} and {@code A} land on the last day of each period,
 * while {@code MS}, {@code QS}, {@code YS} and {@code AS} land on the first. Quarters end in
 * March, June, September and December. The time of day of the origin is kept.
 */
public final class Frequency implements Serializable {
  private static final long serialVersionUID = 1L;

  public enum Unit {
    SECOND,
    MINUTE,
    HOUR,
    DAY,
    BUSINESS_DAY,
    WEEK,
    MONTH,
    QUARTER,
    YEAR
  }

  public enum Anchor {
    NONE,
    START,
    END
  }

  private static final Pattern PATTERN = Pattern.compile("^(\\d*)([A-Za-z]+)$");

  private static final Map<String, Unit> UNITS =
      ImmutableMap.<String, Unit>builder()
          .put("S", Unit.SECOND)
          .put("T", Unit.MINUTE)
          .put("min", Unit.MINUTE)
          .put("H", Unit.HOUR)
          .put("D", Unit.DAY)
          .put("B", Unit.BUSINESS_DAY)
          .put("W", Unit.WEEK)
          .put("M", Unit.MONTH)
          .put("MS", Unit.MONTH)
          .put("Q", Unit.QUARTER)
          .put("QS", Unit.QUARTER)
          .put("Y", Unit.YEAR)
          .put("A", Unit.YEAR)
          .put("YS", Unit.YEAR)
          .put("AS", Unit.YEAR)
          .build();

  private final int multiplier;
  private final Unit unit;
  private final Anchor anchor;

  public Frequency(int multiplier, Unit unit, Anchor anchor) {
    Preconditions.checkArgument(multiplier > 0, "multiplier must be positive");
    Preconditions.checkNotNull(unit);
    Preconditions.checkArgument(
        (calendarMonths(unit) > 0) == (anchor != Anchor.NONE),
        "calendar units take an anchor, fixed units do not");
    this.multiplier = multiplier;
    this.unit = unit;
    this.anchor = anchor;
  }

  public static Frequency parse(String text) throws ConfigException {
    if (text == null) {
      throw new ConfigException("Frequency is required", "freq");
    }
    Matcher matcher = PATTERN.matcher(text.trim());
    if (!matcher.matches()) {
      throw new ConfigException("Unrecognized frequency", text);
    }
    Unit unit = UNITS.get(matcher.group(2));
    if (unit == null) {
      throw new ConfigException("Unrecognized frequency unit", text);
    }
    int multiplier;
    try {
      multiplier = matcher.group(1).isEmpty() ? 1 : Integer.parseInt(matcher.group(1));
    } catch (NumberFormatException e) {
      throw new ConfigException("Frequency multiplier out of range", text, e);
    }
    if (multiplier <= 0) {
      throw new ConfigException("Frequency multiplier must be positive", text);
    }
    if (calendarMonths(unit) == 0) {
      return new Frequency(multiplier, unit, Anchor.NONE);
    }
    Anchor anchor = matcher.group(2).endsWith("S") ? Anchor.START : Anchor.END;
    return new Frequency(multiplier, unit, anchor);
  }

  public int getMultiplier() {
    return multiplier;
  }

  public Unit getUnit() {
    return unit;
  }

  public Anchor getAnchor() {
    return anchor;
  }

  /** The timestamp {@code steps} steps after {@code origin}. */
  public long advance(long origin, int steps) {
    long n = (long) steps * multiplier;
    LocalDateTime start = TimeSeriesUtils.toDateTime(origin);
    switch (unit) {
      case SECOND:
        return origin + n;
      case MINUTE:
        return origin + n * 60;
      case HOUR:
        return origin + n * 3600;
      case DAY:
        return origin + n * TimeSeriesUtils.SECONDS_PER_DAY;
      case WEEK:
        return origin + n * 7 * TimeSeriesUtils.SECONDS_PER_DAY;
      case BUSINESS_DAY:
        return TimeSeriesUtils.toEpochSecond(plusBusinessDays(start, n));
      case MONTH:
      case QUARTER:
      case YEAR:
        return TimeSeriesUtils.toEpochSecond(anchored(start, steps));
      default:
        throw new IllegalStateException("unhandled unit " + unit);
    }
  }

  /** The {@code periods} timestamps following {@code last}. */
  public long[] sequence(long last, int periods) {
    long[] result = new long[periods];
    for (int i = 0; i < periods; i++) {
      result[i] = advance(last, i + 1);
    }
    return result;
  }

  /**
   * The {@code steps}-th anchor date after {@code origin}. The first one is the earliest anchor of
   * the origin's period (or the next period) strictly after the origin.
   */
  private LocalDateTime anchored(LocalDateTime origin, int steps) {
    int months = calendarMonths(unit);
    int offset = (origin.getMonthValue() - 1) % months;
    LocalDateTime periodStart = origin.withDayOfMonth(1).minusMonths(offset);
    if (!anchorOf(periodStart, months).isAfter(origin)) {
      periodStart = periodStart.plusMonths(months);
    }
    return anchorOf(periodStart.plusMonths((long) (steps - 1) * multiplier * months), months);
  }

  /** The anchor day of the period beginning on the first day of {@code periodStart}. */
  private LocalDateTime anchorOf(LocalDateTime periodStart, int months) {
    if (anchor == Anchor.START) {
      return periodStart;
    }
    LocalDateTime lastMonth = periodStart.plusMonths(months - 1);
    return lastMonth.withDayOfMonth(lastMonth.toLocalDate().lengthOfMonth());
  }

  private static int calendarMonths(Unit unit) {
    switch (unit) {
      case MONTH:
        return 1;
      case QUARTER:
        return 3;
      case YEAR:
        return 12;
      default:
        return 0;
    }
  }

  private static LocalDateTime plusBusinessDays(LocalDateTime start, long days) {
    LocalDateTime current = start;
    long added = 0;
    while (added < days) {
      current = current.plusDays(1);
      DayOfWeek dow = current.getDayOfWeek();
      if (dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY) {
        added++;
      }
    }
    return current;
  }

  @Override
  public String toString() {
    String text = multiplier + unit.name();
    return anchor == Anchor.START ? text + "_START" : text;
  }
}
