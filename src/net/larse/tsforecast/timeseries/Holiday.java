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
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * One occurrence of a named holiday. The effect window spans {@code [date + lowerWindow, date +
 * upperWindow]} days, inclusive; the default window is the day itself.
 */
public final class Holiday implements Serializable {
  private static final long serialVersionUID = 1L;

  private final String name;
  private final LocalDate date;
  private final int lowerWindow;
  private final int upperWindow;

  public Holiday(String name, LocalDate date) {
    this(name, date, 0, 0);
  }

  public Holiday(String name, LocalDate date, int lowerWindow, int upperWindow) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "holiday name is required");
    Preconditions.checkNotNull(date);
    Preconditions.checkArgument(lowerWindow <= 0, "lowerWindow must be <= 0");
    Preconditions.checkArgument(upperWindow >= 0, "upperWindow must be >= 0");
    this.name = name;
    this.date = date;
    this.lowerWindow = lowerWindow;
    this.upperWindow = upperWindow;
  }

  public String getName() {
    return name;
  }

  public LocalDate getDate() {
    return date;
  }

  /** The days inside this holiday's window, in order. */
  public List<LocalDate> windowDays() {
    ImmutableList.Builder<LocalDate> days = ImmutableList.builder();
    for (int d = lowerWindow; d <= upperWindow; d++) {
      days.add(date.plusDays(d));
    }
    return days.build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Holiday)) {
      return false;
    }
    Holiday other = (Holiday) o;
    return name.equals(other.name)
        && date.equals(other.date)
        && lowerWindow == other.lowerWindow
        && upperWindow == other.upperWindow;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, date, lowerWindow, upperWindow);
  }

  @Override
  public String toString() {
    return name + "@" + date;
  }
}
