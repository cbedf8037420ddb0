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

import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;
import net.larse.tsforecast.errors.DataException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw tabular records into a {@link CanonicalSeries}.
 *
 * <p>Dates are parsed to epoch seconds, numeric fields are coerced to doubles (unparseable values
 * count as missing), incomplete rows are dropped and the rest sorted. Duplicate timestamps are
 * rejected rather than aggregated.
 */
public class DataPreparer {
  private static final Logger logger = LoggerFactory.getLogger(DataPreparer.class);

  public static final int MIN_ROWS = 2;

  /** A prepared series together with the holidays read from the holiday field, if any. */
  public static final class Prepared {
    private final CanonicalSeries series;
    private final ImmutableList<Holiday> holidays;

    Prepared(CanonicalSeries series, List<Holiday> holidays) {
      this.series = series;
      this.holidays = ImmutableList.copyOf(holidays);
    }

    public CanonicalSeries getSeries() {
      return series;
    }

    public List<Holiday> getHolidays() {
      return holidays;
    }
  }

  /** Column buffers filled while scanning records. */
  private static final class Columns {
    final LongArrayList ts = new LongArrayList();
    final DoubleArrayList y = new DoubleArrayList();
    final DoubleArrayList cap = new DoubleArrayList();
    final DoubleArrayList floor = new DoubleArrayList();
    final Map<String, DoubleArrayList> regressors = new LinkedHashMap<>();

    Columns(List<String> regressorNames) {
      for (String name : regressorNames) {
        regressors.put(name, new DoubleArrayList());
      }
    }

    /** Row order that sorts the buffered timestamps ascending. */
    int[] order() {
      return IntStream.range(0, ts.size())
          .boxed()
          .sorted(Comparator.comparingLong(ts::getLong))
          .mapToInt(Integer::intValue)
          .toArray();
    }
  }

  public Prepared prepare(List<? extends Map<String, ?>> records, FieldMapping mapping)
      throws DataException {
    requireField(records, mapping.getDsField());
    requireField(records, mapping.getYField());

    Columns columns = new Columns(mapping.getRegressorFields());
    Set<Holiday> holidays = new LinkedHashSet<>();
    int dropped = 0;

    for (Map<String, ?> record : records) {
      Long ts = TimeSeriesUtils.parseTimestamp(record.get(mapping.getDsField()));
      if (ts != null && mapping.getHolidayField() != null) {
        Object name = record.get(mapping.getHolidayField());
        String holidayName = name == null ? null : StringUtils.trimToNull(name.toString());
        if (holidayName != null) {
          holidays.add(new Holiday(holidayName, TimeSeriesUtils.toDate(ts)));
        }
      }

      double y = TimeSeriesUtils.parseDouble(record.get(mapping.getYField()));
      double cap = optional(record, mapping.getCapField());
      double floor = optional(record, mapping.getFloorField());
      if (ts == null
          || Double.isNaN(y)
          || (mapping.getCapField() != null && Double.isNaN(cap))
          || (mapping.getFloorField() != null && Double.isNaN(floor))
          || missingRegressor(record, mapping.getRegressorFields())) {
        dropped++;
        continue;
      }

      columns.ts.add(ts.longValue());
      columns.y.add(y);
      columns.cap.add(cap);
      columns.floor.add(floor);
      for (String name : mapping.getRegressorFields()) {
        columns.regressors.get(name).add(TimeSeriesUtils.parseDouble(record.get(name)));
      }
    }

    int n = columns.ts.size();
    if (n < MIN_ROWS) {
      throw new DataException(
          "At least " + MIN_ROWS + " valid rows are required after cleaning", "rows=" + n);
    }

    int[] order = columns.order();
    long[] ts = new long[n];
    double[] y = new double[n];
    double[] cap = mapping.getCapField() == null ? null : new double[n];
    double[] floor = mapping.getFloorField() == null ? null : new double[n];
    Map<String, double[]> regressors = new LinkedHashMap<>();
    for (String name : mapping.getRegressorFields()) {
      regressors.put(name, new double[n]);
    }

    for (int i = 0; i < n; i++) {
      int src = order[i];
      ts[i] = columns.ts.getLong(src);
      if (i > 0 && ts[i] == ts[i - 1]) {
        throw new DataException("Duplicate timestamp in input", TimeSeriesUtils.format(ts[i]));
      }
      y[i] = columns.y.getDouble(src);
      if (cap != null) {
        cap[i] = columns.cap.getDouble(src);
      }
      if (floor != null) {
        floor[i] = columns.floor.getDouble(src);
      }
      for (Map.Entry<String, double[]> e : regressors.entrySet()) {
        e.getValue()[i] = columns.regressors.get(e.getKey()).getDouble(src);
      }
    }

    logger.info(
        "Prepared {} rows from {} records ({} dropped), {} holiday occurrences",
        n, records.size(), dropped, holidays.size());
    return new Prepared(
        new CanonicalSeries(ts, y, cap, floor, regressors), ImmutableList.copyOf(holidays));
  }

  /**
   * Prepares the covariates of future rows. Only the date is required; cells that are missing or
   * unparseable stay NaN and are rejected later if the model needs them.
   */
  public CovariateFrame prepareFuture(List<? extends Map<String, ?>> records, FieldMapping mapping)
      throws DataException {
    Columns columns = new Columns(mapping.getRegressorFields());
    for (Map<String, ?> record : records) {
      Long ts = TimeSeriesUtils.parseTimestamp(record.get(mapping.getDsField()));
      if (ts == null) {
        continue;
      }
      columns.ts.add(ts.longValue());
      columns.cap.add(optional(record, mapping.getCapField()));
      columns.floor.add(optional(record, mapping.getFloorField()));
      for (String name : mapping.getRegressorFields()) {
        columns.regressors.get(name).add(TimeSeriesUtils.parseDouble(record.get(name)));
      }
    }

    int n = columns.ts.size();
    int[] order = columns.order();
    long[] ts = new long[n];
    double[] cap = mapping.getCapField() == null ? null : new double[n];
    double[] floor = mapping.getFloorField() == null ? null : new double[n];
    Map<String, double[]> regressors = new LinkedHashMap<>();
    for (String name : mapping.getRegressorFields()) {
      regressors.put(name, new double[n]);
    }
    for (int i = 0; i < n; i++) {
      int src = order[i];
      ts[i] = columns.ts.getLong(src);
      if (i > 0 && ts[i] == ts[i - 1]) {
        throw new DataException(
            "Duplicate timestamp in future rows", TimeSeriesUtils.format(ts[i]));
      }
      if (cap != null) {
        cap[i] = columns.cap.getDouble(src);
      }
      if (floor != null) {
        floor[i] = columns.floor.getDouble(src);
      }
      for (Map.Entry<String, double[]> e : regressors.entrySet()) {
        e.getValue()[i] = columns.regressors.get(e.getKey()).getDouble(src);
      }
    }
    return new CovariateFrame(ts, cap, floor, regressors);
  }

  private static void requireField(List<? extends Map<String, ?>> records, String field)
      throws DataException {
    for (Map<String, ?> record : records) {
      if (record.containsKey(field)) {
        return;
      }
    }
    throw new DataException("Field not found in data", field);
  }

  private static double optional(Map<String, ?> record, String field) {
    return field == null ? Double.NaN : TimeSeriesUtils.parseDouble(record.get(field));
  }

  private static boolean missingRegressor(Map<String, ?> record, List<String> names) {
    for (String name : names) {
      if (Double.isNaN(TimeSeriesUtils.parseDouble(record.get(name)))) {
        return true;
      }
    }
    return false;
  }
}
