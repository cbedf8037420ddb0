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
import java.util.List;

/** Names of the record fields that feed each column of a series. */
public final class FieldMapping {
  private final String dsField;
  private final String yField;
  private final String capField;
  private final String floorField;
  private final ImmutableList<String> regressorFields;
  private final String holidayField;

  private FieldMapping(Builder builder) {
    this.dsField = builder.dsField;
    this.yField = builder.yField;
    this.capField = builder.capField;
    this.floorField = builder.floorField;
    this.regressorFields = ImmutableList.copyOf(builder.regressorFields);
    this.holidayField = builder.holidayField;
  }

  public static Builder builder(String dsField, String yField) {
    return new Builder(dsField, yField);
  }

  public String getDsField() {
    return dsField;
  }

  public String getYField() {
    return yField;
  }

  /** Null when no capacity column is mapped. */
  public String getCapField() {
    return capField;
  }

  /** Null when no floor column is mapped. */
  public String getFloorField() {
    return floorField;
  }

  public List<String> getRegressorFields() {
    return regressorFields;
  }

  /** Null when no holiday column is mapped. */
  public String getHolidayField() {
    return holidayField;
  }

  public static final class Builder {
    private final String dsField;
    private final String yField;
    private String capField;
    private String floorField;
    private List<String> regressorFields = ImmutableList.of();
    private String holidayField;

    private Builder(String dsField, String yField) {
      this.dsField = Preconditions.checkNotNull(dsField);
      this.yField = Preconditions.checkNotNull(yField);
    }

    public Builder cap(String field) {
      this.capField = field;
      return this;
    }

    public Builder floor(String field) {
      this.floorField = field;
      return this;
    }

    public Builder regressors(List<String> fields) {
      this.regressorFields = Preconditions.checkNotNull(fields);
      return this;
    }

    public Builder holidays(String field) {
      this.holidayField = field;
      return this;
    }

    public FieldMapping build() {
      return new FieldMapping(this);
    }
  }
}
