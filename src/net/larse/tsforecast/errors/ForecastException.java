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

package net.larse.tsforecast.errors;

/**
 * Base class of every failure raised by the forecasting engine.
 *
 * <p>Each failure carries a {@link Kind}, a message and an optional context (the offending field,
 * timestamp or option) so it can be diagnosed without a stack trace.
 */
public class ForecastException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** Malformed, insufficient or ambiguous input. */
    DATA,
    /** Invalid or internally inconsistent configuration. */
    CONFIG,
    /** Optimizer non-convergence or an under-determined system. */
    FIT,
    /** Persistence failure. */
    IO
  }

  private final Kind kind;
  private final String context;

  public ForecastException(Kind kind, String message, String context) {
    super(message);
    this.kind = kind;
    this.context = context;
  }

  public ForecastException(Kind kind, String message, String context, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.context = context;
  }

  public Kind getKind() {
    return kind;
  }

  /** The offending field, timestamp or option, or null. */
  public String getContext() {
    return context;
  }

  @Override
  public String getMessage() {
    String message = super.getMessage();
    return context == null ? message : message + " [" + context + "]";
  }
}
