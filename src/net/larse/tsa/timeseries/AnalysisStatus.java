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
package net.larse.tsa.timeseries;

import com.google.common.base.Preconditions;

/**
 * Whether an analysis ran, and why not when it did not. Results carry a status instead of throwing
 * so that callers analyzing many metrics need no per-metric exception handling.
 */
public final class AnalysisStatus {
  public enum Code {
    OK,
    INSUFFICIENT_DATA
  }

  public static final String INSUFFICIENT_DATA_REASON = "insufficient_data";

  public static final AnalysisStatus OK = new AnalysisStatus(Code.OK, "");

  private final Code code;
  private final String reason;

  private AnalysisStatus(Code code, String reason) {
    this.code = code;
    this.reason = reason;
  }

  /** An insufficient-data status; detail explains what was missing. */
  public static AnalysisStatus insufficientData(String detail) {
    Preconditions.checkNotNull(detail);
    return new AnalysisStatus(Code.INSUFFICIENT_DATA, INSUFFICIENT_DATA_REASON + ": " + detail);
  }

  public Code getCode() {
    return code;
  }

  /** Empty when OK, otherwise starts with "insufficient_data". */
  public String getReason() {
    return reason;
  }

  public boolean isOk() {
    return code == Code.OK;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof AnalysisStatus)) {
      return false;
    }
    AnalysisStatus other = (AnalysisStatus) o;
    return code == other.code && reason.equals(other.reason);
  }

  @Override
  public int hashCode() {
    return 31 * code.hashCode() + reason.hashCode();
  }

  @Override
  public String toString() {
    return isOk() ? "OK" : reason;
  }
}
