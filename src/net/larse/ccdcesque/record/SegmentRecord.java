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
package net.larse.ccdcesque.record;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * One fitted segment of a pixel's time series.
 *
 * <p>Coefficients are stored raw, referenced to date 0, as {@code coef[feature][band]} in design
 * column order. A break date of {@link #NO_BREAK} marks a segment that ran to the end of the
 * series without a confirmed change. A forward run puts the break on or after {@code end}; a
 * reverse run, which walks the series back in time, puts it on or before {@code start}.
 *
 * <p>Records may also carry a bisquare refit of the same window ({@link #hasRobust()}).
 */
public final class SegmentRecord {
  public static final int NO_BREAK = 0;

  private final int px;
  private final int py;
  private final int start;
  private final int end;
  private final int breakDate;
  private final double[][] coef;
  private final double[] rmse;
  private final double[] magnitude;
  private final int numObs;
  private final double[][] robustCoef;
  private final double[] robustRmse;

  /**
   * @param coef [NUM_FEATURES][NUM_BANDS]
   * @param rmse one value per band
   * @param magnitude one value per band; zeros for a segment without a break
   * @param numObs observations in the fitted window
   */
  public SegmentRecord(int px, int py, int start, int end, int breakDate, double[][] coef,
      double[] rmse, double[] magnitude, int numObs) {
    this(px, py, start, end, breakDate, coef, rmse, magnitude, numObs, null, null);
  }

  /**
   * @param robustCoef bisquare coefficients [NUM_FEATURES][NUM_BANDS], or null
   * @param robustRmse RMSE of the bisquare fit per band, or null; set together with robustCoef
   */
  public SegmentRecord(int px, int py, int start, int end, int breakDate, double[][] coef,
      double[] rmse, double[] magnitude, int numObs, double[][] robustCoef,
      double[] robustRmse) {
    Preconditions.checkArgument(start <= end, "segment starts after it ends: %s > %s", start, end);
    Preconditions.checkArgument(breakDate == NO_BREAK || breakDate >= end || breakDate <= start,
        "break %s lies inside the segment [%s, %s]", breakDate, start, end);
    Preconditions.checkArgument(coef.length > 0, "at least one coefficient is required");
    for (double[] c : coef) {
      Preconditions.checkArgument(c.length == rmse.length, "coefficient rows must have one entry "
          + "per band");
    }
    Preconditions.checkArgument(magnitude.length == rmse.length,
        "magnitude must have one entry per band");
    Preconditions.checkArgument((robustCoef == null) == (robustRmse == null),
        "robust coefficients and RMSE must be given together");
    if (robustCoef != null) {
      Preconditions.checkArgument(robustCoef.length == coef.length,
          "robust coefficients must have one row per feature");
      for (double[] c : robustCoef) {
        Preconditions.checkArgument(c.length == rmse.length,
            "robust coefficient rows must have one entry per band");
      }
      Preconditions.checkArgument(robustRmse.length == rmse.length,
          "robust RMSE must have one entry per band");
    }
    this.px = px;
    this.py = py;
    this.start = start;
    this.end = end;
    this.breakDate = breakDate;
    this.coef = copy(coef);
    this.rmse = rmse.clone();
    this.magnitude = magnitude.clone();
    this.numObs = numObs;
    this.robustCoef = robustCoef == null ? null : copy(robustCoef);
    this.robustRmse = robustRmse == null ? null : robustRmse.clone();
  }

  private static double[][] copy(double[][] values) {
    double[][] result = new double[values.length][];
    for (int i = 0; i < values.length; i++) {
      result[i] = values[i].clone();
    }
    return result;
  }

  public int getPx() {
    return px;
  }

  public int getPy() {
    return py;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public int getBreakDate() {
    return breakDate;
  }

  public boolean hasBreak() {
    return breakDate != NO_BREAK;
  }

  public int numFeatures() {
    return coef.length;
  }

  public int numBands() {
    return rmse.length;
  }

  public double getCoef(int feature, int band) {
    return coef[feature][band];
  }

  /** A copy of the coefficients [NUM_FEATURES][NUM_BANDS]. */
  public double[][] getCoef() {
    return copy(coef);
  }

  public double getRmse(int band) {
    return rmse[band];
  }

  public double[] getRmse() {
    return rmse.clone();
  }

  public double getMagnitude(int band) {
    return magnitude[band];
  }

  public double[] getMagnitude() {
    return magnitude.clone();
  }

  public int getNumObs() {
    return numObs;
  }

  public boolean hasRobust() {
    return robustCoef != null;
  }

  public double getRobustCoef(int feature, int band) {
    Preconditions.checkState(hasRobust(), "record has no robust coefficients");
    return robustCoef[feature][band];
  }

  /** A copy of the bisquare coefficients, or null. */
  public double[][] getRobustCoef() {
    return robustCoef == null ? null : copy(robustCoef);
  }

  public double getRobustRmse(int band) {
    Preconditions.checkState(hasRobust(), "record has no robust RMSE");
    return robustRmse[band];
  }

  public double[] getRobustRmse() {
    return robustRmse == null ? null : robustRmse.clone();
  }

  /** Coefficient of the least squares or, with {@code robust}, the bisquare fit. */
  public double getCoef(int feature, int band, boolean robust) {
    return robust ? getRobustCoef(feature, band) : coef[feature][band];
  }

  public double getRmse(int band, boolean robust) {
    return robust ? getRobustRmse(band) : rmse[band];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SegmentRecord)) {
      return false;
    }
    SegmentRecord other = (SegmentRecord) o;
    return px == other.px
        && py == other.py
        && start == other.start
        && end == other.end
        && breakDate == other.breakDate
        && numObs == other.numObs
        && Arrays.deepEquals(coef, other.coef)
        && Arrays.equals(rmse, other.rmse)
        && Arrays.equals(magnitude, other.magnitude)
        && Arrays.deepEquals(robustCoef, other.robustCoef)
        && Arrays.equals(robustRmse, other.robustRmse);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(new int[] {px, py, start, end, breakDate, numObs});
    result = 31 * result + Arrays.deepHashCode(coef);
    result = 31 * result + Arrays.hashCode(rmse);
    result = 31 * result + Arrays.hashCode(magnitude);
    result = 31 * result + Arrays.deepHashCode(robustCoef);
    return 31 * result + Arrays.hashCode(robustRmse);
  }

  @Override
  public String toString() {
    return String.format("SegmentRecord{px=%d, py=%d, start=%d, end=%d, break=%d, numObs=%d, "
        + "rmse=%s}", px, py, start, end, breakDate, numObs, Arrays.toString(rmse));
  }
}
