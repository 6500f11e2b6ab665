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
package net.larse.ccdcesque.timeseries;

import com.google.common.base.Preconditions;

/**
 * Clear observations of one pixel, ready for change detection: the mask band is gone and every
 * remaining observation passed screening.
 */
public final class TimeSeries {
  private final int px;
  private final int py;
  private final int[] dates;
  private final double[][] y;

  /**
   * @param dates ordinal dates, non-decreasing
   * @param y [BANDS][NUM_OBSERVATIONS]
   */
  public TimeSeries(int px, int py, int[] dates, double[][] y) {
    Preconditions.checkNotNull(dates);
    Preconditions.checkNotNull(y);
    Preconditions.checkArgument(y.length > 0, "at least one band is required");
    for (double[] band : y) {
      Preconditions.checkArgument(band.length == dates.length,
          "band has %s values for %s dates", band.length, dates.length);
    }
    checkOrdered(dates);
    this.px = px;
    this.py = py;
    this.dates = dates.clone();
    this.y = new double[y.length][];
    for (int b = 0; b < y.length; b++) {
      this.y[b] = y[b].clone();
    }
  }

  public TimeSeries(int[] dates, double[][] y) {
    this(0, 0, dates, y);
  }

  static void checkOrdered(int[] dates) {
    for (int i = 1; i < dates.length; i++) {
      Preconditions.checkArgument(dates[i] >= dates[i - 1],
          "dates must be in time order (index %s)", i);
    }
  }

  public int getPx() {
    return px;
  }

  public int getPy() {
    return py;
  }

  public int size() {
    return dates.length;
  }

  public int numBands() {
    return y.length;
  }

  /** A copy of the dates. */
  public int[] getDates() {
    return dates.clone();
  }

  /** A copy of the values [BANDS][NUM_OBSERVATIONS]. */
  public double[][] getValues() {
    double[][] copy = new double[y.length][];
    for (int b = 0; b < y.length; b++) {
      copy[b] = y[b].clone();
    }
    return copy;
  }
}
