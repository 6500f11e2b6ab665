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
 * Raw time series of one pixel as delivered by a reader: every band, the mask band included, for
 * every acquisition date.
 */
public final class PixelObservations {
  private final int px;
  private final int py;
  private final int[] dates;
  private final double[][] values;

  /**
   * @param px pixel column
   * @param py pixel row
   * @param dates ordinal dates, non-decreasing
   * @param values [BANDS][NUM_OBSERVATIONS]
   */
  public PixelObservations(int px, int py, int[] dates, double[][] values) {
    Preconditions.checkNotNull(dates);
    Preconditions.checkNotNull(values);
    Preconditions.checkArgument(values.length > 0, "at least one band is required");
    for (double[] band : values) {
      Preconditions.checkArgument(band.length == dates.length,
          "band has %s values for %s dates", band.length, dates.length);
    }
    TimeSeries.checkOrdered(dates);
    this.px = px;
    this.py = py;
    this.dates = dates.clone();
    this.values = new double[values.length][];
    for (int b = 0; b < values.length; b++) {
      this.values[b] = values[b].clone();
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
    return values.length;
  }

  public int date(int i) {
    return dates[i];
  }

  public double value(int band, int i) {
    return values[band][i];
  }
}
