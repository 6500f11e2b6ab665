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
package net.larse.ccdcesque.helper;

import org.ejml.data.DenseMatrix64F;

/** Per-band regression results over one window of observations. */
public class SegmentFit {
  /** Coefficients [NUM_FEATURES][NUM_BANDS]. */
  public final double[][] coefs;

  /** Root mean square residual of each band. */
  public final double[] rmse;

  /** Residuals [NUM_BANDS][NUM_OBSERVATIONS], relative to the first row of the window. */
  public final double[][] residuals;

  /** Index of the first row of the window this fit was computed on. */
  public final int from;

  /** Index after the last row of the window. */
  public final int to;

  SegmentFit(double[][] coefs, double[] rmse, double[][] residuals, int from, int to) {
    this.coefs = coefs;
    this.rmse = rmse;
    this.residuals = residuals;
    this.from = from;
    this.to = to;
  }

  public int numBands() {
    return rmse.length;
  }

  public int numObs() {
    return to - from;
  }

  /** Predicted value of a band for one design row. */
  public double predict(int band, DenseMatrix64F x, int row) {
    double v = 0;
    for (int j = 0; j < coefs.length; j++) {
      v += coefs[j][band] * x.get(row, j);
    }
    return v;
  }

  /** Predicted value of a band for a design row given as an array. */
  public double predict(int band, double[] row) {
    double v = 0;
    for (int j = 0; j < coefs.length; j++) {
      v += coefs[j][band] * row[j];
    }
    return v;
  }
}
