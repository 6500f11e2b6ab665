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

import com.google.common.base.Preconditions;
import org.ejml.data.DenseMatrix64F;

/**
 * Fits one regression per band over a window of design rows.
 */
public class SegmentFitter {
  private final FitGenerator fitGenerator;

  public SegmentFitter(FitGenerator fitGenerator) {
    this.fitGenerator = Preconditions.checkNotNull(fitGenerator);
  }

  public FitGenerator getFitGenerator() {
    return fitGenerator;
  }

  /**
   * Fit every band over the rows [from, to).
   *
   * @param x design matrix [NUM_OBSERVATIONS][NUM_FEATURES]
   * @param y responses [BANDS][NUM_OBSERVATIONS]
   * @param from first row (inclusive)
   * @param to last row (exclusive)
   * @throws IllegalArgumentException if the window has fewer rows than features
   * @throws FitFailureException if a band cannot be solved
   */
  public SegmentFit fit(DenseMatrix64F x, double[][] y, int from, int to)
      throws FitFailureException {
    int count = to - from;
    int numFeatures = x.getNumCols();
    Preconditions.checkArgument(from >= 0 && to <= x.getNumRows(), "window out of range");
    Preconditions.checkArgument(count >= numFeatures,
        "cannot fit %s features from %s observations", numFeatures, count);

    DenseMatrix64F window = new DenseMatrix64F(count, numFeatures);
    for (int i = 0; i < count; i++) {
      for (int j = 0; j < numFeatures; j++) {
        window.set(i, j, x.get(from + i, j));
      }
    }

    int numBands = y.length;
    double[][] coefs = new double[numFeatures][numBands];
    double[] rmse = new double[numBands];
    double[][] residuals = new double[numBands][count];
    double[] target = new double[count];

    for (int b = 0; b < numBands; b++) {
      System.arraycopy(y[b], from, target, 0, count);
      double[] fitCft = fitGenerator.fit(window, target);

      // calculate rmse from predicted value and prediction difference
      double sumSquareResidual = 0;
      for (int i = 0; i < count; i++) {
        double pred = 0;
        for (int j = 0; j < numFeatures; j++) {
          pred += fitCft[j] * window.get(i, j);
        }
        double resid = target[i] - pred;
        residuals[b][i] = resid;
        sumSquareResidual += resid * resid;
      }
      for (int j = 0; j < numFeatures; j++) {
        coefs[j][b] = fitCft[j];
      }
      rmse[b] = Math.sqrt(sumSquareResidual / count);
    }
    return new SegmentFit(coefs, rmse, residuals, from, to);
  }
}
