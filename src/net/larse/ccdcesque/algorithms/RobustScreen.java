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
package net.larse.ccdcesque.algorithms;

import com.google.common.base.Preconditions;
import net.larse.ccdcesque.helper.ConfigurationException;
import net.larse.ccdcesque.helper.FitFailureException;
import net.larse.ccdcesque.helper.RobustLeastSquareBisquare;
import org.apache.commons.math.MathException;
import org.apache.commons.math.distribution.ChiSquaredDistributionImpl;
import org.ejml.data.DenseMatrix64F;

/**
 * Robust pre-screen of a training window.
 *
 * <p>Each screening band is fit with a bisquare M-estimator. Residuals are normalized by the robust
 * scale of the fit (floored at {@code minRmse}), squared and summed across the screening bands; an
 * observation whose sum exceeds the critical value is flagged as noise.
 */
public final class RobustScreen {
  /** Probability used for the default critical value. */
  public static final double DEFAULT_PROBABILITY = 0.99;

  private final int[] bands;
  private final double critical;
  private final double minRmse;

  /**
   * @param bands indices of the bands to screen on
   * @param critical critical value for the summed squared normalized residuals, or NaN for
   *     {@link #chiSquaredCritical(int)} of the number of bands
   * @param minRmse floor for the residual scale
   */
  public RobustScreen(int[] bands, double critical, double minRmse) {
    if (bands == null || bands.length == 0) {
      throw new ConfigurationException("robust screening needs at least one band");
    }
    this.bands = bands.clone();
    this.critical = Double.isNaN(critical) ? chiSquaredCritical(bands.length) : critical;
    if (!(this.critical > 0)) {
      throw new ConfigurationException("screening critical value must be positive");
    }
    this.minRmse = minRmse;
  }

  /** Inverse chi-squared CDF at {@link #DEFAULT_PROBABILITY} with {@code df} degrees of freedom. */
  public static double chiSquaredCritical(int df) {
    if (df <= 0) {
      throw new ConfigurationException("degrees of freedom must be positive, got " + df);
    }
    try {
      return new ChiSquaredDistributionImpl(df).inverseCumulativeProbability(DEFAULT_PROBABILITY);
    } catch (MathException e) {
      throw new ConfigurationException("cannot compute chi-squared critical value", e);
    }
  }

  public double getCritical() {
    return critical;
  }

  /**
   * Flag the observations of the window [from, to) that should be kept.
   *
   * @param x design matrix covering at least the window rows
   * @param y [BANDS][NUM_OBSERVATIONS]
   * @return one flag per window observation; false marks noise
   * @throws FitFailureException if the window design is rank deficient
   */
  public boolean[] screen(DenseMatrix64F x, double[][] y, int from, int to)
      throws FitFailureException {
    int count = to - from;
    int numFeatures = x.getNumCols();
    Preconditions.checkArgument(count >= numFeatures,
        "cannot screen %s observations with %s features", count, numFeatures);

    DenseMatrix64F window = new DenseMatrix64F(count, numFeatures);
    for (int i = 0; i < count; i++) {
      for (int j = 0; j < numFeatures; j++) {
        window.set(i, j, x.get(from + i, j));
      }
    }

    RobustLeastSquareBisquare rlm = new RobustLeastSquareBisquare(window);
    double[] score = new double[count];
    double[] target = new double[count];
    for (int band : bands) {
      System.arraycopy(y[band], from, target, 0, count);
      double[] coefs = rlm.getSolution(target);
      double scale = Math.max(rlm.getScale(), minRmse);
      for (int i = 0; i < count; i++) {
        double pred = 0;
        for (int j = 0; j < numFeatures; j++) {
          pred += coefs[j] * window.get(i, j);
        }
        double z = (target[i] - pred) / scale;
        score[i] += z * z;
      }
    }

    boolean[] keep = new boolean[count];
    for (int i = 0; i < count; i++) {
      keep[i] = score[i] <= critical;
    }
    return keep;
  }
}
