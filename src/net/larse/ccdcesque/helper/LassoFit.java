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

/**
 * This class is a container for arrays and values that are computed along a lasso regularization
 * path. Solutions are stored in the column order of the design matrix they were fit on; the
 * intercept column, if the design has one, holds the unpenalized intercept.
 */
public class LassoFit {
  // The value of lambdas for each solution, in descending order.
  public final double[] lambdas;

  // Coefficients for each solution [NUM_LAMBDAS][NUM_COLUMNS]
  public final double[][] coefficients;

  // Number of non-zero penalized coefficients for each solution
  public final int[] nonZeroWeights;

  // rmse for each solution
  public final double[] rmses;

  // Total number of passes over data
  public int numberOfPasses;

  public LassoFit(double[] lambdas, int numColumns) {
    this.lambdas = lambdas.clone();
    this.coefficients = new double[lambdas.length][numColumns];
    this.nonZeroWeights = new int[lambdas.length];
    this.rmses = new double[lambdas.length];
  }

  public int size() {
    return lambdas.length;
  }

  /**
   * find the index corresponding to specified lambda
   *
   * <p>lambdas are stored in descending order.
   */
  public int getFitByLambda(double lambda) {
    int index;

    // lambda is greater than the largest
    if (lambda >= lambdas[0]) {
      index = 0;
    } else if (lambda <= lambdas[lambdas.length - 1]) {
      index = lambdas.length - 1;
    } else {
      index = 0;
      double distance = Math.abs(lambda - lambdas[0]);
      for (int i = 1; i < lambdas.length; i++) {
        double cdist = Math.abs(lambda - lambdas[i]);
        if (cdist < distance) {
          index = i;
          distance = cdist;
        } else {
          break;
        }
      }
    }
    return index;
  }

  public double[] getCoefficients(int idx) {
    return coefficients[idx].clone();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("lambda\tnonzero\trmse\n");
    for (int i = 0; i < lambdas.length; i++) {
      sb.append(String.format("%.5f\t%d\t%.4f\n", lambdas[i], nonZeroWeights[i], rmses[i]));
    }
    return sb.toString().trim();
  }
}
