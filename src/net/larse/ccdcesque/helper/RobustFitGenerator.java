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

/** Bisquare M-estimator fits. */
public class RobustFitGenerator extends FitGenerator {
  private final int maxIterations;

  public RobustFitGenerator(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  @Override
  public double[] fit(DenseMatrix64F a, double[] y) throws FitFailureException {
    RobustLeastSquareBisquare rls = new RobustLeastSquareBisquare(
        a, RobustLeastSquareBisquare.BISQUARE_TUNING, maxIterations);
    return rls.getSolution(y);
  }

  @Override
  public String name() {
    return "rlm";
  }
}
