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

import java.util.Arrays;
import org.apache.commons.math.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.ejml.alg.dense.decomposition.qr.QRColPivDecompositionHouseholderColumn_D64;
import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;
import org.ejml.ops.CommonOps;
import org.ejml.ops.MatrixFeatures;

/**
 * Iteratively reweighted least squares with the bisquare weight function.
 *
 * <p>Residuals are adjusted for leverage and scaled by the MAD of the adjusted residuals, the way
 * matlab's robustfit does it. The design is shared between calls so several bands can be fit
 * against the same rows; only the leverage adjustment depends on it.
 */
public class RobustLeastSquareBisquare {
  /** Tuning constant giving 95% efficiency for normal errors. */
  public static final double BISQUARE_TUNING = 4.685;

  // The max number of iterations.
  public static final int DEFAULT_MAX_ITERATIONS = 5;

  private final DenseMatrix64F a;
  private final double beta;
  private final int maxIterations;

  private DenseMatrix64F adjFactor;
  private double scale = Double.NaN;
  private double[] weights;

  public RobustLeastSquareBisquare(DenseMatrix64F a) {
    this(a, BISQUARE_TUNING, DEFAULT_MAX_ITERATIONS);
  }

  public RobustLeastSquareBisquare(DenseMatrix64F a, double beta, int maxIterations) {
    this.a = a.copy();
    this.beta = beta;
    this.maxIterations = maxIterations;
  }

  /**
   * Solve for one target vector.
   *
   * @param y target values, one per row of the design
   * @return robust coefficient estimates
   * @throws FitFailureException if the design is rank deficient
   */
  public double[] getSolution(double[] y) throws FitFailureException {
    FitGenerator.checkShape(a, y);
    FitGenerator.checkRank(a);
    DenseMatrix64F b = DenseMatrix64F.wrap(y.length, 1, y.clone());

    // Seed the search with the ordinary least squares solution.
    LinearSolver<DenseMatrix64F> solver = LinearSolverFactory.leastSquares(a.numRows, a.numCols);
    if (!solver.setA(a.copy())) {
      throw new FitFailureException("least squares solver rejected the design matrix");
    }
    DenseMatrix64F x = new DenseMatrix64F(a.numCols, 1);
    solver.solve(b, x);

    if (adjFactor == null) {
      adjFactor = leverageAdjustment();
    }

    /*
     * If we get a perfect or near perfect fit, the whole idea of finding outliers by comparing
     * them to the residual standard deviation becomes difficult.  Never allow the estimate of the
     * error scale to get below a small fraction of the standard deviation of the raw response.
     */
    double tinyS = 1e-6 * new StandardDeviation().evaluate(b.getData());
    if (tinyS == 0) {
      tinyS = 1.0;
    }

    DenseMatrix64F r = b.copy();
    DenseMatrix64F radj = new DenseMatrix64F(b.numRows, 1);
    DenseMatrix64F bw = b.copy();
    DenseMatrix64F aw = a.copy();
    DenseMatrix64F x0 = x.copy();

    DenseMatrix64F ones = new DenseMatrix64F(1, a.getNumCols());
    CommonOps.fill(ones, 1);

    int rank = a.getNumCols();
    DenseMatrix64F w = new DenseMatrix64F(b.numRows, 1);
    CommonOps.fill(w, 1);
    for (int iter = 1; iter <= maxIterations; iter++) {
      // r = b - ax, scaled by the leverage adjustment.
      r.set(b);
      CommonOps.multAdd(-1, a, x, r);
      CommonOps.elementMult(r, adjFactor, radj);

      double madSigma = madsigma(radj.getData(), rank);
      w = bisquare(radj.copy(), Math.max(madSigma, tinyS) * beta);

      // calculate weighted a and b
      CommonOps.elementMult(b, w, bw);
      CommonOps.mult(w, ones, aw);
      CommonOps.elementMult(aw, a);

      if (!solver.setA(aw)) {
        throw new FitFailureException("weighted design matrix is singular");
      }

      // Swap x and x0 so we can check for convergence after the solve.
      DenseMatrix64F tmp = x0;
      x0 = x;
      x = tmp;
      solver.solve(bw, x);
      if (MatrixFeatures.isEquals(x, x0, Math.sqrt(Math.ulp(1.0)))) {
        break;
      }
    }

    r.set(b);
    CommonOps.multAdd(-1, a, x, r);
    CommonOps.elementMult(r, adjFactor, radj);
    scale = Math.max(madsigma(radj.getData(), rank), tinyS);
    weights = w.getData().clone();
    return x.getData().clone();
  }

  /** Robust scale (MAD / 0.6745) of the residuals of the last solution. */
  public double getScale() {
    return scale;
  }

  /** Final bisquare weights of the last solution; outliers get weight 0. */
  public double[] getWeights() {
    return weights == null ? null : weights.clone();
  }

  /** 1 / sqrt(1 - h) for the leverage h of each row. */
  private DenseMatrix64F leverageAdjustment() throws FitFailureException {
    QRColPivDecompositionHouseholderColumn_D64 decomp =
        new QRColPivDecompositionHouseholderColumn_D64();
    if (!decomp.decompose(a.copy())) {
      throw new FitFailureException("QR decomposition of the design matrix failed");
    }
    DenseMatrix64F invR = decomp.getR(null, true);
    int[] perm = decomp.getPivots();

    // Since we are not checking the xrank, perm and R always match in dimension
    DenseMatrix64F permutedA = new DenseMatrix64F(a.getNumRows(), perm.length);
    for (int i = 0; i < perm.length; i++) {
      for (int j = 0; j < a.getNumRows(); j++) {
        permutedA.set(j, i, a.get(j, perm[i]));
      }
    }

    if (!CommonOps.invert(invR)) {
      throw new FitFailureException("R factor of the design matrix is singular");
    }
    DenseMatrix64F e = new DenseMatrix64F(permutedA.getNumRows(), invR.getNumCols());
    CommonOps.mult(permutedA, invR, e);
    CommonOps.elementMult(e, e);
    DenseMatrix64F factor = CommonOps.sumRows(e, null);

    for (int i = 0; i < factor.getNumRows(); i++) {
      factor.set(i, 0, 1.0 / Math.sqrt(1 - Math.min(0.9999, factor.get(i, 0))));
    }
    return factor;
  }

  private static DenseMatrix64F bisquare(DenseMatrix64F r, double s) {
    for (int i = 0; i < r.getNumRows(); i++) {
      for (int j = 0; j < r.getNumCols(); j++) {
        double v = Math.abs(r.get(i, j) / s);
        if (v > 1) {
          r.set(i, j, 0);
        } else {
          double u = 1 - v * v;
          r.set(i, j, u * u);
        }
      }
    }
    return r;
  }

  /** MAD of adjusted residuals after dropping the p - 1 closest to 0. */
  private static double madsigma(double[] r, int p) {
    double[] absRadj = new double[r.length];
    for (int i = 0; i < absRadj.length; i++) {
      absRadj[i] = Math.abs(r[i]);
    }
    Arrays.sort(absRadj);

    DescriptiveStatistics ds = new DescriptiveStatistics();
    for (int i = Math.max(0, p - 1); i < absRadj.length; i++) {
      ds.addValue(absRadj[i]);
    }

    return ds.getPercentile(50.0) / 0.6745;
  }
}
