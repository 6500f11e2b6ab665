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
import org.ejml.UtilEjml;
import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;
import org.ejml.ops.MatrixFeatures;
import org.ejml.ops.NormOps;

/**
 * A wrapper for OLS fitting.
 *
 * <p>Subclasses replace {@link #fit} with penalized or robust estimators. Instances are cheap and
 * may keep scratch state, so every detector run creates its own through {@link Estimator}.
 */
public class FitGenerator {

  /**
   * Fit the coefficients of {@code y = a * x}.
   *
   * @param a design rows [NUM_OBSERVATIONS][NUM_FEATURES]
   * @param y target values, one per row of a
   * @return coefficients, one per column of a
   * @throws FitFailureException if the design is rank deficient
   */
  public double[] fit(DenseMatrix64F a, double[] y) throws FitFailureException {
    checkShape(a, y);
    checkRank(a);

    DenseMatrix64F matrixB = DenseMatrix64F.wrap(y.length, 1, y.clone());
    DenseMatrix64F matrixX = new DenseMatrix64F(a.getNumCols(), 1);
    LinearSolver<DenseMatrix64F> solver =
        LinearSolverFactory.leastSquares(a.getNumRows(), a.getNumCols());
    if (!solver.setA(a.copy()) || solver.quality() == 0) {
      throw new FitFailureException("least squares solver rejected the design matrix");
    }
    solver.solve(matrixB, matrixX);
    return matrixX.getData();
  }

  /** Short name used in log messages. */
  public String name() {
    return "ols";
  }

  static void checkShape(DenseMatrix64F a, double[] y) {
    Preconditions.checkArgument(a.getNumRows() == y.length,
        "design has %s rows but %s targets", a.getNumRows(), y.length);
    Preconditions.checkArgument(a.getNumRows() >= a.getNumCols(),
        "cannot fit %s coefficients from %s observations", a.getNumCols(), a.getNumRows());
  }

  /**
   * Reject designs whose numerical rank is below their column count. The tolerance is relative to
   * the Frobenius norm because the slope column holds raw ordinal dates.
   */
  static void checkRank(DenseMatrix64F a) throws FitFailureException {
    double tolerance =
        NormOps.normF(a) * Math.max(a.getNumRows(), a.getNumCols()) * UtilEjml.EPS;
    int rank = MatrixFeatures.rank(a.copy(), tolerance);
    if (rank < a.getNumCols()) {
      throw new FitFailureException(
          String.format("design matrix is rank deficient (%d < %d)", rank, a.getNumCols()));
    }
  }
}
