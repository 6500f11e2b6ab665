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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import org.apache.commons.math.random.JDKRandomGenerator;
import org.apache.commons.math.random.RandomDataImpl;
import org.ejml.data.DenseMatrix64F;

/**
 * Lasso regression by cyclic coordinate descent.
 *
 * <p>Minimizes {@code (1/2n) * ||y - Xb||^2 + lambda * ||b||_1}. A constant column of the design
 * is treated as the intercept and left unpenalized; the other columns are centered but not
 * scaled, so the penalty acts in the units of the design (raw dates for the slope).
 *
 * <p>With a fixed lambda the fit is deterministic. With cross-validation the lambda is picked
 * from a geometric path by k-fold CV; folds are assigned from a generator seeded with the
 * configured seed, so repeated runs agree.
 */
public class LassoFitGenerator extends FitGenerator {
  private static final double TOLERANCE = 1e-7;
  // Smallest lambda on the CV path, as a fraction of the largest useful one.
  private static final double LAMBDA_RATIO = 1e-3;

  private final double lambda;
  private final int maxIterations;
  private final int folds;
  private final int numLambdas;
  private final long seed;

  /** Fixed regularization strength. */
  public LassoFitGenerator(double lambda, int maxIterations) {
    Preconditions.checkArgument(lambda >= 0, "lambda must be non-negative");
    Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive");
    this.lambda = lambda;
    this.maxIterations = maxIterations;
    this.folds = 0;
    this.numLambdas = 1;
    this.seed = 0;
  }

  /** Regularization strength chosen by cross-validation. */
  public LassoFitGenerator(int folds, int numLambdas, long seed, int maxIterations) {
    Preconditions.checkArgument(folds >= 2, "cross-validation needs at least 2 folds");
    Preconditions.checkArgument(numLambdas >= 2, "lambda path needs at least 2 values");
    Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive");
    this.lambda = Double.NaN;
    this.maxIterations = maxIterations;
    this.folds = folds;
    this.numLambdas = numLambdas;
    this.seed = seed;
  }

  public boolean isCrossValidated() {
    return folds > 0;
  }

  @Override
  public String name() {
    return isCrossValidated() ? "lassocv" : "lasso";
  }

  @Override
  public double[] fit(DenseMatrix64F a, double[] y) throws FitFailureException {
    checkShape(a, y);
    if (!isCrossValidated()) {
      LassoFit path = lassoFit(a, y, new double[] {lambda});
      return path.getCoefficients(0);
    }

    double[] lambdas = lambdaPath(a, y, numLambdas);
    int best = crossValidate(a, y, lambdas);
    LassoFit path = lassoFit(a, y, lambdas);
    return path.getCoefficients(path.getFitByLambda(lambdas[best]));
  }

  /**
   * Fit the whole path, warm starting each lambda from the previous solution.
   *
   * @param lambdas regularization strengths in descending order
   */
  @VisibleForTesting
  LassoFit lassoFit(DenseMatrix64F a, double[] y, double[] lambdas) throws FitFailureException {
    int n = a.getNumRows();
    int p = a.getNumCols();
    int intercept = findInterceptColumn(a);

    double[] means = new double[p];
    double yMean = 0;
    if (intercept >= 0) {
      for (int i = 0; i < n; i++) {
        yMean += y[i];
        for (int j = 0; j < p; j++) {
          means[j] += a.get(i, j);
        }
      }
      yMean /= n;
      for (int j = 0; j < p; j++) {
        means[j] /= n;
      }
    }

    // Centered columns and their squared norms.
    double[][] x = new double[p][n];
    double[] sq = new double[p];
    for (int j = 0; j < p; j++) {
      if (j == intercept) {
        continue;
      }
      for (int i = 0; i < n; i++) {
        x[j][i] = a.get(i, j) - means[j];
        sq[j] += x[j][i] * x[j][i];
      }
    }

    double[] residual = new double[n];
    double yScale = 0;
    for (int i = 0; i < n; i++) {
      residual[i] = y[i] - yMean;
      yScale += residual[i] * residual[i];
    }
    yScale = Math.max(yScale / n, Double.MIN_NORMAL);

    LassoFit result = new LassoFit(lambdas, p);
    double[] beta = new double[p];
    for (int l = 0; l < lambdas.length; l++) {
      double penalty = lambdas[l];
      int pass = 0;
      boolean converged = false;
      while (!converged && pass < maxIterations) {
        pass++;
        double maxChange = 0;
        for (int j = 0; j < p; j++) {
          if (j == intercept || sq[j] == 0) {
            continue;
          }
          double rho = 0;
          for (int i = 0; i < n; i++) {
            rho += x[j][i] * residual[i];
          }
          rho = rho / n + sq[j] / n * beta[j];
          double updated = softThreshold(rho, penalty) / (sq[j] / n);
          double delta = updated - beta[j];
          if (delta != 0) {
            for (int i = 0; i < n; i++) {
              residual[i] -= delta * x[j][i];
            }
            beta[j] = updated;
            maxChange = Math.max(maxChange, delta * delta * sq[j] / n);
          }
        }
        converged = maxChange < TOLERANCE * yScale;
      }
      result.numberOfPasses += pass;
      if (!converged) {
        throw new FitFailureException(String.format(
            "lasso did not converge in %d passes at lambda %.4g", maxIterations, penalty));
      }

      double[] coefs = result.coefficients[l];
      double interceptValue = yMean;
      double ssr = 0;
      for (int j = 0; j < p; j++) {
        if (j != intercept) {
          coefs[j] = beta[j];
          interceptValue -= beta[j] * means[j];
          if (beta[j] != 0) {
            result.nonZeroWeights[l]++;
          }
        }
      }
      if (intercept >= 0) {
        coefs[intercept] = interceptValue;
      }
      for (int i = 0; i < n; i++) {
        ssr += residual[i] * residual[i];
      }
      result.rmses[l] = Math.sqrt(ssr / n);
    }
    return result;
  }

  /** Geometric path from the smallest lambda that zeroes every penalized coefficient. */
  @VisibleForTesting
  static double[] lambdaPath(DenseMatrix64F a, double[] y, int count) {
    int n = a.getNumRows();
    int p = a.getNumCols();
    int intercept = findInterceptColumn(a);

    double yMean = 0;
    if (intercept >= 0) {
      for (double v : y) {
        yMean += v;
      }
      yMean /= n;
    }

    double lambdaMax = 0;
    for (int j = 0; j < p; j++) {
      if (j == intercept) {
        continue;
      }
      double mean = 0;
      if (intercept >= 0) {
        for (int i = 0; i < n; i++) {
          mean += a.get(i, j);
        }
        mean /= n;
      }
      double dot = 0;
      for (int i = 0; i < n; i++) {
        dot += (a.get(i, j) - mean) * (y[i] - yMean);
      }
      lambdaMax = Math.max(lambdaMax, Math.abs(dot) / n);
    }
    if (lambdaMax == 0) {
      lambdaMax = 1;
    }

    double[] lambdas = new double[count];
    double step = Math.log(LAMBDA_RATIO) / (count - 1);
    for (int i = 0; i < count; i++) {
      lambdas[i] = lambdaMax * Math.exp(step * i);
    }
    return lambdas;
  }

  /** Index of the lambda with the smallest mean held-out squared error. */
  private int crossValidate(DenseMatrix64F a, double[] y, double[] lambdas)
      throws FitFailureException {
    int n = a.getNumRows();
    int p = a.getNumCols();
    Preconditions.checkArgument(n >= folds, "fewer observations than folds");

    JDKRandomGenerator rng = new JDKRandomGenerator();
    rng.setSeed(seed);
    int[] permutation = new RandomDataImpl(rng).nextPermutation(n, n);
    int[] fold = new int[n];
    for (int i = 0; i < n; i++) {
      fold[permutation[i]] = i % folds;
    }

    double[] error = new double[lambdas.length];
    for (int k = 0; k < folds; k++) {
      int testCount = 0;
      for (int f : fold) {
        if (f == k) {
          testCount++;
        }
      }
      DenseMatrix64F trainA = new DenseMatrix64F(n - testCount, p);
      double[] trainY = new double[n - testCount];
      int row = 0;
      for (int i = 0; i < n; i++) {
        if (fold[i] != k) {
          for (int j = 0; j < p; j++) {
            trainA.set(row, j, a.get(i, j));
          }
          trainY[row++] = y[i];
        }
      }

      LassoFit path = lassoFit(trainA, trainY, lambdas);
      for (int l = 0; l < lambdas.length; l++) {
        double[] coefs = path.coefficients[l];
        for (int i = 0; i < n; i++) {
          if (fold[i] == k) {
            double pred = 0;
            for (int j = 0; j < p; j++) {
              pred += a.get(i, j) * coefs[j];
            }
            error[l] += (y[i] - pred) * (y[i] - pred);
          }
        }
      }
    }

    int best = 0;
    for (int l = 1; l < error.length; l++) {
      if (error[l] < error[best]) {
        best = l;
      }
    }
    return best;
  }

  private static double softThreshold(double value, double penalty) {
    if (value > penalty) {
      return value - penalty;
    } else if (value < -penalty) {
      return value + penalty;
    }
    return 0;
  }

  /** The first column whose values are all 1, or -1. */
  static int findInterceptColumn(DenseMatrix64F a) {
    for (int j = 0; j < a.getNumCols(); j++) {
      boolean constant = true;
      for (int i = 0; i < a.getNumRows() && constant; i++) {
        constant = a.get(i, j) == 1.0;
      }
      if (constant) {
        return j;
      }
    }
    return -1;
  }
}
