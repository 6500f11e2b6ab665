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
 * Immutable description of the regression used for every band of a segment. Selected by
 * configuration; {@link #newFitGenerator()} hands each detector run its own generator.
 */
public final class Estimator {
  public enum Kind {
    OLS,
    LASSO,
    LASSO_CV,
    ROBUST
  }

  public static final int DEFAULT_LASSO_ITERATIONS = 25000;

  private final Kind kind;
  private final double lambda;
  private final int maxIterations;
  private final int folds;
  private final int numLambdas;
  private final long seed;

  private Estimator(Kind kind, double lambda, int maxIterations, int folds, int numLambdas,
      long seed) {
    this.kind = kind;
    this.lambda = lambda;
    this.maxIterations = maxIterations;
    this.folds = folds;
    this.numLambdas = numLambdas;
    this.seed = seed;
  }

  public static Estimator ols() {
    return new Estimator(Kind.OLS, 0, 0, 0, 0, 0);
  }

  public static Estimator lasso(double lambda) {
    return lasso(lambda, DEFAULT_LASSO_ITERATIONS);
  }

  public static Estimator lasso(double lambda, int maxIterations) {
    if (!(lambda >= 0)) {
      throw new ConfigurationException("lasso lambda must be non-negative, got " + lambda);
    }
    if (maxIterations <= 0) {
      throw new ConfigurationException("lasso maxIterations must be positive");
    }
    return new Estimator(Kind.LASSO, lambda, maxIterations, 0, 0, 0);
  }

  public static Estimator lassoCv(int folds, int numLambdas, long seed) {
    if (folds < 2) {
      throw new ConfigurationException("lasso cross-validation needs at least 2 folds");
    }
    if (numLambdas < 2) {
      throw new ConfigurationException("lasso cross-validation needs at least 2 lambdas");
    }
    return new Estimator(Kind.LASSO_CV, Double.NaN, DEFAULT_LASSO_ITERATIONS, folds, numLambdas,
        seed);
  }

  public static Estimator robust() {
    return new Estimator(Kind.ROBUST, 0, RobustLeastSquareBisquare.DEFAULT_MAX_ITERATIONS, 0, 0, 0);
  }

  public Kind getKind() {
    return kind;
  }

  public double getLambda() {
    return lambda;
  }

  public long getSeed() {
    return seed;
  }

  public FitGenerator newFitGenerator() {
    switch (kind) {
      case LASSO:
        return new LassoFitGenerator(lambda, maxIterations);
      case LASSO_CV:
        return new LassoFitGenerator(folds, numLambdas, seed, maxIterations);
      case ROBUST:
        return new RobustFitGenerator(maxIterations);
      case OLS:
      default:
        return new FitGenerator();
    }
  }

  @Override
  public String toString() {
    switch (kind) {
      case LASSO:
        return "lasso(lambda=" + lambda + ")";
      case LASSO_CV:
        return "lassoCv(folds=" + folds + ", lambdas=" + numLambdas + ", seed=" + seed + ")";
      case ROBUST:
        return "robust";
      default:
        return "ols";
    }
  }
}
