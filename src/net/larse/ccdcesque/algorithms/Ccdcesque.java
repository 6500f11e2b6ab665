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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import net.larse.ccdcesque.helper.ArrayHelper;
import net.larse.ccdcesque.helper.ConfigurationException;
import net.larse.ccdcesque.helper.Estimator;
import net.larse.ccdcesque.helper.FitFailureException;
import net.larse.ccdcesque.helper.FitGenerator;
import net.larse.ccdcesque.helper.RobustFitGenerator;
import net.larse.ccdcesque.helper.RobustLeastSquareBisquare;
import net.larse.ccdcesque.helper.SegmentFit;
import net.larse.ccdcesque.helper.SegmentFitter;
import net.larse.ccdcesque.record.SegmentRecord;
import net.larse.ccdcesque.record.SegmentRecords;
import net.larse.ccdcesque.timeseries.DesignMatrixBuilder;
import net.larse.ccdcesque.timeseries.TimeSeries;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;

/**
 * Continuous change detection and segmentation of a single pixel's time series.
 *
 * <p>A window of observations is accumulated until a stable regression can be trained. New
 * observations are then tested against the model; when {@code consecutive} of them in a row depart
 * from the prediction by more than {@code threshold}, a break is declared, the segment is closed
 * and a new window starts at the first departing observation.
 *
 * <p>With {@code reverse} the same walk starts from the last observation and moves back in time.
 * Records are still returned in temporal order, and each break date then precedes its segment.
 *
 * <p>Instances are immutable and may be shared between threads. Each call to {@link
 * #getResult(TimeSeries)} works on its own copy of the observations.
 */
public class Ccdcesque {
  private static final Logger logger = LogManager.getLogger(Ccdcesque.class);

  // Smallest denominator used when normalizing residuals.
  private static final double MIN_SCALE = 1e-10;

  /** Named states of the per-pixel state machine. */
  public enum State {
    ACCUMULATING,
    MONITORING,
    CLOSING,
    DONE
  }

  public enum Screening {
    NONE,
    RLM
  }

  /** How per-band normalized residuals are combined into one test statistic. */
  public enum Combination {
    /** Mean of the absolute normalized residuals. */
    MEAN_ABS,
    /** Euclidean norm of the normalized residuals. */
    NORM
  }

  /** Which observations of the window feed the dynamic RMSE. */
  public enum DynamicRmseSelection {
    /** The most recent observations of the window. */
    RECENT,
    /** The observations closest in day-of-year to the one under test. */
    SEASONAL
  }

  /** Immutable detector configuration, validated once by {@link Builder#build()}. */
  public static final class Args {
    private final int minObs;
    private final double threshold;
    private final int consecutive;
    private final double minRmse;
    private final double retrainTime;
    private final double minTrainingDays;
    private final Screening screening;
    private final double screeningCrit;
    private final int[] screeningBands;
    private final int[] testIndices;
    private final boolean removeNoise;
    private final boolean dynamicRmse;
    private final int dynamicRmseWindow;
    private final DynamicRmseSelection dynamicRmseSelection;
    private final boolean slopeTest;
    private final Combination combination;
    private final Estimator estimator;
    private final int maxFitRetries;
    private final boolean robust;
    private final boolean reverse;
    private final DesignMatrixBuilder design;

    private Args(Builder b) {
      this.minObs = b.minObs;
      this.threshold = b.threshold;
      this.consecutive = b.consecutive;
      this.minRmse = b.minRmse;
      this.retrainTime = b.retrainTime;
      this.minTrainingDays = b.minTrainingDays;
      this.screening = b.screening;
      this.screeningCrit = b.screeningCrit;
      this.screeningBands = b.screeningBands == null ? null : b.screeningBands.clone();
      this.testIndices = b.testIndices == null ? null : b.testIndices.clone();
      this.removeNoise = b.removeNoise;
      this.dynamicRmse = b.dynamicRmse;
      this.dynamicRmseWindow = b.dynamicRmseWindow;
      this.dynamicRmseSelection = b.dynamicRmseSelection;
      this.slopeTest = b.slopeTest;
      this.combination = b.combination;
      this.estimator = b.estimator;
      this.maxFitRetries = b.maxFitRetries;
      this.robust = b.robust;
      this.reverse = b.reverse;
      this.design = b.design;
    }

    public static Builder builder() {
      return new Builder();
    }

    public int getMinObs() {
      return minObs;
    }

    public double getThreshold() {
      return threshold;
    }

    public int getConsecutive() {
      return consecutive;
    }

    public double getMinRmse() {
      return minRmse;
    }

    public double getRetrainTime() {
      return retrainTime;
    }

    public double getMinTrainingDays() {
      return minTrainingDays;
    }

    public Screening getScreening() {
      return screening;
    }

    public double getScreeningCrit() {
      return screeningCrit;
    }

    /** Bands used by the robust screen, or null for the test bands. */
    public int[] getScreeningBands() {
      return screeningBands == null ? null : screeningBands.clone();
    }

    /** Bands used for break detection, or null for every band. */
    public int[] getTestIndices() {
      return testIndices == null ? null : testIndices.clone();
    }

    public boolean isRemoveNoise() {
      return removeNoise;
    }

    public boolean isDynamicRmse() {
      return dynamicRmse;
    }

    public int getDynamicRmseWindow() {
      return dynamicRmseWindow;
    }

    public DynamicRmseSelection getDynamicRmseSelection() {
      return dynamicRmseSelection;
    }

    public boolean isSlopeTest() {
      return slopeTest;
    }

    public Combination getCombination() {
      return combination;
    }

    public Estimator getEstimator() {
      return estimator;
    }

    public int getMaxFitRetries() {
      return maxFitRetries;
    }

    /** Whether every record also carries a bisquare refit of its window. */
    public boolean isRobust() {
      return robust;
    }

    /** Whether the series is walked from its last observation back to its first. */
    public boolean isReverse() {
      return reverse;
    }

    public DesignMatrixBuilder getDesign() {
      return design;
    }
  }

  public static final class Builder {
    private int minObs = 12;
    private double threshold = 2.56;
    private int consecutive = 5;
    private double minRmse = 0;
    // Days between refits while monitoring; 0 refits on every new observation.
    private double retrainTime = DesignMatrixBuilder.SIZE_OF_A_YEAR;
    private double minTrainingDays = DesignMatrixBuilder.SIZE_OF_A_YEAR;
    private Screening screening = Screening.NONE;
    private double screeningCrit = Double.NaN;
    private int[] screeningBands = null;
    private int[] testIndices = null;
    private boolean removeNoise = true;
    private boolean dynamicRmse = false;
    private int dynamicRmseWindow = 0;
    private DynamicRmseSelection dynamicRmseSelection = DynamicRmseSelection.RECENT;
    private boolean slopeTest = false;
    private Combination combination = Combination.MEAN_ABS;
    private Estimator estimator = Estimator.ols();
    private int maxFitRetries = 10;
    private boolean robust = false;
    private boolean reverse = false;
    private DesignMatrixBuilder design = DesignMatrixBuilder.harmonic(1);

    private Builder() {}

    public Builder minObs(int minObs) {
      this.minObs = minObs;
      return this;
    }

    public Builder threshold(double threshold) {
      this.threshold = threshold;
      return this;
    }

    public Builder consecutive(int consecutive) {
      this.consecutive = consecutive;
      return this;
    }

    public Builder minRmse(double minRmse) {
      this.minRmse = minRmse;
      return this;
    }

    public Builder retrainTime(double retrainTime) {
      this.retrainTime = retrainTime;
      return this;
    }

    public Builder minTrainingDays(double minTrainingDays) {
      this.minTrainingDays = minTrainingDays;
      return this;
    }

    public Builder screening(Screening screening) {
      this.screening = screening;
      return this;
    }

    /** Critical value of the robust screen; NaN selects the chi-squared default. */
    public Builder screeningCrit(double screeningCrit) {
      this.screeningCrit = screeningCrit;
      return this;
    }

    public Builder screeningBands(int... screeningBands) {
      this.screeningBands = screeningBands;
      return this;
    }

    public Builder testIndices(int... testIndices) {
      this.testIndices = testIndices;
      return this;
    }

    public Builder removeNoise(boolean removeNoise) {
      this.removeNoise = removeNoise;
      return this;
    }

    public Builder dynamicRmse(boolean dynamicRmse) {
      this.dynamicRmse = dynamicRmse;
      return this;
    }

    /** Observations feeding the dynamic RMSE; 0 uses {@code minObs}. */
    public Builder dynamicRmseWindow(int dynamicRmseWindow) {
      this.dynamicRmseWindow = dynamicRmseWindow;
      return this;
    }

    public Builder dynamicRmseSelection(DynamicRmseSelection dynamicRmseSelection) {
      this.dynamicRmseSelection = dynamicRmseSelection;
      return this;
    }

    public Builder slopeTest(boolean slopeTest) {
      this.slopeTest = slopeTest;
      return this;
    }

    public Builder combination(Combination combination) {
      this.combination = combination;
      return this;
    }

    public Builder estimator(Estimator estimator) {
      this.estimator = estimator;
      return this;
    }

    public Builder maxFitRetries(int maxFitRetries) {
      this.maxFitRetries = maxFitRetries;
      return this;
    }

    public Builder robust(boolean robust) {
      this.robust = robust;
      return this;
    }

    public Builder reverse(boolean reverse) {
      this.reverse = reverse;
      return this;
    }

    public Builder design(DesignMatrixBuilder design) {
      this.design = design;
      return this;
    }

    /** @throws ConfigurationException if any value is out of range */
    public Args build() {
      if (design == null) {
        throw new ConfigurationException("design must be set");
      }
      if (estimator == null) {
        throw new ConfigurationException("estimator must be set");
      }
      if (screening == null || combination == null || dynamicRmseSelection == null) {
        throw new ConfigurationException("screening, combination and selection must be set");
      }
      if (minObs <= 0) {
        throw new ConfigurationException("minObs must be positive, got " + minObs);
      }
      if (minObs < design.numFeatures()) {
        throw new ConfigurationException("minObs (" + minObs + ") is smaller than the number of "
            + "design columns (" + design.numFeatures() + ")");
      }
      if (!(threshold > 0) || Double.isInfinite(threshold)) {
        throw new ConfigurationException("threshold must be positive, got " + threshold);
      }
      if (consecutive <= 0) {
        throw new ConfigurationException("consecutive must be positive, got " + consecutive);
      }
      if (!(minRmse >= 0)) {
        throw new ConfigurationException("minRmse must be non-negative, got " + minRmse);
      }
      if (Double.isNaN(retrainTime)) {
        throw new ConfigurationException("retrainTime must be a number");
      }
      if (!(minTrainingDays >= 0)) {
        throw new ConfigurationException("minTrainingDays must be non-negative");
      }
      if (dynamicRmseWindow < 0) {
        throw new ConfigurationException("dynamicRmseWindow must be non-negative");
      }
      if (maxFitRetries < 0) {
        throw new ConfigurationException("maxFitRetries must be non-negative");
      }
      checkBands("testIndices", testIndices);
      checkBands("screeningBands", screeningBands);
      if (screening == Screening.RLM && !Double.isNaN(screeningCrit) && !(screeningCrit > 0)) {
        throw new ConfigurationException("screeningCrit must be positive, got " + screeningCrit);
      }
      return new Args(this);
    }

    private static void checkBands(String name, int[] bands) {
      if (bands == null) {
        return;
      }
      if (bands.length == 0) {
        throw new ConfigurationException(name + " must not be empty");
      }
      for (int i = 0; i < bands.length; i++) {
        if (bands[i] < 0) {
          throw new ConfigurationException(name + " has a negative band index " + bands[i]);
        }
        for (int j = 0; j < i; j++) {
          if (bands[i] == bands[j]) {
            throw new ConfigurationException(name + " repeats band " + bands[i]);
          }
        }
      }
    }
  }

  private final Args args;
  private final DesignMatrixBuilder design;
  private final Supplier<FitGenerator> fitGenerators;

  public Ccdcesque(Args args) {
    this(args, args.getEstimator()::newFitGenerator);
  }

  /** Detector whose segment fits come from {@code fitGenerators} instead of the estimator. */
  @VisibleForTesting
  Ccdcesque(Args args, Supplier<FitGenerator> fitGenerators) {
    this.args = Preconditions.checkNotNull(args);
    this.design = args.getDesign();
    this.fitGenerators = Preconditions.checkNotNull(fitGenerators);
  }

  public Args getArgs() {
    return args;
  }

  /**
   * Run change detection on one pixel.
   *
   * @return the pixel's segments in temporal order; empty when there are not enough observations
   * @throws ConfigurationException if a configured band index is out of range for the series
   */
  public SegmentRecords getResult(TimeSeries series) {
    return getResult(series, () -> false);
  }

  /**
   * Run change detection on one pixel, polling {@code cancelled} once per step.
   *
   * @throws CancellationException if {@code cancelled} returns true before the series is done
   */
  public SegmentRecords getResult(TimeSeries series, BooleanSupplier cancelled) {
    Model model = new Model(series);
    if (model.length < args.minObs) {
      logger.debug("pixel ({}, {}): {} observations, {} required", series.getPx(), series.getPy(),
          model.length, args.minObs);
      return model.records();
    }

    while (model.state != State.DONE) {
      if (cancelled.getAsBoolean()) {
        throw new CancellationException(
            "cancelled at pixel (" + series.getPx() + ", " + series.getPy() + ")");
      }
      switch (model.state) {
        case ACCUMULATING:
          model.accumulate();
          break;
        case MONITORING:
          model.monitor();
          break;
        case CLOSING:
          model.close();
          break;
        default:
          throw new IllegalStateException("unexpected state " + model.state);
      }
    }
    return model.records();
  }

  /** Combine per-band normalized residuals into one statistic. */
  @VisibleForTesting
  static double combine(Combination combination, double[] z) {
    double sum = 0;
    if (combination == Combination.NORM) {
      for (double v : z) {
        sum += v * v;
      }
      return Math.sqrt(sum);
    }
    for (double v : z) {
      sum += Math.abs(v);
    }
    return sum / z.length;
  }

  /** Circular distance in days between the day-of-year positions of two dates. */
  @VisibleForTesting
  static double seasonalDistance(int a, int b) {
    double d = Math.abs(a - b) % DesignMatrixBuilder.SIZE_OF_A_YEAR;
    return Math.min(d, DesignMatrixBuilder.SIZE_OF_A_YEAR - d);
  }

  /**
   * The Model class keeps track of the state of the current fit.
   *
   * <p>dates and y are working copies in walking order, so they run backwards in time for a reverse
   * run; noisy observations are removed by shifting values down and tracking the new length.
   */
  private final class Model {
    final int px;
    final int py;
    final int[] dates;
    final double[][] y;
    int length;
    DenseMatrix64F x;

    final int[] testBands;
    final SegmentFitter fitter;
    final SegmentFitter robustFitter;
    final RobustScreen robustScreen;
    // In walking order.
    final List<SegmentRecord> emitted = new ArrayList<>();

    State state = State.ACCUMULATING;
    // Current window is [start, here).
    int start;
    int here;
    SegmentFit fit;
    int lastFitDate;
    int fitFailures;
    double[] magnitude;

    Model(TimeSeries series) {
      this.px = series.getPx();
      this.py = series.getPy();
      this.dates = series.getDates();
      this.y = series.getValues();
      this.length = dates.length;
      if (args.reverse) {
        ArrayUtils.reverse(dates);
        for (double[] band : y) {
          ArrayUtils.reverse(band);
        }
      }
      this.x = design.build(dates, length);

      this.testBands = resolveBands(args.testIndices, series.numBands(), "testIndices");
      this.fitter = new SegmentFitter(fitGenerators.get());
      this.robustFitter = args.robust
          ? new SegmentFitter(
              new RobustFitGenerator(RobustLeastSquareBisquare.DEFAULT_MAX_ITERATIONS))
          : null;
      if (args.screening == Screening.RLM) {
        int[] screeningBands = args.screeningBands == null
            ? testBands
            : resolveBands(args.screeningBands, series.numBands(), "screeningBands");
        this.robustScreen = new RobustScreen(screeningBands, args.screeningCrit, args.minRmse);
      } else {
        this.robustScreen = null;
      }
    }

    /** Segments in temporal order. */
    SegmentRecords records() {
      SegmentRecords records = new SegmentRecords();
      for (int i = 0; i < emitted.size(); i++) {
        records.append(emitted.get(args.reverse ? emitted.size() - 1 - i : i));
      }
      return records;
    }

    /** Days between two observations, whichever way the series is walked. */
    double span(int from, int to) {
      return Math.abs(dates[to] - dates[from]);
    }

    void transition(State next) {
      logger.debug("pixel ({}, {}): {} -> {} at observation {}", px, py, state, next, here);
      state = next;
    }

    /** Build the initial window and train a stable model on it. */
    void accumulate() {
      here = Math.max(here, start + args.minObs);
      while (here <= length && span(start, here - 1) < args.minTrainingDays) {
        here++;
      }
      if (here > length) {
        // Not enough observations left for a new segment; the partial window is dropped.
        transition(State.DONE);
        return;
      }

      try {
        if (robustScreen != null && removeScreenedNoise()) {
          return;
        }
        fit = fitter.fit(x, y, start, here);
      } catch (FitFailureException e) {
        if (!fitFailed(e)) {
          here++;
        }
        return;
      }
      fitFailures = 0;

      if (!isStable()) {
        start++;
        here++;
        return;
      }
      lastFitDate = dates[here - 1];
      transition(State.MONITORING);
    }

    /**
     * Drop the observations the robust screen flags in the window.
     *
     * @return true if the window became too small or too short and must be rebuilt
     */
    boolean removeScreenedNoise() throws FitFailureException {
      boolean[] keep = robustScreen.screen(x, y, start, here);
      int kept = ArrayHelper.count(true, keep, 0, keep.length);
      if (kept == keep.length) {
        return false;
      }
      logger.debug("pixel ({}, {}): robust screen removed {} observations", px, py,
          keep.length - kept);
      length = ArrayHelper.compact(dates, y, length, start, keep);
      here = start + kept;
      x = design.build(dates, length);
      return here - start < args.minObs || span(start, here - 1) < args.minTrainingDays;
    }

    /**
     * A window is stable when neither its first nor its last observation, nor the change of the
     * trend across it, departs from the fit by more than the threshold.
     */
    boolean isStable() {
      int n = here - start;
      int slope = design.slopeIndex();
      double span = span(start, here - 1);
      double[] zFirst = new double[testBands.length];
      double[] zLast = new double[testBands.length];
      double[] zSlope = new double[testBands.length];
      for (int k = 0; k < testBands.length; k++) {
        int b = testBands[k];
        double scale = scale(fit.rmse[b]);
        zFirst[k] = fit.residuals[b][0] / scale;
        zLast[k] = fit.residuals[b][n - 1] / scale;
        zSlope[k] = fit.coefs[slope][b] * span / scale;
      }
      return combine(args.combination, zFirst) <= args.threshold
          && combine(args.combination, zLast) <= args.threshold
          && combine(args.combination, zSlope) <= args.threshold;
    }

    /** Test the next {@code consecutive} observations against the current model. */
    void monitor() {
      if (length - here < args.consecutive) {
        finishSeries();
        return;
      }

      double[][] z = new double[args.consecutive][];
      boolean allExceed = true;
      boolean firstExceeds = false;
      for (int k = 0; k < args.consecutive; k++) {
        z[k] = normalizedResiduals(fit, here + k);
        boolean exceeds = combine(args.combination, z[k]) > args.threshold;
        if (k == 0) {
          firstExceeds = exceeds;
        }
        if (!exceeds) {
          allExceed = false;
          break;
        }
      }

      if (allExceed) {
        if (args.slopeTest && isGradualDrift()) {
          logger.debug("pixel ({}, {}): departure at {} explained by trend", px, py, dates[here]);
          incorporate();
          return;
        }
        magnitude = new double[y.length];
        for (int k = 0; k < testBands.length; k++) {
          double sum = 0;
          for (double[] zk : z) {
            sum += zk[k];
          }
          magnitude[testBands[k]] = sum / args.consecutive;
        }
        transition(State.CLOSING);
        return;
      }

      if (firstExceeds && args.removeNoise) {
        logger.debug("pixel ({}, {}): removed noisy observation at {}", px, py, dates[here]);
        length = ArrayHelper.remove(dates, y, length, here);
        x = design.build(dates, length);
        return;
      }
      incorporate();
    }

    /** Add the observation at {@code here} to the window, refitting when it is time to. */
    void incorporate() {
      here++;
      if (args.retrainTime > 0 && Math.abs(dates[here - 1] - lastFitDate) < args.retrainTime) {
        return;
      }
      try {
        fit = fitter.fit(x, y, start, here);
        fitFailures = 0;
        lastFitDate = dates[here - 1];
      } catch (FitFailureException e) {
        // Keep monitoring with the previous fit.
        fitFailed(e);
      }
    }

    /** Emit the segment ending just before the break and start a new window at the break. */
    void close() {
      refitWindow();
      emit(dates[here], magnitude);
      start = here;
      fit = null;
      magnitude = null;
      transition(State.ACCUMULATING);
    }

    /** Fewer than {@code consecutive} observations remain: they all join the last segment. */
    void finishSeries() {
      here = length;
      refitWindow();
      emit(SegmentRecord.NO_BREAK, new double[y.length]);
      transition(State.DONE);
    }

    void refitWindow() {
      if (fit != null && fit.from == start && fit.to == here) {
        return;
      }
      try {
        fit = fitter.fit(x, y, start, here);
      } catch (FitFailureException e) {
        logger.warn("pixel ({}, {}): refit of the {} observations from {} failed, the record keeps "
            + "the coefficients of the {} observations last fitted: {}", px, py, here - start,
            dates[start], fit.numObs(), e.getMessage());
      }
    }

    /** Record the window [start, here); numObs always counts the whole window. */
    void emit(int breakDate, double[] mag) {
      double[][] robustCoef = null;
      double[] robustRmse = null;
      if (robustFitter != null) {
        try {
          SegmentFit robustFit = robustFitter.fit(x, y, start, here);
          robustCoef = robustFit.coefs;
          robustRmse = robustFit.rmse;
        } catch (FitFailureException e) {
          logger.warn("pixel ({}, {}): robust refit of the segment from {} failed: {}", px, py,
              dates[start], e.getMessage());
        }
      }
      int first = Math.min(dates[start], dates[here - 1]);
      int last = Math.max(dates[start], dates[here - 1]);
      SegmentRecord record = new SegmentRecord(px, py, first, last, breakDate, fit.coefs,
          fit.rmse, mag, here - start, robustCoef, robustRmse);
      logger.debug("pixel ({}, {}): {}", px, py, record);
      emitted.add(record);
    }

    /**
     * Count a failed fit.
     *
     * @return true if the retries are exhausted and the rest of the series was abandoned
     */
    boolean fitFailed(FitFailureException e) {
      fitFailures++;
      if (fitFailures > args.maxFitRetries) {
        logger.warn("pixel ({}, {}): abandoning series at {} after {} failed fits: {}", px, py,
            dates[Math.min(here, length) - 1], fitFailures, e.getMessage());
        transition(State.DONE);
        return true;
      }
      logger.debug("pixel ({}, {}): fit failed ({}), accumulating one more observation", px, py,
          e.getMessage());
      return false;
    }

    /**
     * Intercept and slope re-estimated over the window and the candidates with the seasonal
     * coefficients held fixed. The departure is drift if the candidates fit that trend.
     */
    boolean isGradualDrift() {
      int to = here + args.consecutive;
      int count = to - start;
      int slope = design.slopeIndex();
      int intercept = design.interceptIndex();
      int numTrend = intercept >= 0 ? 2 : 1;

      DenseMatrix64F trend = new DenseMatrix64F(count, numTrend);
      for (int i = 0; i < count; i++) {
        trend.set(i, 0, x.get(start + i, slope));
        if (intercept >= 0) {
          trend.set(i, 1, 1.0);
        }
      }

      FitGenerator ols = new FitGenerator();
      double[][] adjusted = new double[y.length][];
      for (int b : testBands) {
        double[] target = new double[count];
        for (int i = 0; i < count; i++) {
          target[i] = y[b][start + i] - seasonalPart(b, start + i);
        }
        double[] trendCoefs;
        try {
          trendCoefs = ols.fit(trend, target);
        } catch (FitFailureException e) {
          return false;
        }
        adjusted[b] = new double[fit.coefs.length];
        for (int j = 0; j < fit.coefs.length; j++) {
          adjusted[b][j] = fit.coefs[j][b];
        }
        adjusted[b][slope] = trendCoefs[0];
        if (intercept >= 0) {
          adjusted[b][intercept] = trendCoefs[1];
        }
      }

      for (int i = here; i < to; i++) {
        double[] z = new double[testBands.length];
        for (int k = 0; k < testBands.length; k++) {
          int b = testBands[k];
          double pred = 0;
          for (int j = 0; j < adjusted[b].length; j++) {
            pred += adjusted[b][j] * x.get(i, j);
          }
          z[k] = (y[b][i] - pred) / testScale(b, i);
        }
        if (combine(args.combination, z) > args.threshold) {
          return false;
        }
      }
      return true;
    }

    double seasonalPart(int band, int row) {
      double v = 0;
      for (int j = 0; j < fit.coefs.length; j++) {
        if (j != design.slopeIndex() && j != design.interceptIndex()) {
          v += fit.coefs[j][band] * x.get(row, j);
        }
      }
      return v;
    }

    double[] normalizedResiduals(SegmentFit model, int row) {
      double[] z = new double[testBands.length];
      for (int k = 0; k < testBands.length; k++) {
        int b = testBands[k];
        z[k] = (y[b][row] - model.predict(b, x, row)) / testScale(b, row);
      }
      return z;
    }

    /** Residual scale used to test an observation on one band. */
    double testScale(int band, int row) {
      if (!args.dynamicRmse) {
        return scale(fit.rmse[band]);
      }
      int window = args.dynamicRmseWindow > 0 ? args.dynamicRmseWindow : args.minObs;
      int[] rows = args.dynamicRmseSelection == DynamicRmseSelection.SEASONAL
          ? seasonalRows(row, window)
          : recentRows(window);
      double sum = 0;
      for (int i : rows) {
        double r = y[band][i] - fit.predict(band, x, i);
        sum += r * r;
      }
      return scale(Math.sqrt(sum / rows.length));
    }

    int[] recentRows(int window) {
      int n = Math.min(window, here - start);
      int[] rows = new int[n];
      for (int i = 0; i < n; i++) {
        rows[i] = here - n + i;
      }
      return rows;
    }

    int[] seasonalRows(int row, int window) {
      int n = Math.min(window, here - start);
      Integer[] candidates = new Integer[here - start];
      for (int i = 0; i < candidates.length; i++) {
        candidates[i] = start + i;
      }
      // Ties keep the earlier observation.
      Arrays.sort(candidates, (a, b) -> {
        int c = Double.compare(seasonalDistance(dates[a], dates[row]),
            seasonalDistance(dates[b], dates[row]));
        return c != 0 ? c : Integer.compare(a, b);
      });
      int[] rows = new int[n];
      for (int i = 0; i < n; i++) {
        rows[i] = candidates[i];
      }
      return rows;
    }

    double scale(double rmse) {
      return Math.max(Math.max(rmse, args.minRmse), MIN_SCALE);
    }
  }

  private static int[] resolveBands(int[] bands, int numBands, String name) {
    if (bands == null) {
      int[] all = new int[numBands];
      for (int b = 0; b < numBands; b++) {
        all[b] = b;
      }
      return all;
    }
    for (int b : bands) {
      if (b >= numBands) {
        throw new ConfigurationException(
            name + " refers to band " + b + " but the series has " + numBands + " bands");
      }
    }
    return bands.clone();
  }
}
