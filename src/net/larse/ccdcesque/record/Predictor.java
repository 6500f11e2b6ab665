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
package net.larse.ccdcesque.record;

import com.google.common.base.Preconditions;
import net.larse.ccdcesque.timeseries.DesignMatrixBuilder;

/**
 * Reconstructs band values from a segment's coefficients, the least squares ones or, with {@code
 * useRobust}, the bisquare ones.
 *
 * <p>Dates outside the segment are extrapolated; whether that is meaningful is up to the caller.
 */
public class Predictor {
  private final DesignMatrixBuilder design;
  private final boolean useRobust;

  public Predictor(DesignMatrixBuilder design, boolean useRobust) {
    this.design = Preconditions.checkNotNull(design);
    this.useRobust = useRobust;
  }

  public Predictor(DesignMatrixBuilder design) {
    this(design, false);
  }

  public boolean isUseRobust() {
    return useRobust;
  }

  /**
   * Predicted value of every band on {@code date}.
   *
   * @throws IllegalArgumentException if the record does not match the design, or robust values are
   *     requested from a record without them
   */
  public double[] predict(SegmentRecord record, int date) {
    Preconditions.checkArgument(record.numFeatures() == design.numFeatures(),
        "record has %s coefficients, design has %s columns", record.numFeatures(),
        design.numFeatures());
    Preconditions.checkArgument(!useRobust || record.hasRobust(),
        "record starting at %s has no robust coefficients", record.getStart());
    double[] row = design.row(date);
    double[] result = new double[record.numBands()];
    for (int b = 0; b < result.length; b++) {
      double v = 0;
      for (int j = 0; j < row.length; j++) {
        v += record.getCoef(j, b, useRobust) * row[j];
      }
      result[b] = v;
    }
    return result;
  }

  /** @return [DATES][BANDS] */
  public double[][] predict(SegmentRecord record, int[] dates) {
    double[][] result = new double[dates.length][];
    for (int i = 0; i < dates.length; i++) {
      result[i] = predict(record, dates[i]);
    }
    return result;
  }

  /**
   * Predict through the segment {@code lookup} selects for the date.
   *
   * @return the prediction, or null if no segment qualifies
   */
  public double[] predict(SegmentRecords records, int date, SegmentLookup lookup)
      throws AmbiguousSegmentException {
    SegmentRecord record = lookup.find(records, date);
    return record == null ? null : predict(record, date);
  }
}
