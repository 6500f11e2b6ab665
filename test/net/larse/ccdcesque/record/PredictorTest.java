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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import net.larse.ccdcesque.record.SegmentLookup.TieBreak;
import net.larse.ccdcesque.timeseries.DesignMatrixBuilder;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PredictorTest {
  private static final double EPSILON = 1e-9;
  private static final DesignMatrixBuilder DESIGN = DesignMatrixBuilder.harmonic(1);

  // Columns: intercept, slope, sin, cos. Two bands.
  private static SegmentRecord twoBandRecord(int start, int end, int breakDate) {
    double[][] coef = {{100, -50}, {0.5, 0}, {10, 3}, {-5, 0}};
    return new SegmentRecord(0, 0, start, end, breakDate, coef, new double[] {1, 1},
        new double[] {0, 0}, 12);
  }

  private static double expected(double[] c, int date) {
    double rx = DesignMatrixBuilder.OMEGA * date;
    return c[0] + c[1] * date + c[2] * Math.sin(rx) + c[3] * Math.cos(rx);
  }

  @Test
  public void testPredictSingleDate() {
    SegmentRecord record = twoBandRecord(730000, 731000, SegmentRecord.NO_BREAK);
    double[] result = new Predictor(DESIGN).predict(record, 730500);
    assertEquals(2, result.length);
    assertEquals(expected(new double[] {100, 0.5, 10, -5}, 730500), result[0], EPSILON);
    assertEquals(expected(new double[] {-50, 0, 3, 0}, 730500), result[1], EPSILON);
  }

  @Test
  public void testPredictManyDatesExtrapolates() {
    SegmentRecord record = twoBandRecord(730000, 731000, SegmentRecord.NO_BREAK);
    int[] dates = {729000, 730500, 735000};
    double[][] result = new Predictor(DESIGN).predict(record, dates);
    assertEquals(3, result.length);
    for (int i = 0; i < dates.length; i++) {
      assertArrayEquals(new Predictor(DESIGN).predict(record, dates[i]), result[i], 0);
    }
    // Outside the segment the fitted trend just continues.
    assertEquals(expected(new double[] {100, 0.5, 10, -5}, 735000), result[2][0], EPSILON);
  }

  @Test
  public void testPredictFromRobustCoefficients() {
    double[][] coef = {{100}, {0.5}, {10}, {-5}};
    double[][] robustCoef = {{90}, {0.5}, {12}, {-4}};
    SegmentRecord record = new SegmentRecord(0, 0, 730000, 731000, SegmentRecord.NO_BREAK, coef,
        new double[] {1}, new double[] {0}, 12, robustCoef, new double[] {0.8});

    assertEquals(expected(new double[] {100, 0.5, 10, -5}, 730500),
        new Predictor(DESIGN).predict(record, 730500)[0], EPSILON);
    assertEquals(expected(new double[] {90, 0.5, 12, -4}, 730500),
        new Predictor(DESIGN, true).predict(record, 730500)[0], EPSILON);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRobustPredictionNeedsRobustCoefficients() {
    SegmentRecord record = twoBandRecord(730000, 731000, SegmentRecord.NO_BREAK);
    new Predictor(DESIGN, true).predict(record, 730500);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFeatureCountMismatch() {
    SegmentRecord record = twoBandRecord(730000, 731000, SegmentRecord.NO_BREAK);
    new Predictor(DesignMatrixBuilder.harmonic(1, 2)).predict(record, 730500);
  }

  @Test
  public void testPredictThroughLookup() throws Exception {
    SegmentRecords records = new SegmentRecords();
    records.append(twoBandRecord(730000, 731000, 731100));
    SegmentRecord second = new SegmentRecord(0, 0, 731100, 732000, SegmentRecord.NO_BREAK,
        new double[][] {{0, 0}, {0, 0}, {0, 0}, {0, 0}}, new double[] {1, 1},
        new double[] {0, 0}, 12);
    records.append(second);
    Predictor predictor = new Predictor(DESIGN);

    assertArrayEquals(new double[] {0, 0},
        predictor.predict(records, 731500, SegmentLookup.intersecting()), 0);
    assertNull(predictor.predict(records, 731050, SegmentLookup.intersecting()));
    assertArrayEquals(new double[] {0, 0},
        predictor.predict(records, 731050, new SegmentLookup(false, true, TieBreak.FAIL)), 0);
    assertNull(predictor.predict(records, 729000, new SegmentLookup(true, false, TieBreak.FAIL)));
  }
}
