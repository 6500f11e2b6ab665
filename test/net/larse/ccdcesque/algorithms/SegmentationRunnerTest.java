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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import net.larse.ccdcesque.helper.ConfigurationException;
import net.larse.ccdcesque.record.SegmentRecord;
import net.larse.ccdcesque.timeseries.ObservationScreener;
import net.larse.ccdcesque.timeseries.PixelObservations;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SegmentationRunnerTest {
  private static final double CLOUD = 4;

  private final ObservationScreener screener =
      new ObservationScreener(new double[] {0}, new double[] {10000}, 1, CLOUD);

  private static Ccdcesque detector() {
    return new Ccdcesque(Ccdcesque.Args.builder()
        .minObs(12).threshold(3).consecutive(5).minRmse(100).build());
  }

  /** Band 0 holds the values; band 1 is the mask, with every seventh observation clouded. */
  private static PixelObservations pixel(int px, int[] dates, double[] y) {
    double[] mask = new double[dates.length];
    for (int i = 0; i < mask.length; i += 7) {
      mask[i] = CLOUD;
    }
    return new PixelObservations(px, 0, dates, new double[][] {y, mask});
  }

  @Test
  public void testResultsInInputOrder() {
    int[] dates = SyntheticSeries.monthlyDates(56);
    double[] stepped = SyntheticSeries.step(SyntheticSeries.seasonal(dates, 20, 1), 35, 3000);
    double[] stable = SyntheticSeries.seasonal(dates, 20, 2);
    int[] shortDates = SyntheticSeries.monthlyDates(10);

    List<PixelObservations> pixels = Arrays.asList(
        pixel(0, dates, stepped),
        pixel(1, shortDates, SyntheticSeries.seasonal(shortDates, 20, 3)),
        // Two value bands plus the mask: a bad pixel.
        new PixelObservations(2, 0, dates, new double[][] {stable, stable, new double[56]}),
        pixel(3, dates, stable));

    List<SegmentationRunner.PixelResult> results =
        new SegmentationRunner(screener, detector(), 2).run(pixels);

    assertEquals(4, results.size());
    for (int i = 0; i < 4; i++) {
      assertEquals(i, results.get(i).getPx());
    }

    assertFalse(results.get(0).isSkipped());
    assertEquals(2, results.get(0).getRecords().size());
    assertEquals(dates[35], results.get(0).getRecords().get(0).getBreakDate());

    assertFalse(results.get(1).isSkipped());
    assertTrue(results.get(1).getRecords().isEmpty());

    assertTrue(results.get(2).isSkipped());
    assertTrue(results.get(2).getRecords().isEmpty());

    assertEquals(1, results.get(3).getRecords().size());
    SegmentRecord record = results.get(3).getRecords().get(0);
    assertEquals(SegmentRecord.NO_BREAK, record.getBreakDate());
    assertEquals(3, record.getPx());
    // Observations 0, 7, ..., 49 are clouded.
    assertEquals(48, record.getNumObs());
  }

  @Test(expected = ConfigurationException.class)
  public void testConfigurationErrorAbortsTheBatch() {
    int[] dates = SyntheticSeries.monthlyDates(30);
    Ccdcesque badBands = new Ccdcesque(Ccdcesque.Args.builder().testIndices(4).build());
    new SegmentationRunner(screener, badBands, 2).run(Arrays.asList(
        pixel(0, dates, SyntheticSeries.seasonal(dates, 20, 1)),
        pixel(1, dates, SyntheticSeries.seasonal(dates, 20, 2))));
  }
}
