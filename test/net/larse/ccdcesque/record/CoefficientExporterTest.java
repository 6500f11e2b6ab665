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
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.EnumSet;
import net.larse.ccdcesque.helper.ConfigurationException;
import net.larse.ccdcesque.timeseries.DesignMatrixBuilder;
import net.larse.ccdcesque.timeseries.DesignTerm;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CoefficientExporterTest {
  private static final DesignMatrixBuilder DESIGN = DesignMatrixBuilder.harmonic(1);

  // Three bands; columns intercept, slope, sin, cos.
  private static SegmentRecord record() {
    double[][] coef = {{10, 20, 30}, {0.001, 0.002, 0.003}, {1, 2, 3}, {-1, -2, -3}};
    return new SegmentRecord(0, 0, 1000, 3000, SegmentRecord.NO_BREAK, coef,
        new double[] {5, 6, 7}, new double[] {0, 0, 0}, 30);
  }

  @Test
  public void testNamesAreCoefficientMajor() {
    CoefficientExporter exporter = new CoefficientExporter(DESIGN, new int[] {0, 2},
        EnumSet.of(CoefficientGroup.INTERCEPT, CoefficientGroup.SLOPE, CoefficientGroup.RMSE));
    assertEquals(
        Arrays.asList("B1_beta0", "B3_beta0", "B1_beta1", "B3_beta1", "B1_RMSE", "B3_RMSE"),
        exporter.bandNames());
  }

  @Test
  public void testInterceptIsNormalizedToTheMidpoint() {
    CoefficientExporter exporter = new CoefficientExporter(DESIGN, new int[] {0, 2},
        EnumSet.of(CoefficientGroup.INTERCEPT, CoefficientGroup.SLOPE, CoefficientGroup.RMSE));
    double[] values = exporter.export(record());
    assertArrayEquals(new double[] {10 + 0.001 * 2000, 30 + 0.003 * 2000, 0.001, 0.003, 5, 7},
        values, 1e-12);
    // The stored record keeps its raw intercept.
    assertEquals(10, record().getCoef(0, 0), 0);
  }

  @Test
  public void testGroups() {
    assertArrayEquals(new int[] {2, 3}, new CoefficientExporter(DESIGN, new int[] {1},
        EnumSet.of(CoefficientGroup.SEASONALITY)).coefficientIndices());
    assertArrayEquals(new int[] {0, 1, 2, 3}, new CoefficientExporter(DESIGN, new int[] {1},
        EnumSet.of(CoefficientGroup.ALL)).coefficientIndices());

    CoefficientExporter rmseOnly = new CoefficientExporter(DESIGN, new int[] {1, 2},
        EnumSet.of(CoefficientGroup.RMSE));
    assertEquals(0, rmseOnly.coefficientIndices().length);
    assertArrayEquals(new double[] {6, 7}, rmseOnly.export(record()), 0);
  }

  @Test
  public void testSeasonalValuesAreRaw() {
    CoefficientExporter exporter = new CoefficientExporter(DESIGN, new int[] {1},
        EnumSet.of(CoefficientGroup.SEASONALITY));
    assertEquals(Arrays.asList("B2_beta2", "B2_beta3"), exporter.bandNames());
    assertArrayEquals(new double[] {2, -2}, exporter.export(record()), 0);
  }

  @Test
  public void testRobustValues() {
    double[][] coef = {{10}, {0.001}, {1}, {-1}};
    double[][] robustCoef = {{8}, {0.002}, {1.5}, {-0.5}};
    SegmentRecord record = new SegmentRecord(0, 0, 1000, 3000, SegmentRecord.NO_BREAK, coef,
        new double[] {5}, new double[] {0}, 30, robustCoef, new double[] {4});
    CoefficientExporter exporter = new CoefficientExporter(DESIGN, new int[] {0},
        EnumSet.of(CoefficientGroup.ALL, CoefficientGroup.RMSE), true);

    assertTrue(exporter.isUseRobust());
    assertEquals(Arrays.asList("B1_beta0", "B1_beta1", "B1_beta2", "B1_beta3", "B1_RMSE"),
        exporter.bandNames());
    assertArrayEquals(new double[] {8 + 0.002 * 2000, 0.002, 1.5, -0.5, 4},
        exporter.export(record), 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRobustExportNeedsRobustValues() {
    new CoefficientExporter(DESIGN, new int[] {0}, EnumSet.of(CoefficientGroup.ALL), true)
        .export(record());
  }

  @Test(expected = ConfigurationException.class)
  public void testDesignWithoutIntercept() {
    DesignMatrixBuilder design =
        new DesignMatrixBuilder(Arrays.asList(DesignTerm.SLOPE, DesignTerm.harmonic(1)));
    new CoefficientExporter(design, new int[] {0}, EnumSet.of(CoefficientGroup.ALL));
  }

  @Test(expected = ConfigurationException.class)
  public void testNoGroups() {
    new CoefficientExporter(DESIGN, new int[] {0}, EnumSet.noneOf(CoefficientGroup.class));
  }

  @Test(expected = ConfigurationException.class)
  public void testNoBands() {
    new CoefficientExporter(DESIGN, new int[0], EnumSet.of(CoefficientGroup.ALL));
  }
}
