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
package net.larse.ccdcesque.timeseries;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import net.larse.ccdcesque.helper.ConfigurationException;
import org.ejml.data.DenseMatrix64F;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DesignMatrixBuilderTest {

  @Test
  public void testHarmonicColumns() {
    DesignMatrixBuilder design = DesignMatrixBuilder.harmonic(1, 2);
    assertEquals(6, design.numFeatures());
    assertEquals(Arrays.asList("intercept", "slope", "sin1", "cos1", "sin2", "cos2"),
        design.columnNames());
    assertEquals(0, design.interceptIndex());
    assertEquals(1, design.slopeIndex());
    assertArrayEquals(new int[] {2, 3, 4, 5}, design.seasonalColumns());
    assertArrayEquals(new int[] {1, 2}, design.harmonicFrequencies());

    int date = 730120;
    double[] row = design.row(date);
    double w = 2 * Math.PI / 365.25;
    assertEquals(1.0, row[0], 0);
    assertEquals(date, row[1], 0);
    assertEquals(Math.sin(w * date), row[2], 1e-12);
    assertEquals(Math.cos(w * date), row[3], 1e-12);
    assertEquals(Math.sin(2 * w * date), row[4], 1e-12);
    assertEquals(Math.cos(2 * w * date), row[5], 1e-12);
  }

  @Test
  public void testBuildMatchesRows() {
    DesignMatrixBuilder design = DesignMatrixBuilder.harmonic(1);
    int[] dates = {730120, 730150, 730181};
    DenseMatrix64F x = design.build(dates);
    assertEquals(3, x.getNumRows());
    assertEquals(4, x.getNumCols());
    for (int i = 0; i < dates.length; i++) {
      double[] row = design.row(dates[i]);
      for (int j = 0; j < row.length; j++) {
        assertEquals(row[j], x.get(i, j), 0);
      }
    }
    assertEquals(2, design.build(dates, 2).getNumRows());
  }

  @Test
  public void testCustomOrder() {
    DesignMatrixBuilder design = new DesignMatrixBuilder(
        Arrays.asList(DesignTerm.harmonic(3), DesignTerm.SLOPE));
    assertEquals(Arrays.asList("sin3", "cos3", "slope"), design.columnNames());
    assertEquals(2, design.slopeIndex());
    assertEquals(-1, design.interceptIndex());
    assertEquals(100.0, design.row(100)[2], 0);
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingSlope() {
    new DesignMatrixBuilder(Arrays.asList(DesignTerm.INTERCEPT, DesignTerm.harmonic(1)));
  }

  @Test(expected = ConfigurationException.class)
  public void testEmptyDesign() {
    new DesignMatrixBuilder(Collections.<DesignTerm>emptyList());
  }

  @Test(expected = ConfigurationException.class)
  public void testRepeatedHarmonic() {
    DesignMatrixBuilder.harmonic(1, 1);
  }

  @Test(expected = ConfigurationException.class)
  public void testNonPositiveHarmonic() {
    DesignMatrixBuilder.harmonic(0);
  }

  @Test(expected = ConfigurationException.class)
  public void testTwoSlopes() {
    new DesignMatrixBuilder(Arrays.asList(DesignTerm.SLOPE, DesignTerm.SLOPE));
  }
}
