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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.ejml.data.DenseMatrix64F;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RobustLeastSquareBisquareTest {
  private DenseMatrix64F a;
  private double[] y;

  @Before
  public void setUp() {
    int n = 20;
    a = new DenseMatrix64F(n, 2);
    y = new double[n];
    for (int i = 0; i < n; i++) {
      a.set(i, 0, 1.0);
      a.set(i, 1, i);
      y[i] = 10 + 2 * i + 0.1 * ((i * 7) % 5 - 2);
    }
    y[10] += 100;
  }

  @Test
  public void testOutlierIsIgnored() throws Exception {
    RobustLeastSquareBisquare rls = new RobustLeastSquareBisquare(a);
    double[] robust = rls.getSolution(y);
    double[] ols = new FitGenerator().fit(a, y);

    assertTrue(Math.abs(ols[0] - 10) > 2);
    assertEquals(10, robust[0], 0.5);
    assertEquals(2, robust[1], 0.05);
    assertEquals(0, rls.getWeights()[10], 1e-12);
    assertTrue(rls.getWeights()[0] > 0.5);
    assertTrue(rls.getScale() > 0 && rls.getScale() < 1);
  }

  @Test
  public void testCleanDataMatchesLeastSquares() throws Exception {
    y[10] -= 100;
    double[] robust = new RobustLeastSquareBisquare(a).getSolution(y);
    double[] ols = new FitGenerator().fit(a, y);
    assertEquals(ols[0], robust[0], 0.1);
    assertEquals(ols[1], robust[1], 0.01);
  }

  @Test
  public void testRobustFitGenerator() throws Exception {
    RobustFitGenerator generator = new RobustFitGenerator(5);
    assertEquals("rlm", generator.name());
    assertEquals(2, generator.fit(a, y)[1], 0.05);
  }

  @Test(expected = FitFailureException.class)
  public void testRankDeficient() throws Exception {
    DenseMatrix64F singular = new DenseMatrix64F(4, 2, true, 1, 2, 1, 2, 1, 2, 1, 2);
    new RobustLeastSquareBisquare(singular).getSolution(new double[] {1, 2, 3, 4});
  }
}
