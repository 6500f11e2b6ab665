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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SegmentRecordsTest {
  static SegmentRecord record(int start, int end, int breakDate) {
    return new SegmentRecord(3, 4, start, end, breakDate, new double[][] {{1.0}, {0.5}},
        new double[] {2.0}, new double[] {breakDate == SegmentRecord.NO_BREAK ? 0 : 7.0}, 20);
  }

  @Test
  public void testAppendKeepsTemporalOrder() {
    SegmentRecords records = new SegmentRecords();
    assertTrue(records.isEmpty());
    records.append(record(100, 200, 210));
    records.append(record(210, 400, SegmentRecord.NO_BREAK));

    assertEquals(2, records.size());
    List<Integer> starts = new ArrayList<>();
    for (SegmentRecord r : records) {
      starts.add(r.getStart());
    }
    assertEquals(Arrays.asList(100, 210), starts);
  }

  @Test
  public void testSharedBoundaryIsAllowed() {
    SegmentRecords records = new SegmentRecords();
    records.append(record(100, 200, 200));
    records.append(record(200, 300, SegmentRecord.NO_BREAK));
    assertEquals(2, records.size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOverlapIsRejected() {
    SegmentRecords records = new SegmentRecords();
    records.append(record(100, 200, 210));
    records.append(record(150, 300, SegmentRecord.NO_BREAK));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testListViewIsUnmodifiable() {
    SegmentRecords records = new SegmentRecords();
    records.append(record(100, 200, 210));
    records.asList().clear();
  }

  @Test
  public void testEquality() {
    SegmentRecords a = new SegmentRecords();
    SegmentRecords b = new SegmentRecords();
    a.append(record(100, 200, 210));
    b.append(record(100, 200, 210));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());

    b.append(record(210, 300, SegmentRecord.NO_BREAK));
    assertNotEquals(a, b);
  }

  @Test
  public void testRecordIsImmutable() {
    double[][] coef = {{1.0}, {0.5}};
    SegmentRecord r = new SegmentRecord(0, 0, 1, 2, SegmentRecord.NO_BREAK, coef,
        new double[] {2.0}, new double[] {0.0}, 5);
    coef[0][0] = 99;
    r.getCoef()[1][0] = 99;
    assertEquals(1.0, r.getCoef(0, 0), 0);
    assertEquals(0.5, r.getCoef(1, 0), 0);
    assertFalse(r.hasBreak());
  }

  @Test
  public void testBreakBeforeStartIsAccepted() {
    assertEquals(90, record(100, 200, 90).getBreakDate());
  }

  @Test
  public void testRobustValuesAreOptional() {
    SegmentRecord plain = record(100, 200, SegmentRecord.NO_BREAK);
    assertFalse(plain.hasRobust());
    assertNull(plain.getRobustCoef());
    assertNull(plain.getRobustRmse());

    SegmentRecord robust = new SegmentRecord(3, 4, 100, 200, SegmentRecord.NO_BREAK,
        new double[][] {{1.0}, {0.5}}, new double[] {2.0}, new double[] {0.0}, 20,
        new double[][] {{1.5}, {0.25}}, new double[] {1.0});
    assertTrue(robust.hasRobust());
    assertEquals(1.5, robust.getCoef(0, 0, true), 0);
    assertEquals(1.0, robust.getCoef(0, 0, false), 0);
    assertEquals(1.0, robust.getRmse(0, true), 0);
    assertEquals(2.0, robust.getRmse(0, false), 0);
    assertNotEquals(plain, robust);
  }

  @Test(expected = IllegalStateException.class)
  public void testMissingRobustCoefficient() {
    record(100, 200, SegmentRecord.NO_BREAK).getRobustCoef(0, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRobustCoefficientsNeedRmse() {
    new SegmentRecord(3, 4, 100, 200, SegmentRecord.NO_BREAK, new double[][] {{1.0}, {0.5}},
        new double[] {2.0}, new double[] {0.0}, 20, new double[][] {{1.5}, {0.25}}, null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBreakInsideSegmentIsRejected() {
    record(100, 200, 150);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testStartAfterEndIsRejected() {
    record(300, 200, SegmentRecord.NO_BREAK);
  }
}
