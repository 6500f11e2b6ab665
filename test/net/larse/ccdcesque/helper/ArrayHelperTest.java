package net.larse.ccdcesque.helper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class ArrayHelperTest {

  @Test
  public void testCount() {
    boolean[] flags = {true, false, true, true, false};
    assertEquals(3, ArrayHelper.count(true, flags, 0, flags.length));
    assertEquals(2, ArrayHelper.count(true, flags, 0, -2));
    assertEquals(1, ArrayHelper.count(false, flags, 2, flags.length));
  }

  @Test
  public void testCompact() {
    int[] dates = {1, 2, 3, 4, 5, 6};
    double[][] y = {{10, 20, 30, 40, 50, 60}};
    int length = ArrayHelper.compact(dates, y, 6, 1, new boolean[] {true, false, false});
    assertEquals(4, length);
    assertArrayEquals(new int[] {1, 2, 5, 6}, java.util.Arrays.copyOf(dates, length));
    assertArrayEquals(new double[] {10, 20, 50, 60}, java.util.Arrays.copyOf(y[0], length), 0);
  }

  @Test
  public void testRemove() {
    int[] dates = {1, 2, 3};
    double[][] y = {{10, 20, 30}, {-1, -2, -3}};
    int length = ArrayHelper.remove(dates, y, 3, 1);
    assertEquals(2, length);
    assertEquals(3, dates[1]);
    assertEquals(30, y[0][1], 0);
    assertEquals(-3, y[1][1], 0);
  }
}
