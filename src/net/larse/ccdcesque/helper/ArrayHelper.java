package net.larse.ccdcesque.helper;

/** Static array manipulation functions. */
public class ArrayHelper {
  /**
   * Count the number of occurrences of value in array, between start (incl) and end (excl). if end
   * is negative, it is taken as the number of entries from the end (ie: -1 = len-1).
   */
  public static int count(boolean value, boolean[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    int count = 0;
    for (int i = start; i < end; i++) {
      if (array[i] == value) {
        count++;
      }
    }
    return count;
  }

  /**
   * Drop the entries of the range [start, start + keep.length) whose keep flag is false, shifting
   * everything after them down. Returns the new logical length of the arrays.
   *
   * @param dates observation dates
   * @param y [BANDS][NUM_OBSERVATIONS] values that move with the dates
   * @param length current logical length of dates and each band of y
   * @param start index of the first entry covered by keep
   * @param keep one flag per entry in the covered range
   */
  public static int compact(int[] dates, double[][] y, int length, int start, boolean[] keep) {
    int count = start;
    for (int i = start; i < length; i++) {
      int k = i - start;
      if (k >= keep.length || keep[k]) {
        dates[count] = dates[i];
        for (double[] band : y) {
          band[count] = band[i];
        }
        count++;
      }
    }
    return count;
  }

  /** Remove a single entry by shifting everything after it down; returns the new length. */
  public static int remove(int[] dates, double[][] y, int length, int index) {
    System.arraycopy(dates, index + 1, dates, index, length - index - 1);
    for (double[] band : y) {
      System.arraycopy(band, index + 1, band, index, length - index - 1);
    }
    return length - 1;
  }
}
