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
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves which segment of a pixel describes a given date.
 *
 * <p>Segments intersecting the date ({@code start <= date <= end}) are preferred. Failing that,
 * the first segment starting on or after the date is used if {@code after} is enabled, and then the
 * latest unbroken segment ending on or before the date if {@code before} is enabled.
 */
public final class SegmentLookup {
  /** What to do when several segments intersect the date. */
  public enum TieBreak {
    FAIL,
    EARLIEST,
    LATEST
  }

  private final boolean before;
  private final boolean after;
  private final TieBreak tieBreak;

  public SegmentLookup(boolean before, boolean after, TieBreak tieBreak) {
    this.before = before;
    this.after = after;
    this.tieBreak = Preconditions.checkNotNull(tieBreak);
  }

  /** Intersecting segments only, ambiguous dates rejected. */
  public static SegmentLookup intersecting() {
    return new SegmentLookup(false, false, TieBreak.FAIL);
  }

  public boolean isBefore() {
    return before;
  }

  public boolean isAfter() {
    return after;
  }

  public TieBreak getTieBreak() {
    return tieBreak;
  }

  /**
   * @return the segment to use for {@code date}, or null if none qualifies
   * @throws AmbiguousSegmentException if several segments intersect the date under {@link
   *     TieBreak#FAIL}
   */
  public SegmentRecord find(SegmentRecords records, int date) throws AmbiguousSegmentException {
    List<SegmentRecord> intersecting = new ArrayList<>();
    SegmentRecord firstAfter = null;
    SegmentRecord lastBefore = null;
    for (SegmentRecord record : records) {
      if (record.getStart() <= date && date <= record.getEnd()) {
        intersecting.add(record);
      }
      if (firstAfter == null && record.getStart() >= date) {
        firstAfter = record;
      }
      if (record.getEnd() <= date && !record.hasBreak()) {
        lastBefore = record;
      }
    }

    if (!intersecting.isEmpty()) {
      if (intersecting.size() == 1) {
        return intersecting.get(0);
      }
      switch (tieBreak) {
        case EARLIEST:
          return intersecting.get(0);
        case LATEST:
          return intersecting.get(intersecting.size() - 1);
        default:
          throw new AmbiguousSegmentException(date, intersecting.size());
      }
    }
    if (after && firstAfter != null) {
      return firstAfter;
    }
    if (before) {
      return lastBefore;
    }
    return null;
  }
}
