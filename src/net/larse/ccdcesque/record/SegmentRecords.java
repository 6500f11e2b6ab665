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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/** Append-only, temporally ordered segments of one pixel. */
public final class SegmentRecords implements Iterable<SegmentRecord> {
  private final List<SegmentRecord> records = new ArrayList<>();

  public SegmentRecords() {}

  /**
   * @throws IllegalArgumentException if the record starts before the previous record ends
   */
  public void append(SegmentRecord record) {
    Preconditions.checkNotNull(record);
    if (!records.isEmpty()) {
      SegmentRecord last = records.get(records.size() - 1);
      Preconditions.checkArgument(last.getEnd() <= record.getStart(),
          "segment starting at %s overlaps the previous one ending at %s",
          record.getStart(), last.getEnd());
    }
    records.add(record);
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  public SegmentRecord get(int i) {
    return records.get(i);
  }

  /** Unmodifiable view in temporal order. */
  public List<SegmentRecord> asList() {
    return Collections.unmodifiableList(records);
  }

  @Override
  public Iterator<SegmentRecord> iterator() {
    return asList().iterator();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SegmentRecords && records.equals(((SegmentRecords) o).records);
  }

  @Override
  public int hashCode() {
    return records.hashCode();
  }

  @Override
  public String toString() {
    return records.toString();
  }
}
