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

import java.util.Objects;

/**
 * One term of the regression design: the intercept, the linear slope on the ordinal date, or a
 * pair of sine/cosine columns at a harmonic frequency of the year.
 */
public final class DesignTerm {
  public enum Kind {
    INTERCEPT,
    SLOPE,
    HARMONIC
  }

  public static final DesignTerm INTERCEPT = new DesignTerm(Kind.INTERCEPT, 0);
  public static final DesignTerm SLOPE = new DesignTerm(Kind.SLOPE, 0);

  private final Kind kind;
  private final int frequency;

  private DesignTerm(Kind kind, int frequency) {
    this.kind = kind;
    this.frequency = frequency;
  }

  /** Sine and cosine columns completing {@code frequency} cycles per year. */
  public static DesignTerm harmonic(int frequency) {
    return new DesignTerm(Kind.HARMONIC, frequency);
  }

  public Kind getKind() {
    return kind;
  }

  public int getFrequency() {
    return frequency;
  }

  /** Number of design columns this term expands to. */
  public int width() {
    return kind == Kind.HARMONIC ? 2 : 1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DesignTerm)) {
      return false;
    }
    DesignTerm other = (DesignTerm) o;
    return kind == other.kind && frequency == other.frequency;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, frequency);
  }

  @Override
  public String toString() {
    return kind == Kind.HARMONIC ? "harmonic(" + frequency + ")" : kind.name().toLowerCase();
  }
}
