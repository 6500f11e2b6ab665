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

import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.larse.ccdcesque.helper.ConfigurationException;
import org.ejml.data.DenseMatrix64F;

/**
 * Turns ordinal dates into regression design rows.
 *
 * <p>Columns follow the order of the configured terms. A harmonic term of frequency k expands to
 * {@code sin(k * OMEGA * t)} followed by {@code cos(k * OMEGA * t)}, with OMEGA = 2 pi / 365.25.
 * The slope column holds the raw ordinal date, so coefficients are referenced to date 0.
 */
public final class DesignMatrixBuilder {
  // number of days in a year
  public static final double SIZE_OF_A_YEAR = 365.25;

  // Harmonic scaling term.
  public static final double OMEGA = 2.0 * Math.PI / SIZE_OF_A_YEAR;

  private final ImmutableList<DesignTerm> terms;
  private final ImmutableList<String> columnNames;
  private final int slopeIndex;
  private final int interceptIndex;
  private final int[] seasonalColumns;
  private final int[] frequencies;

  /**
   * @throws ConfigurationException if there is no slope term, duplicated intercept or slope
   *     terms, or a non-positive or repeated harmonic frequency
   */
  public DesignMatrixBuilder(List<DesignTerm> terms) {
    if (terms == null || terms.isEmpty()) {
      throw new ConfigurationException("design must have at least one term");
    }
    this.terms = ImmutableList.copyOf(terms);

    List<String> names = new ArrayList<>();
    IntArrayList seasonal = new IntArrayList();
    IntArrayList freqs = new IntArrayList();
    Set<Integer> seen = new HashSet<>();
    int slope = -1;
    int intercept = -1;
    int column = 0;
    for (DesignTerm term : this.terms) {
      switch (term.getKind()) {
        case INTERCEPT:
          if (intercept >= 0) {
            throw new ConfigurationException("design has more than one intercept term");
          }
          intercept = column;
          names.add("intercept");
          break;
        case SLOPE:
          if (slope >= 0) {
            throw new ConfigurationException("design has more than one slope term");
          }
          slope = column;
          names.add("slope");
          break;
        case HARMONIC:
          int k = term.getFrequency();
          if (k <= 0) {
            throw new ConfigurationException("harmonic frequency must be positive, got " + k);
          }
          if (!seen.add(k)) {
            throw new ConfigurationException("harmonic frequency " + k + " is repeated");
          }
          freqs.add(k);
          seasonal.add(column);
          seasonal.add(column + 1);
          names.add("sin" + k);
          names.add("cos" + k);
          break;
        default:
          throw new AssertionError(term);
      }
      column += term.width();
    }
    if (slope < 0) {
      throw new ConfigurationException("design must include a slope term");
    }

    this.slopeIndex = slope;
    this.interceptIndex = intercept;
    this.columnNames = ImmutableList.copyOf(names);
    this.seasonalColumns = seasonal.toIntArray();
    this.frequencies = freqs.toIntArray();
  }

  /** Intercept, slope and one harmonic term per frequency, in that order. */
  public static DesignMatrixBuilder harmonic(int... frequencies) {
    List<DesignTerm> terms = new ArrayList<>();
    terms.add(DesignTerm.INTERCEPT);
    terms.add(DesignTerm.SLOPE);
    for (int k : frequencies) {
      terms.add(DesignTerm.harmonic(k));
    }
    return new DesignMatrixBuilder(terms);
  }

  public ImmutableList<DesignTerm> getTerms() {
    return terms;
  }

  public int numFeatures() {
    return columnNames.size();
  }

  public ImmutableList<String> columnNames() {
    return columnNames;
  }

  public int slopeIndex() {
    return slopeIndex;
  }

  /** Column of the intercept, or -1 if the design has none. */
  public int interceptIndex() {
    return interceptIndex;
  }

  /** Columns of the sine/cosine terms. */
  public int[] seasonalColumns() {
    return seasonalColumns.clone();
  }

  public int[] harmonicFrequencies() {
    return frequencies.clone();
  }

  /** One design row per date. */
  public DenseMatrix64F build(int[] dates) {
    return build(dates, dates.length);
  }

  /** Design rows for the first {@code length} dates. */
  public DenseMatrix64F build(int[] dates, int length) {
    DenseMatrix64F x = new DenseMatrix64F(length, numFeatures());
    double[] row = new double[numFeatures()];
    for (int i = 0; i < length; i++) {
      fillRow(dates[i], row);
      for (int j = 0; j < row.length; j++) {
        x.set(i, j, row[j]);
      }
    }
    return x;
  }

  public double[] row(int date) {
    double[] row = new double[numFeatures()];
    fillRow(date, row);
    return row;
  }

  private void fillRow(int date, double[] row) {
    int column = 0;
    for (DesignTerm term : terms) {
      switch (term.getKind()) {
        case INTERCEPT:
          row[column] = 1.0;
          break;
        case SLOPE:
          row[column] = date;
          break;
        case HARMONIC:
          double rx = term.getFrequency() * OMEGA * date;
          row[column] = Math.sin(rx);
          row[column + 1] = Math.cos(rx);
          break;
        default:
          throw new AssertionError(term);
      }
      column += term.width();
    }
  }

  @Override
  public String toString() {
    return "DesignMatrixBuilder" + terms;
  }
}
