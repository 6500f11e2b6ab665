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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.Set;
import net.larse.ccdcesque.helper.ConfigurationException;
import net.larse.ccdcesque.timeseries.DesignMatrixBuilder;

/**
 * Flattens selected coefficients of a segment for mapping.
 *
 * <p>Values are ordered coefficient-major, then band, followed by one RMSE per band when the
 * {@link CoefficientGroup#RMSE} group is selected. The intercept is normalized to the midpoint of
 * the segment, {@code intercept + slope * (start + end) / 2}, so that it describes the segment's
 * mean level instead of the value at date 0. With {@code useRobust} the bisquare coefficients and
 * RMSE are exported instead.
 */
public class CoefficientExporter {
  private final DesignMatrixBuilder design;
  private final int[] bands;
  private final int[] coefficients;
  private final boolean rmse;
  private final boolean useRobust;
  private final ImmutableList<String> bandNames;

  /**
   * @param bands zero based indices of the bands to export
   * @throws ConfigurationException if the design has no intercept, no band or group is selected,
   *     or a band index is negative
   */
  public CoefficientExporter(DesignMatrixBuilder design, int[] bands,
      Set<CoefficientGroup> groups) {
    this(design, bands, groups, false);
  }

  /**
   * @param useRobust export the bisquare coefficients and RMSE of each record
   */
  public CoefficientExporter(DesignMatrixBuilder design, int[] bands,
      Set<CoefficientGroup> groups, boolean useRobust) {
    if (design.interceptIndex() < 0) {
      throw new ConfigurationException("coefficient export needs an intercept term");
    }
    if (bands == null || bands.length == 0) {
      throw new ConfigurationException("at least one band must be exported");
    }
    for (int b : bands) {
      if (b < 0) {
        throw new ConfigurationException("negative band index " + b);
      }
    }
    if (groups == null || groups.isEmpty()) {
      throw new ConfigurationException("at least one coefficient group must be exported");
    }
    Set<CoefficientGroup> selected = ImmutableSet.copyOf(groups);
    this.design = design;
    this.bands = bands.clone();
    this.rmse = selected.contains(CoefficientGroup.RMSE);
    this.useRobust = useRobust;

    boolean all = selected.contains(CoefficientGroup.ALL);
    int[] seasonal = design.seasonalColumns();
    IntArrayList columns = new IntArrayList();
    for (int j = 0; j < design.numFeatures(); j++) {
      boolean seasonalColumn = false;
      for (int s : seasonal) {
        seasonalColumn |= s == j;
      }
      if (all
          || (j == design.interceptIndex() && selected.contains(CoefficientGroup.INTERCEPT))
          || (j == design.slopeIndex() && selected.contains(CoefficientGroup.SLOPE))
          || (seasonalColumn && selected.contains(CoefficientGroup.SEASONALITY))) {
        columns.add(j);
      }
    }
    this.coefficients = columns.toIntArray();

    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int c : coefficients) {
      for (int b : bands) {
        names.add("B" + (b + 1) + "_beta" + c);
      }
    }
    if (rmse) {
      for (int b : bands) {
        names.add("B" + (b + 1) + "_RMSE");
      }
    }
    this.bandNames = names.build();
  }

  /** Design columns that are exported, in design order. */
  public int[] coefficientIndices() {
    return coefficients.clone();
  }

  /** One name per exported value. */
  public ImmutableList<String> bandNames() {
    return bandNames;
  }

  public boolean isUseRobust() {
    return useRobust;
  }

  /**
   * @throws IllegalArgumentException if robust values are requested and the record has none, or
   *     the record lacks an exported band
   */
  public double[] export(SegmentRecord record) {
    Preconditions.checkArgument(!useRobust || record.hasRobust(),
        "record starting at %s has no robust coefficients", record.getStart());
    for (int b : bands) {
      Preconditions.checkArgument(b < record.numBands(), "record has no band %s", b);
    }
    double[] result = new double[bandNames.size()];
    int intercept = design.interceptIndex();
    int slope = design.slopeIndex();
    double mid = (record.getStart() + (double) record.getEnd()) / 2.0;

    int k = 0;
    for (int c : coefficients) {
      for (int b : bands) {
        double v = record.getCoef(c, b, useRobust);
        if (c == intercept && slope >= 0) {
          v += record.getCoef(slope, b, useRobust) * mid;
        }
        result[k++] = v;
      }
    }
    if (rmse) {
      for (int b : bands) {
        result[k++] = record.getRmse(b, useRobust);
      }
    }
    return result;
  }
}
