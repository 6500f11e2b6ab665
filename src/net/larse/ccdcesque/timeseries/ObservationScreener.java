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

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.larse.ccdcesque.helper.ConfigurationException;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Drops unusable observations from a pixel's raw series.
 *
 * <p>An observation survives when every spectral band lies within its inclusive [min, max] range
 * and the mask band does not hold one of the invalid codes. The mask band itself is not part of the
 * resulting {@link TimeSeries}; the remaining bands keep their relative order.
 */
public final class ObservationScreener {
  /** Mask band index meaning the observations carry no mask band. */
  public static final int NO_MASK_BAND = -1;

  private final double[] minValues;
  private final double[] maxValues;
  private final int maskBand;
  private final double[] invalidCodes;

  /**
   * @param minValues lower bound of each spectral band (mask band excluded)
   * @param maxValues upper bound of each spectral band (mask band excluded)
   * @param maskBand index of the mask band in the raw observations, or {@link #NO_MASK_BAND}
   * @param invalidCodes mask values that invalidate an observation
   */
  public ObservationScreener(double[] minValues, double[] maxValues, int maskBand,
      double... invalidCodes) {
    if (minValues == null || maxValues == null || minValues.length != maxValues.length) {
      throw new ConfigurationException("min and max ranges must have the same number of bands");
    }
    for (int b = 0; b < minValues.length; b++) {
      if (!(minValues[b] <= maxValues[b])) {
        throw new ConfigurationException(
            "band " + b + " has an empty range [" + minValues[b] + ", " + maxValues[b] + "]");
      }
    }
    if (maskBand < NO_MASK_BAND || maskBand > minValues.length) {
      throw new ConfigurationException("invalid mask band index " + maskBand);
    }
    this.minValues = minValues.clone();
    this.maxValues = maxValues.clone();
    this.maskBand = maskBand;
    this.invalidCodes = invalidCodes == null ? new double[0] : invalidCodes.clone();
  }

  /** Range-only screener for observations without a mask band. */
  public ObservationScreener(double[] minValues, double[] maxValues) {
    this(minValues, maxValues, NO_MASK_BAND);
  }

  public int getMaskBand() {
    return maskBand;
  }

  /** Number of spectral bands the screened series will carry. */
  public int numBands() {
    return minValues.length;
  }

  /**
   * @throws IllegalArgumentException if the observations do not carry one band per range plus the
   *     mask band
   */
  public TimeSeries screen(PixelObservations obs) {
    int expected = minValues.length + (maskBand == NO_MASK_BAND ? 0 : 1);
    Preconditions.checkArgument(obs.numBands() == expected,
        "observations have %s bands, screener is configured for %s", obs.numBands(), expected);

    IntArrayList kept = new IntArrayList(obs.size());
    for (int i = 0; i < obs.size(); i++) {
      if (isValid(obs, i)) {
        kept.add(i);
      }
    }

    int[] dates = new int[kept.size()];
    double[][] y = new double[minValues.length][kept.size()];
    for (int k = 0; k < kept.size(); k++) {
      int i = kept.getInt(k);
      dates[k] = obs.date(i);
      int band = 0;
      for (int b = 0; b < obs.numBands(); b++) {
        if (b != maskBand) {
          y[band++][k] = obs.value(b, i);
        }
      }
    }
    return new TimeSeries(obs.getPx(), obs.getPy(), dates, y);
  }

  private boolean isValid(PixelObservations obs, int i) {
    if (maskBand != NO_MASK_BAND && ArrayUtils.contains(invalidCodes, obs.value(maskBand, i))) {
      return false;
    }
    int band = 0;
    for (int b = 0; b < obs.numBands(); b++) {
      if (b == maskBand) {
        continue;
      }
      double v = obs.value(b, i);
      // NaN fails both comparisons.
      if (!(v >= minValues[band] && v <= maxValues[band])) {
        return false;
      }
      band++;
    }
    return true;
  }
}
