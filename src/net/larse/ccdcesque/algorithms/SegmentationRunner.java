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
package net.larse.ccdcesque.algorithms;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import net.larse.ccdcesque.helper.ConfigurationException;
import net.larse.ccdcesque.record.SegmentRecords;
import net.larse.ccdcesque.timeseries.ObservationScreener;
import net.larse.ccdcesque.timeseries.PixelObservations;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Screens and segments many pixels on a fixed thread pool.
 *
 * <p>A pixel whose data makes screening or detection fail is logged and skipped; the rest of the
 * batch carries on. A {@link ConfigurationException} aborts the whole batch.
 */
public class SegmentationRunner {
  private static final Logger logger = LogManager.getLogger(SegmentationRunner.class);

  /** Outcome of one pixel. */
  public static final class PixelResult {
    private final int px;
    private final int py;
    private final SegmentRecords records;
    private final String error;

    private PixelResult(int px, int py, SegmentRecords records, String error) {
      this.px = px;
      this.py = py;
      this.records = records;
      this.error = error;
    }

    public int getPx() {
      return px;
    }

    public int getPy() {
      return py;
    }

    /** The pixel's segments; empty for a skipped pixel. */
    public SegmentRecords getRecords() {
      return records;
    }

    public boolean isSkipped() {
      return error != null;
    }

    /** Why the pixel was skipped, or null. */
    public String getError() {
      return error;
    }
  }

  private final ObservationScreener screener;
  private final Ccdcesque detector;
  private final int numThreads;

  public SegmentationRunner(ObservationScreener screener, Ccdcesque detector, int numThreads) {
    Preconditions.checkArgument(numThreads > 0, "numThreads must be positive");
    this.screener = Preconditions.checkNotNull(screener);
    this.detector = Preconditions.checkNotNull(detector);
    this.numThreads = numThreads;
  }

  public SegmentationRunner(ObservationScreener screener, Ccdcesque detector) {
    this(screener, detector, Runtime.getRuntime().availableProcessors());
  }

  /**
   * Segment every pixel.
   *
   * @return one result per pixel, in input order
   * @throws ConfigurationException if the configuration does not fit the observations
   */
  public List<PixelResult> run(List<PixelObservations> pixels) {
    logger.info("segmenting {} pixels on {} threads", pixels.size(), numThreads);
    ExecutorService executor =
        Executors.newFixedThreadPool(Math.max(1, Math.min(numThreads, pixels.size())));
    AtomicBoolean aborted = new AtomicBoolean(false);
    try {
      List<Future<SegmentRecords>> futures = new ArrayList<>();
      for (PixelObservations pixel : pixels) {
        futures.add(executor.submit(
            () -> detector.getResult(screener.screen(pixel), aborted::get)));
      }

      List<PixelResult> results = new ArrayList<>(pixels.size());
      int skipped = 0;
      for (int i = 0; i < futures.size(); i++) {
        PixelObservations pixel = pixels.get(i);
        try {
          results.add(new PixelResult(pixel.getPx(), pixel.getPy(), futures.get(i).get(), null));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          aborted.set(true);
          throw new IllegalStateException("segmentation interrupted", e);
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof ConfigurationException) {
            aborted.set(true);
            throw (ConfigurationException) cause;
          }
          logger.warn("skipping pixel ({}, {}): {}", pixel.getPx(), pixel.getPy(),
              cause.toString());
          results.add(new PixelResult(pixel.getPx(), pixel.getPy(), new SegmentRecords(),
              cause.toString()));
          skipped++;
        }
      }
      logger.info("segmented {} pixels, skipped {}", results.size() - skipped, skipped);
      return ImmutableList.copyOf(results);
    } finally {
      executor.shutdownNow();
    }
  }
}
