/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.retry.delay;

import com.google.common.base.Ticker;

/**
 * Tracks an exponentially smoothed measurement of how many requests per second
 * are actually being sent.
 * <p>
 * Requests are counted into fixed-length measurement buckets. Whenever at least
 * one whole bucket has gone by, the rate over the elapsed buckets is blended
 * into the measured rate with the configured smoothing factor.
 * </p>
 * <p>
 * Failed requests are also counted separately. That count doesn't affect the
 * rate; it's only reported in {@link AdaptiveRateLimiter#toString()} for
 * diagnostics.
 * </p>
 * <p>
 * Not thread-safe: callers serialize access.
 * </p>
 */
final class AdaptiveRateMeasurer {
  private final AdaptiveRateLimiter.Config config;
  private final Ticker ticker;
  private final long bucketNanos;
  private final double bucketsPerSecond;

  private long lastBucketMarkNanos;
  private int requestCount;
  private long errorSamples;
  private double measuredTxRate;

  AdaptiveRateMeasurer(AdaptiveRateLimiter.Config config, Ticker ticker) {
    this.config = config;
    this.ticker = ticker;
    this.bucketNanos = config.measurementBucketDuration.toNanos();
    this.bucketsPerSecond = 1_000_000_000.0 / bucketNanos;
    this.lastBucketMarkNanos = ticker.read();
  }

  /**
   * Record a completed request and return the measured rate.
   *
   * @param errorSample
   *          whether the request failed; failed requests still count towards
   *          the rate
   */
  double update(boolean errorSample) {
    requestCount++;
    if (errorSample) {
      errorSamples++;
    }

    var elapsedBuckets = (ticker.read() - lastBucketMarkNanos) / bucketNanos;
    if (elapsedBuckets >= 1) {
      var currentRate = requestCount / (double) elapsedBuckets * bucketsPerSecond;
      measuredTxRate = currentRate * config.smoothing + measuredTxRate * (1 - config.smoothing);

      lastBucketMarkNanos += elapsedBuckets * bucketNanos;
      requestCount = 0;
    }

    return measuredTxRate;
  }

  double measuredTxRate() {
    return measuredTxRate;
  }

  /**
   * The number of failed requests recorded, for diagnostics.
   */
  long errorSamples() {
    return errorSamples;
  }
}
