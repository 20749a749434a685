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
 * Works out a new send rate along a TCP Cubic curve.
 * <p>
 * A throttle cuts the rate to {@code beta} of what it was, and remembers the
 * old rate as {@code lastMaxRate}. Successes then grow the rate along
 * {@code C * (t - K)^3 + lastMaxRate}: quickly at first, levelling off around
 * the old maximum at {@code t = K}, then probing beyond it.
 * </p>
 * <p>
 * Not thread-safe: callers serialize access.
 * </p>
 */
final class CubicRateCalculator {
  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private final AdaptiveRateLimiter.Config config;
  private final Ticker ticker;

  private double lastMaxRate;
  private long lastThrottleNanos;
  private double inflectionPoint;

  CubicRateCalculator(AdaptiveRateLimiter.Config config, Ticker ticker, double lastMaxRate, long lastThrottleNanos) {
    this.config = config;
    this.ticker = ticker;
    this.lastMaxRate = lastMaxRate;
    this.lastThrottleNanos = lastThrottleNanos;
    this.inflectionPoint = calculateInflectionPoint();
  }

  CubicRateCalculator(AdaptiveRateLimiter.Config config, Ticker ticker) {
    this(config, ticker, 0.0, ticker.read());
  }

  /**
   * Seconds since the last throttle.
   */
  double calculateTimeWindow() {
    return (ticker.read() - lastThrottleNanos) / NANOS_PER_SECOND;
  }

  /**
   * The point, in seconds after a throttle, where the curve regains
   * {@code lastMaxRate}.
   */
  private double calculateInflectionPoint() {
    return Math.cbrt(lastMaxRate * (1 - config.beta) / config.scaleConstant);
  }

  double cubicSuccess() {
    var t = calculateTimeWindow();
    return config.scaleConstant * Math.pow(t - inflectionPoint, 3) + lastMaxRate;
  }

  /**
   * Record a throttle at the given rate, which becomes the new
   * {@code lastMaxRate}.
   *
   * @return the reduced rate
   */
  double cubicThrottle(double rate) {
    lastMaxRate = rate;
    lastThrottleNanos = ticker.read();
    inflectionPoint = calculateInflectionPoint();
    return rate * config.beta;
  }

  double lastMaxRate() {
    return lastMaxRate;
  }
}
