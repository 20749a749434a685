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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Ticker;
import com.google.common.math.LongMath;
import eu.aylett.retry.RetryErrorType;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A client-side send rate limiter that adapts to throttling.
 * <p>
 * Every completed call is fed to {@link #update(RetryErrorType)}, which
 * measures the rate requests are actually being sent at and works out a new
 * allowed rate along a cubic curve: throttling responses cut the rate back,
 * successes let it climb towards (and eventually past) the rate that was last
 * throttled. The allowed rate is exposed as {@link #refillUnitsPerSecond()} so
 * that it can drive a {@link RetryTokenBucket}.
 * </p>
 * <p>
 * Once the first throttle has been seen, {@link #acquire(int)} also paces
 * attempts to the allowed rate. Before then it never waits.
 * </p>
 * <p>
 * One limiter should be shared by all the calls made through a single client.
 * All methods are thread-safe.
 * </p>
 */
public class AdaptiveRateLimiter {
  private static final Logger logger = LoggerFactory.getLogger(AdaptiveRateLimiter.class);
  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private final Config config;
  private final Ticker ticker;
  private final Sleeper sleeper;
  private final AdaptiveRateMeasurer rateMeasurer;
  private final CubicRateCalculator rateCalculator;

  // All guarded by this
  private boolean throttlingEnabled = false;
  private double refillUnitsPerSecond = 0.0;
  private double capacity = 0.0;
  private double maxCapacity = 0.0;
  private @Nullable Long lastRefillNanos;

  @VisibleForTesting
  AdaptiveRateLimiter(Config config, Ticker ticker, Sleeper sleeper, AdaptiveRateMeasurer rateMeasurer,
      CubicRateCalculator rateCalculator) {
    this.config = config;
    this.ticker = ticker;
    this.sleeper = sleeper;
    this.rateMeasurer = rateMeasurer;
    this.rateCalculator = rateCalculator;
  }

  /**
   * A fully configurable limiter.
   *
   * @param config
   *          the tuning parameters
   * @param ticker
   *          the monotonic time source (mainly for testing)
   * @param sleeper
   *          used to wait for send permits (mainly for testing)
   */
  public AdaptiveRateLimiter(Config config, Ticker ticker, Sleeper sleeper) {
    this(config, ticker, sleeper, new AdaptiveRateMeasurer(config, ticker), new CubicRateCalculator(config, ticker));
  }

  public AdaptiveRateLimiter(Config config) {
    this(config, Ticker.systemTicker(), Sleeper.SYSTEM);
  }

  /**
   * A limiter with the default configuration.
   */
  public AdaptiveRateLimiter() {
    this(Config.DEFAULT);
  }

  public Config config() {
    return config;
  }

  /**
   * Take send permits, waiting for them if the limiter is pacing requests.
   *
   * @param cost
   *          the number of permits needed
   * @throws InterruptedException
   *           if interrupted while waiting
   */
  public void acquire(int cost) throws InterruptedException {
    checkArgument(cost >= 0, "cost must not be negative: %s", cost);
    long waitNanos;
    long availableFrom;
    long readyAt;
    double usedCapacity;
    synchronized (this) {
      if (!throttlingEnabled) {
        return;
      }
      refillCapacity();
      if (cost <= capacity) {
        capacity -= cost;
        return;
      }

      // Reserve the refill we're about to wait for
      usedCapacity = capacity;
      var now = ticker.read();
      availableFrom = lastRefillNanos == null ? now : Math.max(now, lastRefillNanos);
      var reservedNanos = (long) Math.ceil((cost - usedCapacity) / refillUnitsPerSecond * NANOS_PER_SECOND);
      readyAt = LongMath.saturatedAdd(availableFrom, reservedNanos);
      capacity = 0.0;
      lastRefillNanos = readyAt;
      waitNanos = LongMath.saturatedSubtract(readyAt, now);
    }

    logger.debug("Waiting {}ns for {} send permits", waitNanos, cost);
    try {
      sleeper.sleep(Duration.ofNanos(waitNanos));
    } catch (InterruptedException e) {
      releaseReservation(availableFrom, readyAt, usedCapacity);
      throw e;
    }
  }

  /**
   * Undo the reservation made by an interrupted {@link #acquire(int)}, so later
   * callers don't queue behind permits nobody will use. Only the latest
   * reservation can be undone: waits reserved behind it were worked out
   * assuming it, and are left alone.
   */
  private synchronized void releaseReservation(long availableFrom, long readyAt, double usedCapacity) {
    if (lastRefillNanos == null || lastRefillNanos != readyAt) {
      return;
    }
    lastRefillNanos = availableFrom;
    capacity = Math.min(maxCapacity, capacity + usedCapacity);
    logger.debug("Released send permits reserved until {}ns", readyAt);
  }

  /**
   * Record the outcome of a call and work out a new allowed rate.
   *
   * @param errorType
   *          the kind of failure, or {@code null} if the call wasn't retried
   *          because of an error
   * @return the new allowed rate, in requests per second
   */
  public synchronized double update(@Nullable RetryErrorType errorType) {
    var measuredTxRate = rateMeasurer.update(errorType != null);

    double calculatedRate;
    if (errorType == RetryErrorType.THROTTLING) {
      var rateToThrottle = throttlingEnabled ? Math.min(measuredTxRate, refillUnitsPerSecond) : measuredTxRate;
      throttlingEnabled = true;
      calculatedRate = rateCalculator.cubicThrottle(rateToThrottle);
      logger.debug("Throttled at {} requests/s, backing off to {}", rateToThrottle, calculatedRate);
    } else {
      calculatedRate = rateCalculator.cubicSuccess();
    }

    var newRate = Math.min(calculatedRate, 2 * measuredTxRate);
    updateRefillRate(newRate);
    return refillUnitsPerSecond;
  }

  private void updateRefillRate(double newRate) {
    refillCapacity();
    refillUnitsPerSecond = Math.max(newRate, config.minFillRate);
    maxCapacity = Math.max(newRate, config.minCapacity);
    capacity = Math.min(capacity, maxCapacity);
  }

  private void refillCapacity() {
    var now = ticker.read();
    if (lastRefillNanos != null) {
      // A reservation can leave the mark in the future
      var elapsedNanos = Math.max(0, now - lastRefillNanos);
      capacity = Math.min(maxCapacity, capacity + refillUnitsPerSecond * elapsedNanos / NANOS_PER_SECOND);
      lastRefillNanos = Math.max(now, lastRefillNanos);
    } else {
      lastRefillNanos = now;
    }
  }

  /**
   * The currently allowed rate, in requests per second.
   */
  public synchronized double refillUnitsPerSecond() {
    return refillUnitsPerSecond;
  }

  /**
   * The most recently measured rate of requests actually sent, per second.
   */
  public synchronized double measuredTxRate() {
    return rateMeasurer.measuredTxRate();
  }

  /**
   * Whether a throttle has been seen, so {@link #acquire(int)} is pacing
   * requests.
   */
  public synchronized boolean throttlingEnabled() {
    return throttlingEnabled;
  }

  @Override
  public synchronized String toString() {
    return MoreObjects.toStringHelper(this)
        .add("refillUnitsPerSecond", refillUnitsPerSecond)
        .add("measuredTxRate", rateMeasurer.measuredTxRate())
        .add("lastMaxRate", rateCalculator.lastMaxRate())
        .add("errorSamples", rateMeasurer.errorSamples())
        .add("throttlingEnabled", throttlingEnabled)
        .toString();
  }

  /**
   * Immutable tuning parameters for an {@link AdaptiveRateLimiter}.
   * <p>
   * The defaults are the usual TCP Cubic parameters; changing them is rarely a
   * good idea.
   * </p>
   */
  public static final class Config {
    /**
     * The default configuration.
     */
    public static final Config DEFAULT = builder().build();

    /**
     * The fraction of the rate kept after a throttle. Defaults to 0.7.
     */
    public final double beta;
    /**
     * The cubic scaling constant {@code C}: how aggressively the rate grows back
     * after a throttle. Defaults to 0.4.
     */
    public final double scaleConstant;
    /**
     * The weight given to each new rate sample when smoothing the measured rate.
     * Defaults to 0.8.
     */
    public final double smoothing;
    /**
     * The length of each bucket requests are counted into when measuring the
     * rate. Defaults to 500ms.
     */
    public final Duration measurementBucketDuration;
    /**
     * The lowest allowed rate, per second. Defaults to 0.5.
     */
    public final double minFillRate;
    /**
     * The lowest number of send permits the limiter holds. Defaults to 1.
     */
    public final double minCapacity;

    private Config(Builder builder) {
      this.beta = builder.beta;
      this.scaleConstant = builder.scaleConstant;
      this.smoothing = builder.smoothing;
      this.measurementBucketDuration = builder.measurementBucketDuration;
      this.minFillRate = builder.minFillRate;
      this.minCapacity = builder.minCapacity;
    }

    @Contract(value = "-> new", pure = true)
    public static Builder builder() {
      return new Builder();
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("beta", beta)
          .add("scaleConstant", scaleConstant)
          .add("smoothing", smoothing)
          .add("measurementBucketDuration", measurementBucketDuration)
          .add("minFillRate", minFillRate)
          .add("minCapacity", minCapacity)
          .toString();
    }

    /**
     * A mutable builder for {@link Config}.
     */
    public static final class Builder {
      private double beta = 0.7;
      private double scaleConstant = 0.4;
      private double smoothing = 0.8;
      private Duration measurementBucketDuration = Duration.ofMillis(500);
      private double minFillRate = 0.5;
      private double minCapacity = 1.0;

      private Builder() {
      }

      public Builder beta(double beta) {
        this.beta = beta;
        return this;
      }

      public Builder scaleConstant(double scaleConstant) {
        this.scaleConstant = scaleConstant;
        return this;
      }

      public Builder smoothing(double smoothing) {
        this.smoothing = smoothing;
        return this;
      }

      public Builder measurementBucketDuration(Duration measurementBucketDuration) {
        this.measurementBucketDuration = measurementBucketDuration;
        return this;
      }

      public Builder minFillRate(double minFillRate) {
        this.minFillRate = minFillRate;
        return this;
      }

      public Builder minCapacity(double minCapacity) {
        this.minCapacity = minCapacity;
        return this;
      }

      public Config build() {
        checkArgument(beta > 0 && beta < 1, "beta must be between 0 and 1: %s", beta);
        checkArgument(scaleConstant > 0, "scaleConstant must be positive: %s", scaleConstant);
        checkArgument(smoothing > 0 && smoothing <= 1, "smoothing must be in (0, 1]: %s", smoothing);
        checkArgument(!measurementBucketDuration.isNegative() && !measurementBucketDuration.isZero(),
            "measurementBucketDuration must be positive: %s", measurementBucketDuration);
        checkArgument(minFillRate > 0, "minFillRate must be positive: %s", minFillRate);
        checkArgument(minCapacity > 0, "minCapacity must be positive: %s", minCapacity);
        return new Config(this);
      }
    }
  }
}
