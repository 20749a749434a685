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

import com.google.common.base.MoreObjects;
import com.google.common.base.Ticker;
import com.google.common.math.LongMath;
import eu.aylett.retry.RetryErrorType;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * The standard {@link RetryTokenBucket}.
 * <p>
 * The first attempt of a call costs {@link Options#initialTryCost} (nothing,
 * by default). Each retry costs {@link Options#retryCost} or
 * {@link Options#timeoutRetryCost} depending on why it's needed, and a retry
 * that goes on to succeed hands its cost back. Capacity also refills over time
 * at {@link #refillUnitsPerSecond()}, measured against a monotonic
 * {@link Ticker}.
 * </p>
 * <p>
 * One bucket should be shared by all the calls made through a single client:
 * it is safe for concurrent use, and capacity always stays between zero and
 * {@link Options#maxCapacity}.
 * </p>
 */
public class StandardRetryTokenBucket implements RetryTokenBucket {
  private static final Logger logger = LoggerFactory.getLogger(StandardRetryTokenBucket.class);
  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private final Options options;
  private final Ticker ticker;
  private final Sleeper sleeper;
  private final ReentrantLock lock = new ReentrantLock();

  // All guarded by lock
  private int capacity;
  private double refillUnitsPerSecond;
  private long lastRefillNanos;

  /**
   * A fully configurable bucket.
   *
   * @param options
   *          capacity, costs and refill rate
   * @param ticker
   *          the monotonic time source used for refilling (mainly for testing)
   * @param sleeper
   *          used to wait for capacity when not in circuit breaker mode (mainly
   *          for testing)
   */
  public StandardRetryTokenBucket(Options options, Ticker ticker, Sleeper sleeper) {
    this.options = options;
    this.ticker = ticker;
    this.sleeper = sleeper;
    this.capacity = options.initialCapacity;
    this.refillUnitsPerSecond = options.refillUnitsPerSecond;
    this.lastRefillNanos = ticker.read();
  }

  public StandardRetryTokenBucket(Options options) {
    this(options, Ticker.systemTicker(), Sleeper.SYSTEM);
  }

  /**
   * A bucket with the default options: 500 units, no refill, and retries cost 5
   * units each.
   */
  public StandardRetryTokenBucket() {
    this(Options.DEFAULT);
  }

  public Options options() {
    return options;
  }

  /**
   * The capacity currently available, after applying any refill due.
   */
  public int capacity() {
    lock.lock();
    try {
      refillCapacity();
      return capacity;
    } finally {
      lock.unlock();
    }
  }

  public double refillUnitsPerSecond() {
    lock.lock();
    try {
      return refillUnitsPerSecond;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public RetryToken acquireToken() throws InterruptedException {
    checkoutCapacity(options.initialTryCost);
    return new StandardRetryToken(options.initialTryCost, options.initialTrySuccessIncrement);
  }

  @Override
  public void updateRefillRate(double unitsPerSecond) {
    checkArgument(unitsPerSecond >= 0 && Double.isFinite(unitsPerSecond),
        "refill rate must be finite and not negative: %s", unitsPerSecond);
    lock.lock();
    try {
      // Everything owed at the old rate is paid out first
      refillCapacity();
      if (refillUnitsPerSecond != unitsPerSecond) {
        logger.debug("Retry capacity refill rate changed from {} to {} units/s", refillUnitsPerSecond, unitsPerSecond);
      }
      refillUnitsPerSecond = unitsPerSecond;
    } finally {
      lock.unlock();
    }
  }

  private void checkoutCapacity(int size) throws InterruptedException {
    if (size == 0) {
      return;
    }
    while (true) {
      long waitNanos;
      lock.lock();
      try {
        refillCapacity();
        if (size <= capacity) {
          capacity -= size;
          return;
        }

        if (options.circuitBreakerMode || refillUnitsPerSecond <= 0) {
          logger.debug("Retry capacity exhausted: requested {}, available {}", size, capacity);
          throw new RetryCapacityExceededException("Insufficient capacity to attempt another retry", size, capacity);
        }

        var missing = size - capacity;
        // Saturates rather than wrapping for very slow refill rates
        var refillNanos = (long) Math.ceil(missing / refillUnitsPerSecond * NANOS_PER_SECOND);
        var readyAt = LongMath.saturatedAdd(lastRefillNanos, LongMath.saturatedAdd(refillNanos, 1));
        waitNanos = Math.max(1, LongMath.saturatedSubtract(readyAt, ticker.read()));
      } finally {
        lock.unlock();
      }

      logger.debug("Waiting {}ns for {} units of retry capacity", waitNanos, size);
      sleeper.sleep(Duration.ofNanos(waitNanos));
    }
  }

  private void returnCapacity(int size) {
    if (size == 0) {
      return;
    }
    lock.lock();
    try {
      refillCapacity();
      capacity = Math.min(options.maxCapacity, capacity + size);
    } finally {
      lock.unlock();
    }
  }

  private void refillCapacity() {
    assert lock.isHeldByCurrentThread();

    var now = ticker.read();
    if (refillUnitsPerSecond <= 0 || capacity >= options.maxCapacity) {
      lastRefillNanos = now;
      return;
    }

    var elapsedNanos = now - lastRefillNanos;
    if (elapsedNanos <= 0) {
      return;
    }

    var units = (long) Math.floor(elapsedNanos / NANOS_PER_SECOND * refillUnitsPerSecond);
    if (units <= 0) {
      return;
    }

    if (capacity + units >= options.maxCapacity) {
      capacity = options.maxCapacity;
      lastRefillNanos = now;
    } else {
      capacity += (int) units;
      // Only advance by the time the whole units account for, so the remainder
      // carries over to the next refill
      lastRefillNanos += (long) (units / refillUnitsPerSecond * NANOS_PER_SECOND);
    }
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return MoreObjects.toStringHelper(this)
          .add("capacity", capacity)
          .add("maxCapacity", options.maxCapacity)
          .add("refillUnitsPerSecond", refillUnitsPerSecond)
          .toString();
    } finally {
      lock.unlock();
    }
  }

  /**
   * A token from a {@link StandardRetryTokenBucket}.
   */
  private final class StandardRetryToken implements RetryToken {
    private final int cost;
    private final int successIncrement;
    private final AtomicBoolean resolved = new AtomicBoolean(false);

    StandardRetryToken(int cost, int successIncrement) {
      this.cost = cost;
      this.successIncrement = successIncrement;
    }

    private void resolve() {
      checkState(resolved.compareAndSet(false, true), "Retry token has already been resolved");
    }

    @Override
    public void notifySuccess() {
      resolve();
      returnCapacity(successIncrement);
    }

    /**
     * Capacity isn't returned on failure, it only comes back through refill.
     */
    @Override
    public void notifyFailure() {
      resolve();
    }

    @Override
    public void notifyCancelled() {
      resolve();
      returnCapacity(cost);
    }

    @Override
    public RetryToken scheduleRetry(RetryErrorType reason) throws InterruptedException {
      resolve();
      var size = switch (reason) {
        case TRANSIENT, THROTTLING -> options.timeoutRetryCost;
        case CLIENT_SIDE, SERVER_SIDE -> options.retryCost;
      };
      checkoutCapacity(size);
      return new StandardRetryToken(size, size);
    }
  }

  /**
   * Immutable configuration for a {@link StandardRetryTokenBucket}.
   */
  public static final class Options {
    /**
     * The default options.
     */
    public static final Options DEFAULT = builder().build();

    /**
     * The most capacity the bucket can hold.
     */
    public final int maxCapacity;
    /**
     * The capacity the bucket starts with.
     */
    public final int initialCapacity;
    /**
     * How much capacity is restored per second. Zero disables refill and forces
     * {@link #circuitBreakerMode}.
     */
    public final double refillUnitsPerSecond;
    /**
     * When {@code true}, running out of capacity fails the retry straight away.
     * When {@code false}, the bucket waits for refill instead.
     */
    public final boolean circuitBreakerMode;
    /**
     * The capacity taken for the first attempt of a call.
     */
    public final int initialTryCost;
    /**
     * The capacity returned when the first attempt of a call succeeds.
     */
    public final int initialTrySuccessIncrement;
    /**
     * The capacity taken for a retry after a client or server error.
     */
    public final int retryCost;
    /**
     * The capacity taken for a retry after a transient or throttling error.
     */
    public final int timeoutRetryCost;

    private Options(Builder builder, int initialCapacity, boolean circuitBreakerMode) {
      this.maxCapacity = builder.maxCapacity;
      this.initialCapacity = initialCapacity;
      this.refillUnitsPerSecond = builder.refillUnitsPerSecond;
      this.circuitBreakerMode = circuitBreakerMode;
      this.initialTryCost = builder.initialTryCost;
      this.initialTrySuccessIncrement = builder.initialTrySuccessIncrement;
      this.retryCost = builder.retryCost;
      this.timeoutRetryCost = builder.timeoutRetryCost;
    }

    @Contract(value = "-> new", pure = true)
    public static Builder builder() {
      return new Builder();
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("maxCapacity", maxCapacity)
          .add("initialCapacity", initialCapacity)
          .add("refillUnitsPerSecond", refillUnitsPerSecond)
          .add("circuitBreakerMode", circuitBreakerMode)
          .add("initialTryCost", initialTryCost)
          .add("initialTrySuccessIncrement", initialTrySuccessIncrement)
          .add("retryCost", retryCost)
          .add("timeoutRetryCost", timeoutRetryCost)
          .toString();
    }

    /**
     * A mutable builder for {@link Options}.
     */
    public static final class Builder {
      private int maxCapacity = 500;
      private @Nullable Integer initialCapacity;
      private double refillUnitsPerSecond = 0;
      private boolean circuitBreakerMode = true;
      private int initialTryCost = 0;
      private int initialTrySuccessIncrement = 0;
      private int retryCost = 5;
      private int timeoutRetryCost = 5;

      private Builder() {
      }

      public Builder maxCapacity(int maxCapacity) {
        this.maxCapacity = maxCapacity;
        return this;
      }

      /**
       * Defaults to {@link #maxCapacity(int)}.
       */
      public Builder initialCapacity(int initialCapacity) {
        this.initialCapacity = initialCapacity;
        return this;
      }

      public Builder refillUnitsPerSecond(double refillUnitsPerSecond) {
        this.refillUnitsPerSecond = refillUnitsPerSecond;
        return this;
      }

      public Builder circuitBreakerMode(boolean circuitBreakerMode) {
        this.circuitBreakerMode = circuitBreakerMode;
        return this;
      }

      public Builder initialTryCost(int initialTryCost) {
        this.initialTryCost = initialTryCost;
        return this;
      }

      public Builder initialTrySuccessIncrement(int initialTrySuccessIncrement) {
        this.initialTrySuccessIncrement = initialTrySuccessIncrement;
        return this;
      }

      public Builder retryCost(int retryCost) {
        this.retryCost = retryCost;
        return this;
      }

      public Builder timeoutRetryCost(int timeoutRetryCost) {
        this.timeoutRetryCost = timeoutRetryCost;
        return this;
      }

      public Options build() {
        checkArgument(maxCapacity > 0, "maxCapacity must be positive: %s", maxCapacity);
        var initial = initialCapacity == null ? maxCapacity : initialCapacity;
        checkArgument(initial >= 0 && initial <= maxCapacity, "initialCapacity must be between 0 and %s: %s",
            maxCapacity, initial);
        checkArgument(refillUnitsPerSecond >= 0 && Double.isFinite(refillUnitsPerSecond),
            "refillUnitsPerSecond must be finite and not negative: %s", refillUnitsPerSecond);
        checkArgument(initialTryCost >= 0, "initialTryCost must not be negative: %s", initialTryCost);
        checkArgument(initialTrySuccessIncrement >= 0, "initialTrySuccessIncrement must not be negative: %s",
            initialTrySuccessIncrement);
        checkArgument(retryCost >= 0, "retryCost must not be negative: %s", retryCost);
        checkArgument(timeoutRetryCost >= 0, "timeoutRetryCost must not be negative: %s", timeoutRetryCost);
        return new Options(this, initial, circuitBreakerMode || refillUnitsPerSecond == 0);
      }
    }
  }
}
