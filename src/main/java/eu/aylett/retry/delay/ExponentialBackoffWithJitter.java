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
import org.jetbrains.annotations.Contract;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Exponential backoff, capped at a maximum and scaled down by a random jitter
 * factor.
 * <p>
 * The base delay for attempt {@code n} is
 * {@code min(maxBackoff, initialDelay * scaleFactor^(n - 1))}. The returned
 * delay is the base delay multiplied by a random factor drawn from
 * {@code [1 - jitter, 1)}, so a jitter of 0 gives a deterministic series.
 * </p>
 */
public final class ExponentialBackoffWithJitter implements DelayProvider {
  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private final Options options;
  private final DoubleSupplier randomSource;

  /**
   * A fully configurable delay provider.
   *
   * @param options
   *          the backoff parameters
   * @param randomSource
   *          supplies uniformly distributed values in {@code [0, 1)} (mainly for
   *          testing)
   */
  public ExponentialBackoffWithJitter(Options options, DoubleSupplier randomSource) {
    this.options = options;
    this.randomSource = randomSource;
  }

  public ExponentialBackoffWithJitter(Options options) {
    this(options, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Backoff with the default options.
   */
  public ExponentialBackoffWithJitter() {
    this(Options.DEFAULT);
  }

  public Options options() {
    return options;
  }

  @Override
  public Duration backoff(int attempt) {
    checkArgument(attempt > 0, "attempt must be positive: %s", attempt);

    var maxSeconds = seconds(options.maxBackoff);
    var baseSeconds = Math.min(maxSeconds,
        seconds(options.initialDelay) * Math.pow(options.scaleFactor, attempt - 1));

    var jitteredSeconds = baseSeconds;
    if (options.jitter > 0) {
      var factor = (1.0 - options.jitter) + options.jitter * randomSource.getAsDouble();
      jitteredSeconds = baseSeconds * factor;
    }

    var nanos = jitteredSeconds * NANOS_PER_SECOND;
    if (nanos >= Long.MAX_VALUE) {
      return options.maxBackoff;
    }
    return Duration.ofNanos(Math.round(nanos));
  }

  private static double seconds(Duration duration) {
    return duration.getSeconds() + duration.getNano() / NANOS_PER_SECOND;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("options", options).toString();
  }

  /**
   * Immutable parameters for {@link ExponentialBackoffWithJitter}.
   */
  public static final class Options {
    /**
     * 10ms initial delay, growing by 1.5x per attempt up to 20s, with full
     * jitter.
     */
    public static final Options DEFAULT = builder().build();

    /**
     * The base delay before the first retry.
     */
    public final Duration initialDelay;
    /**
     * How much the base delay grows per attempt.
     */
    public final double scaleFactor;
    /**
     * The fraction of the delay that may be removed at random, between 0 (no
     * jitter) and 1 (the delay is anywhere up to the base delay).
     */
    public final double jitter;
    /**
     * The upper bound on any delay.
     */
    public final Duration maxBackoff;

    private Options(Builder builder) {
      this.initialDelay = builder.initialDelay;
      this.scaleFactor = builder.scaleFactor;
      this.jitter = builder.jitter;
      this.maxBackoff = builder.maxBackoff;
    }

    @Contract(value = "-> new", pure = true)
    public static Builder builder() {
      return new Builder();
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("initialDelay", initialDelay)
          .add("scaleFactor", scaleFactor)
          .add("jitter", jitter)
          .add("maxBackoff", maxBackoff)
          .toString();
    }

    /**
     * A mutable builder for {@link Options}.
     */
    public static final class Builder {
      private Duration initialDelay = Duration.ofMillis(10);
      private double scaleFactor = 1.5;
      private double jitter = 1.0;
      private Duration maxBackoff = Duration.ofSeconds(20);

      private Builder() {
      }

      public Builder initialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
        return this;
      }

      public Builder scaleFactor(double scaleFactor) {
        this.scaleFactor = scaleFactor;
        return this;
      }

      public Builder jitter(double jitter) {
        this.jitter = jitter;
        return this;
      }

      public Builder maxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
        return this;
      }

      public Options build() {
        checkArgument(!initialDelay.isNegative(), "initialDelay must not be negative: %s", initialDelay);
        checkArgument(scaleFactor >= 1.0, "scaleFactor must be at least 1: %s", scaleFactor);
        checkArgument(jitter >= 0.0 && jitter <= 1.0, "jitter must be between 0 and 1: %s", jitter);
        checkArgument(!maxBackoff.isNegative(), "maxBackoff must not be negative: %s", maxBackoff);
        return new Options(this);
      }
    }
  }
}
