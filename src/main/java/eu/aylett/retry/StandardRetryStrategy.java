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

package eu.aylett.retry;

import com.google.common.base.MoreObjects;
import eu.aylett.retry.delay.DelayProvider;
import eu.aylett.retry.delay.ExponentialBackoffWithJitter;
import eu.aylett.retry.delay.RetryCapacityExceededException;
import eu.aylett.retry.delay.RetryToken;
import eu.aylett.retry.delay.RetryTokenBucket;
import eu.aylett.retry.delay.Sleeper;
import eu.aylett.retry.delay.StandardRetryTokenBucket;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

import static com.google.common.base.Preconditions.checkArgument;
import static eu.aylett.retry.SneakyThrows.sneakyThrow;

/**
 * A retry strategy that spaces retries out with a {@link DelayProvider} and
 * pays for them from a {@link RetryTokenBucket}.
 * <p>
 * Each failed attempt the policy wants retried first takes capacity from the
 * bucket, then waits for the backoff delay. If the bucket can't pay, the call
 * fails at once rather than waiting. The first attempt is never delayed.
 * </p>
 * <p>
 * One strategy, and so one bucket, should be used for each client. Sharing a
 * bucket between calls is what stops a failing service from being buried
 * under retries.
 * </p>
 */
public class StandardRetryStrategy implements RetryStrategy {
  private static final Logger logger = LoggerFactory.getLogger(StandardRetryStrategy.class);

  private final Config config;

  public StandardRetryStrategy(Config config) {
    this.config = config;
  }

  /**
   * A strategy with the default configuration and its own token bucket.
   */
  public StandardRetryStrategy() {
    this(Config.defaults());
  }

  public Config config() {
    return config;
  }

  @Override
  public <T> RetryOutcome<T> outcome(RetryPolicy<T> policy, Callable<T> callable) throws Exception {
    beforeAttempt(1);

    RetryToken token;
    try {
      token = config.tokenBucket.acquireToken();
    } catch (RetryCapacityExceededException e) {
      throw capacityExceeded(e, 0, null);
    }

    for (var attempt = 1;; attempt++) {
      if (attempt > 1) {
        try {
          beforeAttempt(attempt);
        } catch (InterruptedException e) {
          token.notifyCancelled();
          throw e;
        }
      }

      CallResult<T> result;
      try {
        result = CallResult.success(callable.call());
      } catch (InterruptedException | CancellationException e) {
        // The attempt never finished, so it isn't charged for
        token.notifyCancelled();
        throw e;
      } catch (Exception e) {
        result = CallResult.failure(e);
      } catch (Error e) {
        token.notifyFailure();
        throw e;
      }

      var directive = policy.evaluate(result);
      afterAttempt(attempt, result, directive);

      if (directive instanceof RetryDirective.TerminateAndSucceed) {
        token.notifySuccess();
        return RetryOutcome.of(attempt, result);
      }

      if (!(directive instanceof RetryDirective.RetryError retryError)) {
        token.notifyFailure();
        throw nonRetryableFailure(attempt, result);
      }

      if (attempt >= config.maxAttempts) {
        token.notifyFailure();
        logger.debug("Giving up after {} attempts", attempt);
        throw new RetryExhaustedException(
            "Took more than " + config.maxAttempts + " attempts to get a successful response",
            RetryExhaustedException.Reason.MAX_ATTEMPTS_EXCEEDED, attempt, result.getOrNull(),
            result.exceptionOrNull());
      }

      var reason = retryError.reason();
      RetryToken nextToken;
      try {
        nextToken = token.scheduleRetry(reason);
      } catch (RetryCapacityExceededException e) {
        throw capacityExceeded(e, attempt, result);
      }
      onRetryScheduled(attempt, reason);

      var delay = config.delayProvider.backoff(attempt);
      logger.debug("Attempt {} failed ({}), retrying in {}", attempt, reason, delay);
      try {
        config.sleeper.sleep(delay);
      } catch (InterruptedException e) {
        nextToken.notifyCancelled();
        throw e;
      }

      token = nextToken;
    }
  }

  /**
   * Called before every attempt, including the first. May block.
   *
   * @param attempt
   *          the 1-based number of the attempt about to be made
   */
  protected void beforeAttempt(int attempt) throws InterruptedException {
    // Nothing to do by default
  }

  /**
   * Called after every attempt, once the policy has evaluated it.
   */
  protected <T> void afterAttempt(int attempt, CallResult<T> result, RetryDirective directive) {
    // Nothing to do by default
  }

  /**
   * Called once the bucket has paid for a retry, before the backoff delay.
   *
   * @param attempt
   *          the 1-based number of the attempt that failed
   */
  protected void onRetryScheduled(int attempt, RetryErrorType reason) {
    // Nothing to do by default
  }

  private static Exception nonRetryableFailure(int attempt, CallResult<?> result) {
    var exception = result.exceptionOrNull();
    if (exception != null) {
      // Propagated untouched
      throw sneakyThrow(exception);
    }
    return new RetryFailureException("The operation resulted in a non-retryable failure", attempt, result.getOrNull());
  }

  private static RetryExhaustedException capacityExceeded(RetryCapacityExceededException capacityException,
      int attempts, @Nullable CallResult<?> result) {
    logger.debug("Giving up after {} attempts: {}", attempts, capacityException.getMessage());
    var lastException = result == null ? null : result.exceptionOrNull();
    var exhausted = new RetryExhaustedException("Retry quota exceeded",
        RetryExhaustedException.Reason.INSUFFICIENT_CAPACITY, attempts, result == null ? null : result.getOrNull(),
        lastException == null ? capacityException : lastException);
    if (lastException != null) {
      exhausted.addSuppressed(capacityException);
    }
    return exhausted;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("config", config).toString();
  }

  /**
   * Immutable configuration for a {@link StandardRetryStrategy}.
   */
  public static class Config {
    /**
     * The default maximum number of attempts, including the first.
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /**
     * The maximum number of attempts to make, including the first.
     */
    public final int maxAttempts;
    /**
     * Decides how long to wait before each retry.
     */
    public final DelayProvider delayProvider;
    /**
     * Pays for retries. Passing the same bucket to several strategies shares
     * its capacity between them.
     */
    public final RetryTokenBucket tokenBucket;
    /**
     * Waits out backoff delays.
     */
    public final Sleeper sleeper;

    protected Config(Builder builder) {
      this.maxAttempts = builder.maxAttempts;
      this.delayProvider = builder.delayProvider;
      this.tokenBucket = builder.tokenBucket != null ? builder.tokenBucket : new StandardRetryTokenBucket();
      this.sleeper = builder.sleeper;
    }

    /**
     * A new default configuration. Each call creates a new token bucket, so
     * strategies built from separate calls don't share capacity.
     */
    @Contract(value = "-> new", pure = true)
    public static Config defaults() {
      return builder().build();
    }

    @Contract(value = "-> new", pure = true)
    public static Builder builder() {
      return new Builder();
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("maxAttempts", maxAttempts)
          .add("delayProvider", delayProvider)
          .add("tokenBucket", tokenBucket)
          .toString();
    }

    /**
     * A mutable builder for {@link Config}.
     */
    public static class Builder {
      private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
      private DelayProvider delayProvider = new ExponentialBackoffWithJitter();
      private @Nullable RetryTokenBucket tokenBucket;
      private Sleeper sleeper = Sleeper.SYSTEM;

      protected Builder() {
      }

      public Builder maxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
        return this;
      }

      public Builder delayProvider(DelayProvider delayProvider) {
        this.delayProvider = delayProvider;
        return this;
      }

      /**
       * Defaults to a new {@link StandardRetryTokenBucket} with default options.
       */
      public Builder tokenBucket(RetryTokenBucket tokenBucket) {
        this.tokenBucket = tokenBucket;
        return this;
      }

      public Builder sleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
      }

      public Config build() {
        checkArgument(maxAttempts > 0, "maxAttempts must be positive: %s", maxAttempts);
        return new Config(this);
      }
    }
  }
}
