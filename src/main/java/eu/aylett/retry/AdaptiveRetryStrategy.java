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
import com.google.common.base.Ticker;
import eu.aylett.retry.delay.AdaptiveRateLimiter;

/**
 * A {@link StandardRetryStrategy} that also adapts to throttling.
 * <p>
 * Every attempt is reported to an {@link AdaptiveRateLimiter}. Once the service
 * has throttled the client, attempts are paced to the limiter's allowed rate,
 * and that rate also becomes the refill rate of the retry token bucket.
 * </p>
 * <p>
 * The limiter should be shared the same way as the token bucket: one per
 * client.
 * </p>
 */
public class AdaptiveRetryStrategy extends StandardRetryStrategy {
  private final AdaptiveRateLimiter rateLimiter;

  public AdaptiveRetryStrategy(Config config, AdaptiveRateLimiter rateLimiter) {
    super(config);
    this.rateLimiter = rateLimiter;
  }

  /**
   * A strategy with its own default rate limiter, which waits using the
   * configured sleeper.
   */
  public AdaptiveRetryStrategy(Config config) {
    this(config, new AdaptiveRateLimiter(AdaptiveRateLimiter.Config.DEFAULT, Ticker.systemTicker(), config.sleeper));
  }

  public AdaptiveRetryStrategy() {
    this(Config.defaults());
  }

  public AdaptiveRateLimiter rateLimiter() {
    return rateLimiter;
  }

  @Override
  protected void beforeAttempt(int attempt) throws InterruptedException {
    rateLimiter.acquire(1);
  }

  @Override
  protected <T> void afterAttempt(int attempt, CallResult<T> result, RetryDirective directive) {
    var errorType = directive instanceof RetryDirective.RetryError retryError ? retryError.reason() : null;
    rateLimiter.update(errorType);
  }

  @Override
  protected void onRetryScheduled(int attempt, RetryErrorType reason) {
    if (rateLimiter.throttlingEnabled()) {
      config().tokenBucket.updateRefillRate(rateLimiter.refillUnitsPerSecond());
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("config", config())
        .add("rateLimiter", rateLimiter)
        .toString();
  }
}
