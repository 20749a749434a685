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

import com.google.common.testing.FakeTicker;
import eu.aylett.retry.RetryErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StandardRetryTokenBucketTest {
  private FakeTicker ticker;
  private List<Duration> sleeps;

  @BeforeEach
  void setUp() {
    ticker = new FakeTicker();
    sleeps = new ArrayList<>();
  }

  private StandardRetryTokenBucket bucket(StandardRetryTokenBucket.Options options) {
    // Sleeping moves time on, as it would for real
    return new StandardRetryTokenBucket(options, ticker, duration -> {
      sleeps.add(duration);
      ticker.advance(duration);
    });
  }

  @Test
  void firstAttemptIsFree() throws Exception {
    var bucket = bucket(StandardRetryTokenBucket.Options.DEFAULT);

    var token = bucket.acquireToken();
    token.notifySuccess();

    assertThat(bucket.capacity(), is(500));
  }

  @Test
  void retryCostDependsOnReason() throws Exception {
    var bucket = bucket(StandardRetryTokenBucket.Options.builder().retryCost(5).timeoutRetryCost(10).build());

    var token = bucket.acquireToken().scheduleRetry(RetryErrorType.THROTTLING);
    assertThat(bucket.capacity(), is(490));
    token = token.scheduleRetry(RetryErrorType.TRANSIENT);
    assertThat(bucket.capacity(), is(480));
    token = token.scheduleRetry(RetryErrorType.SERVER_SIDE);
    assertThat(bucket.capacity(), is(475));
    token = token.scheduleRetry(RetryErrorType.CLIENT_SIDE);
    assertThat(bucket.capacity(), is(470));

    // Only the last retry's cost comes back
    token.notifySuccess();
    assertThat(bucket.capacity(), is(475));
  }

  @Test
  void failedRetryKeepsItsCost() throws Exception {
    var bucket = bucket(StandardRetryTokenBucket.Options.DEFAULT);

    bucket.acquireToken().scheduleRetry(RetryErrorType.SERVER_SIDE).notifyFailure();

    assertThat(bucket.capacity(), is(495));
  }

  @Test
  void cancelledRetryReturnsItsCost() throws Exception {
    var bucket = bucket(StandardRetryTokenBucket.Options.DEFAULT);

    bucket.acquireToken().scheduleRetry(RetryErrorType.SERVER_SIDE).notifyCancelled();

    assertThat(bucket.capacity(), is(500));
  }

  @Test
  void initialTryCostAndIncrement() throws Exception {
    var bucket = bucket(StandardRetryTokenBucket.Options.builder()
        .initialTryCost(2)
        .initialTrySuccessIncrement(1)
        .build());

    var token = bucket.acquireToken();
    assertThat(bucket.capacity(), is(498));
    token.notifySuccess();
    assertThat(bucket.capacity(), is(499));
  }

  @Test
  void insufficientCapacity() throws Exception {
    var bucket = bucket(StandardRetryTokenBucket.Options.builder().initialCapacity(4).build());
    var token = bucket.acquireToken();

    var thrown = assertThrows(RetryCapacityExceededException.class,
        () -> token.scheduleRetry(RetryErrorType.SERVER_SIDE));

    assertThat(thrown.requested, is(5));
    assertThat(thrown.available, is(4));
    assertThat(bucket.capacity(), is(4));
    assertThat(sleeps, empty());
  }

  @Test
  void tokensResolveOnce() throws Exception {
    var bucket = bucket(StandardRetryTokenBucket.Options.DEFAULT);
    var token = bucket.acquireToken();
    token.notifySuccess();

    assertThrows(IllegalStateException.class, token::notifyFailure);
    assertThrows(IllegalStateException.class, token::notifyCancelled);
    assertThrows(IllegalStateException.class, () -> token.scheduleRetry(RetryErrorType.TRANSIENT));
    assertThat(bucket.capacity(), is(500));
  }

  @Test
  void refillCarriesPartialUnits() {
    var bucket = bucket(StandardRetryTokenBucket.Options.builder()
        .maxCapacity(10)
        .initialCapacity(0)
        .refillUnitsPerSecond(2.0)
        .build());

    ticker.advance(750, TimeUnit.MILLISECONDS);
    assertThat(bucket.capacity(), is(1));
    ticker.advance(250, TimeUnit.MILLISECONDS);
    assertThat(bucket.capacity(), is(2));
    ticker.advance(100, TimeUnit.SECONDS);
    assertThat(bucket.capacity(), is(10));
  }

  @Test
  void noRefillByDefault() {
    var bucket = bucket(StandardRetryTokenBucket.Options.builder().initialCapacity(0).build());

    ticker.advance(1, TimeUnit.HOURS);

    assertThat(bucket.capacity(), is(0));
  }

  @Test
  void zeroRefillForcesCircuitBreaker() {
    var options = StandardRetryTokenBucket.Options.builder().circuitBreakerMode(false).build();

    assertThat(options.circuitBreakerMode, is(true));
  }

  @Test
  void updateRefillRate() {
    var bucket = bucket(StandardRetryTokenBucket.Options.builder()
        .maxCapacity(10)
        .initialCapacity(0)
        .refillUnitsPerSecond(2.0)
        .build());

    ticker.advance(1, TimeUnit.SECONDS);
    bucket.updateRefillRate(0.0);
    ticker.advance(10, TimeUnit.SECONDS);
    // Refill owed at the old rate is kept
    assertThat(bucket.capacity(), is(2));

    bucket.updateRefillRate(1.0);
    ticker.advance(3, TimeUnit.SECONDS);
    assertThat(bucket.capacity(), is(5));
    assertThat(bucket.refillUnitsPerSecond(), is(1.0));

    assertThrows(IllegalArgumentException.class, () -> bucket.updateRefillRate(-1.0));
    assertThrows(IllegalArgumentException.class, () -> bucket.updateRefillRate(Double.NaN));
  }

  @Test
  void waitsForRefillOutsideCircuitBreakerMode() throws Exception {
    var bucket = bucket(StandardRetryTokenBucket.Options.builder()
        .maxCapacity(10)
        .initialCapacity(0)
        .refillUnitsPerSecond(1.0)
        .circuitBreakerMode(false)
        .build());

    bucket.acquireToken().scheduleRetry(RetryErrorType.SERVER_SIDE);

    assertThat(sleeps, contains(Duration.ofNanos(5_000_000_001L)));
    assertThat(bucket.capacity(), is(0));
  }

  @Test
  void verySlowRefillWaitsInsteadOfSpinning() throws Exception {
    var bucket = new StandardRetryTokenBucket(StandardRetryTokenBucket.Options.builder()
        .initialCapacity(0)
        .refillUnitsPerSecond(1e-12)
        .circuitBreakerMode(false)
        .build(), ticker, duration -> {
          sleeps.add(duration);
          throw new InterruptedException();
        });
    var token = bucket.acquireToken();

    assertThrows(InterruptedException.class, () -> token.scheduleRetry(RetryErrorType.SERVER_SIDE));
    assertThat(sleeps, contains(Duration.ofNanos(Long.MAX_VALUE)));
  }

  @Test
  void waitingCanBeInterrupted() throws Exception {
    var bucket = new StandardRetryTokenBucket(StandardRetryTokenBucket.Options.builder()
        .initialCapacity(0)
        .refillUnitsPerSecond(1.0)
        .circuitBreakerMode(false)
        .build(), ticker, duration -> {
          throw new InterruptedException();
        });
    var token = bucket.acquireToken();

    assertThrows(InterruptedException.class, () -> token.scheduleRetry(RetryErrorType.TRANSIENT));
    assertThat(bucket.capacity(), is(0));
  }

  @Test
  void validation() {
    assertThrows(IllegalArgumentException.class,
        () -> StandardRetryTokenBucket.Options.builder().maxCapacity(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> StandardRetryTokenBucket.Options.builder().maxCapacity(10).initialCapacity(11).build());
    assertThrows(IllegalArgumentException.class,
        () -> StandardRetryTokenBucket.Options.builder().refillUnitsPerSecond(-1).build());
    assertThrows(IllegalArgumentException.class,
        () -> StandardRetryTokenBucket.Options.builder().retryCost(-1).build());
  }

  @Test
  void concurrentUseKeepsCapacityConsistent() throws Exception {
    var bucket = new StandardRetryTokenBucket(StandardRetryTokenBucket.Options.builder().maxCapacity(50).build());
    var failedRetries = new AtomicInteger();

    Callable<Void> task = () -> {
      var random = ThreadLocalRandom.current();
      var token = bucket.acquireToken();
      var retried = false;
      var retries = random.nextInt(4);
      for (var i = 0; i < retries; i++) {
        try {
          token = token.scheduleRetry(RetryErrorType.SERVER_SIDE);
          retried = true;
        } catch (RetryCapacityExceededException e) {
          // The current token was resolved without a refund
          if (retried) {
            failedRetries.incrementAndGet();
          }
          return null;
        }
      }
      switch (random.nextInt(3)) {
        case 0 -> token.notifySuccess();
        case 1 -> token.notifyCancelled();
        default -> {
          token.notifyFailure();
          if (retried) {
            failedRetries.incrementAndGet();
          }
        }
      }
      return null;
    };

    var executor = Executors.newFixedThreadPool(8);
    try {
      var futures = executor.invokeAll(IntStream.range(0, 1000).mapToObj(i -> task).toList());
      for (var future : futures) {
        future.get();
      }
    } finally {
      executor.shutdown();
    }

    assertThat(bucket.capacity(), is(50 - 5 * failedRetries.get()));
  }
}
