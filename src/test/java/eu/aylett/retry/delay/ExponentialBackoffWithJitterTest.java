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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.stream.IntStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExponentialBackoffWithJitterTest {
  private static ExponentialBackoffWithJitter.Options.Builder noJitter() {
    return ExponentialBackoffWithJitter.Options.builder()
        .initialDelay(Duration.ofMillis(10))
        .scaleFactor(2.0)
        .jitter(0.0);
  }

  @Test
  void growsExponentially() {
    var backoff = new ExponentialBackoffWithJitter(noJitter().build());

    var delays = IntStream.rangeClosed(1, 6).mapToObj(backoff::backoff).toList();

    assertThat(delays, contains(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40),
        Duration.ofMillis(80), Duration.ofMillis(160), Duration.ofMillis(320)));
  }

  @Test
  void cappedAtMaxBackoff() {
    var backoff = new ExponentialBackoffWithJitter(noJitter().maxBackoff(Duration.ofMillis(100)).build());

    var delays = IntStream.rangeClosed(1, 6).mapToObj(backoff::backoff).toList();

    assertThat(delays, contains(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40),
        Duration.ofMillis(80), Duration.ofMillis(100), Duration.ofMillis(100)));
  }

  @Test
  void jitterScalesBetweenBounds() {
    var options = noJitter().jitter(0.6).build();

    assertThat(new ExponentialBackoffWithJitter(options, () -> 0.0).backoff(1), is(Duration.ofMillis(4)));
    assertThat(new ExponentialBackoffWithJitter(options, () -> 0.5).backoff(1), is(Duration.ofMillis(7)));
    assertThat(new ExponentialBackoffWithJitter(options, () -> 1.0).backoff(1), is(Duration.ofMillis(10)));
  }

  @Test
  void fullJitterStaysWithinBase() {
    var backoff = new ExponentialBackoffWithJitter(noJitter().jitter(1.0).build());

    for (var i = 0; i < 100; i++) {
      var delay = backoff.backoff(3);
      assertThat(delay, greaterThanOrEqualTo(Duration.ZERO));
      assertThat(delay, lessThanOrEqualTo(Duration.ofMillis(40)));
    }
  }

  @Test
  void hugeAttemptCountsDoNotOverflow() {
    var max = Duration.ofDays(365_000);
    var backoff = new ExponentialBackoffWithJitter(noJitter().maxBackoff(max).build());

    assertThat(backoff.backoff(1_000), is(max));
  }

  @Test
  void defaults() {
    var options = ExponentialBackoffWithJitter.Options.DEFAULT;
    assertThat(options.initialDelay, is(Duration.ofMillis(10)));
    assertThat(options.scaleFactor, is(1.5));
    assertThat(options.jitter, is(1.0));
    assertThat(options.maxBackoff, is(Duration.ofSeconds(20)));
  }

  @Test
  void validation() {
    var builder = ExponentialBackoffWithJitter.Options.builder();
    assertThrows(IllegalArgumentException.class, () -> builder.scaleFactor(0.5).build());
    assertThrows(IllegalArgumentException.class,
        () -> ExponentialBackoffWithJitter.Options.builder().jitter(1.5).build());
    assertThrows(IllegalArgumentException.class,
        () -> ExponentialBackoffWithJitter.Options.builder().initialDelay(Duration.ofMillis(-1)).build());
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffWithJitter().backoff(0));
  }
}
