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

import java.time.Duration;

/**
 * Pauses the calling thread. Implementations must respond to interruption by
 * throwing {@link InterruptedException}.
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Sleeps using {@link Thread#sleep(long, int)}.
   */
  Sleeper SYSTEM = duration -> {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
  };

  void sleep(Duration duration) throws InterruptedException;
}
