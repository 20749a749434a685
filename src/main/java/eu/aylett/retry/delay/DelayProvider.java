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
 * Decides how long to wait before a retry.
 */
@FunctionalInterface
public interface DelayProvider {
  /**
   * The delay to wait before the retry that follows the given attempt.
   *
   * @param attempt
   *          the 1-based number of the attempt that just failed
   * @return a non-negative delay
   */
  Duration backoff(int attempt);
}
