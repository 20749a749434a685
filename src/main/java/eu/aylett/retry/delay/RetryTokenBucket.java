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

/**
 * A pool of retry capacity shared by every call made through one client.
 */
public interface RetryTokenBucket {
  /**
   * Acquire a token for the first attempt of a call.
   *
   * @throws RetryCapacityExceededException
   *           if the bucket cannot pay for the initial attempt
   * @throws InterruptedException
   *           if interrupted while waiting for capacity
   */
  RetryToken acquireToken() throws InterruptedException;

  /**
   * Change how quickly capacity is restored over time.
   *
   * @param unitsPerSecond
   *          the new refill rate, which must not be negative
   */
  void updateRefillRate(double unitsPerSecond);
}
