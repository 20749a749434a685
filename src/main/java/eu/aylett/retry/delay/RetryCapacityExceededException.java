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
 * Thrown by a {@link RetryTokenBucket} when there is not enough capacity left
 * to pay for an attempt.
 */
public class RetryCapacityExceededException extends RuntimeException {
  /**
   * The capacity that was requested.
   */
  public final int requested;
  /**
   * The capacity available at the time.
   */
  public final int available;

  public RetryCapacityExceededException(String message, int requested, int available) {
    super(message + " (requested " + requested + ", available " + available + ")");
    this.requested = requested;
    this.available = available;
  }
}
