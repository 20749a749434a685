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

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a {@link RetryPolicy} rejects a value returned by an attempt.
 * <p>
 * When the policy rejects an attempt that threw, the attempt's own exception
 * is rethrown instead.
 * </p>
 */
public class RetryFailureException extends RuntimeException {
  /**
   * The number of attempts made.
   */
  public final int attempts;
  /**
   * The value the policy rejected.
   */
  public final @Nullable Object lastResponse;

  public RetryFailureException(String message, int attempts, @Nullable Object lastResponse) {
    super(message + " (" + attempts + " attempts, last response " + lastResponse + ")");
    this.attempts = attempts;
    this.lastResponse = lastResponse;
  }
}
