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
 * Thrown when a call is given up on while its failures were still retryable.
 * <p>
 * {@link #reason} says whether the attempt limit was reached or the retry
 * token bucket ran dry. The cause, when there is one, is the exception thrown
 * by the last attempt.
 * </p>
 */
public class RetryExhaustedException extends RuntimeException {
  /**
   * Why retrying stopped.
   */
  public enum Reason {
    /**
     * The retry token bucket couldn't pay for another attempt.
     */
    INSUFFICIENT_CAPACITY,
    /**
     * The maximum number of attempts has been made.
     */
    MAX_ATTEMPTS_EXCEEDED,
  }

  /**
   * Why retrying stopped.
   */
  public final Reason reason;
  /**
   * The number of attempts made.
   */
  public final int attempts;
  /**
   * The value returned by the last attempt, if it returned normally.
   */
  public final @Nullable Object lastResponse;

  /**
   * Constructs a new RetryExhaustedException.
   *
   * @param message
   *          the detail message
   * @param reason
   *          why retrying stopped
   * @param attempts
   *          the number of attempts made
   * @param lastResponse
   *          the value returned by the last attempt, if any
   * @param cause
   *          the exception thrown by the last attempt, if any
   */
  public RetryExhaustedException(String message, Reason reason, int attempts, @Nullable Object lastResponse,
      @Nullable Throwable cause) {
    super(message + " (" + attempts + " attempts)", cause);
    this.reason = reason;
    this.attempts = attempts;
    this.lastResponse = lastResponse;
  }
}
