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

import eu.aylett.retry.RetryErrorType;

/**
 * Permission to make one attempt at a call.
 * <p>
 * Each token must be resolved exactly once, by one of
 * {@link #notifySuccess()}, {@link #notifyFailure()},
 * {@link #notifyCancelled()} or {@link #scheduleRetry(RetryErrorType)}.
 * </p>
 */
public interface RetryToken {
  /**
   * The attempt this token permitted succeeded.
   */
  void notifySuccess();

  /**
   * The attempt this token permitted failed and will not be retried.
   */
  void notifyFailure();

  /**
   * The attempt this token permitted was abandoned before it ran. Any capacity
   * charged for the token is returned.
   */
  void notifyCancelled();

  /**
   * The attempt this token permitted failed and should be retried.
   *
   * @param reason
   *          the kind of failure, which decides the cost of the retry
   * @return a token permitting the next attempt
   * @throws RetryCapacityExceededException
   *           if the bucket cannot pay for another retry
   * @throws InterruptedException
   *           if interrupted while waiting for capacity
   */
  RetryToken scheduleRetry(RetryErrorType reason) throws InterruptedException;
}
