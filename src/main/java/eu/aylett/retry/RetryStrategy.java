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

import java.util.concurrent.Callable;
import java.util.function.Supplier;

import static eu.aylett.retry.SneakyThrows.sneakyThrow;

/**
 * Runs an operation, retrying it for as long as the policy asks and the
 * strategy allows.
 * <p>
 * The caller sees one of: the value of the successful attempt; the exception
 * thrown by an attempt the policy wouldn't retry, unchanged; a
 * {@link RetryFailureException} if the policy rejected a returned value; or a
 * {@link RetryExhaustedException} if retrying was still wanted but no longer
 * allowed.
 * </p>
 * <p>
 * Attempts run one after another on the calling thread. Interrupting the
 * thread while it waits between attempts stops the call with an
 * {@link InterruptedException}.
 * </p>
 */
public interface RetryStrategy {
  /**
   * Call the callable until the policy is satisfied or retrying is no longer
   * allowed.
   *
   * @throws RetryExhaustedException
   *           if the call still needed retrying when the attempt limit or the
   *           retry capacity ran out
   * @throws RetryFailureException
   *           if the policy rejected a value the callable returned
   * @throws InterruptedException
   *           if interrupted while waiting between attempts, or thrown by the
   *           callable
   * @throws Exception
   *           thrown by the callable, when the policy doesn't retry it
   */
  default <T> T checkedRetry(RetryPolicy<T> policy, Callable<T> callable) throws Exception {
    return outcome(policy, callable).getOrThrow();
  }

  /**
   * Call the callable until the policy is satisfied or retrying is no longer
   * allowed, and report how the accepted attempt finished.
   * <p>
   * Unlike {@link #checkedRetry(RetryPolicy, Callable)}, an exception the policy
   * accepts is returned as a {@link RetryOutcome.Failure} rather than thrown.
   * Everything else is thrown just as it is there.
   * </p>
   */
  <T> RetryOutcome<T> outcome(RetryPolicy<T> policy, Callable<T> callable) throws Exception;

  /**
   * Call the supplier until the policy is satisfied or retrying is no longer
   * allowed.
   *
   * @throws RetryExhaustedException
   *           if the call still needed retrying when the attempt limit or the
   *           retry capacity ran out
   * @throws RetryFailureException
   *           if the policy rejected a value the supplier returned
   */
  default <T> T retry(RetryPolicy<T> policy, Supplier<T> supplier) {
    try {
      return checkedRetry(policy, supplier::get);
    } catch (Exception e) {
      throw sneakyThrow(e);
    }
  }

  /**
   * Wrap a Supplier so that when it's called, it's retried.
   */
  default <T> Supplier<T> wrap(RetryPolicy<T> policy, Supplier<T> supplier) {
    return () -> retry(policy, supplier);
  }
}
