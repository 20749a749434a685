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

import java.util.function.Function;

/**
 * Decides what to do after each attempt: succeed, fail, or retry.
 * <p>
 * Policies must not throw. An outcome they can't classify should be mapped to
 * {@link RetryDirective#TERMINATE_AND_FAIL}.
 * </p>
 */
@FunctionalInterface
public interface RetryPolicy<T> {
  RetryDirective evaluate(CallResult<T> result);

  /**
   * A policy that accepts every returned value and classifies exceptions.
   *
   * @param classifier
   *          the kind of error an exception represents, or {@code null} if it
   *          shouldn't be retried
   */
  static <T> RetryPolicy<T> classifying(Function<? super Throwable, @Nullable RetryErrorType> classifier) {
    return result -> {
      var exception = result.exceptionOrNull();
      if (exception == null) {
        return RetryDirective.TERMINATE_AND_SUCCEED;
      }
      var errorType = classifier.apply(exception);
      return errorType == null ? RetryDirective.TERMINATE_AND_FAIL : RetryDirective.retryError(errorType);
    };
  }
}
