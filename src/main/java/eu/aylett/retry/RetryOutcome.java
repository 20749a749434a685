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

import static eu.aylett.retry.SneakyThrows.sneakyThrow;

/**
 * How a retried call finished, once the policy accepted it, and how many
 * attempts it took.
 * <p>
 * A policy may accept an exception as the final result of a call, in which
 * case the outcome is a {@link Failure} rather than the exception propagating.
 * </p>
 */
public sealed interface RetryOutcome<T> {
  /**
   * The number of attempts made, including the first.
   */
  int attempts();

  /**
   * The value of the final attempt, or its exception thrown without being
   * declared.
   */
  @Nullable
  T getOrThrow();

  /**
   * The final attempt returned a value.
   */
  record Response<T>(int attempts, @Nullable T value) implements RetryOutcome<T> {
    @Override
    public @Nullable T getOrThrow() {
      return value;
    }
  }

  /**
   * The final attempt threw an exception that the policy accepted.
   */
  record Failure<T>(int attempts, Throwable exception) implements RetryOutcome<T> {
    @Override
    public T getOrThrow() {
      throw sneakyThrow(exception);
    }
  }

  /**
   * The outcome of a completed attempt.
   */
  static <T> RetryOutcome<T> of(int attempts, CallResult<T> result) {
    var exception = result.exceptionOrNull();
    if (exception != null) {
      return new Failure<>(attempts, exception);
    }
    return new Response<>(attempts, result.getOrNull());
  }
}
