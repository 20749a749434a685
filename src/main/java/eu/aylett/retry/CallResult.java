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

import com.google.common.base.MoreObjects;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

import static eu.aylett.retry.SneakyThrows.sneakyThrow;

/**
 * The outcome of a single attempt: either the value it returned, or the
 * exception it threw.
 */
public final class CallResult<T> {
  private final @Nullable T value;
  private final @Nullable Throwable exception;

  private CallResult(@Nullable T value, @Nullable Throwable exception) {
    this.value = value;
    this.exception = exception;
  }

  @Contract(value = "_ -> new", pure = true)
  public static <T> CallResult<T> success(@Nullable T value) {
    return new CallResult<>(value, null);
  }

  @Contract(value = "_ -> new", pure = true)
  public static <T> CallResult<T> failure(Throwable exception) {
    return new CallResult<>(null, exception);
  }

  public boolean isSuccess() {
    return exception == null;
  }

  public boolean isFailure() {
    return exception != null;
  }

  /**
   * The value returned, or {@code null} if the attempt threw.
   */
  public @Nullable T getOrNull() {
    return value;
  }

  /**
   * The exception thrown, or {@code null} if the attempt returned normally.
   */
  public @Nullable Throwable exceptionOrNull() {
    return exception;
  }

  /**
   * The value returned, or rethrow the exception the attempt threw.
   */
  public @Nullable T getOrThrow() {
    if (exception != null) {
      throw sneakyThrow(exception);
    }
    return value;
  }

  @Override
  @Contract(value = "null -> false", pure = true)
  public boolean equals(@Nullable Object obj) {
    if (obj instanceof CallResult<?> that) {
      return Objects.equals(value, that.value) && Objects.equals(exception, that.exception);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, exception);
  }

  @Override
  public String toString() {
    var helper = MoreObjects.toStringHelper(this);
    if (exception != null) {
      helper.add("exception", exception);
    } else {
      helper.add("value", value);
    }
    return helper.toString();
  }
}
