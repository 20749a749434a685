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

/**
 * A {@link RetryPolicy}'s verdict on one attempt.
 */
public sealed interface RetryDirective {
  /**
   * Stop, and hand the attempt's outcome back to the caller.
   */
  RetryDirective TERMINATE_AND_SUCCEED = new TerminateAndSucceed();
  /**
   * Stop, and fail the call with the attempt's outcome.
   */
  RetryDirective TERMINATE_AND_FAIL = new TerminateAndFail();

  /**
   * Try again, for the given reason.
   */
  static RetryDirective retryError(RetryErrorType reason) {
    return new RetryError(reason);
  }

  record TerminateAndSucceed() implements RetryDirective {
  }

  record TerminateAndFail() implements RetryDirective {
  }

  record RetryError(RetryErrorType reason) implements RetryDirective {
  }
}
