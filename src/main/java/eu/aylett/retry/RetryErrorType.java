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
 * The kind of failure a {@link RetryPolicy} saw when it decided an attempt
 * should be retried.
 * <p>
 * Token buckets charge different amounts for different kinds, and only
 * {@link #THROTTLING} slows down the adaptive rate limiter.
 * </p>
 */
public enum RetryErrorType {
  /**
   * A transient failure, such as a timeout or a dropped connection.
   */
  TRANSIENT,
  /**
   * The service asked the client to slow down.
   */
  THROTTLING,
  /**
   * A failure caused by the client that may succeed if tried again.
   */
  CLIENT_SIDE,
  /**
   * A failure on the service side.
   */
  SERVER_SIDE,
}
