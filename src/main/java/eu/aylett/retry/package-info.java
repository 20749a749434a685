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

/**
 * When a call to a service fails, it's often worth trying again. It's also
 * easy to make things worse by doing so: a service that's failing because it's
 * overloaded won't be helped by every client retrying every request.
 * <p>
 * A {@link eu.aylett.retry.RetryStrategy} runs an operation and, guided by a
 * {@link eu.aylett.retry.RetryPolicy}, retries it with backoff. Retries are
 * paid for from a token bucket shared across all calls through a client, so
 * when most calls are failing, most calls stop being retried.
 * {@link eu.aylett.retry.AdaptiveRetryStrategy} also slows the client down
 * when the service says it's being throttled, and speeds back up as calls
 * succeed.
 * </p>
 * <p>
 * One strategy should be used for each distinct service you call. You
 * <i>should</i> use the same instance for different methods called on the
 * same service.
 * </p>
 */
@NullMarked
package eu.aylett.retry;

import org.jspecify.annotations.NullMarked;
