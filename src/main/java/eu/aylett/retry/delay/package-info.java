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
 * The pieces that decide when, and how fast, a client may retry.
 * <p>
 * A {@link eu.aylett.retry.delay.DelayProvider} spaces retries out. A
 * {@link eu.aylett.retry.delay.RetryTokenBucket} bounds how many retries a
 * client may make in total, so that a struggling service isn't buried under
 * them. An {@link eu.aylett.retry.delay.AdaptiveRateLimiter} goes further and
 * paces every request to a rate that the service has shown it can take.
 * </p>
 * <p>
 * All time measurements use a monotonic {@link com.google.common.base.Ticker},
 * never the wall clock.
 * </p>
 */
@NullMarked
package eu.aylett.retry.delay;

import org.jspecify.annotations.NullMarked;
