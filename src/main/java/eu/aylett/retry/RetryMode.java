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

import java.util.Locale;

/**
 * The retry modes a client can be configured with.
 */
public enum RetryMode {
  /**
   * Backoff and a retry token bucket.
   */
  STANDARD {
    @Override
    public RetryStrategy create(StandardRetryStrategy.Config config) {
      return new StandardRetryStrategy(config);
    }
  },
  /**
   * Everything in {@link #STANDARD}, plus client-side rate limiting that adapts
   * to throttling.
   */
  ADAPTIVE {
    @Override
    public RetryStrategy create(StandardRetryStrategy.Config config) {
      return new AdaptiveRetryStrategy(config);
    }
  };

  /**
   * Build a new strategy in this mode.
   */
  public abstract RetryStrategy create(StandardRetryStrategy.Config config);

  /**
   * Parse a retry mode setting, such as {@code standard} or {@code adaptive}.
   * Case and surrounding whitespace are ignored.
   *
   * @throws IllegalArgumentException
   *           if the value isn't a known mode
   */
  public static RetryMode fromValue(String value) {
    var normalized = value.trim().toLowerCase(Locale.ROOT);
    for (var mode : values()) {
      if (mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown retry mode: " + value);
  }
}
