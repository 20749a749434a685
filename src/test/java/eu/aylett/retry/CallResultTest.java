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

import com.google.common.testing.EqualsTester;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CallResultTest {
  @Test
  void success() {
    var result = CallResult.success("ok");

    assertThat(result.isSuccess(), is(true));
    assertThat(result.isFailure(), is(false));
    assertThat(result.getOrNull(), is("ok"));
    assertThat(result.exceptionOrNull(), nullValue());
    assertThat(result.getOrThrow(), is("ok"));
    assertThat(result.toString(), containsString("value=ok"));
  }

  @Test
  void nullIsASuccessfulValue() {
    var result = CallResult.success(null);

    assertThat(result.isSuccess(), is(true));
    assertThat(result.getOrThrow(), nullValue());
  }

  @Test
  void failureRethrowsCheckedExceptions() {
    var exception = new IOException("broken");
    CallResult<String> result = CallResult.failure(exception);

    assertThat(result.isFailure(), is(true));
    assertThat(result.getOrNull(), nullValue());
    assertThat(result.exceptionOrNull(), sameInstance(exception));
    var thrown = assertThrows(IOException.class, result::getOrThrow);
    assertThat(thrown, sameInstance(exception));
  }

  @Test
  void equality() {
    var exception = new IllegalStateException();
    new EqualsTester()
        .addEqualityGroup(CallResult.success("a"), CallResult.success("a"))
        .addEqualityGroup(CallResult.success("b"))
        .addEqualityGroup(CallResult.success(null), CallResult.success(null))
        .addEqualityGroup(CallResult.failure(exception), CallResult.failure(exception))
        .addEqualityGroup(CallResult.failure(new IllegalStateException()))
        .testEquals();
  }

  @Test
  void directives() {
    new EqualsTester()
        .addEqualityGroup(RetryDirective.TERMINATE_AND_SUCCEED, new RetryDirective.TerminateAndSucceed())
        .addEqualityGroup(RetryDirective.TERMINATE_AND_FAIL)
        .addEqualityGroup(RetryDirective.retryError(RetryErrorType.THROTTLING),
            new RetryDirective.RetryError(RetryErrorType.THROTTLING))
        .addEqualityGroup(RetryDirective.retryError(RetryErrorType.TRANSIENT))
        .testEquals();
  }
}
