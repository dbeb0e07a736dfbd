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

package eu.aylett.admission;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallContextTest {

  @Test
  void backgroundIsNeverDoneUntilCancelled() {
    var context = CallContext.background();
    assertFalse(context.isDone());
    assertFalse(context.hasDeadline());
    assertThat(context.cause(), nullValue());
    assertThat(context.remainingNanos(), equalTo(Long.MAX_VALUE));

    context.cancel();
    assertTrue(context.isDone());
    assertThat(context.cause(), equalTo(CallContext.Cause.CANCELLED));
  }

  @Test
  void deadlinePassesWithClock() {
    var now = new AtomicLong(1_000);
    var context = new CallContext(true, 1_500, now::get);
    assertFalse(context.isDone());
    assertThat(context.remainingNanos(), equalTo(500L));

    now.set(1_500);
    assertThat(context.cause(), equalTo(CallContext.Cause.DEADLINE_EXCEEDED));
    assertThat(context.remainingNanos(), equalTo(0L));
  }

  @Test
  void cancellationWinsOverDeadline() {
    var context = CallContext.withTimeout(Duration.ZERO);
    assertThat(context.cause(), equalTo(CallContext.Cause.DEADLINE_EXCEEDED));
    context.cancel();
    assertThat(context.cause(), equalTo(CallContext.Cause.CANCELLED));
  }

  @Test
  void hugeTimeoutMeansNoDeadline() {
    var context = CallContext.withTimeout(Duration.ofDays(365L * 1000));
    assertFalse(context.hasDeadline());
    assertFalse(context.isDone());
  }

  @Test
  void pastDeadlineIsDoneImmediately() {
    var context = CallContext.withDeadline(System.nanoTime() - TimeUnit.SECONDS.toNanos(1));
    assertTrue(context.hasDeadline());
    assertThat(context.cause(), equalTo(CallContext.Cause.DEADLINE_EXCEEDED));
    assertTrue(context.remainingNanos() < 0);
  }

  @Test
  void futureDeadlineIsLiveUntilItPasses() {
    var context = CallContext.withDeadline(System.nanoTime() + TimeUnit.HOURS.toNanos(1));
    assertTrue(context.hasDeadline());
    assertFalse(context.isDone());
    assertTrue(context.remainingNanos() > TimeUnit.MINUTES.toNanos(59));
  }

  @Test
  void listenersRunOnceOnCancel() {
    var context = CallContext.background();
    var runs = new AtomicInteger();
    context.onDone(runs::incrementAndGet);
    context.cancel();
    context.cancel();
    assertThat(runs.get(), equalTo(1));
  }

  @Test
  void listenerRegisteredAfterCancelRunsImmediately() {
    var context = CallContext.background();
    context.cancel();
    var runs = new AtomicInteger();
    context.onDone(runs::incrementAndGet);
    assertThat(runs.get(), equalTo(1));
  }

  @Test
  void closedRegistrationDoesNotRun() {
    var context = CallContext.background();
    var runs = new AtomicInteger();
    try (var ignored = context.onDone(runs::incrementAndGet)) {
      assertThat(runs.get(), equalTo(0));
    }
    context.cancel();
    assertThat(runs.get(), equalTo(0));
  }
}
