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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeightedGateTest {
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    executor.shutdownNow();
    assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
  }

  @Test
  void acquiresImmediatelyWhenThereIsRoom() throws Exception {
    var gate = new WeightedGate(5);
    gate.acquire(3, CallContext.background());
    gate.acquire(2, CallContext.background());
    assertThat(gate.held(), equalTo(5L));
    gate.release(5);
    assertThat(gate.held(), equalTo(0L));
  }

  @Test
  void rejectsWeightItCanNeverGrant() {
    var gate = new WeightedGate(2);
    assertThrows(IllegalArgumentException.class, () -> gate.acquire(3, CallContext.background()));
    assertThrows(IllegalArgumentException.class, () -> gate.acquire(0, CallContext.background()));
    assertThrows(IllegalArgumentException.class, () -> gate.tryAcquire(3));
    assertThat(gate.held(), equalTo(0L));
    assertThat(gate.queueLength(), equalTo(0));
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new WeightedGate(0));
  }

  @Test
  void releasingMoreThanHeldIsAnError() throws Exception {
    var gate = new WeightedGate(3);
    gate.acquire(1, CallContext.background());
    assertThrows(IllegalStateException.class, () -> gate.release(2));
    assertThrows(IllegalArgumentException.class, () -> gate.release(0));
    assertThat(gate.held(), equalTo(1L));
  }

  @Test
  void tryAcquireDoesNotWait() {
    var gate = new WeightedGate(2);
    assertTrue(gate.tryAcquire(2));
    assertFalse(gate.tryAcquire(1));
    gate.release(1);
    assertTrue(gate.tryAcquire(1));
  }

  @Test
  void waitsUntilReleased() throws Exception {
    var gate = new WeightedGate(1);
    gate.acquire(1, CallContext.background());

    var waiter = executor.submit(() -> {
      gate.acquire(1, CallContext.background());
      return null;
    });
    awaitQueueLength(gate, 1);
    assertFalse(waiter.isDone());

    gate.release(1);
    waiter.get(5, TimeUnit.SECONDS);
    assertThat(gate.held(), equalTo(1L));
    assertThat(gate.queueLength(), equalTo(0));
  }

  @Test
  void heavyWaiterIsNotOvertaken() throws Exception {
    var gate = new WeightedGate(2);
    gate.acquire(2, CallContext.background());
    List<String> order = new CopyOnWriteArrayList<>();

    var heavy = executor.submit(() -> {
      gate.acquire(2, CallContext.background());
      order.add("heavy");
      return null;
    });
    awaitQueueLength(gate, 1);
    var light = executor.submit(() -> {
      gate.acquire(1, CallContext.background());
      order.add("light");
      return null;
    });
    awaitQueueLength(gate, 2);

    // Room for the light waiter, but the heavy one is first in line
    gate.release(1);
    assertThat(gate.queueLength(), equalTo(2));
    assertTrue(order.isEmpty());

    gate.release(1);
    heavy.get(5, TimeUnit.SECONDS);
    assertThat(order, equalTo(List.of("heavy")));
    assertFalse(light.isDone());

    gate.release(2);
    light.get(5, TimeUnit.SECONDS);
    assertThat(order, equalTo(List.of("heavy", "light")));
    assertThat(gate.held(), equalTo(1L));
  }

  @Test
  void timesOutWithoutTakingWeight() throws Exception {
    var gate = new WeightedGate(1);
    gate.acquire(1, CallContext.background());

    assertThrows(TimeoutException.class, () -> gate.acquire(1, CallContext.withTimeout(Duration.ofMillis(50))));
    assertThat(gate.held(), equalTo(1L));
    assertThat(gate.queueLength(), equalTo(0));
  }

  @Test
  void alreadyCancelledContextFailsWithoutQueuing() throws Exception {
    var gate = new WeightedGate(1);
    gate.acquire(1, CallContext.background());
    var context = CallContext.background();
    context.cancel();

    assertThrows(CancellationException.class, () -> gate.acquire(1, context));
    assertThat(gate.queueLength(), equalTo(0));
  }

  @Test
  void alreadyCancelledContextStillAcquiresWhenThereIsRoom() throws Exception {
    var gate = new WeightedGate(1);
    var context = CallContext.background();
    context.cancel();
    gate.acquire(1, context);
    assertThat(gate.held(), equalTo(1L));
  }

  @Test
  void cancellingWakesWaiterPromptly() throws Exception {
    var gate = new WeightedGate(1);
    gate.acquire(1, CallContext.background());
    var context = CallContext.background();

    Future<?> waiter = executor.submit(() -> {
      gate.acquire(1, context);
      return null;
    });
    awaitQueueLength(gate, 1);
    context.cancel();

    var e = assertThrows(ExecutionException.class, () -> waiter.get(5, TimeUnit.SECONDS));
    assertThat(e.getCause(), instanceOf(CancellationException.class));
    assertThat(gate.queueLength(), equalTo(0));
    assertThat(gate.held(), equalTo(1L));
  }

  @Test
  void abandoningTheHeadLetsOthersThrough() throws Exception {
    var gate = new WeightedGate(2);
    gate.acquire(1, CallContext.background());
    var heavyContext = CallContext.background();

    var heavy = executor.submit(() -> {
      gate.acquire(2, heavyContext);
      return null;
    });
    awaitQueueLength(gate, 1);
    var light = executor.submit(() -> {
      gate.acquire(1, CallContext.background());
      return null;
    });
    awaitQueueLength(gate, 2);

    heavyContext.cancel();
    light.get(5, TimeUnit.SECONDS);
    assertThrows(ExecutionException.class, () -> heavy.get(5, TimeUnit.SECONDS));
    assertThat(gate.held(), equalTo(2L));
  }

  @Test
  void interruptionAbandonsTheWait() throws Exception {
    var gate = new WeightedGate(1);
    gate.acquire(1, CallContext.background());

    var waiter = executor.submit(() -> {
      gate.acquire(1, CallContext.background());
      return null;
    });
    awaitQueueLength(gate, 1);
    waiter.cancel(true);

    awaitQueueLength(gate, 0);
    assertThat(gate.held(), equalTo(1L));
    gate.release(1);
    assertThat(gate.held(), equalTo(0L));
  }

  @Test
  void heldNeverExceedsCapacity() throws Exception {
    var gate = new WeightedGate(5);
    var tasks = new ArrayList<Future<?>>();
    for (var i = 0; i < 16; i++) {
      var weight = 1 + i % 3;
      tasks.add(executor.submit(() -> {
        for (var j = 0; j < 200; j++) {
          gate.acquire(weight, CallContext.background());
          assertTrue(gate.held() <= gate.capacity());
          gate.release(weight);
        }
        return null;
      }));
    }
    for (var task : tasks) {
      task.get(30, TimeUnit.SECONDS);
    }
    assertThat(gate.held(), equalTo(0L));
  }

  static void awaitQueueLength(WeightedGate gate, int length) throws InterruptedException {
    var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (gate.queueLength() != length) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("Queue length stuck at " + gate.queueLength() + ", wanted " + length);
      }
      Thread.sleep(1);
    }
  }
}
