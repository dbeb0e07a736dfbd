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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A weighted semaphore: callers acquire some weight out of a fixed capacity, and
 * give it back when they're done.
 * <p>
 * Waiters are served strictly in arrival order. A heavy waiter at the head of
 * the queue holds up lighter waiters behind it, even if there would be room for
 * them, so large requests can't be starved by a stream of small ones.
 * </p>
 * <p>
 * The gate doesn't track who holds what: releasing weight that wasn't acquired
 * is a caller bug. Releasing more than is currently held is detected.
 * </p>
 */
public final class WeightedGate {
  private final long capacity;
  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<Waiter> waiters = new ArrayDeque<>();
  private long held;

  private final class Waiter {
    final long weight;
    final Condition ready = lock.newCondition();
    boolean granted;

    Waiter(long weight) {
      this.weight = weight;
    }
  }

  /**
   * @param capacity
   *          the total weight that may be held at once; must be positive
   */
  public WeightedGate(long capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Gate capacity must be positive, was " + capacity);
    }
    this.capacity = capacity;
  }

  /**
   * Block until {@code weight} is available and this caller is first in line,
   * then take it.
   * <p>
   * If the weight is granted at the same moment the context finishes, the grant
   * wins and this method returns normally.
   * </p>
   *
   * @throws IllegalArgumentException
   *           if {@code weight} is less than one or more than the capacity
   * @throws TimeoutException
   *           if the context's deadline passed first
   * @throws CancellationException
   *           if the context was cancelled first
   * @throws InterruptedException
   *           if the thread was interrupted while waiting
   */
  public void acquire(long weight, CallContext context) throws InterruptedException, TimeoutException {
    checkWeight(weight);
    lock.lock();
    try {
      if (waiters.isEmpty() && capacity - held >= weight) {
        held += weight;
        return;
      }
      failIfDone(context, weight);

      var waiter = new Waiter(weight);
      waiters.addLast(waiter);
      try (var ignored = context.onDone(() -> wake(waiter))) {
        while (!waiter.granted) {
          if (context.isDone()) {
            abandon(waiter);
            failIfDone(context, weight);
          }
          var remaining = context.remainingNanos();
          if (remaining == Long.MAX_VALUE) {
            waiter.ready.await();
          } else {
            waiter.ready.awaitNanos(remaining);
          }
        }
      } catch (InterruptedException e) {
        if (waiter.granted) {
          // Granted between the interrupt and us waking up: hand it back
          held -= weight;
          notifyWaiters();
        } else {
          abandon(waiter);
        }
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Take {@code weight} if it's available right now and nobody is queued ahead.
   *
   * @return whether the weight was taken
   */
  public boolean tryAcquire(long weight) {
    checkWeight(weight);
    lock.lock();
    try {
      if (waiters.isEmpty() && capacity - held >= weight) {
        held += weight;
        return true;
      }
      return false;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Give back weight from a successful acquisition, waking any waiters that now
   * fit.
   *
   * @throws IllegalStateException
   *           if more weight is released than is currently held
   */
  public void release(long weight) {
    if (weight < 1) {
      throw new IllegalArgumentException("Released weight must be positive, was " + weight);
    }
    lock.lock();
    try {
      if (weight > held) {
        throw new IllegalStateException("Released " + weight + " but only " + held + " is held");
      }
      held -= weight;
      notifyWaiters();
    } finally {
      lock.unlock();
    }
  }

  public long capacity() {
    return capacity;
  }

  public long held() {
    lock.lock();
    try {
      return held;
    } finally {
      lock.unlock();
    }
  }

  public int queueLength() {
    lock.lock();
    try {
      return waiters.size();
    } finally {
      lock.unlock();
    }
  }

  private void checkWeight(long weight) {
    if (weight < 1) {
      throw new IllegalArgumentException("Requested weight must be positive, was " + weight);
    }
    if (weight > capacity) {
      throw new IllegalArgumentException("Requested weight " + weight + " exceeds gate capacity " + capacity);
    }
  }

  private static void failIfDone(CallContext context, long weight) throws TimeoutException {
    var cause = context.cause();
    if (cause == null) {
      return;
    }
    switch (cause) {
      case CANCELLED -> throw new CancellationException("Cancelled while waiting for weight " + weight);
      case DEADLINE_EXCEEDED -> throw new TimeoutException("Deadline passed while waiting for weight " + weight);
    }
  }

  private void wake(Waiter waiter) {
    lock.lock();
    try {
      waiter.ready.signal();
    } finally {
      lock.unlock();
    }
  }

  // Must hold the lock
  private void abandon(Waiter waiter) {
    var wasFront = waiters.peekFirst() == waiter;
    waiters.remove(waiter);
    // A waiter behind us may have been blocked only by our weight
    if (wasFront && held < capacity) {
      notifyWaiters();
    }
  }

  // Must hold the lock
  private void notifyWaiters() {
    Waiter next;
    while ((next = waiters.peekFirst()) != null) {
      if (capacity - held < next.weight) {
        break;
      }
      held += next.weight;
      next.granted = true;
      waiters.removeFirst();
      next.ready.signal();
    }
  }
}
