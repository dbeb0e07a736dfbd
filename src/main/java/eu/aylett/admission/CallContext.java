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

import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Carries a cancellation signal and an optional deadline into a blocking
 * admission call.
 * <p>
 * A context is done once it has been cancelled or its deadline has passed.
 * Deadlines are measured against {@link System#nanoTime()}; nothing runs when a
 * deadline passes, so waiters are expected to bound their own waits with
 * {@link #remainingNanos()}. Cancellation is pushed to registered listeners.
 * </p>
 */
public final class CallContext {
  /**
   * Why a context finished.
   */
  public enum Cause {
    CANCELLED, DEADLINE_EXCEEDED,
  }

  /**
   * Handle for a listener registered with {@link #onDone(Runnable)}.
   */
  public interface Registration extends AutoCloseable {
    /**
     * Deregister the listener. Has no effect if it already ran.
     */
    @Override
    void close();
  }

  private final boolean hasDeadline;
  private final long deadlineNanos;
  private final LongSupplier nanoClock;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

  CallContext(boolean hasDeadline, long deadlineNanos, LongSupplier nanoClock) {
    this.hasDeadline = hasDeadline;
    this.deadlineNanos = deadlineNanos;
    this.nanoClock = nanoClock;
  }

  /**
   * A context with no deadline, finished only by {@link #cancel()}.
   */
  public static CallContext background() {
    return new CallContext(false, 0, System::nanoTime);
  }

  /**
   * A context whose deadline is {@code timeout} from now. Timeouts too large to
   * represent in nanoseconds are treated as having no deadline.
   */
  public static CallContext withTimeout(Duration timeout) {
    var nanos = TimeUnit.NANOSECONDS.convert(timeout);
    if (nanos >= Long.MAX_VALUE / 2) {
      return background();
    }
    return new CallContext(true, System.nanoTime() + Math.max(0, nanos), System::nanoTime);
  }

  /**
   * A context whose deadline is the given {@link System#nanoTime()} reading. A
   * deadline already in the past gives a context that is done from the start.
   */
  public static CallContext withDeadline(long deadlineNanos) {
    return new CallContext(true, deadlineNanos, System::nanoTime);
  }

  /**
   * Cancel this context, running every registered listener once. Later calls do
   * nothing.
   */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      for (var listener : listeners) {
        // Only the caller that manages to remove a listener gets to run it
        if (listeners.remove(listener)) {
          listener.run();
        }
      }
    }
  }

  /**
   * Register a listener to run when this context is cancelled. If it has already
   * been cancelled the listener runs immediately, on the calling thread.
   */
  public Registration onDone(Runnable listener) {
    listeners.add(listener);
    if (cancelled.get() && listeners.remove(listener)) {
      listener.run();
    }
    return () -> listeners.remove(listener);
  }

  public boolean isDone() {
    return cause() != null;
  }

  /**
   * Why this context is done, or null if it is still live. Cancellation wins over
   * an expired deadline.
   */
  public @Nullable Cause cause() {
    if (cancelled.get()) {
      return Cause.CANCELLED;
    }
    if (hasDeadline && nanoClock.getAsLong() - deadlineNanos >= 0) {
      return Cause.DEADLINE_EXCEEDED;
    }
    return null;
  }

  /**
   * Nanoseconds until the deadline, which may be negative once it has passed, or
   * {@link Long#MAX_VALUE} when there is no deadline.
   */
  @Contract(pure = true)
  public long remainingNanos() {
    if (!hasDeadline) {
      return Long.MAX_VALUE;
    }
    return deadlineNanos - nanoClock.getAsLong();
  }

  public boolean hasDeadline() {
    return hasDeadline;
  }
}
