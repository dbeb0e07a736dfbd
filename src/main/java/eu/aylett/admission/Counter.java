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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A named, bounded, thread-safe count.
 * <p>
 * The count always stays within {@code [0, maximum]}; what happens when a
 * mutation would leave that range depends on the {@link OverflowPolicy}.
 * Mutations are exclusive, reads share.
 * </p>
 */
public final class Counter {
  private static final Logger LOG = LoggerFactory.getLogger(Counter.class);

  private final String name;
  private final long maximum;
  private final OverflowPolicy policy;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private long count;

  /**
   * @param name
   *          used in error messages
   * @param maximum
   *          the largest count allowed; must be positive
   * @param policy
   *          what to do when a mutation would go out of bounds
   */
  public Counter(String name, long maximum, OverflowPolicy policy) {
    if (maximum < 1) {
      throw new IllegalArgumentException("Counter " + name + " needs a positive maximum, was " + maximum);
    }
    this.name = name;
    this.maximum = maximum;
    this.policy = policy;
  }

  public void add() {
    add(1);
  }

  /**
   * Add {@code delta} to the count.
   * <p>
   * A rolling-over counter that would pass its maximum resets to zero and then
   * adds, so driving a counter with maximum M through M + 1 single increments
   * leaves it at 1.
   * </p>
   *
   * @throws CounterSaturatedException
   *           if a saturating counter would pass its maximum
   */
  public void add(long delta) {
    checkDelta(delta);
    if (policy == OverflowPolicy.ROLLOVER && delta > maximum) {
      throw new IllegalArgumentException("Counter " + name + " cannot add " + delta + " past maximum " + maximum);
    }
    lock.writeLock().lock();
    try {
      if (delta > maximum - count) {
        if (policy == OverflowPolicy.SATURATE) {
          throw new CounterSaturatedException(name, count, delta, maximum);
        }
        count = 0;
      }
      count += delta;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void remove() {
    remove(1);
  }

  /**
   * Remove {@code delta} from the count. A rolling-over counter ignores removals
   * that would take it below zero.
   *
   * @throws CounterSaturatedException
   *           if a saturating counter would go below zero
   */
  public void remove(long delta) {
    checkDelta(delta);
    lock.writeLock().lock();
    try {
      if (delta > count) {
        if (policy == OverflowPolicy.SATURATE) {
          throw new CounterSaturatedException(name, count, -delta, maximum);
        }
        LOG.debug("Ignoring removal of {} from counter {} at {}", delta, name, count);
        return;
      }
      count -= delta;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public long read() {
    lock.readLock().lock();
    try {
      return count;
    } finally {
      lock.readLock().unlock();
    }
  }

  public long maximum() {
    return maximum;
  }

  public String name() {
    return name;
  }

  public OverflowPolicy policy() {
    return policy;
  }

  private void checkDelta(long delta) {
    if (delta < 0) {
      throw new IllegalArgumentException("Counter " + name + " needs a non-negative delta, was " + delta);
    }
  }

  @Override
  public String toString() {
    return name + "=" + read() + "/" + maximum;
  }
}
