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

/**
 * Thrown when a {@link OverflowPolicy#SATURATE saturating} counter is asked to
 * move outside its bounds. The counter is left unchanged.
 */
public class CounterSaturatedException extends RuntimeException {
  /**
   * The name of the counter that refused the mutation.
   */
  public final String counter;
  /**
   * The count at the time of the attempt.
   */
  public final long count;
  /**
   * The attempted change; negative for removals.
   */
  public final long delta;
  /**
   * The counter's configured maximum.
   */
  public final long maximum;

  public CounterSaturatedException(String counter, long count, long delta, long maximum) {
    super("Counter " + counter + " cannot " + (delta < 0 ? "remove " + -delta : "add " + delta) + " (count " + count
        + ", bounds [0, " + maximum + "])");
    this.counter = counter;
    this.count = count;
    this.delta = delta;
    this.maximum = maximum;
  }
}
