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
 * What a {@link Counter} does when a mutation would take it out of bounds.
 */
public enum OverflowPolicy {
  /**
   * Refuse the mutation and throw {@link CounterSaturatedException}. For counts
   * where hitting a bound means something has gone wrong.
   */
  SATURATE,
  /**
   * Wrap to zero when adding past the maximum; ignore removals below zero. For
   * cumulative statistics that must never get in the way of real work.
   */
  ROLLOVER,
}
