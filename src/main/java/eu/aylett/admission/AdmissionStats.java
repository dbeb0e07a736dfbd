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
 * A point-in-time view of an {@link AdmissionController}'s counters. Each value
 * is read separately, so under load they may not add up exactly.
 */
public record AdmissionStats(long totalWeight, long waitingWeight, long inFlightWeight, long completedCount,
    long errorCount) {
}
