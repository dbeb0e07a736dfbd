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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricFilter;
import com.codahale.metrics.MetricRegistry;

/**
 * Publishes an {@link AdmissionController}'s counters as gauges.
 */
public final class AdmissionMetrics {
  private AdmissionMetrics() {
  }

  /**
   * Register gauges for total, waiting and in-flight weight and the completed
   * and error counts, named under {@code prefix}. The gauges read the live
   * counters every time they're sampled.
   *
   * @throws IllegalArgumentException
   *           if any of the names is already registered
   */
  public static void register(MetricRegistry registry, String prefix, AdmissionController<?, ?> controller) {
    registry.register(MetricRegistry.name(prefix, "total-weight"), (Gauge<Long>) controller::totalWeight);
    registry.register(MetricRegistry.name(prefix, "waiting-weight"), (Gauge<Long>) controller::waitingWeight);
    registry.register(MetricRegistry.name(prefix, "in-flight-weight"), (Gauge<Long>) controller::inFlightWeight);
    registry.register(MetricRegistry.name(prefix, "completed"), (Gauge<Long>) controller::completedCount);
    registry.register(MetricRegistry.name(prefix, "errors"), (Gauge<Long>) controller::errorCount);
  }

  /**
   * Remove everything registered under {@code prefix}.
   */
  public static void unregister(MetricRegistry registry, String prefix) {
    registry.removeMatching(MetricFilter.startsWith(prefix + "."));
  }
}
