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

/**
 * Weighted admission control for clients of rate- or capacity-limited services.
 * <p>
 * An {@link eu.aylett.admission.AdmissionController} sits in front of an HTTP
 * client (or anything else that turns requests into responses) and lets at most
 * a fixed total weight of requests through at once. Callers that don't fit wait
 * their turn, in order, until there's room or their time runs out.
 * </p>
 * <p>
 * Use one controller per limited resource, normally one per downstream service,
 * and share it between every thread that calls that service. Weights are yours
 * to choose: a weight of 1 for everything makes the controller a plain
 * concurrency limit.
 * </p>
 * <p>
 * Nothing here retries. A failed call leaves the controller exactly as it was,
 * so retrying is safe, but it's up to the caller.
 * </p>
 */
@NullMarked
package eu.aylett.admission;

import org.jspecify.annotations.NullMarked;
