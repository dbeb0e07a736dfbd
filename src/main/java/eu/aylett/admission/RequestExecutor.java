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
 * Sends a request and returns its response. Usually an HTTP client.
 *
 * @param <Q>
 *          the request type
 * @param <R>
 *          the response type
 */
@FunctionalInterface
public interface RequestExecutor<Q, R> {
  R execute(Q request) throws Exception;
}
