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

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodyHandlers;

/**
 * Executes requests synchronously on a JDK {@link HttpClient}.
 *
 * @param <T>
 *          the response body type
 */
public final class HttpClientExecutor<T> implements RequestExecutor<HttpRequest, HttpResponse<T>> {
  private final HttpClient client;
  private final BodyHandler<T> bodyHandler;

  public HttpClientExecutor(HttpClient client, BodyHandler<T> bodyHandler) {
    this.client = client;
    this.bodyHandler = bodyHandler;
  }

  /**
   * Read whole response bodies as bytes, using a client shared across the JVM.
   */
  public static HttpClientExecutor<byte[]> ofByteArray() {
    return ofByteArray(defaultClient());
  }

  public static HttpClientExecutor<byte[]> ofByteArray(HttpClient client) {
    return new HttpClientExecutor<>(client, BodyHandlers.ofByteArray());
  }

  /**
   * The shared client, created on first use.
   */
  public static HttpClient defaultClient() {
    return DefaultClientHolder.CLIENT;
  }

  @Override
  public HttpResponse<T> execute(HttpRequest request) throws IOException, InterruptedException {
    return client.send(request, bodyHandler);
  }

  HttpClient client() {
    return client;
  }

  private static final class DefaultClientHolder {
    static final HttpClient CLIENT = HttpClient.newHttpClient();
  }
}
