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

import eu.aylett.admission.AdmissionException.Reason;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Limits the total weight of requests in flight through a
 * {@link RequestExecutor}, queuing callers until there's room.
 * <p>
 * Give cheap requests a small weight and expensive ones (large uploads or
 * downloads, say) a larger weight. A request is only sent once its whole weight
 * fits; until then its caller waits, up to the per-call timeout or until its
 * {@link CallContext} is cancelled.
 * </p>
 * <p>
 * Every call leaves the counters as it found them, whichever way it fails. The
 * counters are for watching; the gate alone decides who gets in.
 * </p>
 *
 * @param <Q>
 *          the request type
 * @param <R>
 *          the response type
 */
public class AdmissionController<Q, R> {
  private static final Logger LOG = LoggerFactory.getLogger(AdmissionController.class);

  /**
   * The largest total weight a controller can be configured with.
   */
  public static final long MAX_TOTAL_WEIGHT = Integer.MAX_VALUE;
  /**
   * Used in place of a per-call timeout that's missing or out of range.
   */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(1);
  public static final Duration MIN_TIMEOUT = Duration.ofSeconds(1);
  public static final Duration MAX_TIMEOUT = Duration.ofHours(1);
  /**
   * Waiting weight beyond this means callers are piling up without bound.
   */
  public static final long DEFAULT_MAX_WAITING_WEIGHT = Long.MAX_VALUE / 2;

  private final @Nullable WeightedGate gate;
  private final @Nullable Counter waiting;
  private final @Nullable Counter inFlight;
  private final @Nullable Counter completed;
  private final @Nullable Counter errors;
  private final Duration perCallTimeout;
  private final @Nullable RequestExecutor<Q, R> executor;

  /**
   * A controller with the default limit on waiting weight.
   *
   * @param totalWeight
   *          the most weight allowed in flight at once; clamped to
   *          {@code [1, MAX_TOTAL_WEIGHT]}
   * @param perCallTimeout
   *          how long a call may wait for admission when no context is given;
   *          missing or outside {@code [MIN_TIMEOUT, MAX_TIMEOUT]} means
   *          {@link #DEFAULT_TIMEOUT}
   * @param executor
   *          sends admitted requests
   */
  public AdmissionController(long totalWeight, @Nullable Duration perCallTimeout, RequestExecutor<Q, R> executor) {
    this(totalWeight, perCallTimeout, DEFAULT_MAX_WAITING_WEIGHT, executor);
  }

  /**
   * A fully configurable controller.
   *
   * @param maxWaitingWeight
   *          the most weight allowed to queue for admission; calls that would
   *          exceed it fail with {@link Reason#TOO_MANY_WAITERS}
   */
  public AdmissionController(long totalWeight, @Nullable Duration perCallTimeout, long maxWaitingWeight,
      RequestExecutor<Q, R> executor) {
    var capacity = clampTotalWeight(totalWeight);
    this.gate = new WeightedGate(capacity);
    this.waiting = new Counter("waiting-weight", Math.max(1, maxWaitingWeight), OverflowPolicy.SATURATE);
    this.inFlight = new Counter("in-flight-weight", capacity, OverflowPolicy.SATURATE);
    this.completed = new Counter("completed", Long.MAX_VALUE, OverflowPolicy.ROLLOVER);
    this.errors = new Counter("errors", Long.MAX_VALUE, OverflowPolicy.ROLLOVER);
    this.perCallTimeout = normaliseTimeout(perCallTimeout);
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /**
   * Assemble a controller from parts, none of which are checked until a call is
   * made.
   */
  AdmissionController(@Nullable WeightedGate gate, @Nullable Counter waiting, @Nullable Counter inFlight,
      @Nullable Counter completed, @Nullable Counter errors, Duration perCallTimeout,
      @Nullable RequestExecutor<Q, R> executor) {
    this.gate = gate;
    this.waiting = waiting;
    this.inFlight = inFlight;
    this.completed = completed;
    this.errors = errors;
    this.perCallTimeout = perCallTimeout;
    this.executor = executor;
  }

  /**
   * A controller in front of a JDK HTTP client.
   *
   * @param executor
   *          sends admitted requests; if null, requests go to
   *          {@link HttpClientExecutor#defaultClient() the shared client}
   */
  public static AdmissionController<HttpRequest, HttpResponse<byte[]>> forHttpClient(long totalWeight,
      @Nullable Duration perCallTimeout, @Nullable RequestExecutor<HttpRequest, HttpResponse<byte[]>> executor) {
    return new AdmissionController<>(totalWeight, perCallTimeout,
        executor == null ? HttpClientExecutor.ofByteArray() : executor);
  }

  /**
   * Send a request with weight 1, waiting up to the per-call timeout for
   * admission.
   *
   * @throws AdmissionException
   *           if the request wasn't admitted, or failed once it was
   */
  public R execute(@Nullable Q request) {
    return executeWeighted(request, 1);
  }

  /**
   * Send a request with the given weight, waiting up to the per-call timeout for
   * admission.
   *
   * @throws AdmissionException
   *           if the request wasn't admitted, or failed once it was
   */
  public R executeWeighted(@Nullable Q request, long weight) {
    return executeWeighted(request, weight, CallContext.withTimeout(perCallTimeout));
  }

  /**
   * Send a request with the given weight, waiting for admission until the
   * context is done.
   * <p>
   * Weights below 1 count as 1. The context only bounds the wait for admission;
   * once admitted, the request runs for as long as the executor takes.
   * </p>
   *
   * @throws AdmissionException
   *           if the request wasn't admitted, or failed once it was
   */
  public R executeWeighted(@Nullable Q request, long weight, CallContext context) {
    if (request == null) {
      throw new AdmissionException(Reason.INVALID_REQUEST, "Request is null");
    }
    Objects.requireNonNull(context, "context");
    var normalised = Math.max(1, weight);
    if (normalised > MAX_TOTAL_WEIGHT) {
      throw overweight(normalised, MAX_TOTAL_WEIGHT);
    }

    var gate = requireCollaborator(this.gate, "gate");
    var waiting = requireCollaborator(this.waiting, "waiting-weight counter");
    var inFlight = requireCollaborator(this.inFlight, "in-flight-weight counter");
    var completed = requireCollaborator(this.completed, "completed counter");
    var errors = requireCollaborator(this.errors, "errors counter");
    var executor = requireCollaborator(this.executor, "executor");

    if (normalised > gate.capacity()) {
      throw overweight(normalised, gate.capacity());
    }

    try {
      waiting.add(normalised);
    } catch (CounterSaturatedException e) {
      throw new AdmissionException(Reason.TOO_MANY_WAITERS,
          "Too much weight waiting for admission to take " + normalised + " more", e);
    }

    try {
      gate.acquire(normalised, context);
    } catch (TimeoutException e) {
      throw stopWaiting(waiting, normalised,
          new AdmissionException(Reason.ADMISSION_TIMEOUT, "Timed out waiting for admission", e));
    } catch (CancellationException e) {
      throw stopWaiting(waiting, normalised,
          new AdmissionException(Reason.ADMISSION_CANCELLED, "Cancelled while waiting for admission", e));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw stopWaiting(waiting, normalised,
          new AdmissionException(Reason.ADMISSION_CANCELLED, "Interrupted while waiting for admission", e));
    } catch (RuntimeException e) {
      throw stopWaiting(waiting, normalised,
          new AdmissionException(Reason.INTERNAL_CONSISTENCY, "Gate refused a weight it should accept", e));
    }
    LOG.trace("Admitted request with weight {}", normalised);

    // From here on the weight is ours and must go back to the gate, whatever
    // happens
    @Nullable CounterSaturatedException inconsistency = null;
    var countedInFlight = false;
    @Nullable R response = null;
    @Nullable Exception failure = null;
    try {
      try {
        waiting.remove(normalised);
      } catch (CounterSaturatedException e) {
        inconsistency = accumulate(inconsistency, e);
      }
      try {
        inFlight.add(normalised);
        countedInFlight = true;
      } catch (CounterSaturatedException e) {
        inconsistency = accumulate(inconsistency, e);
      }

      try {
        response = executor.execute(request);
      } catch (Exception e) {
        failure = e;
      }
    } finally {
      if (countedInFlight) {
        try {
          inFlight.remove(normalised);
        } catch (CounterSaturatedException e) {
          inconsistency = accumulate(inconsistency, e);
        }
      }
      gate.release(normalised);
    }

    if (failure != null) {
      if (failure instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      errors.add();
      var executionFailed = new AdmissionException(Reason.EXECUTION_FAILED,
          "Request execution failed: " + failure.getMessage(), failure);
      if (inconsistency != null) {
        throw AdmissionException.combine(inconsistent(inconsistency), executionFailed);
      }
      throw executionFailed;
    }
    completed.add();
    if (inconsistency != null) {
      throw inconsistent(inconsistency);
    }
    return response;
  }

  /**
   * A {@link RequestExecutor} that sends every request through this controller
   * with the given weight and the per-call timeout.
   */
  public RequestExecutor<Q, R> asExecutor(long weight) {
    return request -> executeWeighted(request, weight);
  }

  public long waitingWeight() {
    return waiting == null ? 0 : waiting.read();
  }

  public long inFlightWeight() {
    return inFlight == null ? 0 : inFlight.read();
  }

  public long completedCount() {
    return completed == null ? 0 : completed.read();
  }

  public long errorCount() {
    return errors == null ? 0 : errors.read();
  }

  public long totalWeight() {
    return gate == null ? 0 : gate.capacity();
  }

  public Duration perCallTimeout() {
    return perCallTimeout;
  }

  public AdmissionStats stats() {
    return new AdmissionStats(totalWeight(), waitingWeight(), inFlightWeight(), completedCount(), errorCount());
  }

  @Nullable RequestExecutor<Q, R> executor() {
    return executor;
  }

  private static long clampTotalWeight(long totalWeight) {
    if (totalWeight < 1) {
      LOG.warn("Total weight {} is below 1, using 1", totalWeight);
      return 1;
    }
    if (totalWeight > MAX_TOTAL_WEIGHT) {
      LOG.warn("Total weight {} is above {}, using {}", totalWeight, MAX_TOTAL_WEIGHT, MAX_TOTAL_WEIGHT);
      return MAX_TOTAL_WEIGHT;
    }
    return totalWeight;
  }

  private static Duration normaliseTimeout(@Nullable Duration timeout) {
    if (timeout == null) {
      return DEFAULT_TIMEOUT;
    }
    if (timeout.compareTo(MIN_TIMEOUT) < 0 || timeout.compareTo(MAX_TIMEOUT) > 0) {
      LOG.warn("Per-call timeout {} is outside [{}, {}], using {}", timeout, MIN_TIMEOUT, MAX_TIMEOUT,
          DEFAULT_TIMEOUT);
      return DEFAULT_TIMEOUT;
    }
    return timeout;
  }

  private static <T> T requireCollaborator(@Nullable T collaborator, String name) {
    if (collaborator == null) {
      throw new AdmissionException(Reason.NOT_INITIALIZED,
          "No " + name + ", use an AdmissionController constructor to build the controller");
    }
    return collaborator;
  }

  private static AdmissionException overweight(long weight, long limit) {
    return new AdmissionException(Reason.OVERWEIGHT_REQUEST,
        "Request weight " + weight + " can never fit in total weight " + limit);
  }

  private static AdmissionException stopWaiting(Counter waiting, long weight, AdmissionException failure) {
    try {
      waiting.remove(weight);
    } catch (CounterSaturatedException e) {
      return AdmissionException.combine(failure, e);
    }
    return failure;
  }

  private static CounterSaturatedException accumulate(@Nullable CounterSaturatedException first,
      CounterSaturatedException next) {
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }

  private static AdmissionException inconsistent(CounterSaturatedException cause) {
    return new AdmissionException(Reason.INTERNAL_CONSISTENCY,
        "Admission bookkeeping went out of bounds: " + cause.getMessage(), cause);
  }
}
