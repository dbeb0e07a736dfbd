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

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a request could not be admitted, or was admitted and
 * then failed.
 * <p>
 * The {@link #reason} says which. Where the underlying request execution failed
 * the original exception is the cause.
 * </p>
 */
public class AdmissionException extends RuntimeException {
  /**
   * Why a call failed.
   */
  public enum Reason {
    /** The request was null. */
    INVALID_REQUEST,
    /** The controller is missing a collaborator. */
    NOT_INITIALIZED,
    /** The request's weight can never fit through the gate. */
    OVERWEIGHT_REQUEST,
    /** Too much weight is already waiting for admission. */
    TOO_MANY_WAITERS,
    /** The deadline passed before the request was admitted. */
    ADMISSION_TIMEOUT,
    /** The call was cancelled or interrupted before the request was admitted. */
    ADMISSION_CANCELLED,
    /** The request was admitted, and executing it failed. */
    EXECUTION_FAILED,
    /** Bookkeeping went out of bounds somewhere it never should. */
    INTERNAL_CONSISTENCY,
  }

  /**
   * Why the call failed.
   */
  public final Reason reason;

  public AdmissionException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AdmissionException(Reason reason, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  /**
   * Fold a secondary failure into a primary one: the result keeps the primary's
   * reason and cause, names both failures in its message, and carries the
   * secondary as a suppressed exception.
   */
  public static AdmissionException combine(AdmissionException primary, Throwable secondary) {
    var combined = new AdmissionException(primary.reason, primary.getMessage() + "; also: " + secondary.getMessage(),
        primary.getCause());
    for (var suppressed : primary.getSuppressed()) {
      combined.addSuppressed(suppressed);
    }
    combined.addSuppressed(secondary);
    return combined;
  }
}
