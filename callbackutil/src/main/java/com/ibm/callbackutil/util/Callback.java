/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.util;

/**
 * A completion continuation. An asynchronous operation invokes its callback exactly once, either
 * with a result and a {@code null} failure, or with a non-null failure.
 *
 * <p>
 * The argument order follows {@link java.util.concurrent.CompletionStage#whenComplete}: the result
 * comes first, the failure second. A {@code null} failure always means success, in which case the
 * result may itself be {@code null}.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface Callback<T> {

  /**
   * Reports the outcome of an asynchronous operation.
   *
   * @param result the result of the operation, meaningful only if {@code failure} is null
   * @param failure the failure of the operation, or null if it succeeded
   */
  void complete(T result, Throwable failure);

  /**
   * Reports a successful outcome.
   *
   * @param result the result, may be null
   */
  default void succeed(final T result) {
    complete(result, null);
  }

  /**
   * Reports a failed outcome.
   *
   * @param failure the failure, must not be null
   * @throws NullPointerException if {@code failure} is null
   */
  default void fail(final Throwable failure) {
    if (failure == null) {
      throw new NullPointerException("failure");
    }
    complete(null, failure);
  }
}
