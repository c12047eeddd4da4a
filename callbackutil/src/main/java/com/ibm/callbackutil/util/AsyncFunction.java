/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.util;

/**
 * An asynchronous operation which takes a single argument and reports its outcome to a
 * {@link Callback}.
 *
 * @param <A> the argument type
 * @param <T> the result type
 */
@FunctionalInterface
public interface AsyncFunction<A, T> {

  /**
   * Starts the operation on {@code argument}. The callback must eventually be invoked exactly once.
   *
   * @param argument the input of the operation
   * @param callback the completion continuation
   */
  void apply(A argument, Callback<T> callback);

  /**
   * Binds {@code argument} to this function, producing an {@link AsyncTask}.
   *
   * @param argument the input to bind
   * @return a task which applies this function to {@code argument}
   */
  default AsyncTask<T> bind(final A argument) {
    return callback -> apply(argument, callback);
  }
}
