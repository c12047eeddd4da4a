/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.util;

/**
 * An asynchronous operation which takes no argument and reports its outcome to a {@link Callback}.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface AsyncTask<T> {

  /**
   * Starts the operation. The callback must eventually be invoked exactly once.
   *
   * @param callback the completion continuation
   */
  void run(Callback<T> callback);
}
