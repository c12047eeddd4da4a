/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.retry;

/**
 * A side effect run after each failed attempt of a delayed retry. The retry does not start waiting
 * for the next attempt until the handler calls {@code done}.
 */
@FunctionalInterface
public interface FailureHandler {

  /**
   * Handles a failed attempt.
   *
   * @param failure the failure the attempt reported
   * @param done to be run once handling is finished
   */
  void onFailure(Throwable failure, Runnable done);

  /**
   * @return a handler which does nothing and signals done immediately
   */
  static FailureHandler none() {
    return (failure, done) -> done.run();
  }
}
