/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.util;

import java.time.Duration;

/**
 * A single logical thread of control on which continuations are interleaved.
 *
 * <p>
 * Components in this library never recurse into a queued continuation synchronously; instead they
 * hand it to {@link #execute(Runnable)} so that it runs on a later tick with a fresh stack. All
 * tasks submitted to one loop run one at a time, in submission order for {@code execute} and in
 * deadline order for {@code schedule}.
 */
public interface EventLoop {

  /**
   * Runs {@code task} on a later tick of this loop. The task is never run before this method
   * returns.
   *
   * @param task the task to run
   */
  void execute(Runnable task);

  /**
   * Runs {@code task} on this loop once {@code delay} has elapsed.
   *
   * @param task the task to run
   * @param delay the minimum delay before running, must not be negative
   */
  void schedule(Runnable task, Duration delay);
}
