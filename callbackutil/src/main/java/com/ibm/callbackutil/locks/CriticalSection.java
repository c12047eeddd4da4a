/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.locks;

import com.ibm.callbackutil.util.Callback;

/**
 * The code run while a {@link CallbackLock} is held.
 *
 * @param <T> the result type of the critical section
 */
@FunctionalInterface
public interface CriticalSection<T> {

  /**
   * Runs the critical section. The lock stays held until {@code release} is invoked; the outcome
   * passed to {@code release} is forwarded to the completion given to
   * {@link CallbackLock#run(CriticalSection, Callback)}. {@code release} must be invoked exactly
   * once, unless this method throws first.
   *
   * @param release releases the lock and reports the outcome
   */
  void enter(Callback<T> release);
}
