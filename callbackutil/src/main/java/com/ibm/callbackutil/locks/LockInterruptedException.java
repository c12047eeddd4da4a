/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.locks;

/**
 * The failure reported by a cancellation point which gave up its work because other callers were
 * waiting for the lock.
 *
 * <p>
 * This is distinct from an ordinary operation failure: retry wrappers stop retrying when they see
 * it and hand it back to their caller unchanged.
 *
 * @see CallbackLock#cancels(com.ibm.callbackutil.util.AsyncTask)
 */
public class LockInterruptedException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public LockInterruptedException(final String message) {
    super(message);
  }

  /**
   * Tests whether {@code failure} is a cooperative interruption.
   *
   * @param failure a reported failure, may be null
   * @return true if {@code failure} is a {@link LockInterruptedException}
   */
  public static boolean isInterruption(final Throwable failure) {
    return failure instanceof LockInterruptedException;
  }
}
