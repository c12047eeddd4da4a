/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ibm.callbackutil.locks.LockInterruptedException;
import com.ibm.callbackutil.util.AsyncTask;
import com.ibm.callbackutil.util.Callback;

/**
 * One invocation of an interruption-aware retry.
 *
 * <p>
 * The bounded retry treats any failure as retryable. To keep a {@link LockInterruptedException}
 * from being retried, the task's callback is intercepted: an interruption is stored in a single
 * slot and the attempt is reported to the retry as a success, which ends the loop. When the retry
 * completes, a stored interruption replaces whatever outcome the retry computed, and the slot is
 * cleared.
 */
final class InterruptAwareRetry<T> {
  private static final Logger log = LoggerFactory.getLogger(InterruptAwareRetry.class);

  private LockInterruptedException capturedInterrupt;

  private InterruptAwareRetry() {}

  static <T> void retry(final RetryOptions options, final AsyncTask<T> task,
      final Callback<? super T> completion) {
    final InterruptAwareRetry<T> retry = new InterruptAwareRetry<>();
    Retries.retryBounded(options, retry.capturing(task), retry.delivering(completion));
  }

  private AsyncTask<T> capturing(final AsyncTask<T> task) {
    return attempt -> task.run((result, failure) -> {
      if (LockInterruptedException.isInterruption(failure)) {
        if (this.capturedInterrupt != null) {
          throw new IllegalStateException("interruption already captured", failure);
        }
        log.debug("attempt interrupted, ending retry");
        this.capturedInterrupt = (LockInterruptedException) failure;
        attempt.succeed(null);
      } else {
        attempt.complete(result, failure);
      }
    });
  }

  private Callback<T> delivering(final Callback<? super T> completion) {
    return (result, failure) -> {
      final LockInterruptedException interrupt = this.capturedInterrupt;
      if (interrupt != null) {
        this.capturedInterrupt = null;
        completion.complete(null, interrupt);
      } else {
        completion.complete(result, failure);
      }
    };
  }
}
