/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.locks;

import com.ibm.callbackutil.util.AsyncFunction;
import com.ibm.callbackutil.util.AsyncTask;
import com.ibm.callbackutil.util.Callback;
import com.ibm.callbackutil.util.EventLoop;

/**
 * A mutual exclusion lock for callback-style code running on a single {@link EventLoop}.
 *
 * <p>
 * Callers hand the lock a {@link CriticalSection}; at most one critical section runs at a time and
 * queued callers are served in the order they called {@link #run(CriticalSection, Callback)}. The
 * lock never blocks: a caller that finds the lock held is queued and {@code run} returns at once.
 *
 * <p>
 * Since a running critical section cannot be preempted, the lock offers cooperative cancellation.
 * A long critical section marks some of its steps as cancellation points with
 * {@link #cancels(AsyncTask)}; when the lock is {@link #isCancellable() cancellable} and another
 * caller is queued, such a step skips its work and fails with a {@link LockInterruptedException},
 * letting the critical section give up the lock early.
 *
 * <p>
 * Implementations are confined to their event loop and are not thread-safe.
 */
public interface CallbackLock {

  /**
   * System property holding the default for {@link #isCancellable()}; {@code true} if unset.
   */
  String CANCELLABLE_PROPERTY = "com.ibm.callbackutil.locks.cancellable";

  /**
   * Runs {@code criticalSection} once the lock is acquired. If the lock is free and nobody is
   * queued, the critical section runs before this method returns; otherwise the caller is queued.
   *
   * <p>
   * {@code completion} is invoked exactly once with the outcome the critical section passes to its
   * release callback. If the critical section throws before releasing, the lock is released,
   * {@code completion} receives the thrown exception, the next waiter is woken and the exception is
   * rethrown to whoever invoked the critical section.
   *
   * <p>
   * The next waiter is chosen before {@code completion} runs, so a completion which calls
   * {@code run} again queues behind that waiter, or takes the lock if nobody was waiting.
   *
   * <p>
   * After a release the next waiter always starts on a later tick of the event loop, so arbitrarily
   * long queues never deepen the stack.
   *
   * @param criticalSection the code to run while holding the lock
   * @param completion receives the outcome of the critical section
   */
  <T> void run(CriticalSection<T> criticalSection, Callback<? super T> completion);

  /**
   * Marks {@code cancellationPoint} as a step that may be skipped. Running the returned task checks
   * {@link #shouldCancel()}: if true the task's callback fails immediately with a
   * {@link LockInterruptedException} and {@code cancellationPoint} is not run; otherwise it runs
   * normally. A step reached while the lock is not held is never interrupted.
   *
   * @param cancellationPoint a step of a critical section guarded by this lock
   * @return the guarded step
   */
  <T> AsyncTask<T> cancels(AsyncTask<T> cancellationPoint);

  /**
   * Marks a one-argument step as a cancellation point.
   *
   * @see #cancels(AsyncTask)
   */
  <A, T> AsyncFunction<A, T> cancels(AsyncFunction<A, T> cancellationPoint);

  /**
   * The explicit cancellation check used by cancellation points.
   *
   * @return true if this lock is cancellable and at least one caller is queued for it
   */
  boolean shouldCancel();

  boolean isCancellable();

  /**
   * Switches cooperative cancellation on or off. While off, every cancellation point runs normally.
   */
  void setCancellable(boolean cancellable);

  /**
   * @return true if a critical section currently holds the lock
   */
  boolean isLocked();

  /**
   * @return the number of callers queued for the lock
   */
  int getQueueLength();

  /**
   * Creates a {@link CallbackLock} whose cancellation switch defaults to the
   * {@link #CANCELLABLE_PROPERTY} system property.
   *
   * @param eventLoop the loop on which queued callers are woken
   * @return a new fair lock
   */
  static CallbackLock create(final EventLoop eventLoop) {
    return new FairCallbackLock(eventLoop, defaultCancellable());
  }

  /**
   * Creates a {@link CallbackLock} with an explicit cancellation switch.
   *
   * @param eventLoop the loop on which queued callers are woken
   * @param cancellable the initial state of the cancellation switch
   * @return a new fair lock
   */
  static CallbackLock create(final EventLoop eventLoop, final boolean cancellable) {
    return new FairCallbackLock(eventLoop, cancellable);
  }

  /**
   * @return the configured default for the cancellation switch
   */
  static boolean defaultCancellable() {
    return Boolean.parseBoolean(System.getProperty(CANCELLABLE_PROPERTY, "true"));
  }
}
