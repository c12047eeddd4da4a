/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.locks;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ibm.callbackutil.util.AsyncFunction;
import com.ibm.callbackutil.util.AsyncTask;
import com.ibm.callbackutil.util.Callback;
import com.ibm.callbackutil.util.EventLoop;

/**
 * A {@link CallbackLock} which enforces fairness in its acquisition ordering
 */
public class FairCallbackLock implements CallbackLock {
  /*
   * Each caller that cannot run immediately is appended to the waiter queue as an "acquired"
   * thunk. Releasing the lock pops the head waiter and hands it to the event loop, so the waiter
   * starts on a fresh stack. Between that release and the waiter's tick the lock is free but
   * spoken for: `handingOff` is set, and new callers queue up behind the existing waiters instead
   * of barging in ahead of the one about to run.
   */

  private static final Logger log = LoggerFactory.getLogger(FairCallbackLock.class);

  private final EventLoop eventLoop;
  private final Queue<Runnable> waiters = new ArrayDeque<>();
  private boolean locked;
  private boolean handingOff;
  private boolean cancellable;

  public FairCallbackLock(final EventLoop eventLoop) {
    this(eventLoop, CallbackLock.defaultCancellable());
  }

  public FairCallbackLock(final EventLoop eventLoop, final boolean cancellable) {
    this.eventLoop = Objects.requireNonNull(eventLoop);
    this.cancellable = cancellable;
  }

  @Override
  public <T> void run(final CriticalSection<T> criticalSection,
      final Callback<? super T> completion) {
    Objects.requireNonNull(criticalSection);
    Objects.requireNonNull(completion);
    final Runnable acquired = () -> acquired(criticalSection, completion);
    if (this.locked || this.handingOff || !this.waiters.isEmpty()) {
      this.waiters.add(acquired);
    } else {
      acquired.run();
    }
  }

  private <T> void acquired(final CriticalSection<T> criticalSection,
      final Callback<? super T> completion) {
    this.handingOff = false;
    this.locked = true;
    final Release<T> release = new Release<>(completion);
    try {
      criticalSection.enter(release);
    } catch (final Throwable t) {
      if (!release.released) {
        release.released = true;
        final Runnable next = unlock();
        try {
          completion.complete(null, t);
        } catch (final RuntimeException e) {
          t.addSuppressed(e);
        } finally {
          wake(next);
        }
      }
      throw t;
    }
  }

  /*
   * Frees the lock and claims the head waiter before any completion runs, so a completion which
   * calls run() again queues behind that waiter instead of taking the lock inline.
   */
  private Runnable unlock() {
    this.locked = false;
    final Runnable next = this.waiters.poll();
    if (next != null) {
      this.handingOff = true;
    }
    return next;
  }

  private void wake(final Runnable next) {
    if (next != null) {
      this.eventLoop.execute(next);
    }
  }

  private final class Release<T> implements Callback<T> {
    private final Callback<? super T> completion;
    boolean released;

    Release(final Callback<? super T> completion) {
      this.completion = completion;
    }

    @Override
    public void complete(final T result, final Throwable failure) {
      if (this.released) {
        throw new IllegalStateException("released lock not in locked state");
      }
      this.released = true;
      final Runnable next = unlock();
      try {
        this.completion.complete(result, failure);
      } finally {
        wake(next);
      }
    }
  }

  @Override
  public <T> AsyncTask<T> cancels(final AsyncTask<T> cancellationPoint) {
    Objects.requireNonNull(cancellationPoint);
    return callback -> {
      if (interrupt(callback)) {
        return;
      }
      cancellationPoint.run(callback);
    };
  }

  @Override
  public <A, T> AsyncFunction<A, T> cancels(final AsyncFunction<A, T> cancellationPoint) {
    Objects.requireNonNull(cancellationPoint);
    return (argument, callback) -> {
      if (interrupt(callback)) {
        return;
      }
      cancellationPoint.apply(argument, callback);
    };
  }

  /*
   * Fails the callback and returns true if the cancellation point must be skipped. Only a holder of
   * the lock is interrupted.
   */
  private boolean interrupt(final Callback<?> callback) {
    if (this.cancellable && !this.locked) {
      log.warn("cancellation point reached while {} is not held", this);
      return false;
    }
    if (!shouldCancel()) {
      return false;
    }
    log.debug("interrupting critical section, {} waiter(s) queued", this.waiters.size());
    callback.fail(new LockInterruptedException(
        "interrupted: " + this.waiters.size() + " waiter(s) queued for the lock"));
    return true;
  }

  @Override
  public boolean shouldCancel() {
    return this.cancellable && !this.waiters.isEmpty();
  }

  @Override
  public boolean isCancellable() {
    return this.cancellable;
  }

  @Override
  public void setCancellable(final boolean cancellable) {
    this.cancellable = cancellable;
  }

  @Override
  public boolean isLocked() {
    return this.locked;
  }

  @Override
  public int getQueueLength() {
    return this.waiters.size();
  }

  @Override
  public String toString() {
    return "FairCallbackLock[" + (this.locked ? "locked" : "unlocked")
        + ", waiters=" + this.waiters.size() + "]";
  }
}
