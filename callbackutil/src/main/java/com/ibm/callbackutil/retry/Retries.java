/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.retry;

import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ibm.callbackutil.locks.LockInterruptedException;
import com.ibm.callbackutil.util.AsyncTask;
import com.ibm.callbackutil.util.Callback;
import com.ibm.callbackutil.util.Callbacks;
import com.ibm.callbackutil.util.EventLoop;

/**
 * Static methods for retrying callback-style {@link AsyncTask AsyncTasks}.
 *
 * <p>
 * The {@code retry} methods are aware of cooperative lock cancellation: an attempt that fails with
 * a {@link LockInterruptedException} is never retried, and that interruption is what the caller's
 * callback receives, exactly once. Any other failure is retried up to the configured number of
 * attempts, after which the last failure is reported.
 *
 * <pre>
 * {@code
 * Retries.retry(3, callback -> lock.run(release -> write(release), callback),
 *     (result, failure) -> {
 *       if (LockInterruptedException.isInterruption(failure)) {
 *         // gave up the lock to a waiter
 *       }
 *     });
 * }
 * </pre>
 */
public final class Retries {
  private static final Logger log = LoggerFactory.getLogger(Retries.class);

  private Retries() {}

  /**
   * Runs {@code task} up to {@code times} times, stopping at the first success or interruption.
   *
   * @param times the maximum number of attempts
   * @param task the task to attempt
   * @param completion receives the first success, the interruption, or the last failure
   */
  public static <T> void retry(final int times, final AsyncTask<T> task,
      final Callback<? super T> completion) {
    retry(RetryOptions.times(times), task, completion);
  }

  /**
   * Runs {@code task} as configured by {@code options}, stopping at the first success or
   * interruption.
   *
   * @param options the attempt bound, interval and error filter
   * @param task the task to attempt
   * @param completion receives the first success, the interruption, or the last failure
   */
  public static <T> void retry(final RetryOptions options, final AsyncTask<T> task,
      final Callback<? super T> completion) {
    Objects.requireNonNull(options);
    Objects.requireNonNull(task);
    Objects.requireNonNull(completion);
    InterruptAwareRetry.retry(options, task, completion);
  }

  /**
   * Retries {@code task} up to {@code times} times, waiting {@code delay} between attempts.
   *
   * @see #retryWithDelay(EventLoop, int, Duration, AsyncTask, Callback, FailureHandler)
   */
  public static <T> void retryWithDelay(final EventLoop eventLoop, final int times,
      final Duration delay, final AsyncTask<T> task, final Callback<? super T> completion) {
    retryWithDelay(eventLoop, times, delay, task, completion, FailureHandler.none());
  }

  /**
   * Retries {@code task} up to {@code times} times. After each failed attempt {@code onFailure}
   * runs; once it signals done, the retry waits {@code delay} on {@code eventLoop} and makes the
   * next attempt. No delay follows the final attempt, and a success is reported at once.
   *
   * <p>
   * An interrupted attempt skips both {@code onFailure} and the delay, and ends the retry.
   *
   * @param eventLoop the loop used to wait out the delay
   * @param times the maximum number of attempts
   * @param delay the wait between a handled failure and the next attempt
   * @param task the task to attempt
   * @param completion receives the first success, the interruption, or the last failure
   * @param onFailure run after each failed attempt
   */
  public static <T> void retryWithDelay(final EventLoop eventLoop, final int times,
      final Duration delay, final AsyncTask<T> task, final Callback<? super T> completion,
      final FailureHandler onFailure) {
    Objects.requireNonNull(eventLoop);
    Objects.requireNonNull(delay);
    Objects.requireNonNull(task);
    Objects.requireNonNull(onFailure);
    retry(times, new DelayedAttempts<>(eventLoop, times, delay, task, onFailure), completion);
  }

  /**
   * The bounded retry loop: attempts {@code task} until it succeeds, the attempts are exhausted, or
   * it reports a failure the options do not consider retryable. Unaware of interruptions.
   */
  static <T> void retryBounded(final RetryOptions options, final AsyncTask<T> task,
      final Callback<? super T> completion) {
    new BoundedAttempts<>(options, task, completion).attempt();
  }

  private static final class BoundedAttempts<T> {
    private final RetryOptions options;
    private final AsyncTask<T> task;
    private final Callback<? super T> completion;
    private int attempt;

    BoundedAttempts(final RetryOptions options, final AsyncTask<T> task,
        final Callback<? super T> completion) {
      this.options = options;
      this.task = task;
      this.completion = completion;
    }

    void attempt() {
      this.attempt++;
      this.task.run(Callbacks.once(this::attempted));
    }

    private void attempted(final T result, final Throwable failure) {
      if (failure == null) {
        this.completion.complete(result, null);
        return;
      }
      if (this.attempt >= this.options.getTimes() || !this.options.isRetryable(failure)) {
        this.completion.complete(result, failure);
        return;
      }
      log.debug("attempt {} of {} failed, retrying", this.attempt, this.options.getTimes(),
          failure);
      final Duration interval = this.options.getInterval();
      if (interval.isZero()) {
        attempt();
      } else {
        this.options.getEventLoop()
            .orElseThrow(() -> new IllegalStateException("interval without an event loop"))
            .schedule(this::attempt, interval);
      }
    }
  }

  /*
   * Defers each failed attempt's report until the failure handler is done and the delay elapsed
   */
  private static final class DelayedAttempts<T> implements AsyncTask<T> {
    private final EventLoop eventLoop;
    private final int times;
    private final Duration delay;
    private final AsyncTask<T> task;
    private final FailureHandler onFailure;
    private int attempt;

    DelayedAttempts(final EventLoop eventLoop, final int times, final Duration delay,
        final AsyncTask<T> task, final FailureHandler onFailure) {
      this.eventLoop = eventLoop;
      this.times = times;
      this.delay = delay;
      this.task = task;
      this.onFailure = onFailure;
    }

    @Override
    public void run(final Callback<T> attempted) {
      final int current = ++this.attempt;
      this.task.run((result, failure) -> {
        if (failure == null || LockInterruptedException.isInterruption(failure)) {
          attempted.complete(result, failure);
          return;
        }
        this.onFailure.onFailure(failure, () -> {
          if (current >= this.times) {
            attempted.complete(result, failure);
          } else {
            this.eventLoop.schedule(() -> attempted.complete(result, failure), this.delay);
          }
        });
      });
    }
  }
}
