/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Utility methods for running several {@link AsyncTask AsyncTasks} concurrently and joining their
 * outcomes into a single {@link Callback}.
 *
 * <p>
 * "Concurrently" means every task is started before any of them is awaited; on a single event loop
 * their continuations interleave. Results are always reported in task order, whatever order the
 * tasks complete in.
 */
public final class Combinators {
  private Combinators() {}

  /**
   * Starts every task and reports the list of their results once all have succeeded. If any task
   * fails, {@code callback} receives that first failure immediately and the outcomes of the
   * remaining tasks are ignored. A task which throws propagates the exception to the caller, and a
   * task which completes twice gets an {@link IllegalStateException}.
   *
   * @param tasks the tasks to run
   * @param callback receives the results in task order, or the first failure
   */
  public static <T> void collect(
      final List<? extends AsyncTask<T>> tasks,
      final Callback<? super List<T>> callback) {
    Objects.requireNonNull(callback);
    final int size = tasks.size();
    if (size == 0) {
      callback.succeed(Collections.<T>emptyList());
      return;
    }
    final Join<T> join = new Join<>(size, callback);
    for (int i = 0; i < size; i++) {
      final int index = i;
      final Callback<T> taskCallback =
          Callbacks.once((result, failure) -> join.arrive(index, result, failure));
      tasks.get(i).run(taskCallback);
    }
  }

  /**
   * Starts every task and waits for all of them, whether they succeed or fail. The join is never
   * cut short by a failure, and a task which throws before reporting to its callback counts as
   * failed with the thrown exception. A task which throws after it has reported propagates the
   * exception to the caller.
   *
   * <p>
   * If every task succeeded, {@code callback} receives the results in task order. Otherwise it
   * receives the same aligned result list, with {@code null} in place of each failed task's result,
   * together with the first failure observed. That failure is reported as is, so an interruption
   * stays recognizable to an enclosing retry, and every later failure is attached to it in
   * completion order as a {@link Throwable#getSuppressed() suppressed} exception.
   *
   * <p>
   * The tasks are not serialized through any lock; the name reflects the usual caller, which passes
   * lock-guarded tasks.
   *
   * @param tasks the tasks to run
   * @param callback receives the aligned results and, if any task failed, the first failure
   */
  public static <T> void parallelLocked(
      final List<? extends AsyncTask<T>> tasks,
      final Callback<? super List<T>> callback) {
    Objects.requireNonNull(callback);
    final List<Throwable> failures = new ArrayList<>();
    final List<AsyncTask<T>> absorbing = new ArrayList<>(tasks.size());
    for (final AsyncTask<T> task : tasks) {
      absorbing.add(joined -> {
        final Absorbing<T> absorber = new Absorbing<>(joined, failures);
        try {
          task.run(absorber);
        } catch (final RuntimeException e) {
          if (absorber.reported) {
            throw e;
          }
          absorber.fail(e);
        }
      });
    }
    // absorbing tasks never fail, so neither does the join
    collect(absorbing, (results, ignored) -> {
      if (failures.isEmpty()) {
        callback.succeed(results);
        return;
      }
      final Throwable first = failures.get(0);
      for (final Throwable other : failures.subList(1, failures.size())) {
        if (other != first) {
          first.addSuppressed(other);
        }
      }
      callback.complete(results, first);
    });
  }

  /*
   * Turns a task's failure into a null result, recording the failure on the side
   */
  private static final class Absorbing<T> implements Callback<T> {
    private final Callback<T> joined;
    private final List<Throwable> failures;
    boolean reported;

    Absorbing(final Callback<T> joined, final List<Throwable> failures) {
      this.joined = joined;
      this.failures = failures;
    }

    @Override
    public void complete(final T result, final Throwable failure) {
      this.reported = true;
      if (failure != null) {
        this.failures.add(failure);
        this.joined.succeed(null);
      } else {
        this.joined.succeed(result);
      }
    }
  }

  private static final class Join<T> {
    private final Object[] results;
    private final Callback<? super List<T>> callback;
    private int remaining;
    private boolean done;

    Join(final int size, final Callback<? super List<T>> callback) {
      this.results = new Object[size];
      this.remaining = size;
      this.callback = callback;
    }

    @SuppressWarnings("unchecked")
    void arrive(final int index, final T result, final Throwable failure) {
      if (this.done) {
        return;
      }
      if (failure != null) {
        this.done = true;
        this.callback.fail(failure);
        return;
      }
      this.results[index] = result;
      if (--this.remaining == 0) {
        this.done = true;
        this.callback.succeed((List<T>) (List<?>) Arrays.asList(this.results));
      }
    }
  }
}
