/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.util;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Utility methods for creating {@link Callback Callbacks} and bridging callback-style operations
 * to and from {@link CompletionStage CompletionStages}.
 */
public final class Callbacks {
  private Callbacks() {}

  /**
   * Wraps {@code callback} so that a second completion is rejected. The first call is forwarded to
   * {@code callback}; any further call throws an {@link IllegalStateException} and is not
   * forwarded.
   *
   * @param callback the callback to guard
   * @return a callback which may be completed at most once
   */
  public static <T> Callback<T> once(final Callback<T> callback) {
    Objects.requireNonNull(callback);
    return new Callback<T>() {
      private boolean completed;

      @Override
      public void complete(final T result, final Throwable failure) {
        if (this.completed) {
          throw new IllegalStateException("callback completed more than once", failure);
        }
        this.completed = true;
        callback.complete(result, failure);
      }
    };
  }

  /**
   * Creates a callback which completes {@code future} with the reported outcome.
   *
   * @param future the future to complete
   * @return a callback completing {@code future}
   */
  public static <T> Callback<T> completer(final CompletableFuture<? super T> future) {
    Objects.requireNonNull(future);
    return (result, failure) -> {
      if (failure != null) {
        future.completeExceptionally(failure);
      } else {
        future.complete(result);
      }
    };
  }

  /**
   * Runs {@code task} and returns a {@link CompletionStage} which completes with its outcome. If
   * {@code task} throws rather than reporting to its callback, the returned stage completes
   * exceptionally with the thrown exception.
   *
   * @param task the task to run
   * @return a stage completed by the task's callback
   */
  public static <T> CompletionStage<T> toStage(final AsyncTask<T> task) {
    final CompletableFuture<T> future = new CompletableFuture<>();
    try {
      task.run(completer(future));
    } catch (final RuntimeException | Error e) {
      future.completeExceptionally(e);
    }
    return future;
  }

  /**
   * Adapts a stage-producing supplier into an {@link AsyncTask}. Each run of the returned task
   * calls {@code supplier} and reports the stage's outcome to the callback, unwrapping
   * {@link CompletionException}.
   *
   * @param supplier produces a new stage for each run
   * @return a task reporting the outcome of the supplied stage
   */
  public static <T> AsyncTask<T> fromStage(final Supplier<? extends CompletionStage<T>> supplier) {
    Objects.requireNonNull(supplier);
    return callback -> supplier.get().whenComplete((result, failure) -> {
      if (failure != null) {
        callback.fail(unwrap(failure));
      } else {
        callback.succeed(result);
      }
    });
  }

  private static Throwable unwrap(final Throwable t) {
    return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
  }
}
