/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.util;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link EventLoop} backed by a single daemon thread.
 *
 * <p>
 * A task which throws does not stop the loop. A {@link RuntimeException} is logged and the next
 * task runs; an {@link Error} is logged before it is rethrown to the executor.
 * Closing the loop stops it from accepting new tasks; already queued ticks still run, delayed tasks
 * that are not yet due are dropped.
 */
public class SingleThreadEventLoop implements EventLoop, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SingleThreadEventLoop.class);
  private static final AtomicInteger LOOP_IDS = new AtomicInteger();

  private final ScheduledThreadPoolExecutor executor;
  private volatile Thread thread;

  public SingleThreadEventLoop() {
    this("callback-event-loop-" + LOOP_IDS.incrementAndGet());
  }

  public SingleThreadEventLoop(final String name) {
    Objects.requireNonNull(name);
    this.executor = new ScheduledThreadPoolExecutor(1, r -> {
      final Thread t = new Thread(r, name);
      t.setDaemon(true);
      this.thread = t;
      return t;
    });
    this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
  }

  @Override
  public void execute(final Runnable task) {
    this.executor.execute(guarded(task));
  }

  @Override
  public void schedule(final Runnable task, final Duration delay) {
    if (delay.isNegative()) {
      throw new IllegalArgumentException("negative delay " + delay);
    }
    this.executor.schedule(guarded(task), delay.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * @return true if the calling thread is this loop's thread
   */
  public boolean inEventLoop() {
    return Thread.currentThread() == this.thread;
  }

  /**
   * Waits for queued ticks to run after {@link #close()}.
   *
   * @return true if the loop terminated before the timeout elapsed
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(final Duration timeout) throws InterruptedException {
    return this.executor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  @Override
  public void close() {
    this.executor.shutdown();
  }

  private static Runnable guarded(final Runnable task) {
    Objects.requireNonNull(task);
    return () -> {
      try {
        task.run();
      } catch (final RuntimeException e) {
        log.error("event loop task {} failed", task, e);
      } catch (final Error e) {
        log.error("event loop task {} failed with an error", task, e);
        throw e;
      }
    };
  }
}
