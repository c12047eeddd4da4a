/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.util;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Queue;

/**
 * A deterministic {@link EventLoop} driven by its caller, with a virtual clock.
 *
 * <p>
 * Nothing runs until the owner calls {@link #runPending()} or {@link #advance(Duration)}. Ticks
 * run iteratively on the caller's stack, so a chain of continuations each submitting the next never
 * grows the stack. A task that throws propagates out of the driving method; the remaining tasks
 * stay queued.
 *
 * <p>
 * This class is not thread-safe; it is meant to be driven from a single thread, typically a test.
 */
public class ManualEventLoop implements EventLoop {

  private final Queue<Runnable> ready = new ArrayDeque<>();
  private final PriorityQueue<Timer> timers = new PriorityQueue<>(
      Comparator.comparingLong((final Timer t) -> t.deadline).thenComparingLong(t -> t.sequence));
  private long nowNanos;
  private long timerSequence;

  private static final class Timer {
    final long deadline;
    final long sequence;
    final Runnable task;

    Timer(final long deadline, final long sequence, final Runnable task) {
      this.deadline = deadline;
      this.sequence = sequence;
      this.task = task;
    }
  }

  @Override
  public void execute(final Runnable task) {
    this.ready.add(Objects.requireNonNull(task));
  }

  @Override
  public void schedule(final Runnable task, final Duration delay) {
    Objects.requireNonNull(task);
    if (delay.isNegative()) {
      throw new IllegalArgumentException("negative delay " + delay);
    }
    this.timers.add(new Timer(this.nowNanos + delay.toNanos(), this.timerSequence++, task));
  }

  /**
   * Runs ready ticks until none remain, including ticks submitted by the ticks being run. Timers
   * are not fired and the clock does not move.
   *
   * @return the number of ticks run
   */
  public int runPending() {
    int count = 0;
    Runnable task;
    while ((task = this.ready.poll()) != null) {
      task.run();
      count++;
    }
    return count;
  }

  /**
   * Moves the virtual clock forward by {@code duration}, firing every timer that comes due in
   * deadline order and running ready ticks in between.
   *
   * @param duration how far to move the clock
   * @return the number of ticks and timers run
   */
  public int advance(final Duration duration) {
    if (duration.isNegative()) {
      throw new IllegalArgumentException("negative duration " + duration);
    }
    final long target = this.nowNanos + duration.toNanos();
    int count = runPending();
    Timer next;
    while ((next = this.timers.peek()) != null && next.deadline <= target) {
      this.timers.poll();
      this.nowNanos = next.deadline;
      next.task.run();
      count += 1 + runPending();
    }
    this.nowNanos = target;
    return count;
  }

  /**
   * Runs ready ticks and fires timers, moving the clock as far as needed, until nothing is queued.
   *
   * @return the number of ticks and timers run
   */
  public int runUntilIdle() {
    int count = runPending();
    Timer next;
    while ((next = this.timers.poll()) != null) {
      this.nowNanos = Math.max(this.nowNanos, next.deadline);
      next.task.run();
      count += 1 + runPending();
    }
    return count;
  }

  /**
   * @return the virtual time elapsed since this loop was created
   */
  public Duration now() {
    return Duration.ofNanos(this.nowNanos);
  }

  /**
   * @return the number of ready ticks plus not yet fired timers
   */
  public int pendingCount() {
    return this.ready.size() + this.timers.size();
  }
}
