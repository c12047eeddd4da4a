/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.iteration;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import com.ibm.callbackutil.util.EventLoop;

/**
 * Methods to construct {@link AsyncQueue AsyncQueues}.
 *
 * @see AsyncQueue
 */
public final class AsyncQueues {
  private AsyncQueues() {}

  /**
   * Creates an empty queue without a consumer. Its drain signal is still available through
   * {@link AsyncQueue#whenDrain(Runnable)}.
   *
   * @return an empty {@link AsyncQueue}
   */
  public static <T> AsyncQueue<T> create() {
    return new SignallingQueue<>();
  }

  /**
   * Creates an empty queue whose elements are fed to {@code consumer}.
   *
   * @see #consuming(EventLoop, Iterable, AsyncQueue.Consumer)
   */
  public static <T> AsyncQueue<T> consuming(final EventLoop eventLoop,
      final AsyncQueue.Consumer<? super T> consumer) {
    return consuming(eventLoop, Collections.emptyList(), consumer);
  }

  /**
   * Creates a queue holding {@code initial} (pushed at the back, in iteration order) whose elements
   * are fed to {@code consumer}. If {@code initial} is not empty, the first element is handed to
   * the consumer before this method returns.
   *
   * @param eventLoop the loop on which the consumer loop schedules itself between elements
   * @param initial the elements the queue starts with
   * @param consumer processes elements one at a time
   * @return a consuming {@link AsyncQueue}
   */
  public static <T> AsyncQueue<T> consuming(final EventLoop eventLoop,
      final Iterable<? extends T> initial, final AsyncQueue.Consumer<? super T> consumer) {
    final ConsumingQueue<T> queue = new ConsumingQueue<>(eventLoop, consumer);
    for (final T element : initial) {
      queue.pushBack(element);
    }
    queue.start();
    return queue;
  }

  /*
   * Each transition is reported to a hook: becameNonEmpty after a push onto an empty queue,
   * becameEmpty after a pop that drains it. Drain listeners are one-shot and detached before they
   * run, so a listener may register another for the next drain.
   */
  private static class SignallingQueue<T> implements AsyncQueue<T> {
    private final Deque<T> entries = new ArrayDeque<>();
    private List<Runnable> drainListeners = new ArrayList<>();

    @Override
    public void pushBack(final T element) {
      this.entries.addLast(Objects.requireNonNull(element));
      if (this.entries.size() == 1) {
        becameNonEmpty();
      }
    }

    @Override
    public void pushFront(final T element) {
      this.entries.addFirst(Objects.requireNonNull(element));
      if (this.entries.size() == 1) {
        becameNonEmpty();
      }
    }

    @Override
    public T popBack() {
      if (this.entries.isEmpty()) {
        throw new NoSuchElementException("popBack from empty queue");
      }
      final T element = this.entries.removeLast();
      if (this.entries.isEmpty()) {
        becameEmpty();
      }
      return element;
    }

    @Override
    public T popFront() {
      if (this.entries.isEmpty()) {
        throw new NoSuchElementException("popFront from empty queue");
      }
      final T element = this.entries.removeFirst();
      if (this.entries.isEmpty()) {
        becameEmpty();
      }
      return element;
    }

    @Override
    public T peekFront() {
      if (this.entries.isEmpty()) {
        throw new NoSuchElementException("peekFront on empty queue");
      }
      return this.entries.getFirst();
    }

    @Override
    public T peekBack() {
      if (this.entries.isEmpty()) {
        throw new NoSuchElementException("peekBack on empty queue");
      }
      return this.entries.getLast();
    }

    @Override
    public int size() {
      return this.entries.size();
    }

    @Override
    public void whenDrain(final Runnable listener) {
      Objects.requireNonNull(listener);
      if (this.entries.isEmpty()) {
        listener.run();
      } else {
        this.drainListeners.add(listener);
      }
    }

    void becameNonEmpty() {}

    private void becameEmpty() {
      if (this.drainListeners.isEmpty()) {
        return;
      }
      final List<Runnable> listeners = this.drainListeners;
      this.drainListeners = new ArrayList<>();
      for (final Runnable listener : listeners) {
        listener.run();
      }
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + this.entries;
    }
  }

  /*
   * `busy` covers both an element in flight and a scheduled continuation of the loop, so a push
   * made while either is pending never starts a second consumer.
   */
  private static final class ConsumingQueue<T> extends SignallingQueue<T> {
    private final EventLoop eventLoop;
    private final AsyncQueue.Consumer<? super T> consumer;
    private boolean started;
    private boolean busy;

    ConsumingQueue(final EventLoop eventLoop, final AsyncQueue.Consumer<? super T> consumer) {
      this.eventLoop = Objects.requireNonNull(eventLoop);
      this.consumer = Objects.requireNonNull(consumer);
    }

    void start() {
      this.started = true;
      if (!isEmpty()) {
        this.busy = true;
        consumeNext();
      }
    }

    @Override
    void becameNonEmpty() {
      if (this.started && !this.busy) {
        this.busy = true;
        consumeNext();
      }
    }

    private void consumeNext() {
      if (isEmpty()) {
        // drained by a direct pop while the next tick was pending
        this.busy = false;
        return;
      }
      final Done done = new Done();
      final T element = popFront();
      try {
        this.consumer.accept(element, done);
      } catch (final RuntimeException e) {
        if (!done.signalled) {
          done.run();
        }
        throw e;
      }
    }

    private final class Done implements Runnable {
      boolean signalled;

      @Override
      public void run() {
        if (this.signalled) {
          throw new IllegalStateException("done signalled more than once");
        }
        this.signalled = true;
        if (isEmpty()) {
          ConsumingQueue.this.busy = false;
        } else {
          ConsumingQueue.this.eventLoop.execute(ConsumingQueue.this::consumeNext);
        }
      }
    }
  }
}
