/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.iteration;

import java.util.NoSuchElementException;

/**
 * A double-ended queue which signals its empty/non-empty transitions, optionally feeding a single
 * consumer one element at a time.
 *
 * <p>
 * Pushes and pops at either end cost O(1). Elements pushed at the back and popped at the front come
 * out in FIFO order; mixing in front pushes gives LIFO behaviour for those elements. Null elements
 * are not permitted.
 *
 * <p>
 * A queue created with a {@link Consumer} (see {@link AsyncQueues#consuming}) runs a consumer loop:
 * whenever the queue goes from empty to non-empty the loop pops the front element and hands it to
 * the consumer. When the consumer signals done, the loop takes the next front element on a later
 * tick of its event loop, or goes idle if the queue is empty. Exactly one element is in flight at a
 * time.
 *
 * <p>
 * Queues are confined to their event loop and are not thread-safe.
 *
 * @param <T> the element type
 * @see AsyncQueues
 */
public interface AsyncQueue<T> {

  /**
   * Processes elements taken from a consuming queue.
   *
   * @param <T> the element type
   */
  @FunctionalInterface
  interface Consumer<T> {

    /**
     * Processes {@code element}. The queue hands over no other element until {@code done} is run,
     * which must happen exactly once. Running {@code done} again throws
     * {@link IllegalStateException}.
     *
     * @param element the element popped from the front of the queue
     * @param done signals that processing finished
     */
    void accept(T element, Runnable done);
  }

  /**
   * Appends {@code element} at the back.
   *
   * @throws NullPointerException if {@code element} is null
   */
  void pushBack(T element);

  /**
   * Inserts {@code element} at the front.
   *
   * @throws NullPointerException if {@code element} is null
   */
  void pushFront(T element);

  /**
   * Removes and returns the back element.
   *
   * @throws NoSuchElementException if the queue is empty
   */
  T popBack();

  /**
   * Removes and returns the front element.
   *
   * @throws NoSuchElementException if the queue is empty
   */
  T popFront();

  /**
   * @throws NoSuchElementException if the queue is empty
   */
  T peekFront();

  /**
   * @throws NoSuchElementException if the queue is empty
   */
  T peekBack();

  int size();

  default boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Runs {@code listener} immediately if the queue is empty, otherwise exactly once the next time
   * the queue becomes empty. Listeners registered for the same drain run in registration order.
   *
   * @param listener the drain listener
   */
  void whenDrain(Runnable listener);
}
