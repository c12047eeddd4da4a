/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.retry;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;

import com.ibm.callbackutil.locks.CallbackLock;
import com.ibm.callbackutil.locks.LockInterruptedException;
import com.ibm.callbackutil.util.AsyncTask;
import com.ibm.callbackutil.util.Combinators;
import com.ibm.callbackutil.util.ManualEventLoop;
import com.ibm.callbackutil.util.RecordingCallback;

public class RetriesTest {
  private static class TestException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    TestException(final String message) {
      super(message);
    }
  }

  @Test
  public void testInterruptionStopsRetrying() {
    final AtomicInteger calls = new AtomicInteger();
    final RecordingCallback<String> completion = new RecordingCallback<>();

    Retries.<String>retry(3, callback -> {
      calls.incrementAndGet();
      callback.fail(new LockInterruptedException("interrupted"));
    }, completion);

    Assert.assertEquals(1, calls.get());
    Assert.assertTrue(LockInterruptedException.isInterruption(completion.assertFailed()));
  }

  @Test
  public void testSucceedsAfterOrdinaryFailures() {
    final AtomicInteger calls = new AtomicInteger();
    final RecordingCallback<String> completion = new RecordingCallback<>();

    Retries.<String>retry(3, callback -> {
      if (calls.incrementAndGet() < 3) {
        callback.fail(new TestException("attempt " + calls.get()));
      } else {
        callback.succeed("third time");
      }
    }, completion);

    Assert.assertEquals(3, calls.get());
    Assert.assertEquals("third time", completion.assertSucceeded());
  }

  @Test
  public void testExhaustedAttemptsReportLastFailure() {
    final AtomicInteger calls = new AtomicInteger();
    final RecordingCallback<String> completion = new RecordingCallback<>();

    Retries.<String>retry(3,
        callback -> callback.fail(new TestException("attempt " + calls.incrementAndGet())),
        completion);

    Assert.assertEquals(3, calls.get());
    Assert.assertEquals("attempt 3", completion.assertFailed().getMessage());
  }

  @Test
  public void testInterruptionAfterOrdinaryFailure() {
    final AtomicInteger calls = new AtomicInteger();
    final RecordingCallback<String> completion = new RecordingCallback<>();

    Retries.<String>retry(5, callback -> {
      if (calls.incrementAndGet() == 1) {
        callback.fail(new TestException("ordinary"));
      } else {
        callback.fail(new LockInterruptedException("interrupted"));
      }
    }, completion);

    Assert.assertEquals(2, calls.get());
    Assert.assertTrue(LockInterruptedException.isInterruption(completion.assertFailed()));
  }

  @Test
  public void testEachRetryCapturesIndependently() {
    final AsyncTask<String> interrupted =
        callback -> callback.fail(new LockInterruptedException("interrupted"));
    final RecordingCallback<String> first = new RecordingCallback<>();
    final RecordingCallback<String> second = new RecordingCallback<>();

    Retries.retry(2, interrupted, first);
    Retries.retry(2, interrupted, second);

    Assert.assertTrue(LockInterruptedException.isInterruption(first.assertFailed()));
    Assert.assertTrue(LockInterruptedException.isInterruption(second.assertFailed()));
  }

  @Test
  public void testErrorFilter() {
    final AtomicInteger calls = new AtomicInteger();
    final RecordingCallback<String> completion = new RecordingCallback<>();
    final RetryOptions options = RetryOptions.builder()
        .times(5)
        .errorFilter(failure -> !(failure instanceof IllegalArgumentException))
        .build();

    Retries.<String>retry(options, callback -> {
      if (calls.incrementAndGet() == 1) {
        callback.fail(new TestException("retryable"));
      } else {
        callback.fail(new IllegalArgumentException("fatal"));
      }
    }, completion);

    Assert.assertEquals(2, calls.get());
    Assert.assertEquals("fatal", completion.assertFailed().getMessage());
  }

  @Test
  public void testIntervalWaitsOnEventLoop() {
    final ManualEventLoop loop = new ManualEventLoop();
    final AtomicInteger calls = new AtomicInteger();
    final RecordingCallback<String> completion = new RecordingCallback<>();
    final RetryOptions options = RetryOptions.builder()
        .times(2)
        .interval(loop, Duration.ofMillis(50))
        .build();

    Retries.<String>retry(options,
        callback -> callback.fail(new TestException("" + calls.incrementAndGet())),
        completion);
    Assert.assertEquals(1, calls.get());

    loop.advance(Duration.ofMillis(49));
    Assert.assertEquals(1, calls.get());
    loop.advance(Duration.ofMillis(1));
    Assert.assertEquals(2, calls.get());
    Assert.assertEquals("2", completion.assertFailed().getMessage());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTimesMustBePositive() {
    RetryOptions.times(0);
  }

  @Test
  public void testInterruptedCriticalSectionIsNotRetried() {
    final ManualEventLoop loop = new ManualEventLoop();
    final CallbackLock lock = CallbackLock.create(loop, true);
    final AtomicInteger steps = new AtomicInteger();
    final AsyncTask<String> step = lock.cancels(callback -> {
      steps.incrementAndGet();
      callback.succeed("written");
    });
    final RecordingCallback<String> holder = new RecordingCallback<>();
    final RecordingCallback<String> waiter = new RecordingCallback<>();

    lock.<String>run(release -> {
      lock.<String>run(waiterRelease -> waiterRelease.succeed("waiter"), waiter);
      Retries.retry(3, step, release);
    }, holder);

    Assert.assertEquals(0, steps.get());
    Assert.assertTrue(LockInterruptedException.isInterruption(holder.assertFailed()));
    Assert.assertFalse(waiter.isDone());

    loop.runPending();
    Assert.assertEquals("waiter", waiter.assertSucceeded());
  }

  @Test
  public void testInterruptedJoinIsNotRetried() {
    final AtomicInteger calls = new AtomicInteger();
    final RecordingCallback<List<String>> completion = new RecordingCallback<>();
    final AsyncTask<String> interrupted = callback -> {
      calls.incrementAndGet();
      callback.fail(new LockInterruptedException("interrupted"));
    };
    final AsyncTask<String> ordinary = callback -> callback.succeed("ok");

    Retries.<List<String>>retry(3,
        callback -> Combinators.parallelLocked(Arrays.asList(interrupted, ordinary), callback),
        completion);

    Assert.assertEquals(1, calls.get());
    Assert.assertTrue(LockInterruptedException.isInterruption(completion.assertFailed()));
  }
}
