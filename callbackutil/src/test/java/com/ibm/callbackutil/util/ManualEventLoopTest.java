/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class ManualEventLoopTest {

  @Test
  public void testTicksRunInSubmissionOrder() {
    final ManualEventLoop loop = new ManualEventLoop();
    final List<Integer> order = new ArrayList<>();
    loop.execute(() -> {
      order.add(1);
      loop.execute(() -> order.add(3));
    });
    loop.execute(() -> order.add(2));
    Assert.assertTrue(order.isEmpty());

    Assert.assertEquals(3, loop.runPending());
    Assert.assertEquals(Arrays.asList(1, 2, 3), order);
  }

  @Test
  public void testTimersFireInDeadlineOrder() {
    final ManualEventLoop loop = new ManualEventLoop();
    final List<String> order = new ArrayList<>();
    loop.schedule(() -> order.add("late"), Duration.ofMillis(20));
    loop.schedule(() -> order.add("early"), Duration.ofMillis(10));
    loop.schedule(() -> order.add("early-second"), Duration.ofMillis(10));

    loop.advance(Duration.ofMillis(10));
    Assert.assertEquals(Arrays.asList("early", "early-second"), order);
    Assert.assertEquals(Duration.ofMillis(10), loop.now());

    loop.runUntilIdle();
    Assert.assertEquals(Arrays.asList("early", "early-second", "late"), order);
    Assert.assertEquals(Duration.ofMillis(20), loop.now());
    Assert.assertEquals(0, loop.pendingCount());
  }

  @Test
  public void testTimerScheduledFromTimerUsesVirtualNow() {
    final ManualEventLoop loop = new ManualEventLoop();
    final List<Duration> fired = new ArrayList<>();
    loop.schedule(() -> {
      fired.add(loop.now());
      loop.schedule(() -> fired.add(loop.now()), Duration.ofMillis(5));
    }, Duration.ofMillis(5));

    loop.advance(Duration.ofMillis(10));
    Assert.assertEquals(Arrays.asList(Duration.ofMillis(5), Duration.ofMillis(10)), fired);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeDelay() {
    new ManualEventLoop().schedule(() -> {}, Duration.ofMillis(-1));
  }
}
