/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;

public class LazyDefaultMapTest {

  @Test
  public void testGetCreatesOncePerKey() {
    final AtomicInteger created = new AtomicInteger();
    final LazyDefaultMap<String, List<String>> map = new LazyDefaultMap<>(() -> {
      created.incrementAndGet();
      return new ArrayList<>();
    });

    final List<String> first = map.get("a");
    first.add("x");
    Assert.assertSame(first, map.get("a"));
    Assert.assertEquals(1, created.get());

    map.get("b");
    Assert.assertEquals(2, created.get());
    Assert.assertEquals(2, map.size());
  }

  @Test
  public void testSetOverwrites() {
    final LazyDefaultMap<String, Integer> map = new LazyDefaultMap<>(() -> 0);
    Assert.assertEquals(Integer.valueOf(0), map.get("k"));
    map.set("k", 7);
    Assert.assertEquals(Integer.valueOf(7), map.get("k"));
  }

  @Test
  public void testStoredNullIsReturned() {
    final LazyDefaultMap<String, String> map = new LazyDefaultMap<>(() -> "default");
    map.set("k", null);
    Assert.assertNull(map.get("k"));
  }

  @Test
  public void testRemoveDoesNotCallFactory() {
    final AtomicInteger created = new AtomicInteger();
    final LazyDefaultMap<String, Integer> map = new LazyDefaultMap<>(created::incrementAndGet);

    Assert.assertFalse(map.remove("missing"));
    Assert.assertEquals(0, created.get());

    map.get("k");
    Assert.assertTrue(map.remove("k"));
    Assert.assertFalse(map.containsKey("k"));
    Assert.assertEquals(1, created.get());
  }
}
