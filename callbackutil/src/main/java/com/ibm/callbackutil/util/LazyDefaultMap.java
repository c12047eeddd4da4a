/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.util;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A map which materializes a default value the first time a missing key is read.
 *
 * <p>
 * {@link #get(Object)} never returns a missing value: on a miss it calls the factory once, stores
 * the result and returns it, so later reads of the same key return the same instance. This class is
 * not thread-safe.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class LazyDefaultMap<K, V> {
  private final Supplier<? extends V> factory;
  private final Map<K, V> entries = new HashMap<>();

  public LazyDefaultMap(final Supplier<? extends V> factory) {
    this.factory = Objects.requireNonNull(factory);
  }

  /**
   * Returns the value for {@code key}, creating and storing a default value on first access.
   */
  public V get(final K key) {
    if (this.entries.containsKey(key)) {
      return this.entries.get(key);
    }
    final V value = this.factory.get();
    this.entries.put(key, value);
    return value;
  }

  /**
   * Stores {@code value} for {@code key}, replacing any existing value.
   *
   * @return {@code value}
   */
  public V set(final K key, final V value) {
    this.entries.put(key, value);
    return value;
  }

  /**
   * Removes the entry for {@code key} without invoking the factory.
   *
   * @return true if an entry existed
   */
  public boolean remove(final K key) {
    if (!this.entries.containsKey(key)) {
      return false;
    }
    this.entries.remove(key);
    return true;
  }

  public boolean containsKey(final K key) {
    return this.entries.containsKey(key);
  }

  public int size() {
    return this.entries.size();
  }

  @Override
  public String toString() {
    return "LazyDefaultMap" + this.entries;
  }
}
