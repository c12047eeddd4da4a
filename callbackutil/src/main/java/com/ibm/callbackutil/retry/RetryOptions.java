/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

import com.ibm.callbackutil.util.EventLoop;

/**
 * Settings for a bounded retry: how many attempts to make, how long to wait between them, and which
 * failures are worth retrying.
 *
 * <p>
 * Instances are immutable; use {@link #builder()} or {@link #times(int)}.
 */
public final class RetryOptions {
  public static final int DEFAULT_TIMES = 5;

  private final int times;
  private final Duration interval;
  private final EventLoop eventLoop;
  private final Predicate<? super Throwable> errorFilter;

  private RetryOptions(final Builder builder) {
    this.times = builder.times;
    this.interval = builder.interval;
    this.eventLoop = builder.eventLoop;
    this.errorFilter = builder.errorFilter;
  }

  /**
   * @return options making {@code times} attempts with no interval and no error filter
   */
  public static RetryOptions times(final int times) {
    return builder().times(times).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return the maximum number of attempts, at least 1
   */
  public int getTimes() {
    return this.times;
  }

  /**
   * @return the wait between a failed attempt and the next one
   */
  public Duration getInterval() {
    return this.interval;
  }

  /**
   * @return the loop used to wait out the interval, present whenever the interval is nonzero
   */
  public Optional<EventLoop> getEventLoop() {
    return Optional.ofNullable(this.eventLoop);
  }

  /**
   * @return true if a failed attempt reporting {@code failure} may be retried
   */
  public boolean isRetryable(final Throwable failure) {
    return this.errorFilter.test(failure);
  }

  @Override
  public String toString() {
    return "RetryOptions[times=" + this.times + ", interval=" + this.interval + "]";
  }

  public static final class Builder {
    private int times = DEFAULT_TIMES;
    private Duration interval = Duration.ZERO;
    private EventLoop eventLoop;
    private Predicate<? super Throwable> errorFilter = failure -> true;

    private Builder() {}

    public Builder times(final int times) {
      if (times < 1) {
        throw new IllegalArgumentException("times must be at least 1: " + times);
      }
      this.times = times;
      return this;
    }

    /**
     * Waits {@code interval} on {@code eventLoop} before each retry.
     */
    public Builder interval(final EventLoop eventLoop, final Duration interval) {
      if (interval.isNegative()) {
        throw new IllegalArgumentException("negative interval " + interval);
      }
      this.eventLoop = Objects.requireNonNull(eventLoop);
      this.interval = interval;
      return this;
    }

    /**
     * Only failures accepted by {@code errorFilter} are retried; any other failure ends the retry
     * and is reported as is.
     */
    public Builder errorFilter(final Predicate<? super Throwable> errorFilter) {
      this.errorFilter = Objects.requireNonNull(errorFilter);
      return this;
    }

    public RetryOptions build() {
      return new RetryOptions(this);
    }
  }
}
