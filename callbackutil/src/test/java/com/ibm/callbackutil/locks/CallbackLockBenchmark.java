/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: java-callback-util
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.callbackutil.locks;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.Main;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.RunnerException;

import com.ibm.callbackutil.util.ManualEventLoop;

@Fork(1)
@State(Scope.Thread)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@BenchmarkMode(Mode.AverageTime)
@Warmup(iterations = 10, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
public class CallbackLockBenchmark {
  ManualEventLoop loop;
  CallbackLock lock;

  @Param({"1", "16", "256"})
  int queued;

  @Setup
  public void setupBenchmark() {
    this.loop = new ManualEventLoop();
    this.lock = CallbackLock.create(this.loop, true);
  }

  @Benchmark
  public void uncontended(final Blackhole bh) {
    this.lock.<Integer>run(release -> release.succeed(1), (result, failure) -> bh.consume(result));
  }

  @Benchmark
  public int contended(final Blackhole bh) {
    this.lock.<Integer>run(release -> this.loop.execute(() -> release.succeed(0)),
        (result, failure) -> bh.consume(result));
    for (int i = 0; i < this.queued; i++) {
      this.lock.<Integer>run(release -> release.succeed(1),
          (result, failure) -> bh.consume(result));
    }
    return this.loop.runPending();
  }

  public static void main(final String[] args) throws IOException, RunnerException {
    Main.main(new String[] {CallbackLockBenchmark.class.getName()});
  }
}
