// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.reachability.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

public class ThreadUtils {

  public enum WorkLoad {
    // The threshold for HEAVY is basically just a fan-out when we have two items to process.
    HEAVY(2),
    // Below this many items the scheduling overhead dominates the scan of a class.
    LIGHT(4);

    private final int threshold;

    WorkLoad(int threshold) {
      this.threshold = threshold;
    }

    public int getThreshold() {
      return threshold;
    }
  }

  public static final int NOT_SPECIFIED = -1;

  public static <T> void processItems(
      Collection<T> items, Consumer<T> consumer, ExecutorService executorService)
      throws ExecutionException {
    processItems(items, consumer, executorService, WorkLoad.LIGHT);
  }

  public static <T> void processItems(
      Collection<T> items,
      Consumer<T> consumer,
      ExecutorService executorService,
      WorkLoad workLoad)
      throws ExecutionException {
    if (executorService == null || items.size() < workLoad.getThreshold()) {
      items.forEach(consumer);
      return;
    }
    List<Future<?>> futures = new ArrayList<>(items.size());
    for (T item : items) {
      futures.add(executorService.submit(() -> consumer.accept(item)));
    }
    awaitFutures(futures);
  }

  public static <T> List<T> awaitFutures(Collection<? extends Future<? extends T>> futures)
      throws ExecutionException {
    List<T> results = new ArrayList<>(futures.size());
    ExecutionException firstException = null;
    for (Future<? extends T> future : futures) {
      try {
        results.add(future.get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RuntimeException("Interrupted while waiting for future.", e);
      } catch (ExecutionException e) {
        // Keep waiting for the remaining tasks so no task outlives the scan that started it.
        if (firstException == null) {
          firstException = e;
        }
      }
    }
    if (firstException != null) {
      throw firstException;
    }
    return results;
  }

  /**
   * Returns the thread pool size to use. We use #cpus as thread pool size for machines with <=16
   * cpus, and #cpus/2 as thread pool size for machines with more cpus, and at most 48 threads.
   */
  private static int getThreadPoolSize(int processors) {
    if (processors <= 16) {
      return processors;
    }
    int threadPoolSize = 16 + (int) Math.round((processors - 16) / 2.0);
    return Math.min(threadPoolSize, 48);
  }

  public static ExecutorService getExecutorService(int threads) {
    int poolSize =
        threads == NOT_SPECIFIED
            ? getThreadPoolSize(Runtime.getRuntime().availableProcessors())
            : threads;
    return Executors.newWorkStealingPool(poolSize);
  }

  public static ExecutorService getExecutorService(InternalOptions options) {
    return getExecutorService(options.threadCount);
  }
}
