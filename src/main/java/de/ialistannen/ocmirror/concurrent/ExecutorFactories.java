package de.ialistannen.ocmirror.concurrent;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the bounded worker pools transfers and lookups run on.
 */
public final class ExecutorFactories {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Builds a fixed-size pool with an unbounded queue. At most {@code size} tasks run at the same time.
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix
   * @return the executor
   */
  public static ExecutorService newWorkerPool(int size, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("Concurrency must be positive, got " + size);
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "oc-mirror-worker" : prefix;
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(
        (t, e) -> LOGGER.error("Uncaught exception in worker {}", t.getName(), e)
      );
      return thread;
    };

    return new ThreadPoolExecutor(
      size,
      size,
      0L,
      TimeUnit.MILLISECONDS,
      new LinkedBlockingQueue<>(),
      factory
    );
  }
}
