package de.ialistannen.ocmirror.concurrent;

import com.google.common.base.Throwables;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs batches of tasks on a shared pool and fails fast: the first failing task cancels everything still pending.
 */
public final class ParallelTasks {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParallelTasks.class);

  private ParallelTasks() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Runs all tasks and waits for them.
   *
   * @param executor the executor to run on
   * @param tasks the tasks
   * @param <T> the result type
   * @return the results, in task order
   * @throws IOException if a task failed with one
   * @throws InterruptedException if interrupted while waiting or a task was
   */
  public static <T> List<T> invokeAll(Executor executor, List<? extends Callable<T>> tasks)
    throws IOException, InterruptedException {
    CompletionService<T> completionService = new ExecutorCompletionService<>(executor);
    List<Future<T>> futures = new ArrayList<>(tasks.size());
    List<T> results = new ArrayList<>(tasks.size());

    try {
      for (Callable<T> task : tasks) {
        futures.add(completionService.submit(task));
      }
      for (int i = 0; i < futures.size(); i++) {
        completionService.take().get();
      }
      for (Future<T> future : futures) {
        results.add(future.get());
      }
    } catch (ExecutionException e) {
      cancelAll(futures);
      Throwable cause = e.getCause();
      Throwables.throwIfInstanceOf(cause, IOException.class);
      Throwables.throwIfInstanceOf(cause, InterruptedException.class);
      Throwables.throwIfUnchecked(cause);
      throw new IllegalStateException("Task failed", cause);
    } catch (InterruptedException e) {
      cancelAll(futures);
      throw e;
    }

    return results;
  }

  private static void cancelAll(List<? extends Future<?>> futures) {
    long cancelled = futures.stream()
      .filter(future -> !future.isDone())
      .filter(future -> future.cancel(true))
      .count();
    if (cancelled > 0) {
      LOGGER.debug("Cancelled {} pending tasks", cancelled);
    }
  }
}
