package org.waabox.bundle;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a function to each member of a list, sequentially or on a
 * bounded pool of worker threads.
 *
 * <p>With a concurrency of 1 the function runs on the calling thread, in
 * member order. With a higher concurrency every member becomes one task of
 * a fixed pool of at most {@code concurrency} threads; idle workers pick
 * the next pending task. All tasks are submitted before any result is
 * awaited. Results are collected by member id and returned in member
 * order, whatever order the tasks completed in.
 *
 * <p>The pool lives for the duration of a single call. Workers only see
 * the member they are given and communicate through their return value.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ParallelMapper {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ParallelMapper.class);

  /** The default prefix of worker thread names. */
  private static final String DEFAULT_THREAD_PREFIX = "bundle-map-worker";

  /** The prefix of worker thread names. */
  private final String threadPrefix;

  /** Creates a mapper whose workers are named bundle-map-worker-N. */
  public ParallelMapper() {
    this(DEFAULT_THREAD_PREFIX);
  }

  /**
   * Creates a mapper whose workers are named {@code threadPrefix-N}.
   *
   * @param threadPrefix the worker thread name prefix, never null
   */
  public ParallelMapper(final String threadPrefix) {
    this.threadPrefix = Objects.requireNonNull(threadPrefix,
        "threadPrefix must not be null");
  }

  /**
   * Applies the function to every member.
   *
   * @param members     the members, with unique ids, never null
   * @param function    the function to apply, never null
   * @param concurrency the maximum number of members processed at the
   *                    same time, at least 1
   * @param <T>         the member type
   * @param <R>         the result type
   *
   * @return one result per member, in member order, never null
   *
   * @throws IllegalArgumentException if concurrency is less than 1 or two
   *                                  members share an id
   * @throws CatalogException         if the function failed for any member;
   *                                  an {@link Error} is rethrown as is
   */
  public <T extends Member, R> List<R> map(final List<T> members,
      final Function<? super T, ? extends R> function,
      final int concurrency) {
    Objects.requireNonNull(members, "members must not be null");
    Objects.requireNonNull(function, "function must not be null");
    checkConcurrency(concurrency);

    if (concurrency == 1 || members.isEmpty()) {
      return sequential(members, function);
    }
    return parallel(members, function,
        Math.min(concurrency, members.size()));
  }

  /**
   * Checks that the given concurrency is usable.
   *
   * @param concurrency the concurrency to check
   *
   * @throws IllegalArgumentException if concurrency is less than 1
   */
  static void checkConcurrency(final int concurrency) {
    if (concurrency < 1) {
      throw new IllegalArgumentException(
          "concurrency must be greater than 0, got: " + concurrency);
    }
  }

  /**
   * Applies the function on the calling thread, in member order.
   *
   * @param members  the members, never null
   * @param function the function to apply, never null
   * @param <T>      the member type
   * @param <R>      the result type
   *
   * @return one result per member, in member order, never null
   */
  private <T extends Member, R> List<R> sequential(final List<T> members,
      final Function<? super T, ? extends R> function) {
    final List<R> results = new ArrayList<>(members.size());
    for (final T member : members) {
      try {
        results.add(function.apply(member));
      } catch (final Exception e) {
        throw failure(member.id(), e);
      }
    }
    return results;
  }

  /**
   * Submits one task per member to a fresh pool, then gathers the results
   * by member id and puts them back in member order.
   *
   * <p>The pool is shut down before returning, which cancels the tasks
   * still running after a failure.
   *
   * @param members  the members, never null
   * @param function the function to apply, never null
   * @param workers  the pool size, at least 1
   * @param <T>      the member type
   * @param <R>      the result type
   *
   * @return one result per member, in member order, never null
   */
  private <T extends Member, R> List<R> parallel(final List<T> members,
      final Function<? super T, ? extends R> function, final int workers) {
    final ExecutorService pool = Executors.newFixedThreadPool(workers,
        new WorkerFactory(threadPrefix));
    try {
      final Map<String, Future<R>> pending = new LinkedHashMap<>();
      for (final T member : members) {
        final Callable<R> task = () -> function.apply(member);
        if (pending.put(member.id(), pool.submit(task)) != null) {
          throw new IllegalArgumentException(
              "Duplicate member id: '" + member.id() + "'");
        }
      }
      log.debug("Submitted {} task(s) to {} worker(s)", pending.size(),
          workers);

      final Map<String, R> results = new HashMap<>();
      for (final Map.Entry<String, Future<R>> entry : pending.entrySet()) {
        results.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
      }

      final List<R> ordered = new ArrayList<>(members.size());
      for (final T member : members) {
        ordered.add(results.get(member.id()));
      }
      return ordered;
    } finally {
      pool.shutdownNow();
    }
  }

  /**
   * Waits for the result of one member.
   *
   * @param memberId the member id, never null
   * @param future   the pending result, never null
   * @param <R>      the result type
   *
   * @return the result, may be null
   */
  private static <R> R await(final String memberId, final Future<R> future) {
    try {
      return future.get();
    } catch (final ExecutionException e) {
      throw failure(memberId, e.getCause());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CatalogException(
          "Interrupted while waiting for member '" + memberId + "'", e);
    }
  }

  /**
   * Wraps the failure of the function for one member.
   *
   * <p>Errors are not wrapped: they are rethrown as is, whatever mode the
   * function ran in.
   *
   * @param memberId the member id, never null
   * @param cause    the failure, never null
   *
   * @return the exception to throw, never null
   */
  private static CatalogException failure(final String memberId,
      final Throwable cause) {
    if (cause instanceof Error error) {
      throw error;
    }
    return new CatalogException(
        "Function failed for member '" + memberId + "'", cause);
  }

  /** Creates named daemon worker threads. */
  private static final class WorkerFactory implements ThreadFactory {

    /** The thread name prefix. */
    private final String prefix;

    /** The number of threads created so far. */
    private final AtomicInteger count = new AtomicInteger();

    /**
     * Creates a new WorkerFactory.
     *
     * @param prefix the thread name prefix, never null
     */
    private WorkerFactory(final String prefix) {
      this.prefix = prefix;
    }

    /** {@inheritDoc} */
    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread thread = new Thread(runnable,
          prefix + "-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
