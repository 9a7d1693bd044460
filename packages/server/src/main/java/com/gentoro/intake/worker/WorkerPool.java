package com.gentoro.intake.worker;

import com.gentoro.intake.exception.ErrorDetails;
import com.gentoro.intake.exception.ExceptionUtil;
import com.gentoro.intake.exception.StateException;
import com.gentoro.intake.queue.Job;
import com.gentoro.intake.queue.TaskQueue;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;

/**
 * Fixed set of long-lived worker threads draining a {@link TaskQueue}.
 *
 * <p>Each worker loops forever: dequeue, process, notify the listener. A failing job never stops
 * a worker, not even one that ends in an {@link Error}. Workers exit only once the queue is closed and drained, or when interrupted by {@link
 * #shutdownNow()}.
 */
public final class WorkerPool {
  private static final Logger log =
      com.gentoro.intake.logging.LoggingService.getLogger(WorkerPool.class);

  private final TaskQueue queue;
  private final JobProcessor processor;
  private final JobListener listener;
  private final int size;
  private final List<Thread> workers = new ArrayList<>();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();

  public WorkerPool(TaskQueue queue, JobProcessor processor, int size) {
    this(queue, processor, size, JobListener.NONE);
  }

  public WorkerPool(TaskQueue queue, JobProcessor processor, int size, JobListener listener) {
    if (size < 1) {
      throw new IllegalArgumentException("size must be >= 1, got " + size);
    }
    this.queue = queue;
    this.processor = processor;
    this.size = size;
    this.listener = listener == null ? JobListener.NONE : listener;
  }

  /**
   * Start every worker. May be called once.
   *
   * @throws StateException when already started or when a thread cannot be created
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new StateException("Worker pool already started");
    }
    for (int i = 0; i < size; i++) {
      Thread worker = new Thread(this::runWorker, "intake-worker-" + i);
      try {
        worker.start();
      } catch (OutOfMemoryError | IllegalThreadStateException e) {
        shutdownNow();
        throw new StateException("Failed to start worker thread " + i, e);
      }
      workers.add(worker);
    }
    log.info("Started {} workers", size);
  }

  private void runWorker() {
    while (true) {
      Job job;
      try {
        job = queue.dequeue();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      if (job == null) {
        break;
      }
      handle(job);
    }
    log.debug("{} stopped", Thread.currentThread().getName());
  }

  private void handle(Job job) {
    JobResult result;
    Instant startedAt = Instant.now();
    try {
      result = processor.process(job);
    } catch (Throwable t) {
      // Includes Errors such as StackOverflowError raised inside a decoder.
      ErrorDetails details = ExceptionUtil.toErrorDetails(t);
      log.error(
          "Unexpected {} processing {}: {}",
          details.type(),
          job.sourcePath(),
          details.message(),
          t);
      result = new JobResult(job, JobStatus.FAILED, t.toString(), startedAt, Instant.now());
    }

    processed.incrementAndGet();
    if (!result.status().isSuccess()) {
      failed.incrementAndGet();
    }
    try {
      listener.onCompleted(result);
    } catch (RuntimeException e) {
      log.warn("Job listener failed for {}: {}", job.sourcePath(), e.toString());
    }
  }

  /**
   * Wait for every worker to exit. Workers only exit after the queue is closed, so callers close
   * the queue first to drain it.
   *
   * @return {@code true} if all workers finished within the timeout
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    for (Thread worker : workers) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return !anyAlive();
      }
      worker.join(Math.max(1L, remaining / 1_000_000L));
    }
    return !anyAlive();
  }

  /** Interrupt every worker. Jobs in flight run to completion unless they observe interruption. */
  public void shutdownNow() {
    for (Thread worker : workers) {
      worker.interrupt();
    }
  }

  private boolean anyAlive() {
    return workers.stream().anyMatch(Thread::isAlive);
  }

  public int size() {
    return size;
  }

  public long processedCount() {
    return processed.get();
  }

  public long failedCount() {
    return failed.get();
  }

  List<Thread> threads() {
    return Collections.unmodifiableList(workers);
  }
}
