package com.gentoro.intake.queue;

import com.gentoro.intake.exception.QueueFullException;
import com.gentoro.intake.exception.StateException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity FIFO ring buffer coupling the broker consumer to the worker pool.
 *
 * <p>{@link #enqueue(Job)} never waits for space: it fails with {@link QueueFullException} as soon
 * as every slot is taken, so the broker read loop is never stalled. {@link #dequeue()} suspends
 * the caller until a job is available. All state is guarded by one lock with a single "not empty"
 * condition.
 *
 * <p>After {@link #close()} no new jobs are accepted, but jobs already buffered are still handed
 * out; once the queue is both closed and empty, {@code dequeue} returns {@code null}.
 */
public final class TaskQueue {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();

  private final Job[] items;
  private int head;
  private int tail;
  private int occupied;
  private boolean closed;

  public TaskQueue(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
    }
    this.items = new Job[capacity];
  }

  /**
   * Append a job at the tail.
   *
   * @throws QueueFullException when {@code size() == capacity()}
   * @throws StateException when the queue has been closed
   */
  public void enqueue(Job job) {
    if (job == null) {
      throw new IllegalArgumentException("job must not be null");
    }
    lock.lock();
    try {
      if (closed) {
        throw new StateException("Task queue is closed, rejecting " + job.sourcePath());
      }
      if (occupied == items.length) {
        throw new QueueFullException(items.length);
      }
      items[tail] = job;
      tail = (tail + 1) % items.length;
      occupied++;
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Remove and return the oldest job, waiting while the queue is empty.
   *
   * @return the next job, or {@code null} once the queue is closed and drained
   */
  public Job dequeue() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (occupied == 0) {
        if (closed) return null;
        notEmpty.await();
      }
      return take();
    } finally {
      lock.unlock();
    }
  }

  private Job take() {
    Job job = items[head];
    items[head] = null;
    head = (head + 1) % items.length;
    occupied--;
    return job;
  }

  /** Stop accepting jobs and wake every waiting worker. Idempotent. */
  public void close() {
    lock.lock();
    try {
      closed = true;
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return occupied;
    } finally {
      lock.unlock();
    }
  }

  public int capacity() {
    return items.length;
  }
}
