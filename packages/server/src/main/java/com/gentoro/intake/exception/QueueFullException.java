package com.gentoro.intake.exception;

/** Raised by the task queue when a job is offered while every slot is occupied. */
public class QueueFullException extends IntakeException {
  private final int capacity;

  public QueueFullException(int capacity) {
    super(IntakeErrorCode.QUEUE_FULL, "Task queue is full (capacity " + capacity + ")");
    this.capacity = capacity;
  }

  public int getCapacity() {
    return capacity;
  }
}
