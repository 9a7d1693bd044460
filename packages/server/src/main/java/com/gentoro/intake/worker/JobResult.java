package com.gentoro.intake.worker;

import com.gentoro.intake.queue.Job;
import java.time.Duration;
import java.time.Instant;

/** Outcome of processing one {@link Job}. */
public record JobResult(
    Job job, JobStatus status, String message, Instant startedAt, Instant finishedAt) {

  public Duration elapsed() {
    return Duration.between(startedAt, finishedAt);
  }
}
