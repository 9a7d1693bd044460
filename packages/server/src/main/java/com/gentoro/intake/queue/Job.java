package com.gentoro.intake.queue;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One unit of work: a single input file awaiting classification and processing.
 *
 * @param sourcePath path of the file as received
 * @param deliveryTag broker delivery tag, or {@code -1} when the job did not come from the broker
 * @param receivedAt when the job was created
 */
public record Job(String sourcePath, long deliveryTag, Instant receivedAt) {

  public Job {
    if (sourcePath == null || sourcePath.isBlank()) {
      throw new IllegalArgumentException("sourcePath must not be blank");
    }
    if (receivedAt == null) {
      receivedAt = Instant.now();
    }
  }

  public static Job of(String sourcePath) {
    return new Job(sourcePath, -1L, Instant.now());
  }

  public Path path() {
    return Path.of(sourcePath);
  }
}
