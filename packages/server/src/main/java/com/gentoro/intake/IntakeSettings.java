package com.gentoro.intake;

import com.gentoro.intake.exception.ConfigurationException;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Validated core settings of the intake pipeline.
 *
 * @param outputDir root under which every extracted or relocated file is written
 * @param queueCapacity fixed number of slots in the task queue
 * @param workerCount number of long-lived worker threads
 * @param drainTimeout how long shutdown waits for queued jobs to finish
 * @param maxExtractedBytes expanded-size limit per archive, {@code 0} for unlimited
 */
public record IntakeSettings(
    Path outputDir,
    int queueCapacity,
    int workerCount,
    Duration drainTimeout,
    long maxExtractedBytes) {

  public static IntakeSettings from(Configuration configuration) {
    String outputDir = configuration.getString("intake.output-dir", "extracted");
    if (outputDir == null || outputDir.isBlank()) {
      throw new ConfigurationException("intake.output-dir must not be blank");
    }
    int capacity = configuration.getInt("queue.capacity", 10);
    if (capacity < 1) {
      throw new ConfigurationException("queue.capacity must be >= 1, got " + capacity);
    }
    int workers = configuration.getInt("workers.count", 10);
    if (workers < 1) {
      throw new ConfigurationException("workers.count must be >= 1, got " + workers);
    }
    long drainSeconds = configuration.getLong("workers.drain-timeout-seconds", 30L);
    if (drainSeconds < 0) {
      throw new ConfigurationException("workers.drain-timeout-seconds must be >= 0");
    }
    long maxBytes = configuration.getLong("extraction.max-total-bytes", 0L);
    if (maxBytes < 0) {
      throw new ConfigurationException("extraction.max-total-bytes must be >= 0");
    }
    return new IntakeSettings(
        Path.of(outputDir), capacity, workers, Duration.ofSeconds(drainSeconds), maxBytes);
  }

  public IntakeSettings withOutputDir(Path dir) {
    return new IntakeSettings(dir, queueCapacity, workerCount, drainTimeout, maxExtractedBytes);
  }
}
