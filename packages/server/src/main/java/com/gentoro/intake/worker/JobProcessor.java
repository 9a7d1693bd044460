package com.gentoro.intake.worker;

import com.gentoro.intake.archive.ArchiveClassifier;
import com.gentoro.intake.archive.ExtractionEngine;
import com.gentoro.intake.archive.ExtractionSummary;
import com.gentoro.intake.exception.ErrorDetails;
import com.gentoro.intake.exception.ExceptionUtil;
import com.gentoro.intake.exception.IntakeException;
import com.gentoro.intake.queue.Job;
import com.gentoro.intake.relocate.FileRelocator;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import org.slf4j.Logger;

/**
 * Processes a single job to completion: existence check, classification, then extraction or
 * relocation. Never throws for a per-job failure; the outcome is returned and logged instead.
 */
public class JobProcessor {
  private static final Logger log =
      com.gentoro.intake.logging.LoggingService.getLogger(JobProcessor.class);

  private final Path outputRoot;
  private final ArchiveClassifier classifier;
  private final ExtractionEngine extractionEngine;
  private final FileRelocator relocator;

  public JobProcessor(
      Path outputRoot,
      ArchiveClassifier classifier,
      ExtractionEngine extractionEngine,
      FileRelocator relocator) {
    this.outputRoot = outputRoot;
    this.classifier = classifier;
    this.extractionEngine = extractionEngine;
    this.relocator = relocator;
  }

  public JobResult process(Job job) {
    Instant startedAt = Instant.now();
    log.info("Processing file: {}", job.sourcePath());

    Path source;
    try {
      source = job.path();
    } catch (InvalidPathException e) {
      log.error("Invalid file path {}: {}", job.sourcePath(), e.getMessage());
      return result(job, JobStatus.FAILED, "Invalid path: " + e.getMessage(), startedAt);
    }

    if (!Files.exists(source)) {
      log.error("File does not exist: {}", source);
      return result(job, JobStatus.MISSING_SOURCE, "File does not exist", startedAt);
    }

    try {
      if (classifier.isArchive(source)) {
        log.info("File {} is an archive. Starting extraction...", source);
        ExtractionSummary summary = extractionEngine.extract(source, outputRoot);
        log.info(
            "Extraction completed successfully for {} to {} ({}: {} files, {} directories, {} skipped, {} bytes)",
            source,
            outputRoot,
            summary.format(),
            summary.files(),
            summary.directories(),
            summary.skipped(),
            summary.bytes());
        return result(
            job,
            JobStatus.EXTRACTED,
            summary.files() + " files, " + summary.directories() + " directories",
            startedAt);
      }

      log.warn("File {} is not an archive", source);
      Path destination = relocator.relocate(source, outputRoot);
      log.info("Copied non-archive file {} to {}", source, destination);
      return result(job, JobStatus.RELOCATED, destination.toString(), startedAt);
    } catch (IntakeException e) {
      String reason = ExceptionUtil.extractErrorMessage(e);
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      log.error(
          "Processing failed for {}: {} [{} {}]",
          source,
          reason,
          details.code(),
          details.context());
      log.debug("Failure trace for {}: {}", source, ExceptionUtil.formatCompactStackTrace(e));
      return result(job, JobStatus.FAILED, reason, startedAt);
    }
  }

  private static JobResult result(Job job, JobStatus status, String message, Instant startedAt) {
    return new JobResult(job, status, message, startedAt, Instant.now());
  }
}
