package com.gentoro.intake.exception;

import java.nio.file.Path;

/**
 * Failure unpacking an archive: unreadable or unrecognized container, a rejected entry path, or
 * an I/O error while writing output. Aborts the current job only.
 */
public class ExtractionException extends IntakeException {
  private final Path archive;

  public ExtractionException(Path archive, String message) {
    super(IntakeErrorCode.EXTRACTION_ERROR, message);
    this.archive = archive;
    withContext("archive", archive);
  }

  public ExtractionException(Path archive, String message, Throwable cause) {
    super(IntakeErrorCode.EXTRACTION_ERROR, message, cause);
    this.archive = archive;
    withContext("archive", archive);
  }

  @Override
  public ExtractionException withContext(String key, Object value) {
    super.withContext(key, value);
    return this;
  }

  public Path getArchive() {
    return archive;
  }
}
