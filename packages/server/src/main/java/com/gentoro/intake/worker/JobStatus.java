package com.gentoro.intake.worker;

/** Final state of one processing attempt. */
public enum JobStatus {
  /** Archive unpacked into the output root. */
  EXTRACTED,
  /** Plain file copied into the output root. */
  RELOCATED,
  /** Source path did not exist when the job was dequeued. */
  MISSING_SOURCE,
  /** Extraction or relocation failed; partial output may remain. */
  FAILED;

  public boolean isSuccess() {
    return this == EXTRACTED || this == RELOCATED;
  }
}
