package com.gentoro.intake.exception;

/** Stable error codes attached to every {@link IntakeException}. */
public enum IntakeErrorCode {
  UNKNOWN,
  CONFIGURATION_ERROR,
  STATE_ERROR,
  QUEUE_FULL,
  BROKER_ERROR,
  EXTRACTION_ERROR,
  RELOCATION_ERROR
}
