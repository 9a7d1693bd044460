package com.gentoro.intake.exception;

/** Failure copying a plain file into the output root. */
public class RelocationException extends IntakeException {
  public RelocationException(String message) {
    super(IntakeErrorCode.RELOCATION_ERROR, message);
  }

  public RelocationException(String message, Throwable cause) {
    super(IntakeErrorCode.RELOCATION_ERROR, message, cause);
  }
}
