package com.gentoro.intake.exception;

/** Operation attempted while a component is in the wrong lifecycle state. */
public class StateException extends IntakeException {
  public StateException(String message) {
    super(IntakeErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(IntakeErrorCode.STATE_ERROR, message, cause);
  }
}
