package com.gentoro.intake.exception;

/** Connection-level failures talking to the message broker. Always fatal to the consumer. */
public class BrokerException extends IntakeException {
  public BrokerException(String message) {
    super(IntakeErrorCode.BROKER_ERROR, message);
  }

  public BrokerException(String message, Throwable cause) {
    super(IntakeErrorCode.BROKER_ERROR, message, cause);
  }
}
