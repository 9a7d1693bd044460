package com.gentoro.intake.exception;

/** Invalid or missing service configuration. */
public class ConfigurationException extends IntakeException {
  public ConfigurationException(String message) {
    super(IntakeErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(IntakeErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
