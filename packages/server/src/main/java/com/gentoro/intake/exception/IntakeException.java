package com.gentoro.intake.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for all service-specific failures.
 *
 * <p>Carries an {@link IntakeErrorCode} and an optional context map (for example the archive path
 * or entry name involved) that {@link ExceptionUtil} copies into {@link ErrorDetails}.
 */
public class IntakeException extends RuntimeException {
  private final IntakeErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public IntakeException(IntakeErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public IntakeException(IntakeErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public IntakeErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context value and return {@code this} for chaining. */
  public IntakeException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
