package com.gentoro.intake.exception;

import java.time.Instant;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging. If the throwable is an
   * {@link IntakeException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof IntakeException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        IntakeErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Produce a compact, human-friendly representation of a throwable's stack trace. It captures only
   * the first line of each stack frame up to the provided limit and joins them in call-order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a reasonable default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Build a one-line reason for a failed job: the top-level message followed by the message of
   * the deepest cause when it differs, e.g. {@code "Failed to open archive x.zip: (EOFException)
   * Unexpected end of ZLIB input stream"}.
   *
   * @param t the throwable to describe
   * @return the reason, or {@code "Unknown error"} when {@code t} is null
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }

    String top = t.getMessage();
    if (top == null || top.isBlank()) {
      top = t.getClass().getSimpleName();
    }

    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    if (root == t) {
      return top;
    }

    String rootMessage = root.getMessage();
    if (rootMessage == null || rootMessage.isBlank() || top.contains(rootMessage)) {
      return top;
    }
    return top + ": (" + root.getClass().getSimpleName() + ") " + rootMessage;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
