package com.gentoro.intake.exception;

import java.time.Instant;
import java.util.Map;

/** Flattened view of a failure, suitable for a single log line. */
public record ErrorDetails(
    String type, String message, IntakeErrorCode code, Map<String, Object> context, Instant at) {}
