package com.gentoro.intake.archive;

/**
 * Outcome of a successful extraction.
 *
 * @param format decoder label, e.g. {@code zip} or {@code gz+tar}
 * @param files regular files written
 * @param directories directories created
 * @param skipped entries ignored because they are neither files nor directories
 * @param bytes total bytes written
 */
public record ExtractionSummary(String format, int files, int directories, int skipped, long bytes) {}
