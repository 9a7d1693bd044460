package com.gentoro.intake.archive.reader;

import java.io.IOException;
import java.nio.file.Path;

/** The file matched no archive or compression format known to the decoders. */
public class UnsupportedFormatException extends IOException {
  public UnsupportedFormatException(Path path) {
    super("Unrecognized archive format: " + path);
  }
}
