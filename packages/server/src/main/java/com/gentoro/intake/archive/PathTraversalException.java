package com.gentoro.intake.archive;

import java.io.IOException;

/** An entry name or output path that would resolve outside the output root. */
public class PathTraversalException extends IOException {
  private final String entryName;

  public PathTraversalException(String entryName, String message) {
    super(message);
    this.entryName = entryName;
  }

  public String getEntryName() {
    return entryName;
  }
}
