package com.gentoro.intake.archive;

import java.io.IOException;

/** Expanded archive content exceeded the configured byte limit. */
public class SizeLimitExceededException extends IOException {
  public SizeLimitExceededException(long limit) {
    super("Expanded content exceeds limit of " + limit + " bytes");
  }

  public SizeLimitExceededException(String entryName, long declaredSize, long remaining) {
    super(
        "Entry "
            + entryName
            + " declares "
            + declaredSize
            + " bytes, only "
            + remaining
            + " bytes left within the limit");
  }
}
