package com.gentoro.intake.archive.reader;

import java.io.Closeable;
import java.io.IOException;

/**
 * Forward-only iteration over the entries of one archive, in the order the underlying decoder
 * yields them.
 */
public interface ArchiveReader extends Closeable {

  /** Short format label for logging, e.g. {@code zip} or {@code gz+tar}. */
  String format();

  /**
   * Advance to the next entry.
   *
   * @return the entry, or {@code null} once the archive is exhausted
   * @throws IOException when the archive is corrupt or truncated
   */
  DecodedEntry nextEntry() throws IOException;
}
