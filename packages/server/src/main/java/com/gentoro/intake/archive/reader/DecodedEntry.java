package com.gentoro.intake.archive.reader;

import java.io.IOException;
import java.io.InputStream;

/**
 * One record of an archive as exposed by an {@link ArchiveReader}. Valid only until the reader
 * advances to the next entry.
 *
 * @param pathname entry name with {@code /} separators, as stored in the archive
 * @param type record kind
 * @param size uncompressed size in bytes, or {@code -1} when the format does not record it
 * @param data opens the entry's content; only meaningful for {@link EntryType#FILE}
 */
public record DecodedEntry(String pathname, EntryType type, long size, Data data) {

  /** Lazily opened entry content. Callers close the returned stream. */
  @FunctionalInterface
  public interface Data {
    InputStream open() throws IOException;
  }

  static Data unreadable(String pathname, String reason) {
    return () -> {
      throw new IOException("Cannot read entry data for " + pathname + ": " + reason);
    };
  }
}
