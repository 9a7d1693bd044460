package com.gentoro.intake.archive.reader;

import java.io.IOException;
import java.io.InputStream;
import org.apache.commons.io.input.CloseShieldInputStream;

/**
 * Presents a single compressed file (for example {@code notes.txt.gz}) as an archive holding one
 * regular file named after the input minus its compressor extension.
 */
final class CompressedFileReader implements ArchiveReader {
  private final String format;
  private final String entryName;
  private final InputStream decompressed;
  private boolean consumed;

  CompressedFileReader(String format, String entryName, InputStream decompressed) {
    this.format = format;
    this.entryName = entryName;
    this.decompressed = decompressed;
  }

  @Override
  public String format() {
    return format;
  }

  @Override
  public DecodedEntry nextEntry() {
    if (consumed) {
      return null;
    }
    consumed = true;
    return new DecodedEntry(
        entryName, EntryType.FILE, -1L, () -> CloseShieldInputStream.wrap(decompressed));
  }

  @Override
  public void close() throws IOException {
    decompressed.close();
  }
}
