package com.gentoro.intake.archive.reader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Iterator;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZFile;

/**
 * Reads 7z archives. Commons Compress offers no streaming reader for 7z; {@link SevenZFile}
 * requires random access to the file.
 */
final class SevenZArchiveReader implements ArchiveReader {
  private final SevenZFile sevenZFile;
  private final Iterator<SevenZArchiveEntry> entries;

  private SevenZArchiveReader(SevenZFile sevenZFile) {
    this.sevenZFile = sevenZFile;
    this.entries = sevenZFile.getEntries().iterator();
  }

  static SevenZArchiveReader open(Path path) throws IOException {
    return new SevenZArchiveReader(SevenZFile.builder().setPath(path).get());
  }

  @Override
  public String format() {
    return "7z";
  }

  @Override
  public DecodedEntry nextEntry() throws IOException {
    if (!entries.hasNext()) {
      return null;
    }
    SevenZArchiveEntry entry = entries.next();
    EntryType type;
    if (entry.isAntiItem()) {
      type = EntryType.OTHER;
    } else if (entry.isDirectory()) {
      type = EntryType.DIRECTORY;
    } else {
      type = EntryType.FILE;
    }
    DecodedEntry.Data data =
        entry.hasStream() ? () -> sevenZFile.getInputStream(entry) : InputStream::nullInputStream;
    return new DecodedEntry(entry.getName(), type, entry.getSize(), data);
  }

  @Override
  public void close() throws IOException {
    sevenZFile.close();
  }
}
