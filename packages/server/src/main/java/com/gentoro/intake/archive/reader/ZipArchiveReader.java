package com.gentoro.intake.archive.reader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Enumeration;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;

/**
 * Reads ZIP archives through the random-access {@link ZipFile}, which uses the central directory
 * and therefore copes with entries the streaming reader cannot size (data descriptors).
 */
final class ZipArchiveReader implements ArchiveReader {
  private final ZipFile zipFile;
  private final Enumeration<ZipArchiveEntry> entries;

  private ZipArchiveReader(ZipFile zipFile) {
    this.zipFile = zipFile;
    this.entries = zipFile.getEntries();
  }

  static ZipArchiveReader open(Path path) throws IOException {
    return new ZipArchiveReader(ZipFile.builder().setPath(path).get());
  }

  @Override
  public String format() {
    return "zip";
  }

  @Override
  public DecodedEntry nextEntry() throws IOException {
    if (!entries.hasMoreElements()) {
      return null;
    }
    ZipArchiveEntry entry = entries.nextElement();
    String name = entry.getName();
    EntryType type;
    if (entry.isDirectory()) {
      type = EntryType.DIRECTORY;
    } else if (entry.isUnixSymlink()) {
      type = EntryType.OTHER;
    } else {
      type = EntryType.FILE;
    }
    DecodedEntry.Data data =
        zipFile.canReadEntryData(entry)
            ? () -> zipFile.getInputStream(entry)
            : DecodedEntry.unreadable(name, "unsupported compression method or encryption");
    return new DecodedEntry(name, type, entry.getSize(), data);
  }

  @Override
  public void close() throws IOException {
    zipFile.close();
  }
}
