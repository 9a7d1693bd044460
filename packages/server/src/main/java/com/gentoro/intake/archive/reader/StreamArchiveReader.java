package com.gentoro.intake.archive.reader;

import java.io.IOException;
import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.ArchiveInputStream;
import org.apache.commons.compress.archivers.cpio.CpioArchiveEntry;
import org.apache.commons.compress.archivers.dump.DumpArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.io.input.CloseShieldInputStream;

/**
 * Reads the formats Apache Commons Compress exposes as an {@link ArchiveInputStream}: tar most
 * importantly, but also ar, arj, cpio and dump. Compressed tars arrive here already wrapped in
 * their decompressor by {@link ArchiveReaders}.
 */
final class StreamArchiveReader implements ArchiveReader {
  private final String format;
  private final ArchiveInputStream<? extends ArchiveEntry> in;

  StreamArchiveReader(String format, ArchiveInputStream<? extends ArchiveEntry> in) {
    this.format = format;
    this.in = in;
  }

  @Override
  public String format() {
    return format;
  }

  @Override
  public DecodedEntry nextEntry() throws IOException {
    ArchiveEntry entry = in.getNextEntry();
    if (entry == null) {
      return null;
    }
    String name = entry.getName();
    EntryType type = typeOf(entry);
    DecodedEntry.Data data =
        in.canReadEntryData(entry)
            ? () -> CloseShieldInputStream.wrap(in)
            : DecodedEntry.unreadable(name, "unsupported compression or encryption");
    return new DecodedEntry(name, type, entry.getSize(), data);
  }

  static EntryType typeOf(ArchiveEntry entry) {
    if (entry.isDirectory()) {
      return EntryType.DIRECTORY;
    }
    if (entry instanceof TarArchiveEntry tar) {
      // isFile() is also true for symbolic and hard links
      if (tar.isSymbolicLink()
          || tar.isLink()
          || tar.isCharacterDevice()
          || tar.isBlockDevice()
          || tar.isFIFO()) {
        return EntryType.OTHER;
      }
      return tar.isFile() ? EntryType.FILE : EntryType.OTHER;
    }
    if (entry instanceof CpioArchiveEntry cpio) {
      return cpio.isRegularFile() ? EntryType.FILE : EntryType.OTHER;
    }
    if (entry instanceof DumpArchiveEntry dump) {
      return dump.isFile() ? EntryType.FILE : EntryType.OTHER;
    }
    return EntryType.FILE;
  }

  @Override
  public void close() throws IOException {
    in.close();
  }
}
