package com.gentoro.intake.archive.reader;

import com.github.junrar.Archive;
import com.github.junrar.exception.RarException;
import com.github.junrar.rarfile.FileHeader;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads RAR archives with junrar. RAR is not supported by Commons Compress; junrar handles the
 * RAR4 format, RAR5 archives fail to open and the job is reported as failed.
 */
final class RarArchiveReader implements ArchiveReader {
  private final Archive archive;

  private RarArchiveReader(Archive archive) {
    this.archive = archive;
  }

  static RarArchiveReader open(Path path) throws IOException {
    Archive archive;
    try {
      archive = new Archive(path.toFile());
    } catch (RarException e) {
      throw new IOException("Unreadable RAR archive: " + e.getMessage(), e);
    }
    boolean encrypted;
    try {
      encrypted = archive.isEncrypted();
    } catch (RarException e) {
      archive.close();
      throw new IOException("Unreadable RAR archive header: " + e.getMessage(), e);
    }
    if (encrypted) {
      archive.close();
      throw new IOException("Encrypted RAR archives are not supported");
    }
    return new RarArchiveReader(archive);
  }

  @Override
  public String format() {
    return "rar";
  }

  @Override
  public DecodedEntry nextEntry() throws IOException {
    FileHeader header = archive.nextFileHeader();
    if (header == null) {
      return null;
    }
    // RAR stores DOS-style separators.
    String name = header.getFileName().replace('\\', '/');
    EntryType type = header.isDirectory() ? EntryType.DIRECTORY : EntryType.FILE;
    DecodedEntry.Data data =
        header.isEncrypted()
            ? DecodedEntry.unreadable(name, "entry is encrypted")
            : () -> archive.getInputStream(header);
    return new DecodedEntry(name, type, header.getFullUnpackSize(), data);
  }

  @Override
  public void close() throws IOException {
    archive.close();
  }
}
