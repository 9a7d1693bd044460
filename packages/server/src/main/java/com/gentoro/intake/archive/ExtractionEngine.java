package com.gentoro.intake.archive;

import com.gentoro.intake.archive.reader.ArchiveReader;
import com.gentoro.intake.archive.reader.ArchiveReaders;
import com.gentoro.intake.archive.reader.DecodedEntry;
import com.gentoro.intake.exception.ExtractionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;

/**
 * Unpacks an archive beneath an output root.
 *
 * <p>Entries are processed in the order the decoder yields them. Every entry path passes the
 * confinement check of {@link IoUtil#secureResolve(Path, String)} before anything is written;
 * directories are recreated, regular files are streamed in {@link IoUtil#BUFFER_SIZE} chunks and
 * atomically moved into place, and links or device entries are skipped with a warning.
 *
 * <p>The first failure aborts the archive with an {@link ExtractionException}. Entries written
 * before the failure are left in place.
 */
public final class ExtractionEngine {
  private static final Logger log =
      com.gentoro.intake.logging.LoggingService.getLogger(ExtractionEngine.class);

  private final long maxTotalBytes;

  public ExtractionEngine() {
    this(0L);
  }

  /**
   * @param maxTotalBytes expanded-size limit per archive; {@code 0} disables the limit
   */
  public ExtractionEngine(long maxTotalBytes) {
    if (maxTotalBytes < 0) {
      throw new IllegalArgumentException("maxTotalBytes must be >= 0");
    }
    this.maxTotalBytes = maxTotalBytes;
  }

  public ExtractionSummary extract(Path archive, Path outputRoot) {
    ArchiveReader opened;
    try {
      opened = ArchiveReaders.open(archive);
    } catch (IOException e) {
      throw new ExtractionException(
          archive, "Failed to open archive " + archive + ": " + e.getMessage(), e);
    }

    Path root = outputRoot.toAbsolutePath().normalize();
    Counters counters = new Counters();
    try (ArchiveReader reader = opened) {
      try {
        Files.createDirectories(root);
      } catch (IOException e) {
        throw new ExtractionException(
            archive, "Failed to create output directory " + root + ": " + e.getMessage(), e);
      }

      DecodedEntry entry;
      while ((entry = reader.nextEntry()) != null) {
        log.debug("Extracting {} from {}", entry.pathname(), archive);
        try {
          extractEntry(entry, root, counters);
        } catch (PathTraversalException e) {
          throw new ExtractionException(
                  archive, "Rejected entry in " + archive + ": " + e.getMessage(), e)
              .withContext("entry", entry.pathname());
        } catch (IOException e) {
          throw new ExtractionException(
                  archive,
                  "Failed to extract " + entry.pathname() + " from " + archive + ": "
                      + e.getMessage(),
                  e)
              .withContext("entry", entry.pathname());
        }
      }

      return new ExtractionSummary(
          reader.format(), counters.files, counters.directories, counters.skipped, counters.bytes);
    } catch (IOException e) {
      throw new ExtractionException(
          archive, "Archive read error for " + archive + ": " + e.getMessage(), e);
    }
  }

  private void extractEntry(DecodedEntry entry, Path root, Counters counters) throws IOException {
    String name = entry.pathname();
    Path target = IoUtil.secureResolve(root, name);

    switch (entry.type()) {
      case DIRECTORY -> {
        Files.createDirectories(target);
        IoUtil.requireRealPathWithin(root, target, name);
        counters.directories++;
      }
      case FILE -> {
        if (target.equals(root)) {
          throw new PathTraversalException(name, "File entry resolves to the output root: " + name);
        }
        Path parent = target.getParent();
        Files.createDirectories(parent);
        IoUtil.requireRealPathWithin(root, parent, name);

        long budget = maxTotalBytes == 0 ? Long.MAX_VALUE : maxTotalBytes - counters.bytes;
        // Declared sizes are only a hint; the copy enforces the limit on the bytes actually read.
        if (entry.size() > budget) {
          throw new SizeLimitExceededException(name, entry.size(), budget);
        }
        try (InputStream in = entry.data().open()) {
          counters.bytes += IoUtil.copyAtomically(in, target, budget);
        }
        counters.files++;
      }
      case OTHER -> {
        log.warn("Skipping {} in archive: not a regular file or directory", name);
        counters.skipped++;
      }
    }
  }

  private static final class Counters {
    int files;
    int directories;
    int skipped;
    long bytes;
  }
}
