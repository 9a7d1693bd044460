package com.gentoro.intake.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Decides whether an input file should be unpacked or copied as-is.
 *
 * <p>First the final extension of the file name is compared, case-sensitively, against {@link
 * #ARCHIVE_EXTENSIONS}; {@code report.ZIP} is therefore not an extension match. Failing that, the
 * first four bytes are compared against the ZIP and RAR signatures. Any I/O error while sniffing
 * yields {@code false}, so unreadable input takes the copy path rather than the unpack path.
 *
 * <p>This is a heuristic: a positive answer does not guarantee the file decodes.
 */
public final class ArchiveClassifier {
  public static final Set<String> ARCHIVE_EXTENSIONS =
      Set.of(".zip", ".rar", ".tar", ".gz", ".bz2", ".7z");

  static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};
  static final byte[] RAR_MAGIC = {0x52, 0x61, 0x72, 0x21};
  private static final List<byte[]> SIGNATURES = List.of(ZIP_MAGIC, RAR_MAGIC);

  private static final org.slf4j.Logger log =
      com.gentoro.intake.logging.LoggingService.getLogger(ArchiveClassifier.class);

  public boolean isArchive(Path path) {
    if (hasArchiveExtension(path)) {
      return true;
    }
    byte[] head = new byte[4];
    try (InputStream in = Files.newInputStream(path)) {
      if (in.readNBytes(head, 0, head.length) < head.length) {
        return false;
      }
    } catch (IOException | SecurityException e) {
      log.debug("Could not sniff {}, treating as plain file: {}", path, e.toString());
      return false;
    }
    return SIGNATURES.stream().anyMatch(sig -> Arrays.equals(sig, head));
  }

  static boolean hasArchiveExtension(Path path) {
    Path name = path.getFileName();
    if (name == null) return false;
    String fileName = name.toString();
    int dot = fileName.lastIndexOf('.');
    return dot >= 0 && ARCHIVE_EXTENSIONS.contains(fileName.substring(dot));
  }
}
