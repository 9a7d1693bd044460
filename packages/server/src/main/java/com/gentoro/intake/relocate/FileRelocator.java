package com.gentoro.intake.relocate;

import com.gentoro.intake.archive.IoUtil;
import com.gentoro.intake.exception.RelocationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.slf4j.Logger;

/**
 * Copies a non-archive input file unchanged to {@code outputRoot/<basename>}.
 *
 * <p>Two inputs sharing a basename map to the same destination; the copy that completes last
 * wins, and the destination is always replaced atomically.
 */
public final class FileRelocator {
  private static final Logger log =
      com.gentoro.intake.logging.LoggingService.getLogger(FileRelocator.class);

  /**
   * @return the destination path
   * @throws RelocationException when the source cannot be read or the destination written
   */
  public Path relocate(Path source, Path outputRoot) {
    Path fileName = source.getFileName();
    if (fileName == null) {
      throw new RelocationException("Source has no file name: " + source);
    }
    Path destination = outputRoot.resolve(fileName.toString());

    try {
      Files.createDirectories(outputRoot);
    } catch (IOException e) {
      throw new RelocationException(
          "Failed to create output directory " + outputRoot + ": " + e.getMessage(), e);
    }

    InputStream in;
    try {
      in = Files.newInputStream(source);
    } catch (NoSuchFileException e) {
      throw new RelocationException("Source file does not exist: " + source, e);
    } catch (IOException e) {
      throw new RelocationException("Failed to open " + source + ": " + e.getMessage(), e);
    }

    try (in) {
      long bytes = IoUtil.copyAtomically(in, destination, Long.MAX_VALUE);
      log.debug("Copied {} bytes from {} to {}", bytes, source, destination);
      return destination;
    } catch (IOException e) {
      throw new RelocationException(
          "Failed to copy " + source + " to " + destination + ": " + e.getMessage(), e);
    }
  }
}
