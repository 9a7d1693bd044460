package com.gentoro.intake.archive;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.ThreadLocalRandom;

/** Small collection of I/O helpers for safe file operations. */
public final class IoUtil {
  /** Chunk size used for every copy; independent of entry or file size. */
  public static final int BUFFER_SIZE = 8192;

  private static final int TEMP_NAME_ATTEMPTS = 16;

  private IoUtil() {}

  /**
   * Resolve an archive entry name securely inside a base directory.
   *
   * <p>Prevents ZipSlip attacks by normalizing and verifying parent directory containment.
   * Absolute names and {@code ..} segments that climb above {@code base} are rejected.
   */
  public static Path secureResolve(Path base, String entryName) throws PathTraversalException {
    Path root = base.toAbsolutePath().normalize();
    Path dest;
    try {
      dest = root.resolve(entryName).normalize();
    } catch (java.nio.file.InvalidPathException e) {
      throw new PathTraversalException(entryName, "Invalid entry name: " + entryName);
    }
    if (!dest.startsWith(root) || dest.equals(root) && !isSelfReference(entryName)) {
      throw new PathTraversalException(entryName, "Blocked entry escaping output root: " + entryName);
    }
    return dest;
  }

  private static boolean isSelfReference(String entryName) {
    String trimmed = entryName.replace('\\', '/');
    while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
    return trimmed.isEmpty() || trimmed.equals(".");
  }

  /**
   * Verify that an existing directory, after resolving symbolic links, still lives under {@code
   * base}. Guards against symlinks planted in the output tree by earlier jobs.
   */
  public static void requireRealPathWithin(Path base, Path dir, String entryName)
      throws IOException {
    Path realRoot = base.toRealPath();
    Path realDir = dir.toRealPath();
    if (!realDir.startsWith(realRoot)) {
      throw new PathTraversalException(
          entryName, "Blocked entry resolving outside output root via link: " + entryName);
    }
  }

  /**
   * Stream {@code in} into {@code dest} through a uniquely named temporary sibling, then move it
   * over {@code dest}. Readers never observe a partially written file and concurrent writers to
   * the same destination never interleave; the last completed write wins.
   *
   * @param maxBytes abort with {@link SizeLimitExceededException} once more than this many bytes
   *     were read; {@link Long#MAX_VALUE} for no limit
   * @return number of bytes written
   */
  public static long copyAtomically(InputStream in, Path dest, long maxBytes) throws IOException {
    Path dir = dest.toAbsolutePath().getParent();
    Files.createDirectories(dir);
    Path temp = createTempSibling(dir, dest);
    boolean moved = false;
    try {
      long total = 0;
      try (OutputStream out = Files.newOutputStream(temp)) {
        byte[] buffer = new byte[BUFFER_SIZE];
        int n;
        while ((n = in.read(buffer)) != -1) {
          total += n;
          if (total > maxBytes) {
            throw new SizeLimitExceededException(maxBytes);
          }
          out.write(buffer, 0, n);
        }
      }
      moveReplacing(temp, dest);
      moved = true;
      return total;
    } finally {
      if (!moved) {
        Files.deleteIfExists(temp);
      }
    }
  }

  /**
   * Create an empty, uniquely named file next to {@code dest}. Unlike {@link
   * Files#createTempFile}, which restricts the file to its owner, the new file gets the default
   * permissions of the process umask, the same as any other file the service writes.
   */
  private static Path createTempSibling(Path dir, Path dest) throws IOException {
    String prefix = tempPrefix(dest);
    FileAlreadyExistsException collision = null;
    for (int attempt = 0; attempt < TEMP_NAME_ATTEMPTS; attempt++) {
      String suffix = Long.toUnsignedString(ThreadLocalRandom.current().nextLong(), 36);
      try {
        return Files.createFile(dir.resolve(prefix + suffix + ".part"));
      } catch (FileAlreadyExistsException e) {
        collision = e;
      }
    }
    throw collision;
  }

  private static void moveReplacing(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static String tempPrefix(Path dest) {
    String name = dest.getFileName() == null ? "entry" : dest.getFileName().toString();
    if (name.length() > 32) name = name.substring(0, 32);
    return "." + name + ".";
  }
}
