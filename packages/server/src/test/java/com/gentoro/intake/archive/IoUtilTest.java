package com.gentoro.intake.archive;

import static org.junit.jupiter.api.Assertions.*;

import java.io.*;
import java.nio.file.*;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

class IoUtilTest {

  @TempDir Path temp;

  @Test
  void resolvesEntryInsideBase() throws Exception {
    Path base = temp.resolve("safe");
    Path result = IoUtil.secureResolve(base, "a/b.txt");
    assertTrue(result.startsWith(base.toAbsolutePath().normalize()));
    assertEquals("b.txt", result.getFileName().toString());
  }

  @Test
  void allowsDotSegmentsThatStayInside() throws Exception {
    Path base = temp.resolve("safe");
    Path result = IoUtil.secureResolve(base, "a/../c/./d.txt");
    assertEquals(base.toAbsolutePath().normalize().resolve("c/d.txt"), result);
  }

  @Test
  void detectsZipSlip() {
    Path base = temp.resolve("safe");
    PathTraversalException ex =
        assertThrows(
            PathTraversalException.class, () -> IoUtil.secureResolve(base, "../../evil.txt"));
    assertEquals("../../evil.txt", ex.getEntryName());
  }

  @Test
  void rejectsAbsoluteEntryNames() {
    Path base = temp.resolve("safe");
    assertThrows(PathTraversalException.class, () -> IoUtil.secureResolve(base, "/etc/passwd"));
  }

  @Test
  void selfReferenceResolvesToBase() throws Exception {
    Path base = temp.resolve("safe");
    assertEquals(base.toAbsolutePath().normalize(), IoUtil.secureResolve(base, "./"));
    assertThrows(PathTraversalException.class, () -> IoUtil.secureResolve(base, "x/.."));
  }

  @Test
  void copiesStreamToFile() throws Exception {
    Path dest = temp.resolve("nested/dir/file.txt");
    long bytes =
        IoUtil.copyAtomically(new ByteArrayInputStream("hello".getBytes()), dest, Long.MAX_VALUE);

    assertEquals(5, bytes);
    assertEquals("hello", Files.readString(dest));
    assertNoTempFiles(dest.getParent());
  }

  @Test
  void replacesExistingFile() throws Exception {
    Path dest = temp.resolve("file.txt");
    Files.writeString(dest, "old content that is longer");
    IoUtil.copyAtomically(new ByteArrayInputStream("new".getBytes()), dest, Long.MAX_VALUE);
    assertEquals("new", Files.readString(dest));
  }

  @Test
  void enforcesSizeLimitWithoutLeavingPartialFile() throws Exception {
    Path dest = temp.resolve("big.bin");
    assertThrows(
        SizeLimitExceededException.class,
        () -> IoUtil.copyAtomically(new ByteArrayInputStream(new byte[100]), dest, 10));

    assertFalse(Files.exists(dest));
    assertNoTempFiles(temp);
  }

  @Test
  void rejectsDirectoryReachedThroughOutsideSymlink() throws Exception {
    Path base = Files.createDirectories(temp.resolve("out"));
    Path outside = Files.createDirectories(temp.resolve("elsewhere"));
    Path link = base.resolve("link");
    try {
      Files.createSymbolicLink(link, outside);
    } catch (UnsupportedOperationException | IOException e) {
      Assumptions.abort("symbolic links not supported here");
    }

    assertThrows(
        PathTraversalException.class, () -> IoUtil.requireRealPathWithin(base, link, "link/x"));
    IoUtil.requireRealPathWithin(base, Files.createDirectories(base.resolve("real")), "real/x");
  }

  @Test
  @DisplayName("atomically written files get the same permissions as a plainly created file")
  void writtenFileKeepsDefaultPermissions() throws Exception {
    Assumptions.assumeTrue(
        FileSystems.getDefault().supportedFileAttributeViews().contains("posix"),
        "POSIX permissions not supported here");
    Path baseline = Files.createFile(temp.resolve("baseline.txt"));
    Path dest = temp.resolve("written.txt");

    IoUtil.copyAtomically(new ByteArrayInputStream("x".getBytes()), dest, Long.MAX_VALUE);

    Set<PosixFilePermission> expected = Files.getPosixFilePermissions(baseline);
    assertEquals(
        PosixFilePermissions.toString(expected),
        PosixFilePermissions.toString(Files.getPosixFilePermissions(dest)));
  }

  private static void assertNoTempFiles(Path dir) throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".part")));
    }
  }
}
