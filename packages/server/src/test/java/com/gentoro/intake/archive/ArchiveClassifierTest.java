package com.gentoro.intake.archive;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArchiveClassifierTest {

  @TempDir Path temp;

  private final ArchiveClassifier classifier = new ArchiveClassifier();

  @Test
  void matchesArchiveExtensionsWithoutReadingContent() {
    // none of these exist; the extension alone decides
    assertTrue(classifier.isArchive(temp.resolve("data.zip")));
    assertTrue(classifier.isArchive(temp.resolve("backup.tar")));
    assertTrue(classifier.isArchive(temp.resolve("logs.tar.gz")));
    assertTrue(classifier.isArchive(temp.resolve("dump.bz2")));
    assertTrue(classifier.isArchive(temp.resolve("bundle.7z")));
    assertTrue(classifier.isArchive(temp.resolve("old.rar")));
  }

  @Test
  void extensionMatchIsCaseSensitive() throws Exception {
    Path upper = temp.resolve("report.ZIP");
    Files.writeString(upper, "plain text, not a zip");
    assertFalse(classifier.isArchive(upper));
  }

  @Test
  void detectsZipBySignature() throws Exception {
    Path blob = temp.resolve("blob.bin");
    Files.write(blob, new byte[] {0x50, 0x4B, 0x03, 0x04, 0x14, 0x00});
    assertTrue(classifier.isArchive(blob));
  }

  @Test
  void detectsRarBySignature() throws Exception {
    Path blob = temp.resolve("upload");
    Files.write(blob, "Rar!\u001a\u0007\u0000".getBytes(StandardCharsets.ISO_8859_1));
    assertTrue(classifier.isArchive(blob));
  }

  @Test
  void plainTextIsNotAnArchive() throws Exception {
    Path notes = temp.resolve("notes.txt");
    Files.writeString(notes, "hello");
    assertFalse(classifier.isArchive(notes));
  }

  @Test
  void shortFileIsNotAnArchive() throws Exception {
    Path tiny = temp.resolve("tiny.dat");
    Files.write(tiny, new byte[] {0x50, 0x4B});
    assertFalse(classifier.isArchive(tiny));
  }

  @Test
  void unreadableInputFailsOpen() throws Exception {
    assertFalse(classifier.isArchive(temp.resolve("missing.dat")));
    Path dir = Files.createDirectory(temp.resolve("folder"));
    assertFalse(classifier.isArchive(dir));
  }
}
