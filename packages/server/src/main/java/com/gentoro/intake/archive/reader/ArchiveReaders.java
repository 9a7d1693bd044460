package com.gentoro.intake.archive.reader;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.ArchiveException;
import org.apache.commons.compress.archivers.ArchiveInputStream;
import org.apache.commons.compress.archivers.ArchiveStreamFactory;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.apache.commons.io.FilenameUtils;

/**
 * Opens an {@link ArchiveReader} for a file by inspecting its content rather than its name.
 *
 * <p>Negotiation order:
 *
 * <ol>
 *   <li>RAR signature → junrar
 *   <li>any archive Commons Compress detects: ZIP and 7z through their random-access readers,
 *       everything else (tar, ar, arj, cpio, dump) as a stream
 *   <li>any compressor Commons Compress detects (gzip, bzip2, xz, lzma, Z, ...): if the
 *       decompressed content is itself a stream archive it is read as such ({@code .tar.gz}),
 *       otherwise it becomes a single-entry archive
 * </ol>
 *
 * Anything else is rejected with {@link UnsupportedFormatException}.
 */
public final class ArchiveReaders {
  private static final byte[] RAR_SIGNATURE = {0x52, 0x61, 0x72, 0x21};
  private static final ArchiveStreamFactory ARCHIVERS = new ArchiveStreamFactory();
  private static final CompressorStreamFactory COMPRESSORS = new CompressorStreamFactory(true);

  private ArchiveReaders() {}

  public static ArchiveReader open(Path path) throws IOException {
    if (startsWith(path, RAR_SIGNATURE)) {
      return RarArchiveReader.open(path);
    }

    InputStream raw = new BufferedInputStream(Files.newInputStream(path));
    boolean handedOff = false;
    try {
      String archiver = detectArchiver(raw);
      if (archiver != null) {
        if (isRandomAccessFormat(archiver)) {
          raw.close();
          handedOff = true;
          return ArchiveStreamFactory.SEVEN_Z.equals(archiver)
              ? SevenZArchiveReader.open(path)
              : ZipArchiveReader.open(path);
        }
        ArchiveReader reader = new StreamArchiveReader(archiver, createArchiveStream(archiver, raw));
        handedOff = true;
        return reader;
      }

      String compressor = detectCompressor(raw);
      if (compressor == null) {
        throw new UnsupportedFormatException(path);
      }
      InputStream decompressed =
          new BufferedInputStream(createCompressorStream(compressor, raw));
      handedOff = true;
      try {
        String inner = detectArchiver(decompressed);
        if (inner != null && !isRandomAccessFormat(inner)) {
          return new StreamArchiveReader(
              compressor + "+" + inner, createArchiveStream(inner, decompressed));
        }
        return new CompressedFileReader(compressor, decompressedName(path), decompressed);
      } catch (IOException | RuntimeException e) {
        decompressed.close();
        throw e;
      }
    } finally {
      if (!handedOff) {
        raw.close();
      }
    }
  }

  /** Name of the single file inside a compressed input, e.g. {@code notes.txt.gz → notes.txt}. */
  static String decompressedName(Path path) {
    String fileName = path.getFileName().toString();
    String base = FilenameUtils.removeExtension(fileName);
    return base.isEmpty() || base.equals(fileName) ? fileName + ".out" : base;
  }

  private static boolean isRandomAccessFormat(String archiver) {
    return ArchiveStreamFactory.ZIP.equals(archiver)
        || ArchiveStreamFactory.JAR.equals(archiver)
        || ArchiveStreamFactory.SEVEN_Z.equals(archiver);
  }

  private static boolean startsWith(Path path, byte[] signature) throws IOException {
    byte[] head = new byte[signature.length];
    try (InputStream in = Files.newInputStream(path)) {
      int read = in.readNBytes(head, 0, head.length);
      return read == head.length && Arrays.equals(head, signature);
    }
  }

  private static String detectArchiver(InputStream in) {
    try {
      return ArchiveStreamFactory.detect(in);
    } catch (ArchiveException e) {
      return null;
    }
  }

  private static String detectCompressor(InputStream in) {
    try {
      return CompressorStreamFactory.detect(in);
    } catch (CompressorException e) {
      return null;
    }
  }

  private static ArchiveInputStream<? extends ArchiveEntry> createArchiveStream(
      String archiver, InputStream in) throws IOException {
    try {
      return ARCHIVERS.createArchiveInputStream(archiver, in);
    } catch (ArchiveException e) {
      throw new IOException("Cannot read " + archiver + " archive: " + e.getMessage(), e);
    }
  }

  private static InputStream createCompressorStream(String compressor, InputStream in)
      throws IOException {
    try {
      return COMPRESSORS.createCompressorInputStream(compressor, in);
    } catch (CompressorException e) {
      throw new IOException("Cannot decompress " + compressor + " data: " + e.getMessage(), e);
    }
  }
}
