package com.gentoro.intake.archive.reader;

/** Kind of record found inside an archive. */
public enum EntryType {
  /** Regular file with data. */
  FILE,
  /** Directory, possibly empty. */
  DIRECTORY,
  /** Anything else: symbolic or hard links, devices, FIFOs, 7z anti-items. Never written. */
  OTHER
}
