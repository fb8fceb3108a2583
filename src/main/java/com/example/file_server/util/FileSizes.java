package com.example.file_server.util;

import java.util.Locale;

public final class FileSizes {
  private static final long KB = 1024;
  private static final long MB = KB * 1024;
  private static final long GB = MB * 1024;

  private FileSizes() {}

  /** "512 B", "1.5 KB", "2.0 MB", "3.1 GB". */
  public static String format(long bytes) {
    if (bytes < KB) {
      return bytes + " B";
    } else if (bytes < MB) {
      return String.format(Locale.ROOT, "%.1f KB", bytes / (double) KB);
    } else if (bytes < GB) {
      return String.format(Locale.ROOT, "%.1f MB", bytes / (double) MB);
    }
    return String.format(Locale.ROOT, "%.1f GB", bytes / (double) GB);
  }
}
