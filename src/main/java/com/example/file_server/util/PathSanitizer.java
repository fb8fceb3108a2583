package com.example.file_server.util;

import com.example.file_server.config.FileServerProperties;
import com.example.file_server.exception.InvalidFileNameException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Validates client-supplied file names before they are used to build a path under the storage
 * root. A name that passes {@link #sanitize(String)} is a single path element that, joined to the
 * root and normalized, stays a direct child of the root.
 */
@Component
public class PathSanitizer {
  private static final Pattern WINDOWS_FORBIDDEN_CHARS = Pattern.compile("[<>:\"|?*]");
  private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");
  private static final Set<String> WINDOWS_RESERVED_NAMES =
      Set.of(
          "CON", "PRN", "AUX", "NUL", "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7",
          "COM8", "COM9", "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9");

  private final Path root;
  private final int maxLength;

  @Autowired
  public PathSanitizer(FileServerProperties properties) {
    this(properties.storageRoot(), properties.maxFilenameLength());
  }

  public PathSanitizer(Path root, int maxLength) {
    this.root = root.toAbsolutePath().normalize();
    this.maxLength = maxLength;
  }

  /**
   * Returns {@code candidate} unchanged if it is safe to use as a stored-file name.
   *
   * @throws InvalidFileNameException if the name is empty, too long, contains separators or
   *     control characters, is hidden or reserved, or would resolve outside the storage root
   */
  public String sanitize(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      throw new InvalidFileNameException("Filename cannot be empty");
    }
    if (candidate.codePointCount(0, candidate.length()) > maxLength) {
      throw new InvalidFileNameException("Filename is too long");
    }
    if (!candidate.equals(candidate.strip())) {
      throw new InvalidFileNameException("Invalid filename");
    }
    if (CONTROL_CHARS.matcher(candidate).find()) {
      throw new InvalidFileNameException("Invalid filename");
    }
    if (candidate.indexOf('/') >= 0 || candidate.indexOf('\\') >= 0) {
      throw new InvalidFileNameException("Invalid filename");
    }
    if (!candidate.equals(FilenameUtils.getName(candidate))) {
      throw new InvalidFileNameException("Invalid filename");
    }
    if (WINDOWS_FORBIDDEN_CHARS.matcher(candidate).find()) {
      throw new InvalidFileNameException("Invalid filename");
    }
    if (candidate.startsWith(".")) {
      throw new InvalidFileNameException("Hidden files are not allowed");
    }
    String baseName = FilenameUtils.getBaseName(candidate).toUpperCase(Locale.ROOT);
    if (WINDOWS_RESERVED_NAMES.contains(baseName)) {
      throw new InvalidFileNameException("Invalid filename");
    }
    resolve(candidate);
    return candidate;
  }

  /**
   * Reduces a client-supplied original name to its last path element with control characters
   * removed. The result is informational and feeds name generation; it is never joined to the
   * root, so characters {@link #sanitize(String)} would refuse are kept.
   *
   * @throws InvalidFileNameException if nothing is left of the name
   */
  public String cleanOriginalName(String originalName) {
    if (originalName == null) {
      throw new InvalidFileNameException("Filename cannot be empty");
    }
    int cut = Math.max(originalName.lastIndexOf('/'), originalName.lastIndexOf('\\'));
    String name = CONTROL_CHARS.matcher(originalName.substring(cut + 1)).replaceAll("").strip();
    if (name.isEmpty()) {
      throw new InvalidFileNameException("Filename cannot be empty");
    }
    return name;
  }

  /** Like {@link #sanitize(String)} but returns {@code false} instead of throwing. */
  public boolean isSafe(String candidate) {
    try {
      sanitize(candidate);
      return true;
    } catch (InvalidFileNameException e) {
      return false;
    }
  }

  /**
   * Joins {@code name} to the storage root and checks that the normalized result is a direct child
   * of the root.
   */
  public Path resolve(String name) {
    Path resolved;
    try {
      resolved = root.resolve(name).normalize();
    } catch (InvalidPathException e) {
      throw new InvalidFileNameException("Invalid filename");
    }
    if (!resolved.startsWith(root) || !root.equals(resolved.getParent())) {
      throw new InvalidFileNameException("Invalid file path");
    }
    return resolved;
  }

  public Path getRoot() {
    return root;
  }
}
