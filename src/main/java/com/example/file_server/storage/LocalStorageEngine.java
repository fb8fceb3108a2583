package com.example.file_server.storage;

import com.example.file_server.config.FileServerProperties;
import com.example.file_server.exception.DisallowedFileTypeException;
import com.example.file_server.exception.FileAlreadyExistsException;
import com.example.file_server.exception.FileTooLargeException;
import com.example.file_server.exception.InvalidRequestArgumentException;
import com.example.file_server.exception.RequestStage;
import com.example.file_server.exception.ResourceNotFoundException;
import com.example.file_server.exception.StorageException;
import com.example.file_server.model.StoredFile;
import com.example.file_server.model.StoredFileContent;
import com.example.file_server.util.FileSizes;
import com.example.file_server.util.MimeUtil;
import com.example.file_server.util.NameGenerator;
import com.example.file_server.util.PathSanitizer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link StorageEngine} over a single flat directory. Uploads are written to a hidden temp file in
 * the same directory and renamed into place, so a partially written file is never visible under
 * its final name. Size and creation time for listings come from filesystem attributes.
 */
@Component
public class LocalStorageEngine implements StorageEngine {
  private static final Logger log = LoggerFactory.getLogger(LocalStorageEngine.class);

  static final String TEMP_PREFIX = ".upload-";
  static final String TEMP_SUFFIX = ".part";
  private static final int LOCK_STRIPES = 64;

  private final Path root;
  private final PathSanitizer sanitizer;
  private final long maxFileSize;
  private final Set<String> blockedExtensions;
  private final Set<String> allowedExtensions;
  private final Set<String> blockedContentTypes;
  private final Object[] nameLocks = new Object[LOCK_STRIPES];

  public LocalStorageEngine(FileServerProperties properties, PathSanitizer sanitizer) {
    this.root = sanitizer.getRoot();
    this.sanitizer = sanitizer;
    this.maxFileSize = properties.maxFileSize();
    this.blockedExtensions = properties.blockedExtensions();
    this.allowedExtensions = properties.allowedExtensions();
    this.blockedContentTypes = properties.blockedContentTypes();
    for (int i = 0; i < LOCK_STRIPES; i++) {
      nameLocks[i] = new Object();
    }
    try {
      Files.createDirectories(root);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create storage directory: " + root, e);
    }
    log.info(
        "Storage directory: {} (max file size {})", root, FileSizes.format(maxFileSize));
  }

  @Override
  public StoredFile write(
      String storedName, InputStream content, long declaredSize, String originalName) {
    Path target = sanitizer.resolve(sanitizer.sanitize(storedName));
    checkSize(declaredSize);
    checkExtension(storedName);

    Path temp = null;
    boolean published = false;
    try {
      MimeUtil.Detected detected = MimeUtil.detect(content, storedName);
      checkContentType(detected.contentType);

      temp = Files.createTempFile(root, TEMP_PREFIX, TEMP_SUFFIX);
      long written;
      try (InputStream bounded =
              BoundedInputStream.builder()
                  .setInputStream(detected.stream)
                  .setMaxCount(maxFileSize + 1)
                  .setPropagateClose(false)
                  .get();
          OutputStream out = Files.newOutputStream(temp)) {
        written = IOUtils.copyLarge(bounded, out);
      }
      checkSize(written);

      moveIntoPlace(temp, target, storedName);
      published = true;
      log.debug("Stored {} ({} bytes, type={})", storedName, written, detected.contentType);
      return StoredFile.builder()
          .storedName(storedName)
          .originalName(originalName)
          .sizeBytes(written)
          .createdAt(Instant.now())
          .contentType(detected.contentType)
          .build();
    } catch (IOException e) {
      throw new StorageException("Failed to save file", RequestStage.PERSISTENCE, e);
    } finally {
      if (!published && temp != null) {
        discard(temp);
      }
    }
  }

  @Override
  public StoredFileContent read(String storedName) {
    Path path = sanitizer.resolve(sanitizer.sanitize(storedName));
    try {
      BasicFileAttributes attrs =
          Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
      if (!attrs.isRegularFile()) {
        if (attrs.isSymbolicLink()) {
          log.warn("Refusing to follow symbolic link in storage directory: {}", storedName);
        }
        throw notFound(RequestStage.RETRIEVAL);
      }
      InputStream in = Files.newInputStream(path, LinkOption.NOFOLLOW_LINKS);
      return new StoredFileContent(toStoredFile(storedName, attrs), in);
    } catch (NoSuchFileException e) {
      throw notFound(RequestStage.RETRIEVAL);
    } catch (IOException e) {
      throw new StorageException("Failed to read file", RequestStage.RETRIEVAL, e);
    }
  }

  @Override
  public List<StoredFile> list() {
    if (!Files.isDirectory(root)) {
      return List.of();
    }
    List<StoredFile> files = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        // skips hidden names, which covers in-flight temp files
        if (!sanitizer.isSafe(name)) {
          continue;
        }
        try {
          BasicFileAttributes attrs =
              Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
          if (attrs.isRegularFile()) {
            files.add(toStoredFile(name, attrs));
          }
        } catch (NoSuchFileException e) {
          log.debug("File {} was removed while listing", name);
        }
      }
    } catch (IOException e) {
      throw new StorageException("Failed to read file list", RequestStage.LISTING, e);
    }
    files.sort(
        Comparator.comparing(StoredFile::getCreatedAt)
            .thenComparing(StoredFile::getStoredName)
            .reversed());
    return files;
  }

  @Override
  public void delete(String storedName) {
    Path path = sanitizer.resolve(sanitizer.sanitize(storedName));
    if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
      throw notFound(RequestStage.DELETION);
    }
    try {
      if (!Files.deleteIfExists(path)) {
        throw notFound(RequestStage.DELETION);
      }
    } catch (IOException e) {
      throw new StorageException("Failed to delete file", RequestStage.DELETION, e);
    }
  }

  private void moveIntoPlace(Path temp, Path target, String storedName) throws IOException {
    // A rename may replace an existing target, so check-then-move is serialized per name.
    synchronized (lockFor(storedName)) {
      if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
        throw new FileAlreadyExistsException("File already exists: " + storedName);
      }
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        log.warn("Atomic move not supported under {}, using a plain move", root);
        try {
          Files.move(temp, target);
        } catch (java.nio.file.FileAlreadyExistsException ex) {
          throw new FileAlreadyExistsException("File already exists: " + storedName, ex);
        }
      }
    }
  }

  private Object lockFor(String storedName) {
    return nameLocks[Math.floorMod(storedName.hashCode(), LOCK_STRIPES)];
  }

  private void checkSize(long size) {
    if (size > maxFileSize) {
      throw new FileTooLargeException(
          "File too large. Maximum size: " + FileSizes.format(maxFileSize), maxFileSize);
    }
    if (size == 0) {
      throw new InvalidRequestArgumentException("File is empty");
    }
  }

  private void checkExtension(String storedName) {
    String extension = NameGenerator.extension(storedName);
    if (blockedExtensions.contains(extension)
        || (!allowedExtensions.isEmpty() && !allowedExtensions.contains(extension))) {
      throw new DisallowedFileTypeException(
          "File type not allowed: " + (extension.isEmpty() ? "(none)" : "." + extension));
    }
  }

  private void checkContentType(String contentType) {
    if (blockedContentTypes.contains(contentType)) {
      throw new DisallowedFileTypeException("File type not allowed: " + contentType);
    }
  }

  private StoredFile toStoredFile(String storedName, BasicFileAttributes attrs) {
    Instant created = attrs.creationTime().toInstant();
    if (created.equals(Instant.EPOCH)) {
      created = attrs.lastModifiedTime().toInstant();
    }
    return StoredFile.builder()
        .storedName(storedName)
        .sizeBytes(attrs.size())
        .createdAt(created)
        .contentType(MimeUtil.detectFromName(storedName))
        .build();
  }

  private void discard(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.error("Failed to remove temporary upload file {}", temp, e);
    }
  }

  private static ResourceNotFoundException notFound(RequestStage stage) {
    return new ResourceNotFoundException("File not found", stage);
  }
}
