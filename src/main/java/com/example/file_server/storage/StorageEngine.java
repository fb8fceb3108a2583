package com.example.file_server.storage;

import com.example.file_server.model.StoredFile;
import com.example.file_server.model.StoredFileContent;
import java.io.InputStream;
import java.util.List;

/**
 * Owns the mapping from stored names to bytes on the backing store. No other component writes to
 * the storage root.
 */
public interface StorageEngine {

  /**
   * Validate and persist a new file under {@code storedName}. The bytes become visible under that
   * name only once fully written.
   *
   * @param storedName generated name, must not already exist
   * @param content bytes to store, not closed by this method
   * @param declaredSize size announced by the client, or a negative value if unknown
   * @param originalName client-supplied name, informational only
   * @return the persisted file
   * @throws com.example.file_server.exception.FileTooLargeException if the declared or actual size
   *     exceeds the configured maximum
   * @throws com.example.file_server.exception.DisallowedFileTypeException if the extension or the
   *     detected content type is not permitted
   * @throws com.example.file_server.exception.StorageException on I/O failure
   */
  StoredFile write(String storedName, InputStream content, long declaredSize, String originalName);

  /**
   * Open a stored file for reading.
   *
   * @throws com.example.file_server.exception.ResourceNotFoundException if no such file exists
   */
  StoredFileContent read(String storedName);

  /** Files directly under the storage root, newest first. */
  List<StoredFile> list();

  /**
   * Remove a stored file.
   *
   * @throws com.example.file_server.exception.ResourceNotFoundException if no such file exists
   */
  void delete(String storedName);
}
