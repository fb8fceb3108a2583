package com.example.file_server.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One file on the backing store. {@code originalName} is only known for the upload that created
 * the file; entries read back from the storage root carry {@code null}.
 */
@Value
@Builder
public class StoredFile {
  String storedName;
  String originalName;
  long sizeBytes;
  Instant createdAt;
  String contentType;
}
