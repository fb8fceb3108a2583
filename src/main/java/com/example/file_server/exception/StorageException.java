package com.example.file_server.exception;

/** Backing-store I/O failure: disk full, permission denied, failed rename. */
public class StorageException extends FileServerException {
  public StorageException(String message, RequestStage stage, Throwable cause) {
    super(message, stage, cause);
  }
}
