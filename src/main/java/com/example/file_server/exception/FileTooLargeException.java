package com.example.file_server.exception;

public class FileTooLargeException extends InvalidRequestArgumentException {
  private final long maxFileSize;

  public FileTooLargeException(String message, long maxFileSize) {
    super(message);
    this.maxFileSize = maxFileSize;
  }

  public long getMaxFileSize() {
    return maxFileSize;
  }
}
