package com.example.file_server.exception;

public class FileAlreadyExistsException extends FileServerException {
  public FileAlreadyExistsException(String message) {
    super(message, RequestStage.PERSISTENCE);
  }

  public FileAlreadyExistsException(String message, Throwable cause) {
    super(message, RequestStage.PERSISTENCE, cause);
  }
}
