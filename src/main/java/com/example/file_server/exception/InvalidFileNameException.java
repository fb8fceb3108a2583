package com.example.file_server.exception;

/** A client-supplied name failed sanitization. */
public class InvalidFileNameException extends FileServerException {
  public InvalidFileNameException(String message) {
    super(message, RequestStage.VALIDATION);
  }
}
