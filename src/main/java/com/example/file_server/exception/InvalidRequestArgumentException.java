package com.example.file_server.exception;

public class InvalidRequestArgumentException extends FileServerException {
  public InvalidRequestArgumentException(String message) {
    super(message, RequestStage.VALIDATION);
  }

  public InvalidRequestArgumentException(String message, RequestStage stage) {
    super(message, stage);
  }
}
