package com.example.file_server.exception;

public class ResourceNotFoundException extends FileServerException {
  public ResourceNotFoundException(String message, RequestStage stage) {
    super(message, stage);
  }
}
