package com.example.file_server.exception;

public class DisallowedFileTypeException extends InvalidRequestArgumentException {
  public DisallowedFileTypeException(String message) {
    super(message);
  }
}
