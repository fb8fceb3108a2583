package com.example.file_server.exception;

public class UnauthorizedOperationException extends FileServerException {
  public static final String MESSAGE = "Invalid password";

  public UnauthorizedOperationException() {
    super(MESSAGE, RequestStage.AUTHENTICATION);
  }
}
