package com.example.file_server.exception;

/**
 * Base class for every failure the file service reports to its caller. Each instance carries the
 * {@link RequestStage} at which the request was rejected.
 */
public abstract class FileServerException extends RuntimeException {
  private final RequestStage stage;

  protected FileServerException(String message, RequestStage stage) {
    super(message);
    this.stage = stage;
  }

  protected FileServerException(String message, RequestStage stage, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public RequestStage getStage() {
    return stage;
  }
}
