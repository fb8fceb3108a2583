package com.example.file_server.exception;

/** Stage of request handling at which a failure occurred. */
public enum RequestStage {
  AUTHENTICATION,
  VALIDATION,
  PERSISTENCE,
  LISTING,
  DELETION,
  RETRIEVAL
}
