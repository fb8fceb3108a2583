package com.example.file_server.controller.advice;

import com.example.file_server.exception.FileAlreadyExistsException;
import com.example.file_server.exception.FileServerException;
import com.example.file_server.exception.FileTooLargeException;
import com.example.file_server.exception.InvalidFileNameException;
import com.example.file_server.exception.InvalidRequestArgumentException;
import com.example.file_server.exception.RequestStage;
import com.example.file_server.exception.ResourceNotFoundException;
import com.example.file_server.exception.StorageException;
import com.example.file_server.exception.UnauthorizedOperationException;
import com.example.file_server.util.FileSizes;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Maps failures to a stable status and {@code code} per category. Messages returned to clients
 * are the fixed texts of our own exceptions; exception internals and paths are only logged.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  public static final String AUTH_ERROR = "AUTH_ERROR";
  public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
  public static final String INVALID_NAME = "INVALID_NAME";
  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String CONFLICT = "CONFLICT";
  public static final String STORAGE_ERROR = "STORAGE_ERROR";
  public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

  private final long maxFileSize;

  public GlobalExceptionHandler(
      @Value("${file-server.max-file-size:524288000}") long maxFileSize) {
    this.maxFileSize = maxFileSize;
  }

  @ExceptionHandler(UnauthorizedOperationException.class)
  public ResponseEntity<Object> handleUnauthorizedOperationException(
      UnauthorizedOperationException ex) {
    return buildErrorResponse(ex, HttpStatus.UNAUTHORIZED, AUTH_ERROR);
  }

  @ExceptionHandler(InvalidFileNameException.class)
  public ResponseEntity<Object> handleInvalidFileNameException(InvalidFileNameException ex) {
    return buildErrorResponse(ex, HttpStatus.BAD_REQUEST, INVALID_NAME);
  }

  @ExceptionHandler(FileTooLargeException.class)
  public ResponseEntity<Object> handleFileTooLargeException(FileTooLargeException ex) {
    Map<String, Object> body =
        errorBody(ex.getMessage(), ex.getStage(), HttpStatus.BAD_REQUEST, VALIDATION_ERROR);
    body.put("maxFileSize", ex.getMaxFileSize());
    return toResponse(HttpStatus.BAD_REQUEST, body);
  }

  // raised by the servlet container while parsing the multipart body, before any handler runs
  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<Object> handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex) {
    log.debug("Rejected oversized upload: {}", ex.getMessage());
    return handleFileTooLargeException(
        new FileTooLargeException(
            "File too large. Maximum size: " + FileSizes.format(maxFileSize), maxFileSize));
  }

  @ExceptionHandler(InvalidRequestArgumentException.class)
  public ResponseEntity<Object> handleInvalidRequestArgumentException(
      InvalidRequestArgumentException ex) {
    return buildErrorResponse(ex, HttpStatus.BAD_REQUEST, VALIDATION_ERROR);
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<Object> handleResourceNotFoundException(ResourceNotFoundException ex) {
    return buildErrorResponse(ex, HttpStatus.NOT_FOUND, NOT_FOUND);
  }

  @ExceptionHandler(FileAlreadyExistsException.class)
  public ResponseEntity<Object> handleFileAlreadyExistsException(FileAlreadyExistsException ex) {
    return buildErrorResponse(ex, HttpStatus.CONFLICT, CONFLICT);
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<Object> handleStorageException(StorageException ex) {
    log.error("Storage failure during {}: {}", ex.getStage(), ex.getMessage(), ex);
    return buildErrorResponse(ex, HttpStatus.INTERNAL_SERVER_ERROR, STORAGE_ERROR);
  }

  @ExceptionHandler({MissingServletRequestPartException.class, MultipartException.class})
  public ResponseEntity<Object> handleMultipartException(Exception ex) {
    log.debug("Rejected malformed upload: {}", ex.getMessage());
    return buildErrorResponse(
        "A file must be sent as multipart field 'file'",
        RequestStage.VALIDATION,
        HttpStatus.BAD_REQUEST,
        VALIDATION_ERROR);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Object> handleMissingParameter(MissingServletRequestParameterException ex) {
    return buildErrorResponse(
        "Missing parameter: " + ex.getParameterName(),
        RequestStage.VALIDATION,
        HttpStatus.BAD_REQUEST,
        VALIDATION_ERROR);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Object> handleAllOtherExceptions(Exception ex) {
    log.error("Unhandled exception", ex);
    return buildErrorResponse(
        "Internal server error", null, HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
  }

  private ResponseEntity<Object> buildErrorResponse(
      FileServerException ex, HttpStatus status, String code) {
    return buildErrorResponse(ex.getMessage(), ex.getStage(), status, code);
  }

  private ResponseEntity<Object> buildErrorResponse(
      String message, RequestStage stage, HttpStatus status, String code) {
    return toResponse(status, errorBody(message, stage, status, code));
  }

  private static Map<String, Object> errorBody(
      String message, RequestStage stage, HttpStatus status, String code) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", System.currentTimeMillis());
    body.put("status", status.value());
    body.put("error", status.getReasonPhrase());
    body.put("code", code);
    body.put("stage", stage);
    body.put("message", message);
    return body;
  }

  private static ResponseEntity<Object> toResponse(HttpStatus status, Map<String, Object> body) {
    return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
  }
}
