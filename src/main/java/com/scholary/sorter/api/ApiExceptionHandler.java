package com.scholary.sorter.api;

import com.scholary.sorter.decision.ConflictException;
import com.scholary.sorter.decision.JobNotFoundException;
import com.scholary.sorter.paths.ConfigurationException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps exceptions to {@code {"error": ..., "status": ...}} responses. */
@RestControllerAdvice(basePackages = "com.scholary.sorter.api")
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ConflictException.class)
  public ResponseEntity<ApiError> handleConflict(ConflictException ex) {
    LOGGER.info("Conflict: {}", ex.getMessage());
    String current = ex.getCurrentStatus() == null ? null : ex.getCurrentStatus().wireName();
    return body(
        HttpStatus.CONFLICT,
        new ApiError(ex.getMessage(), HttpStatus.CONFLICT.value(), current));
  }

  @ExceptionHandler({JobNotFoundException.class, NoSuchFileException.class})
  public ResponseEntity<ApiError> handleNotFound(Exception ex) {
    String message =
        ex instanceof NoSuchFileException missing
            ? "Path does not exist: " + missing.getFile()
            : ex.getMessage();
    return error(HttpStatus.NOT_FOUND, message);
  }

  @ExceptionHandler(NotDirectoryException.class)
  public ResponseEntity<ApiError> handleNotDirectory(NotDirectoryException ex) {
    return error(HttpStatus.BAD_REQUEST, "Not a directory: " + ex.getFile());
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ApiError> handleAccessDenied(AccessDeniedException ex) {
    return error(HttpStatus.FORBIDDEN, "Permission denied: " + ex.getFile());
  }

  @ExceptionHandler({ConfigurationException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiError> handleBadRequest(RuntimeException ex) {
    LOGGER.info("Rejected request: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleInvalid(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return error(HttpStatus.BAD_REQUEST, message);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiError> handleUnreadable(Exception ex) {
    Throwable root = ex;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    String message =
        root instanceof IllegalArgumentException ? root.getMessage() : "Malformed request";
    if (ex instanceof MissingServletRequestParameterException missing) {
      message = "Missing parameter: " + missing.getParameterName();
    }
    return error(HttpStatus.BAD_REQUEST, message);
  }

  @ExceptionHandler(AsyncRequestTimeoutException.class)
  public void handleStreamTimeout(AsyncRequestTimeoutException ex) {
    // event stream closed by the container; there is no JSON body to write
    LOGGER.debug("Event stream timed out");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse framework) {
      HttpStatusCode status = framework.getStatusCode();
      return body(status, ApiError.of(ex.getMessage(), status.value()));
    }
    LOGGER.error("Unexpected error: {}", ex.getMessage(), ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, String message) {
    return body(status, ApiError.of(message, status.value()));
  }

  private static ResponseEntity<ApiError> body(HttpStatusCode status, ApiError error) {
    return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(error);
  }
}
