package com.ascend.modsync.sync.api;

import com.ascend.modsync.sync.model.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Set;

@RestControllerAdvice
public class SyncExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(SyncExceptionHandler.class);

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ApiResponse<Void>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
    Set<HttpMethod> supported = ex.getSupportedHttpMethods();
    ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED);
    if (supported != null && !supported.isEmpty()) {
      builder.allow(supported.toArray(new HttpMethod[0]));
    }
    return builder.body(ApiResponse.error("Method not allowed"));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest().body(ApiResponse.error(BackgroundFetchController.INVALID_ACTION));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiResponse<Void>> handleBadArgument(IllegalArgumentException ex) {
    return ResponseEntity.badRequest().body(ApiResponse.error(ex.getMessage()));
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ApiResponse<Void>> handleStatus(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ApiResponse.error(ex.getReason()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse) {
      // framework errors (unknown path, unsupported media type) keep their own status
      ErrorResponse errorResponse = (ErrorResponse) ex;
      return ResponseEntity.status(errorResponse.getStatusCode())
          .body(ApiResponse.error(errorResponse.getBody().getTitle(), errorResponse.getBody().getDetail()));
    }
    log.error("Unhandled error in mod sync API", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiResponse.error("Internal server error", ex.getMessage()));
  }
}
