package com.compcollector.comps.api;

import com.compcollector.comps.service.CompJobNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CompExceptionHandler {

  @ExceptionHandler(CompJobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(CompJobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
    String message = ex.getMessage() == null ? "invalid request" : ex.getMessage();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", message));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<Map<String, String>> handleConflict(IllegalStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "job_not_resettable", "message", ex.getMessage()));
  }
}
