package com.civicbiz.catalog.ingest.api;

import com.civicbiz.catalog.ingest.service.BusinessNotFoundException;
import com.civicbiz.catalog.ingest.service.ConfigurationException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CatalogExceptionHandler {

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<Map<String, String>> handleConfiguration(ConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_configuration", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(BusinessNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(BusinessNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "not_found", "message", ex.getMessage()));
  }
}
