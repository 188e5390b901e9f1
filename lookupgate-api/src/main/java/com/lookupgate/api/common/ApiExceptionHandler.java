package com.lookupgate.api.common;

import com.lookupgate.domain.credential.CredentialErrorCode;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.credential.StorageCorruptionException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(CredentialException.class)
  public ResponseEntity<Map<String, Object>> credential(CredentialException ex) {
    CredentialErrorCode code = ex.code();
    if (code.httpStatus() >= 500) {
      log.error("Credential failure reason={}", code.reason(), ex);
    } else {
      log.debug("Credential failure reason={} message={}", code.reason(), ex.getMessage());
    }
    return ResponseEntity.status(code.httpStatus()).body(ErrorBodies.body(code.reason(), ex.getMessage()));
  }

  @ExceptionHandler(StorageCorruptionException.class)
  public ResponseEntity<Map<String, Object>> corruption(StorageCorruptionException ex) {
    log.error("Stored credential data is corrupt", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorBodies.body("storage_corruption", "Stored credential data is corrupt"));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new HashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    Map<String, Object> body = ErrorBodies.body("validation_error", "invalid_request");
    body.put("fields", fields);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ErrorBodies.body("validation_error", ex.getMessage() == null ? "invalid_request" : ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ErrorBodies.body("bad_request", "Request body is missing or malformed"));
  }
}
