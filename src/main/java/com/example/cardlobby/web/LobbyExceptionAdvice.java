package com.example.cardlobby.web;

import com.example.cardlobby.error.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Maps lobby failures to HTTP status codes with a {code, message, details} body. */
@RestControllerAdvice
public class LobbyExceptionAdvice {

  private static final Logger log = LoggerFactory.getLogger(LobbyExceptionAdvice.class);

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<Map<String, Object>> unauthorized(AuthenticationException e) {
    return body(HttpStatus.UNAUTHORIZED, e);
  }

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, Object>> badRequest(ValidationException e) {
    return body(HttpStatus.BAD_REQUEST, e);
  }

  @ExceptionHandler(AuthorizationException.class)
  public ResponseEntity<Map<String, Object>> forbidden(AuthorizationException e) {
    return body(HttpStatus.FORBIDDEN, e);
  }

  @ExceptionHandler(RoomNotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(RoomNotFoundException e) {
    return body(HttpStatus.NOT_FOUND, e);
  }

  @ExceptionHandler({CapacityException.class, StateException.class})
  public ResponseEntity<Map<String, Object>> conflict(LobbyException e) {
    return body(HttpStatus.CONFLICT, e);
  }

  @ExceptionHandler(PersistenceException.class)
  public ResponseEntity<Map<String, Object>> unavailable(PersistenceException e) {
    log.warn("REST persistence failure: {}", e.getMessage());
    return body(HttpStatus.SERVICE_UNAVAILABLE, e);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
    return body(HttpStatus.BAD_REQUEST, new ValidationException("Malformed request body"));
  }

  private static ResponseEntity<Map<String, Object>> body(HttpStatus status, LobbyException e) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("code", e.getCode());
    m.put("message", e.getMessage());
    m.put("details", e.getDetails());
    return ResponseEntity.status(status).body(m);
  }
}
