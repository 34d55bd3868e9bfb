package com.example.squad_announcer.api;

import com.example.squad_announcer.service.MatchProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidSquadRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidSquadRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("SQUAD_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("SQUAD_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(RegistrationNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleRegistrationNotFound(
      RegistrationNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("REGISTRATION_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(RiotAccountNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleAccountNotFound(RiotAccountNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("REGISTRATION_ACCOUNT_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(CompetitiveMatchNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNoCompetitiveMatch(
      CompetitiveMatchNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("COMPETITIVE_MATCH_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(MatchProviderException.class)
  public ResponseEntity<ApiErrorResponse> handleMatchProvider(MatchProviderException ex) {
    return switch (ex.reason()) {
      case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(new ApiErrorResponse("MATCH_PROVIDER_NOT_FOUND", ex.getMessage()));
      case RATE_LIMITED -> ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
          .body(new ApiErrorResponse("MATCH_PROVIDER_RATE_LIMITED", ex.getMessage()));
      case TIMEOUT -> ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
          .body(new ApiErrorResponse("MATCH_PROVIDER_TIMEOUT", ex.getMessage()));
      case UNAVAILABLE, INVALID_RESPONSE -> ResponseEntity.status(HttpStatus.BAD_GATEWAY)
          .body(new ApiErrorResponse("MATCH_PROVIDER_UNAVAILABLE", ex.getMessage()));
    };
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("SQUAD_INTERNAL_ERROR", ex.getMessage()));
  }
}
