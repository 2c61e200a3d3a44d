/*
 * どこで: Crons API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: SDK が再送すべきかをステータスとコードで判断できるようにするため
 */
package com.example.crons.api;

import com.example.crons.store.StoreUnavailableException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MonitorNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleMonitorNotFound(MonitorNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.MONITOR_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(CheckInRateLimitedException.class)
  public ResponseEntity<ApiErrorResponse> handleRateLimited(CheckInRateLimitedException ex) {
    return error(HttpStatus.TOO_MANY_REQUESTS, ApiErrorCode.RATE_LIMITED, ex.getMessage());
  }

  @ExceptionHandler(CheckInConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleConflict(CheckInConflictException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(StoreUnavailableException ex) {
    logger.warn("store unavailable", ex);
    // 内部の接続情報は返さない
    return error(
        HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.STORE_UNAVAILABLE, "store is unavailable");
  }

  @ExceptionHandler(CheckInDeadlineExceededException.class)
  public ResponseEntity<ApiErrorResponse> handleDeadlineExceeded(
      CheckInDeadlineExceededException ex) {
    return error(HttpStatus.GATEWAY_TIMEOUT, ApiErrorCode.DEADLINE_EXCEEDED, ex.getMessage());
  }

  @ExceptionHandler({InvalidCheckInException.class, InvalidMonitorConfigException.class})
  public ResponseEntity<ApiErrorResponse> handleInvalidInput(RuntimeException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleHandlerMethodValidation(
      HandlerMethodValidationException ex) {
    final String message =
        ex.getAllErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.VALIDATION_ERROR, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
