package com.cario.qr.app.api;

import com.cario.qr.app.exception.ArtifactNotFoundException;
import com.cario.qr.app.exception.CapacityExceededException;
import com.cario.qr.app.exception.EncodingException;
import com.cario.qr.app.exception.RenderException;
import com.cario.qr.app.exception.ValidationException;
import com.cario.qr.app.model.ApiError;
import com.cario.qr.app.util.Futures;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Maps exceptions to {@link ApiError} bodies.
 *
 * <p>Async handlers complete their futures exceptionally; the wrapped cause is unwrapped here so it
 * gets the same status as when thrown synchronously.
 */
@Log4j2
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(CompletionException.class)
  public ResponseEntity<ApiError> handleCompletion(CompletionException e) {
    return handle(Futures.unwrap(e));
  }

  @ExceptionHandler({
    ValidationException.class,
    EncodingException.class,
    RenderException.class,
    ArtifactNotFoundException.class,
    CapacityExceededException.class
  })
  public ResponseEntity<ApiError> handleService(RuntimeException e) {
    return handle(e);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException e) {
    String detail =
        e.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));
    return build(HttpStatus.BAD_REQUEST, "validation_error", detail);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException e) {
    return build(HttpStatus.BAD_REQUEST, "validation_error", e.getMessage());
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class,
    TypeMismatchException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception e) {
    return build(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException e) {
    return build(HttpStatus.PAYLOAD_TOO_LARGE, "payload_too_large", e.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleOther(Exception e) {
    // framework errors (405, 415, unknown route) already carry their status
    if (e instanceof ErrorResponse) {
      HttpStatus status = HttpStatus.valueOf(((ErrorResponse) e).getStatusCode().value());
      return build(status, status.name().toLowerCase(Locale.ROOT), e.getMessage());
    }
    return handle(e);
  }

  // ------------------ mapping ------------------

  private ResponseEntity<ApiError> handle(Throwable t) {
    if (t instanceof ValidationException) {
      return build(HttpStatus.BAD_REQUEST, "validation_error", t.getMessage());
    }
    if (t instanceof RenderException) {
      return build(HttpStatus.BAD_REQUEST, "render_error", t.getMessage());
    }
    if (t instanceof EncodingException) {
      return build(HttpStatus.UNPROCESSABLE_ENTITY, "encoding_error", t.getMessage());
    }
    if (t instanceof ArtifactNotFoundException) {
      return build(HttpStatus.NOT_FOUND, "not_found", t.getMessage());
    }
    if (t instanceof CapacityExceededException) {
      log.warn("api.busy msg={}", t.getMessage());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .header(HttpHeaders.RETRY_AFTER, "1")
          .body(apiError(HttpStatus.SERVICE_UNAVAILABLE, "service_busy", t.getMessage()));
    }
    log.error("api.error unexpected type={} msg={}", t.getClass().getName(), t.getMessage(), t);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
  }

  private static ResponseEntity<ApiError> build(HttpStatus status, String error, String detail) {
    if (status.is4xxClientError()) {
      log.warn("api.reject status={} error={} detail={}", status.value(), error, detail);
    }
    return ResponseEntity.status(status).body(apiError(status, error, detail));
  }

  private static ApiError apiError(HttpStatus status, String error, String detail) {
    return ApiError.builder()
        .error(error)
        .detail(detail)
        .status(status.value())
        .timestamp(Instant.now().toString())
        .build();
  }
}
