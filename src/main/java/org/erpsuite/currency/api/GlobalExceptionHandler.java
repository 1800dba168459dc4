package org.erpsuite.currency.api;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import org.erpsuite.currency.service.CurrencyServiceError;
import org.erpsuite.currency.service.exception.BusinessException;
import org.erpsuite.currency.service.exception.InvalidRequestException;
import org.erpsuite.currency.service.exception.ResourceNotFoundException;
import org.erpsuite.currency.service.exception.ServiceException;

/**
 * Maps exceptions to {@link ApiErrorResponse} bodies.
 *
 * <ul>
 *   <li>{@link InvalidRequestException}, validation and binding failures: 400
 *   <li>{@link ResourceNotFoundException}: 404
 *   <li>{@link BusinessException}: 422
 *   <li>anything else: 500
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final String VALIDATION_ERROR = CurrencyServiceError.VALIDATION_ERROR.name();

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
    log.warn("Invalid request: {}", ex.getMessage());

    return ResponseEntity.badRequest()
        .body(ApiErrorResponse.of(ApiErrorType.INVALID_REQUEST, ex.getMessage(), ex.getCode()));
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(ResourceNotFoundException ex) {
    log.warn("Resource not found: {}", ex.getMessage());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(ApiErrorResponse.of(ApiErrorType.NOT_FOUND, ex.getMessage(), ex.getCode()));
  }

  @ExceptionHandler(BusinessException.class)
  public ResponseEntity<ApiErrorResponse> handleBusiness(BusinessException ex) {
    log.warn("Business rule violated: {} ({})", ex.getMessage(), ex.getCode());

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(ApiErrorResponse.of(ApiErrorType.APPLICATION_ERROR, ex.getMessage(), ex.getCode()));
  }

  @ExceptionHandler(ServiceException.class)
  public ResponseEntity<ApiErrorResponse> handleService(ServiceException ex) {
    log.error("Service error: {}", ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiErrorResponse.of(ApiErrorType.INTERNAL_ERROR, ex.getMessage(), ex.getCode()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    var fieldErrors =
        ex.getBindingResult().getFieldErrors().stream()
            .map(
                e ->
                    new ApiErrorResponse.FieldError(
                        e.getField(), e.getDefaultMessage(), e.getRejectedValue()))
            .toList();
    log.warn("Request body validation failed: {}", fieldErrors);

    return ResponseEntity.badRequest()
        .body(
            new ApiErrorResponse(
                ApiErrorType.VALIDATION_ERROR,
                "Request validation failed",
                VALIDATION_ERROR,
                fieldErrors));
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleHandlerMethodValidation(
      HandlerMethodValidationException ex) {
    var fieldErrors =
        ex.getParameterValidationResults().stream()
            .flatMap(
                result ->
                    result.getResolvableErrors().stream()
                        .map(
                            error ->
                                new ApiErrorResponse.FieldError(
                                    result.getMethodParameter().getParameterName(),
                                    error.getDefaultMessage(),
                                    result.getArgument())))
            .toList();
    log.warn("Request parameter validation failed: {}", fieldErrors);

    return ResponseEntity.badRequest()
        .body(
            new ApiErrorResponse(
                ApiErrorType.VALIDATION_ERROR,
                "Request validation failed",
                VALIDATION_ERROR,
                fieldErrors));
  }

  @ExceptionHandler({
    MissingRequestHeaderException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBinding(Exception ex) {
    log.warn("Request binding failed: {}", ex.getMessage());

    return ResponseEntity.badRequest()
        .body(
            new ApiErrorResponse(
                ApiErrorType.VALIDATION_ERROR, ex.getMessage(), VALIDATION_ERROR, List.of()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleNotReadable(HttpMessageNotReadableException ex) {
    log.warn("Malformed request body: {}", ex.getMessage());

    return ResponseEntity.badRequest()
        .body(
            ApiErrorResponse.of(
                ApiErrorType.VALIDATION_ERROR, "Malformed request body", VALIDATION_ERROR));
  }

  /**
   * Fallback for everything else. Framework exceptions that carry their own status (unknown path,
   * unsupported method, ...) keep it; all others become 500.
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse) {
      var status = ((ErrorResponse) ex).getStatusCode();
      log.warn("Request failed with status {}: {}", status.value(), ex.getMessage());
      var type = status.value() == 404 ? ApiErrorType.NOT_FOUND : ApiErrorType.INVALID_REQUEST;

      return ResponseEntity.status(status).body(ApiErrorResponse.of(type, ex.getMessage(), null));
    }

    log.error("Unexpected error: {}", ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiErrorResponse.of(
                ApiErrorType.INTERNAL_ERROR, "An unexpected error occurred", null));
  }
}
