package org.erpsuite.currency.api;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;

/** Error body returned by every endpoint. */
@Schema(description = "Error response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
    @Schema(
            description = "Error category",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "APPLICATION_ERROR")
        ApiErrorType type,
    @Schema(
            description = "Human readable message",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Currency code 'EUR' already exists")
        String message,
    @Schema(description = "Machine readable error code", example = "DUPLICATE_CURRENCY_CODE")
        String code,
    @Schema(description = "Per-field validation failures") List<FieldError> fieldErrors) {

  public static ApiErrorResponse of(ApiErrorType type, String message, String code) {
    return new ApiErrorResponse(type, message, code, null);
  }

  /**
   * A single rejected field.
   *
   * @param field name of the field or parameter
   * @param message why it was rejected
   * @param rejectedValue the rejected value
   */
  public record FieldError(String field, String message, Object rejectedValue) {}
}
