package org.erpsuite.currency.api;

/** Category of an error response. */
public enum ApiErrorType {
  /** Request is malformed or violates a documented limit. */
  INVALID_REQUEST,

  /** Request body or parameters failed Bean Validation. */
  VALIDATION_ERROR,

  /** Requested resource does not exist. */
  NOT_FOUND,

  /** Request is well-formed but violates a business rule. */
  APPLICATION_ERROR,

  /** Unexpected server-side failure. */
  INTERNAL_ERROR
}
