package org.erpsuite.currency.service.exception;

/** Malformed or out-of-range input. */
public class InvalidRequestException extends ServiceException {

  public InvalidRequestException(String message, String code) {
    super(message, code);
  }
}
