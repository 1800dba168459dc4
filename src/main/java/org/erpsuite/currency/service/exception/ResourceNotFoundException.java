package org.erpsuite.currency.service.exception;

/** The requested resource does not exist for the calling tenant. */
public class ResourceNotFoundException extends ServiceException {

  public ResourceNotFoundException(String message) {
    super(message);
  }

  public ResourceNotFoundException(String message, String code) {
    super(message, code);
  }
}
