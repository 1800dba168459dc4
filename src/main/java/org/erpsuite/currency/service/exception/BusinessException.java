package org.erpsuite.currency.service.exception;

/** A well-formed request that the current state of the registry does not allow. */
public class BusinessException extends ServiceException {

  public BusinessException(String message, String code) {
    super(message, code);
  }

  public BusinessException(String message, String code, Throwable cause) {
    super(message, code, cause);
  }
}
