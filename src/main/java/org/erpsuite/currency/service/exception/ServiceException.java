package org.erpsuite.currency.service.exception;

/**
 * Base class for all errors raised by the currency service.
 *
 * <p>Carries an optional machine-readable error code that is returned to API clients alongside the
 * message.
 */
public class ServiceException extends RuntimeException {

  private final String code;

  public ServiceException(String message) {
    this(message, null, null);
  }

  public ServiceException(String message, String code) {
    this(message, code, null);
  }

  public ServiceException(String message, String code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  /**
   * Machine-readable error code.
   *
   * @return the code, or null when the error has none
   */
  public String getCode() {
    return code;
  }
}
