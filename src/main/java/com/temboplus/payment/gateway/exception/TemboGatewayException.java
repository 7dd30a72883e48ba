package com.temboplus.payment.gateway.exception;

import com.temboplus.payment.gateway.enums.ErrorKind;

/**
 * Base type for every failure surfaced by the gateway client. Callers can branch on
 * {@link #getKind()} instead of on concrete subclasses.
 */
public abstract class TemboGatewayException extends RuntimeException {

  protected TemboGatewayException(String message) {
    super(message);
  }

  protected TemboGatewayException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract ErrorKind getKind();
}
