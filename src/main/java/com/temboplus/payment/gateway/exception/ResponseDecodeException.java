package com.temboplus.payment.gateway.exception;

import com.temboplus.payment.gateway.enums.ErrorKind;

/**
 * Thrown when a gateway reply or a webhook body does not match the expected JSON shape.
 */
public class ResponseDecodeException extends TemboGatewayException {

  public ResponseDecodeException(String message) {
    super(message);
  }

  public ResponseDecodeException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.DECODE;
  }
}
