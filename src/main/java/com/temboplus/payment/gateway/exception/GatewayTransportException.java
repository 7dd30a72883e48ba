package com.temboplus.payment.gateway.exception;

import com.temboplus.payment.gateway.enums.ErrorKind;

/**
 * Thrown when the gateway is unreachable, times out, or answers with a non-2xx status that
 * carries no decodable error envelope. {@link #getHttpStatus()} is {@code 0} when no reply
 * was received.
 */
public class GatewayTransportException extends TemboGatewayException {

  private final int httpStatus;
  private final String responseBody;

  public GatewayTransportException(String message, Throwable cause) {
    super(message, cause);
    this.httpStatus = 0;
    this.responseBody = null;
  }

  public GatewayTransportException(int httpStatus, String responseBody) {
    super("Unexpected status code: " + httpStatus + ", body: " + responseBody);
    this.httpStatus = httpStatus;
    this.responseBody = responseBody;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public String getResponseBody() {
    return responseBody;
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.TRANSPORT;
  }
}
