package com.temboplus.payment.gateway.exception;

/**
 * Thrown when the calling thread is interrupted while a call is in flight.
 *
 * <p>The gateway may still have accepted the request: treat this as "outcome unknown" and
 * query the status before resubmitting.
 */
public class GatewayCancelledException extends GatewayTransportException {

  public GatewayCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
