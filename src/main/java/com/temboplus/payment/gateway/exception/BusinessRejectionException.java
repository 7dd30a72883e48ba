package com.temboplus.payment.gateway.exception;

import com.temboplus.payment.gateway.enums.ErrorKind;
import com.temboplus.payment.gateway.model.PaymentResponse;

/**
 * Thrown when the HTTP call succeeded but the reply reports {@code PAYMENT_REJECTED} or
 * {@code GENERIC_ERROR}. The decoded reply is kept so the gateway transaction id is not lost.
 */
public class BusinessRejectionException extends TemboGatewayException {

  private final PaymentResponse response;

  public BusinessRejectionException(PaymentResponse response) {
    super("TemboPlus API Error [" + response.getStatusCode() + "]: Request failed");
    this.response = response;
  }

  public String getStatusCode() {
    return response.getStatusCode();
  }

  public PaymentResponse getResponse() {
    return response;
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.BUSINESS;
  }
}
