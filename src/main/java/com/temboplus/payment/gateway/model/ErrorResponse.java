package com.temboplus.payment.gateway.model;

/**
 * Body returned by this service's own endpoints when a request is refused.
 */
public class ErrorResponse {

  private final String message;

  public ErrorResponse(String message) {
    this.message = message;
  }

  public String getMessage() {
    return message;
  }
}
