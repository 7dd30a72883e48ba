package com.temboplus.payment.gateway.exception;

import com.temboplus.payment.gateway.enums.ErrorKind;
import java.util.List;

/**
 * Thrown when a request or webhook payload fails local validation.
 * Carries a list of all validation errors so they can be reported together.
 * Requests rejected this way never reach the gateway.
 */
public class InvalidRequestException extends TemboGatewayException {

  private final List<String> errors;

  public InvalidRequestException(List<String> errors) {
    super("Invalid request: " + String.join(", ", errors));
    this.errors = List.copyOf(errors);
  }

  public InvalidRequestException(String error) {
    this(List.of(error));
  }

  public List<String> getErrors() {
    return errors;
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.VALIDATION;
  }
}
