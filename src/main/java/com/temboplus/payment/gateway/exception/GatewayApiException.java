package com.temboplus.payment.gateway.exception;

import com.fasterxml.jackson.databind.JsonNode;
import com.temboplus.payment.gateway.enums.ErrorKind;
import com.temboplus.payment.gateway.model.ApiErrorResponse;

/**
 * Thrown when the gateway answers with a non-2xx status and its own error envelope.
 * The gateway's diagnostic fields are kept as received.
 */
public class GatewayApiException extends TemboGatewayException {

  private final int statusCode;
  private final String reason;
  private final String apiMessage;
  private final JsonNode details;

  public GatewayApiException(ApiErrorResponse error) {
    super(describe(error));
    this.statusCode = error.getStatusCode();
    this.reason = error.getReason();
    this.apiMessage = error.getMessage();
    this.details = error.getDetails();
  }

  private static String describe(ApiErrorResponse error) {
    String prefix = "TemboPlus API Error [" + error.getStatusCode() + "]";
    if (error.getReason() != null && !error.getReason().isEmpty()) {
      return prefix + ": " + error.getReason();
    }
    if (error.getMessage() != null && !error.getMessage().isEmpty()) {
      return prefix + ": " + error.getMessage();
    }
    return prefix;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getReason() {
    return reason;
  }

  public String getApiMessage() {
    return apiMessage;
  }

  public JsonNode getDetails() {
    return details;
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.API;
  }
}
