package com.temboplus.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Error envelope returned with non-2xx replies, e.g.
 * {@code {"statusCode":401,"reason":"INVALID_CREDENTIALS"}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiErrorResponse {

  private int statusCode;
  private String reason;
  private String message;
  private JsonNode details;

  public int getStatusCode() {
    return statusCode;
  }

  public void setStatusCode(int statusCode) {
    this.statusCode = statusCode;
  }

  public String getReason() {
    return reason;
  }

  public void setReason(String reason) {
    this.reason = reason;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public JsonNode getDetails() {
    return details;
  }

  public void setDetails(JsonNode details) {
    this.details = details;
  }
}
