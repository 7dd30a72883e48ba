package com.temboplus.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.temboplus.payment.gateway.enums.StatusCode;

/**
 * Callback body the gateway posts to the caller's {@code callbackUrl}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookPayload {

  private String statusCode;
  private String transactionRef;
  private String transactionId;

  public WebhookPayload() {
  }

  public WebhookPayload(String statusCode, String transactionRef, String transactionId) {
    this.statusCode = statusCode;
    this.transactionRef = transactionRef;
    this.transactionId = transactionId;
  }

  public String getStatusCode() {
    return statusCode;
  }

  public void setStatusCode(String statusCode) {
    this.statusCode = statusCode;
  }

  public String getTransactionRef() {
    return transactionRef;
  }

  public void setTransactionRef(String transactionRef) {
    this.transactionRef = transactionRef;
  }

  public String getTransactionId() {
    return transactionId;
  }

  public void setTransactionId(String transactionId) {
    this.transactionId = transactionId;
  }

  @JsonIgnore
  public boolean isSuccessfulPayment() {
    return StatusCode.PAYMENT_ACCEPTED.getCode().equals(statusCode);
  }

  @JsonIgnore
  public boolean isFailedPayment() {
    return StatusCode.isFailure(statusCode);
  }
}
