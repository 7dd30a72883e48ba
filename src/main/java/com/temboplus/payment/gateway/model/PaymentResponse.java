package com.temboplus.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Gateway reply to collection, disbursement and status requests.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentResponse {

  private String statusCode;
  private String transactionRef;
  private String transactionId;

  public PaymentResponse() {
  }

  public PaymentResponse(String statusCode, String transactionRef, String transactionId) {
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

  @Override
  public String toString() {
    return "PaymentResponse{"
        + "statusCode='" + statusCode + '\''
        + ", transactionRef='" + transactionRef + '\''
        + ", transactionId='" + transactionId + '\''
        + '}';
  }
}
