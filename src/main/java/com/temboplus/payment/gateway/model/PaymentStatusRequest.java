package com.temboplus.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Status lookup by the caller's reference, the gateway's transaction id, or both.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class PaymentStatusRequest {

  private String transactionRef;
  private String transactionId;

  public PaymentStatusRequest() {
  }

  public PaymentStatusRequest(String transactionRef, String transactionId) {
    this.transactionRef = transactionRef;
    this.transactionId = transactionId;
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
}
