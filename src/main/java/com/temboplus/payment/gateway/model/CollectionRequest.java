package com.temboplus.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

/**
 * Request for a USSD-push collection from a mobile subscriber.
 *
 * <p>{@code transactionDate} uses the {@code yyyy-MM-dd HH:mm:ss} format and
 * {@code msisdn} the full international form, e.g. {@code 255715123456}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CollectionRequest {

  private String msisdn;
  private String channel;
  private BigDecimal amount;
  private String narration;
  private String transactionRef;
  private String transactionDate;
  private String callbackUrl;

  public String getMsisdn() {
    return msisdn;
  }

  public void setMsisdn(String msisdn) {
    this.msisdn = msisdn;
  }

  public String getChannel() {
    return channel;
  }

  public void setChannel(String channel) {
    this.channel = channel;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public void setAmount(BigDecimal amount) {
    this.amount = amount;
  }

  public String getNarration() {
    return narration;
  }

  public void setNarration(String narration) {
    this.narration = narration;
  }

  public String getTransactionRef() {
    return transactionRef;
  }

  public void setTransactionRef(String transactionRef) {
    this.transactionRef = transactionRef;
  }

  public String getTransactionDate() {
    return transactionDate;
  }

  public void setTransactionDate(String transactionDate) {
    this.transactionDate = transactionDate;
  }

  public String getCallbackUrl() {
    return callbackUrl;
  }

  public void setCallbackUrl(String callbackUrl) {
    this.callbackUrl = callbackUrl;
  }

  @Override
  public String toString() {
    return "CollectionRequest{"
        + "channel='" + channel + '\''
        + ", amount=" + amount
        + ", transactionRef='" + transactionRef + '\''
        + ", transactionDate='" + transactionDate + '\''
        + '}';
  }
}
