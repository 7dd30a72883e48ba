package com.temboplus.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

/**
 * Wallet-to-mobile or wallet-to-bank payout.
 *
 * <p>For bank payouts ({@code TZ-BANK-B2C}) the {@code msisdn} field carries
 * {@code <BIC>:<ACCOUNT NUMBER>} instead of a phone number.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DisbursementRequest {

  private String countryCode;
  private String accountNo;
  private String serviceCode;
  private BigDecimal amount;
  private String msisdn;
  private String narration;
  private String currencyCode;
  private String recipientNames;
  private String transactionRef;
  private String transactionDate;
  private String callbackUrl;

  public DisbursementRequest() {
  }

  /** Field-by-field copy, so defaults can be applied without touching the caller's instance. */
  public DisbursementRequest(DisbursementRequest other) {
    this.countryCode = other.countryCode;
    this.accountNo = other.accountNo;
    this.serviceCode = other.serviceCode;
    this.amount = other.amount;
    this.msisdn = other.msisdn;
    this.narration = other.narration;
    this.currencyCode = other.currencyCode;
    this.recipientNames = other.recipientNames;
    this.transactionRef = other.transactionRef;
    this.transactionDate = other.transactionDate;
    this.callbackUrl = other.callbackUrl;
  }

  public String getCountryCode() {
    return countryCode;
  }

  public void setCountryCode(String countryCode) {
    this.countryCode = countryCode;
  }

  public String getAccountNo() {
    return accountNo;
  }

  public void setAccountNo(String accountNo) {
    this.accountNo = accountNo;
  }

  public String getServiceCode() {
    return serviceCode;
  }

  public void setServiceCode(String serviceCode) {
    this.serviceCode = serviceCode;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public void setAmount(BigDecimal amount) {
    this.amount = amount;
  }

  public String getMsisdn() {
    return msisdn;
  }

  public void setMsisdn(String msisdn) {
    this.msisdn = msisdn;
  }

  public String getNarration() {
    return narration;
  }

  public void setNarration(String narration) {
    this.narration = narration;
  }

  public String getCurrencyCode() {
    return currencyCode;
  }

  public void setCurrencyCode(String currencyCode) {
    this.currencyCode = currencyCode;
  }

  public String getRecipientNames() {
    return recipientNames;
  }

  public void setRecipientNames(String recipientNames) {
    this.recipientNames = recipientNames;
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
    return "DisbursementRequest{"
        + "serviceCode='" + serviceCode + '\''
        + ", amount=" + amount
        + ", currencyCode='" + currencyCode + '\''
        + ", transactionRef='" + transactionRef + '\''
        + '}';
  }
}
