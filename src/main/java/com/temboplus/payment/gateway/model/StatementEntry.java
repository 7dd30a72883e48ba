package com.temboplus.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.temboplus.payment.gateway.model.json.TolerantAmountDeserializer;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * One ledger line of a wallet statement.
 *
 * <p>The credited and debited amounts arrive as numbers, numeric strings, empty strings or
 * {@code null}; anything that is not a number decodes to {@link Optional#empty()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatementEntry {

  private String accountNo;
  private String debitOrCredit;
  private String tranRefNo;
  private String narration;
  private String txnDate;
  private String valueDate;
  @JsonDeserialize(using = TolerantAmountDeserializer.class)
  private Optional<BigDecimal> amountCredited = Optional.empty();
  @JsonDeserialize(using = TolerantAmountDeserializer.class)
  private Optional<BigDecimal> amountDebited = Optional.empty();
  private BigDecimal balance;

  public String getAccountNo() {
    return accountNo;
  }

  public void setAccountNo(String accountNo) {
    this.accountNo = accountNo;
  }

  public String getDebitOrCredit() {
    return debitOrCredit;
  }

  public void setDebitOrCredit(String debitOrCredit) {
    this.debitOrCredit = debitOrCredit;
  }

  public String getTranRefNo() {
    return tranRefNo;
  }

  public void setTranRefNo(String tranRefNo) {
    this.tranRefNo = tranRefNo;
  }

  public String getNarration() {
    return narration;
  }

  public void setNarration(String narration) {
    this.narration = narration;
  }

  public String getTxnDate() {
    return txnDate;
  }

  public void setTxnDate(String txnDate) {
    this.txnDate = txnDate;
  }

  public String getValueDate() {
    return valueDate;
  }

  public void setValueDate(String valueDate) {
    this.valueDate = valueDate;
  }

  public Optional<BigDecimal> getAmountCredited() {
    return amountCredited;
  }

  public void setAmountCredited(Optional<BigDecimal> amountCredited) {
    this.amountCredited = amountCredited == null ? Optional.empty() : amountCredited;
  }

  public Optional<BigDecimal> getAmountDebited() {
    return amountDebited;
  }

  public void setAmountDebited(Optional<BigDecimal> amountDebited) {
    this.amountDebited = amountDebited == null ? Optional.empty() : amountDebited;
  }

  public BigDecimal getBalance() {
    return balance;
  }

  public void setBalance(BigDecimal balance) {
    this.balance = balance;
  }
}
