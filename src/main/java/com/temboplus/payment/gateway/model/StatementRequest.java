package com.temboplus.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Date range for a wallet statement. Dates are {@code yyyy-MM-dd}; {@code walletId} is only
 * sent when set.
 */
public class StatementRequest {

  private String startDate;
  private String endDate;
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  private String walletId;

  public StatementRequest() {
  }

  public StatementRequest(String startDate, String endDate) {
    this.startDate = startDate;
    this.endDate = endDate;
  }

  public String getStartDate() {
    return startDate;
  }

  public void setStartDate(String startDate) {
    this.startDate = startDate;
  }

  public String getEndDate() {
    return endDate;
  }

  public void setEndDate(String endDate) {
    this.endDate = endDate;
  }

  public String getWalletId() {
    return walletId;
  }

  public void setWalletId(String walletId) {
    this.walletId = walletId;
  }
}
