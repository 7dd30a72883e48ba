package com.temboplus.payment.gateway.enums;

/**
 * Gateway operations and their default paths. Every operation is a {@code POST}.
 */
public enum ApiOperation {
  COLLECTION("/tembo/v1/collection"),
  COLLECTION_STATUS("/tembo/v1/collection/status"),
  COLLECTION_BALANCE("/tembo/v1/wallet/collection-balance"),
  COLLECTION_STATEMENT("/tembo/v1/wallet/collection-statement"),
  MAIN_BALANCE("/tembo/v1/wallet/main-balance"),
  MAIN_STATEMENT("/tembo/v1/wallet/main-statement"),
  WALLET_TO_MOBILE("/tembo/v1/payment/wallet-to-mobile"),
  PAYMENT_STATUS("/tembo/v1/payment/status");

  private final String defaultPath;

  ApiOperation(String defaultPath) {
    this.defaultPath = defaultPath;
  }

  public String getDefaultPath() {
    return defaultPath;
  }
}
