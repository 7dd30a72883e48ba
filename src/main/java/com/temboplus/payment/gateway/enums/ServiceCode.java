package com.temboplus.payment.gateway.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Disbursement routes. Bank payouts share the wallet-to-mobile endpoint and are told apart
 * only by {@link #TZ_BANK_B2C}.
 */
public enum ServiceCode {
  TZ_TIGO_B2C("TZ-TIGO-B2C"),
  TZ_AIRTEL_B2C("TZ-AIRTEL-B2C"),
  TZ_BANK_B2C("TZ-BANK-B2C");

  private final String code;

  ServiceCode(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  public boolean isBankPayout() {
    return this == TZ_BANK_B2C;
  }

  public static Optional<ServiceCode> fromCode(String code) {
    return Arrays.stream(values())
        .filter(service -> service.code.equals(code))
        .findFirst();
  }

  public static List<String> supportedCodes() {
    return Arrays.stream(values()).map(ServiceCode::getCode).toList();
  }
}
