package com.temboplus.payment.gateway.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Status vocabulary shared by collection, disbursement and status-query replies and by
 * webhook callbacks.
 */
public enum StatusCode {
  PENDING_ACK,
  PAYMENT_ACCEPTED,
  PAYMENT_REJECTED,
  GENERIC_ERROR;

  public String getCode() {
    return name();
  }

  public static Optional<StatusCode> fromCode(String code) {
    return Arrays.stream(values())
        .filter(status -> status.name().equals(code))
        .findFirst();
  }

  /** True for the codes that mean the gateway refused or failed the operation. */
  public static boolean isFailure(String code) {
    return PAYMENT_REJECTED.name().equals(code) || GENERIC_ERROR.name().equals(code);
  }
}
