package com.temboplus.payment.gateway.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Mobile network operator routes that can receive a USSD push for a collection.
 */
public enum Channel {
  TZ_TIGO_C2B("TZ-TIGO-C2B", "Tigo"),
  TZ_AIRTEL_C2B("TZ-AIRTEL-C2B", "Airtel"),
  TZ_HALOTEL_C2B("TZ-HALOTEL-C2B", "Halotel");

  private final String code;
  private final String provider;

  Channel(String code, String provider) {
    this.code = code;
    this.provider = provider;
  }

  public String getCode() {
    return code;
  }

  public String getProvider() {
    return provider;
  }

  public static Optional<Channel> fromCode(String code) {
    return Arrays.stream(values())
        .filter(channel -> channel.code.equals(code))
        .findFirst();
  }

  public static List<String> supportedCodes() {
    return Arrays.stream(values()).map(Channel::getCode).toList();
  }

  /** Operator name for a channel code, or {@code "Unknown"} when the code is not supported. */
  public static String providerOf(String code) {
    return fromCode(code).map(Channel::getProvider).orElse("Unknown");
  }
}
