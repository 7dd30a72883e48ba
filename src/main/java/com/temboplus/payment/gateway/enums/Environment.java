package com.temboplus.payment.gateway.enums;

/**
 * Gateway deployment the client talks to.
 */
public enum Environment {
  SANDBOX("https://sandbox.temboplus.com"),
  PRODUCTION("https://api.temboplus.com");

  private final String baseUrl;

  Environment(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getBaseUrl() {
    return baseUrl;
  }
}
