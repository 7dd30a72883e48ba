package com.temboplus.payment.gateway.client;

/**
 * Header names required by the gateway on every call.
 */
public final class GatewayHeaders {

  public static final String ACCOUNT_ID = "x-account-id";
  public static final String SECRET_KEY = "x-secret-key";
  public static final String REQUEST_ID = "x-request-id";

  private GatewayHeaders() {
  }
}
