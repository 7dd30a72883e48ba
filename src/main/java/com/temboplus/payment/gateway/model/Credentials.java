package com.temboplus.payment.gateway.model;

/**
 * Static gateway credentials, sent as {@code x-account-id} and {@code x-secret-key} on every
 * call. {@link #toString()} never reveals the secret.
 */
public record Credentials(String accountId, String secretKey) {

  public Credentials {
    if (accountId == null || accountId.isBlank()) {
      throw new IllegalArgumentException("Account id is required");
    }
    if (secretKey == null || secretKey.isBlank()) {
      throw new IllegalArgumentException("Secret key is required");
    }
  }

  @Override
  public String toString() {
    return "Credentials[accountId=" + accountId + ", secretKey=****]";
  }
}
