package com.temboplus.payment.gateway.configuration;

import com.temboplus.payment.gateway.enums.Environment;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Client settings bound from the {@code tembo.*} properties.
 *
 * @param environment sandbox or production; selects the default base URL
 * @param accountId value of the {@code x-account-id} header
 * @param secretKey value of the {@code x-secret-key} header
 * @param timeout connect and read timeout applied to each call
 * @param baseUrl optional override of the environment's base URL, e.g. a local mock server
 */
@ConfigurationProperties(prefix = "tembo")
public record TemboProperties(
    @DefaultValue("sandbox") Environment environment,
    String accountId,
    String secretKey,
    @DefaultValue("30s") Duration timeout,
    String baseUrl) {

  public String resolveBaseUrl() {
    if (baseUrl == null || baseUrl.isBlank()) {
      return environment.getBaseUrl();
    }
    return baseUrl;
  }

  @Override
  public String toString() {
    return "TemboProperties[environment=" + environment
        + ", accountId=" + accountId
        + ", timeout=" + timeout
        + ", baseUrl=" + resolveBaseUrl() + "]";
  }
}
