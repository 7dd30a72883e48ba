package com.temboplus.payment.gateway.configuration;

import com.temboplus.payment.gateway.client.GatewayLoggingInterceptor;
import com.temboplus.payment.gateway.client.TemboEndpoints;
import com.temboplus.payment.gateway.model.Credentials;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Application-wide bean configuration.
 *
 * <p>Provides:
 * <ul>
 *   <li>{@link RestTemplate} backed by the JDK HTTP client, with the configured timeout
 *       applied to connect and read of every call, and outbound call logging</li>
 *   <li>{@link Credentials} and {@link TemboEndpoints} resolved once from {@link TemboProperties}</li>
 *   <li>{@link Clock} for request ids and transaction timestamps (replaceable in tests)</li>
 * </ul>
 */
@Configuration
public class ApplicationConfiguration {

  private static final Logger LOG = LoggerFactory.getLogger(ApplicationConfiguration.class);

  @Bean
  public RestTemplate restTemplate(RestTemplateBuilder builder, TemboProperties properties) {
    Duration timeout = properties.timeout();
    return builder
        .requestFactory(() -> requestFactory(timeout))
        .additionalInterceptors(new GatewayLoggingInterceptor())
        .build();
  }

  @Bean
  public Credentials credentials(TemboProperties properties) {
    return new Credentials(properties.accountId(), properties.secretKey());
  }

  @Bean
  public TemboEndpoints temboEndpoints(TemboProperties properties) {
    LOG.info("event=client.configured environment={} baseUrl={} timeout={}",
        properties.environment(), properties.resolveBaseUrl(), properties.timeout());
    return TemboEndpoints.defaults(properties.resolveBaseUrl());
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  private static JdkClientHttpRequestFactory requestFactory(Duration timeout) {
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .build();
    JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
    factory.setReadTimeout(timeout);
    return factory;
  }
}
