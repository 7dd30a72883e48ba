package com.temboplus.payment.gateway.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@DisplayName("GatewayLoggingInterceptor")
class GatewayLoggingInterceptorTest {

  private static final String URL = "http://localhost:8080/tembo/v1/wallet/main-balance";

  private RestTemplate restTemplate;
  private MockRestServiceServer server;

  @BeforeEach
  void setUp() {
    restTemplate = new RestTemplate();
    restTemplate.getInterceptors().add(new GatewayLoggingInterceptor());
    server = MockRestServiceServer.bindTo(restTemplate).build();
  }

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  private RequestEntity<Void> request() {
    return RequestEntity.method(HttpMethod.POST, URI.create(URL))
        .header(GatewayHeaders.REQUEST_ID, "req_1736935200000_1")
        .build();
  }

  @Test
  @DisplayName("Should expose the request id in the MDC during the call and clear it afterwards")
  void shouldScopeRequestIdToCall_whenCallSucceeds() {
    // given
    AtomicReference<String> seen = new AtomicReference<>();
    server.expect(requestTo(URL))
        .andRespond(request -> {
          seen.set(MDC.get("requestId"));
          return withSuccess("{}", MediaType.APPLICATION_JSON).createResponse(request);
        });

    // when
    restTemplate.exchange(request(), String.class);

    // then
    assertEquals("req_1736935200000_1", seen.get());
    assertNull(MDC.get("requestId"));
    server.verify();
  }

  @Test
  @DisplayName("Should clear the MDC when the gateway is unreachable")
  void shouldClearRequestId_whenCallFails() {
    // given
    server.expect(requestTo(URL))
        .andRespond(withException(new IOException("Connection refused")));

    // when / then
    assertThrows(ResourceAccessException.class,
        () -> restTemplate.exchange(request(), String.class));
    assertNull(MDC.get("requestId"));
  }

  @Test
  @DisplayName("Should restore the caller's own request id after the call")
  void shouldRestoreOuterRequestId_whenCallerHadOne() {
    // given
    MDC.put("requestId", "inbound-42");
    AtomicReference<String> seen = new AtomicReference<>();
    server.expect(requestTo(URL))
        .andRespond(request -> {
          seen.set(MDC.get("requestId"));
          return withSuccess("{}", MediaType.APPLICATION_JSON).createResponse(request);
        });

    // when
    restTemplate.exchange(request(), String.class);

    // then
    assertEquals("req_1736935200000_1", seen.get());
    assertEquals("inbound-42", MDC.get("requestId"));
  }

  @Test
  @DisplayName("Should restore the caller's own request id when the gateway is unreachable")
  void shouldRestoreOuterRequestId_whenCallFails() {
    // given
    MDC.put("requestId", "inbound-42");
    server.expect(requestTo(URL))
        .andRespond(withException(new IOException("Connection refused")));

    // when / then
    assertThrows(ResourceAccessException.class,
        () -> restTemplate.exchange(request(), String.class));
    assertEquals("inbound-42", MDC.get("requestId"));
  }
}
