package com.temboplus.payment.gateway.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.temboplus.payment.gateway.enums.ApiOperation;
import com.temboplus.payment.gateway.enums.StatusCode;
import com.temboplus.payment.gateway.enums.WalletAccount;
import com.temboplus.payment.gateway.exception.BusinessRejectionException;
import com.temboplus.payment.gateway.exception.GatewayApiException;
import com.temboplus.payment.gateway.exception.GatewayCancelledException;
import com.temboplus.payment.gateway.exception.GatewayTransportException;
import com.temboplus.payment.gateway.exception.ResponseDecodeException;
import com.temboplus.payment.gateway.exception.TemboGatewayException;
import com.temboplus.payment.gateway.model.ApiErrorResponse;
import com.temboplus.payment.gateway.model.BalanceResponse;
import com.temboplus.payment.gateway.model.CollectionRequest;
import com.temboplus.payment.gateway.model.Credentials;
import com.temboplus.payment.gateway.model.DisbursementRequest;
import com.temboplus.payment.gateway.model.PaymentResponse;
import com.temboplus.payment.gateway.model.PaymentStatusRequest;
import com.temboplus.payment.gateway.model.StatementEntry;
import com.temboplus.payment.gateway.model.StatementRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP-based implementation of {@link TemboClient} using {@link RestTemplate}.
 *
 * <p>Bodies are encoded and decoded with the application's {@link ObjectMapper} rather than
 * RestTemplate's converters so that every reply, successful or not, is classified here:
 * <ol>
 *   <li>non-2xx with a decodable error envelope and a non-zero status code
 *       -> {@link GatewayApiException}</li>
 *   <li>any other non-2xx -> {@link GatewayTransportException} with the raw status and body</li>
 *   <li>2xx that does not decode -> {@link ResponseDecodeException}</li>
 *   <li>2xx payment reply with {@code PAYMENT_REJECTED} or {@code GENERIC_ERROR}
 *       -> {@link BusinessRejectionException}</li>
 * </ol>
 * Connection failures and timeouts become {@link GatewayTransportException}; if the calling
 * thread was interrupted they become {@link GatewayCancelledException} instead.
 */
@Component
public class TemboClientImpl implements TemboClient {

  private static final Logger LOG = LoggerFactory.getLogger(TemboClientImpl.class);

  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;
  private final TemboEndpoints endpoints;
  private final Credentials credentials;
  private final RequestIdGenerator requestIdGenerator;

  public TemboClientImpl(RestTemplate restTemplate, ObjectMapper objectMapper,
      TemboEndpoints endpoints, Credentials credentials, RequestIdGenerator requestIdGenerator) {
    this.restTemplate = restTemplate;
    this.objectMapper = objectMapper;
    this.endpoints = endpoints;
    this.credentials = credentials;
    this.requestIdGenerator = requestIdGenerator;
  }

  @Override
  public PaymentResponse collect(CollectionRequest request) {
    return submitPayment(ApiOperation.COLLECTION, request);
  }

  @Override
  public PaymentResponse disburse(DisbursementRequest request) {
    return submitPayment(ApiOperation.WALLET_TO_MOBILE, request);
  }

  @Override
  public PaymentResponse getCollectionStatus(PaymentStatusRequest request) {
    return submitPayment(ApiOperation.COLLECTION_STATUS, request);
  }

  @Override
  public PaymentResponse getPaymentStatus(PaymentStatusRequest request) {
    return submitPayment(ApiOperation.PAYMENT_STATUS, request);
  }

  @Override
  public BalanceResponse getBalance(WalletAccount account) {
    ApiOperation operation = account.getBalanceOperation();
    String body = post(operation, null);
    return decode(operation, body, objectMapper.constructType(BalanceResponse.class));
  }

  @Override
  public List<StatementEntry> getStatement(WalletAccount account, StatementRequest request) {
    ApiOperation operation = account.getStatementOperation();
    String body = post(operation, request);
    JavaType listType = objectMapper.getTypeFactory()
        .constructCollectionType(List.class, StatementEntry.class);
    return decode(operation, body, listType);
  }

  private PaymentResponse submitPayment(ApiOperation operation, Object request) {
    String body = post(operation, request);
    PaymentResponse response = decode(operation, body,
        objectMapper.constructType(PaymentResponse.class));
    if (StatusCode.isFailure(response.getStatusCode())) {
      LOG.warn("event=gateway.business_rejected operation={} statusCode={} transactionRef={} "
              + "transactionId={}", operation, response.getStatusCode(),
          response.getTransactionRef(), response.getTransactionId());
      throw new BusinessRejectionException(response);
    }
    return response;
  }

  /**
   * Sends one authenticated POST and returns the body of a 2xx reply.
   *
   * @param body request payload, or {@code null} to send no body
   */
  private String post(ApiOperation operation, Object body) {
    RequestEntity<?> request = buildRequest(operation, body);
    ResponseEntity<String> response;
    try {
      response = restTemplate.exchange(request, String.class);
    } catch (RestClientResponseException e) {
      throw classifyFailure(operation, e.getStatusCode().value(), e.getResponseBodyAsString());
    } catch (ResourceAccessException e) {
      if (Thread.currentThread().isInterrupted()) {
        LOG.warn("event=gateway.cancelled operation={}", operation);
        throw new GatewayCancelledException(
            "Call to " + endpoints.path(operation) + " was cancelled; outcome unknown", e);
      }
      throw new GatewayTransportException(
          "Request to " + endpoints.path(operation) + " failed: " + e.getMessage(), e);
    } catch (RestClientException e) {
      throw new GatewayTransportException(
          "Request to " + endpoints.path(operation) + " failed: " + e.getMessage(), e);
    }

    if (!response.getStatusCode().is2xxSuccessful()) {
      throw classifyFailure(operation, response.getStatusCode().value(), response.getBody());
    }
    return response.getBody();
  }

  private RequestEntity<?> buildRequest(ApiOperation operation, Object body) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.set(GatewayHeaders.ACCOUNT_ID, credentials.accountId());
    headers.set(GatewayHeaders.SECRET_KEY, credentials.secretKey());
    headers.set(GatewayHeaders.REQUEST_ID, requestIdGenerator.next());

    RequestEntity.BodyBuilder builder = RequestEntity.post(endpoints.uri(operation))
        .headers(headers);
    if (body == null) {
      return builder.build();
    }
    return builder.body(encode(body));
  }

  private String encode(Object body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Failed to serialize " + body.getClass().getSimpleName(), e);
    }
  }

  private TemboGatewayException classifyFailure(ApiOperation operation, int status,
      String body) {
    if (body != null && !body.isBlank()) {
      try {
        ApiErrorResponse error = strictReader(objectMapper.constructType(ApiErrorResponse.class))
            .readValue(body);
        if (error != null && error.getStatusCode() != 0) {
          LOG.warn("event=gateway.api_error operation={} httpStatus={} statusCode={} reason={}",
              operation, status, error.getStatusCode(), error.getReason());
          return new GatewayApiException(error);
        }
      } catch (JsonProcessingException e) {
        LOG.debug("Error body from {} is not an API error envelope: {}", operation,
            e.getOriginalMessage());
      }
    }
    LOG.warn("event=gateway.transport_error operation={} httpStatus={}", operation, status);
    return new GatewayTransportException(status, body);
  }

  // a reply is one JSON value; anything after it makes the body invalid
  private ObjectReader strictReader(JavaType type) {
    return objectMapper.readerFor(type).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  private <T> T decode(ApiOperation operation, String body, JavaType type) {
    if (body == null || body.isBlank()) {
      throw new ResponseDecodeException("Empty response body from " + endpoints.path(operation));
    }
    T value;
    try {
      value = strictReader(type).readValue(body);
    } catch (JsonProcessingException e) {
      throw new ResponseDecodeException("Failed to decode response from "
          + endpoints.path(operation) + ": " + e.getOriginalMessage(), e);
    }
    if (value == null) {
      throw new ResponseDecodeException("Null response body from " + endpoints.path(operation));
    }
    return value;
  }
}
