package com.temboplus.payment.gateway.webhook;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.temboplus.payment.gateway.exception.InvalidRequestException;
import com.temboplus.payment.gateway.exception.ResponseDecodeException;
import com.temboplus.payment.gateway.model.WebhookPayload;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Parses and minimally validates callback bodies posted by the gateway.
 *
 * <p>No signature is checked: the gateway does not sign callbacks, so authenticity must be
 * established by other means (e.g. an unguessable callback URL, or confirming through a
 * status query before acting on the payload).
 */
@Component
public class WebhookValidator {

  private final ObjectReader payloadReader;

  public WebhookValidator(ObjectMapper objectMapper) {
    this.payloadReader = objectMapper.readerFor(WebhookPayload.class)
        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Decodes a raw callback body.
   *
   * @param body the raw request body
   * @return the decoded payload
   * @throws ResponseDecodeException if the body is not a single JSON object of the expected
   *     shape
   * @throws InvalidRequestException if the transaction reference or transaction id is missing
   */
  public WebhookPayload validate(byte[] body) {
    if (body == null || body.length == 0) {
      throw new ResponseDecodeException("Failed to parse webhook payload: empty body");
    }

    WebhookPayload payload;
    try {
      payload = payloadReader.readValue(body);
    } catch (IOException e) {
      throw new ResponseDecodeException("Failed to parse webhook payload: " + e.getMessage(), e);
    }
    if (payload == null) {
      throw new ResponseDecodeException("Failed to parse webhook payload: null body");
    }

    List<String> errors = new ArrayList<>();
    if (payload.getTransactionRef() == null || payload.getTransactionRef().isBlank()) {
      errors.add("Transaction reference is required");
    }
    if (payload.getTransactionId() == null || payload.getTransactionId().isBlank()) {
      errors.add("Transaction id is required");
    }
    if (!errors.isEmpty()) {
      throw new InvalidRequestException(errors);
    }
    return payload;
  }
}
