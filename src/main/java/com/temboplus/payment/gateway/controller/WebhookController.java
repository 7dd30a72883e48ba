package com.temboplus.payment.gateway.controller;

import com.temboplus.payment.gateway.model.WebhookPayload;
import com.temboplus.payment.gateway.webhook.WebhookHandler;
import com.temboplus.payment.gateway.webhook.WebhookValidator;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives payment callbacks from the gateway.
 *
 * <p>POST /webhooks/tembo answers {@code 200 {"status":"received"}} once the payload has been
 * validated and handled. Malformed payloads get a 400 and handler failures a 500 (see
 * {@link com.temboplus.payment.gateway.exception.CommonExceptionHandler}); in both cases the
 * gateway's own retry mechanism re-delivers the callback.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {

  private static final Logger LOG = LoggerFactory.getLogger(WebhookController.class);

  private final WebhookValidator webhookValidator;
  private final WebhookHandler webhookHandler;

  public WebhookController(WebhookValidator webhookValidator, WebhookHandler webhookHandler) {
    this.webhookValidator = webhookValidator;
    this.webhookHandler = webhookHandler;
  }

  @PostMapping("/tembo")
  public ResponseEntity<Map<String, String>> receive(@RequestBody byte[] body) {
    WebhookPayload payload = webhookValidator.validate(body);
    LOG.info("event=webhook.received statusCode={} transactionRef={} transactionId={}",
        payload.getStatusCode(), payload.getTransactionRef(), payload.getTransactionId());

    webhookHandler.handle(payload);
    return ResponseEntity.ok(Map.of("status", "received"));
  }
}
