package com.temboplus.payment.gateway.webhook;

import com.temboplus.payment.gateway.model.WebhookPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default handler: records the outcome only. Declare a {@code @Primary}
 * {@link WebhookHandler} bean to act on callbacks.
 */
@Component
public class LoggingWebhookHandler implements WebhookHandler {

  private static final Logger LOG = LoggerFactory.getLogger(LoggingWebhookHandler.class);

  @Override
  public void handle(WebhookPayload payload) {
    if (payload.isSuccessfulPayment()) {
      LOG.info("event=webhook.payment_accepted transactionRef={} transactionId={}",
          payload.getTransactionRef(), payload.getTransactionId());
    } else if (payload.isFailedPayment()) {
      LOG.warn("event=webhook.payment_failed statusCode={} transactionRef={} transactionId={}",
          payload.getStatusCode(), payload.getTransactionRef(), payload.getTransactionId());
    } else {
      LOG.warn("event=webhook.unknown_status statusCode={} transactionRef={}",
          payload.getStatusCode(), payload.getTransactionRef());
    }
  }
}
