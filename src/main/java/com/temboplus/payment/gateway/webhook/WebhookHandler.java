package com.temboplus.payment.gateway.webhook;

import com.temboplus.payment.gateway.model.WebhookPayload;

/**
 * Application logic run for each validated callback.
 *
 * <p>Throwing from {@link #handle} makes the endpoint answer with a server error, so the
 * gateway delivers the callback again. Implementations should therefore be idempotent per
 * transaction reference.
 */
public interface WebhookHandler {

  void handle(WebhookPayload payload);
}
