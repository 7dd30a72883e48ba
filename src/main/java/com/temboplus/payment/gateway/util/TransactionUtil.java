package com.temboplus.payment.gateway.util;

import com.temboplus.payment.gateway.model.CollectionRequest;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Helpers for building well-formed payment requests.
 */
public final class TransactionUtil {

  public static final DateTimeFormatter TRANSACTION_DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private TransactionUtil() {
  }

  /**
   * Returns {@code <prefix>_<epochSeconds>}. Two references generated with the same prefix
   * in the same second are equal; add a distinguishing prefix when submitting in bulk.
   */
  public static String generateTransactionRef(String prefix, Clock clock) {
    return prefix + "_" + clock.instant().getEpochSecond();
  }

  public static String formatTransactionDate(LocalDateTime dateTime) {
    return TRANSACTION_DATE_FORMAT.format(dateTime);
  }

  public static String formatTransactionDate(Clock clock) {
    return formatTransactionDate(LocalDateTime.now(clock));
  }

  /**
   * Builds a collection request with a normalised MSISDN, a generated {@code TXN_} reference
   * and the current transaction date.
   */
  public static CollectionRequest buildCollectionRequest(String phoneNumber, String channel,
      BigDecimal amount, String narration, String callbackUrl, Clock clock) {
    CollectionRequest request = new CollectionRequest();
    request.setMsisdn(MsisdnUtil.format(phoneNumber));
    request.setChannel(channel);
    request.setAmount(amount);
    request.setNarration(narration);
    request.setTransactionRef(generateTransactionRef("TXN", clock));
    request.setTransactionDate(formatTransactionDate(clock));
    request.setCallbackUrl(callbackUrl);
    return request;
  }
}
