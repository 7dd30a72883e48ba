package com.temboplus.payment.gateway.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.temboplus.payment.gateway.enums.Channel;
import com.temboplus.payment.gateway.model.CollectionRequest;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TransactionUtil")
class TransactionUtilTest {

  private final Clock clock = Clock.fixed(Instant.parse("2025-01-15T10:00:00Z"), ZoneOffset.UTC);

  @Test
  @DisplayName("Should build references from the prefix and epoch seconds")
  void shouldGenerateReference() {
    assertEquals("ORDER_1736935200", TransactionUtil.generateTransactionRef("ORDER", clock));
  }

  @Test
  @DisplayName("Should format transaction dates as yyyy-MM-dd HH:mm:ss")
  void shouldFormatDate() {
    assertEquals("2025-01-15 10:00:00", TransactionUtil.formatTransactionDate(clock));
    assertEquals("2024-12-31 23:59:05",
        TransactionUtil.formatTransactionDate(LocalDateTime.of(2024, 12, 31, 23, 59, 5)));
  }

  @Test
  @DisplayName("Should build a ready-to-send collection request")
  void shouldBuildCollectionRequest() {
    // when
    CollectionRequest request = TransactionUtil.buildCollectionRequest("0715123456",
        Channel.TZ_TIGO_C2B.getCode(), new BigDecimal("5000"), "Order #7",
        "https://merchant.example/webhooks/tembo", clock);

    // then
    assertEquals("255715123456", request.getMsisdn());
    assertEquals("TZ-TIGO-C2B", request.getChannel());
    assertEquals(new BigDecimal("5000"), request.getAmount());
    assertEquals("Order #7", request.getNarration());
    assertEquals("TXN_1736935200", request.getTransactionRef());
    assertEquals("2025-01-15 10:00:00", request.getTransactionDate());
    assertEquals("https://merchant.example/webhooks/tembo", request.getCallbackUrl());
  }

  @Test
  @DisplayName("Should name the operator behind a channel")
  void shouldResolveProvider() {
    assertEquals("Tigo", Channel.providerOf("TZ-TIGO-C2B"));
    assertEquals("Airtel", Channel.providerOf("TZ-AIRTEL-C2B"));
    assertEquals("Halotel", Channel.providerOf("TZ-HALOTEL-C2B"));
    assertEquals("Unknown", Channel.providerOf("TZ-VODACOM-C2B"));
  }
}
