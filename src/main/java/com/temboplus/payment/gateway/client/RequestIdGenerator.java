package com.temboplus.payment.gateway.client;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Generates {@code x-request-id} values of the form {@code req_<epochMillis>_<sequence>}.
 * The sequence keeps ids unique for calls issued within the same millisecond.
 */
@Component
public class RequestIdGenerator {

  private final Clock clock;
  private final AtomicLong sequence = new AtomicLong();

  public RequestIdGenerator(Clock clock) {
    this.clock = clock;
  }

  public String next() {
    return "req_" + clock.millis() + "_" + sequence.incrementAndGet();
  }
}
