package com.temboplus.payment.gateway.model.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decodes an amount that the gateway may send as a number, a numeric string, an empty string
 * or {@code null}.
 *
 * <p>Never fails on the value itself: anything that is not a JSON number (bare or quoted)
 * becomes {@link Optional#empty()}, so a single malformed field does not reject the rest of a
 * statement.
 */
public class TolerantAmountDeserializer extends StdDeserializer<Optional<BigDecimal>> {

  private static final Pattern JSON_NUMBER =
      Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");

  public TolerantAmountDeserializer() {
    super(Optional.class);
  }

  @Override
  public Optional<BigDecimal> deserialize(JsonParser p, DeserializationContext ctxt)
      throws IOException {
    JsonToken token = p.currentToken();
    if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
      try {
        return Optional.of(p.getDecimalValue());
      } catch (NumberFormatException | JsonProcessingException e) {
        // exponent outside BigDecimal's range
        return Optional.empty();
      }
    }
    if (token == JsonToken.VALUE_STRING) {
      return parse(p.getText());
    }
    // objects, arrays and booleans are consumed and dropped
    p.skipChildren();
    return Optional.empty();
  }

  @Override
  public Optional<BigDecimal> getNullValue(DeserializationContext ctxt) {
    return Optional.empty();
  }

  /**
   * Parses the content of a quoted amount.
   *
   * @param text the string content, possibly empty or padded with whitespace
   * @return the amount, or empty when the text is not a JSON number or does not fit a
   *     {@link BigDecimal}
   */
  public static Optional<BigDecimal> parse(String text) {
    if (text == null) {
      return Optional.empty();
    }
    String trimmed = text.strip();
    if (trimmed.isEmpty() || !JSON_NUMBER.matcher(trimmed).matches()) {
      return Optional.empty();
    }
    try {
      return Optional.of(new BigDecimal(trimmed));
    } catch (NumberFormatException e) {
      // exponent outside BigDecimal's range
      return Optional.empty();
    }
  }
}
