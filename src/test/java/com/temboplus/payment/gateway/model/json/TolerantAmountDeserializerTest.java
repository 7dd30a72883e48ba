package com.temboplus.payment.gateway.model.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.temboplus.payment.gateway.model.StatementEntry;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

@DisplayName("TolerantAmountDeserializer")
class TolerantAmountDeserializerTest {

  private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();

  private StatementEntry decode(String amountCredited) throws Exception {
    return objectMapper.readValue(
        "{\"accountNo\":\"1\",\"amountCredited\":" + amountCredited + ",\"balance\":500}",
        StatementEntry.class);
  }

  @Nested
  @DisplayName("Within A Statement Entry")
  class WithinEntry {

    @Test
    @DisplayName("Should decode a bare number")
    void shouldDecode_whenNumber() throws Exception {
      assertEquals(Optional.of(new BigDecimal("42.5")), decode("42.5").getAmountCredited());
    }

    @Test
    @DisplayName("Should decode a quoted number")
    void shouldDecode_whenQuotedNumber() throws Exception {
      assertEquals(Optional.of(new BigDecimal("42.5")), decode("\"42.5\"").getAmountCredited());
    }

    @Test
    @DisplayName("Should treat an empty string as absent")
    void shouldBeAbsent_whenEmptyString() throws Exception {
      assertTrue(decode("\"\"").getAmountCredited().isEmpty());
    }

    @Test
    @DisplayName("Should treat null as absent")
    void shouldBeAbsent_whenNull() throws Exception {
      assertTrue(decode("null").getAmountCredited().isEmpty());
    }

    @Test
    @DisplayName("Should treat a non-numeric string as absent without failing the entry")
    void shouldBeAbsent_whenText() throws Exception {
      // when
      StatementEntry entry = decode("\"abc\"");

      // then
      assertTrue(entry.getAmountCredited().isEmpty());
      assertEquals(0, new BigDecimal("500").compareTo(entry.getBalance()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "{\"value\":1}", "[1,2]"})
    @DisplayName("Should treat objects, arrays and booleans as absent")
    void shouldBeAbsent_whenStructured(String json) throws Exception {
      // when
      StatementEntry entry = decode(json);

      // then
      assertTrue(entry.getAmountCredited().isEmpty());
      assertEquals("1", entry.getAccountNo());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1e2147483648", "\"1e2147483648\"", "\"-2.5E-2147483649\""})
    @DisplayName("Should treat amounts whose exponent overflows as absent without failing the entry")
    void shouldBeAbsent_whenExponentOverflows(String json) throws Exception {
      // when
      StatementEntry entry = decode(json);

      // then
      assertTrue(entry.getAmountCredited().isEmpty());
      assertEquals(0, new BigDecimal("500").compareTo(entry.getBalance()));
    }

    @Test
    @DisplayName("Should leave a missing field absent")
    void shouldBeAbsent_whenFieldMissing() throws Exception {
      // when
      StatementEntry entry = objectMapper.readValue("{\"accountNo\":\"1\"}", StatementEntry.class);

      // then
      assertTrue(entry.getAmountCredited().isEmpty());
      assertTrue(entry.getAmountDebited().isEmpty());
    }
  }

  @Nested
  @DisplayName("Quoted Amount Parsing")
  class Parsing {

    @ParameterizedTest
    @ValueSource(strings = {" 42.5 ", "0", "-10", "1e3", "2.5E-1", "10000"})
    @DisplayName("Should accept JSON number syntax")
    void shouldParse_whenJsonNumber(String text) {
      assertTrue(TolerantAmountDeserializer.parse(text).isPresent());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "abc", "+5", ".5", "1.", "01", "1,000", "NaN", "12abc"})
    @DisplayName("Should reject anything else")
    void shouldBeAbsent_whenNotJsonNumber(String text) {
      assertTrue(TolerantAmountDeserializer.parse(text).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1e2147483648", "1E+99999999999", "-2.5e-2147483649"})
    @DisplayName("Should treat exponents beyond BigDecimal's range as absent")
    void shouldBeAbsent_whenExponentOverflows(String text) {
      assertTrue(TolerantAmountDeserializer.parse(text).isEmpty());
    }

    @Test
    @DisplayName("Should keep the exact decimal value")
    void shouldKeepScale() {
      assertEquals(new BigDecimal("1000.00"), TolerantAmountDeserializer.parse("1000.00").get());
    }
  }
}
