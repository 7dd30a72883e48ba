package com.temboplus.payment.gateway.util;

import com.temboplus.payment.gateway.exception.InvalidRequestException;

/**
 * Phone number helpers for Tanzanian subscribers ({@code 255} country code).
 */
public final class MsisdnUtil {

  private static final String COUNTRY_CODE = "255";

  private MsisdnUtil() {
  }

  /**
   * Normalises a local or international phone number to {@code 255XXXXXXXXX}.
   * A leading {@code +} and then a leading {@code 0} are dropped; a remaining 9-digit
   * mobile number (starting with 6 or 7) gets the country code prepended. Anything else is
   * returned as-is.
   */
  public static String format(String phoneNumber) {
    if (phoneNumber == null) {
      return null;
    }
    String number = phoneNumber.strip();
    if (number.startsWith("+")) {
      number = number.substring(1);
    }
    if (number.startsWith("0")) {
      number = number.substring(1);
    }
    if (number.length() == 9 && (number.charAt(0) == '6' || number.charAt(0) == '7')) {
      number = COUNTRY_CODE + number;
    }
    return number;
  }

  /**
   * Basic MSISDN check: 10 to 15 characters, starting with the country code.
   *
   * @throws InvalidRequestException if the number fails the check
   */
  public static void validate(String msisdn) {
    if (msisdn == null || msisdn.length() < 10 || msisdn.length() > 15) {
      throw new InvalidRequestException("Invalid MSISDN length: " + msisdn);
    }
    if (!msisdn.startsWith(COUNTRY_CODE)) {
      throw new InvalidRequestException(
          "MSISDN should start with country code " + COUNTRY_CODE + ": " + msisdn);
    }
  }
}
