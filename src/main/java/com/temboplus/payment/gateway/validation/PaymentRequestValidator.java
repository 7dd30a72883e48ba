package com.temboplus.payment.gateway.validation;

import com.temboplus.payment.gateway.enums.Channel;
import com.temboplus.payment.gateway.enums.ServiceCode;
import com.temboplus.payment.gateway.model.CollectionRequest;
import com.temboplus.payment.gateway.model.DisbursementRequest;
import com.temboplus.payment.gateway.model.PaymentStatusRequest;
import com.temboplus.payment.gateway.model.StatementRequest;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Validates outbound requests before they are sent to the gateway.
 *
 * <p>Uses an explicit validation approach (rather than Bean Validation annotations) so that
 * all errors are returned at once, not just the first failure.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Collection: msisdn, channel, narration, transaction reference, transaction date and
 *       callback URL required; amount greater than zero; channel must be supported</li>
 *   <li>Disbursement: as collection, plus country code {@code TZ}, currency code {@code TZS},
 *       a supported service code, recipient names and source account number; bank payouts
 *       need {@code <BIC>:<ACCOUNT NUMBER>} in place of the msisdn</li>
 *   <li>Status query: transaction reference or transaction id</li>
 *   <li>Statement: start and end date required, start not after end</li>
 * </ul>
 */
@Component
public class PaymentRequestValidator {

  private static final Set<String> SUPPORTED_COUNTRIES = Set.of("TZ");
  private static final Set<String> SUPPORTED_CURRENCIES = Set.of("TZS");
  private static final Pattern BANK_DESTINATION = Pattern.compile("[^:\\s]+:[^:\\s]+");

  /**
   * Validates a collection request against all rules.
   *
   * @param request the collection request to validate
   * @return a list of human-readable error messages; empty if the request is valid
   */
  public List<String> validate(CollectionRequest request) {
    List<String> errors = new ArrayList<>();

    requireText(request.getMsisdn(), "MSISDN", errors);
    validateChannel(request.getChannel(), errors);
    validateAmount(request.getAmount(), errors);
    requireText(request.getNarration(), "Narration", errors);
    requireText(request.getTransactionRef(), "Transaction reference", errors);
    requireText(request.getTransactionDate(), "Transaction date", errors);
    requireText(request.getCallbackUrl(), "Callback URL", errors);

    return errors;
  }

  /**
   * Validates a wallet-to-mobile or wallet-to-bank payout against all rules.
   *
   * @param request the payout request to validate
   * @return a list of human-readable error messages; empty if the request is valid
   */
  public List<String> validate(DisbursementRequest request) {
    List<String> errors = new ArrayList<>();

    requireOneOf(request.getCountryCode(), SUPPORTED_COUNTRIES, "Country code", errors);
    requireText(request.getAccountNo(), "Account number", errors);
    validateServiceCode(request.getServiceCode(), errors);
    validateAmount(request.getAmount(), errors);
    validateDestination(request.getMsisdn(), request.getServiceCode(), errors);
    requireText(request.getNarration(), "Narration", errors);
    requireOneOf(request.getCurrencyCode(), SUPPORTED_CURRENCIES, "Currency code", errors);
    requireText(request.getRecipientNames(), "Recipient names", errors);
    requireText(request.getTransactionRef(), "Transaction reference", errors);
    requireText(request.getTransactionDate(), "Transaction date", errors);
    requireText(request.getCallbackUrl(), "Callback URL", errors);

    return errors;
  }

  public List<String> validate(PaymentStatusRequest request) {
    List<String> errors = new ArrayList<>();
    if (isBlank(request.getTransactionRef()) && isBlank(request.getTransactionId())) {
      errors.add("Either transaction reference or transaction id is required");
    }
    return errors;
  }

  public List<String> validate(StatementRequest request) {
    List<String> errors = new ArrayList<>();

    requireText(request.getStartDate(), "Start date", errors);
    requireText(request.getEndDate(), "End date", errors);
    if (!errors.isEmpty()) {
      return errors;
    }

    // Only ISO dates are compared; other formats are left for the gateway to judge.
    Optional<LocalDate> start = parseIsoDate(request.getStartDate());
    Optional<LocalDate> end = parseIsoDate(request.getEndDate());
    if (start.isPresent() && end.isPresent() && start.get().isAfter(end.get())) {
      errors.add("Start date must not be after end date");
    }
    return errors;
  }

  private static Optional<LocalDate> parseIsoDate(String value) {
    try {
      return Optional.of(LocalDate.parse(value));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private void validateChannel(String channel, List<String> errors) {
    if (isBlank(channel)) {
      errors.add("Channel is required");
      return;
    }
    if (Channel.fromCode(channel).isEmpty()) {
      errors.add("Channel must be one of: " + String.join(", ", Channel.supportedCodes()));
    }
  }

  private void validateServiceCode(String serviceCode, List<String> errors) {
    if (isBlank(serviceCode)) {
      errors.add("Service code is required");
      return;
    }
    if (ServiceCode.fromCode(serviceCode).isEmpty()) {
      errors.add("Service code must be one of: "
          + String.join(", ", ServiceCode.supportedCodes()));
    }
  }

  private void validateDestination(String msisdn, String serviceCode, List<String> errors) {
    if (isBlank(msisdn)) {
      errors.add("MSISDN is required");
      return;
    }
    boolean bankPayout = ServiceCode.fromCode(serviceCode)
        .map(ServiceCode::isBankPayout)
        .orElse(false);
    if (bankPayout && !BANK_DESTINATION.matcher(msisdn).matches()) {
      errors.add("Bank payouts require MSISDN in the format <BIC>:<ACCOUNT NUMBER>");
    }
  }

  private void validateAmount(BigDecimal amount, List<String> errors) {
    if (amount == null) {
      errors.add("Amount is required");
      return;
    }
    if (amount.signum() <= 0) {
      errors.add("Amount must be greater than zero");
    }
  }

  private void requireOneOf(String value, Set<String> supported, String field,
      List<String> errors) {
    if (isBlank(value)) {
      errors.add(field + " is required");
      return;
    }
    if (!supported.contains(value)) {
      errors.add(field + " must be one of: " + String.join(", ", supported));
    }
  }

  private void requireText(String value, String field, List<String> errors) {
    if (isBlank(value)) {
      errors.add(field + " is required");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
