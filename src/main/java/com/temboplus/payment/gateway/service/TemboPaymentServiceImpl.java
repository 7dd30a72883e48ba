package com.temboplus.payment.gateway.service;

import com.temboplus.payment.gateway.client.TemboClient;
import com.temboplus.payment.gateway.enums.ServiceCode;
import com.temboplus.payment.gateway.enums.WalletAccount;
import com.temboplus.payment.gateway.exception.InvalidRequestException;
import com.temboplus.payment.gateway.model.BalanceResponse;
import com.temboplus.payment.gateway.model.CollectionRequest;
import com.temboplus.payment.gateway.model.DisbursementRequest;
import com.temboplus.payment.gateway.model.PaymentResponse;
import com.temboplus.payment.gateway.model.PaymentStatusRequest;
import com.temboplus.payment.gateway.model.StatementEntry;
import com.temboplus.payment.gateway.model.StatementRequest;
import com.temboplus.payment.gateway.validation.PaymentRequestValidator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Service implementation composing validation and gateway calls.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Validation - delegates to {@link PaymentRequestValidator}; invalid requests never
 *       reach the {@link TemboClient}</li>
 *   <li>Bank payouts - pins the service code to {@code TZ-BANK-B2C}</li>
 *   <li>Gateway communication - delegates to {@link TemboClient}</li>
 * </ul>
 *
 * <p>Observability: the transaction reference is added to MDC for the duration of each
 * payment call. Key events logged:
 * <ul>
 *   <li>{@code payment.validation_failed} - request rejected with error count</li>
 *   <li>{@code payment.submitted} - request accepted by the gateway with its transaction id</li>
 *   <li>{@code wallet.statement_fetched} - statement returned with entry count</li>
 * </ul>
 */
@Service
public class TemboPaymentServiceImpl implements TemboPaymentService {

  private static final Logger LOG = LoggerFactory.getLogger(TemboPaymentServiceImpl.class);

  private final TemboClient temboClient;
  private final PaymentRequestValidator validator;

  public TemboPaymentServiceImpl(TemboClient temboClient, PaymentRequestValidator validator) {
    this.temboClient = temboClient;
    this.validator = validator;
  }

  @Override
  public PaymentResponse collect(CollectionRequest request) {
    MDC.put("transactionRef", request.getTransactionRef());
    try {
      LOG.info("event=collection.received channel={} amount={}",
          request.getChannel(), request.getAmount());
      rejectIfInvalid("collection", validator.validate(request));

      PaymentResponse response = temboClient.collect(request);
      logSubmitted("collection", response);
      return response;
    } finally {
      MDC.remove("transactionRef");
    }
  }

  @Override
  public PaymentResponse disburseToMobile(DisbursementRequest request) {
    MDC.put("transactionRef", request.getTransactionRef());
    try {
      LOG.info("event=disbursement.received serviceCode={} amount={} currency={}",
          request.getServiceCode(), request.getAmount(), request.getCurrencyCode());
      rejectIfInvalid("disbursement", validator.validate(request));

      PaymentResponse response = temboClient.disburse(request);
      logSubmitted("disbursement", response);
      return response;
    } finally {
      MDC.remove("transactionRef");
    }
  }

  @Override
  public PaymentResponse disburseToBank(DisbursementRequest request) {
    String bankService = ServiceCode.TZ_BANK_B2C.getCode();
    String serviceCode = request.getServiceCode();
    if (serviceCode != null && !serviceCode.isBlank() && !serviceCode.equals(bankService)) {
      LOG.warn("event=payment.validation_failed operation=bank_disbursement serviceCode={}",
          serviceCode);
      throw new InvalidRequestException("Service code must be " + bankService
          + " for bank payouts");
    }

    DisbursementRequest bankRequest = new DisbursementRequest(request);
    bankRequest.setServiceCode(bankService);
    return disburseToMobile(bankRequest);
  }

  @Override
  public PaymentResponse getCollectionStatus(PaymentStatusRequest request) {
    rejectIfInvalid("collection_status", validator.validate(request));
    return temboClient.getCollectionStatus(request);
  }

  @Override
  public PaymentResponse getPaymentStatus(PaymentStatusRequest request) {
    rejectIfInvalid("payment_status", validator.validate(request));
    return temboClient.getPaymentStatus(request);
  }

  @Override
  public BalanceResponse getCollectionBalance() {
    return temboClient.getBalance(WalletAccount.COLLECTION);
  }

  @Override
  public BalanceResponse getMainBalance() {
    return temboClient.getBalance(WalletAccount.MAIN);
  }

  @Override
  public List<StatementEntry> getCollectionStatement(StatementRequest request) {
    return fetchStatement(WalletAccount.COLLECTION, request);
  }

  @Override
  public List<StatementEntry> getMainStatement(StatementRequest request) {
    return fetchStatement(WalletAccount.MAIN, request);
  }

  private List<StatementEntry> fetchStatement(WalletAccount account, StatementRequest request) {
    rejectIfInvalid("statement", validator.validate(request));
    List<StatementEntry> entries = temboClient.getStatement(account, request);
    LOG.info("event=wallet.statement_fetched account={} startDate={} endDate={} entries={}",
        account, request.getStartDate(), request.getEndDate(), entries.size());
    return entries;
  }

  private void rejectIfInvalid(String operation, List<String> errors) {
    if (!errors.isEmpty()) {
      LOG.warn("event=payment.validation_failed operation={} errorCount={} errors={}",
          operation, errors.size(), errors);
      throw new InvalidRequestException(errors);
    }
  }

  private void logSubmitted(String operation, PaymentResponse response) {
    LOG.info("event=payment.submitted operation={} statusCode={} transactionId={}",
        operation, response.getStatusCode(), response.getTransactionId());
  }
}
