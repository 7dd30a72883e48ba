package com.temboplus.payment.gateway.service;

import com.temboplus.payment.gateway.model.BalanceResponse;
import com.temboplus.payment.gateway.model.CollectionRequest;
import com.temboplus.payment.gateway.model.DisbursementRequest;
import com.temboplus.payment.gateway.model.PaymentResponse;
import com.temboplus.payment.gateway.model.PaymentStatusRequest;
import com.temboplus.payment.gateway.model.StatementEntry;
import com.temboplus.payment.gateway.model.StatementRequest;
import java.util.List;

/**
 * Public entry point for every gateway capability.
 *
 * <p>Each operation validates its input locally, then calls the gateway once. Failures are
 * thrown as {@link com.temboplus.payment.gateway.exception.TemboGatewayException} subtypes;
 * wrap a call in {@link GatewayResult#of} to receive them as a value instead. Nothing is
 * retried: retry policy belongs to the caller.
 */
public interface TemboPaymentService {

  /**
   * Pushes a USSD payment prompt to a subscriber.
   *
   * @param request the collection details
   * @return the gateway's acknowledgement, normally {@code PENDING_ACK}
   * @throws com.temboplus.payment.gateway.exception.InvalidRequestException if validation fails
   * @throws com.temboplus.payment.gateway.exception.BusinessRejectionException if the gateway
   *     rejects the collection
   */
  PaymentResponse collect(CollectionRequest request);

  /**
   * Pays out from the wallet to a mobile subscriber.
   *
   * @param request the payout; its service code selects the mobile network or bank rail
   * @return the gateway's acknowledgement
   * @throws com.temboplus.payment.gateway.exception.InvalidRequestException if validation fails
   */
  PaymentResponse disburseToMobile(DisbursementRequest request);

  /**
   * Pays out from the wallet to a bank account. An empty service code defaults to
   * {@code TZ-BANK-B2C}; any other service code is rejected. The caller's request is not
   * modified.
   *
   * @param request the payout, with {@code msisdn} set to {@code <BIC>:<ACCOUNT NUMBER>}
   * @return the gateway's acknowledgement
   * @throws com.temboplus.payment.gateway.exception.InvalidRequestException if validation
   *     fails or a non-bank service code is supplied
   */
  PaymentResponse disburseToBank(DisbursementRequest request);

  /**
   * @throws com.temboplus.payment.gateway.exception.InvalidRequestException if neither the
   *     transaction reference nor the transaction id is set
   */
  PaymentResponse getCollectionStatus(PaymentStatusRequest request);

  /**
   * Status of a wallet-to-mobile or wallet-to-bank payout.
   *
   * @throws com.temboplus.payment.gateway.exception.InvalidRequestException if neither the
   *     transaction reference nor the transaction id is set
   */
  PaymentResponse getPaymentStatus(PaymentStatusRequest request);

  BalanceResponse getCollectionBalance();

  BalanceResponse getMainBalance();

  /**
   * Statement of the collection wallet. The gateway returns the whole range in one reply.
   */
  List<StatementEntry> getCollectionStatement(StatementRequest request);

  List<StatementEntry> getMainStatement(StatementRequest request);
}
