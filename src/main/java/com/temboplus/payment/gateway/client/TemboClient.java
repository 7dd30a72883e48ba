package com.temboplus.payment.gateway.client;

import com.temboplus.payment.gateway.enums.WalletAccount;
import com.temboplus.payment.gateway.model.BalanceResponse;
import com.temboplus.payment.gateway.model.CollectionRequest;
import com.temboplus.payment.gateway.model.DisbursementRequest;
import com.temboplus.payment.gateway.model.PaymentResponse;
import com.temboplus.payment.gateway.model.PaymentStatusRequest;
import com.temboplus.payment.gateway.model.StatementEntry;
import com.temboplus.payment.gateway.model.StatementRequest;
import java.util.List;

/**
 * Abstraction for communicating with the TemboPlus gateway API.
 *
 * <p>Implementations send requests as-is: validation happens in the service layer before
 * any call reaches this interface. Every method blocks until the gateway replies or the
 * configured timeout expires, and none of them retries.
 *
 * <p>All methods throw {@link com.temboplus.payment.gateway.exception.TemboGatewayException}
 * subtypes:
 * <ul>
 *   <li>{@code GatewayTransportException} when the gateway is unreachable, times out, or
 *       answers non-2xx without an error envelope</li>
 *   <li>{@code GatewayCancelledException} when the calling thread is interrupted mid-call</li>
 *   <li>{@code GatewayApiException} when a non-2xx reply carries the gateway's error envelope</li>
 *   <li>{@code ResponseDecodeException} when a 2xx body does not match the expected shape</li>
 * </ul>
 */
public interface TemboClient {

  /**
   * Sends a USSD-push collection request.
   *
   * @throws com.temboplus.payment.gateway.exception.BusinessRejectionException if the reply
   *     status is {@code PAYMENT_REJECTED} or {@code GENERIC_ERROR}
   */
  PaymentResponse collect(CollectionRequest request);

  /**
   * Sends a wallet-to-mobile or wallet-to-bank payout.
   *
   * @throws com.temboplus.payment.gateway.exception.BusinessRejectionException if the reply
   *     status is {@code PAYMENT_REJECTED} or {@code GENERIC_ERROR}
   */
  PaymentResponse disburse(DisbursementRequest request);

  /**
   * Looks up the status of a collection.
   *
   * @throws com.temboplus.payment.gateway.exception.BusinessRejectionException if the
   *     collection was rejected or failed
   */
  PaymentResponse getCollectionStatus(PaymentStatusRequest request);

  /**
   * Looks up the status of a payout.
   *
   * @throws com.temboplus.payment.gateway.exception.BusinessRejectionException if the
   *     payout was rejected or failed
   */
  PaymentResponse getPaymentStatus(PaymentStatusRequest request);

  /** Fetches the balance of a wallet. The call carries no body. */
  BalanceResponse getBalance(WalletAccount account);

  /** Fetches every statement entry of a wallet within the requested date range. */
  List<StatementEntry> getStatement(WalletAccount account, StatementRequest request);
}
