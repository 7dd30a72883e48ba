package com.temboplus.payment.gateway.enums;

/**
 * Coarse classification of every failure the client can surface.
 */
public enum ErrorKind {
  /** Rejected locally before any network call. */
  VALIDATION,
  /** Connection failure, timeout, cancellation or a non-2xx reply without an error envelope. */
  TRANSPORT,
  /** Non-2xx reply carrying the gateway's own error envelope. */
  API,
  /** 2xx reply whose body reports a rejected or failed operation. */
  BUSINESS,
  /** Body did not match the expected shape. */
  DECODE
}
