package com.temboplus.payment.gateway.service;

import com.temboplus.payment.gateway.enums.ErrorKind;
import com.temboplus.payment.gateway.exception.TemboGatewayException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Outcome of a gateway call as a value: either a result or exactly one
 * {@link TemboGatewayException}.
 *
 * <pre>{@code
 * GatewayResult<PaymentResponse> result = GatewayResult.of(() -> service.collect(request));
 * if (result.getErrorKind().filter(ErrorKind.BUSINESS::equals).isPresent()) { ... }
 * }</pre>
 *
 * @param <T> the success type
 */
public final class GatewayResult<T> {

  private final T value;
  private final TemboGatewayException error;

  private GatewayResult(T value, TemboGatewayException error) {
    this.value = value;
    this.error = error;
  }

  public static <T> GatewayResult<T> success(T value) {
    return new GatewayResult<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> GatewayResult<T> failure(TemboGatewayException error) {
    return new GatewayResult<>(null, Objects.requireNonNull(error, "error"));
  }

  /**
   * Runs a gateway call and captures its outcome. Only gateway failures are captured;
   * other runtime exceptions propagate.
   */
  public static <T> GatewayResult<T> of(Supplier<T> call) {
    try {
      return success(call.get());
    } catch (TemboGatewayException e) {
      return failure(e);
    }
  }

  public boolean isSuccess() {
    return error == null;
  }

  public Optional<T> getValue() {
    return Optional.ofNullable(value);
  }

  public Optional<TemboGatewayException> getError() {
    return Optional.ofNullable(error);
  }

  public Optional<ErrorKind> getErrorKind() {
    return getError().map(TemboGatewayException::getKind);
  }

  /** Returns the value, or rethrows the captured failure. */
  public T orElseThrow() {
    if (error != null) {
      throw error;
    }
    return value;
  }
}
