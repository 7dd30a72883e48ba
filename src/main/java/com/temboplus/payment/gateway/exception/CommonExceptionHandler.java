package com.temboplus.payment.gateway.exception;

import com.temboplus.payment.gateway.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Global exception handler for the webhook endpoint.
 *
 * <p>Each handler uses the exception's own message via {@code ex.getMessage()}
 * so the thrower controls the response content, not the handler.
 *
 * <ul>
 *   <li>{@link InvalidRequestException} -> 400 Bad Request</li>
 *   <li>{@link ResponseDecodeException} -> 400 Bad Request</li>
 *   <li>{@link HttpMessageNotReadableException} -> 400 Bad Request</li>
 *   <li>any other {@link RuntimeException} -> 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Every non-2xx answer makes the gateway re-deliver the callback.
 */
@ControllerAdvice
public class CommonExceptionHandler {

  private static final Logger LOG = LoggerFactory.getLogger(CommonExceptionHandler.class);

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
    LOG.warn("Invalid webhook payload: {}", ex.getErrors());
    return new ResponseEntity<>(new ErrorResponse(ex.getMessage()), HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(ResponseDecodeException.class)
  public ResponseEntity<ErrorResponse> handleUndecodable(ResponseDecodeException ex) {
    LOG.warn("Undecodable webhook payload: {}", ex.getMessage());
    return new ResponseEntity<>(new ErrorResponse(ex.getMessage()), HttpStatus.BAD_REQUEST);
  }

  /** Returns a 400 when the request body is missing or cannot be read. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableMessage(HttpMessageNotReadableException ex) {
    LOG.warn("Malformed request body: {}", ex.getMessage());
    return new ResponseEntity<>(new ErrorResponse("Malformed request body"),
        HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ErrorResponse> handleProcessingFailure(RuntimeException ex) {
    LOG.error("Webhook processing failed", ex);
    return new ResponseEntity<>(new ErrorResponse("Webhook processing failed"),
        HttpStatus.INTERNAL_SERVER_ERROR);
  }
}
