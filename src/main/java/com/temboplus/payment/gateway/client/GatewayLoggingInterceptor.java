package com.temboplus.payment.gateway.client;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

/**
 * RestTemplate interceptor that logs every outbound gateway call with method, path, status
 * and latency.
 *
 * <p>The call's {@code x-request-id} is put in the SLF4J MDC as {@code requestId} while the
 * call runs, so log lines from lower layers can be correlated with the gateway's own logs.
 * A {@code requestId} the calling thread already carried is restored afterwards.
 * Headers are never logged: they carry the secret key.
 */
public class GatewayLoggingInterceptor implements ClientHttpRequestInterceptor {

  private static final Logger LOG = LoggerFactory.getLogger(GatewayLoggingInterceptor.class);

  @Override
  public ClientHttpResponse intercept(HttpRequest request, byte[] body,
      ClientHttpRequestExecution execution) throws IOException {
    String requestId = request.getHeaders().getFirst(GatewayHeaders.REQUEST_ID);
    String path = request.getURI().getPath();
    String outerRequestId = MDC.get("requestId");
    if (requestId != null) {
      MDC.put("requestId", requestId);
    }

    long startTime = System.currentTimeMillis();
    try {
      ClientHttpResponse response = execution.execute(request, body);
      LOG.info("event=gateway.responded method={} path={} status={} latencyMs={}",
          request.getMethod(), path, response.getStatusCode().value(),
          System.currentTimeMillis() - startTime);
      return response;
    } catch (IOException e) {
      LOG.warn("event=gateway.unreachable method={} path={} latencyMs={} error={}",
          request.getMethod(), path, System.currentTimeMillis() - startTime, e.getMessage());
      throw e;
    } finally {
      if (outerRequestId == null) {
        MDC.remove("requestId");
      } else {
        MDC.put("requestId", outerRequestId);
      }
    }
  }
}
