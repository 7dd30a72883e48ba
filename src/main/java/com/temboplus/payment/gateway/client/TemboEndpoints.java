package com.temboplus.payment.gateway.client;

import com.temboplus.payment.gateway.enums.ApiOperation;
import java.net.URI;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable table of operation paths under a base URL.
 *
 * <p>Production code uses {@link #defaults(String)}; tests point the same table at a mock
 * server or substitute individual paths.
 */
public final class TemboEndpoints {

  private final String baseUrl;
  private final Map<ApiOperation, String> paths;

  public TemboEndpoints(String baseUrl, Map<ApiOperation, String> paths) {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("Base URL is required");
    }
    EnumMap<ApiOperation, String> copy = new EnumMap<>(ApiOperation.class);
    for (ApiOperation operation : ApiOperation.values()) {
      String path = paths.get(operation);
      if (path == null || path.isBlank()) {
        throw new IllegalArgumentException("No path configured for " + operation);
      }
      copy.put(operation, path);
    }
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.paths = Collections.unmodifiableMap(copy);
  }

  public static TemboEndpoints defaults(String baseUrl) {
    Map<ApiOperation, String> paths = new EnumMap<>(ApiOperation.class);
    for (ApiOperation operation : ApiOperation.values()) {
      paths.put(operation, operation.getDefaultPath());
    }
    return new TemboEndpoints(baseUrl, paths);
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public String path(ApiOperation operation) {
    return paths.get(operation);
  }

  public URI uri(ApiOperation operation) {
    return URI.create(baseUrl + paths.get(operation));
  }
}
