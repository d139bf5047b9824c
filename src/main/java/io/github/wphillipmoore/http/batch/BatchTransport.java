package io.github.wphillipmoore.http.batch;

import java.time.Duration;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Transport interface for sending one physical HTTP request.
 *
 * <p>The batch client issues exactly one call per batch. Implementations own TLS, connection
 * pooling and retries. They return every response the server sends, whatever its status, and
 * throw {@link io.github.wphillipmoore.http.batch.exception.BatchTransportException} for network
 * or connection failures and {@link
 * io.github.wphillipmoore.http.batch.exception.BatchTimeoutException} when the timeout elapses.
 */
public interface BatchTransport {

  /**
   * Sends a POST request with a pre-encoded body.
   *
   * @param url fully-qualified URL to send the request to
   * @param body the encoded request body
   * @param headers HTTP headers to include in the request, including {@code Content-Type}
   * @param timeout request timeout, or {@code null} for no timeout
   * @return the transport response
   */
  TransportResponse post(
      String url, byte[] body, Map<String, String> headers, @Nullable Duration timeout);
}
