package io.github.wphillipmoore.http.batch;

import io.github.wphillipmoore.http.batch.exception.BatchTimeoutException;
import io.github.wphillipmoore.http.batch.exception.BatchTransportException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;
import javax.net.ssl.SSLContext;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based implementation of {@link BatchTransport}.
 *
 * <p>Retries a request once when it fails with a low-level I/O error before any response was
 * received; a response with an error status is returned, never retried. {@code gzip} and {@code
 * deflate} response bodies are decompressed and the {@code content-encoding} header is dropped.
 * Bodies are decoded as UTF-8.
 */
public final class HttpClientTransport implements BatchTransport {

  private static final Logger log = LoggerFactory.getLogger(HttpClientTransport.class);

  static final int MAX_ATTEMPTS = 2;

  /** Headers the JDK client manages itself and refuses to accept from callers. */
  private static final Set<String> RESTRICTED_HEADERS =
      Set.of("connection", "content-length", "expect", "host", "upgrade");

  private final HttpClient client;

  /** Creates a transport with a default TLS-verifying {@link HttpClient}. */
  public HttpClientTransport() {
    this.client = HttpClient.newHttpClient();
  }

  /**
   * Creates a transport with a custom {@link SSLContext}, for example for mutual TLS.
   *
   * @param sslContext the SSL context to use
   */
  public HttpClientTransport(SSLContext sslContext) {
    Objects.requireNonNull(sslContext, "sslContext");
    this.client = HttpClient.newBuilder().sslContext(sslContext).build();
  }

  /**
   * Creates a transport with an injected {@link HttpClient}. Package-private for testing.
   *
   * @param client the HTTP client to use
   */
  HttpClientTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public TransportResponse post(
      String url, byte[] body, Map<String, String> headers, @Nullable Duration timeout) {
    HttpRequest.Builder requestBuilder =
        HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Accept-Encoding", "gzip, deflate")
            .POST(HttpRequest.BodyPublishers.ofByteArray(body));

    headers.forEach(
        (name, value) -> {
          if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
            requestBuilder.setHeader(name, value);
          }
        });

    if (timeout != null) {
      requestBuilder.timeout(timeout);
    }

    HttpResponse<byte[]> response = sendWithRetry(requestBuilder.build(), url, timeout);
    Map<String, String> responseHeaders = flattenHeaders(response.headers());
    String encoding = responseHeaders.remove("content-encoding");
    byte[] content = decompress(response.body(), encoding, url);
    return new TransportResponse(
        response.statusCode(), new String(content, StandardCharsets.UTF_8), responseHeaders);
  }

  private HttpResponse<byte[]> sendWithRetry(
      HttpRequest request, String url, @Nullable Duration timeout) {
    for (int attempt = 1; ; attempt++) {
      try {
        return client.send(request, HttpResponse.BodyHandlers.ofByteArray());
      } catch (HttpTimeoutException e) {
        if (attempt >= MAX_ATTEMPTS) {
          throw new BatchTimeoutException("HTTP request timed out", url, timeout, e);
        }
        log.warn("HTTP request to {} timed out, retrying", url);
      } catch (IOException e) {
        if (attempt >= MAX_ATTEMPTS) {
          throw new BatchTransportException("HTTP request failed", url, e);
        }
        log.warn("HTTP request to {} failed ({}), retrying", url, e.toString());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new BatchTransportException("HTTP request interrupted", url, e);
      }
    }
  }

  /**
   * Inflates a response body according to its {@code Content-Encoding}.
   *
   * @param body the raw body bytes
   * @param encoding the content encoding, or {@code null} for none
   * @param url the request URL, for error reporting
   * @return the decoded bytes
   */
  static byte[] decompress(byte[] body, @Nullable String encoding, String url) {
    if (encoding == null || body.length == 0) {
      return body;
    }
    String normalized = encoding.trim().toLowerCase(Locale.ROOT);
    if (!"gzip".equals(normalized) && !"deflate".equals(normalized)) {
      return body;
    }
    try (InputStream in =
        "gzip".equals(normalized)
            ? new GZIPInputStream(new ByteArrayInputStream(body))
            : new InflaterInputStream(new ByteArrayInputStream(body))) {
      return in.readAllBytes();
    } catch (IOException e) {
      throw new BatchTransportException("Failed to decode " + normalized + " response", url, e);
    }
  }

  /**
   * Flattens {@link HttpHeaders} multi-value map to single-value map per RFC 9110 section 5.3.
   *
   * <p>Multiple values for the same header name are joined with {@code ", "}. Names are
   * lower-cased.
   *
   * @param httpHeaders the HTTP response headers
   * @return a mutable, flattened string-to-string header map
   */
  static Map<String, String> flattenHeaders(HttpHeaders httpHeaders) {
    Map<String, String> result = new LinkedHashMap<>();
    httpHeaders
        .map()
        .forEach(
            (name, values) -> result.put(name.toLowerCase(Locale.ROOT), String.join(", ", values)));
    return result;
  }
}
