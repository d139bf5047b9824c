package io.github.wphillipmoore.http.batch;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Immutable outer response returned by a {@link BatchTransport}.
 *
 * <p>Headers are defensively copied to guarantee unmodifiability. Header names keep whatever case
 * the transport reported; use {@link #header(String)} for case-insensitive lookup.
 *
 * @param statusCode the HTTP status code
 * @param body the response body text, never null (empty string if no body)
 * @param headers the response headers, never null, unmodifiable
 */
public record TransportResponse(int statusCode, String body, Map<String, String> headers)
    implements Serializable {

  /** Validates non-null fields and defensively copies headers. */
  public TransportResponse {
    Objects.requireNonNull(body, "body");
    headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
  }

  /**
   * Returns the value of the named header, matching the name case-insensitively.
   *
   * @param name the header name
   * @return the header value, or {@code null} if absent
   */
  public @Nullable String header(String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  /** Returns the {@code Content-Type} header, or {@code null} if absent. */
  public @Nullable String contentType() {
    return header("Content-Type");
  }

  /** Returns whether the status code is in the 2xx range. */
  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }
}
