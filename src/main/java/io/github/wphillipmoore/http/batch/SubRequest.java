package io.github.wphillipmoore.http.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One logical POST request carried inside a batch.
 *
 * <p>The body is any value Gson can serialize (maps, lists, records, primitives, {@code
 * JsonElement}). It is serialized when the batch is encoded and is never modified. Headers keep
 * their insertion order and are written after the JSON content headers of the embedded request.
 *
 * @param url the target URL of the sub-request, never null
 * @param body the JSON-serializable request body, never null
 * @param headers per-request headers, never null, unmodifiable
 */
public record SubRequest(String url, Object body, Map<String, String> headers) {

  /** Validates fields and copies headers into an ordered, unmodifiable map. */
  public SubRequest {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(headers, "headers");
    if (url.isBlank() || containsLineBreak(url) || url.indexOf(' ') >= 0) {
      throw new IllegalArgumentException("url must be a non-blank request target: " + url);
    }
    Map<String, String> copy = new LinkedHashMap<>();
    headers.forEach(
        (name, value) -> {
          validateHeader(name, value);
          copy.put(name, value);
        });
    headers = Collections.unmodifiableMap(copy);
  }

  /**
   * Creates a sub-request without per-request headers.
   *
   * @param url the target URL
   * @param body the JSON-serializable request body
   */
  public SubRequest(String url, Object body) {
    this(url, body, Map.of());
  }

  /**
   * Checks that a header can be written on its own line of an HTTP message.
   *
   * @param name the header name
   * @param value the header value
   * @throws IllegalArgumentException if the name is blank or either part contains a line break
   */
  public static void validateHeader(String name, String value) {
    Objects.requireNonNull(name, "header name");
    Objects.requireNonNull(value, "header value");
    if (name.isBlank() || name.indexOf(':') >= 0 || containsLineBreak(name)) {
      throw new IllegalArgumentException("Invalid header name: " + name);
    }
    if (containsLineBreak(value)) {
      throw new IllegalArgumentException("Header value contains a line break: " + name);
    }
  }

  private static boolean containsLineBreak(String text) {
    return text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0;
  }
}
