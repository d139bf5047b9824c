package io.github.wphillipmoore.http.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One decoded response from a batch, aligned with the sub-request at the same position.
 *
 * <p>A non-2xx {@code status} is a regular outcome of the sub-request, not a decoding failure.
 * Header names are lower-cased and keep the order in which they appeared in the part. {@code data}
 * holds the parsed JSON body (as produced by Gson for {@code Object.class}: maps, lists, doubles,
 * strings, booleans) when the part declared a JSON content type and the body parsed.
 *
 * @param status the HTTP status code of the embedded response
 * @param headers the embedded response headers, lower-cased names, unmodifiable
 * @param text the raw body text, never null
 * @param data the parsed JSON body, or {@code null} if the body is not JSON
 */
public record SubResponse(
    int status, Map<String, String> headers, String text, @Nullable Object data) {

  /** Validates fields and normalizes header names. */
  public SubResponse {
    Objects.requireNonNull(headers, "headers");
    Objects.requireNonNull(text, "text");
    Map<String, String> copy = new LinkedHashMap<>();
    headers.forEach((name, value) -> copy.put(name.toLowerCase(Locale.ROOT), value));
    headers = Collections.unmodifiableMap(copy);
  }

  /** Returns whether the body was recognized and parsed as JSON. */
  public boolean isJson() {
    return data != null;
  }

  /** Returns whether the status code is in the 2xx range. */
  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }

  /**
   * Returns the value of the named header, matching the name case-insensitively.
   *
   * @param name the header name
   * @return the header value, or {@code null} if absent
   */
  public @Nullable String header(String name) {
    return headers.get(name.toLowerCase(Locale.ROOT));
  }
}
