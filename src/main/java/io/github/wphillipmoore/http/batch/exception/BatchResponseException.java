package io.github.wphillipmoore.http.batch.exception;

import io.github.wphillipmoore.http.batch.TransportResponse;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when the outer batch response is an error or cannot be decoded.
 *
 * <p>Covers a non-2xx outer status, an outer response that is not {@code multipart/mixed}, a part
 * that is not a well-formed HTTP message, and a part count that does not match the request count.
 * The outer response is attached whenever one was received.
 */
public final class BatchResponseException extends BatchException {

  private static final long serialVersionUID = 1L;

  private final @Nullable TransportResponse response;

  /**
   * Creates a response exception.
   *
   * @param message description of the failure
   * @param response the outer response, or {@code null} if unavailable
   */
  public BatchResponseException(String message, @Nullable TransportResponse response) {
    super(message);
    this.response = response;
  }

  /**
   * Creates a response exception with a cause.
   *
   * @param message description of the failure
   * @param response the outer response, or {@code null} if unavailable
   * @param cause the underlying cause
   */
  public BatchResponseException(
      String message, @Nullable TransportResponse response, Throwable cause) {
    super(message, cause);
    this.response = response;
  }

  /**
   * Returns the outer batch response, or {@code null} if none was available.
   *
   * @return the outer response, or {@code null}
   */
  public @Nullable TransportResponse getResponse() {
    return response;
  }

  /**
   * Returns the outer HTTP status code, or {@code null} if no response was available.
   *
   * @return the status code, or {@code null}
   */
  public @Nullable Integer getStatusCode() {
    return response != null ? response.statusCode() : null;
  }

  /**
   * Returns the raw outer response text, or {@code null} if no response was available.
   *
   * @return the response text, or {@code null}
   */
  public @Nullable String getResponseText() {
    return response != null ? response.body() : null;
  }
}
