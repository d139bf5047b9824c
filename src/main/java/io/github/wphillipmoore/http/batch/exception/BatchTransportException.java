package io.github.wphillipmoore.http.batch.exception;

import java.util.Objects;

/** Thrown when a network or connection failure prevents the batch request from completing. */
public final class BatchTransportException extends BatchException {

  private static final long serialVersionUID = 1L;

  private final String url;

  /**
   * Creates a transport exception.
   *
   * @param message description of the failure
   * @param url the batch URL that was being accessed
   */
  public BatchTransportException(String message, String url) {
    super(message);
    this.url = Objects.requireNonNull(url, "url");
  }

  /**
   * Creates a transport exception with a cause.
   *
   * @param message description of the failure
   * @param url the batch URL that was being accessed
   * @param cause the underlying cause
   */
  public BatchTransportException(String message, String url, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
  }

  /** Returns the batch URL that was being accessed when the failure occurred. */
  public String getUrl() {
    return url;
  }
}
