package io.github.wphillipmoore.http.batch.exception;

import java.time.Duration;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** Thrown when the batch request does not complete within the transport timeout. */
public final class BatchTimeoutException extends BatchException {

  private static final long serialVersionUID = 1L;

  private final String url;
  private final @Nullable Duration timeout;

  /**
   * Creates a timeout exception.
   *
   * @param message description of the failure
   * @param url the batch URL that was being accessed
   * @param timeout the timeout that elapsed, or {@code null} if unknown
   * @param cause the underlying cause
   */
  public BatchTimeoutException(
      String message, String url, @Nullable Duration timeout, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
    this.timeout = timeout;
  }

  /** Returns the batch URL that was being accessed when the timeout occurred. */
  public String getUrl() {
    return url;
  }

  /**
   * Returns the timeout that elapsed, or {@code null} if it was not known to the transport.
   *
   * @return the timeout, or {@code null}
   */
  public @Nullable Duration getTimeout() {
    return timeout;
  }
}
