package io.github.wphillipmoore.http.batch.exception;

/**
 * Base exception for a batch that failed as a whole.
 *
 * <p>This is an unchecked exception hierarchy. A sub-request that the server answered with an
 * error status is not reported through this hierarchy; it is a regular {@link
 * io.github.wphillipmoore.http.batch.SubResponse} in the result list.
 */
public sealed class BatchException extends RuntimeException
    permits BatchTransportException, BatchTimeoutException, BatchResponseException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message. */
  public BatchException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public BatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
