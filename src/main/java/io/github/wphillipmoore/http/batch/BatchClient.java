package io.github.wphillipmoore.http.batch;

import io.github.wphillipmoore.http.batch.codec.BatchDecoder;
import io.github.wphillipmoore.http.batch.codec.BatchEncoder;
import io.github.wphillipmoore.http.batch.codec.EncodedBatch;
import io.github.wphillipmoore.http.batch.exception.BatchResponseException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends many independent JSON POST requests as one {@code multipart/mixed} HTTP round trip.
 *
 * <p>Each call to {@link #send(List)} encodes the sub-requests, issues exactly one request to the
 * batch URL through the {@link BatchTransport}, and decodes the multipart response into one {@link
 * SubResponse} per sub-request, in submission order. The client performs no retries and never
 * splits a batch.
 *
 * <p>There are three outcomes: the ordered responses, a transport exception raised by the
 * transport, or a {@link BatchResponseException} when the outer response is an error or cannot be
 * decoded. Sub-requests that failed on the server are ordinary responses with a non-2xx status.
 *
 * <p>Instances are immutable and safe to share between threads:
 *
 * <pre>{@code
 * BatchClient client = new BatchClient.Builder("https://fcm.googleapis.com/batch")
 *     .transport(new HttpClientTransport())
 *     .commonHeaders(Map.of("Authorization", "Bearer " + token))
 *     .build();
 * List<SubResponse> responses = client.send(requests);
 * }</pre>
 */
public final class BatchClient {

  private static final Logger log = LoggerFactory.getLogger(BatchClient.class);

  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  private final String batchUrl;
  private final BatchTransport transport;
  private final Map<String, String> commonHeaders;
  private final @Nullable Duration timeout;
  private final BatchEncoder encoder;
  private final BatchDecoder decoder = new BatchDecoder();

  private BatchClient(Builder builder) {
    this.batchUrl = builder.batchUrl;
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.commonHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.commonHeaders));
    this.timeout = builder.timeout;
    this.encoder = builder.encoder;
  }

  /** Returns the URL that accepts batch requests. */
  public String getBatchUrl() {
    return batchUrl;
  }

  /** Returns the headers sent on the outer request and merged into every sub-request. */
  public Map<String, String> getCommonHeaders() {
    return commonHeaders;
  }

  /** Returns the outer request timeout, or {@code null} if none is applied. */
  public @Nullable Duration getTimeout() {
    return timeout;
  }

  /**
   * Sends the sub-requests as a single batch.
   *
   * @param requests the sub-requests, in submission order; must not be empty
   * @return one response per sub-request, in submission order
   * @throws IllegalArgumentException if {@code requests} is empty
   * @throws io.github.wphillipmoore.http.batch.exception.BatchException if the batch as a whole
   *     failed
   */
  public List<SubResponse> send(List<SubRequest> requests) {
    Objects.requireNonNull(requests, "requests");
    if (requests.isEmpty()) {
      throw new IllegalArgumentException("requests must not be empty");
    }

    EncodedBatch batch = encoder.encode(requests, commonHeaders);
    Map<String, String> headers =
        BatchEncoder.mergeHeaders(commonHeaders, Map.of("Content-Type", batch.contentType()));

    log.debug("Sending batch of {} requests to {}", requests.size(), batchUrl);
    TransportResponse response = transport.post(batchUrl, batch.body(), headers, timeout);

    if (!response.isSuccess()) {
      throw new BatchResponseException(
          "Batch request failed with HTTP status "
              + response.statusCode()
              + ". Raw server response: \""
              + response.body()
              + "\"",
          response);
    }

    List<SubResponse> responses = decoder.decode(response);
    if (responses.size() != requests.size()) {
      throw new BatchResponseException(
          "Expected " + requests.size() + " parts in batch response but got " + responses.size(),
          response);
    }
    log.debug("Received {} responses from {}", responses.size(), batchUrl);
    return responses;
  }

  /**
   * Sends the sub-requests as a single batch and summarizes the outcome.
   *
   * @param requests the sub-requests, in submission order; must not be empty
   * @return the responses with success and failure counts
   * @throws IllegalArgumentException if {@code requests} is empty
   * @throws io.github.wphillipmoore.http.batch.exception.BatchException if the batch as a whole
   *     failed
   */
  public BatchResult execute(List<SubRequest> requests) {
    return new BatchResult(send(requests));
  }

  /** Builder for {@link BatchClient}. */
  public static final class Builder {

    private final String batchUrl;
    private @Nullable BatchTransport transport;
    private Map<String, String> commonHeaders = Map.of();
    private @Nullable Duration timeout = DEFAULT_TIMEOUT;
    private BatchEncoder encoder = new BatchEncoder();

    /**
     * Creates a builder for the given batch endpoint.
     *
     * @param batchUrl the URL that accepts batch requests
     */
    public Builder(String batchUrl) {
      this.batchUrl = Objects.requireNonNull(batchUrl, "batchUrl");
    }

    /** Sets the transport implementation. Required before calling {@link #build()}. */
    public Builder transport(BatchTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /**
     * Sets headers sent on the outer request and merged into every sub-request. A sub-request's
     * own header of the same name takes precedence.
     */
    public Builder commonHeaders(Map<String, String> commonHeaders) {
      Objects.requireNonNull(commonHeaders, "commonHeaders");
      commonHeaders.forEach(SubRequest::validateHeader);
      this.commonHeaders = commonHeaders;
      return this;
    }

    /** Sets the outer request timeout. {@code null} disables the timeout. Defaults to 10s. */
    public Builder timeout(@Nullable Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /** Sets the multipart boundary. Defaults to {@link BatchEncoder#BOUNDARY}. */
    public Builder boundary(String boundary) {
      this.encoder = new BatchEncoder(boundary);
      return this;
    }

    /** Builds the client. */
    public BatchClient build() {
      return new BatchClient(this);
    }
  }
}
