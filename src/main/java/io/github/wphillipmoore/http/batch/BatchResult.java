package io.github.wphillipmoore.http.batch;

import java.util.List;
import java.util.Objects;

/**
 * Ordered outcome of one batch with per-item success counts.
 *
 * <p>{@code responses.get(i)} answers the {@code i}-th submitted {@link SubRequest}.
 *
 * @param responses the sub-responses in submission order, never null, unmodifiable
 */
public record BatchResult(List<SubResponse> responses) {

  /** Validates and defensively copies the responses. */
  public BatchResult {
    responses = List.copyOf(Objects.requireNonNull(responses, "responses"));
  }

  /** Returns the number of sub-responses with a 2xx status. */
  public int successCount() {
    int count = 0;
    for (SubResponse response : responses) {
      if (response.isSuccess()) {
        count++;
      }
    }
    return count;
  }

  /** Returns the number of sub-responses with a non-2xx status. */
  public int failureCount() {
    return responses.size() - successCount();
  }

  /** Returns the number of sub-responses. */
  public int size() {
    return responses.size();
  }
}
