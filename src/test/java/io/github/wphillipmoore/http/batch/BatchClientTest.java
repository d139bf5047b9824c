package io.github.wphillipmoore.http.batch;

import static io.github.wphillipmoore.http.batch.MultipartResponses.jsonPart;
import static io.github.wphillipmoore.http.batch.MultipartResponses.response;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.github.wphillipmoore.http.batch.codec.BatchEncoder;
import io.github.wphillipmoore.http.batch.codec.HttpMessages;
import io.github.wphillipmoore.http.batch.codec.MultipartParser;
import io.github.wphillipmoore.http.batch.exception.BatchResponseException;
import io.github.wphillipmoore.http.batch.exception.BatchTimeoutException;
import io.github.wphillipmoore.http.batch.exception.BatchTransportException;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BatchClientTest {

  private static final String BATCH_URL = "https://batch.url";
  private static final String URL = "https://example.com";

  @Mock private BatchTransport transport;

  private BatchClient.Builder builder() {
    return new BatchClient.Builder(BATCH_URL).transport(transport);
  }

  private static List<SubRequest> threeRequests() {
    return List.of(
        new SubRequest(URL, Map.of("foo", 1)),
        new SubRequest(URL, Map.of("foo", 2)),
        new SubRequest(URL, Map.of("foo", 3)));
  }

  private void stubResponse(TransportResponse response) {
    when(transport.post(anyString(), any(byte[].class), anyMap(), any())).thenReturn(response);
  }

  @Nested
  class BuilderValidation {

    @Test
    void buildSucceedsWithDefaults() {
      BatchClient client = builder().build();

      assertThat(client.getBatchUrl()).isEqualTo(BATCH_URL);
      assertThat(client.getTimeout()).isEqualTo(Duration.ofSeconds(10));
      assertThat(client.getCommonHeaders()).isEmpty();
    }

    @Test
    void builderNullBatchUrlThrowsNullPointerException() {
      assertThatThrownBy(() -> new BatchClient.Builder(null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("batchUrl");
    }

    @Test
    void buildWithoutTransportThrowsNullPointerException() {
      assertThatThrownBy(() -> new BatchClient.Builder(BATCH_URL).build())
          .isInstanceOf(NullPointerException.class)
          .hasMessage("transport");
    }

    @Test
    void customTimeoutAndNullTimeout() {
      assertThat(builder().timeout(Duration.ofSeconds(3)).build().getTimeout())
          .isEqualTo(Duration.ofSeconds(3));
      assertThat(builder().timeout(null).build().getTimeout()).isNull();
    }

    @Test
    void invalidCommonHeaderIsRejected() {
      assertThatThrownBy(() -> builder().commonHeaders(Map.of("X-A", "1\n2")))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  class Send {

    @Test
    void singleRequestRoundTrip() {
      stubResponse(response(jsonPart(1, 200, "{\"success\":true}")));

      List<SubResponse> responses =
          builder().build().send(List.of(new SubRequest(URL, Map.of("foo", 1))));

      assertThat(responses).hasSize(1);
      assertThat(responses.get(0).status()).isEqualTo(200);
      assertThat(responses.get(0).data()).isEqualTo(Map.of("success", true));
      verify(transport, times(1)).post(eq(BATCH_URL), any(byte[].class), anyMap(), any());
    }

    @Test
    void sendsOneEncodedRequestWithMultipartHeaders() {
      stubResponse(
          response(jsonPart(1, 200, "{}"), jsonPart(2, 200, "{}"), jsonPart(3, 200, "{}")));
      BatchClient client =
          builder()
              .commonHeaders(Map.of("Authorization", "Bearer token"))
              .timeout(Duration.ofSeconds(7))
              .build();

      client.send(threeRequests());

      ArgumentCaptor<byte[]> bodyCaptor = ArgumentCaptor.forClass(byte[].class);
      @SuppressWarnings("unchecked")
      ArgumentCaptor<Map<String, String>> headersCaptor = ArgumentCaptor.forClass(Map.class);
      verify(transport)
          .post(
              eq(BATCH_URL),
              bodyCaptor.capture(),
              headersCaptor.capture(),
              eq(Duration.ofSeconds(7)));

      assertThat(headersCaptor.getValue())
          .containsEntry("Content-Type", "multipart/mixed; boundary=" + BatchEncoder.BOUNDARY)
          .containsEntry("Authorization", "Bearer token");

      String body = new String(bodyCaptor.getValue(), StandardCharsets.UTF_8);
      List<String> parts = MultipartParser.split(body, BatchEncoder.BOUNDARY);
      assertThat(parts).hasSize(3);
      for (int i = 0; i < parts.size(); i++) {
        HttpMessages.Message part = HttpMessages.parseEntity(parts.get(i));
        HttpMessages.Message inner = HttpMessages.parseMessage(part.body());
        assertThat(part.header("content-id")).isEqualTo(String.valueOf(i + 1));
        assertThat(inner.startLine()).isEqualTo("POST https://example.com HTTP/1.1");
        assertThat(inner.header("Authorization")).isEqualTo("Bearer token");
        assertThat(inner.body()).isEqualTo("{\"foo\":" + (i + 1) + "}");
      }
    }

    @Test
    void preservesSubmissionOrder() {
      stubResponse(
          response(
              jsonPart(2, 200, "{\"foo\":2}"),
              jsonPart(3, 200, "{\"foo\":3}"),
              jsonPart(1, 200, "{\"foo\":1}")));

      List<SubResponse> responses = builder().build().send(threeRequests());

      assertThat(responses)
          .extracting(sub -> (Object) ((Map<?, ?>) sub.data()).get("foo"))
          .containsExactly(1L, 2L, 3L);
    }

    @Test
    void mixedOutcomesResolve() {
      stubResponse(
          response(
              jsonPart(1, 200, "{\"name\":\"a\"}"),
              jsonPart(2, 200, "{\"name\":\"b\"}"),
              jsonPart(3, 500, "{\"error\":{\"code\":500}}")));

      BatchResult result = builder().build().execute(threeRequests());

      assertThat(result.responses()).extracting(SubResponse::status).containsExactly(200, 200, 500);
      assertThat(result.successCount()).isEqualTo(2);
      assertThat(result.failureCount()).isEqualTo(1);
    }

    @Test
    void subRequestHeadersOverrideCommonHeaders() {
      stubResponse(response(jsonPart(1, 200, "{}")));
      BatchClient client = builder().commonHeaders(Map.of("X-Custom-Header", "value")).build();

      client.send(
          List.of(new SubRequest(URL, Map.of(), Map.of("X-Custom-Header", "overwrite"))));

      ArgumentCaptor<byte[]> bodyCaptor = ArgumentCaptor.forClass(byte[].class);
      verify(transport).post(anyString(), bodyCaptor.capture(), anyMap(), any());
      assertThat(new String(bodyCaptor.getValue(), StandardCharsets.UTF_8))
          .contains("X-Custom-Header: overwrite\r\n");
    }

    @Test
    void multipartContentTypeReplacesCommonContentTypeIgnoringCase() {
      stubResponse(response(jsonPart(1, 200, "{}")));
      BatchClient client =
          builder().commonHeaders(Map.of("content-type", "application/json", "X-A", "1")).build();

      client.send(List.of(new SubRequest(URL, Map.of())));

      @SuppressWarnings("unchecked")
      ArgumentCaptor<Map<String, String>> headersCaptor = ArgumentCaptor.forClass(Map.class);
      verify(transport).post(anyString(), any(byte[].class), headersCaptor.capture(), any());
      assertThat(headersCaptor.getValue())
          .hasSize(2)
          .containsEntry("Content-Type", "multipart/mixed; boundary=" + BatchEncoder.BOUNDARY)
          .containsEntry("X-A", "1")
          .doesNotContainKey("content-type");
    }

    @Test
    void emptyBatchIsRejectedWithoutCallingTransport() {
      BatchClient client = builder().build();

      assertThatThrownBy(() -> client.send(List.of()))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("requests must not be empty");
      verifyNoInteractions(transport);
    }
  }

  @Nested
  class BatchFailures {

    @Test
    void errorStatusRejectsWithOuterResponse() {
      stubResponse(new TransportResponse(500, "{\"error\":\"test\"}", Map.of()));

      assertThatThrownBy(() -> builder().build().send(threeRequests()))
          .isInstanceOf(BatchResponseException.class)
          .hasMessageContaining("Raw server response: \"{\"error\":\"test\"}\"")
          .satisfies(
              thrown -> {
                BatchResponseException ex = (BatchResponseException) thrown;
                assertThat(ex.getStatusCode()).isEqualTo(500);
                assertThat(ex.getResponseText()).isEqualTo("{\"error\":\"test\"}");
              });
    }

    @Test
    void transportExceptionPropagatesUnchanged() {
      BatchTransportException failure =
          new BatchTransportException("HTTP request failed", BATCH_URL, new IOException("reset"));
      when(transport.post(anyString(), any(byte[].class), anyMap(), any())).thenThrow(failure);

      assertThatThrownBy(() -> builder().build().send(threeRequests())).isSameAs(failure);
    }

    @Test
    void timeoutPropagatesUnchanged() {
      BatchTimeoutException failure =
          new BatchTimeoutException(
              "HTTP request timed out",
              BATCH_URL,
              Duration.ofSeconds(10),
              new HttpTimeoutException("timed out"));
      when(transport.post(anyString(), any(byte[].class), anyMap(), any())).thenThrow(failure);

      assertThatThrownBy(() -> builder().build().send(threeRequests())).isSameAs(failure);
    }

    @Test
    void nonMultipartSuccessRejects() {
      stubResponse(new TransportResponse(200, "{}", Map.of("Content-Type", "application/json")));

      assertThatThrownBy(() -> builder().build().send(threeRequests()))
          .isInstanceOf(BatchResponseException.class);
    }

    @Test
    void partCountMismatchRejects() {
      stubResponse(response(jsonPart(1, 200, "{}"), jsonPart(2, 200, "{}")));

      assertThatThrownBy(() -> builder().build().send(threeRequests()))
          .isInstanceOf(BatchResponseException.class)
          .hasMessage("Expected 3 parts in batch response but got 2");
    }
  }
}
