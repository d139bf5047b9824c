package io.github.wphillipmoore.http.batch.codec;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.google.gson.ToNumberPolicy;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import io.github.wphillipmoore.http.batch.SubResponse;
import io.github.wphillipmoore.http.batch.TransportResponse;
import io.github.wphillipmoore.http.batch.exception.BatchResponseException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes a {@code multipart/mixed} batch response into one {@link SubResponse} per part.
 *
 * <p>Decoding runs in two passes: {@link MultipartParser} splits the outer body on the boundary
 * announced by the response's {@code Content-Type}, then {@link HttpMessages} parses the MIME
 * headers of each part and the raw HTTP/1.1 response it carries.
 *
 * <p>When the {@code content-id} values of the parts (such as {@code 2}, {@code <2>} or {@code
 * response-2}) number them exactly {@code 1..n}, results are ordered by them; otherwise they keep
 * the order in which the parts appear. A part body is parsed as JSON only when its content type
 * denotes JSON, and a body that fails to parse simply yields {@code data == null}. JSON integers
 * decode as {@link Long}, other numbers as {@link Double}.
 *
 * <p>Any structural problem fails the whole batch with a {@link BatchResponseException} that
 * carries the outer response.
 */
public final class BatchDecoder {

  private static final Logger log = LoggerFactory.getLogger(BatchDecoder.class);

  private static final Pattern CONTENT_ID = Pattern.compile("(\\d{1,9})\\s*>?\\s*$");
  private static final TypeAdapter<Object> JSON_ADAPTER =
      new GsonBuilder()
          .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
          .create()
          .getAdapter(Object.class);

  /** A decoded part and the correlation id it carried, if any. */
  private record DecodedPart(@Nullable Integer contentId, SubResponse response) {}

  /**
   * Decodes the outer batch response.
   *
   * @param response the outer response returned by the transport
   * @return the sub-responses, in submission order
   * @throws BatchResponseException if the response is not a successful, well-formed multipart
   *     response
   */
  public List<SubResponse> decode(TransportResponse response) {
    Objects.requireNonNull(response, "response");
    if (!response.isSuccess()) {
      throw new BatchResponseException(
          "Batch request failed with HTTP status " + response.statusCode(), response);
    }
    String contentType = response.contentType();
    String boundary = contentType != null ? MultipartParser.boundaryOf(contentType) : null;
    if (boundary == null) {
      throw new BatchResponseException(
          "Expected a multipart/mixed response with a boundary but got Content-Type: "
              + contentType,
          response);
    }

    List<String> parts;
    try {
      parts = MultipartParser.split(response.body(), boundary);
    } catch (IllegalArgumentException e) {
      throw new BatchResponseException(
          "Malformed multipart response: " + e.getMessage(), response, e);
    }

    List<DecodedPart> decoded = new ArrayList<>(parts.size());
    for (int i = 0; i < parts.size(); i++) {
      decoded.add(decodePart(parts.get(i), i, response));
    }
    log.debug("Decoded {} parts from batch response with boundary {}", decoded.size(), boundary);
    return inSubmissionOrder(decoded);
  }

  private static DecodedPart decodePart(String part, int index, TransportResponse outer) {
    try {
      HttpMessages.Message entity = HttpMessages.parseEntity(part);
      HttpMessages.Message message = HttpMessages.parseMessage(entity.body());
      int status = HttpMessages.parseStatusCode(message.startLine());
      String text = HttpMessages.framedBody(message);
      Object data = isJsonContentType(message.header("Content-Type")) ? parseJson(text) : null;
      Integer contentId = parseContentId(entity.header("Content-ID"));
      return new DecodedPart(contentId, new SubResponse(status, message.headers(), text, data));
    } catch (IllegalArgumentException e) {
      throw new BatchResponseException(
          "Malformed HTTP message in batch part " + (index + 1) + ": " + e.getMessage(), outer, e);
    }
  }

  private static List<SubResponse> inSubmissionOrder(List<DecodedPart> decoded) {
    SubResponse[] ordered = new SubResponse[decoded.size()];
    for (DecodedPart part : decoded) {
      Integer contentId = part.contentId();
      if (contentId == null
          || contentId < 1
          || contentId > ordered.length
          || ordered[contentId - 1] != null) {
        log.debug("Content-ids do not number parts 1..{}; keeping response order", ordered.length);
        return decoded.stream().map(DecodedPart::response).toList();
      }
      ordered[contentId - 1] = part.response();
    }
    return List.of(ordered);
  }

  /**
   * Extracts the correlation index from a {@code content-id} value.
   *
   * @param contentId the header value, or {@code null}
   * @return the trailing integer, or {@code null} if there is none
   */
  static @Nullable Integer parseContentId(@Nullable String contentId) {
    if (contentId == null) {
      return null;
    }
    Matcher matcher = CONTENT_ID.matcher(contentId.trim());
    return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
  }

  static boolean isJsonContentType(@Nullable String contentType) {
    if (contentType == null) {
      return false;
    }
    int semicolon = contentType.indexOf(';');
    String mediaType =
        (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType)
            .trim()
            .toLowerCase(Locale.ROOT);
    return "application/json".equals(mediaType) || mediaType.endsWith("+json");
  }

  /**
   * Parses a body as strict JSON.
   *
   * @param text the body text
   * @return the parsed value, or {@code null} if the text is empty or not valid JSON
   */
  static @Nullable Object parseJson(String text) {
    if (text.isBlank()) {
      return null;
    }
    try (JsonReader reader = new JsonReader(new StringReader(text))) {
      reader.setStrictness(Strictness.STRICT);
      Object value = JSON_ADAPTER.read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        return null;
      }
      return value;
    } catch (IOException | JsonParseException | IllegalStateException | NumberFormatException e) {
      log.debug("Batch part declared JSON but the body did not parse: {}", e.getMessage());
      return null;
    }
  }
}
