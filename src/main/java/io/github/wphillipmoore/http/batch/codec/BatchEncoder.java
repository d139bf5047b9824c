package io.github.wphillipmoore.http.batch.codec;

import static io.github.wphillipmoore.http.batch.codec.HttpMessages.CRLF;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.github.wphillipmoore.http.batch.SubRequest;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Encodes an ordered list of {@link SubRequest}s into one {@code multipart/mixed} request body.
 *
 * <p>Each sub-request becomes one {@code application/http} part holding a raw {@code POST} HTTP/1.1
 * message with a JSON body. Parts carry {@code content-id: n}, where {@code n} is the 1-based
 * submission index, so responses can be correlated with their requests:
 *
 * <pre>{@code
 * --__END_OF_PART__
 * Content-Length: 120
 * Content-Type: application/http
 * content-id: 1
 * content-transfer-encoding: binary
 *
 * POST https://example.com/v1/send HTTP/1.1
 * Content-Length: 9
 * Content-Type: application/json; charset=UTF-8
 *
 * {"foo":1}
 * --__END_OF_PART__--
 * }</pre>
 *
 * <p>Every {@code Content-Length} is a UTF-8 byte count. The boundary is fixed rather than random,
 * which assumes it never occurs inside a serialized JSON body. Encoding is deterministic and the
 * encoder holds no mutable state.
 */
public final class BatchEncoder {

  /** Default multipart boundary shared with batch servers. */
  public static final String BOUNDARY = "__END_OF_PART__";

  static final String JSON_CONTENT_TYPE = "application/json; charset=UTF-8";
  static final String PART_CONTENT_TYPE = "application/http";

  // RFC 2046 bchars, at most 70 characters, not ending in a space.
  private static final Pattern VALID_BOUNDARY =
      Pattern.compile("[0-9A-Za-z'()+_,\\-./:=? ]{0,69}[0-9A-Za-z'()+_,\\-./:=?]");
  private static final Pattern TOKEN = Pattern.compile("[0-9A-Za-z'+_\\-.]+");

  private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

  private final String boundary;

  /** Creates an encoder using {@link #BOUNDARY}. */
  public BatchEncoder() {
    this(BOUNDARY);
  }

  /**
   * Creates an encoder with a custom boundary.
   *
   * @param boundary the multipart boundary
   * @throws IllegalArgumentException if the boundary is not a valid RFC 2046 boundary
   */
  public BatchEncoder(String boundary) {
    Objects.requireNonNull(boundary, "boundary");
    if (!VALID_BOUNDARY.matcher(boundary).matches()) {
      throw new IllegalArgumentException("Invalid multipart boundary: " + boundary);
    }
    this.boundary = boundary;
  }

  /** Returns the multipart boundary. */
  public String getBoundary() {
    return boundary;
  }

  /** Returns the {@code multipart/mixed} content type announcing this encoder's boundary. */
  public String contentType() {
    String parameter = TOKEN.matcher(boundary).matches() ? boundary : "\"" + boundary + "\"";
    return "multipart/mixed; boundary=" + parameter;
  }

  /**
   * Encodes the sub-requests into a multipart body.
   *
   * @param requests the sub-requests, in submission order
   * @param commonHeaders headers added to every embedded request; a sub-request's own header with
   *     the same name takes precedence
   * @return the encoded body and its content type
   * @throws IllegalArgumentException if {@code requests} is empty or a common header is invalid
   */
  public EncodedBatch encode(List<SubRequest> requests, Map<String, String> commonHeaders) {
    Objects.requireNonNull(requests, "requests");
    Objects.requireNonNull(commonHeaders, "commonHeaders");
    if (requests.isEmpty()) {
      throw new IllegalArgumentException("requests must not be empty");
    }
    commonHeaders.forEach(SubRequest::validateHeader);

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (int i = 0; i < requests.size(); i++) {
      SubRequest request = Objects.requireNonNull(requests.get(i), "request");
      writePart(out, serializeRequest(request, commonHeaders), i + 1);
    }
    out.writeBytes(("--" + boundary + "--" + CRLF).getBytes(StandardCharsets.UTF_8));
    return new EncodedBatch(out.toByteArray(), contentType());
  }

  /**
   * Serializes one sub-request as a raw HTTP/1.1 request message.
   *
   * @param request the sub-request
   * @param commonHeaders headers shared by all sub-requests
   * @return the request message
   */
  static String serializeRequest(SubRequest request, Map<String, String> commonHeaders) {
    String json = GSON.toJson(request.body());
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Length", String.valueOf(HttpMessages.byteLength(json)));
    headers.put("Content-Type", JSON_CONTENT_TYPE);
    Map<String, String> merged = mergeHeaders(commonHeaders, request.headers());
    StringBuilder message = new StringBuilder();
    message.append(HttpMessages.requestLine("POST", request.url())).append(CRLF);
    HttpMessages.appendHeaders(message, headers);
    HttpMessages.appendHeaders(message, merged);
    message.append(CRLF).append(json);
    return message.toString();
  }

  /**
   * Merges common headers with a sub-request's own headers. Names compare case-insensitively; an
   * overriding header keeps the position of the common header it replaces.
   *
   * @param commonHeaders headers shared by all sub-requests
   * @param ownHeaders the sub-request's headers
   * @return the merged headers in write order
   */
  public static Map<String, String> mergeHeaders(
      Map<String, String> commonHeaders, Map<String, String> ownHeaders) {
    Map<String, String[]> byLowerName = new LinkedHashMap<>();
    commonHeaders.forEach(
        (name, value) -> byLowerName.put(name.toLowerCase(Locale.ROOT), new String[] {name, value}));
    ownHeaders.forEach(
        (name, value) -> byLowerName.put(name.toLowerCase(Locale.ROOT), new String[] {name, value}));
    Map<String, String> merged = new LinkedHashMap<>();
    byLowerName.values().forEach(header -> merged.put(header[0], header[1]));
    return merged;
  }

  private void writePart(ByteArrayOutputStream out, String message, int contentId) {
    byte[] messageBytes = message.getBytes(StandardCharsets.UTF_8);
    StringBuilder head = new StringBuilder();
    head.append("--").append(boundary).append(CRLF);
    Map<String, String> partHeaders = new LinkedHashMap<>();
    partHeaders.put("Content-Length", String.valueOf(messageBytes.length));
    partHeaders.put("Content-Type", PART_CONTENT_TYPE);
    partHeaders.put("content-id", String.valueOf(contentId));
    partHeaders.put("content-transfer-encoding", "binary");
    HttpMessages.appendHeaders(head, partHeaders);
    head.append(CRLF);
    out.writeBytes(head.toString().getBytes(StandardCharsets.UTF_8));
    out.writeBytes(messageBytes);
    out.writeBytes(CRLF.getBytes(StandardCharsets.UTF_8));
  }
}
