package io.github.wphillipmoore.http.batch.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Splits a {@code multipart/mixed} body into its raw parts (RFC 2046 section 5.1).
 *
 * <p>The preamble before the first delimiter and the epilogue after the close delimiter are
 * discarded. The line break that precedes a delimiter belongs to the delimiter, so part content
 * never ends with it. Whitespace padding after a delimiter is ignored.
 */
public final class MultipartParser {

  private static final Pattern BOUNDARY_PARAM =
      Pattern.compile(";\\s*boundary\\s*=\\s*(?:\"([^\"]*)\"|([^;\\s]+))", Pattern.CASE_INSENSITIVE);

  private MultipartParser() {}

  /**
   * Returns the boundary parameter of a {@code multipart/mixed} content type.
   *
   * @param contentType the {@code Content-Type} header value
   * @return the boundary, or {@code null} if the media type is not {@code multipart/mixed} or has
   *     no usable boundary
   */
  public static @Nullable String boundaryOf(String contentType) {
    int semicolon = contentType.indexOf(';');
    String mediaType = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
    if (!"multipart/mixed".equals(mediaType.trim().toLowerCase(Locale.ROOT))) {
      return null;
    }
    Matcher matcher = BOUNDARY_PARAM.matcher(contentType);
    if (!matcher.find()) {
      return null;
    }
    String boundary = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
    return boundary.isEmpty() ? null : boundary;
  }

  /**
   * Splits a multipart body on the given boundary.
   *
   * @param body the multipart body
   * @param boundary the boundary, without the leading dashes
   * @return the content of each part, in order of appearance
   * @throws IllegalArgumentException if the first or the close delimiter is missing
   */
  public static List<String> split(String body, String boundary) {
    String delimiter = "--" + boundary;
    int start = findDelimiter(body, delimiter, 0);
    if (start < 0) {
      throw new IllegalArgumentException("Multipart body does not contain boundary " + boundary);
    }
    List<String> parts = new ArrayList<>();
    int cursor = start + delimiter.length();
    while (!body.startsWith("--", cursor)) {
      int contentStart = skipLineEnd(body, cursor);
      int next = findDelimiter(body, delimiter, contentStart);
      if (next < 0) {
        throw new IllegalArgumentException("Multipart body is missing its close delimiter");
      }
      parts.add(body.substring(contentStart, Math.max(contentStart, contentEnd(body, next))));
      cursor = next + delimiter.length();
    }
    return parts;
  }

  /** Finds a delimiter that starts a line, at or after {@code from}. */
  private static int findDelimiter(String body, String delimiter, int from) {
    int index = body.indexOf(delimiter, from);
    while (index >= 0) {
      boolean lineStart = index == 0 || body.charAt(index - 1) == '\n';
      if (lineStart && endsDelimiter(body, index + delimiter.length())) {
        return index;
      }
      index = body.indexOf(delimiter, index + 1);
    }
    return -1;
  }

  private static boolean endsDelimiter(String body, int index) {
    if (index >= body.length()) {
      return true;
    }
    char next = body.charAt(index);
    return next == '-' || next == ' ' || next == '\t' || next == '\r' || next == '\n';
  }

  /** Returns the index of the line break that precedes the delimiter at {@code delimiterStart}. */
  private static int contentEnd(String body, int delimiterStart) {
    int end = delimiterStart - 1;
    if (end > 0 && body.charAt(end - 1) == '\r') {
      end--;
    }
    return end;
  }

  private static int skipLineEnd(String body, int from) {
    int index = from;
    while (index < body.length() && (body.charAt(index) == ' ' || body.charAt(index) == '\t')) {
      index++;
    }
    if (body.startsWith("\r\n", index)) {
      return index + 2;
    }
    if (body.startsWith("\n", index)) {
      return index + 1;
    }
    throw new IllegalArgumentException("Multipart delimiter is not followed by a line break");
  }
}
