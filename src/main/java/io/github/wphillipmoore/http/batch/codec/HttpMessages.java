package io.github.wphillipmoore.http.batch.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * HTTP/1.1 message grammar shared by the batch encoder and decoder.
 *
 * <p>Writes request messages and MIME header blocks with CRLF line endings, and reads them back as
 * start line, header block, blank line and body. Reading tolerates bare LF line endings and folded
 * header lines. Parsed header names are lower-cased; repeated headers are joined with {@code ", "}
 * per RFC 9110 section 5.3.
 */
public final class HttpMessages {

  /** Line terminator used for every line written. */
  public static final String CRLF = "\r\n";

  private static final Pattern STATUS_LINE =
      Pattern.compile("HTTP/\\d(?:\\.\\d)? (\\d{3})(?: .*)?");
  private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

  private HttpMessages() {}

  /**
   * A parsed HTTP message or MIME entity.
   *
   * @param startLine the request or status line, or the empty string for a MIME entity
   * @param headers header values keyed by lower-cased name, in order of appearance
   * @param body everything after the blank line that ends the header block
   */
  public record Message(String startLine, Map<String, String> headers, String body) {

    /** Validates non-null fields. */
    public Message {
      Objects.requireNonNull(startLine, "startLine");
      Objects.requireNonNull(headers, "headers");
      Objects.requireNonNull(body, "body");
    }

    /**
     * Returns the value of the named header.
     *
     * @param name the header name, in any case
     * @return the header value, or {@code null} if absent
     */
    public @Nullable String header(String name) {
      return headers.get(name.toLowerCase(Locale.ROOT));
    }
  }

  /**
   * Returns an HTTP/1.1 request line without its line terminator.
   *
   * @param method the request method
   * @param target the request target
   * @return the request line
   */
  public static String requestLine(String method, String target) {
    return method + " " + target + " HTTP/1.1";
  }

  /**
   * Appends one {@code name: value} line per header, followed by CRLF.
   *
   * @param target the builder to append to
   * @param headers headers written in iteration order
   */
  public static void appendHeaders(StringBuilder target, Map<String, String> headers) {
    headers.forEach((name, value) -> target.append(name).append(": ").append(value).append(CRLF));
  }

  /** Returns the number of bytes {@code text} occupies when encoded as UTF-8. */
  public static int byteLength(String text) {
    return text.getBytes(StandardCharsets.UTF_8).length;
  }

  /**
   * Parses a message that begins with a start line.
   *
   * @param text the raw message
   * @return the parsed message
   * @throws IllegalArgumentException if the start line is missing or a header line is malformed
   */
  public static Message parseMessage(String text) {
    String[] head = splitHead(text);
    String[] lines = LINE_BREAK.split(head[0], -1);
    String startLine = lines[0].trim();
    if (startLine.isEmpty()) {
      throw new IllegalArgumentException("HTTP message has no start line");
    }
    Map<String, String> headers = parseHeaderLines(Arrays.copyOfRange(lines, 1, lines.length));
    return new Message(startLine, headers, head[1]);
  }

  /**
   * Parses a MIME entity: a header block, a blank line and a body, without a start line.
   *
   * @param text the raw entity
   * @return the parsed entity with an empty start line
   * @throws IllegalArgumentException if a header line is malformed
   */
  public static Message parseEntity(String text) {
    String[] head = splitHead(text);
    String[] lines = head[0].isEmpty() ? new String[0] : LINE_BREAK.split(head[0], -1);
    return new Message("", parseHeaderLines(lines), head[1]);
  }

  /**
   * Extracts the status code from an HTTP status line such as {@code HTTP/1.1 404 Not Found}.
   *
   * @param statusLine the status line
   * @return the numeric status code
   * @throws IllegalArgumentException if the line is not a status line
   */
  public static int parseStatusCode(String statusLine) {
    Matcher matcher = STATUS_LINE.matcher(statusLine);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid HTTP status line: " + statusLine);
    }
    return Integer.parseInt(matcher.group(1));
  }

  /**
   * Returns the body cut to the byte count declared by {@code Content-Length}, when the header is
   * present and the body is at least that long. Otherwise returns the body unchanged.
   *
   * @param message the parsed message
   * @return the framed body
   */
  public static String framedBody(Message message) {
    String declared = message.header("Content-Length");
    if (declared == null) {
      return message.body();
    }
    int length;
    try {
      length = Integer.parseInt(declared.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid Content-Length: " + declared, e);
    }
    byte[] bytes = message.body().getBytes(StandardCharsets.UTF_8);
    if (length < 0 || length >= bytes.length) {
      return message.body();
    }
    return new String(bytes, 0, length, StandardCharsets.UTF_8);
  }

  /** Splits the text at the first blank line into head and body. */
  private static String[] splitHead(String text) {
    if (text.startsWith(CRLF)) {
      return new String[] {"", text.substring(2)};
    }
    if (text.startsWith("\n")) {
      return new String[] {"", text.substring(1)};
    }
    int crlf = text.indexOf("\r\n\r\n");
    int lf = text.indexOf("\n\n");
    if (crlf >= 0 && (lf < 0 || crlf < lf)) {
      return new String[] {text.substring(0, crlf), text.substring(crlf + 4)};
    }
    if (lf >= 0) {
      return new String[] {text.substring(0, lf), text.substring(lf + 2)};
    }
    // Head only, no body.
    return new String[] {stripTrailingLineBreak(text), ""};
  }

  private static Map<String, String> parseHeaderLines(String[] lines) {
    Map<String, String> headers = new LinkedHashMap<>();
    String previous = null;
    for (String line : lines) {
      if (line.isEmpty()) {
        continue;
      }
      if (previous != null && (line.charAt(0) == ' ' || line.charAt(0) == '\t')) {
        headers.put(previous, headers.get(previous) + " " + line.trim());
        continue;
      }
      int colon = line.indexOf(':');
      if (colon <= 0) {
        throw new IllegalArgumentException("Invalid header line: " + line);
      }
      String name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
      if (name.isEmpty()) {
        throw new IllegalArgumentException("Invalid header line: " + line);
      }
      String value = line.substring(colon + 1).trim();
      headers.merge(name, value, (first, second) -> first + ", " + second);
      previous = name;
    }
    return headers;
  }

  private static String stripTrailingLineBreak(String text) {
    if (text.endsWith(CRLF)) {
      return text.substring(0, text.length() - 2);
    }
    if (text.endsWith("\n")) {
      return text.substring(0, text.length() - 1);
    }
    return text;
  }
}
