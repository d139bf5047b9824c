package io.github.wphillipmoore.http.batch.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Encoded outer request: the multipart body and the content type that announces its boundary.
 *
 * <p>The body array is copied on the way in and on the way out, so instances are immutable and
 * compare by content.
 *
 * @param body the encoded multipart body
 * @param contentType the {@code multipart/mixed} content type including the boundary
 */
public record EncodedBatch(byte[] body, String contentType) {

  /** Validates non-null fields and defensively copies the body. */
  public EncodedBatch {
    body = Objects.requireNonNull(body, "body").clone();
    Objects.requireNonNull(contentType, "contentType");
  }

  /** Returns a copy of the encoded body. */
  @Override
  public byte[] body() {
    return body.clone();
  }

  /** Returns the encoded body decoded as UTF-8 text. */
  public String bodyText() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof EncodedBatch that
        && Arrays.equals(body, that.body)
        && contentType.equals(that.contentType);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(body) + contentType.hashCode();
  }

  @Override
  public String toString() {
    return "EncodedBatch[contentType=" + contentType + ", length=" + body.length + "]";
  }
}
