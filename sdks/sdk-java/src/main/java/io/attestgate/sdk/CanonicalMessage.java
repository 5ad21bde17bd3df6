package io.attestgate.sdk;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * The signature base: one line per covered component followed by the {@code @signature-params}
 * line, joined by '\n' without a trailing newline.
 */
public final class CanonicalMessage {
  private final String text;
  private final String signatureParams;

  CanonicalMessage(String text, String signatureParams) {
    this.text = Objects.requireNonNull(text, "text");
    this.signatureParams = Objects.requireNonNull(signatureParams, "signatureParams");
  }

  public String text() {
    return text;
  }

  /**
   * The serialized inner list that also forms the value of the Signature-Input entry.
   */
  public String signatureParams() {
    return signatureParams;
  }

  public byte[] bytes() {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CanonicalMessage && ((CanonicalMessage) other).text.equals(text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
