package io.attestgate.sdk;

import io.attestgate.sdk.sfv.BareItem;
import io.attestgate.sdk.sfv.StructuredDictionary;
import io.attestgate.sdk.sfv.StructuredFieldException;
import io.attestgate.sdk.sfv.StructuredFieldParser;
import io.attestgate.sdk.sfv.StructuredItem;

import java.security.MessageDigest;
import java.util.Base64;
import java.util.List;
import java.util.Map;

public final class ContentDigestVerifier {
  private ContentDigestVerifier() {}

  public static Failure verify(HttpRequestMessage request) {
    List<String> values = request.headerValues("content-digest");
    if (values.isEmpty()) {
      return null;
    }

    StructuredDictionary digests;
    try {
      digests = StructuredFieldParser.parseDictionary(CanonicalMessageBuilder.combine(values));
    } catch (StructuredFieldException e) {
      return Failure.of(FailureKind.MALFORMED_HEADER, "Failed to parse content-digest header: " + e.getMessage());
    }
    if (digests.isEmpty()) {
      return Failure.of(FailureKind.MALFORMED_HEADER, "Content-Digest header has no entries");
    }

    byte[] body = request.body();
    for (Map.Entry<String, StructuredItem> entry : digests.asMap().entrySet()) {
      String algorithm = entry.getKey();
      if (!ContentDigests.isSupported(algorithm)) {
        return Failure.of(FailureKind.DIGEST_MISMATCH, "Unsupported content-digest algorithm '" + algorithm + "'");
      }
      byte[] declared = declaredDigest(entry.getValue());
      if (declared == null) {
        return Failure.of(FailureKind.MALFORMED_HEADER,
            "Content-Digest entry '" + algorithm + "' is not a byte sequence or base64 string");
      }
      if (!MessageDigest.isEqual(declared, ContentDigests.digest(algorithm, body))) {
        return Failure.of(FailureKind.DIGEST_MISMATCH, "Content digest verification failed for algorithm '" + algorithm + "'");
      }
    }
    return null;
  }

  private static byte[] declaredDigest(StructuredItem member) {
    if (member.isInnerList()) {
      return null;
    }
    BareItem value = member.bareItem();
    if (value.isByteSequence()) {
      return value.bytesValue();
    }
    if (!value.isString()) {
      return null;
    }
    String text = value.stringValue();
    if (text.length() >= 2 && text.startsWith(":") && text.endsWith(":")) {
      text = text.substring(1, text.length() - 1);
    }
    try {
      return Base64.getDecoder().decode(text);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
