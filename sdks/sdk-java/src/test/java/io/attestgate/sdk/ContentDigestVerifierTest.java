package io.attestgate.sdk;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentDigestVerifierTest {
  private static final byte[] BODY = "{\"hello\":\"world\"}".getBytes(StandardCharsets.UTF_8);
  private static final String SHA_256_OF_BODY = "k6I5cakU5erL8KjSUVTNownDwccvu5kU1Hxg88toFYg=";

  private static HttpRequestMessage post(byte[] body, String contentDigest) {
    HttpRequestMessage.Builder builder = HttpRequestMessage.fromUrl("POST", "https://api.example.com/echo").body(body);
    if (contentDigest != null) {
      builder.header("Content-Digest", contentDigest);
    }
    return builder.build();
  }

  @Test
  void headerMatchesKnownDigest() {
    assertEquals("sha-256=:" + SHA_256_OF_BODY + ":", ContentDigests.header(BODY));
  }

  @Test
  void acceptsMatchingDigest() {
    assertNull(ContentDigestVerifier.verify(post(BODY, "sha-256=:" + SHA_256_OF_BODY + ":")));
  }

  @Test
  void acceptsStringEncodedDigest() {
    assertNull(ContentDigestVerifier.verify(post(BODY, "sha-256=\"" + SHA_256_OF_BODY + "\"")));
    assertNull(ContentDigestVerifier.verify(post(BODY, "sha-256=\":" + SHA_256_OF_BODY + ":\"")));
  }

  @Test
  void acceptsSeveralAlgorithms() {
    String header = ContentDigests.header(List.of(ContentDigests.SHA_256, ContentDigests.SHA_512), BODY);
    assertTrue(header.startsWith("sha-256=:" + SHA_256_OF_BODY + ":, sha-512=:"));
    assertNull(ContentDigestVerifier.verify(post(BODY, header)));
  }

  @Test
  void rejectsModifiedBody() {
    byte[] tampered = BODY.clone();
    tampered[tampered.length - 2] ^= 0x01;

    Failure failure = ContentDigestVerifier.verify(post(tampered, "sha-256=:" + SHA_256_OF_BODY + ":"));

    assertEquals(FailureKind.DIGEST_MISMATCH, failure.kind);
    assertEquals(401, failure.kind.httpStatus());
  }

  @Test
  void rejectsWhenAnyAlgorithmMismatches() {
    String header = "sha-256=:" + SHA_256_OF_BODY + ":, sha-512=:" + SHA_256_OF_BODY + ":";
    assertEquals(FailureKind.DIGEST_MISMATCH, ContentDigestVerifier.verify(post(BODY, header)).kind);
  }

  @Test
  void rejectsUnsupportedAlgorithm() {
    Failure failure = ContentDigestVerifier.verify(post(BODY, "md5=:CY9rzUYh03PK3k6DJie09g==:"));
    assertEquals(FailureKind.DIGEST_MISMATCH, failure.kind);
  }

  @Test
  void rejectsUnparseableHeader() {
    assertEquals(FailureKind.MALFORMED_HEADER, ContentDigestVerifier.verify(post(BODY, "sha-256=:not base64!:")).kind);
    assertEquals(FailureKind.MALFORMED_HEADER, ContentDigestVerifier.verify(post(BODY, "")).kind);
    assertEquals(FailureKind.MALFORMED_HEADER, ContentDigestVerifier.verify(post(BODY, "sha-256=42")).kind);
  }

  @Test
  void absentHeaderPasses() {
    assertNull(ContentDigestVerifier.verify(post(BODY, null)));
  }

  @Test
  void emptyBodyDigest() {
    byte[] empty = new byte[0];
    assertNull(ContentDigestVerifier.verify(post(empty, ContentDigests.header(empty))));
  }
}
