package io.attestgate.sdk;

import io.attestgate.sdk.sfv.Parameters;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SignatureMetadataValidatorTest {
  private static final String ALG = "ecdsa-p256-sha256";
  private static final long NOW = SigningFixtures.NOW;
  private static final Instant NOW_INSTANT = Instant.ofEpochSecond(NOW);
  private static final VerificationPolicy FIVE_MINUTES = VerificationPolicy.builder()
      .maximumSignatureAge(Duration.ofSeconds(300))
      .build();

  private static Parameters.Builder parameters() {
    return Parameters.builder().putString("alg", ALG);
  }

  private static Failure validate(Parameters parameters, VerificationPolicy policy) {
    return SignatureMetadataValidator.validate(parameters, policy, ALG, NOW_INSTANT);
  }

  @Test
  void acceptsFreshSignature() {
    assertNull(validate(parameters().putInteger("created", NOW).build(), FIVE_MINUTES));
    assertNull(validate(parameters().putInteger("created", NOW - 300).build(), FIVE_MINUTES));
  }

  @Test
  void rejectsStaleSignature() {
    Failure failure = validate(parameters().putInteger("created", NOW - 301).build(), FIVE_MINUTES);
    assertEquals(FailureKind.STALE_OR_FUTURE_SIGNATURE, failure.kind);
  }

  @Test
  void rejectsFutureSignature() {
    Failure failure = validate(parameters().putInteger("created", NOW + 1).build(), FIVE_MINUTES);
    assertEquals(FailureKind.STALE_OR_FUTURE_SIGNATURE, failure.kind);
  }

  @Test
  void clockSkewWidensWindowBothWays() {
    VerificationPolicy skewed = VerificationPolicy.builder()
        .maximumSignatureAge(Duration.ofSeconds(300))
        .allowedClockSkew(Duration.ofSeconds(30))
        .build();

    assertNull(validate(parameters().putInteger("created", NOW + 30).build(), skewed));
    assertNull(validate(parameters().putInteger("created", NOW - 330).build(), skewed));
    assertNotNull(validate(parameters().putInteger("created", NOW + 31).build(), skewed));
    assertNotNull(validate(parameters().putInteger("created", NOW - 331).build(), skewed));
  }

  @Test
  void hugeSkewAndAgeSaturateInsteadOfOverflowing() {
    VerificationPolicy unbounded = VerificationPolicy.builder()
        .maximumSignatureAge(Duration.ofSeconds(Long.MAX_VALUE))
        .allowedClockSkew(Duration.ofSeconds(Long.MAX_VALUE))
        .build();

    assertNull(validate(parameters().putInteger("created", NOW).build(), unbounded));
    assertNull(validate(parameters().putInteger("created", 0).build(), unbounded));
    assertNull(validate(parameters().putInteger("created", NOW + 86400).build(), unbounded));
    assertNull(validate(parameters().putInteger("created", 0).putInteger("expires", 1).build(), unbounded));
  }

  @Test
  void expiresBoundary() {
    assertNull(validate(parameters().putInteger("created", NOW - 10).putInteger("expires", NOW).build(), FIVE_MINUTES));

    Failure expired = validate(parameters().putInteger("created", NOW - 10).putInteger("expires", NOW - 1).build(), FIVE_MINUTES);
    assertEquals(FailureKind.STALE_OR_FUTURE_SIGNATURE, expired.kind);
  }

  @Test
  void rejectsExpiresBeforeCreated() {
    Failure failure = validate(parameters().putInteger("created", NOW).putInteger("expires", NOW - 5).build(),
        VerificationPolicy.builder().allowedClockSkew(Duration.ofSeconds(60)).build());
    assertEquals(FailureKind.STALE_OR_FUTURE_SIGNATURE, failure.kind);
  }

  @Test
  void requiresCreatedByDefault() {
    Failure failure = validate(parameters().build(), VerificationPolicy.defaults());
    assertEquals(FailureKind.MISSING_METADATA, failure.kind);

    VerificationPolicy lenient = VerificationPolicy.builder().requireCreated(false).build();
    assertNull(validate(parameters().build(), lenient));
  }

  @Test
  void requiresExpiresAndNonceWhenConfigured() {
    VerificationPolicy strict = VerificationPolicy.builder().requireExpires(true).requireNonce(true).build();

    assertEquals(FailureKind.MISSING_METADATA,
        validate(parameters().putInteger("created", NOW).putString("nonce", "n-1").build(), strict).kind);
    assertEquals(FailureKind.MISSING_METADATA,
        validate(parameters().putInteger("created", NOW).putInteger("expires", NOW + 60).build(), strict).kind);
    assertNull(validate(parameters().putInteger("created", NOW).putInteger("expires", NOW + 60)
        .putString("nonce", "n-1").build(), strict));
  }

  @Test
  void noAgeLimitByDefault() {
    assertNull(validate(parameters().putInteger("created", NOW - 86400).build(), VerificationPolicy.defaults()));
  }

  @Test
  void algorithmMustMatchMode() {
    assertEquals(FailureKind.UNSUPPORTED_ALGORITHM,
        validate(Parameters.builder().putInteger("created", NOW).build(), FIVE_MINUTES).kind);
    assertEquals(FailureKind.UNSUPPORTED_ALGORITHM,
        validate(Parameters.builder().putString("alg", "hmac-sha256").putInteger("created", NOW).build(), FIVE_MINUTES).kind);
    assertEquals(FailureKind.UNSUPPORTED_ALGORITHM,
        validate(Parameters.builder().putToken("alg", "ecdsa-p256-sha256").putInteger("created", NOW).build(), FIVE_MINUTES).kind);
  }

  @Test
  void rejectsUnknownParametersUnlessRelaxed() {
    Parameters withExtra = parameters().putInteger("created", NOW).putString("context", "x").build();

    assertEquals(FailureKind.MALFORMED_HEADER, validate(withExtra, FIVE_MINUTES).kind);
    assertNull(validate(withExtra, VerificationPolicy.builder().restrictParameters(false).build()));
  }

  @Test
  void rejectsWronglyTypedParameters() {
    assertEquals(FailureKind.MALFORMED_HEADER,
        validate(parameters().putString("created", "1700000000").build(), FIVE_MINUTES).kind);
    assertEquals(FailureKind.MALFORMED_HEADER,
        validate(parameters().putInteger("created", NOW).putInteger("keyid", 7).build(), FIVE_MINUTES).kind);
  }
}
