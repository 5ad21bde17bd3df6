package io.attestgate.sdk;

import io.attestgate.sdk.sfv.BareItem;
import io.attestgate.sdk.sfv.Parameters;

import java.time.Instant;
import java.util.Set;

public final class SignatureMetadataValidator {
  public static final Set<String> KNOWN_PARAMETERS = Set.of("alg", "created", "expires", "keyid", "nonce", "tag");

  private SignatureMetadataValidator() {}

  /**
   * @return null when the parameters are acceptable, otherwise the first violation found
   */
  public static Failure validate(Parameters parameters, VerificationPolicy policy, String expectedAlgorithm, Instant now) {
    if (policy.restrictParameters()) {
      for (String key : parameters.keys()) {
        if (!KNOWN_PARAMETERS.contains(key)) {
          return Failure.of(FailureKind.MALFORMED_HEADER, "Unknown signature parameter '" + key + "'");
        }
      }
    }

    BareItem alg = parameters.get("alg");
    if (alg == null) {
      return Failure.of(FailureKind.UNSUPPORTED_ALGORITHM, "Signature missing 'alg' parameter");
    }
    if (!alg.isString() || !alg.stringValue().equals(expectedAlgorithm)) {
      return Failure.of(FailureKind.UNSUPPORTED_ALGORITHM, "Unsupported signature algorithm " + alg);
    }

    for (String textual : new String[] {"keyid", "nonce", "tag"}) {
      BareItem value = parameters.get(textual);
      if (value != null && !value.isString()) {
        return Failure.of(FailureKind.MALFORMED_HEADER, "Signature parameter '" + textual + "' must be a string");
      }
    }
    if (policy.requireNonce() && !parameters.containsKey("nonce")) {
      return Failure.of(FailureKind.MISSING_METADATA, "Signature missing 'nonce' parameter");
    }

    BareItem created = parameters.get("created");
    BareItem expires = parameters.get("expires");
    if (created != null && !created.isInteger()) {
      return Failure.of(FailureKind.MALFORMED_HEADER, "Signature parameter 'created' must be an integer");
    }
    if (expires != null && !expires.isInteger()) {
      return Failure.of(FailureKind.MALFORMED_HEADER, "Signature parameter 'expires' must be an integer");
    }
    if (created == null && policy.requireCreated()) {
      return Failure.of(FailureKind.MISSING_METADATA, "Signature missing 'created' parameter");
    }
    if (expires == null && policy.requireExpires()) {
      return Failure.of(FailureKind.MISSING_METADATA, "Signature missing 'expires' parameter");
    }

    return validateWindow(
        created == null ? null : created.longValue(),
        expires == null ? null : expires.longValue(),
        policy,
        now.getEpochSecond());
  }

  private static Failure validateWindow(Long created, Long expires, VerificationPolicy policy, long now) {
    long skew = policy.allowedClockSkew().getSeconds();
    if (created != null) {
      if (policy.maximumSignatureAge() != null) {
        long oldest = saturatedSubtract(saturatedSubtract(now, policy.maximumSignatureAge().getSeconds()), skew);
        if (created < oldest) {
          return Failure.of(FailureKind.STALE_OR_FUTURE_SIGNATURE,
              "Signature created at " + created + " is older than the allowed age (now " + now + ")");
        }
      }
      if (created > saturatedAdd(now, skew)) {
        return Failure.of(FailureKind.STALE_OR_FUTURE_SIGNATURE,
            "Signature created at " + created + " is in the future (now " + now + ")");
      }
    }
    if (expires != null && saturatedAdd(expires, skew) < now) {
      return Failure.of(FailureKind.STALE_OR_FUTURE_SIGNATURE,
          "Signature expired at " + expires + " (now " + now + ")");
    }
    if (created != null && expires != null && expires < created) {
      return Failure.of(FailureKind.STALE_OR_FUTURE_SIGNATURE,
          "Signature expires at " + expires + " before it was created at " + created);
    }
    return null;
  }

  // durations are never negative, so overflow only happens towards the far end
  private static long saturatedAdd(long value, long seconds) {
    try {
      return Math.addExact(value, seconds);
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private static long saturatedSubtract(long value, long seconds) {
    try {
      return Math.subtractExact(value, seconds);
    } catch (ArithmeticException e) {
      return Long.MIN_VALUE;
    }
  }
}
