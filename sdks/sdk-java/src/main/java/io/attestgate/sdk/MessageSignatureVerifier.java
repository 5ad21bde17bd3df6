package io.attestgate.sdk;

import io.attestgate.sdk.sfv.StructuredDictionary;
import io.attestgate.sdk.sfv.StructuredFieldException;
import io.attestgate.sdk.sfv.StructuredFieldParser;
import io.attestgate.sdk.sfv.StructuredItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Verifies the HTTP message signature of a request: parses Signature and Signature-Input, checks
 * the signature metadata, rebuilds the canonical message, checks Content-Digest and finally the
 * signature bytes. Every outcome is reported as a {@link VerificationResult}. Only a null request or
 * key is refused, with {@link NullPointerException}.
 */
public final class MessageSignatureVerifier {
  private static final Logger logger = LoggerFactory.getLogger(MessageSignatureVerifier.class);

  private final VerificationPolicy policy;
  private final Clock clock;
  private final VerificationListener listener;

  public MessageSignatureVerifier(VerificationPolicy policy) {
    this(policy, Clock.systemUTC(), VerificationListener.NONE);
  }

  public MessageSignatureVerifier(VerificationPolicy policy, Clock clock, VerificationListener listener) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = listener == null ? VerificationListener.NONE : listener;
  }

  public VerificationResult verify(HttpRequestMessage request, KeyMaterial key) {
    return verify(request, key, Objects.requireNonNull(key, "key").mode().defaultLabel());
  }

  public VerificationResult verify(HttpRequestMessage request, KeyMaterial key, String label) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(key, "key");
    VerificationResult result;
    try {
      result = verifyLabel(request, key, label);
    } catch (RuntimeException e) {
      logger.error("Unexpected error during message signature verification", e);
      result = VerificationResult.failure(FailureKind.SIGNATURE_MISMATCH, "Unexpected verification error: " + e);
    }
    if (result.valid) {
      logger.debug("Message signature '{}' verified", label);
    } else {
      logger.debug("Message signature '{}' rejected: {} {}", label, result.failureKind, result.reason);
    }
    listener.onResult(result);
    return result;
  }

  private VerificationResult verifyLabel(HttpRequestMessage request, KeyMaterial key, String label) {
    List<String> signatureValues = request.headerValues("signature");
    List<String> signatureInputValues = request.headerValues("signature-input");
    if (signatureValues.isEmpty() || signatureInputValues.isEmpty()) {
      return VerificationResult.failure(FailureKind.MALFORMED_HEADER, "Missing Signature or Signature-Input headers");
    }

    StructuredDictionary signatures;
    try {
      signatures = StructuredFieldParser.parseDictionary(CanonicalMessageBuilder.combine(signatureValues));
    } catch (StructuredFieldException e) {
      return VerificationResult.failure(FailureKind.MALFORMED_HEADER, "Failed to parse signature header: " + e.getMessage());
    }
    StructuredDictionary signatureInputs;
    try {
      signatureInputs = StructuredFieldParser.parseDictionary(CanonicalMessageBuilder.combine(signatureInputValues));
    } catch (StructuredFieldException e) {
      return VerificationResult.failure(FailureKind.MALFORMED_HEADER, "Failed to parse signature-input header: " + e.getMessage());
    }

    if (!signatures.keys().equals(signatureInputs.keys())) {
      return VerificationResult.failure(FailureKind.MALFORMED_HEADER,
          "Signature labels " + signatures.keys() + " do not match Signature-Input labels " + signatureInputs.keys());
    }
    StructuredItem signatureEntry = signatures.get(label);
    StructuredItem signatureInputEntry = signatureInputs.get(label);
    if (signatureEntry == null || signatureInputEntry == null) {
      return VerificationResult.failure(FailureKind.MALFORMED_HEADER, "Signature headers missing '" + label + "' entry");
    }
    if (signatureEntry.isInnerList() || !signatureEntry.bareItem().isByteSequence()) {
      return VerificationResult.failure(FailureKind.MALFORMED_HEADER, "Signature item is not encoded as a byte sequence");
    }
    if (!signatureInputEntry.isInnerList()) {
      return VerificationResult.failure(FailureKind.MALFORMED_HEADER,
          "Signature-Input entry does not contain an inner list of components");
    }

    Failure metadata = SignatureMetadataValidator.validate(
        signatureInputEntry.parameters(), policy, key.mode().algorithm(), clock.instant());
    if (metadata != null) {
      return VerificationResult.failure(metadata, label, null);
    }

    CanonicalMessageBuilder.BuildResult built = CanonicalMessageBuilder.build(
        request, signatureInputEntry.innerList(), signatureInputEntry.parameters());
    if (!built.succeeded()) {
      return VerificationResult.failure(built.failure, label, null);
    }
    CanonicalMessage message = built.message;
    listener.onCanonicalMessage(label, message);

    Failure digest = ContentDigestVerifier.verify(request);
    if (digest != null) {
      return VerificationResult.failure(digest, label, message.text());
    }

    if (!SignatureVerifier.verify(key, message.bytes(), signatureEntry.bareItem().bytesValue())) {
      return VerificationResult.failure(
          Failure.of(FailureKind.SIGNATURE_MISMATCH, "Signature verification failed"), label, message.text());
    }
    return VerificationResult.success(label, message.text());
  }
}
