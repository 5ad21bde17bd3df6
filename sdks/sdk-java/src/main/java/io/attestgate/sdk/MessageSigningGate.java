package io.attestgate.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;

public final class MessageSigningGate {
  private static final Logger logger = LoggerFactory.getLogger(MessageSigningGate.class);

  private final VerifierSettings settings;
  private final MessageSignatureVerifier verifier;
  private final byte[] baseSecret;

  public MessageSigningGate(VerifierSettings settings) {
    this(settings, Clock.systemUTC(), VerificationListener.NONE);
  }

  public MessageSigningGate(VerifierSettings settings, Clock clock, VerificationListener listener) {
    this.settings = settings.validate();
    this.verifier = new MessageSignatureVerifier(settings.toPolicy(), clock, listener);
    this.baseSecret = settings.baseSecretBytes();
  }

  /**
   * Buffers {@code body} into {@code request} first. A failed or interrupted read rejects the
   * request with 400.
   */
  public AdmissionDecision admit(TokenClaims claims, HttpRequestMessage.Builder request, InputStream body) {
    if (body != null) {
      try {
        request.body(body, settings.maxBodyBytes);
      } catch (IOException e) {
        logger.info("Request body could not be read: {}", e.getMessage());
        return AdmissionDecision.reject(
            Failure.of(FailureKind.MALFORMED_HEADER, "Request body could not be read: " + e.getMessage()), null);
      }
    }
    return admit(claims, request.build());
  }

  public AdmissionDecision admit(TokenClaims claims, HttpRequestMessage request) {
    if (claims == null) {
      claims = new TokenClaims();
    }

    Failure binding = TokenBindingVerifier.verify(request, settings.tokenBindingHeaders(), claims.tokenBinding);
    if (binding != null) {
      return reject(binding, request);
    }

    switch (settings.messageSigningMode) {
      case INSTALLATION:
        return admitInstallation(claims, request);
      case ACCOUNT:
        return admitAccount(claims, request);
      default:
        return AdmissionDecision.allow(request);
    }
  }

  private AdmissionDecision admitInstallation(TokenClaims claims, HttpRequestMessage request) {
    if (claims.installationPublicKey == null || claims.installationPublicKey.trim().isEmpty()) {
      logger.debug("Token has no installation public key, message signature not checked");
      return AdmissionDecision.allow(request);
    }
    KeyMaterial key = KeyMaterial.installation(claims.installationPublicKey);
    return decide(verifier.verify(request, key, settings.installationLabel), request);
  }

  private AdmissionDecision admitAccount(TokenClaims claims, HttpRequestMessage request) {
    if (baseSecret == null) {
      return reject(Failure.of(FailureKind.MISSING_METADATA, "Account message signing requires a base secret"), request);
    }
    if (claims.deviceId == null || claims.deviceId.trim().isEmpty()) {
      return reject(Failure.of(FailureKind.MISSING_METADATA, "Token is missing the device id claim"), request);
    }
    if (claims.tokenExpiry == null) {
      return reject(Failure.of(FailureKind.MISSING_METADATA, "Token is missing the expiry claim"), request);
    }

    KeyMaterial key;
    try {
      key = KeyMaterial.account(baseSecret, claims.deviceId, claims.tokenExpiry, settings.deviceIdEncoding);
    } catch (IllegalArgumentException e) {
      return reject(Failure.of(FailureKind.MISSING_METADATA, "Invalid device id claim: " + e.getMessage()), request);
    }
    return decide(verifier.verify(request, key, settings.accountLabel), request);
  }

  private AdmissionDecision decide(VerificationResult result, HttpRequestMessage request) {
    if (result.valid) {
      return AdmissionDecision.allow(request);
    }
    return reject(Failure.of(result.failureKind, result.reason), request);
  }

  private AdmissionDecision reject(Failure failure, HttpRequestMessage request) {
    logger.info("Request rejected ({}): {}", failure.kind, failure.reason);
    return AdmissionDecision.reject(failure, request);
  }
}
