package io.attestgate.sdk;

import java.util.Objects;

public final class KeyMaterial {
  private final SigningMode mode;
  private final String installationPublicKey;
  private final byte[] accountSecret;

  private KeyMaterial(SigningMode mode, String installationPublicKey, byte[] accountSecret) {
    this.mode = mode;
    this.installationPublicKey = installationPublicKey;
    this.accountSecret = accountSecret;
  }

  /**
   * @param publicKeyBase64 base64 DER SubjectPublicKeyInfo of a P-256 key
   */
  public static KeyMaterial installation(String publicKeyBase64) {
    Objects.requireNonNull(publicKeyBase64, "publicKeyBase64");
    return new KeyMaterial(SigningMode.INSTALLATION, publicKeyBase64.trim(), null);
  }

  public static KeyMaterial account(byte[] baseSecret, String deviceId, long tokenExpiryEpochSeconds, DeviceIdEncoding encoding) {
    if (baseSecret == null || baseSecret.length == 0) {
      throw new IllegalArgumentException("Account base secret must not be empty");
    }
    if (deviceId == null || deviceId.trim().isEmpty()) {
      throw new IllegalArgumentException("Device id is required for account message signing");
    }
    byte[] deviceIdBytes = encoding.decode(deviceId);
    return new KeyMaterial(
        SigningMode.ACCOUNT,
        null,
        SignatureVerifier.deriveAccountSecret(baseSecret, deviceIdBytes, tokenExpiryEpochSeconds));
  }

  public static KeyMaterial accountSecret(byte[] derivedSecret) {
    if (derivedSecret == null || derivedSecret.length == 0) {
      throw new IllegalArgumentException("Derived account secret must not be empty");
    }
    return new KeyMaterial(SigningMode.ACCOUNT, null, derivedSecret.clone());
  }

  public SigningMode mode() {
    return mode;
  }

  public String installationPublicKey() {
    return installationPublicKey;
  }

  public byte[] accountSecret() {
    return accountSecret == null ? null : accountSecret.clone();
  }

  @Override
  public String toString() {
    return "KeyMaterial[" + mode + "]";
  }
}
