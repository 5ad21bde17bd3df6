package io.attestgate.sdk;

public class TokenClaims {
  // ipk: base64 DER SubjectPublicKeyInfo
  public String installationPublicKey;
  // did
  public String deviceId;
  // exp, unix seconds
  public Long tokenExpiry;
  // pay: base64 SHA-256 of the binding header values
  public String tokenBinding;

  public TokenClaims() {}

  public TokenClaims(String installationPublicKey, String deviceId, Long tokenExpiry, String tokenBinding) {
    this.installationPublicKey = installationPublicKey;
    this.deviceId = deviceId;
    this.tokenExpiry = tokenExpiry;
    this.tokenBinding = tokenBinding;
  }
}
