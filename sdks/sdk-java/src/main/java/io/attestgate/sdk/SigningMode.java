package io.attestgate.sdk;

public enum SigningMode {
  NONE(null, null),
  INSTALLATION("ecdsa-p256-sha256", "install"),
  ACCOUNT("hmac-sha256", "account");

  private final String algorithm;
  private final String defaultLabel;

  SigningMode(String algorithm, String defaultLabel) {
    this.algorithm = algorithm;
    this.defaultLabel = defaultLabel;
  }

  /**
   * The value the {@code alg} signature parameter must carry in this mode.
   */
  public String algorithm() {
    return algorithm;
  }

  public String defaultLabel() {
    return defaultLabel;
  }
}
