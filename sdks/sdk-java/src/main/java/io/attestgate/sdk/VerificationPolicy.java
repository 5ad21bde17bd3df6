package io.attestgate.sdk;

import java.time.Duration;
import java.util.Objects;

public final class VerificationPolicy {
  private final boolean requireCreated;
  private final boolean requireExpires;
  private final boolean requireNonce;
  private final Duration maximumSignatureAge;
  private final Duration allowedClockSkew;
  private final boolean restrictParameters;

  private VerificationPolicy(Builder builder) {
    this.requireCreated = builder.requireCreated;
    this.requireExpires = builder.requireExpires;
    this.requireNonce = builder.requireNonce;
    this.maximumSignatureAge = builder.maximumSignatureAge;
    this.allowedClockSkew = builder.allowedClockSkew;
    this.restrictParameters = builder.restrictParameters;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static VerificationPolicy defaults() {
    return builder().build();
  }

  public boolean requireCreated() {
    return requireCreated;
  }

  public boolean requireExpires() {
    return requireExpires;
  }

  public boolean requireNonce() {
    return requireNonce;
  }

  /**
   * Oldest acceptable {@code created} value relative to now, or null for no limit.
   */
  public Duration maximumSignatureAge() {
    return maximumSignatureAge;
  }

  public Duration allowedClockSkew() {
    return allowedClockSkew;
  }

  /**
   * Whether signature parameters outside alg, created, expires, keyid, nonce and tag are refused.
   */
  public boolean restrictParameters() {
    return restrictParameters;
  }

  @Override
  public String toString() {
    return "VerificationPolicy[requireCreated=" + requireCreated
        + ", requireExpires=" + requireExpires
        + ", requireNonce=" + requireNonce
        + ", maximumSignatureAge=" + maximumSignatureAge
        + ", allowedClockSkew=" + allowedClockSkew
        + ", restrictParameters=" + restrictParameters + "]";
  }

  public static final class Builder {
    private boolean requireCreated = true;
    private boolean requireExpires;
    private boolean requireNonce;
    private Duration maximumSignatureAge;
    private Duration allowedClockSkew = Duration.ZERO;
    private boolean restrictParameters = true;

    private Builder() {}

    public Builder requireCreated(boolean requireCreated) {
      this.requireCreated = requireCreated;
      return this;
    }

    public Builder requireExpires(boolean requireExpires) {
      this.requireExpires = requireExpires;
      return this;
    }

    public Builder requireNonce(boolean requireNonce) {
      this.requireNonce = requireNonce;
      return this;
    }

    public Builder maximumSignatureAge(Duration maximumSignatureAge) {
      if (maximumSignatureAge != null && maximumSignatureAge.isNegative()) {
        throw new IllegalArgumentException("Maximum signature age must not be negative");
      }
      this.maximumSignatureAge = maximumSignatureAge;
      return this;
    }

    public Builder allowedClockSkew(Duration allowedClockSkew) {
      Objects.requireNonNull(allowedClockSkew, "allowedClockSkew");
      if (allowedClockSkew.isNegative()) {
        throw new IllegalArgumentException("Allowed clock skew must not be negative");
      }
      this.allowedClockSkew = allowedClockSkew;
      return this;
    }

    public Builder restrictParameters(boolean restrictParameters) {
      this.restrictParameters = restrictParameters;
      return this;
    }

    public VerificationPolicy build() {
      return new VerificationPolicy(this);
    }
  }
}
