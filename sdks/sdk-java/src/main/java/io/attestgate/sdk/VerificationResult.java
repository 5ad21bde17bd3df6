package io.attestgate.sdk;

public final class VerificationResult {
  public final boolean valid;
  public final FailureKind failureKind;
  public final String reason;
  public final String label;
  public final String canonicalMessage;

  private VerificationResult(boolean valid, FailureKind failureKind, String reason, String label, String canonicalMessage) {
    this.valid = valid;
    this.failureKind = failureKind;
    this.reason = reason;
    this.label = label;
    this.canonicalMessage = canonicalMessage;
  }

  public static VerificationResult success(String label, String canonicalMessage) {
    return new VerificationResult(true, null, null, label, canonicalMessage);
  }

  public static VerificationResult failure(Failure failure, String label, String canonicalMessage) {
    return new VerificationResult(false, failure.kind, failure.reason, label, canonicalMessage);
  }

  public static VerificationResult failure(FailureKind kind, String reason) {
    return new VerificationResult(false, kind, reason, null, null);
  }

  public int httpStatus() {
    return valid ? 200 : failureKind.httpStatus();
  }

  @Override
  public String toString() {
    return valid ? "VerificationResult[valid, label=" + label + "]"
        : "VerificationResult[" + failureKind + ": " + reason + "]";
  }
}
