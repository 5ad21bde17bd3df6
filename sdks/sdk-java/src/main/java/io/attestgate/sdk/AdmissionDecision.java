package io.attestgate.sdk;

/**
 * What the HTTP layer should do with a request. {@link #reason} goes to logs only; clients get
 * {@link #responseBody()}.
 */
public final class AdmissionDecision {
  public static final String REJECTED_BODY = "Invalid Token";

  public final boolean allowed;
  public final int status;
  public final FailureKind failureKind;
  public final String reason;
  public final HttpRequestMessage request;

  private AdmissionDecision(boolean allowed, int status, FailureKind failureKind, String reason, HttpRequestMessage request) {
    this.allowed = allowed;
    this.status = status;
    this.failureKind = failureKind;
    this.reason = reason;
    this.request = request;
  }

  public static AdmissionDecision allow(HttpRequestMessage request) {
    return new AdmissionDecision(true, 200, null, null, request);
  }

  public static AdmissionDecision reject(Failure failure, HttpRequestMessage request) {
    return new AdmissionDecision(false, failure.kind.httpStatus(), failure.kind, failure.reason, request);
  }

  public String responseBody() {
    return allowed ? null : REJECTED_BODY;
  }

  @Override
  public String toString() {
    return allowed ? "AdmissionDecision[allowed]" : "AdmissionDecision[" + status + " " + failureKind + ": " + reason + "]";
  }
}
