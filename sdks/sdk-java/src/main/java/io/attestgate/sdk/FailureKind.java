package io.attestgate.sdk;

/**
 * Why a request was refused. Kinds that mean "the request cannot be checked" map to 400, kinds
 * that mean "the check failed" map to 401.
 */
public enum FailureKind {
  MALFORMED_HEADER(400),
  UNSUPPORTED_ALGORITHM(401),
  MISSING_METADATA(401),
  STALE_OR_FUTURE_SIGNATURE(401),
  UNRESOLVABLE_COMPONENT(400),
  DIGEST_MISMATCH(401),
  SIGNATURE_MISMATCH(401);

  private final int httpStatus;

  FailureKind(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
