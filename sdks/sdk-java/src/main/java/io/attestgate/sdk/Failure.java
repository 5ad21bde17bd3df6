package io.attestgate.sdk;

import java.util.Objects;

public final class Failure {
  public final FailureKind kind;
  public final String reason;

  private Failure(FailureKind kind, String reason) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.reason = reason;
  }

  public static Failure of(FailureKind kind, String reason) {
    return new Failure(kind, reason);
  }

  @Override
  public String toString() {
    return kind + ": " + reason;
  }
}
