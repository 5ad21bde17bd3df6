package io.attestgate.sdk;

public interface VerificationListener {
  VerificationListener NONE = new VerificationListener() {};

  default void onCanonicalMessage(String label, CanonicalMessage message) {}

  default void onResult(VerificationResult result) {}
}
