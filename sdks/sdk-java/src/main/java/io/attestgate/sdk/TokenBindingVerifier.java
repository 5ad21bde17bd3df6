package io.attestgate.sdk;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

public final class TokenBindingVerifier {
  private TokenBindingVerifier() {}

  /**
   * @return null when the binding holds or does not apply
   */
  public static Failure verify(HttpRequestMessage request, List<String> headerNames, String bindingClaim) {
    if (isBlank(bindingClaim) || headerNames == null || headerNames.isEmpty()) {
      return null;
    }

    StringBuilder concatenated = new StringBuilder();
    List<String> missing = new ArrayList<>();
    for (String headerName : headerNames) {
      String value = String.join(",", request.headerValues(headerName)).trim();
      if (value.isEmpty()) {
        missing.add(headerName);
        continue;
      }
      concatenated.append(value);
    }
    if (!missing.isEmpty()) {
      return Failure.of(FailureKind.MALFORMED_HEADER,
          "Token binding header(s) '" + String.join(", ", missing) + "' are missing or empty");
    }

    byte[] expected = bindingHash(concatenated.toString()).getBytes(StandardCharsets.UTF_8);
    if (!MessageDigest.isEqual(bindingClaim.trim().getBytes(StandardCharsets.UTF_8), expected)) {
      return Failure.of(FailureKind.SIGNATURE_MISMATCH, "Token binding does not match the binding headers");
    }
    return null;
  }

  public static String bindingHash(String value) {
    return Base64.getEncoder().encodeToString(ContentDigests.digest(ContentDigests.SHA_256, value.getBytes(StandardCharsets.UTF_8)));
  }

  private static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
