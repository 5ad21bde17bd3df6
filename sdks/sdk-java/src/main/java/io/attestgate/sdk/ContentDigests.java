package io.attestgate.sdk;

import io.attestgate.sdk.sfv.BareItem;
import io.attestgate.sdk.sfv.StructuredDictionary;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class ContentDigests {
  public static final String SHA_256 = "sha-256";
  public static final String SHA_512 = "sha-512";

  private static final Map<String, String> JCA_NAMES = Map.of(
      SHA_256, "SHA-256",
      SHA_512, "SHA-512");

  private ContentDigests() {}

  public static boolean isSupported(String algorithm) {
    return algorithm != null && JCA_NAMES.containsKey(algorithm.toLowerCase(Locale.ROOT));
  }

  public static byte[] digest(String algorithm, byte[] body) {
    String jcaName = algorithm == null ? null : JCA_NAMES.get(algorithm.toLowerCase(Locale.ROOT));
    if (jcaName == null) {
      throw new IllegalArgumentException("Unsupported content-digest algorithm: " + algorithm);
    }
    try {
      return MessageDigest.getInstance(jcaName).digest(body);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("Digest algorithm unavailable: " + jcaName, e);
    }
  }

  /**
   * Builds a Content-Digest field value, for example {@code sha-256=:X48E9q...=:}.
   */
  public static String header(List<String> algorithms, byte[] body) {
    StructuredDictionary.Builder dictionary = StructuredDictionary.builder();
    for (String algorithm : algorithms) {
      dictionary.put(algorithm.toLowerCase(Locale.ROOT), BareItem.ofByteSequence(digest(algorithm, body)));
    }
    return dictionary.build().toString();
  }

  public static String header(byte[] body) {
    return header(List.of(SHA_256), body);
  }
}
