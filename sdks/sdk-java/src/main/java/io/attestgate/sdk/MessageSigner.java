package io.attestgate.sdk;

import io.attestgate.sdk.sfv.BareItem;
import io.attestgate.sdk.sfv.Parameters;
import io.attestgate.sdk.sfv.StructuredDictionary;
import io.attestgate.sdk.sfv.StructuredItem;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.ArrayList;
import java.util.List;

public final class MessageSigner {
  private MessageSigner() {}

  public static List<StructuredItem> components(String... identifiers) {
    List<StructuredItem> components = new ArrayList<>();
    for (String identifier : identifiers) {
      components.add(StructuredItem.of(BareItem.ofString(identifier)));
    }
    return components;
  }

  public static Parameters parameters(SigningMode mode, long created) {
    return Parameters.builder()
        .putString("alg", mode.algorithm())
        .putInteger("created", created)
        .build();
  }

  public static SignedHeaders signWithInstallationKey(
      HttpRequestMessage request,
      List<StructuredItem> components,
      Parameters parameters,
      String label,
      PrivateKey privateKey
  ) {
    CanonicalMessage message = canonicalMessage(request, components, parameters);
    byte[] signature;
    try {
      Signature signer = Signature.getInstance(SignatureVerifier.ECDSA_P1363_ALGORITHM);
      signer.initSign(privateKey);
      signer.update(message.bytes());
      signature = signer.sign();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to sign canonical message", e);
    }
    return headers(label, message, signature);
  }

  public static SignedHeaders signWithAccountSecret(
      HttpRequestMessage request,
      List<StructuredItem> components,
      Parameters parameters,
      String label,
      byte[] derivedSecret
  ) {
    CanonicalMessage message = canonicalMessage(request, components, parameters);
    return headers(label, message, SignatureVerifier.hmacSha256(derivedSecret, message.bytes()));
  }

  private static CanonicalMessage canonicalMessage(HttpRequestMessage request, List<StructuredItem> components, Parameters parameters) {
    CanonicalMessageBuilder.BuildResult built = CanonicalMessageBuilder.build(request, components, parameters);
    if (!built.succeeded()) {
      throw new IllegalArgumentException("Cannot sign request: " + built.failure.reason);
    }
    return built.message;
  }

  private static SignedHeaders headers(String label, CanonicalMessage message, byte[] signature) {
    String signatureHeader = StructuredDictionary.builder()
        .put(label, BareItem.ofByteSequence(signature))
        .build()
        .toString();
    return new SignedHeaders(signatureHeader, label + "=" + message.signatureParams(), message.text());
  }

  public static final class SignedHeaders {
    public final String signature;
    public final String signatureInput;
    public final String canonicalMessage;

    SignedHeaders(String signature, String signatureInput, String canonicalMessage) {
      this.signature = signature;
      this.signatureInput = signatureInput;
      this.canonicalMessage = canonicalMessage;
    }

    public HttpRequestMessage.Builder applyTo(HttpRequestMessage.Builder request) {
      return request
          .removeHeader("signature")
          .removeHeader("signature-input")
          .header("Signature", signature)
          .header("Signature-Input", signatureInput);
    }
  }
}
