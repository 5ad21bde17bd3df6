package io.attestgate.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.ECPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

public final class SignatureVerifier {
  private static final Logger logger = LoggerFactory.getLogger(SignatureVerifier.class);

  public static final String ECDSA_P1363_ALGORITHM = "SHA256withECDSAinP1363Format";
  public static final String HMAC_ALGORITHM = "HmacSHA256";

  private SignatureVerifier() {}

  public static boolean verify(KeyMaterial key, byte[] payload, byte[] signature) {
    switch (key.mode()) {
      case INSTALLATION:
        return verifyInstallationSignature(key.installationPublicKey(), payload, signature);
      case ACCOUNT:
        return verifyAccountSignature(key.accountSecret(), payload, signature);
      default:
        return false;
    }
  }

  public static boolean verifyInstallationSignature(String publicKeyBase64, byte[] payload, byte[] signature) {
    PublicKey publicKey;
    try {
      publicKey = importInstallationKey(publicKeyBase64);
    } catch (GeneralSecurityException e) {
      logger.warn("Invalid installation public key - {}", e.getMessage());
      return false;
    }
    return verifyInstallationSignature(publicKey, payload, signature);
  }

  public static boolean verifyInstallationSignature(PublicKey publicKey, byte[] payload, byte[] signature) {
    try {
      Signature verifier = Signature.getInstance(ECDSA_P1363_ALGORITHM);
      verifier.initVerify(publicKey);
      verifier.update(payload);
      return verifier.verify(signature);
    } catch (GeneralSecurityException e) {
      logger.debug("ECDSA verification raised {}", e.toString());
      return false;
    }
  }

  public static PublicKey importInstallationKey(String publicKeyBase64) throws GeneralSecurityException {
    byte[] encoded;
    try {
      encoded = Base64.getDecoder().decode(publicKeyBase64);
    } catch (IllegalArgumentException e) {
      throw new InvalidKeySpecException("Installation public key is not valid base64", e);
    }
    PublicKey publicKey = KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(encoded));
    if (!(publicKey instanceof ECPublicKey)
        || ((ECPublicKey) publicKey).getParams().getCurve().getField().getFieldSize() != 256) {
      throw new InvalidKeyException("Installation public key is not a P-256 key");
    }
    return publicKey;
  }

  /**
   * HMAC-SHA256(baseSecret, deviceId || big-endian int64 token expiry).
   */
  public static byte[] deriveAccountSecret(byte[] baseSecret, byte[] deviceId, long tokenExpiryEpochSeconds) {
    byte[] message = ByteBuffer.allocate(deviceId.length + Long.BYTES)
        .put(deviceId)
        .putLong(tokenExpiryEpochSeconds)
        .array();
    return hmacSha256(baseSecret, message);
  }

  public static boolean verifyAccountSignature(byte[] derivedSecret, byte[] payload, byte[] signature) {
    if (derivedSecret == null || derivedSecret.length == 0 || signature == null) {
      return false;
    }
    return MessageDigest.isEqual(hmacSha256(derivedSecret, payload), signature);
  }

  public static byte[] hmacSha256(byte[] key, byte[] data) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }
}
