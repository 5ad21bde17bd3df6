package io.attestgate.sdk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class VerifierSettings {
  public static final int DEFAULT_MAX_BODY_BYTES = 1024 * 1024;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public SigningMode messageSigningMode = SigningMode.NONE;
  // base64
  public String accountMessageBaseSecret;
  public String installationLabel = SigningMode.INSTALLATION.defaultLabel();
  public String accountLabel = SigningMode.ACCOUNT.defaultLabel();
  public boolean requireCreated = true;
  public boolean requireExpires;
  public boolean requireNonce;
  public Long maxSignatureAgeSeconds = 300L;
  public long allowedClockSkewSeconds;
  public boolean restrictSignatureParameters = true;
  public DeviceIdEncoding deviceIdEncoding = DeviceIdEncoding.BASE64;
  public List<String> tokenBindingHeaders = new ArrayList<>();
  public int maxBodyBytes = DEFAULT_MAX_BODY_BYTES;

  public static VerifierSettings defaults() {
    return new VerifierSettings();
  }

  public static VerifierSettings load(Path path) {
    String json;
    try {
      json = Files.readString(path);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read verifier settings " + path, e);
    }
    return parse(json);
  }

  public static VerifierSettings parse(String json) {
    VerifierSettings settings;
    try {
      settings = MAPPER.readValue(json, VerifierSettings.class);
    } catch (JacksonException e) {
      throw new IllegalArgumentException("Invalid verifier settings: " + e.getOriginalMessage(), e);
    }
    if (settings == null) {
      throw new IllegalArgumentException("Verifier settings document is empty");
    }
    settings.validate();
    return settings;
  }

  public VerifierSettings validate() {
    if (messageSigningMode == null) {
      throw new IllegalArgumentException("messageSigningMode must be one of NONE, INSTALLATION, ACCOUNT");
    }
    if (deviceIdEncoding == null) {
      throw new IllegalArgumentException("deviceIdEncoding must be BASE64 or UTF8");
    }
    if (isBlank(installationLabel) || isBlank(accountLabel)) {
      throw new IllegalArgumentException("Signature labels must not be empty");
    }
    if (maxSignatureAgeSeconds != null && maxSignatureAgeSeconds < 0) {
      throw new IllegalArgumentException("maxSignatureAgeSeconds must not be negative");
    }
    if (allowedClockSkewSeconds < 0) {
      throw new IllegalArgumentException("allowedClockSkewSeconds must not be negative");
    }
    if (maxBodyBytes < 0) {
      throw new IllegalArgumentException("maxBodyBytes must not be negative");
    }
    // decoded eagerly so a malformed secret fails at load time
    baseSecretBytes();
    return this;
  }

  public VerificationPolicy toPolicy() {
    return VerificationPolicy.builder()
        .requireCreated(requireCreated)
        .requireExpires(requireExpires)
        .requireNonce(requireNonce)
        .maximumSignatureAge(maxSignatureAgeSeconds == null ? null : Duration.ofSeconds(maxSignatureAgeSeconds))
        .allowedClockSkew(Duration.ofSeconds(allowedClockSkewSeconds))
        .restrictParameters(restrictSignatureParameters)
        .build();
  }

  /**
   * @return the decoded base secret, or null when none is configured
   */
  public byte[] baseSecretBytes() {
    if (isBlank(accountMessageBaseSecret)) {
      return null;
    }
    try {
      return Base64.getDecoder().decode(accountMessageBaseSecret.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("accountMessageBaseSecret is not valid base64", e);
    }
  }

  public String labelFor(SigningMode mode) {
    switch (mode) {
      case INSTALLATION:
        return installationLabel;
      case ACCOUNT:
        return accountLabel;
      default:
        return null;
    }
  }

  public List<String> tokenBindingHeaders() {
    return tokenBindingHeaders == null ? List.of() : tokenBindingHeaders;
  }

  private static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
