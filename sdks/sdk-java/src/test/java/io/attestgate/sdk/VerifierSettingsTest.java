package io.attestgate.sdk;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerifierSettingsTest {
  @Test
  void defaults() {
    VerifierSettings settings = VerifierSettings.defaults();

    assertEquals(SigningMode.NONE, settings.messageSigningMode);
    assertEquals("install", settings.labelFor(SigningMode.INSTALLATION));
    assertEquals("account", settings.labelFor(SigningMode.ACCOUNT));
    assertEquals(DeviceIdEncoding.BASE64, settings.deviceIdEncoding);
    assertEquals(VerifierSettings.DEFAULT_MAX_BODY_BYTES, settings.maxBodyBytes);
    assertNull(settings.baseSecretBytes());

    VerificationPolicy policy = settings.toPolicy();
    assertTrue(policy.requireCreated());
    assertFalse(policy.requireExpires());
    assertFalse(policy.requireNonce());
    assertTrue(policy.restrictParameters());
    assertEquals(Duration.ofSeconds(300), policy.maximumSignatureAge());
    assertEquals(Duration.ZERO, policy.allowedClockSkew());
  }

  @Test
  void loadsSettingsFile() throws Exception {
    Path path = Path.of(VerifierSettingsTest.class.getResource("/verifier-settings.json").toURI());

    VerifierSettings settings = VerifierSettings.load(path);

    assertEquals(SigningMode.ACCOUNT, settings.messageSigningMode);
    assertEquals(16, settings.baseSecretBytes().length);
    assertEquals(DeviceIdEncoding.UTF8, settings.deviceIdEncoding);
    assertEquals(List.of("Authorization"), settings.tokenBindingHeaders());
    assertEquals(4096, settings.maxBodyBytes);
    assertEquals("account", settings.accountLabel);

    VerificationPolicy policy = settings.toPolicy();
    assertTrue(policy.requireNonce());
    assertEquals(Duration.ofSeconds(120), policy.maximumSignatureAge());
    assertEquals(Duration.ofSeconds(5), policy.allowedClockSkew());
  }

  @Test
  void nullAgeDisablesLimit() {
    VerifierSettings settings = VerifierSettings.parse("{\"maxSignatureAgeSeconds\": null}");

    assertNull(settings.toPolicy().maximumSignatureAge());
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> VerifierSettings.parse("{\"messageSigningMode\": \"SOMETIMES\"}"));
    assertThrows(IllegalArgumentException.class, () -> VerifierSettings.parse("{\"allowedClockSkewSeconds\": -1}"));
    assertThrows(IllegalArgumentException.class, () -> VerifierSettings.parse("{\"accountMessageBaseSecret\": \"not base64!\"}"));
    assertThrows(IllegalArgumentException.class, () -> VerifierSettings.parse("{\"installationLabel\": \"\"}"));
    assertThrows(IllegalArgumentException.class, () -> VerifierSettings.parse("{not json"));
  }

  @Test
  void missingFileFails(@TempDir Path dir) {
    assertThrows(IllegalStateException.class, () -> VerifierSettings.load(dir.resolve("absent.json")));
  }

  @Test
  void loadsFromDisk(@TempDir Path dir) throws Exception {
    Path path = dir.resolve("settings.json");
    Files.writeString(path, "{\"messageSigningMode\": \"INSTALLATION\", \"installationLabel\": \"sig1\"}", StandardCharsets.UTF_8);

    VerifierSettings settings = VerifierSettings.load(path);

    assertEquals(SigningMode.INSTALLATION, settings.messageSigningMode);
    assertEquals("sig1", settings.labelFor(SigningMode.INSTALLATION));
  }
}
