package io.attestgate.sdk;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageSigningGateTest {
  private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(SigningFixtures.NOW), ZoneOffset.UTC);

  private final KeyPair keyPair = SigningFixtures.p256KeyPair();

  private static MessageSigningGate gate(VerifierSettings settings) {
    return new MessageSigningGate(settings, CLOCK, VerificationListener.NONE);
  }

  private static VerifierSettings settings(SigningMode mode) {
    VerifierSettings settings = VerifierSettings.defaults();
    settings.messageSigningMode = mode;
    return settings;
  }

  private HttpRequestMessage installationSigned(HttpRequestMessage.Builder builder) {
    MessageSigner.SignedHeaders signed = MessageSigner.signWithInstallationKey(builder.build(),
        MessageSigner.components("@method", "approov-token"),
        MessageSigner.parameters(SigningMode.INSTALLATION, SigningFixtures.NOW), "install", keyPair.getPrivate());
    return signed.applyTo(builder).build();
  }

  private static TokenClaims accountClaims() {
    return new TokenClaims(null, SigningFixtures.DEVICE_ID, SigningFixtures.TOKEN_EXPIRY, null);
  }

  private static HttpRequestMessage accountSigned(HttpRequestMessage.Builder builder) {
    MessageSigner.SignedHeaders signed = MessageSigner.signWithAccountSecret(builder.build(),
        MessageSigner.components("@method", "@path", "approov-token"),
        MessageSigner.parameters(SigningMode.ACCOUNT, SigningFixtures.NOW), "account",
        Base64.getDecoder().decode(SigningFixtures.DERIVED_SECRET));
    return signed.applyTo(builder).build();
  }

  @Test
  void noneModeAllowsUnsignedRequests() {
    AdmissionDecision decision = gate(VerifierSettings.defaults())
        .admit(new TokenClaims(), SigningFixtures.tokenRequest().build());

    assertTrue(decision.allowed);
    assertEquals(200, decision.status);
    assertNull(decision.responseBody());
  }

  @Test
  void installationModeVerifiesSignature() {
    TokenClaims claims = new TokenClaims(SigningFixtures.spki(keyPair), null, null, null);

    AdmissionDecision decision = gate(settings(SigningMode.INSTALLATION))
        .admit(claims, installationSigned(SigningFixtures.tokenRequest()));

    assertTrue(decision.allowed, decision::toString);
    assertNotNull(decision.request);
  }

  @Test
  void installationModeRejectsUnsignedRequest() {
    TokenClaims claims = new TokenClaims(SigningFixtures.spki(keyPair), null, null, null);

    AdmissionDecision decision = gate(settings(SigningMode.INSTALLATION)).admit(claims, SigningFixtures.tokenRequest().build());

    assertFalse(decision.allowed);
    assertEquals(400, decision.status);
    assertEquals("Invalid Token", decision.responseBody());
    assertEquals(FailureKind.MALFORMED_HEADER, decision.failureKind);
  }

  @Test
  void installationModeWithoutKeyClaimProceeds() {
    AdmissionDecision decision = gate(settings(SigningMode.INSTALLATION))
        .admit(new TokenClaims(), SigningFixtures.tokenRequest().build());

    assertTrue(decision.allowed);
  }

  @Test
  void installationModeRejectsSignatureFromOtherKey() {
    TokenClaims claims = new TokenClaims(SigningFixtures.spki(SigningFixtures.p256KeyPair()), null, null, null);

    AdmissionDecision decision = gate(settings(SigningMode.INSTALLATION))
        .admit(claims, installationSigned(SigningFixtures.tokenRequest()));

    assertFalse(decision.allowed);
    assertEquals(401, decision.status);
    assertEquals(FailureKind.SIGNATURE_MISMATCH, decision.failureKind);
  }

  @Test
  void accountModeVerifiesDerivedSecret() {
    VerifierSettings settings = settings(SigningMode.ACCOUNT);
    settings.accountMessageBaseSecret = SigningFixtures.BASE_SECRET;

    AdmissionDecision decision = gate(settings).admit(accountClaims(), accountSigned(SigningFixtures.tokenRequest()));

    assertTrue(decision.allowed, decision::toString);
  }

  @Test
  void accountModeRejectsOtherExpiry() {
    VerifierSettings settings = settings(SigningMode.ACCOUNT);
    settings.accountMessageBaseSecret = SigningFixtures.BASE_SECRET;
    TokenClaims claims = accountClaims();
    claims.tokenExpiry = SigningFixtures.TOKEN_EXPIRY + 60;

    AdmissionDecision decision = gate(settings).admit(claims, accountSigned(SigningFixtures.tokenRequest()));

    assertEquals(401, decision.status);
    assertEquals(FailureKind.SIGNATURE_MISMATCH, decision.failureKind);
  }

  @Test
  void accountModeRequiresClaimsAndSecret() {
    VerifierSettings withSecret = settings(SigningMode.ACCOUNT);
    withSecret.accountMessageBaseSecret = SigningFixtures.BASE_SECRET;
    HttpRequestMessage request = accountSigned(SigningFixtures.tokenRequest());

    AdmissionDecision noSecret = gate(settings(SigningMode.ACCOUNT)).admit(accountClaims(), request);
    AdmissionDecision noDevice = gate(withSecret).admit(new TokenClaims(null, null, SigningFixtures.TOKEN_EXPIRY, null), request);
    AdmissionDecision noExpiry = gate(withSecret).admit(new TokenClaims(null, SigningFixtures.DEVICE_ID, null, null), request);
    AdmissionDecision badDevice = gate(withSecret).admit(new TokenClaims(null, "not base64!", SigningFixtures.TOKEN_EXPIRY, null), request);

    for (AdmissionDecision decision : List.of(noSecret, noDevice, noExpiry, badDevice)) {
      assertFalse(decision.allowed);
      assertEquals(401, decision.status, decision::toString);
    }
  }

  @Test
  void tokenBindingCheckedFirst() {
    VerifierSettings settings = VerifierSettings.defaults();
    settings.tokenBindingHeaders = List.of("Authorization");
    HttpRequestMessage request = SigningFixtures.tokenRequest().header("Authorization", "Bearer abc").build();

    TokenClaims bound = new TokenClaims(null, null, null, TokenBindingVerifier.bindingHash("Bearer abc"));
    TokenClaims boundElsewhere = new TokenClaims(null, null, null, TokenBindingVerifier.bindingHash("Bearer other"));

    assertTrue(gate(settings).admit(bound, request).allowed);
    AdmissionDecision rejected = gate(settings).admit(boundElsewhere, request);
    assertFalse(rejected.allowed);
    assertEquals(401, rejected.status);
  }

  @Test
  void buffersBodyBeforeVerifying() {
    byte[] body = "{\"hello\":\"world\"}".getBytes(StandardCharsets.UTF_8);
    HttpRequestMessage.Builder builder = HttpRequestMessage.fromUrl("POST", "https://api.example.com/v1/orders")
        .header("Approov-Token", SigningFixtures.TOKEN)
        .header("Content-Digest", ContentDigests.header(body));
    MessageSigner.SignedHeaders signed = MessageSigner.signWithInstallationKey(builder.build(),
        MessageSigner.components("@method", "approov-token", "content-digest"),
        MessageSigner.parameters(SigningMode.INSTALLATION, SigningFixtures.NOW), "install", keyPair.getPrivate());
    signed.applyTo(builder);
    TokenClaims claims = new TokenClaims(SigningFixtures.spki(keyPair), null, null, null);

    AdmissionDecision decision = gate(settings(SigningMode.INSTALLATION))
        .admit(claims, builder, new ByteArrayInputStream(body));

    assertTrue(decision.allowed, decision::toString);
    assertArrayEquals(body, decision.request.body());
  }

  @Test
  void unreadableBodyIsBadRequest() {
    InputStream failing = new InputStream() {
      @Override
      public int read() throws IOException {
        throw new IOException("connection reset");
      }
    };

    AdmissionDecision decision = gate(VerifierSettings.defaults())
        .admit(new TokenClaims(), SigningFixtures.tokenRequest(), failing);

    assertFalse(decision.allowed);
    assertEquals(400, decision.status);
    assertEquals("Invalid Token", decision.responseBody());
  }

  @Test
  void oversizedBodyIsBadRequest() {
    VerifierSettings settings = VerifierSettings.defaults();
    settings.maxBodyBytes = 8;

    AdmissionDecision decision = gate(settings).admit(new TokenClaims(), SigningFixtures.tokenRequest(),
        new ByteArrayInputStream(new byte[9]));

    assertEquals(400, decision.status);
  }
}
