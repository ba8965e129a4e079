package org.moxie.sovereign.signing;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.security.MessageDigest;
import java.security.Signature;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DelegatedSignerTest {

  @Mock
  private SigningGateway gateway;

  private ExecutorService executor;
  private String          publicKeyPem;

  @BeforeEach
  void setUp() {
    executor     = Executors.newCachedThreadPool();
    publicKeyPem = PublicKeys.toPem(TestKeys.rsa().getPublic());
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private DelegatedSigner signer(Duration timeout) {
    return new DelegatedSigner(gateway, publicKeyPem, executor, timeout);
  }

  @Test
  void sign_pssRequested_forwardsSaltVerbatim() throws Exception {
    byte[] digest    = new byte[48];
    byte[] signature = {1, 2, 3};
    when(gateway.sign(digest, HashAlgorithm.SHA384, SignatureScheme.PSS, 20)).thenReturn(signature);

    byte[] result = signer(Duration.ofSeconds(5)).sign(digest, SignOptions.pss("sha384", 20));

    assertSame(signature, result);
    verify(gateway).sign(digest, HashAlgorithm.SHA384, SignatureScheme.PSS, 20);
  }

  @Test
  void sign_pssWithHashLengthSentinel_forwardsSentinel() throws Exception {
    byte[] digest = new byte[32];
    when(gateway.sign(any(), any(), any(), anyInt())).thenReturn(new byte[] {9});

    signer(Duration.ofSeconds(5)).sign(digest, SignOptions.pss("sha256", SignOptions.SALT_LENGTH_EQUALS_HASH));

    verify(gateway).sign(digest, HashAlgorithm.SHA256, SignatureScheme.PSS, SignOptions.SALT_LENGTH_EQUALS_HASH);
  }

  @Test
  void sign_noOptions_defaultsToPkcs1AndSha256() throws Exception {
    byte[] digest = new byte[32];
    when(gateway.sign(any(), any(), any(), anyInt())).thenReturn(new byte[] {9});

    signer(Duration.ofSeconds(5)).sign(digest, null);

    verify(gateway).sign(digest, HashAlgorithm.SHA256, SignatureScheme.PKCS1_V15, SignOptions.SALT_LENGTH_EQUALS_HASH);
  }

  @Test
  void sign_unknownHash_fallsBackToSha256() throws Exception {
    byte[] digest = new byte[32];
    when(gateway.sign(any(), any(), any(), anyInt())).thenReturn(new byte[] {9});

    signer(Duration.ofSeconds(5)).sign(digest, SignOptions.pkcs1("whirlpool"));

    verify(gateway).sign(eq(digest), eq(HashAlgorithm.SHA256), eq(SignatureScheme.PKCS1_V15), anyInt());
  }

  @Test
  void sign_gatewayFailure_propagates() throws Exception {
    SigningException failure = new SigningException("TPM busy");
    when(gateway.sign(any(), any(), any(), anyInt())).thenThrow(failure);

    SigningException e = assertThrows(SigningException.class,
                                      () -> signer(Duration.ofSeconds(5)).sign(new byte[32], SignOptions.defaults()));

    assertSame(failure, e);
    assertFalse(e.isTransient());
    assertFalse(e.isRetryable());
  }

  @Test
  void sign_gatewayTooSlow_isTransientFailure() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    when(gateway.sign(any(), any(), any(), anyInt())).thenAnswer(invocation -> {
      release.await(10, TimeUnit.SECONDS);
      return new byte[] {1};
    });

    try {
      SigningException e = assertThrows(SigningException.class,
                                        () -> signer(Duration.ofMillis(100)).sign(new byte[32], SignOptions.defaults()));

      assertTrue(e.isTransient());
      assertTrue(e.isRetryable());
    } finally {
      release.countDown();
    }
  }

  @Test
  void sign_withSoftwareGateway_producesVerifiableSignature() throws Exception {
    InMemorySigningGateway software = new InMemorySigningGateway(TestKeys.rsa());
    DelegatedSigner        signer   = new DelegatedSigner(software, software.publicKeyPem(), executor, Duration.ofSeconds(5));
    byte[]                 data     = "attested payload".getBytes();

    byte[] signature = signer.sign(MessageDigest.getInstance("SHA-256").digest(data), SignOptions.defaults());

    Signature verifier = Signature.getInstance("SHA256withRSA");
    verifier.initVerify(signer.getPublic());
    verifier.update(data);
    assertTrue(verifier.verify(signature));
  }

  @Test
  void getPublic_returnsParsedKey() {
    assertEquals(TestKeys.rsa().getPublic(), signer(Duration.ofSeconds(1)).getPublic());
  }

  @Test
  void constructor_garbageKey_throws() {
    assertThrows(IllegalArgumentException.class,
                 () -> new DelegatedSigner(gateway, "-----BEGIN PUBLIC KEY-----\n!!!\n-----END PUBLIC KEY-----\n", executor, Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class,
                 () -> new DelegatedSigner(gateway, "", executor, Duration.ofSeconds(1)));
  }

  @Test
  void constructor_nonRsaKey_throws() {
    String ecPem = PublicKeys.toPem(TestKeys.generate("EC", 256).getPublic());

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                                              () -> new DelegatedSigner(gateway, ecPem, executor, Duration.ofSeconds(1)));

    assertTrue(e.getMessage().contains("RSA") || e.getMessage().contains("parse"), e.getMessage());
  }
}
