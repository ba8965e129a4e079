package org.moxie.sovereign.signing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Signs with the TPM App Key without ever touching it. Every request is forwarded to
 * the {@link SigningGateway}; the returned bytes are handed back untouched and their
 * correctness is left to whoever consumes them (the TLS peer or a document verifier).
 */
public class DelegatedSigner {

  private static final Logger log = LoggerFactory.getLogger(DelegatedSigner.class);

  private final SigningGateway  gateway;
  private final RSAPublicKey    publicKey;
  private final ExecutorService executor;
  private final Duration        timeout;

  /**
   * @param gateway         Gateway owning the private key
   * @param publicKeyPem    PEM public key or certificate of the App Key
   * @param executor        Executor running the (possibly slow) hardware call
   * @param timeout         Upper bound on a single signing call
   * @throws IllegalArgumentException if the key encoding cannot be parsed or is not RSA
   */
  public DelegatedSigner(SigningGateway gateway, String publicKeyPem, ExecutorService executor, Duration timeout) {
    this.gateway   = Objects.requireNonNull(gateway, "Signing gateway is required");
    this.publicKey = PublicKeys.parseRsa(publicKeyPem);
    this.executor  = Objects.requireNonNull(executor, "Executor is required");
    this.timeout   = Objects.requireNonNull(timeout, "Timeout is required");
  }

  public RSAPublicKey getPublic() {
    return publicKey;
  }

  /**
   * Sign {@code digest} through the gateway.
   *
   * @param digest  Digest of the data to sign
   * @param options Requested hash, padding and salt length
   * @return Signature bytes exactly as the gateway produced them
   * @throws SigningException if the gateway fails; transient when the call timed out
   */
  public byte[] sign(byte[] digest, SignOptions options) throws SigningException {
    SignOptions     effective = options != null ? options : SignOptions.defaults();
    HashAlgorithm   hash      = HashAlgorithm.resolve(effective.hash());
    SignatureScheme scheme    = effective.pss() ? SignatureScheme.PSS : SignatureScheme.PKCS1_V15;
    int             salt      = effective.pss() ? effective.saltLength() : SignOptions.SALT_LENGTH_EQUALS_HASH;

    if (scheme == SignatureScheme.PSS) {
      log.info("PSS requested, signing with hash {} and salt length {}", hash.wireName(), salt);
    } else {
      log.debug("Signing {} byte digest with hash {} using PKCS#1 v1.5", digest.length, hash.wireName());
    }

    if (log.isDebugEnabled() && digest.length >= 8) {
      log.debug("Digest prefix {}", HexFormat.of().formatHex(digest, 0, 8));
    }

    Future<byte[]> pending = executor.submit(() -> gateway.sign(digest, hash, scheme, salt));

    try {
      byte[] signature = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      log.debug("Gateway produced {} byte {} signature", signature.length, scheme.wireName());
      return signature;
    } catch (TimeoutException e) {
      pending.cancel(true);
      throw new SigningException("Signing gateway did not answer within " + timeout.toMillis() + " ms", e, true);
    } catch (InterruptedException e) {
      pending.cancel(true);
      Thread.currentThread().interrupt();
      throw new SigningException("Interrupted while waiting for signing gateway", e, true);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof SigningException signingException) {
        throw signingException;
      }
      throw new SigningException("Failed to sign using TPM App Key: " + e.getCause().getMessage(), e.getCause());
    }
  }
}
