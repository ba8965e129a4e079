package org.moxie.sovereign.signing;

import java.io.ByteArrayOutputStream;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.Signature;

/**
 * Software stand-in for the TPM plugin, backed by a JCA key pair. Used for local runs
 * and tests where no TPM is present. Only PKCS#1 v1.5 is supported: the JDK offers no
 * raw-digest PSS primitive.
 */
public class InMemorySigningGateway implements SigningGateway {

  private final KeyPair keyPair;

  public InMemorySigningGateway(KeyPair keyPair) {
    if (!"RSA".equals(keyPair.getPrivate().getAlgorithm())) {
      throw new IllegalArgumentException("Expected an RSA key pair but got " + keyPair.getPrivate().getAlgorithm());
    }
    this.keyPair = keyPair;
  }

  public String publicKeyPem() {
    return PublicKeys.toPem(keyPair.getPublic());
  }

  @Override
  public byte[] sign(byte[] digest, HashAlgorithm hash, SignatureScheme scheme, int saltLength) throws SigningException {
    if (scheme != SignatureScheme.PKCS1_V15) {
      throw new SigningException("Scheme " + scheme.wireName() + " is not supported by the in-memory gateway");
    }

    if (digest.length != hash.digestLength()) {
      throw new SigningException("Digest length " + digest.length + " does not match " + hash.wireName());
    }

    try {
      ByteArrayOutputStream digestInfo = new ByteArrayOutputStream();
      digestInfo.writeBytes(hash.digestInfoPrefix());
      digestInfo.writeBytes(digest);

      Signature signature = Signature.getInstance("NONEwithRSA");
      signature.initSign(keyPair.getPrivate());
      signature.update(digestInfo.toByteArray());
      return signature.sign();
    } catch (GeneralSecurityException e) {
      throw new SigningException("Software signing failed", e);
    }
  }
}
