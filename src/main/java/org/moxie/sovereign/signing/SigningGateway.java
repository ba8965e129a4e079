package org.moxie.sovereign.signing;

/**
 * Sole owner of the private key material. Callers hand over a digest plus parameters
 * and get back whatever signature bytes the hardware produced.
 */
public interface SigningGateway {

  /**
   * Sign a precomputed digest.
   *
   * @param digest     Digest to sign, already hashed with {@code hash}
   * @param hash       Hash algorithm the digest was produced with
   * @param scheme     Padding scheme
   * @param saltLength PSS salt length, ignored for PKCS#1 v1.5
   * @return Raw signature bytes
   * @throws SigningException if the gateway refuses or cannot be reached
   */
  byte[] sign(byte[] digest, HashAlgorithm hash, SignatureScheme scheme, int saltLength) throws SigningException;
}
