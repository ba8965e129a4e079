package org.moxie.sovereign.signing;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.HexFormat;

/**
 * PEM helpers for App Key material.
 */
public final class PublicKeys {

  private static final String PUBLIC_KEY_LABEL  = "PUBLIC KEY";
  private static final String CERTIFICATE_LABEL = "CERTIFICATE";

  private PublicKeys() {}

  /**
   * Parse an RSA public key from either a {@code PUBLIC KEY} or a {@code CERTIFICATE}
   * PEM block.
   *
   * @throws IllegalArgumentException if the encoding cannot be parsed or the key is not RSA
   */
  public static RSAPublicKey parseRsa(String pem) {
    if (pem == null || pem.isBlank()) {
      throw new IllegalArgumentException("Public key encoding is empty");
    }

    PublicKey key;

    try {
      if (pem.contains("BEGIN " + CERTIFICATE_LABEL)) {
        CertificateFactory factory = CertificateFactory.getInstance("X.509");
        X509Certificate    cert    = (X509Certificate) factory.generateCertificate(
            new ByteArrayInputStream(pem.getBytes(StandardCharsets.US_ASCII)));
        key = cert.getPublicKey();
      } else {
        byte[] der = decodePem(pem, PUBLIC_KEY_LABEL);
        key = KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
      }
    } catch (GeneralSecurityException e) {
      throw new IllegalArgumentException("Failed to parse public key: " + e.getMessage(), e);
    }

    if (key instanceof RSAPublicKey rsaKey) {
      return rsaKey;
    }

    throw new IllegalArgumentException("Public key is not RSA: " + key.getAlgorithm());
  }

  public static String toPem(PublicKey key) {
    String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                        .encodeToString(key.getEncoded());

    return "-----BEGIN " + PUBLIC_KEY_LABEL + "-----\n" + body + "\n-----END " + PUBLIC_KEY_LABEL + "-----\n";
  }

  /**
   * SHA-256 over the SubjectPublicKeyInfo encoding, hex encoded. Used as the signer
   * key identifier inside evidence.
   */
  public static String fingerprint(PublicKey key) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(key.getEncoded()));
    } catch (NoSuchAlgorithmException e) {
      throw new AssertionError("SHA-256 not available", e);
    }
  }

  private static byte[] decodePem(String pem, String label) {
    String begin = "-----BEGIN " + label + "-----";
    String end   = "-----END " + label + "-----";
    int    from  = pem.indexOf(begin);
    int    to    = pem.indexOf(end);

    if (from < 0 || to < from) {
      throw new IllegalArgumentException("Failed to decode PEM " + label + " block");
    }

    String body = pem.substring(from + begin.length(), to).replaceAll("\\s", "");

    try {
      return Base64.getDecoder().decode(body);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in PEM " + label + " block", e);
    }
  }
}
