package org.moxie.sovereign.signing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Digest algorithms the hardware gateway can sign over.
 */
public enum HashAlgorithm {
  SHA256("sha256", "SHA-256", 32, new byte[] {
      0x30, 0x31, 0x30, 0x0d, 0x06, 0x09, 0x60, (byte) 0x86, 0x48, 0x01, 0x65, 0x03, 0x04, 0x02, 0x01, 0x05, 0x00, 0x04, 0x20
  }),
  SHA384("sha384", "SHA-384", 48, new byte[] {
      0x30, 0x41, 0x30, 0x0d, 0x06, 0x09, 0x60, (byte) 0x86, 0x48, 0x01, 0x65, 0x03, 0x04, 0x02, 0x02, 0x05, 0x00, 0x04, 0x30
  }),
  SHA512("sha512", "SHA-512", 64, new byte[] {
      0x30, 0x51, 0x30, 0x0d, 0x06, 0x09, 0x60, (byte) 0x86, 0x48, 0x01, 0x65, 0x03, 0x04, 0x02, 0x03, 0x05, 0x00, 0x04, 0x40
  });

  private static final Logger log = LoggerFactory.getLogger(HashAlgorithm.class);

  private final String wireName;
  private final String jcaName;
  private final int    digestLength;
  private final byte[] digestInfoPrefix;

  HashAlgorithm(String wireName, String jcaName, int digestLength, byte[] digestInfoPrefix) {
    this.wireName         = wireName;
    this.jcaName          = jcaName;
    this.digestLength     = digestLength;
    this.digestInfoPrefix = digestInfoPrefix;
  }

  /**
   * Name understood by the TPM plugin ({@code sha256}, {@code sha384}, {@code sha512}).
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Standard JCA algorithm name, e.g. {@code SHA-256}.
   */
  public String jcaName() {
    return jcaName;
  }

  public int digestLength() {
    return digestLength;
  }

  /**
   * DER prefix of the PKCS#1 v1.5 DigestInfo structure for this hash.
   */
  public byte[] digestInfoPrefix() {
    return digestInfoPrefix.clone();
  }

  /**
   * Map a caller supplied hash name onto a supported algorithm. Accepts wire names and
   * JCA names in any case. Anything unrecognized, including {@code null}, falls back to
   * SHA-256 with a warning instead of failing.
   */
  public static HashAlgorithm resolve(String requested) {
    if (requested == null || requested.isBlank()) {
      return SHA256;
    }

    String normalized = requested.trim().toLowerCase(Locale.ROOT).replace("-", "");

    for (HashAlgorithm algorithm : values()) {
      if (algorithm.wireName.equals(normalized)) {
        return algorithm;
      }
    }

    log.warn("Unsupported hash algorithm {}, using SHA-256", requested);
    return SHA256;
  }
}
