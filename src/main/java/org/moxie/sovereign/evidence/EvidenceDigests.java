package org.moxie.sovereign.evidence;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;

/**
 * Digests that tie a quote to a challenge. Every string is length-prefixed so that
 * field boundaries cannot be shifted between values.
 */
public final class EvidenceDigests {

  private EvidenceDigests() {}

  /**
   * SHA-256 over a ring's measured state: identity, integrity summary and metadata in
   * key order.
   */
  public static byte[] claimsDigest(Ring ring, MeasuredState state) {
    MessageDigest digest = sha256();

    update(digest, ring.name());
    update(digest, state.identity());
    update(digest, state.integrityLogSummary());

    for (Map.Entry<String, String> entry : state.metadata().entrySet()) {
      update(digest, entry.getKey());
      update(digest, entry.getValue());
    }

    return digest.digest();
  }

  /**
   * SHA-256 of {@code session_id || ring_nonce || claims_digest}; the value a quote
   * must carry as its qualifying data.
   */
  public static byte[] bindingHash(String sessionId, String nonce, byte[] claimsDigest) {
    MessageDigest digest = sha256();

    update(digest, sessionId);
    update(digest, nonce);
    digest.update(claimsDigest);

    return digest.digest();
  }

  public static byte[] sha256(byte[] data) {
    return sha256().digest(data);
  }

  private static void update(MessageDigest digest, String value) {
    byte[] bytes = (value == null ? "" : value).getBytes(StandardCharsets.UTF_8);
    digest.update(ByteBuffer.allocate(4).putInt(bytes.length).array());
    digest.update(bytes);
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new AssertionError("SHA-256 not available", e);
    }
  }
}
