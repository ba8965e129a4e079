package org.moxie.sovereign.signing;

/**
 * RSA padding schemes supported by the TPM App Key.
 */
public enum SignatureScheme {
  /** PKCS#1 v1.5, the legacy default. */
  PKCS1_V15("rsassa"),
  /** Probabilistic signature scheme. */
  PSS("rsapss");

  private final String wireName;

  SignatureScheme(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
