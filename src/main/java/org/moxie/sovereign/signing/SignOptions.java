package org.moxie.sovereign.signing;

/**
 * Parameters a caller passes along with a digest.
 *
 * @param hash       Requested hash name, may be {@code null} or unrecognized
 * @param pss        Whether probabilistic padding was explicitly requested
 * @param saltLength PSS salt length, or {@link #SALT_LENGTH_EQUALS_HASH}
 */
public record SignOptions(String hash, boolean pss, int saltLength) {

  /** Sentinel salt length meaning "as long as the digest". */
  public static final int SALT_LENGTH_EQUALS_HASH = -1;

  public static SignOptions defaults() {
    return new SignOptions(null, false, SALT_LENGTH_EQUALS_HASH);
  }

  public static SignOptions pkcs1(String hash) {
    return new SignOptions(hash, false, SALT_LENGTH_EQUALS_HASH);
  }

  public static SignOptions pss(String hash, int saltLength) {
    return new SignOptions(hash, true, saltLength);
  }
}
