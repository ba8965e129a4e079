package org.moxie.sovereign.attestation;

/**
 * Base of every checked failure on the attestation path. Subclasses say whether the node
 * may try again; a retry always starts from a new challenge.
 */
public class AttestationException extends Exception {

  public AttestationException(String message) {
    super(message);
  }

  public AttestationException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return true if a new attempt could succeed without anything on the node changing
   */
  public boolean isRetryable() {
    return false;
  }
}
