package org.moxie.sovereign.signing;

import org.moxie.sovereign.attestation.AttestationException;

/**
 * The gateway failed to produce a signature. Transient failures (timeouts) may be
 * retried with a fresh digest, never by reusing a nonce that was already bound.
 */
public class SigningException extends AttestationException {

  private final boolean transientFailure;

  public SigningException(String message) {
    this(message, null, false);
  }

  public SigningException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public SigningException(String message, Throwable cause, boolean transientFailure) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  public boolean isTransient() {
    return transientFailure;
  }

  @Override
  public boolean isRetryable() {
    return transientFailure;
  }
}
