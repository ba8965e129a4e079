package org.moxie.sovereign.verifier;

import org.moxie.sovereign.attestation.AttestationException;

import java.util.OptionalInt;

/**
 * The remote verifier rejected the evidence, answered with a non-success status, or
 * returned a result missing required fields. Fail-closed, never retried automatically.
 */
public class VerificationFailedException extends AttestationException {

  private final Integer remoteStatus;

  public VerificationFailedException(String message) {
    this(message, null, null);
  }

  public VerificationFailedException(String message, Integer remoteStatus) {
    this(message, remoteStatus, null);
  }

  public VerificationFailedException(String message, Integer remoteStatus, Throwable cause) {
    super(message, cause);
    this.remoteStatus = remoteStatus;
  }

  public OptionalInt getRemoteStatus() {
    return remoteStatus == null ? OptionalInt.empty() : OptionalInt.of(remoteStatus);
  }
}
