package org.moxie.sovereign.evidence;

import org.moxie.sovereign.attestation.AttestationException;

/**
 * A bundle violated a binding rule. Fail-closed and never retried with the same session.
 */
public class BundleException extends AttestationException {

  public enum Kind {
    INCOMPLETE_BUNDLE,
    SESSION_MISMATCH,
    DUPLICATE_RING,
    BINDING_MISMATCH,
    BAD_SIGNATURE
  }

  private final Kind kind;

  public BundleException(Kind kind, String message) {
    super(kind + ": " + message);
    this.kind = kind;
  }

  public BundleException(Kind kind, String message, Throwable cause) {
    super(kind + ": " + message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
