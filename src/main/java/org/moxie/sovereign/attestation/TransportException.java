package org.moxie.sovereign.attestation;

/**
 * Connection or timeout failure talking to a remote collaborator (verifier, TPM plugin,
 * keylime agent, attestation server). Retryable by the caller, but only with a fresh
 * challenge when the failed call carried a nonce.
 */
public class TransportException extends AttestationException {

  private final boolean timeout;

  public TransportException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public TransportException(String message, Throwable cause, boolean timeout) {
    super(message, cause);
    this.timeout = timeout;
  }

  public boolean isTimeout() {
    return timeout;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
