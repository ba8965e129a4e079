package org.moxie.sovereign.session;

import org.moxie.sovereign.attestation.AttestationException;

/**
 * A challenge could not be used. Always fail-closed; the caller must start over with
 * a new challenge.
 */
public class SessionException extends AttestationException {

  public enum Reason {
    NOT_FOUND,
    ALREADY_CONSUMED,
    EXPIRED
  }

  private final Reason reason;
  private final String sessionId;

  public SessionException(Reason reason, String sessionId) {
    super(describe(reason, sessionId));
    this.reason    = reason;
    this.sessionId = sessionId;
  }

  public Reason getReason() {
    return reason;
  }

  public String getSessionId() {
    return sessionId;
  }

  private static String describe(Reason reason, String sessionId) {
    return switch (reason) {
      case NOT_FOUND -> "session " + sessionId + " not found";
      case ALREADY_CONSUMED -> "session " + sessionId + " already consumed";
      case EXPIRED -> "session " + sessionId + " expired";
    };
  }
}
