package org.moxie.sovereign.attestation;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.sovereign.session.Session;

import java.time.Instant;

/**
 * The part of a session a node gets to see.
 */
public record Challenge(@JsonProperty("session_id") String sessionId,
                        @JsonProperty("nonce_host") String nonceHost,
                        @JsonProperty("nonce_vm") String nonceVm,
                        @JsonProperty("expires_at") Instant expiresAt)
{

  public static Challenge from(Session session) {
    return new Challenge(session.sessionId(), session.nonceHost(), session.nonceVm(), session.expiresAt());
  }

  public Session toSession() {
    return new Session(sessionId, nonceHost, nonceVm, null, expiresAt, false);
  }
}
