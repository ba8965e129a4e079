package org.moxie.sovereign.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.sovereign.evidence.Ring;

import java.time.Instant;

/**
 * A single-use freshness challenge. Snapshot value: the authoritative consumed flag
 * lives in the {@link SessionManager}.
 */
public record Session(@JsonProperty("session_id") String sessionId,
                      @JsonProperty("nonce_host") String nonceHost,
                      @JsonProperty("nonce_vm") String nonceVm,
                      @JsonProperty("issued_at") Instant issuedAt,
                      @JsonProperty("expires_at") Instant expiresAt,
                      @JsonProperty("consumed") boolean consumed)
{

  /**
   * The nonce a ring binds its quote to. The workload ring is attested inside the VM
   * and shares the VM challenge.
   */
  public String nonceFor(Ring ring) {
    return switch (ring) {
      case HOST -> nonceHost;
      case VM, WORKLOAD -> nonceVm;
    };
  }

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
