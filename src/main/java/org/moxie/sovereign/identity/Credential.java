package org.moxie.sovereign.identity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * A short-lived identity document. {@code token} is the signed JWT carrying the same
 * facts for relying parties.
 */
public record Credential(@JsonProperty("subject_id") String subjectId,
                         @JsonProperty("ttl") Duration ttl,
                         @JsonProperty("selectors") Set<String> selectors,
                         @JsonProperty("parent_id") String parentId,
                         @JsonProperty("issued_at") Instant issuedAt,
                         @JsonProperty("expires_at") Instant expiresAt,
                         @JsonProperty("token") String token)
{

  public Credential {
    selectors = selectors == null ? Set.of() : Set.copyOf(selectors);
  }

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
