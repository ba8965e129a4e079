package org.moxie.sovereign.attestation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.sovereign.identity.Credential;
import org.moxie.sovereign.policy.PolicyResult;
import org.moxie.sovereign.verifier.AttestedClaims;

/**
 * Result of a completed attempt. A credential is present exactly when the policy allowed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttestationOutcome(@JsonProperty("policy") PolicyResult policy,
                                 @JsonProperty("claims") AttestedClaims claims,
                                 @JsonProperty("credential") Credential credential)
{

  public static AttestationOutcome issued(PolicyResult policy, AttestedClaims claims, Credential credential) {
    return new AttestationOutcome(policy, claims, credential);
  }

  public static AttestationOutcome denied(PolicyResult policy, AttestedClaims claims) {
    return new AttestationOutcome(policy, claims, null);
  }

  @JsonIgnore
  public boolean isIssued() {
    return credential != null;
  }
}
