package org.moxie.sovereign.attestation;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.sovereign.evidence.EvidenceBundle;
import org.moxie.sovereign.identity.IdentityRequest;

/**
 * Body of {@code POST /v1/node/evidence}.
 */
public record EvidenceSubmission(@JsonProperty("bundle") EvidenceBundle bundle,
                                 @JsonProperty("identity") IdentityRequest identity) {}
