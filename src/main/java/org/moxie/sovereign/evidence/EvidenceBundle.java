package org.moxie.sovereign.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Evidence from every ring taking part in one attempt, signed by the aggregator's App
 * Key so the verifier authenticates the aggregator as well as each hardware root.
 */
public record EvidenceBundle(@JsonProperty("session_id") String sessionId,
                             @JsonProperty("evidence") List<Evidence> evidence,
                             @JsonProperty("aggregator_public_key") String aggregatorPublicKey,
                             @JsonProperty("aggregator_certificate") byte[] aggregatorCertificate,
                             @JsonProperty("signature") byte[] signature)
{

  public EvidenceBundle {
    evidence = evidence == null ? List.of() : List.copyOf(evidence);
  }

  public Optional<Evidence> evidenceFor(Ring ring) {
    return evidence.stream().filter(e -> e.ring() == ring).findFirst();
  }

  public Optional<String> workloadCodeHash() {
    return evidenceFor(Ring.WORKLOAD).map(e -> e.extraMetadata().get(Evidence.IDENTITY_METADATA));
  }
}
