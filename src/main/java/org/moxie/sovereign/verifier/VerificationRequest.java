package org.moxie.sovereign.verifier;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.moxie.sovereign.evidence.Evidence;
import org.moxie.sovereign.evidence.EvidenceBundle;
import org.moxie.sovereign.evidence.Ring;

import java.util.Base64;
import java.util.List;

/**
 * Body of {@code POST /v2.4/verify/evidence}. The flat fields are what the verifier
 * needs for the App Key proof of residency; the per-ring evidence rides along for the
 * nested rings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationRequest(@JsonProperty("tpm_signed_attestation") String tpmSignedAttestation,
                                  @JsonProperty("hash_alg") String hashAlg,
                                  @JsonProperty("app_key_public") String appKeyPublic,
                                  @JsonProperty("app_key_certificate") String appKeyCertificate,
                                  @JsonProperty("challenge_nonce") String challengeNonce,
                                  @JsonProperty("workload_code_hash") String workloadCodeHash,
                                  @JsonProperty("session_id") String sessionId,
                                  @JsonProperty("evidence") List<Evidence> evidence,
                                  @JsonProperty("bundle_signature") String bundleSignature,
                                  @JsonProperty("metadata") Metadata metadata)
{

  public record Metadata(@JsonProperty("source") String source,
                         @JsonProperty("submission_type") String submissionType) {}

  static final String SOURCE          = "sovereign-identity-server";
  static final String SUBMISSION_TYPE = "PoR/tpm-app-key";

  public static VerificationRequest from(EvidenceBundle bundle) {
    Base64.Encoder encoder = Base64.getEncoder();
    Evidence       primary = bundle.evidenceFor(Ring.HOST)
                                   .orElseGet(() -> bundle.evidence().isEmpty() ? null : bundle.evidence().get(0));

    return new VerificationRequest(primary == null ? null : encoder.encodeToString(primary.quoteBytes()),
                                   "sha256",
                                   bundle.aggregatorPublicKey(),
                                   bundle.aggregatorCertificate() == null ? null : encoder.encodeToString(bundle.aggregatorCertificate()),
                                   primary == null ? null : primary.nonce(),
                                   bundle.workloadCodeHash().orElse(null),
                                   bundle.sessionId(),
                                   bundle.evidence(),
                                   bundle.signature() == null ? null : encoder.encodeToString(bundle.signature()),
                                   new Metadata(SOURCE, SUBMISSION_TYPE));
  }
}
