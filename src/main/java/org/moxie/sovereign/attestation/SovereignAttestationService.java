package org.moxie.sovereign.attestation;

import org.moxie.sovereign.config.FeatureFlags;
import org.moxie.sovereign.evidence.BundleVerifier;
import org.moxie.sovereign.evidence.EvidenceBundle;
import org.moxie.sovereign.identity.Credential;
import org.moxie.sovereign.identity.IdentityIssuer;
import org.moxie.sovereign.nodeattestor.UnifiedIdentityNodeAttestor;
import org.moxie.sovereign.policy.PolicyConfig;
import org.moxie.sovereign.policy.PolicyEngine;
import org.moxie.sovereign.policy.PolicyResult;
import org.moxie.sovereign.policy.PolicyRule;
import org.moxie.sovereign.session.Session;
import org.moxie.sovereign.session.SessionManager;
import org.moxie.sovereign.verifier.AttestedClaims;
import org.moxie.sovereign.verifier.VerifierClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Server side of node attestation: hands out challenges, then takes a bundle through
 * local binding checks, the remote verifier and the policy engine before issuing an
 * identity.
 */
public class SovereignAttestationService {

  private static final Logger log = LoggerFactory.getLogger(SovereignAttestationService.class);

  private final FeatureFlags     featureFlags;
  private final SessionManager   sessions;
  private final BundleVerifier   bundleVerifier;
  private final VerifierClient   verifierClient;
  private final Duration         verifierTimeout;
  private final PolicyEngine     policyEngine;
  private final PolicyConfig     policyConfig;
  private final List<PolicyRule> extraRules;
  private final IdentityIssuer   identityIssuer;

  public SovereignAttestationService(FeatureFlags featureFlags,
                                     SessionManager sessions,
                                     BundleVerifier bundleVerifier,
                                     VerifierClient verifierClient,
                                     Duration verifierTimeout,
                                     PolicyEngine policyEngine,
                                     PolicyConfig policyConfig,
                                     List<PolicyRule> extraRules,
                                     IdentityIssuer identityIssuer)
  {
    this.featureFlags    = featureFlags;
    this.sessions        = sessions;
    this.bundleVerifier  = bundleVerifier;
    this.verifierClient  = verifierClient;
    this.verifierTimeout = verifierTimeout;
    this.policyEngine    = policyEngine;
    this.policyConfig    = policyConfig;
    this.extraRules      = extraRules == null ? List.of() : List.copyOf(extraRules);
    this.identityIssuer  = identityIssuer;
  }

  public boolean isEnabled() {
    return featureFlags.isEnabled(FeatureFlags.Flag.UNIFIED_IDENTITY);
  }

  /**
   * Answer a node attestation trigger with a fresh challenge.
   *
   * @throws IllegalStateException    if unified identity is disabled
   * @throws IllegalArgumentException if {@code payload} is not the unified identity marker
   */
  public Session beginAttestation(byte[] payload) {
    requireEnabled();

    if (!UnifiedIdentityNodeAttestor.isMarker(payload)) {
      throw new IllegalArgumentException("Unexpected node attestation payload");
    }

    return sessions.issueChallenge();
  }

  /**
   * Verify a submitted bundle and, if policy allows, issue the requested identity. The
   * session is consumed before the remote verifier is called, so whatever happens next
   * the same nonces cannot be submitted again.
   *
   * @return The policy verdict, with a credential when allowed
   * @throws org.moxie.sovereign.session.SessionException        if the session is unknown, expired or already used
   * @throws org.moxie.sovereign.evidence.BundleException         if the bundle fails local binding checks
   * @throws org.moxie.sovereign.verifier.VerificationFailedException if the verifier rejects the evidence
   * @throws TransportException                                    if the verifier cannot be reached in time
   */
  public AttestationOutcome completeAttestation(EvidenceSubmission submission) throws AttestationException {
    requireEnabled();

    if (submission == null || submission.bundle() == null || submission.identity() == null) {
      throw new IllegalArgumentException("Submission must carry a bundle and an identity request");
    }

    EvidenceBundle bundle  = submission.bundle();
    Session        session = sessions.lookup(bundle.sessionId());

    bundleVerifier.verify(bundle, session);

    Session        consumed = sessions.consume(session.sessionId());
    AttestedClaims claims   = verifierClient.verifyEvidence(bundle, verifierTimeout);
    PolicyResult   verdict  = policyEngine.evaluate(claims, policyConfig, extraRules);

    if (!verdict.allowed()) {
      log.warn("Denied identity for session {}: {}", session.sessionId(), verdict.reason());
      return AttestationOutcome.denied(verdict, claims);
    }

    Credential credential = identityIssuer.issue(consumed, verdict, submission.identity(), claims,
                                                 bundle.aggregatorPublicKey(),
                                                 bundle.workloadCodeHash().orElse(null));

    return AttestationOutcome.issued(verdict, claims, credential);
  }

  private void requireEnabled() {
    if (!isEnabled()) {
      throw new IllegalStateException("Unified identity is disabled");
    }
  }
}
