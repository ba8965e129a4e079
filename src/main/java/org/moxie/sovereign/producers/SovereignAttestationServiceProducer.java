package org.moxie.sovereign.producers;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.moxie.sovereign.attestation.SovereignAttestationService;
import org.moxie.sovereign.config.Config;
import org.moxie.sovereign.config.FeatureFlags;
import org.moxie.sovereign.evidence.BundleCodec;
import org.moxie.sovereign.evidence.BundleVerifier;
import org.moxie.sovereign.identity.IdentityIssuer;
import org.moxie.sovereign.policy.PolicyConfig;
import org.moxie.sovereign.policy.PolicyEngine;
import org.moxie.sovereign.session.SessionManager;
import org.moxie.sovereign.transport.HttpRpcTransport;
import org.moxie.sovereign.verifier.VerifierClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.List;

/**
 * Assembles the server-side attestation pipeline from configuration.
 */
@ApplicationScoped
public class SovereignAttestationServiceProducer {

  private static final Logger log = LoggerFactory.getLogger(SovereignAttestationServiceProducer.class);

  @Inject
  HttpClient httpClient;

  @Inject
  ObjectMapper mapper;

  @Inject
  Config config;

  @Inject
  FeatureFlags featureFlags;

  /**
   * @throws IllegalStateException if the verifier URL or signing secret is missing
   */
  @Produces
  @ApplicationScoped
  public SovereignAttestationService produceAttestationService() {
    if (config.getVerifierUrl() == null || config.getVerifierUrl().isBlank()) {
      throw new IllegalStateException("verifier.url must be configured");
    }

    if (config.getIdentitySigningSecret() == null || config.getIdentitySigningSecret().isBlank()) {
      throw new IllegalStateException("identity.signing_secret must be configured");
    }

    PolicyConfig   policyConfig   = config.getPolicyConfig();
    VerifierClient verifierClient = new VerifierClient(new HttpRpcTransport(httpClient, URI.create(config.getVerifierUrl())), mapper);
    IdentityIssuer identityIssuer = new IdentityIssuer(config.getIdentitySigningSecret(), config.getTrustDomain(), config.getIdentityTtl());

    log.info("Attestation pipeline ready (verifier={}, required rings={}, allowed geolocations={}, require healthy gpu={})",
             config.getVerifierUrl(), config.getRequiredRings(), policyConfig.allowedGeolocations(), policyConfig.requireHealthyGpu());

    return new SovereignAttestationService(featureFlags,
                                           new SessionManager(config.getSessionTtl()),
                                           new BundleVerifier(new BundleCodec(), config.getRequiredRings()),
                                           verifierClient,
                                           config.getVerifierTimeout(),
                                           new PolicyEngine(),
                                           policyConfig,
                                           List.of(),
                                           identityIssuer);
  }
}
