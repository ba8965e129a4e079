package org.moxie.sovereign.services;

import io.helidon.config.Config;
import io.helidon.microprofile.cdi.RuntimeStart;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.moxie.sovereign.attestation.SovereignAttestationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the attestation pipeline while the server boots, so an unknown feature flag or
 * a bad policy or ring setting stops startup instead of failing the first request.
 */
@ApplicationScoped
public class PipelineStartup {

  private static final Logger log = LoggerFactory.getLogger(PipelineStartup.class);

  @Inject
  SovereignAttestationService attestationService;

  public PipelineStartup() {}

  PipelineStartup(SovereignAttestationService attestationService) {
    this.attestationService = attestationService;
  }

  void onStartup(@Observes @RuntimeStart Config config) {
    try {
      log.info("Unified identity {}", attestationService.isEnabled() ? "enabled" : "disabled");
    } catch (RuntimeException e) {
      log.error("[ALERT] Attestation pipeline misconfigured, refusing to start", e);
      throw e;
    }
  }
}
