package org.moxie.sovereign.producers;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.moxie.sovereign.config.Config;
import org.moxie.sovereign.config.FeatureFlags;

@ApplicationScoped
public class FeatureFlagsProducer {

  @Inject
  Config config;

  /**
   * Loads flags once; an unknown flag name fails startup.
   */
  @Produces
  @ApplicationScoped
  public FeatureFlags produceFeatureFlags() {
    FeatureFlags flags = new FeatureFlags();
    flags.load(config.getFeatureFlags());
    return flags;
  }
}
