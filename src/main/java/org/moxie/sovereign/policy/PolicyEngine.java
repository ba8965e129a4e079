package org.moxie.sovereign.policy;

import org.moxie.sovereign.verifier.AttestedClaims;
import org.moxie.sovereign.verifier.GpuMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether verified claims are acceptable. Stateless: checks run in a fixed order
 * and the first failure is returned.
 */
public class PolicyEngine {

  private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

  public PolicyResult evaluate(AttestedClaims claims, PolicyConfig config) {
    return evaluate(claims, config, List.of());
  }

  public PolicyResult evaluate(AttestedClaims claims, PolicyConfig config, List<PolicyRule> extraRules) {
    if (claims == null) {
      return denied(PolicyResult.deny("no attested claims"));
    }

    if (config == null) {
      config = PolicyConfig.defaults();
    }

    if (!config.allowedGeolocations().isEmpty() &&
        !GeolocationMatcher.matchesAny(claims.geolocation(), config.allowedGeolocations()))
    {
      return denied(PolicyResult.deny(String.format(Locale.ROOT, "geolocation %s not in allowed list %s",
                                                    claims.geolocation(), config.allowedGeolocations())));
    }

    if (claims.hostIntegrityStatus() != config.requiredIntegrityStatus()) {
      return denied(PolicyResult.deny(String.format(Locale.ROOT, "host integrity status is %s, required %s",
                                                    claims.hostIntegrityStatus().wireName(),
                                                    config.requiredIntegrityStatus().wireName())));
    }

    Optional<GpuMetrics> gpu = claims.gpuMetrics();

    if (config.requireHealthyGpu()) {
      if (gpu.isEmpty()) {
        return denied(PolicyResult.deny("gpu metrics missing but healthy gpu required"));
      }

      if (!gpu.get().isHealthy()) {
        return denied(PolicyResult.deny(String.format(Locale.ROOT, "gpu status is %s, required %s", gpu.get().status(), GpuMetrics.HEALTHY)));
      }
    }

    if (gpu.isPresent() && config.maxGpuUtilizationPct() != null &&
        gpu.get().utilizationPct() > config.maxGpuUtilizationPct())
    {
      return denied(PolicyResult.deny(String.format(Locale.ROOT, "gpu utilization %.1f%% exceeds maximum %.1f%%",
                                                    gpu.get().utilizationPct(), config.maxGpuUtilizationPct())));
    }

    if (gpu.isPresent() && config.minGpuMemoryMb() != null &&
        gpu.get().memoryMb() < config.minGpuMemoryMb())
    {
      return denied(PolicyResult.deny(String.format(Locale.ROOT, "gpu memory %d MB below minimum %d MB",
                                                    gpu.get().memoryMb(), config.minGpuMemoryMb())));
    }

    if (extraRules != null) {
      for (PolicyRule rule : extraRules) {
        Optional<String> veto = rule.veto(claims);

        if (veto.isPresent()) {
          return denied(PolicyResult.deny(veto.get()));
        }
      }
    }

    return PolicyResult.allow();
  }

  private static PolicyResult denied(PolicyResult result) {
    log.warn("Policy violation: {}", result.reason());
    return result;
  }
}
