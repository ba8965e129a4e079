package org.moxie.sovereign.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.moxie.sovereign.evidence.Ring;
import org.moxie.sovereign.policy.PolicyConfig;
import org.moxie.sovereign.verifier.HostIntegrityStatus;

import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@ApplicationScoped
public class Config {

  @Inject
  @ConfigProperty(name = "feature.flags", defaultValue = "Unified-Identity")
  private String featureFlags;

  @Inject
  @ConfigProperty(name = "session.ttl.seconds", defaultValue = "300")
  private long sessionTtlSeconds;

  @Inject
  @ConfigProperty(name = "verifier.url")
  private String verifierUrl;

  @Inject
  @ConfigProperty(name = "verifier.timeout.seconds", defaultValue = "30")
  private long verifierTimeoutSeconds;

  @Inject
  @ConfigProperty(name = "policy.allowed_geolocations", defaultValue = "Spain:*")
  private String allowedGeolocations;

  @Inject
  @ConfigProperty(name = "policy.require_healthy_gpu", defaultValue = "true")
  private boolean requireHealthyGpu;

  @Inject
  @ConfigProperty(name = "policy.required_integrity_status", defaultValue = "passed_all_checks")
  private String requiredIntegrityStatus;

  @Inject
  @ConfigProperty(name = "policy.max_gpu_utilization_pct", defaultValue = "0")
  private double maxGpuUtilizationPct;

  @Inject
  @ConfigProperty(name = "policy.min_gpu_memory_mb", defaultValue = "0")
  private long minGpuMemoryMb;

  @Inject
  @ConfigProperty(name = "bundle.required_rings", defaultValue = "host")
  private String requiredRings;

  @Inject
  @ConfigProperty(name = "identity.trust_domain", defaultValue = "example.org")
  private String trustDomain;

  @Inject
  @ConfigProperty(name = "identity.ttl.seconds", defaultValue = "3600")
  private long identityTtlSeconds;

  @Inject
  @ConfigProperty(name = "identity.signing_secret")
  private String identitySigningSecret;

  public List<String> getFeatureFlags() {
    return split(featureFlags);
  }

  public Duration getSessionTtl() {
    return Duration.ofSeconds(sessionTtlSeconds);
  }

  public String getVerifierUrl() {
    return verifierUrl;
  }

  public Duration getVerifierTimeout() {
    return Duration.ofSeconds(verifierTimeoutSeconds);
  }

  public PolicyConfig getPolicyConfig() {
    HostIntegrityStatus required = HostIntegrityStatus.fromWire(requiredIntegrityStatus);

    if (required == HostIntegrityStatus.UNKNOWN && !"unknown".equalsIgnoreCase(requiredIntegrityStatus.trim())) {
      throw new IllegalArgumentException("Unsupported policy.required_integrity_status: " + requiredIntegrityStatus);
    }

    return new PolicyConfig(new LinkedHashSet<>(split(allowedGeolocations)),
                            requireHealthyGpu,
                            required,
                            maxGpuUtilizationPct > 0 ? maxGpuUtilizationPct : null,
                            minGpuMemoryMb > 0 ? minGpuMemoryMb : null);
  }

  public Set<Ring> getRequiredRings() {
    return parseRings(requiredRings);
  }

  public String getTrustDomain() {
    return trustDomain;
  }

  public Duration getIdentityTtl() {
    return Duration.ofSeconds(identityTtlSeconds);
  }

  public String getIdentitySigningSecret() { return identitySigningSecret; }

  static Set<Ring> parseRings(String value) {
    EnumSet<Ring> rings = EnumSet.noneOf(Ring.class);

    for (String name : split(value)) {
      try {
        rings.add(Ring.valueOf(name.toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown ring in bundle.required_rings: " + name, e);
      }
    }

    return rings;
  }

  static List<String> split(String value) {
    if (value == null) {
      return new LinkedList<>();
    }

    return Arrays.stream(value.split(","))
                 .map(String::trim)
                 .filter(s -> !s.isEmpty())
                 .collect(Collectors.toList());
  }
}
