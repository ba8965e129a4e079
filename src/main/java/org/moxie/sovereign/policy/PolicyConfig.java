package org.moxie.sovereign.policy;

import org.moxie.sovereign.verifier.HostIntegrityStatus;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only inputs to a policy evaluation.
 *
 * @param allowedGeolocations     Exact locations or {@code "Country:*"} patterns; empty allows any location
 * @param requireHealthyGpu       Whether GPU health must be reported and healthy
 * @param requiredIntegrityStatus Integrity status the host must report
 * @param maxGpuUtilizationPct    Upper bound on reported utilization, {@code null} to skip
 * @param minGpuMemoryMb          Lower bound on reported memory, {@code null} to skip
 */
public record PolicyConfig(Set<String> allowedGeolocations,
                           boolean requireHealthyGpu,
                           HostIntegrityStatus requiredIntegrityStatus,
                           Double maxGpuUtilizationPct,
                           Long minGpuMemoryMb)
{

  public static final List<String> DEFAULT_ALLOWED_GEOLOCATIONS = List.of("Spain:*");

  public PolicyConfig {
    allowedGeolocations     = allowedGeolocations == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(allowedGeolocations));
    requiredIntegrityStatus = requiredIntegrityStatus == null ? HostIntegrityStatus.PASSED_ALL_CHECKS : requiredIntegrityStatus;
  }

  public PolicyConfig(Set<String> allowedGeolocations, boolean requireHealthyGpu, HostIntegrityStatus requiredIntegrityStatus) {
    this(allowedGeolocations, requireHealthyGpu, requiredIntegrityStatus, null, null);
  }

  public static PolicyConfig defaults() {
    return new PolicyConfig(Set.copyOf(DEFAULT_ALLOWED_GEOLOCATIONS), true, HostIntegrityStatus.PASSED_ALL_CHECKS);
  }

  public PolicyConfig withRequireHealthyGpu(boolean require) {
    return new PolicyConfig(allowedGeolocations, require, requiredIntegrityStatus, maxGpuUtilizationPct, minGpuMemoryMb);
  }
}
