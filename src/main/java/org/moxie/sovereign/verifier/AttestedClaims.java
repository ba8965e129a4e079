package org.moxie.sovereign.verifier;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Verified facts about the attested node. Produced only by {@link VerifierClient} and
 * consumed by the policy engine.
 *
 * @param geolocation         Location string, e.g. {@code "Spain: N40.4168, W3.7038"}
 * @param sensorId            Sensor the location came from, when reported
 * @param hostIntegrityStatus Host integrity verdict
 * @param gpuMetricsHealth    Accelerator health, {@code null} for nodes that predate GPU reporting
 * @param auditId             Verifier audit trail identifier
 */
public record AttestedClaims(@JsonProperty("geolocation") String geolocation,
                             @JsonProperty("sensor_id") String sensorId,
                             @JsonProperty("host_integrity_status") HostIntegrityStatus hostIntegrityStatus,
                             @JsonProperty("gpu_metrics_health") GpuMetrics gpuMetricsHealth,
                             @JsonProperty("audit_id") String auditId)
{

  public AttestedClaims {
    hostIntegrityStatus = hostIntegrityStatus == null ? HostIntegrityStatus.UNKNOWN : hostIntegrityStatus;
  }

  public Optional<GpuMetrics> gpuMetrics() {
    return Optional.ofNullable(gpuMetricsHealth);
  }
}
