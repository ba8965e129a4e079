package org.moxie.sovereign.verifier;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Accelerator health as attested by the verifier.
 */
public record GpuMetrics(@JsonProperty("status") String status,
                         @JsonProperty("utilization_pct") double utilizationPct,
                         @JsonProperty("memory_mb") long memoryMb)
{

  public static final String HEALTHY = "healthy";

  @JsonIgnore
  public boolean isHealthy() {
    return HEALTHY.equals(status);
  }
}
