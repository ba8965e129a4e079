package org.moxie.sovereign.identity;

import org.moxie.sovereign.session.Session;
import org.moxie.sovereign.verifier.AttestedClaims;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the {@code grc.*} claim blocks embedded in issued credentials.
 */
public final class IdentityClaims {

  public static final String WORKLOAD        = "grc.workload";
  public static final String TPM_ATTESTATION = "grc.tpm-attestation";
  public static final String GEOLOCATION     = "grc.geolocation";

  static final String KEY_SOURCE = "tpm-app-key";

  private IdentityClaims() {}

  public static Map<String, Map<String, Object>> build(String subjectId,
                                                       Session session,
                                                       AttestedClaims claims,
                                                       String appKeyPublic,
                                                       String workloadCodeHash)
  {
    Map<String, Map<String, Object>> result   = new LinkedHashMap<>();
    Map<String, Object>              workload = new LinkedHashMap<>();

    workload.put("workload-id", subjectId);
    workload.put("key-source", KEY_SOURCE);
    if (workloadCodeHash != null) workload.put("workload-code-hash", workloadCodeHash);
    result.put(WORKLOAD, workload);

    Map<String, Object> verified = new LinkedHashMap<>();
    verified.put("geolocation", claims.geolocation());
    verified.put("host_integrity_status", claims.hostIntegrityStatus().wireName());
    claims.gpuMetrics().ifPresent(gpu -> {
      Map<String, Object> health = new LinkedHashMap<>();
      health.put("status", gpu.status());
      health.put("utilization_pct", gpu.utilizationPct());
      health.put("memory_mb", gpu.memoryMb());
      verified.put("gpu_metrics_health", health);
    });

    Map<String, Object> tpm = new LinkedHashMap<>();
    if (appKeyPublic != null) tpm.put("app-key-public", appKeyPublic);
    tpm.put("challenge-nonce", session.nonceHost());
    tpm.put("verified-claims", verified);
    if (claims.auditId() != null) tpm.put("audit-id", claims.auditId());
    result.put(TPM_ATTESTATION, tpm);

    Map<String, Object> geolocation = new LinkedHashMap<>();
    geolocation.put("raw", claims.geolocation());
    if (claims.sensorId() != null) geolocation.put("sensor-id", claims.sensorId());
    result.put(GEOLOCATION, geolocation);

    return result;
  }
}
