package org.moxie.sovereign.verifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.moxie.sovereign.attestation.AttestationException;
import org.moxie.sovereign.evidence.EvidenceBundle;
import org.moxie.sovereign.transport.RpcRequest;
import org.moxie.sovereign.transport.RpcResponse;
import org.moxie.sovereign.transport.RpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;

/**
 * Ships a bundle to the remote verifier and turns its verdict into
 * {@link AttestedClaims}. A call corresponds to exactly one challenge, so nothing is
 * retried here: a caller wanting another attempt must start from a fresh challenge.
 */
public class VerifierClient {

  private static final Logger log = LoggerFactory.getLogger(VerifierClient.class);

  static final String VERIFY_PATH = "/v2.4/verify/evidence";

  static final int MAX_ATTESTATION_LENGTH = 64 * 1024;

  private final RpcTransport transport;
  private final ObjectMapper mapper;

  public VerifierClient(RpcTransport transport, ObjectMapper mapper) {
    this.transport = transport;
    this.mapper    = mapper;
  }

  /**
   * Verify {@code bundle}, abandoning the call once {@code timeout} elapses or the
   * calling thread is interrupted.
   *
   * @return Claims attested by the verifier, never partially populated
   * @throws org.moxie.sovereign.attestation.TransportException on connection failure or timeout
   * @throws VerificationFailedException if the bundle lacks the primary quote, nonce or
   *                                     App Key, on a non-success status, a negative
   *                                     verdict or a result missing required fields
   */
  public AttestedClaims verifyEvidence(EvidenceBundle bundle, Duration timeout) throws AttestationException {
    if (bundle == null) {
      throw new IllegalArgumentException("bundle cannot be null");
    }

    VerificationRequest request = VerificationRequest.from(bundle);
    validate(request);

    String body;

    try {
      body = mapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new AttestationException("Failed to serialize verification request", e);
    }

    log.debug("Sending verification request for session {} to {}", bundle.sessionId(), transport.describe());

    RpcResponse response = transport.exchange(RpcRequest.postJson(VERIFY_PATH, body), timeout);

    if (!response.isSuccess()) {
      log.error("Verifier returned status {} for session {}: {}", response.statusCode(), bundle.sessionId(), response.bodyAsString());
      throw new VerificationFailedException("verifier returned status " + response.statusCode() + ": " + response.bodyAsString(),
                                            response.statusCode());
    }

    JsonNode root;

    try {
      root = mapper.readTree(response.body());
    } catch (IOException e) {
      throw new VerificationFailedException("verifier response is not valid JSON", response.statusCode(), e);
    }

    AttestedClaims claims = parseResults(root == null ? null : root.get("results"), response.statusCode());

    log.info("Verified session {} (geolocation={}, integrity={}, gpu={}, audit_id={})",
             bundle.sessionId(),
             claims.geolocation(),
             claims.hostIntegrityStatus(),
             claims.gpuMetrics().map(GpuMetrics::status).orElse("absent"),
             claims.auditId());

    return claims;
  }

  /**
   * Reject a request the verifier could never accept before it leaves this process.
   */
  static void validate(VerificationRequest request) throws VerificationFailedException {
    String attestation = request.tpmSignedAttestation();

    if (attestation == null || attestation.isEmpty()) {
      throw new VerificationFailedException("tpm_signed_attestation is required");
    }

    if (attestation.length() > MAX_ATTESTATION_LENGTH) {
      throw new VerificationFailedException("tpm_signed_attestation exceeds maximum size of 64 KiB");
    }

    try {
      Base64.getDecoder().decode(attestation);
    } catch (IllegalArgumentException e) {
      throw new VerificationFailedException("tpm_signed_attestation must be valid base64", null, e);
    }

    if (request.challengeNonce() == null || request.challengeNonce().isEmpty()) {
      throw new VerificationFailedException("challenge_nonce is required");
    }

    if (request.appKeyPublic() == null || request.appKeyPublic().isEmpty()) {
      throw new VerificationFailedException("app_key_public is required");
    }
  }

  private AttestedClaims parseResults(JsonNode results, int status) throws VerificationFailedException {
    if (results == null || !results.isObject()) {
      throw new VerificationFailedException("verifier response has no results", status);
    }

    JsonNode verified = results.get("verified");

    if (verified == null || !verified.isBoolean()) {
      throw new VerificationFailedException("verifier response has no verified flag", status);
    }

    if (!verified.booleanValue()) {
      log.warn("Verifier rejected evidence: {}", results.path("verification_details"));
      throw new VerificationFailedException("verifier reported evidence as not verified", status);
    }

    JsonNode claims = results.get("attested_claims");

    if (claims == null || !claims.isObject()) {
      throw new VerificationFailedException("verifier response has no attested_claims", status);
    }

    JsonNode geolocationNode = claims.get("geolocation");
    String   geolocation     = null;
    String   sensorId        = null;

    if (geolocationNode != null && geolocationNode.isTextual()) {
      geolocation = geolocationNode.asText();
    } else if (geolocationNode != null && geolocationNode.isObject()) {
      geolocation = geolocationNode.path("value").asText(null);
      sensorId    = geolocationNode.path("sensor_id").asText(null);
    }

    if (geolocation == null || geolocation.isEmpty()) {
      throw new VerificationFailedException("attested_claims has no geolocation", status);
    }

    JsonNode integrity = claims.get("host_integrity_status");

    if (integrity == null || !integrity.isTextual()) {
      throw new VerificationFailedException("attested_claims has no host_integrity_status", status);
    }

    GpuMetrics gpu     = null;
    JsonNode   gpuNode = claims.get("gpu_metrics_health");

    if (gpuNode != null && gpuNode.isObject() && !gpuNode.path("status").asText("").isEmpty()) {
      gpu = new GpuMetrics(gpuNode.path("status").asText(),
                           gpuNode.path("utilization_pct").asDouble(),
                           gpuNode.path("memory_mb").asLong());
    }

    String auditId = results.path("audit_id").asText(claims.path("audit_id").asText(null));

    return new AttestedClaims(geolocation, sensorId, HostIntegrityStatus.fromWire(integrity.asText()), gpu, auditId);
  }
}
