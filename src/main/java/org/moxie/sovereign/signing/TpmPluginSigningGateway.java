package org.moxie.sovereign.signing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.moxie.sovereign.attestation.AttestationException;
import org.moxie.sovereign.attestation.TransportException;
import org.moxie.sovereign.transport.RpcRequest;
import org.moxie.sovereign.transport.RpcResponse;
import org.moxie.sovereign.transport.RpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Talks to the local TPM plugin server, which holds the App Key inside the TPM. The
 * plugin is normally reached over a Unix domain socket, but any {@link RpcTransport}
 * works.
 */
public class TpmPluginSigningGateway implements SigningGateway {

  private static final Logger log = LoggerFactory.getLogger(TpmPluginSigningGateway.class);

  private static final String SUCCESS = "success";

  private final RpcTransport transport;
  private final ObjectMapper mapper;
  private final Duration     callTimeout;

  public record AppKeyCertificate(byte[] certificate, String agentUuid) {}

  public TpmPluginSigningGateway(RpcTransport transport, ObjectMapper mapper, Duration callTimeout) {
    this.transport   = transport;
    this.mapper      = mapper;
    this.callTimeout = callTimeout;
  }

  @Override
  public byte[] sign(byte[] digest, HashAlgorithm hash, SignatureScheme scheme, int saltLength) throws SigningException {
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("data", Base64.getEncoder().encodeToString(digest));
    request.put("hash_alg", hash.wireName());
    request.put("is_digest", true);
    request.put("scheme", scheme.wireName());
    request.put("salt_length", saltLength);

    log.debug("Signing via TPM plugin at {} (hash={}, scheme={}, salt={})",
              transport.describe(), hash.wireName(), scheme.wireName(), saltLength);

    JsonNode result;

    try {
      result = call("/sign-data", request);
    } catch (TransportException e) {
      throw new SigningException("Failed to reach TPM plugin: " + e.getMessage(), e, e.isTimeout());
    } catch (AttestationException e) {
      throw new SigningException("Failed to sign data via TPM plugin: " + e.getMessage(), e);
    }

    String signature = result.path("signature").asText(null);

    if (signature == null) {
      throw new SigningException("TPM plugin returned no signature");
    }

    try {
      return Base64.getDecoder().decode(signature);
    } catch (IllegalArgumentException e) {
      throw new SigningException("Invalid base64 signature from TPM plugin", e);
    }
  }

  /**
   * Fetch the PEM encoded App Key public key.
   */
  public String getAppKeyPublic() throws AttestationException {
    JsonNode result       = call("/get-app-key", Map.of());
    String   appKeyPublic = result.path("app_key_public").asText("");

    if (appKeyPublic.isEmpty()) {
      throw new AttestationException("App Key not available from TPM plugin");
    }

    return appKeyPublic;
  }

  /**
   * Ask the plugin for an App Key certificate signed by the attestation key
   * (delegated certification), bound to {@code challengeNonce}.
   */
  public AppKeyCertificate requestCertificate(String appKeyPublic, String challengeNonce) throws AttestationException {
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("app_key_public", appKeyPublic);
    request.put("challenge_nonce", challengeNonce);

    JsonNode result      = call("/request-certificate", request);
    String   certificate = result.path("app_key_certificate").asText("");

    if (certificate.isEmpty()) {
      throw new AttestationException("TPM plugin returned no App Key certificate");
    }

    try {
      return new AppKeyCertificate(Base64.getDecoder().decode(certificate), result.path("agent_uuid").asText(null));
    } catch (IllegalArgumentException e) {
      throw new AttestationException("Invalid base64 App Key certificate", e);
    }
  }

  private JsonNode call(String path, Map<String, Object> body) throws AttestationException {
    String json;

    try {
      json = mapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new AttestationException("Failed to serialize TPM plugin request", e);
    }

    RpcResponse response = transport.exchange(RpcRequest.postJson(path, json), callTimeout);

    if (response.statusCode() != 200) {
      throw new AttestationException("TPM plugin " + path + " failed with status " + response.statusCode() + ": " + response.bodyAsString());
    }

    JsonNode result;

    try {
      result = mapper.readTree(response.body());
    } catch (IOException e) {
      throw new AttestationException("Failed to parse TPM plugin response from " + path, e);
    }

    String status = result.path("status").asText("");

    if (!SUCCESS.equals(status)) {
      throw new AttestationException("TPM plugin " + path + " returned status=" + status);
    }

    return result;
  }
}
