package org.moxie.sovereign.evidence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical encoding of the signed part of a bundle. The aggregator and the server must
 * produce byte-identical payloads, so properties and map keys are always sorted.
 */
public class BundleCodec {

  private final ObjectMapper canonical;

  public BundleCodec() {
    this.canonical = JsonMapper.builder()
                               .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                               .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                               .build();
  }

  /**
   * Bytes covered by the bundle signature: session id, evidence in order and the
   * aggregator's public key. The signature itself is excluded.
   */
  public byte[] signingPayload(String sessionId, List<Evidence> evidence, String aggregatorPublicKey) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("session_id", sessionId);
    payload.put("evidence", evidence);
    payload.put("aggregator_public_key", aggregatorPublicKey);

    try {
      return canonical.writeValueAsBytes(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Evidence is not serializable", e);
    }
  }

  public byte[] signingPayload(EvidenceBundle bundle) {
    return signingPayload(bundle.sessionId(), bundle.evidence(), bundle.aggregatorPublicKey());
  }
}
