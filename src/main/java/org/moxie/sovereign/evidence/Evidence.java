package org.moxie.sovereign.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One ring's evidence for one attestation attempt. Immutable once collected.
 */
public record Evidence(@JsonProperty("ring") Ring ring,
                       @JsonProperty("session_id") String sessionId,
                       @JsonProperty("nonce") String nonce,
                       @JsonProperty("quote") byte[] quoteBytes,
                       @JsonProperty("signer_public_key_id") String signerPublicKeyId,
                       @JsonProperty("platform_measurements") List<String> platformMeasurements,
                       @JsonProperty("event_log") byte[] eventLog,
                       @JsonProperty("claims_digest") byte[] claimsDigest,
                       @JsonProperty("binding_hash") byte[] bindingHash,
                       @JsonProperty("extra_metadata") Map<String, String> extraMetadata)
{

  public static final String IDENTITY_METADATA = "identity";

  public Evidence {
    platformMeasurements = platformMeasurements == null ? List.of() : List.copyOf(platformMeasurements);
    extraMetadata        = extraMetadata == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(extraMetadata));
  }
}
