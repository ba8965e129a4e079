package org.moxie.sovereign.evidence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.moxie.sovereign.attestation.AttestationException;
import org.moxie.sovereign.transport.RpcRequest;
import org.moxie.sovereign.transport.RpcResponse;
import org.moxie.sovereign.transport.RpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Identity quotes from a keylime agent running next to the TPM (physical for the host
 * ring, virtual for the VM ring).
 */
public class KeylimeAgentQuoteSource implements QuoteSource {

  private static final Logger log = LoggerFactory.getLogger(KeylimeAgentQuoteSource.class);

  static final int    MAX_NONCE_BYTES = 32;
  static final String QUOTE_PATH      = "/v2.2/quotes/identity";

  private final RpcTransport transport;
  private final ObjectMapper mapper;
  private final Duration     timeout;

  public KeylimeAgentQuoteSource(RpcTransport transport, ObjectMapper mapper, Duration timeout) {
    this.transport = transport;
    this.mapper    = mapper;
    this.timeout   = timeout;
  }

  @Override
  public Quote quote(Ring ring, byte[] qualifyingData) throws AttestationException {
    if (qualifyingData.length > MAX_NONCE_BYTES) {
      throw new AttestationException("Qualifying data of " + qualifyingData.length + " bytes exceeds TPM nonce size");
    }

    String      nonce    = HexFormat.of().formatHex(qualifyingData);
    RpcResponse response = transport.exchange(RpcRequest.get(QUOTE_PATH + "?nonce=" + nonce), timeout);

    if (!response.isSuccess()) {
      throw new AttestationException("Keylime agent quote for " + ring + " failed with status " + response.statusCode() + ": " + response.bodyAsString());
    }

    JsonNode results;

    try {
      results = mapper.readTree(response.body()).path("results");
    } catch (IOException e) {
      throw new AttestationException("Failed to parse keylime agent quote response", e);
    }

    String quote = results.path("quote").asText("");

    if (quote.isEmpty()) {
      throw new AttestationException("Keylime agent returned an empty quote for " + ring);
    }

    List<String> measurements = new ArrayList<>();
    for (JsonNode pcr : results.path("pcrs")) {
      measurements.add(pcr.asText());
    }

    log.info("Obtained {} quote from {}", ring, transport.describe());

    return new Quote(quote.getBytes(StandardCharsets.UTF_8),
                     results.path("pubkey").asText(null),
                     measurements,
                     results.path("ima_measurement_list").asText("").getBytes(StandardCharsets.UTF_8));
  }
}
