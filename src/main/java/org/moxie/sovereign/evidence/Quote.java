package org.moxie.sovereign.evidence;

import java.util.List;

/**
 * Hardware (or App Key) signed statement over a qualifying value.
 *
 * @param quoteBytes           Opaque quote as produced by the quoting root
 * @param signerPublicKeyId    Identifier of the key that signed the quote
 * @param platformMeasurements Ordered register values reported with the quote
 * @param eventLog             Raw measured boot / IMA log, may be empty
 */
public record Quote(byte[] quoteBytes, String signerPublicKeyId, List<String> platformMeasurements, byte[] eventLog) {

  public Quote {
    platformMeasurements = platformMeasurements == null ? List.of() : List.copyOf(platformMeasurements);
    eventLog             = eventLog == null ? new byte[0] : eventLog;
  }
}
