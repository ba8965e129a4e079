package org.moxie.sovereign.nodeattestor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Sends nothing but a marker telling the server that evidence will follow on the
 * out-of-band channel. The node has no settings to validate.
 */
public class UnifiedIdentityNodeAttestor implements NodeAttestor {

  private static final Logger log = LoggerFactory.getLogger(UnifiedIdentityNodeAttestor.class);

  public static final String NAME    = "unified_identity";
  public static final String PAYLOAD = "unified_identity";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void configure(Map<String, String> settings) {
    if (settings != null && !settings.isEmpty()) {
      log.debug("Ignoring {} settings for {}", settings.size(), NAME);
    }
  }

  @Override
  public byte[] attest(AttestationStream stream) throws IOException {
    stream.send(PAYLOAD.getBytes(StandardCharsets.UTF_8));
    return stream.receive();
  }

  public static boolean isMarker(byte[] payload) {
    return payload != null && PAYLOAD.equals(new String(payload, StandardCharsets.UTF_8).trim());
  }
}
