package org.moxie.sovereign.nodeattestor;

import java.io.IOException;
import java.util.Map;

public interface NodeAttestor {

  String name();

  void configure(Map<String, String> settings);

  /**
   * Start attestation of this node over {@code stream}.
   *
   * @return The server's answer to the attestation trigger
   */
  byte[] attest(AttestationStream stream) throws IOException;
}
