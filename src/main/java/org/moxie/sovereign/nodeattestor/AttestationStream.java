package org.moxie.sovereign.nodeattestor;

import java.io.IOException;

/**
 * The channel a node attestor speaks over to the identity server.
 */
public interface AttestationStream {

  void send(byte[] payload) throws IOException;

  /**
   * Block until the server answers the last payload.
   */
  byte[] receive() throws IOException;
}
