package org.moxie.sovereign.agent;

import org.moxie.sovereign.attestation.TransportException;
import org.moxie.sovereign.nodeattestor.AttestationStream;
import org.moxie.sovereign.transport.RpcRequest;
import org.moxie.sovereign.transport.RpcResponse;
import org.moxie.sovereign.transport.RpcTransport;

import java.io.IOException;
import java.time.Duration;

/**
 * Carries node attestor payloads to the server's attest endpoint, one request per
 * payload.
 */
public class RpcAttestationStream implements AttestationStream {

  static final String ATTEST_PATH = "/v1/node/attest";

  private final RpcTransport transport;
  private final Duration     timeout;

  private byte[] pending;

  public RpcAttestationStream(RpcTransport transport, Duration timeout) {
    this.transport = transport;
    this.timeout   = timeout;
  }

  @Override
  public void send(byte[] payload) {
    this.pending = payload;
  }

  @Override
  public byte[] receive() throws IOException {
    if (pending == null) {
      throw new IllegalStateException("Nothing sent");
    }

    RpcResponse response;

    try {
      response = transport.exchange(RpcRequest.post(ATTEST_PATH, pending, "text/plain"), timeout);
    } catch (TransportException e) {
      throw new IOException("Attestation trigger failed: " + e.getMessage(), e);
    } finally {
      pending = null;
    }

    if (!response.isSuccess()) {
      throw new IOException("Server returned status " + response.statusCode() + " to attestation trigger: " + response.bodyAsString());
    }

    return response.body();
  }
}
