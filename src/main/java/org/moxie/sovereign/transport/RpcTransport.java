package org.moxie.sovereign.transport;

import org.moxie.sovereign.attestation.TransportException;

import java.time.Duration;

/**
 * One logical request/response exchange. The protocol classes above this interface
 * never know whether the bytes travel over TCP, a Unix domain socket or anything else;
 * only the binding changes per ring boundary.
 */
public interface RpcTransport {

  /**
   * Perform the exchange, giving up once {@code timeout} elapses. On timeout or thread
   * interruption the outstanding call is abandoned and no remote side effect may be
   * assumed.
   *
   * @param request Request to send
   * @param timeout Budget for the whole exchange
   * @return The remote response, whatever its status code
   * @throws TransportException on connection failure, timeout or interruption
   */
  RpcResponse exchange(RpcRequest request, Duration timeout) throws TransportException;

  /**
   * Human readable endpoint description, used in log lines.
   */
  String describe();
}
