package org.moxie.sovereign.transport;

import java.nio.charset.StandardCharsets;

/**
 * A single logical call, independent of the binding that carries it.
 */
public record RpcRequest(String method, String path, byte[] body, String contentType) {

  public static RpcRequest get(String path) {
    return new RpcRequest("GET", path, null, null);
  }

  public static RpcRequest postJson(String path, String json) {
    return new RpcRequest("POST", path, json.getBytes(StandardCharsets.UTF_8), "application/json");
  }

  public static RpcRequest post(String path, byte[] body, String contentType) {
    return new RpcRequest("POST", path, body, contentType);
  }

  public boolean hasBody() {
    return body != null;
  }
}
