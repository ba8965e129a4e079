package org.moxie.sovereign.transport;

import java.nio.charset.StandardCharsets;

public record RpcResponse(int statusCode, byte[] body) {

  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }

  public String bodyAsString() {
    return body == null ? "" : new String(body, StandardCharsets.UTF_8);
  }
}
