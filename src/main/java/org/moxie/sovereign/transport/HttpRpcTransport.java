package org.moxie.sovereign.transport;

import org.moxie.sovereign.attestation.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP(S) binding on top of the JDK {@link HttpClient}. Mutual TLS, when used, is
 * configured on the client's SSL context by whoever builds it.
 */
public class HttpRpcTransport implements RpcTransport {

  private static final Logger log = LoggerFactory.getLogger(HttpRpcTransport.class);

  private final HttpClient httpClient;
  private final URI        baseUri;

  public HttpRpcTransport(HttpClient httpClient, URI baseUri) {
    this.httpClient = httpClient;
    this.baseUri    = baseUri;
  }

  @Override
  public RpcResponse exchange(RpcRequest request, Duration timeout) throws TransportException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(resolve(request.path()))
                                             .timeout(timeout)
                                             .header("Accept", "application/json");

    if (request.hasBody()) {
      builder.method(request.method(), HttpRequest.BodyPublishers.ofByteArray(request.body()));
      builder.header("Content-Type", request.contentType());
    } else {
      builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
    }

    CompletableFuture<HttpResponse<byte[]>> pending = httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofByteArray());

    try {
      HttpResponse<byte[]> response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return new RpcResponse(response.statusCode(), response.body());
    } catch (TimeoutException e) {
      pending.cancel(true);
      log.warn("Call to {}{} timed out after {} ms", baseUri, request.path(), timeout.toMillis());
      throw new TransportException("request to " + request.path() + " timed out", e, true);
    } catch (InterruptedException e) {
      pending.cancel(true);
      Thread.currentThread().interrupt();
      throw new TransportException("request to " + request.path() + " interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;

      if (cause instanceof HttpTimeoutException) {
        throw new TransportException("request to " + request.path() + " timed out", cause, true);
      }

      throw new TransportException("request to " + request.path() + " failed: " + cause.getMessage(), cause);
    }
  }

  @Override
  public String describe() {
    return baseUri.toString();
  }

  private URI resolve(String path) {
    String base = baseUri.toString();

    if (base.endsWith("/") && path.startsWith("/")) {
      return URI.create(base + path.substring(1));
    }

    return URI.create(base + path);
  }
}
