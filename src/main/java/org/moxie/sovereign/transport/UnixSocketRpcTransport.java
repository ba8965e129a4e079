package org.moxie.sovereign.transport;

import org.moxie.sovereign.attestation.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTP/1.1 over a Unix domain socket, the binding used between the agent and the
 * local TPM plugin server. Each exchange opens a fresh connection and sends
 * {@code Connection: close}, so the response body runs to end of stream unless a
 * {@code Content-Length} header says otherwise.
 */
public class UnixSocketRpcTransport implements RpcTransport {

  private static final Logger log = LoggerFactory.getLogger(UnixSocketRpcTransport.class);

  private static final String SCHEME_PREFIX = "unix://";

  private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(runnable -> {
    Thread thread = new Thread(runnable, "uds-transport-watchdog");
    thread.setDaemon(true);
    return thread;
  });

  private final Path socketPath;

  public UnixSocketRpcTransport(Path socketPath) {
    this.socketPath = socketPath;
  }

  /**
   * Build a transport from an endpoint such as {@code unix:///tmp/tpm-plugin.sock}.
   */
  public static UnixSocketRpcTransport fromEndpoint(String endpoint) {
    if (endpoint == null || !endpoint.startsWith(SCHEME_PREFIX)) {
      throw new IllegalArgumentException("Endpoint must use the unix:// scheme: " + endpoint);
    }

    return new UnixSocketRpcTransport(Path.of(endpoint.substring(SCHEME_PREFIX.length())));
  }

  @Override
  public RpcResponse exchange(RpcRequest request, Duration timeout) throws TransportException {
    if (!Files.exists(socketPath)) {
      throw new TransportException("socket " + socketPath + " does not exist (is the plugin server running?)", null);
    }

    AtomicBoolean expired = new AtomicBoolean(false);

    try (SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX)) {
      ScheduledFuture<?> watchdog = WATCHDOG.schedule(() -> {
        expired.set(true);
        closeQuietly(channel);
      }, timeout.toMillis(), TimeUnit.MILLISECONDS);

      try {
        channel.connect(UnixDomainSocketAddress.of(socketPath));

        OutputStream out = Channels.newOutputStream(channel);
        out.write(encodeRequest(request));
        out.flush();

        return decodeResponse(Channels.newInputStream(channel));
      } finally {
        watchdog.cancel(false);
      }
    } catch (AsynchronousCloseException e) {
      if (expired.get()) {
        log.warn("Call over {} to {} timed out after {} ms", socketPath, request.path(), timeout.toMillis());
        throw new TransportException("request to " + request.path() + " timed out", e, true);
      }
      throw new TransportException("request to " + request.path() + " aborted", e);
    } catch (IOException e) {
      throw new TransportException("request over " + socketPath + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public String describe() {
    return SCHEME_PREFIX + socketPath;
  }

  static byte[] encodeRequest(RpcRequest request) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    StringBuilder         head   = new StringBuilder();

    head.append(request.method()).append(' ').append(request.path()).append(" HTTP/1.1\r\n");
    head.append("Host: localhost\r\n");
    head.append("Accept: application/json\r\n");
    head.append("Connection: close\r\n");

    if (request.hasBody()) {
      head.append("Content-Type: ").append(request.contentType()).append("\r\n");
      head.append("Content-Length: ").append(request.body().length).append("\r\n");
    }

    head.append("\r\n");
    buffer.write(head.toString().getBytes(StandardCharsets.US_ASCII));

    if (request.hasBody()) {
      buffer.write(request.body());
    }

    return buffer.toByteArray();
  }

  static RpcResponse decodeResponse(InputStream in) throws IOException {
    String statusLine = readLine(in);

    if (statusLine == null) {
      throw new IOException("Connection closed before status line");
    }

    String[] parts = statusLine.split(" ", 3);

    if (parts.length < 2 || !parts[0].startsWith("HTTP/")) {
      throw new IOException("Malformed status line: " + statusLine);
    }

    int statusCode;

    try {
      statusCode = Integer.parseInt(parts[1]);
    } catch (NumberFormatException e) {
      throw new IOException("Malformed status code: " + statusLine, e);
    }

    int contentLength = -1;
    String line;

    while ((line = readLine(in)) != null && !line.isEmpty()) {
      int colon = line.indexOf(':');
      if (colon <= 0) continue;

      String name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
      if (name.equals("content-length")) {
        contentLength = parseContentLength(line.substring(colon + 1).trim());
      }
    }

    byte[] body = contentLength >= 0 ? in.readNBytes(contentLength) : in.readAllBytes();

    if (contentLength >= 0 && body.length < contentLength) {
      throw new IOException("Truncated response body: expected " + contentLength + " bytes, got " + body.length);
    }

    return new RpcResponse(statusCode, body);
  }

  private static int parseContentLength(String value) throws IOException {
    int length;

    try {
      length = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IOException("Malformed Content-Length: " + value, e);
    }

    if (length < 0) {
      throw new IOException("Negative Content-Length: " + value);
    }

    return length;
  }

  private static String readLine(InputStream in) throws IOException {
    ByteArrayOutputStream line = new ByteArrayOutputStream();
    int b;

    while ((b = in.read()) != -1) {
      if (b == '\n') {
        byte[] raw = line.toByteArray();
        int    len = raw.length > 0 && raw[raw.length - 1] == '\r' ? raw.length - 1 : raw.length;
        return new String(raw, 0, len, StandardCharsets.US_ASCII);
      }
      line.write(b);
    }

    return line.size() == 0 ? null : line.toString(StandardCharsets.US_ASCII);
  }

  private static void closeQuietly(SocketChannel channel) {
    try {
      channel.close();
    } catch (IOException e) {
      log.debug("Failed to close timed out channel", e);
    }
  }
}
