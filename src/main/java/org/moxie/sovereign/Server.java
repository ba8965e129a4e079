package org.moxie.sovereign;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

/**
 * Identity server entry point. The attestation pipeline is assembled during CDI startup,
 * so configuration errors surface here, before the port opens.
 */
public class Server {

  private static final Logger log = LoggerFactory.getLogger(Server.class);

  private Server() {}

  public static void main(String[] argv) {
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();

    Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
        log.error("Uncaught exception in thread {}", thread.getName(), throwable));

    io.helidon.microprofile.server.Server server;

    try {
      server = io.helidon.microprofile.server.Server.create().start();
    } catch (RuntimeException e) {
      log.error("Sovereign identity server failed to start", e);
      System.exit(1);
      return;
    }

    Runtime.getRuntime().addShutdownHook(new Thread(() -> log.info("Sovereign identity server on port {} stopping", server.port()),
                                                    "shutdown-logger"));

    log.info("Sovereign identity server listening on {}:{}", server.host(), server.port());
  }
}
