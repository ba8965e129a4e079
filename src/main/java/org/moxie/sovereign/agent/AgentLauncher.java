package org.moxie.sovereign.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.moxie.sovereign.attestation.AttestationException;
import org.moxie.sovereign.attestation.AttestationOutcome;
import org.moxie.sovereign.evidence.AppKeyQuoteSource;
import org.moxie.sovereign.evidence.BundleCodec;
import org.moxie.sovereign.evidence.EvidenceBundler;
import org.moxie.sovereign.evidence.EvidenceCollector;
import org.moxie.sovereign.evidence.KeylimeAgentQuoteSource;
import org.moxie.sovereign.evidence.MeasuredState;
import org.moxie.sovereign.evidence.QuoteSource;
import org.moxie.sovereign.evidence.Ring;
import org.moxie.sovereign.identity.IdentityRequest;
import org.moxie.sovereign.nodeattestor.NodeAttestor;
import org.moxie.sovereign.nodeattestor.NodeAttestorRegistry;
import org.moxie.sovereign.nodeattestor.UnifiedIdentityNodeAttestor;
import org.moxie.sovereign.producers.HttpClientProducer;
import org.moxie.sovereign.producers.ObjectMapperProducer;
import org.moxie.sovereign.signing.DelegatedSigner;
import org.moxie.sovereign.signing.TpmPluginSigningGateway;
import org.moxie.sovereign.transport.HttpRpcTransport;
import org.moxie.sovereign.transport.RpcTransport;
import org.moxie.sovereign.transport.UnixSocketRpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Node-side entry point. Wires the TPM plugin, the keylime agent and the identity server
 * from {@code agent.*} configuration and runs a single attestation attempt.
 */
public class AgentLauncher {

  private static final Logger log = LoggerFactory.getLogger(AgentLauncher.class);

  private AgentLauncher() {}

  public static void main(String[] argv) {
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();

    Config          config   = ConfigProvider.getConfig();
    ExecutorService executor = Executors.newCachedThreadPool();
    int             status;

    try {
      AttestationAgent   agent   = create(config, new HttpClientProducer().getClient(), ObjectMapperProducer.create(), executor);
      AttestationOutcome outcome = agent.attest(identityRequest(config));

      status = outcome.isIssued() ? 0 : 1;
    } catch (AttestationException | RuntimeException e) {
      log.error("Attestation failed", e);
      status = 1;
    } finally {
      executor.shutdownNow();
    }

    System.exit(status);
  }

  static AttestationAgent create(Config config, HttpClient httpClient, ObjectMapper mapper, ExecutorService executor)
      throws AttestationException
  {
    Duration     timeout   = Duration.ofSeconds(config.getOptionalValue("agent.timeout.seconds", Long.class).orElse(30L));
    RpcTransport server    = new HttpRpcTransport(httpClient, URI.create(config.getValue("agent.server.url", String.class)));
    RpcTransport tpmPlugin = transportFor(config.getValue("agent.tpm_plugin.endpoint", String.class), httpClient);
    RpcTransport keylime   = new HttpRpcTransport(httpClient, URI.create(config.getValue("agent.keylime.url", String.class)));

    TpmPluginSigningGateway gateway      = new TpmPluginSigningGateway(tpmPlugin, mapper, timeout);
    String                  appKeyPublic = gateway.getAppKeyPublic();
    DelegatedSigner         signer       = new DelegatedSigner(gateway, appKeyPublic, executor, timeout);

    log.info("Using App Key from TPM plugin at {}", tpmPlugin.describe());

    Set<Ring>                rings          = requiredRings(config);
    Map<Ring, QuoteSource>   quoteSources   = new EnumMap<>(Ring.class);
    Map<Ring, MeasuredState> measuredStates = new EnumMap<>(Ring.class);
    QuoteSource              appKeyQuotes   = new AppKeyQuoteSource(signer);

    for (Ring ring : rings) {
      quoteSources.put(ring, ring == Ring.HOST ? new KeylimeAgentQuoteSource(keylime, mapper, timeout) : appKeyQuotes);
      measuredStates.put(ring, measuredState(config, ring));
    }

    NodeAttestor nodeAttestor = NodeAttestorRegistry.withDefaults()
                                                    .create(config.getOptionalValue("agent.node_attestor", String.class)
                                                                  .orElse(UnifiedIdentityNodeAttestor.NAME),
                                                            Map.of());

    return new AttestationAgent(nodeAttestor,
                                server,
                                mapper,
                                new EvidenceCollector(quoteSources),
                                new EvidenceBundler(signer, new BundleCodec(), rings, null),
                                measuredStates,
                                timeout,
                                nonce -> gateway.requestCertificate(appKeyPublic, nonce).certificate());
  }

  static IdentityRequest identityRequest(Config config) {
    return new IdentityRequest(config.getValue("agent.identity.path", String.class),
                               config.getOptionalValue("agent.parent_id", String.class).orElse(null),
                               config.getOptionalValues("agent.selectors", String.class).orElse(List.of()));
  }

  static RpcTransport transportFor(String endpoint, HttpClient httpClient) {
    if (endpoint.startsWith("unix://")) {
      return UnixSocketRpcTransport.fromEndpoint(endpoint);
    }

    return new HttpRpcTransport(httpClient, URI.create(endpoint));
  }

  private static Set<Ring> requiredRings(Config config) {
    Set<Ring> rings = EnumSet.noneOf(Ring.class);

    for (String name : config.getOptionalValues("agent.required_rings", String.class).orElse(List.of("host"))) {
      rings.add(Ring.valueOf(name.trim().toUpperCase(Locale.ROOT)));
    }

    return rings;
  }

  private static MeasuredState measuredState(Config config, Ring ring) {
    String prefix = "agent." + ring.name().toLowerCase(Locale.ROOT) + ".";

    return MeasuredState.of(config.getOptionalValue(prefix + "identity", String.class).orElse(""),
                            config.getOptionalValue(prefix + "log_summary", String.class).orElse(""));
  }
}
