package org.moxie.sovereign.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.moxie.sovereign.attestation.AttestationException;
import org.moxie.sovereign.attestation.AttestationOutcome;
import org.moxie.sovereign.attestation.Challenge;
import org.moxie.sovereign.attestation.EvidenceSubmission;
import org.moxie.sovereign.attestation.TransportException;
import org.moxie.sovereign.evidence.Evidence;
import org.moxie.sovereign.evidence.EvidenceBundle;
import org.moxie.sovereign.evidence.EvidenceBundler;
import org.moxie.sovereign.evidence.EvidenceCollector;
import org.moxie.sovereign.evidence.MeasuredState;
import org.moxie.sovereign.evidence.Ring;
import org.moxie.sovereign.identity.IdentityRequest;
import org.moxie.sovereign.nodeattestor.NodeAttestor;
import org.moxie.sovereign.session.Session;
import org.moxie.sovereign.transport.RpcRequest;
import org.moxie.sovereign.transport.RpcResponse;
import org.moxie.sovereign.transport.RpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Node side of one attestation attempt: trigger, collect, bundle, submit. Every call to
 * {@link #attest(IdentityRequest)} starts from a new challenge.
 */
public class AttestationAgent {

  private static final Logger log = LoggerFactory.getLogger(AttestationAgent.class);

  static final String EVIDENCE_PATH = "/v1/node/evidence";

  private final NodeAttestor             nodeAttestor;
  private final RpcTransport             server;
  private final ObjectMapper             mapper;
  private final EvidenceCollector        collector;
  private final EvidenceBundler          bundler;
  private final Map<Ring, MeasuredState> measuredStates;
  private final Duration                 timeout;
  private final AppKeyCertifier          certifier;

  public AttestationAgent(NodeAttestor nodeAttestor,
                          RpcTransport server,
                          ObjectMapper mapper,
                          EvidenceCollector collector,
                          EvidenceBundler bundler,
                          Map<Ring, MeasuredState> measuredStates,
                          Duration timeout)
  {
    this(nodeAttestor, server, mapper, collector, bundler, measuredStates, timeout, null);
  }

  /**
   * @param certifier Asked for a fresh App Key certificate on every attempt, or null to
   *                  keep the bundler's static certificate
   */
  public AttestationAgent(NodeAttestor nodeAttestor,
                          RpcTransport server,
                          ObjectMapper mapper,
                          EvidenceCollector collector,
                          EvidenceBundler bundler,
                          Map<Ring, MeasuredState> measuredStates,
                          Duration timeout,
                          AppKeyCertifier certifier)
  {
    this.nodeAttestor   = nodeAttestor;
    this.server         = server;
    this.mapper         = mapper;
    this.collector      = collector;
    this.bundler        = bundler;
    this.measuredStates = new EnumMap<>(measuredStates);
    this.timeout        = timeout;
    this.certifier      = certifier;
  }

  /**
   * @return The server's verdict; carries a credential only when identity was issued
   * @throws AttestationException if any step fails before the server reaches a policy verdict
   */
  public AttestationOutcome attest(IdentityRequest identity) throws AttestationException {
    Session session = requestChallenge();

    log.info("Attesting {} rings under session {}", measuredStates.size(), session.sessionId());

    List<Evidence> evidence = new ArrayList<>();

    for (Map.Entry<Ring, MeasuredState> entry : measuredStates.entrySet()) {
      evidence.add(collector.collect(session, entry.getKey(), entry.getValue()));
    }

    EvidenceBundle bundle = certifier == null ? bundler.bundle(evidence)
                                              : bundler.bundle(evidence, certify(session));

    return submit(new EvidenceSubmission(bundle, identity));
  }

  private Session requestChallenge() throws AttestationException {
    byte[] response;

    try {
      response = nodeAttestor.attest(new RpcAttestationStream(server, timeout));
    } catch (IOException e) {
      throw new TransportException("Node attestation via " + nodeAttestor.name() + " failed: " + e.getMessage(), e);
    }

    try {
      return mapper.readValue(response, Challenge.class).toSession();
    } catch (IOException e) {
      throw new AttestationException("Invalid challenge from server", e);
    }
  }

  private byte[] certify(Session session) {
    try {
      return certifier.certify(session.nonceHost());
    } catch (AttestationException e) {
      log.warn("Failed to get App Key certificate, continuing without certificate", e);
      return null;
    }
  }

  private AttestationOutcome submit(EvidenceSubmission submission) throws AttestationException {
    String body;

    try {
      body = mapper.writeValueAsString(submission);
    } catch (JsonProcessingException e) {
      throw new AttestationException("Failed to serialize evidence submission", e);
    }

    RpcResponse response = server.exchange(RpcRequest.postJson(EVIDENCE_PATH, body), timeout);

    if (response.statusCode() != 200 && response.statusCode() != 403) {
      throw new AttestationException("Server returned status " + response.statusCode() + ": " + response.bodyAsString());
    }

    AttestationOutcome outcome;

    try {
      outcome = mapper.readValue(response.body(), AttestationOutcome.class);
    } catch (IOException e) {
      throw new AttestationException("Invalid attestation outcome from server", e);
    }

    if (outcome.isIssued()) {
      log.info("Received identity {} expiring at {}", outcome.credential().subjectId(), outcome.credential().expiresAt());
    } else {
      log.warn("Identity denied: {}", outcome.policy() == null ? "no reason given" : outcome.policy().reason());
    }

    return outcome;
  }
}
