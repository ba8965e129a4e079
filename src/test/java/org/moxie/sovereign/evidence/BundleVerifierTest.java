package org.moxie.sovereign.evidence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.moxie.sovereign.producers.ObjectMapperProducer;
import org.moxie.sovereign.session.Session;
import org.moxie.sovereign.session.SessionManager;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BundleVerifierTest {

  private SessionManager sessions;
  private Session        session;
  private BundleVerifier verifier;

  @BeforeEach
  void setUp() {
    sessions = new SessionManager(Duration.ofMinutes(5));
    session  = sessions.issueChallenge();
    verifier = new BundleVerifier(new BundleCodec(), EnumSet.of(Ring.HOST, Ring.VM));
  }

  private EvidenceBundle bundle(Session session, Ring... rings) throws Exception {
    return EvidenceFixtures.bundler(EnumSet.noneOf(Ring.class)).bundle(EvidenceFixtures.collect(session, rings));
  }

  @Test
  void verify_validBundle_passes() throws Exception {
    assertDoesNotThrow(() -> verifier.verify(bundle(session, Ring.HOST, Ring.VM, Ring.WORKLOAD), session));
  }

  @Test
  void verify_afterJsonRoundTrip_stillPasses() throws Exception {
    ObjectMapper   mapper   = ObjectMapperProducer.create();
    EvidenceBundle original = bundle(session, Ring.HOST, Ring.VM, Ring.WORKLOAD);
    EvidenceBundle received = mapper.readValue(mapper.writeValueAsString(original), EvidenceBundle.class);

    assertDoesNotThrow(() -> verifier.verify(received, session));
  }

  @Test
  void verify_otherSession_isSessionMismatch() throws Exception {
    EvidenceBundle bundle = bundle(session, Ring.HOST, Ring.VM);

    BundleException e = assertThrows(BundleException.class, () -> verifier.verify(bundle, sessions.issueChallenge()));

    assertEquals(BundleException.Kind.SESSION_MISMATCH, e.getKind());
  }

  @Test
  void verify_missingRequiredRing_isIncomplete() throws Exception {
    EvidenceBundle bundle = bundle(session, Ring.HOST);

    BundleException e = assertThrows(BundleException.class, () -> verifier.verify(bundle, session));

    assertEquals(BundleException.Kind.INCOMPLETE_BUNDLE, e.getKind());
  }

  @Test
  void verify_tamperedQuote_failsSignature() throws Exception {
    EvidenceBundle bundle   = bundle(session, Ring.HOST, Ring.VM);
    List<Evidence> tampered = new ArrayList<>(bundle.evidence());
    Evidence       host     = tampered.get(0);

    tampered.set(0, new Evidence(host.ring(), host.sessionId(), host.nonce(), "forged".getBytes(StandardCharsets.UTF_8),
                                 host.signerPublicKeyId(), host.platformMeasurements(), host.eventLog(),
                                 host.claimsDigest(), host.bindingHash(), host.extraMetadata()));

    EvidenceBundle forged = new EvidenceBundle(bundle.sessionId(), tampered, bundle.aggregatorPublicKey(),
                                               bundle.aggregatorCertificate(), bundle.signature());

    BundleException e = assertThrows(BundleException.class, () -> verifier.verify(forged, session));

    assertEquals(BundleException.Kind.BAD_SIGNATURE, e.getKind());
  }

  @Test
  void verify_wrongNonce_isBindingMismatch() throws Exception {
    Evidence host  = EvidenceFixtures.collect(session, Ring.HOST).get(0);
    Evidence stale = new Evidence(host.ring(), host.sessionId(), "00".repeat(32), host.quoteBytes(),
                                  host.signerPublicKeyId(), host.platformMeasurements(), host.eventLog(),
                                  host.claimsDigest(), host.bindingHash(), host.extraMetadata());

    List<Evidence> evidence = new ArrayList<>(List.of(stale));
    evidence.addAll(EvidenceFixtures.collect(session, Ring.VM));

    EvidenceBundle bundle = EvidenceFixtures.bundler(EnumSet.noneOf(Ring.class)).bundle(evidence);

    BundleException e = assertThrows(BundleException.class, () -> verifier.verify(bundle, session));

    assertEquals(BundleException.Kind.BINDING_MISMATCH, e.getKind());
  }

  @Test
  void verify_alteredClaimsDigest_isBindingMismatch() throws Exception {
    Evidence host    = EvidenceFixtures.collect(session, Ring.HOST).get(0);
    Evidence altered = new Evidence(host.ring(), host.sessionId(), host.nonce(), host.quoteBytes(),
                                    host.signerPublicKeyId(), host.platformMeasurements(), host.eventLog(),
                                    new byte[32], host.bindingHash(), host.extraMetadata());

    List<Evidence> evidence = new ArrayList<>(List.of(altered));
    evidence.addAll(EvidenceFixtures.collect(session, Ring.VM));

    EvidenceBundle bundle = EvidenceFixtures.bundler(EnumSet.noneOf(Ring.class)).bundle(evidence);

    BundleException e = assertThrows(BundleException.class, () -> verifier.verify(bundle, session));

    assertEquals(BundleException.Kind.BINDING_MISMATCH, e.getKind());
  }

  @Test
  void verify_unsignedBundle_isRejected() throws Exception {
    EvidenceBundle bundle   = bundle(session, Ring.HOST, Ring.VM);
    EvidenceBundle unsigned = new EvidenceBundle(bundle.sessionId(), bundle.evidence(), bundle.aggregatorPublicKey(),
                                                 bundle.aggregatorCertificate(), null);

    assertEquals(BundleException.Kind.BAD_SIGNATURE,
                 assertThrows(BundleException.class, () -> verifier.verify(unsigned, session)).getKind());
  }
}
